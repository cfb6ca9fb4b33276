/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.weaveflow.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import io.weaveflow.graph.action.AsyncNodeAction;
import io.weaveflow.graph.action.StateMerger;
import io.weaveflow.graph.exception.GraphStateException;
import org.springframework.lang.Nullable;

import static io.weaveflow.graph.StateGraph.END;

/**
 * Prebuilt topologies. Each method returns an uncompiled {@link StateGraph} with its
 * entry point set, so callers may still add nodes and edges before compiling.
 */
public final class GraphPatterns {

	private GraphPatterns() {
	}

	/**
	 * {@code n1 -> n2 -> ... -> END}, in the iteration order of {@code nodes}.
	 */
	public static <S> StateGraph<S> linear(Map<String, AsyncNodeAction<S>> nodes) throws GraphStateException {
		StateGraph<S> graph = new StateGraph<>();
		List<String> ids = chain(graph, nodes);
		graph.addEdge(ids.get(ids.size() - 1), END);
		return graph.setEntryPoint(ids.get(0));
	}

	/**
	 * Chains {@code nodes} and, after the last one, returns to {@code entryNode} while
	 * {@code shouldContinue} holds, otherwise ends. The recursion limit bounds the loop.
	 */
	public static <S> StateGraph<S> loop(String entryNode, Map<String, AsyncNodeAction<S>> nodes,
			Predicate<S> shouldContinue) throws GraphStateException {
		StateGraph<S> graph = new StateGraph<>();
		List<String> ids = chain(graph, nodes);
		Map<String, Predicate<S>> routes = new LinkedHashMap<>();
		routes.put(entryNode, shouldContinue);
		graph.addConditionalRouter(ids.get(ids.size() - 1), routes, END);
		return graph.setEntryPoint(entryNode);
	}

	/**
	 * {@code split} fans out to every mapper, {@code merger} combines their results (the
	 * last mapper's result when null), and every mapper continues into {@code reduce}.
	 */
	public static <S> StateGraph<S> mapReduce(String splitNode, AsyncNodeAction<S> split,
			Map<String, AsyncNodeAction<S>> mappers, @Nullable StateMerger<S> merger, String reduceNode,
			AsyncNodeAction<S> reduce) throws GraphStateException {
		StateGraph<S> graph = new StateGraph<>();
		graph.addNode(splitNode, split);
		for (Map.Entry<String, AsyncNodeAction<S>> mapper : mappers.entrySet()) {
			graph.addNode(mapper.getKey(), mapper.getValue());
		}
		graph.addNode(reduceNode, reduce);
		graph.addParallelEdge(splitNode, new ArrayList<>(mappers.keySet()), merger);
		for (String mapperId : mappers.keySet()) {
			graph.addEdge(mapperId, reduceNode);
		}
		graph.addEdge(reduceNode, END);
		return graph.setEntryPoint(splitNode);
	}

	private static <S> List<String> chain(StateGraph<S> graph, Map<String, AsyncNodeAction<S>> nodes)
			throws GraphStateException {
		if (nodes.isEmpty()) {
			throw new IllegalArgumentException("at least one node is required");
		}
		List<String> ids = new ArrayList<>(nodes.keySet());
		for (Map.Entry<String, AsyncNodeAction<S>> node : nodes.entrySet()) {
			graph.addNode(node.getKey(), node.getValue());
		}
		for (int i = 0; i < ids.size() - 1; i++) {
			graph.addEdge(ids.get(i), ids.get(i + 1));
		}
		return ids;
	}

}
