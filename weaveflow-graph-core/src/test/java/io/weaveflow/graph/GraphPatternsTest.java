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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.weaveflow.graph.action.AsyncNodeAction;
import io.weaveflow.graph.exception.GraphIterationLimitException;
import io.weaveflow.graph.state.MapState;
import org.junit.jupiter.api.Test;

import static io.weaveflow.graph.action.AsyncNodeAction.node_async;
import static org.junit.jupiter.api.Assertions.*;

class GraphPatternsTest {

	private static int v(MapState state) {
		return state.value("v", 0);
	}

	@Test
	void linearChainsNodesInMapOrder() throws Exception {
		Map<String, AsyncNodeAction<MapState>> nodes = new LinkedHashMap<>();
		nodes.put("add", node_async(state -> state.with("v", v(state) + 2)));
		nodes.put("triple", node_async(state -> state.with("v", v(state) * 3)));
		nodes.put("dec", node_async(state -> state.with("v", v(state) - 1)));

		GraphResult<MapState> result = GraphPatterns.linear(nodes).compile().invoke(MapState.of("v", 1));

		assertEquals(List.of("add", "triple", "dec"), result.path());
		assertEquals(8, v(result.state()));
	}

	@Test
	void linearRequiresAtLeastOneNode() {
		assertThrows(IllegalArgumentException.class, () -> GraphPatterns.linear(Map.of()));
	}

	@Test
	void loopRepeatsWhileTheConditionHolds() throws Exception {
		Map<String, AsyncNodeAction<MapState>> nodes = new LinkedHashMap<>();
		nodes.put("inc", node_async(state -> state.with("v", v(state) + 1)));
		nodes.put("log", node_async(state -> state.with("logged", state.value("logged", 0) + 1)));

		GraphResult<MapState> result = GraphPatterns.loop("inc", nodes, state -> v(state) < 3)
			.compile()
			.invoke(MapState.of("v", 0));

		assertEquals(3, v(result.state()));
		assertEquals(3, result.state().value("logged", 0).intValue());
		assertEquals(List.of("inc", "log", "inc", "log", "inc", "log"), result.path());
	}

	@Test
	void endlessLoopIsBoundedByTheRecursionLimit() throws Exception {
		Map<String, AsyncNodeAction<MapState>> nodes = Map.of("spin", node_async(state -> state));

		StateGraph<MapState> graph = GraphPatterns.loop("spin", nodes, state -> true);

		assertThrows(GraphIterationLimitException.class,
				() -> graph.compile(CompileConfig.builder().recursionLimit(5).build()).invoke(MapState.of()));
	}

	@Test
	void mapReduceFansOutAndJoinsIntoTheReducer() throws Exception {
		Map<String, AsyncNodeAction<MapState>> mappers = new LinkedHashMap<>();
		mappers.put("double", node_async(state -> state.with("double", v(state) * 2)));
		mappers.put("square", node_async(state -> state.with("square", v(state) * v(state))));

		GraphResult<MapState> result = GraphPatterns
			.mapReduce("split", node_async(state -> state), mappers, MapState.overlayMerger(), "reduce",
					node_async(state -> state.with("sum", state.value("double", 0) + state.value("square", 0))))
			.compile()
			.invoke(MapState.of("v", 4));

		// 8 + 16
		assertEquals(24, result.state().value("sum", 0).intValue());
		assertEquals(List.of("split", "reduce"), result.path());
	}

	@Test
	void patternsCanBeExtendedBeforeCompiling() throws Exception {
		Map<String, AsyncNodeAction<MapState>> nodes = new LinkedHashMap<>();
		nodes.put("first", node_async(state -> state.with("first", true)));

		StateGraph<MapState> graph = GraphPatterns.linear(nodes);
		graph.addNode("unused", node_async(state -> state));

		assertEquals(2, graph.nodes().size());
		assertEquals("first", graph.getEntryPoint().orElseThrow());
	}

}
