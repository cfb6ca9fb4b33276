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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import io.weaveflow.graph.callback.CallbackManager;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.compose.ExecutionUnit;
import io.weaveflow.graph.compose.Lambda;
import io.weaveflow.graph.exception.GraphStateException;
import io.weaveflow.graph.exception.RunnableErrors;
import io.weaveflow.graph.executor.MainGraphExecutor;
import io.weaveflow.graph.internal.edge.Edge;
import io.weaveflow.graph.internal.edge.ParallelEdge;
import io.weaveflow.graph.internal.node.Node;
import io.weaveflow.graph.internal.node.ParallelNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import static java.util.Objects.requireNonNull;

/**
 * Executable form of a validated {@link StateGraph}. Thread-safe: every run keeps its own
 * {@link GraphRunnerContext}.
 *
 * @param <S> the state type
 */
public class CompiledGraph<S> {

	public static final String GRAPH_TYPE = "StateGraph";

	private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

	public final StateGraph<S> stateGraph;

	public final CompileConfig compileConfig;

	private final Map<String, Node<S>> nodes;

	private final Map<String, Edge<S>> edges;

	private final Map<String, ParallelNode<S>> parallelNodes = new LinkedHashMap<>();

	private final String entryPoint;

	private final UnaryOperator<S> stateCloner;

	private final int maxIterations;

	private final MainGraphExecutor<S> mainGraphExecutor;

	protected CompiledGraph(StateGraph<S> stateGraph, CompileConfig compileConfig) throws GraphStateException {
		stateGraph.validateGraph();
		this.stateGraph = stateGraph;
		this.compileConfig = compileConfig;
		this.maxIterations = compileConfig.recursionLimit();
		this.entryPoint = stateGraph.getEntryPoint().orElseThrow();
		this.stateCloner = stateGraph.getStateCloner();
		this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(stateGraph.nodes.elements));
		this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(stateGraph.edges.elements));

		// 为每条并行边创建并行节点
		for (Edge<S> edge : edges.values()) {
			if (edge instanceof ParallelEdge<S> parallelEdge) {
				var targets = parallelEdge.targets().stream().map(nodes::get).toList();
				parallelNodes.put(parallelEdge.sourceId(),
						new ParallelNode<>(parallelEdge.sourceId(), targets, parallelEdge.merger()));
			}
		}
		this.mainGraphExecutor = new MainGraphExecutor<>(this);
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	public String getEntryPoint() {
		return entryPoint;
	}

	public UnaryOperator<S> getStateCloner() {
		return stateCloner;
	}

	public Optional<Node<S>> getNode(String id) {
		return Optional.ofNullable(nodes.get(id));
	}

	public Optional<Edge<S>> getEdge(String sourceId) {
		return Optional.ofNullable(edges.get(sourceId));
	}

	public ParallelNode<S> getParallelNode(String sourceId) {
		ParallelNode<S> parallelNode = parallelNodes.get(sourceId);
		if (parallelNode == null) {
			throw RunnableErrors.missingNode.exception(ParallelNode.formatNodeId(sourceId));
		}
		return parallelNode;
	}

	public GraphResult<S> invoke(S initialState) {
		return invoke(initialState, RunnableConfig.empty());
	}

	/**
	 * Runs the graph to completion on the calling thread (parallel branches run on the
	 * configured executor).
	 * @throws io.weaveflow.graph.exception.GraphRunnerException if a node, a router or a
	 * merger fails, or the recursion limit is reached
	 */
	public GraphResult<S> invoke(S initialState, RunnableConfig config) {
		return run(initialState, config, output -> {
		});
	}

	public Flux<NodeOutput<S>> stream(S initialState) {
		return stream(initialState, RunnableConfig.empty());
	}

	/**
	 * Runs the graph on a bounded-elastic worker, emitting the START output, one output
	 * per executed node or parallel fan-out, then the END output. A failing run
	 * terminates the Flux with the error. Cancelling the subscription stops the run at
	 * the next emitted output; the step in flight finishes first.
	 */
	public Flux<NodeOutput<S>> stream(S initialState, RunnableConfig config) {
		return Flux.<NodeOutput<S>>create(sink -> {
			try {
				run(initialState, config, output -> {
					if (sink.isCancelled()) {
						throw new CancellationException("stream of '" + stateGraph.getName() + "' was cancelled");
					}
					sink.next(output);
				});
				sink.complete();
			}
			catch (CancellationException e) {
				log.debug("stopped run of '{}' after the subscriber cancelled", stateGraph.getName());
			}
			catch (RuntimeException e) {
				sink.error(e);
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Exposes this graph as an execution unit. Only invoke is native: stream yields the
	 * final result, collect runs on the first input, transform runs once per input.
	 */
	public ExecutionUnit<S, GraphResult<S>> toUnit() {
		return Lambda.<S, GraphResult<S>>builder().name(stateGraph.getName()).invoke(this::invoke).build();
	}

	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title) {
		return stateGraph.getGraph(type, title);
	}

	RunInfo runInfo() {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("entry_point", entryPoint);
		metadata.put("node_count", nodes.size());
		metadata.put("edge_count", edges.size());
		return new RunInfo(stateGraph.getName(), GRAPH_TYPE, ComponentType.GRAPH, metadata);
	}

	private GraphResult<S> run(S initialState, RunnableConfig config, Consumer<NodeOutput<S>> listener) {
		requireNonNull(initialState, "initialState cannot be null");
		requireNonNull(config, "config cannot be null");
		CallbackManager callbacks = config.callbackManager().orElse(null);
		if (callbacks == null) {
			return mainGraphExecutor.execute(new GraphRunnerContext<>(this, initialState, config, listener));
		}
		try {
			return callbacks.runWithCallbacks(config.context(), runInfo(), initialState, ctx -> mainGraphExecutor
				.execute(new GraphRunnerContext<>(this, initialState, config.withContext(ctx), listener)));
		}
		catch (RuntimeException e) {
			throw e;
		}
		catch (Exception e) {
			throw RunnableErrors.executionError.exception(e, e.getMessage());
		}
	}

}
