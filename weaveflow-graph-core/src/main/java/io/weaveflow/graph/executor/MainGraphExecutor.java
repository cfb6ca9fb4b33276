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
package io.weaveflow.graph.executor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import io.weaveflow.graph.CompiledGraph;
import io.weaveflow.graph.GraphResult;
import io.weaveflow.graph.GraphRunnerContext;
import io.weaveflow.graph.exception.GraphIterationLimitException;
import io.weaveflow.graph.exception.GraphRunnerException;
import io.weaveflow.graph.exception.RunnableErrors;
import io.weaveflow.graph.internal.edge.Edge;
import io.weaveflow.graph.internal.node.Node;
import io.weaveflow.graph.internal.node.ParallelNode;
import io.weaveflow.graph.streaming.Channels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.weaveflow.graph.StateGraph.END;
import static io.weaveflow.graph.StateGraph.START;

/**
 * Drives a run from the entry point until the end node is reached.
 * <p>
 * The traversal is a lookup of the current node id in the compiled node table followed
 * by edge resolution; nodes may be revisited any number of times. Every node execution
 * consumes one iteration; fanned-out targets do not, except a fan-out chained directly
 * after another. Reaching the recursion limit before the end node aborts the run with
 * {@link GraphIterationLimitException}.
 */
public class MainGraphExecutor<S> {

	private static final Logger log = LoggerFactory.getLogger(MainGraphExecutor.class);

	private final CompiledGraph<S> compiledGraph;

	private final NodeExecutor<S> nodeExecutor;

	public MainGraphExecutor(CompiledGraph<S> compiledGraph) {
		this.compiledGraph = compiledGraph;
		this.nodeExecutor = new NodeExecutor<>();
	}

	public GraphResult<S> execute(GraphRunnerContext<S> context) {
		context.setCurrentNodeId(compiledGraph.getEntryPoint());
		context.emit(START);

		while (!context.isEndNode()) {
			checkIterationLimit(context);
			String nodeId = context.getCurrentNodeId();
			Node<S> node = compiledGraph.getNode(nodeId).orElseThrow(() -> RunnableErrors.missingNode.exception(nodeId));

			context.nextIteration();
			context.addToPath(nodeId);
			context.setState(nodeExecutor.execute(node, context.getState(), context));
			context.emit(nodeId);

			context.setCurrentNodeId(nextNodeId(nodeId, context));
		}

		context.emit(END);
		log.debug("graph run completed after {} iteration(s), path {}", context.getIteration(), context.getPath());
		return context.toResult();
	}

	private String nextNodeId(String nodeId, GraphRunnerContext<S> context) {
		Edge<S> edge = compiledGraph.getEdge(nodeId).orElse(null);
		if (edge == null) {
			return END;
		}
		if (!edge.isParallel()) {
			return route(edge, context);
		}
		while (true) {
			ParallelNode<S> parallelNode = compiledGraph.getParallelNode(edge.sourceId());
			fanOut(parallelNode, context);

			// 从第一个能继续执行的并行目标节点的出边继续
			Edge<S> nextFanOut = null;
			for (String targetId : parallelNode.targetIds()) {
				Edge<S> continuation = compiledGraph.getEdge(targetId).orElse(null);
				if (continuation == null) {
					continue;
				}
				if (continuation.isParallel()) {
					nextFanOut = continuation;
					break;
				}
				String next = route(continuation, context);
				if (!Objects.equals(next, END)) {
					return next;
				}
			}
			if (nextFanOut == null) {
				return END;
			}
			// 连续扇出各占一次迭代
			checkIterationLimit(context);
			context.nextIteration();
			edge = nextFanOut;
		}
	}

	private void fanOut(ParallelNode<S> parallelNode, GraphRunnerContext<S> context) {
		log.debug("fanning out from '{}' to {}", parallelNode.sourceId(), parallelNode.targetIds());
		S merged = parallelNode.apply(context.getState(),
				(target, view) -> nodeExecutor.execute(target, view, context), executorFor(parallelNode, context),
				compiledGraph.getStateCloner());
		context.setState(merged);
		context.emit(parallelNode.id());
	}

	private String route(Edge<S> edge, GraphRunnerContext<S> context) {
		List<String> targets;
		try {
			targets = edge.resolve(context.getState());
		}
		catch (GraphRunnerException e) {
			throw e;
		}
		catch (Exception e) {
			Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
			throw RunnableErrors.routingError.exception(cause, edge.sourceId(), cause.getMessage());
		}
		String next = targets.isEmpty() ? END : targets.get(0);
		if (!Objects.equals(next, END) && compiledGraph.getNode(next).isEmpty()) {
			throw RunnableErrors.missingRoute.exception(edge.sourceId(), next);
		}
		log.debug("edge from '{}' resolved to '{}'", edge.sourceId(), next);
		return next;
	}

	private Executor executorFor(ParallelNode<S> parallelNode, GraphRunnerContext<S> context) {
		// 优先使用配置元数据中为该节点指定的执行器
		return context.getConfig()
			.metadata(parallelNode.sourceId())
			.filter(value -> value instanceof Executor)
			.map(Executor.class::cast)
			.or(() -> context.getConfig().executor())
			.or(() -> compiledGraph.compileConfig.executor())
			.orElseGet(Channels::defaultExecutor);
	}

	private void checkIterationLimit(GraphRunnerContext<S> context) {
		if (context.isMaxIterationsReached()) {
			throw new GraphIterationLimitException(compiledGraph.getMaxIterations(), context.getPath());
		}
	}

}
