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
package io.weaveflow.graph.internal.node;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

import io.weaveflow.graph.action.StateMerger;
import io.weaveflow.graph.exception.GraphRunnerException;
import io.weaveflow.graph.exception.RunnableErrors;
import org.springframework.lang.Nullable;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Synthetic node executing the targets of a parallel edge concurrently and merging their
 * results.
 *
 * @param <S> the state type
 */
public class ParallelNode<S> extends Node<S> {

	public static final String PARALLEL_PREFIX = "__PARALLEL__";

	/**
	 * Runs one branch of the fan-out.
	 */
	@FunctionalInterface
	public interface BranchExecutor<S> {

		S execute(Node<S> target, S state);

	}

	private final String sourceId;

	private final List<Node<S>> targets;

	private final StateMerger<S> merger;

	// 格式化并行节点ID，添加前缀以标识为并行节点
	public static String formatNodeId(String nodeId) {
		return format("%s(%s)", PARALLEL_PREFIX, requireNonNull(nodeId, "nodeId cannot be null!"));
	}

	public ParallelNode(String sourceId, List<Node<S>> targets, @Nullable StateMerger<S> merger) {
		super(formatNodeId(sourceId), format("parallel fan-out from %s", sourceId), null);
		this.sourceId = sourceId;
		this.targets = List.copyOf(targets);
		this.merger = merger;
	}

	public String sourceId() {
		return sourceId;
	}

	public List<Node<S>> targets() {
		return targets;
	}

	public List<String> targetIds() {
		return targets.stream().map(Node::id).toList();
	}

	@Override
	public boolean isParallel() {
		return true;
	}

	/**
	 * Runs every target on {@code executor}, each against its own view of {@code state},
	 * waits for all of them and merges the results. When a branch fails, the failure of
	 * the first failing branch in declared order is thrown and nothing is merged.
	 */
	public S apply(S state, BranchExecutor<S> branchExecutor, Executor executor, UnaryOperator<S> stateCloner) {
		List<CompletableFuture<S>> futures = new ArrayList<>(targets.size());
		for (Node<S> target : targets) {
			S view = stateCloner.apply(state);
			futures.add(CompletableFuture.supplyAsync(() -> branchExecutor.execute(target, view), executor));
		}

		// 等待所有分支完成（包括失败的分支）
		CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).exceptionally(e -> null).join();

		List<S> results = new ArrayList<>(futures.size());
		for (int i = 0; i < futures.size(); i++) {
			try {
				results.add(futures.get(i).join());
			}
			catch (CompletionException e) {
				throw branchFailure(targets.get(i).id(), e.getCause() != null ? e.getCause() : e);
			}
		}
		return merge(state, results);
	}

	/**
	 * Without a merger the result of the last declared target wins.
	 */
	S merge(S original, List<S> results) {
		if (merger == null) {
			return results.get(results.size() - 1);
		}
		try {
			return merger.merge(original, results);
		}
		catch (Exception e) {
			throw RunnableErrors.mergeError.exception(e, sourceId, e.getMessage());
		}
	}

	private static GraphRunnerException branchFailure(String targetId, Throwable cause) {
		if (cause instanceof GraphRunnerException graphRunnerException) {
			return graphRunnerException;
		}
		if (cause instanceof Error error) {
			throw error;
		}
		return RunnableErrors.nodeExecutionError.exception(cause, targetId, cause.getMessage());
	}

}
