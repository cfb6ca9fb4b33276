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
package io.weaveflow.graph.action;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Represents an asynchronous node action that transforms the graph state.
 */
@FunctionalInterface
public interface AsyncNodeAction<S> extends Function<S, CompletableFuture<S>> {

	/**
	 * Applies this action to the given state.
	 * @param state the current state
	 * @return a CompletableFuture completing with the new state
	 */
	CompletableFuture<S> apply(S state);

	/**
	 * Creates an asynchronous node action from a synchronous node action.
	 * @param syncAction the synchronous node action
	 * @return an asynchronous node action
	 */
	// 将同步节点动作转换为异步节点动作
	static <S> AsyncNodeAction<S> node_async(NodeAction<S> syncAction) {
		requireNonNull(syncAction, "syncAction cannot be null");
		return state -> {
			CompletableFuture<S> result = new CompletableFuture<>();
			try {
				result.complete(syncAction.apply(state));
			}
			catch (Exception e) {
				result.completeExceptionally(e);
			}
			return result;
		};
	}

}
