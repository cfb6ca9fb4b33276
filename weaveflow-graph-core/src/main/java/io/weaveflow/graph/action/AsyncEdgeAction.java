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
 * Asynchronous router of a conditional edge.
 */
@FunctionalInterface
public interface AsyncEdgeAction<S> extends Function<S, CompletableFuture<String>> {

	CompletableFuture<String> apply(S state);

	// 将同步路由动作转换为异步路由动作
	static <S> AsyncEdgeAction<S> edge_async(EdgeAction<S> syncAction) {
		requireNonNull(syncAction, "syncAction cannot be null");
		return state -> {
			CompletableFuture<String> result = new CompletableFuture<>();
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
