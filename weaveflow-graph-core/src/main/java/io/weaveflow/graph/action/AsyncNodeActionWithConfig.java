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
import java.util.function.BiFunction;
import java.util.function.Function;

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.compose.ExecutionUnit;

import static java.util.Objects.requireNonNull;

/**
 * Node action that also receives the {@link RunnableConfig} of the current run, including
 * the callback context of the node being executed.
 */
@FunctionalInterface
public interface AsyncNodeActionWithConfig<S> {

	CompletableFuture<S> apply(S state, RunnableConfig config);

	static <S> AsyncNodeActionWithConfig<S> of(AsyncNodeAction<S> action) {
		requireNonNull(action, "action cannot be null");
		return (state, config) -> action.apply(state);
	}

	/**
	 * Adapts an execution unit into a node: {@code getInput} extracts the unit's input
	 * from the state and {@code setOutput} folds the unit's output back into it. The unit
	 * is invoked with the node's config, so its callbacks nest under the node's.
	 */
	static <S, I, O> AsyncNodeActionWithConfig<S> fromUnit(ExecutionUnit<I, O> unit, Function<S, I> getInput,
			BiFunction<S, O, S> setOutput) {
		requireNonNull(unit, "unit cannot be null");
		requireNonNull(getInput, "getInput cannot be null");
		requireNonNull(setOutput, "setOutput cannot be null");
		return (state, config) -> {
			CompletableFuture<S> result = new CompletableFuture<>();
			try {
				result.complete(setOutput.apply(state, unit.invoke(getInput.apply(state), config)));
			}
			catch (Exception e) {
				result.completeExceptionally(e);
			}
			return result;
		};
	}

	/**
	 * Adapts a unit whose input and output are the state itself.
	 */
	static <S> AsyncNodeActionWithConfig<S> fromUnit(ExecutionUnit<S, S> unit) {
		return fromUnit(unit, Function.identity(), (state, output) -> output);
	}

}
