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
package io.weaveflow.graph.compose;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.streaming.ChannelReader;

/**
 * A computation that can be driven in four modes: value in / value out
 * ({@link #invoke}), value in / stream out ({@link #stream}), stream in / value out
 * ({@link #collect}) and stream in / stream out ({@link #transform}).
 * <p>
 * A component that does not support a mode throws {@link UnsupportedOperationException}
 * from it. {@link Lambda} builds a unit from any subset of modes and derives the rest.
 * Stream-returning modes report failures as in-band error items where possible; the
 * value-returning modes throw.
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface ExecutionUnit<I, O> {

	O invoke(I input, RunnableConfig config);

	ChannelReader<O> stream(I input, RunnableConfig config);

	O collect(ChannelReader<I> input, RunnableConfig config);

	ChannelReader<O> transform(ChannelReader<I> input, RunnableConfig config);

	default O invoke(I input) {
		return invoke(input, RunnableConfig.empty());
	}

	default ChannelReader<O> stream(I input) {
		return stream(input, RunnableConfig.empty());
	}

	default O collect(ChannelReader<I> input) {
		return collect(input, RunnableConfig.empty());
	}

	default ChannelReader<O> transform(ChannelReader<I> input) {
		return transform(input, RunnableConfig.empty());
	}

	/**
	 * @return a unit running this unit, then {@code next} on its output
	 */
	default <R> ExecutionUnit<I, R> pipe(ExecutionUnit<O, R> next) {
		return new UnitSequence<>(this, next);
	}

	default List<O> batch(List<I> inputs) {
		return batch(inputs, RunnableConfig.empty());
	}

	/**
	 * Invokes every input one after the other.
	 */
	default List<O> batch(List<I> inputs, RunnableConfig config) {
		List<O> results = new ArrayList<>(inputs.size());
		for (I input : inputs) {
			results.add(invoke(input, config));
		}
		return results;
	}

	default List<O> batchParallel(List<I> inputs) {
		return batchParallel(inputs, RunnableConfig.empty());
	}

	/**
	 * Invokes every input concurrently and waits for all of them. The output at index
	 * {@code i} belongs to the input at index {@code i}. If any invocation fails, the
	 * failure of the lowest failing index is thrown once all invocations have finished.
	 */
	default List<O> batchParallel(List<I> inputs, RunnableConfig config) {
		Executor executor = ModeDerivation.executor(config);
		List<CompletableFuture<O>> futures = new ArrayList<>(inputs.size());
		for (I input : inputs) {
			futures.add(CompletableFuture.supplyAsync(() -> invoke(input, config), executor));
		}
		CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).exceptionally(e -> null).join();
		List<O> results = new ArrayList<>(inputs.size());
		for (CompletableFuture<O> future : futures) {
			try {
				results.add(future.join());
			}
			catch (CompletionException e) {
				throw ModeDerivation.unchecked(e, runInfo().type());
			}
		}
		return results;
	}

	default RunInfo runInfo() {
		String name = getClass().getSimpleName();
		return RunInfo.of(name, name, ComponentType.RUNNABLE);
	}

}
