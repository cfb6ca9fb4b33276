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

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.streaming.ChannelReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Two units run one after the other, built by {@link ExecutionUnit#pipe}.
 * <p>
 * {@link #stream} prefers streaming end to end ({@code first.stream} into
 * {@code second.transform}). Without {@code first.stream} it runs {@code first.invoke}
 * followed by {@code second.stream}; without {@code second.transform} it feeds the first
 * value of the stream already opened into {@code second.stream}, so {@code first} runs
 * once either way.
 */
public class UnitSequence<I, M, O> implements ExecutionUnit<I, O> {

	public static final String TYPE = "UnitSequence";

	private static final Logger log = LoggerFactory.getLogger(UnitSequence.class);

	private final ExecutionUnit<I, M> first;

	private final ExecutionUnit<M, O> second;

	public UnitSequence(ExecutionUnit<I, M> first, ExecutionUnit<M, O> second) {
		this.first = requireNonNull(first, "first cannot be null");
		this.second = requireNonNull(second, "second cannot be null");
	}

	public ExecutionUnit<I, M> first() {
		return first;
	}

	public ExecutionUnit<M, O> second() {
		return second;
	}

	@Override
	public O invoke(I input, RunnableConfig config) {
		return second.invoke(first.invoke(input, config), config);
	}

	@Override
	public ChannelReader<O> stream(I input, RunnableConfig config) {
		ChannelReader<M> intermediate;
		try {
			intermediate = first.stream(input, config);
		}
		catch (UnsupportedOperationException e) {
			log.debug("{} does not stream, falling back to invoke", first.runInfo().name());
			return second.stream(first.invoke(input, config), config);
		}
		try {
			return second.transform(intermediate, config);
		}
		catch (UnsupportedOperationException e) {
			log.debug("{} does not transform, streaming from the first intermediate value",
					second.runInfo().name());
			return second.stream(firstValue(intermediate), config);
		}
	}

	@Override
	public O collect(ChannelReader<I> input, RunnableConfig config) {
		return second.invoke(first.collect(input, config), config);
	}

	@Override
	public ChannelReader<O> transform(ChannelReader<I> input, RunnableConfig config) {
		return second.transform(first.transform(input, config), config);
	}

	private M firstValue(ChannelReader<M> intermediate) {
		try {
			return ModeDerivation.first(intermediate, first.runInfo().name() + " streamed no value");
		}
		catch (Exception e) {
			throw ModeDerivation.unchecked(e, TYPE);
		}
	}

	@Override
	public RunInfo runInfo() {
		return RunInfo.of(first.runInfo().name() + " | " + second.runInfo().name(), TYPE,
				ComponentType.CHAIN);
	}

}
