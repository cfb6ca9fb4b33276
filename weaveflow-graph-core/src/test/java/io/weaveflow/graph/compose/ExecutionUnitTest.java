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

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.exception.RunnableException;
import io.weaveflow.graph.streaming.ChannelReader;
import io.weaveflow.graph.streaming.Channels;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionUnitTest {

	/**
	 * Supports invoke only, like a component without native streaming.
	 */
	static class InvokeOnlyUnit implements ExecutionUnit<String, String> {

		@Override
		public String invoke(String input, RunnableConfig config) {
			return input.toUpperCase();
		}

		@Override
		public ChannelReader<String> stream(String input, RunnableConfig config) {
			throw new UnsupportedOperationException("stream");
		}

		@Override
		public String collect(ChannelReader<String> input, RunnableConfig config) {
			throw new UnsupportedOperationException("collect");
		}

		@Override
		public ChannelReader<String> transform(ChannelReader<String> input, RunnableConfig config) {
			throw new UnsupportedOperationException("transform");
		}

	}

	/**
	 * Streams from a single value but cannot consume a stream.
	 */
	static class NoTransformUnit extends InvokeOnlyUnit {

		@Override
		public ChannelReader<String> stream(String input, RunnableConfig config) {
			return Channels.single(invoke(input, config));
		}

	}

	@Test
	void pipeRunsBothUnitsInOrder() {
		ExecutionUnit<String, Integer> length = Lambda.of("length", String::length);
		ExecutionUnit<Integer, Integer> twice = Lambda.of("twice", x -> x * 2);

		ExecutionUnit<String, Integer> sequence = length.pipe(twice);

		assertEquals(8, sequence.invoke("abcd"));
		assertEquals(List.of(6), sequence.stream("abc").collectAll());
		assertEquals(List.of(2, 4), sequence.transform(Channels.fromIterable(List.of("a", "ab"))).collectAll());
		assertEquals(4, sequence.collect(Channels.fromIterable(List.of("ab"))));
	}

	@Test
	void pipeStreamFallsBackToInvokeWhenStreamingIsUnsupported() {
		ExecutionUnit<String, String> sequence = new InvokeOnlyUnit().pipe(Lambda.<String, String>of("exclaim", s -> s + "!"));

		assertEquals(List.of("HI!"), sequence.stream("hi").collectAll());
	}

	@Test
	void pipeStreamFallsBackWhenSecondCannotTransform() {
		ExecutionUnit<String, String> sequence = Lambda.<String, String>of("trim", String::trim)
			.pipe(new NoTransformUnit());

		assertEquals(List.of("HI"), sequence.stream("  hi ").collectAll());
		assertEquals("HI", sequence.invoke("  hi "));
	}

	@Test
	void pipeStreamRunsAStreamingFirstUnitOnce() {
		AtomicInteger runs = new AtomicInteger();
		ExecutionUnit<String, String> source = Lambda.<String, String>streaming((input, config) -> {
			runs.incrementAndGet();
			return Channels.fromIterable(List.of(input + "!", "ignored"));
		});

		List<String> out = source.pipe(new NoTransformUnit()).stream("x").collectAll();

		// 第二个单元不支持 transform 时，复用已打开的流的第一个值
		assertEquals(List.of("X!"), out);
		assertEquals(1, runs.get());
	}

	@Test
	void pipeStreamFailsWhenTheFirstUnitStreamsNothing() {
		ExecutionUnit<String, String> sequence = Lambda.<String, String>streaming((input, config) -> Channels.empty())
			.pipe(new NoTransformUnit());

		assertThrows(RunnableException.class, () -> sequence.stream("x"));
	}

	@Test
	void sequenceRunInfoNamesBothSides() {
		UnitSequence<String, Integer, Integer> sequence = new UnitSequence<>(Lambda.of("length", String::length),
				Lambda.of("twice", x -> x * 2));

		assertEquals("length | twice", sequence.runInfo().name());
		assertEquals(ComponentType.CHAIN, sequence.runInfo().componentType());
	}

	@Test
	void batchKeepsInputOrder() {
		ExecutionUnit<Integer, Integer> inc = Lambda.of(x -> x + 1);

		assertEquals(List.of(2, 3, 4), inc.batch(List.of(1, 2, 3)));
		assertEquals(List.of(), inc.batch(List.of()));
	}

	@Test
	void batchParallelKeepsInputOrder() {
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			ExecutionUnit<Integer, Integer> slowInc = Lambda.of(x -> {
				try {
					Thread.sleep((5 - x) * 20L);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return x + 1;
			});
			RunnableConfig config = RunnableConfig.builder().executor(executor).build();

			assertEquals(List.of(2, 3, 4, 5), slowInc.batchParallel(List.of(1, 2, 3, 4), config));
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void batchParallelSurfacesTheFirstFailureByIndex() {
		ExecutionUnit<Integer, Integer> picky = Lambda.of(x -> {
			if (x == 2) {
				throw new IllegalArgumentException("two");
			}
			if (x == 3) {
				throw new IllegalStateException("three");
			}
			return x;
		});

		IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
				() -> picky.batchParallel(List.of(1, 2, 3)));
		assertEquals("two", failure.getMessage());
	}

}
