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
package io.weaveflow.graph.streaming;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import static org.junit.jupiter.api.Assertions.*;

class ChannelsTest {

	@Test
	void mergeOfNothingIsExhausted() {
		ChannelReader<String> merged = Channels.merge(List.of());

		assertTrue(merged.read().isEnd());
	}

	@Test
	void mergeOfOneReturnsItUnchanged() {
		ChannelReader<String> single = Channels.fromIterable(List.of("x"));

		assertSame(single, Channels.merge(List.of(single)));
		assertSame(single, Channels.concat(List.of(single)));
	}

	@Test
	void mergeKeepsPerSourceOrder() {
		ChannelReader<String> a = Channels.fromIterable(List.of("a1", "a2", "a3"));
		ChannelReader<String> b = Channels.fromIterable(List.of("b1", "b2", "b3"));

		List<String> merged = Channels.merge(List.of(a, b)).collectAll();

		assertEquals(6, merged.size());
		assertEquals(List.of("a1", "a2", "a3"), merged.stream().filter(s -> s.startsWith("a")).toList());
		assertEquals(List.of("b1", "b2", "b3"), merged.stream().filter(s -> s.startsWith("b")).toList());
	}

	@Test
	void mergeForwardsErrorsAndKeepsOtherSources() {
		ChannelReader<String> failing = Channels.failed(new IllegalStateException("source failed"));
		ChannelReader<String> healthy = Channels.fromIterable(List.of("ok"));
		ChannelReader<String> merged = Channels.merge(List.of(failing, healthy));

		List<StreamItem<String>> items = drain(merged);

		assertEquals(1, items.stream().filter(StreamItem::isError).count());
		assertTrue(items.contains(StreamItem.of("ok")));
	}

	@Test
	void mergeNamedMarksEverySourceExhaustion() {
		Map<String, ChannelReader<Integer>> sources = new LinkedHashMap<>();
		sources.put("left", Channels.fromIterable(List.of(1, 2)));
		sources.put("right", Channels.fromIterable(List.of(3)));

		List<StreamItem<Integer>> items = drain(Channels.mergeNamed(sources));

		Set<String> exhausted = new HashSet<>();
		List<Integer> values = new ArrayList<>();
		for (StreamItem<Integer> item : items) {
			if (item.isSourceExhausted()) {
				exhausted.add(item.sourceName().orElseThrow());
			}
			else {
				values.add(item.value());
			}
		}
		assertEquals(Set.of("left", "right"), exhausted);
		assertEquals(3, values.size());
		// 每个来源的结束标记排在它的所有值之后
		int leftMarker = indexOfMarker(items, "left");
		assertTrue(items.indexOf(StreamItem.of(2)) < leftMarker);
		assertTrue(items.indexOf(StreamItem.of(3)) < indexOfMarker(items, "right"));
	}

	@Test
	void mergeNamedOfOneStillEmitsTheMarker() {
		List<StreamItem<String>> items = drain(Channels.mergeNamed(Map.of("only", Channels.fromIterable(List.of("v")))));

		assertEquals(2, items.size());
		assertEquals("v", items.get(0).value());
		assertEquals("only", items.get(1).sourceName().orElseThrow());
	}

	@Test
	void concatDrainsSourcesInOrder() {
		ChannelReader<Integer> first = Channels.fromIterable(List.of(1, 2));
		ChannelReader<Integer> second = Channels.fromIterable(List.of(3));
		ChannelReader<Integer> third = Channels.fromIterable(List.of(4, 5));

		assertEquals(List.of(1, 2, 3, 4, 5), Channels.concat(List.of(first, second, third)).collectAll());
	}

	@Test
	void concatForwardsErrorsAndKeepsDrainingTheSameSource() {
		Channel<Integer> first = Channels.pipe(Channels.UNBOUNDED);
		first.writer().write(1);
		first.writer().writeError(new IllegalArgumentException("mid"));
		first.writer().write(2);
		first.writer().close();

		List<StreamItem<Integer>> items = drain(
				Channels.concat(List.of(first.reader(), Channels.fromIterable(List.of(3)))));

		assertEquals(4, items.size());
		assertEquals(1, items.get(0).value());
		assertInstanceOf(IllegalArgumentException.class, items.get(1).error());
		assertEquals(2, items.get(2).value());
		assertEquals(3, items.get(3).value());
	}

	@Test
	void transformDropsNoValueAndTurnsFailuresIntoErrors() {
		ChannelReader<Integer> source = Channels.fromIterable(List.of(1, 2, 3, 4));

		List<StreamItem<Integer>> items = drain(Channels.transform(source, value -> {
			if (value == 2) {
				throw NoValueException.INSTANCE;
			}
			if (value == 3) {
				throw new IllegalArgumentException("three");
			}
			return value * 10;
		}));

		assertEquals(3, items.size());
		assertEquals(10, items.get(0).value());
		assertEquals("three", items.get(1).error().getMessage());
		assertEquals(40, items.get(2).value());
	}

	@Test
	void transformOnReaderChainsConversions() {
		List<String> result = Channels.fromIterable(List.of(1, 2))
			.transform(value -> value + 1)
			.transform(value -> "#" + value)
			.collectAll();

		assertEquals(List.of("#2", "#3"), result);
	}

	@Test
	void retiredDerivedReaderStopsItsPump() throws Exception {
		Channel<Integer> source = Channels.pipe(Channels.UNBOUNDED);
		ChannelReader<Integer> derived = Channels.transform(source.reader(), value -> value);
		derived.close();

		boolean rejected = false;
		for (int i = 0; i < 200 && !rejected; i++) {
			rejected = !source.writer().write(i);
			TimeUnit.MILLISECONDS.sleep(10);
		}
		assertTrue(rejected);
		assertTrue(source.reader().isClosed());
	}

	@Test
	void fromFluxBridgesValuesAndErrors() {
		assertEquals(List.of(1, 2), Channels.fromFlux(Flux.just(1, 2)).collectAll());

		ChannelReader<Integer> failing = Channels.fromFlux(Flux.concat(Flux.just(1), Flux.error(new IllegalStateException("flux"))));
		assertEquals(1, failing.read().value());
		assertEquals("flux", failing.read().error().getMessage());
		assertTrue(failing.read().isEnd());
	}

	@Test
	void singleAndEmptyFactories() {
		assertEquals(List.of("one"), Channels.single("one").collectAll());
		assertTrue(Channels.<String>empty().collectAll().isEmpty());
	}

	private static <T> List<StreamItem<T>> drain(ChannelReader<T> reader) {
		List<StreamItem<T>> items = new ArrayList<>();
		while (true) {
			StreamItem<T> item = reader.read();
			if (item.isEnd()) {
				return items;
			}
			items.add(item);
		}
	}

	private static int indexOfMarker(List<? extends StreamItem<?>> items, String source) {
		for (int i = 0; i < items.size(); i++) {
			if (items.get(i).sourceName().filter(source::equals).isPresent()) {
				return i;
			}
		}
		return -1;
	}

}
