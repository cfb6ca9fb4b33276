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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

	@Test
	void readsValuesInWriteOrderThenEnd() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		ChannelWriter<Integer> writer = channel.writer();
		assertTrue(writer.write(1));
		assertTrue(writer.write(2));
		assertTrue(writer.write(3));
		writer.close();

		assertEquals(List.of(1, 2, 3), channel.reader().collectAll());
	}

	@Test
	void endIsDeliveredExactlyOnce() {
		Channel<String> channel = Channels.pipe(1);
		channel.writer().close();
		ChannelReader<String> reader = channel.reader();

		assertTrue(reader.read().isEnd());
		assertTrue(reader.isClosed());
		assertThrows(StreamClosedException.class, reader::read);
	}

	@Test
	void recvSignalsExhaustionAndRethrowsErrors() throws Exception {
		Channel<String> channel = Channels.pipe(Channels.UNBOUNDED);
		channel.writer().write("a");
		channel.writer().writeError(new IllegalStateException("boom"));
		channel.writer().writeError(new IOException("io"));
		channel.writer().close();
		ChannelReader<String> reader = channel.reader();

		assertEquals("a", reader.recv());
		IllegalStateException unchecked = assertThrows(IllegalStateException.class, reader::recv);
		assertEquals("boom", unchecked.getMessage());
		// 受检异常包装为 StreamException
		StreamException wrapped = assertThrows(StreamException.class, reader::recv);
		assertInstanceOf(IOException.class, wrapped.getCause());
		assertThrows(StreamEndException.class, reader::recv);
	}

	@Test
	void errorItemsDoNotCloseTheChannel() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		channel.writer().writeError(new IllegalArgumentException("first"));
		channel.writer().write(7);
		channel.writer().close();
		ChannelReader<Integer> reader = channel.reader();

		assertTrue(reader.read().isError());
		assertEquals(7, reader.read().value());
		assertTrue(reader.read().isEnd());
	}

	@Test
	void collectAllRetiresReaderOnFirstError() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		channel.writer().write(1);
		channel.writer().writeError(new IllegalStateException("bad"));
		channel.writer().write(2);
		ChannelReader<Integer> reader = channel.reader();

		assertThrows(IllegalStateException.class, reader::collectAll);
		assertTrue(reader.isClosed());
	}

	@Test
	void zeroCapacityWriteReturnsOnlyAfterConsumption() throws Exception {
		Channel<String> channel = Channels.pipe(0);
		AtomicBoolean returned = new AtomicBoolean();
		Thread producer = new Thread(() -> {
			channel.writer().write("hand-off");
			returned.set(true);
		});
		producer.start();

		TimeUnit.MILLISECONDS.sleep(150);
		assertFalse(returned.get());

		assertEquals("hand-off", channel.reader().read().value());
		producer.join(2000);
		assertTrue(returned.get());
	}

	@Test
	void writerBlocksAtCapacity() throws Exception {
		Channel<Integer> channel = Channels.pipe(2);
		channel.writer().write(1);
		channel.writer().write(2);
		AtomicBoolean returned = new AtomicBoolean();
		Thread producer = new Thread(() -> {
			channel.writer().write(3);
			returned.set(true);
		});
		producer.start();

		TimeUnit.MILLISECONDS.sleep(150);
		assertFalse(returned.get());

		assertEquals(1, channel.reader().read().value());
		producer.join(2000);
		assertTrue(returned.get());
	}

	@Test
	void writesAreRejectedOnceClosed() {
		Channel<Integer> channel = Channels.pipe(4);
		channel.writer().close();
		channel.writer().close();

		assertTrue(channel.writer().isClosed());
		assertFalse(channel.writer().write(1));
		assertFalse(channel.writer().writeError(new IllegalStateException()));
	}

	@Test
	void writesAreRejectedWhenEveryReaderIsRetired() {
		Channel<Integer> channel = Channels.pipe(0);
		channel.reader().close();

		// 没有读者时写入不会阻塞
		assertFalse(channel.writer().write(1));
	}

	@Test
	void copiesSeeTheSameItemsFromTheCopyPoint() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		ChannelReader<Integer> original = channel.reader();
		channel.writer().write(1);
		channel.writer().write(2);
		assertEquals(1, original.read().value());

		List<ChannelReader<Integer>> copies = original.copy(2);
		channel.writer().write(3);
		channel.writer().close();

		assertEquals(List.of(2, 3), copies.get(0).collectAll());
		assertEquals(List.of(2, 3), copies.get(1).collectAll());
		assertTrue(original.isClosed());
		assertThrows(StreamClosedException.class, original::read);
	}

	@Test
	void copyOfOneReturnsTheSameReader() {
		ChannelReader<Integer> reader = Channels.fromIterable(List.of(1));

		assertSame(reader, reader.copy(1).get(0));
		assertFalse(reader.isClosed());
	}

	@Test
	void copyOfZeroRetiresTheReader() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		ChannelReader<Integer> reader = channel.reader();

		assertEquals(List.of(), reader.copy(0));
		assertThrows(StreamClosedException.class, reader::read);
		// 没有读者后写入被拒绝而不是阻塞
		assertFalse(channel.writer().write(1));
	}

	@Test
	void copiesAreDrainedIndependently() throws Exception {
		Channel<Integer> channel = Channels.pipe(4);
		List<ChannelReader<Integer>> copies = channel.reader().copy(3);
		List<Integer> expected = IntStream.range(0, 200).boxed().toList();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<List<Integer>>> drained = new ArrayList<>();
			for (int i = 0; i < copies.size(); i++) {
				ChannelReader<Integer> copy = copies.get(i);
				int pauseEvery = 10 * (i + 1);
				drained.add(executor.submit(() -> drain(copy, pauseEvery)));
			}
			executor.submit(() -> {
				expected.forEach(channel.writer()::write);
				channel.writer().close();
			});

			for (Future<List<Integer>> future : drained) {
				assertEquals(expected, future.get(10, TimeUnit.SECONDS));
			}
		}
		finally {
			executor.shutdownNow();
		}
	}

	private static List<Integer> drain(ChannelReader<Integer> reader, int pauseEvery) throws InterruptedException {
		List<Integer> values = new ArrayList<>();
		for (StreamItem<Integer> item = reader.read(); !item.isEnd(); item = reader.read()) {
			values.add(item.value());
			if (values.size() % pauseEvery == 0) {
				TimeUnit.MILLISECONDS.sleep(2);
			}
		}
		return values;
	}

	@Test
	void sharedBufferIsTrimmedBehindTheSlowestReader() {
		Channel<Integer> channel = Channels.pipe(Channels.UNBOUNDED);
		List<ChannelReader<Integer>> copies = channel.reader().copy(2);
		channel.writer().write(1);
		channel.writer().write(2);

		copies.get(0).read();
		copies.get(0).read();
		assertEquals(2, channel.buffered());

		copies.get(1).read();
		assertEquals(1, channel.buffered());

		copies.get(1).close();
		assertEquals(0, channel.buffered());
	}

	@Test
	void retiringTheSlowReaderUnblocksTheWriter() throws Exception {
		Channel<Integer> channel = Channels.pipe(1);
		List<ChannelReader<Integer>> copies = channel.reader().copy(2);
		channel.writer().write(1);
		copies.get(0).read();
		AtomicBoolean returned = new AtomicBoolean();
		Thread producer = new Thread(() -> {
			channel.writer().write(2);
			returned.set(true);
		});
		producer.start();

		TimeUnit.MILLISECONDS.sleep(150);
		assertFalse(returned.get());

		copies.get(1).close();
		producer.join(2000);
		assertTrue(returned.get());
		assertEquals(2, copies.get(0).read().value());
	}

	@Test
	void negativeCapacityIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> Channels.pipe(-1));
	}

	@Test
	void toFluxEmitsValuesAndCompletes() {
		StepVerifier.create(Channels.fromIterable(List.of("a", "b", "c")).toFlux())
			.expectNext("a", "b", "c")
			.verifyComplete();
	}

	@Test
	void toFluxTerminatesOnFirstError() {
		Channel<String> channel = Channels.pipe(Channels.UNBOUNDED);
		channel.writer().write("a");
		channel.writer().writeError(new IllegalStateException("stop"));
		channel.writer().write("never");
		channel.writer().close();

		StepVerifier.create(channel.reader().toFlux())
			.expectNext("a")
			.expectErrorMatches(e -> e instanceof IllegalStateException && "stop".equals(e.getMessage()))
			.verify();
	}

	@Test
	void streamItemAccessorsRejectTheWrongKind() {
		assertThrows(IllegalStateException.class, () -> StreamItem.end().value());
		assertThrows(IllegalStateException.class, () -> StreamItem.of(1).error());
		assertThrows(NullPointerException.class, () -> StreamItem.of(null));
		assertSame(StreamItem.end(), StreamItem.end());
	}

}
