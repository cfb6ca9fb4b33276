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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;

import static java.util.Objects.requireNonNull;

/**
 * Factories and the fan-in / fan-out algebra over {@link ChannelReader}s.
 * <p>
 * Derived channels are fed by pump tasks running on an {@link Executor}. Pumps block on
 * their sources, so the default executor hands every task its own daemon thread. A pump
 * whose output reader has been retired stops and retires its sources.
 */
public final class Channels {

	private static final Logger log = LoggerFactory.getLogger(Channels.class);

	public static final int UNBOUNDED = Integer.MAX_VALUE;

	public static final int DEFAULT_CAPACITY = 16;

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

	private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
		Thread thread = new Thread(runnable, "weaveflow-stream-" + THREAD_COUNTER.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	private enum Drain {

		EXHAUSTED, FAILED, ABANDONED

	}

	private Channels() {
	}

	public static Executor defaultExecutor() {
		return DEFAULT_EXECUTOR;
	}

	/**
	 * @param capacity {@code 0} for a synchronous handoff, {@link #UNBOUNDED} for no limit
	 */
	public static <T> Channel<T> pipe(int capacity) {
		return new Channel<>(capacity);
	}

	public static <T> ChannelReader<T> empty() {
		Channel<T> channel = pipe(0);
		channel.writer().close();
		return channel.reader();
	}

	public static <T> ChannelReader<T> single(T value) {
		return fromIterable(List.of(value));
	}

	/**
	 * @return a reader yielding one in-band error, then end-of-stream
	 */
	public static <T> ChannelReader<T> failed(Throwable error) {
		Channel<T> channel = pipe(1);
		channel.writer().writeError(error);
		channel.writer().close();
		return channel.reader();
	}

	public static <T> ChannelReader<T> fromIterable(Iterable<? extends T> values) {
		Channel<T> channel = pipe(UNBOUNDED);
		for (T value : values) {
			channel.writer().write(value);
		}
		channel.writer().close();
		return channel.reader();
	}

	/**
	 * Subscribes to the given Flux and exposes its signals as a channel. An error signal
	 * becomes an in-band error followed by end-of-stream. Retiring the reader cancels the
	 * subscription on the next emitted value.
	 */
	public static <T> ChannelReader<T> fromFlux(Flux<T> flux) {
		Channel<T> channel = pipe(UNBOUNDED);
		ChannelWriter<T> writer = channel.writer();
		flux.subscribe(new BaseSubscriber<T>() {

			@Override
			protected void hookOnSubscribe(Subscription subscription) {
				request(Long.MAX_VALUE);
			}

			@Override
			protected void hookOnNext(T value) {
				if (!writer.write(value)) {
					cancel();
				}
			}

			@Override
			protected void hookOnError(Throwable throwable) {
				writer.writeError(throwable);
			}

			@Override
			protected void hookFinally(SignalType type) {
				writer.close();
			}
		});
		return channel.reader();
	}

	public static <T> ChannelReader<T> merge(List<ChannelReader<T>> readers) {
		return merge(readers, DEFAULT_EXECUTOR);
	}

	/**
	 * Interleaves the given readers. Per-source order is kept; the global order is not
	 * defined. An in-band error from one source is forwarded while the others keep going.
	 * The output ends once every source is exhausted.
	 */
	public static <T> ChannelReader<T> merge(List<ChannelReader<T>> readers, Executor executor) {
		requireNonNull(readers, "readers cannot be null");
		if (readers.isEmpty()) {
			return empty();
		}
		if (readers.size() == 1) {
			return readers.get(0);
		}
		Channel<T> out = pipe(DEFAULT_CAPACITY);
		AtomicInteger active = new AtomicInteger(readers.size());
		for (ChannelReader<T> source : readers) {
			executor.execute(() -> {
				try {
					drain(source, out.writer());
				}
				finally {
					if (active.decrementAndGet() == 0) {
						out.writer().close();
					}
				}
			});
		}
		return out.reader();
	}

	public static <T> ChannelReader<T> mergeNamed(Map<String, ChannelReader<T>> readers) {
		return mergeNamed(readers, DEFAULT_EXECUTOR);
	}

	/**
	 * Like {@link #merge(List, Executor)}, but emits an in-band
	 * {@link SourceExhaustedException} marker carrying the source name when a source
	 * drains.
	 */
	public static <T> ChannelReader<T> mergeNamed(Map<String, ChannelReader<T>> readers, Executor executor) {
		requireNonNull(readers, "readers cannot be null");
		if (readers.isEmpty()) {
			return empty();
		}
		Channel<T> out = pipe(DEFAULT_CAPACITY);
		AtomicInteger active = new AtomicInteger(readers.size());
		new LinkedHashMap<>(readers).forEach((name, source) -> executor.execute(() -> {
			try {
				if (drain(source, out.writer()) == Drain.EXHAUSTED) {
					out.writer().send(StreamItem.error(new SourceExhaustedException(name)));
				}
			}
			finally {
				if (active.decrementAndGet() == 0) {
					out.writer().close();
				}
			}
		}));
		return out.reader();
	}

	public static <T> ChannelReader<T> concat(List<ChannelReader<T>> readers) {
		return concat(readers, DEFAULT_EXECUTOR);
	}

	/**
	 * Drains each reader fully, in list order, before moving to the next one.
	 */
	public static <T> ChannelReader<T> concat(List<ChannelReader<T>> readers, Executor executor) {
		requireNonNull(readers, "readers cannot be null");
		if (readers.isEmpty()) {
			return empty();
		}
		if (readers.size() == 1) {
			return readers.get(0);
		}
		List<ChannelReader<T>> sources = new ArrayList<>(readers);
		Channel<T> out = pipe(DEFAULT_CAPACITY);
		executor.execute(() -> {
			try {
				for (int i = 0; i < sources.size(); i++) {
					if (drain(sources.get(i), out.writer()) == Drain.ABANDONED) {
						sources.subList(i + 1, sources.size()).forEach(ChannelReader::close);
						return;
					}
				}
			}
			finally {
				out.writer().close();
			}
		});
		return out.reader();
	}

	public static <T> List<ChannelReader<T>> copy(ChannelReader<T> reader, int n) {
		return reader.copy(n);
	}

	public static <T, R> ChannelReader<R> transform(ChannelReader<T> reader, StreamConverter<T, R> converter) {
		return transform(reader, converter, DEFAULT_EXECUTOR);
	}

	/**
	 * Maps every value through {@code converter}. {@link NoValueException} drops the
	 * value; any other exception becomes an in-band error at the same position. In-band
	 * errors from the source pass through unchanged.
	 */
	public static <T, R> ChannelReader<R> transform(ChannelReader<T> reader, StreamConverter<T, R> converter,
			Executor executor) {
		requireNonNull(reader, "reader cannot be null");
		requireNonNull(converter, "converter cannot be null");
		Channel<R> out = pipe(DEFAULT_CAPACITY);
		ChannelWriter<R> writer = out.writer();
		executor.execute(() -> {
			try {
				while (true) {
					StreamItem<T> item = reader.read();
					if (item.isEnd()) {
						return;
					}
					StreamItem<R> next;
					if (item.isError()) {
						next = StreamItem.error(item.error());
					}
					else {
						try {
							next = StreamItem.of(converter.convert(item.value()));
						}
						catch (NoValueException skip) {
							continue;
						}
						catch (Exception e) {
							next = StreamItem.error(e);
						}
					}
					if (!writer.send(next)) {
						reader.close();
						return;
					}
				}
			}
			catch (StreamException e) {
				log.debug("transform source failed", e);
				writer.writeError(e);
				reader.close();
			}
			finally {
				writer.close();
			}
		});
		return out.reader();
	}

	private static <T> Drain drain(ChannelReader<T> source, ChannelWriter<T> writer) {
		try {
			while (true) {
				StreamItem<T> item = source.read();
				if (item.isEnd()) {
					return Drain.EXHAUSTED;
				}
				if (!writer.send(item)) {
					source.close();
					return Drain.ABANDONED;
				}
			}
		}
		catch (StreamException e) {
			log.debug("fan-in source failed", e);
			writer.writeError(e);
			source.close();
			return Drain.FAILED;
		}
	}

}
