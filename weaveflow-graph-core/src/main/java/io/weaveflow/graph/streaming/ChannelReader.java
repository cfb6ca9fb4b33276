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
import java.util.List;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * A read end of a {@link Channel}. Each reader sees every item written after its cursor,
 * in write order, then end-of-stream exactly once. Reading past that point, or from a
 * reader retired by {@link #close()} or {@link #copy(int)}, raises
 * {@link StreamClosedException}.
 *
 * @param <T> the value type
 */
public final class ChannelReader<T> implements AutoCloseable {

	private final Channel<T> channel;

	// guarded by the channel lock
	long cursor;

	boolean retired;

	ChannelReader(Channel<T> channel, long cursor) {
		this.channel = channel;
		this.cursor = cursor;
	}

	/**
	 * Blocks until an item is available or the channel is closed and drained.
	 */
	public StreamItem<T> read() {
		return channel.next(this);
	}

	/**
	 * Returns the next value.
	 * @throws StreamEndException when the stream is exhausted
	 */
	public T recv() {
		StreamItem<T> item = read();
		return switch (item.kind()) {
			case VALUE -> item.value();
			case ERROR -> throw propagate(item.error());
			case END -> throw new StreamEndException();
		};
	}

	/**
	 * Drains the remaining values. The first in-band error retires the reader and is
	 * rethrown.
	 */
	public List<T> collectAll() {
		List<T> values = new ArrayList<>();
		while (true) {
			StreamItem<T> item = read();
			if (item.isEnd()) {
				return values;
			}
			if (item.isError()) {
				close();
				throw propagate(item.error());
			}
			values.add(item.value());
		}
	}

	/**
	 * Splits this reader into {@code n} independent readers positioned where this one is.
	 * This reader is retired unless {@code n == 1}, in which case it is returned as is.
	 */
	public List<ChannelReader<T>> copy(int n) {
		return channel.copy(this, n);
	}

	public <R> ChannelReader<R> transform(StreamConverter<T, R> converter) {
		return Channels.transform(this, converter);
	}

	/**
	 * Bridges this reader to a {@link Flux}. The first in-band error terminates the Flux;
	 * cancelling the subscription retires the reader.
	 */
	public Flux<T> toFlux() {
		return Flux.<T>generate(sink -> {
			StreamItem<T> item = read();
			switch (item.kind()) {
				case VALUE -> sink.next(item.value());
				case ERROR -> sink.error(item.error());
				case END -> sink.complete();
			}
		}).subscribeOn(Schedulers.boundedElastic()).doFinally(signal -> close());
	}

	public boolean isClosed() {
		return channel.isRetired(this);
	}

	/**
	 * Retires this reader. Items it has not read are released. Idempotent.
	 */
	@Override
	public void close() {
		channel.release(this);
	}

	static RuntimeException propagate(Throwable error) {
		if (error instanceof RuntimeException runtimeException) {
			return runtimeException;
		}
		if (error instanceof Error e) {
			throw e;
		}
		return new StreamException("stream carried an error", error);
	}

}
