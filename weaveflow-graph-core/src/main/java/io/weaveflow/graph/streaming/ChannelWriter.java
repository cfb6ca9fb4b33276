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

/**
 * The single write end of a {@link Channel}.
 *
 * @param <T> the value type
 */
public final class ChannelWriter<T> implements AutoCloseable {

	private final Channel<T> channel;

	ChannelWriter(Channel<T> channel) {
		this.channel = channel;
	}

	/**
	 * Appends a value, blocking while the channel is at capacity.
	 * @return {@code true} if accepted, {@code false} if the channel is closed or has no
	 * remaining readers
	 */
	public boolean write(T value) {
		return channel.offer(StreamItem.of(value));
	}

	/**
	 * Appends an in-band error. The channel stays open.
	 * @return {@code true} if accepted, {@code false} if the channel is closed or has no
	 * remaining readers
	 */
	public boolean writeError(Throwable error) {
		return channel.offer(StreamItem.error(error));
	}

	boolean send(StreamItem<T> item) {
		return channel.offer(item);
	}

	public boolean isClosed() {
		return channel.isClosed();
	}

	/**
	 * Closes the write end. Buffered items still drain to readers. Idempotent.
	 */
	@Override
	public void close() {
		channel.close();
	}

}
