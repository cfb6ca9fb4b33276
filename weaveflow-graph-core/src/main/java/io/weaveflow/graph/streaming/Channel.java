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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;

/**
 * Single-writer, multi-reader conduit of {@link StreamItem}s.
 * <p>
 * Items live in one shared buffer. Every live reader owns a cursor into it, and an item
 * is released as soon as the slowest live reader has moved past it, so fan-out through
 * {@link ChannelReader#copy(int)} costs the gap between the slowest and the fastest
 * reader rather than one queue per reader.
 * <p>
 * Capacity bounds the number of items not yet consumed by the slowest reader. With
 * capacity {@code 0} a write returns only once the item has been taken (rendezvous).
 * Once every reader has been retired, writes are rejected instead of blocking, so an
 * abandoned channel never stalls its producer.
 *
 * @param <T> the value type
 */
public final class Channel<T> {

	private final ReentrantLock lock = new ReentrantLock();

	private final Condition changed = lock.newCondition();

	private final int capacity;

	private final List<StreamItem<T>> buffer = new ArrayList<>();

	// absolute index of buffer.get(0)
	private long base;

	private final Set<ChannelReader<T>> readers = new LinkedHashSet<>();

	private boolean closed;

	private final ChannelWriter<T> writer;

	private final ChannelReader<T> reader;

	Channel(int capacity) {
		if (capacity < 0) {
			throw new IllegalArgumentException(format("capacity must be >= 0, was %d", capacity));
		}
		this.capacity = capacity;
		this.writer = new ChannelWriter<>(this);
		this.reader = new ChannelReader<>(this, 0);
		this.readers.add(reader);
	}

	public ChannelWriter<T> writer() {
		return writer;
	}

	/**
	 * @return the reader created together with this channel
	 */
	public ChannelReader<T> reader() {
		return reader;
	}

	public int capacity() {
		return capacity;
	}

	boolean offer(StreamItem<T> item) {
		lock.lock();
		try {
			while (!closed && !readers.isEmpty() && pending() >= Math.max(capacity, 1)) {
				await("write");
			}
			if (closed || readers.isEmpty()) {
				return false;
			}
			buffer.add(item);
			long index = tail() - 1;
			changed.signalAll();
			if (capacity == 0) {
				while (!readers.isEmpty() && slowestCursor() <= index) {
					await("hand off");
				}
			}
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	void close() {
		lock.lock();
		try {
			if (!closed) {
				closed = true;
				changed.signalAll();
			}
		}
		finally {
			lock.unlock();
		}
	}

	boolean isClosed() {
		lock.lock();
		try {
			return closed;
		}
		finally {
			lock.unlock();
		}
	}

	StreamItem<T> next(ChannelReader<T> r) {
		lock.lock();
		try {
			while (!r.retired && r.cursor >= tail() && !closed) {
				await("read");
			}
			if (r.retired) {
				throw new StreamClosedException("reader has already been retired");
			}
			if (r.cursor < tail()) {
				StreamItem<T> item = buffer.get((int) (r.cursor - base));
				r.cursor++;
				trim();
				changed.signalAll();
				return item;
			}
			// 已关闭且读尽：返回一次结束信号后退役
			retire(r);
			return StreamItem.end();
		}
		finally {
			lock.unlock();
		}
	}

	void release(ChannelReader<T> r) {
		lock.lock();
		try {
			if (!r.retired) {
				retire(r);
			}
		}
		finally {
			lock.unlock();
		}
	}

	boolean isRetired(ChannelReader<T> r) {
		lock.lock();
		try {
			return r.retired;
		}
		finally {
			lock.unlock();
		}
	}

	List<ChannelReader<T>> copy(ChannelReader<T> r, int n) {
		if (n < 0) {
			throw new IllegalArgumentException(format("copy count must be >= 0, was %d", n));
		}
		lock.lock();
		try {
			if (r.retired) {
				throw new StreamClosedException("cannot copy a retired reader");
			}
			if (n == 1) {
				return List.of(r);
			}
			List<ChannelReader<T>> copies = new ArrayList<>(n);
			for (int i = 0; i < n; i++) {
				ChannelReader<T> copy = new ChannelReader<>(this, r.cursor);
				readers.add(copy);
				copies.add(copy);
			}
			retire(r);
			return List.copyOf(copies);
		}
		finally {
			lock.unlock();
		}
	}

	int buffered() {
		lock.lock();
		try {
			return buffer.size();
		}
		finally {
			lock.unlock();
		}
	}

	private void retire(ChannelReader<T> r) {
		r.retired = true;
		readers.remove(r);
		trim();
		changed.signalAll();
	}

	private long tail() {
		return base + buffer.size();
	}

	private long pending() {
		return tail() - slowestCursor();
	}

	private long slowestCursor() {
		long min = tail();
		for (ChannelReader<T> r : readers) {
			min = Math.min(min, r.cursor);
		}
		return min;
	}

	private void trim() {
		int consumed = (int) (slowestCursor() - base);
		if (consumed > 0) {
			buffer.subList(0, consumed).clear();
			base += consumed;
		}
	}

	private void await(String operation) {
		try {
			changed.await();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new StreamException(format("interrupted while waiting to %s", operation), e);
		}
	}

}
