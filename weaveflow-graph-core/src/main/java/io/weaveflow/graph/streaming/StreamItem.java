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

import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * A single element travelling through a {@link Channel}: either a value, an in-band
 * error, or the end-of-stream signal.
 *
 * @param <T> the value type
 */
public final class StreamItem<T> {

	public enum Kind {

		VALUE, ERROR, END

	}

	private static final StreamItem<?> END = new StreamItem<>(Kind.END, null, null);

	private final Kind kind;

	private final T value;

	private final Throwable error;

	private StreamItem(Kind kind, T value, Throwable error) {
		this.kind = kind;
		this.value = value;
		this.error = error;
	}

	public static <T> StreamItem<T> of(T value) {
		return new StreamItem<>(Kind.VALUE, Objects.requireNonNull(value, "value cannot be null"), null);
	}

	public static <T> StreamItem<T> error(Throwable error) {
		return new StreamItem<>(Kind.ERROR, null, Objects.requireNonNull(error, "error cannot be null"));
	}

	@SuppressWarnings("unchecked")
	public static <T> StreamItem<T> end() {
		return (StreamItem<T>) END;
	}

	public Kind kind() {
		return kind;
	}

	public boolean isValue() {
		return kind == Kind.VALUE;
	}

	public boolean isError() {
		return kind == Kind.ERROR;
	}

	public boolean isEnd() {
		return kind == Kind.END;
	}

	/**
	 * @return {@code true} if this item is the marker a named merge emits when one of its
	 * sources drains
	 */
	public boolean isSourceExhausted() {
		return error instanceof SourceExhaustedException;
	}

	public Optional<String> sourceName() {
		if (error instanceof SourceExhaustedException exhausted) {
			return Optional.of(exhausted.sourceName());
		}
		return Optional.empty();
	}

	/**
	 * @return the carried value
	 * @throws IllegalStateException if this item is not a value
	 */
	public T value() {
		if (kind != Kind.VALUE) {
			throw new IllegalStateException(format("stream item of kind %s has no value", kind));
		}
		return value;
	}

	/**
	 * @return the carried error
	 * @throws IllegalStateException if this item is not an error
	 */
	public Throwable error() {
		if (kind != Kind.ERROR) {
			throw new IllegalStateException(format("stream item of kind %s has no error", kind));
		}
		return error;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StreamItem<?> that)) {
			return false;
		}
		return kind == that.kind && Objects.equals(value, that.value) && Objects.equals(error, that.error);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value, error);
	}

	@Override
	public String toString() {
		return switch (kind) {
			case VALUE -> format("StreamItem{value=%s}", value);
			case ERROR -> format("StreamItem{error=%s}", error);
			case END -> "StreamItem{end}";
		};
	}

}
