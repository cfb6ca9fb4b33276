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
package io.weaveflow.graph.callback;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable key/value context threaded through the {@link CallbackHandler} chain. Each
 * handler receives the context produced by the previous one and returns the context for
 * the next; modifications always yield a new instance.
 */
public final class CallbackContext {

	private static final CallbackContext EMPTY = new CallbackContext(Map.of());

	private final Map<String, Object> values;

	private CallbackContext(Map<String, Object> values) {
		this.values = values;
	}

	public static CallbackContext empty() {
		return EMPTY;
	}

	public static CallbackContext of(Map<String, Object> values) {
		requireNonNull(values, "values cannot be null");
		if (values.isEmpty()) {
			return EMPTY;
		}
		return new CallbackContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
	}

	public Optional<Object> get(String key) {
		return Optional.ofNullable(values.get(key));
	}

	public <T> Optional<T> get(String key, Class<T> type) {
		return get(key).filter(type::isInstance).map(type::cast);
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	public CallbackContext with(String key, Object value) {
		requireNonNull(key, "key cannot be null");
		requireNonNull(value, "value cannot be null");
		Map<String, Object> copy = new LinkedHashMap<>(values);
		copy.put(key, value);
		return new CallbackContext(Collections.unmodifiableMap(copy));
	}

	public CallbackContext without(String key) {
		if (!values.containsKey(key)) {
			return this;
		}
		Map<String, Object> copy = new LinkedHashMap<>(values);
		copy.remove(key);
		return of(copy);
	}

	public Map<String, Object> asMap() {
		return values;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CallbackContext that)) {
			return false;
		}
		return Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return "CallbackContext" + values;
	}

}
