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
package io.weaveflow.graph.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.weaveflow.graph.action.StateMerger;

import static java.util.Objects.requireNonNull;

/**
 * Immutable map-backed graph state. Every update returns a new instance, so the same
 * state can be handed to several parallel branches safely.
 */
public final class MapState {

	private static final MapState EMPTY = new MapState(Map.of());

	private final Map<String, Object> data;

	private MapState(Map<String, Object> data) {
		this.data = data;
	}

	public static MapState of() {
		return EMPTY;
	}

	public static MapState of(String key, Object value) {
		return EMPTY.with(key, value);
	}

	public static MapState of(Map<String, Object> data) {
		requireNonNull(data, "data cannot be null");
		data.forEach((key, value) -> requireNonNull(value, () -> "value of '" + key + "' cannot be null"));
		return new MapState(Collections.unmodifiableMap(new LinkedHashMap<>(data)));
	}

	/**
	 * Merger overlaying the branch results on the original state in declared order, so a
	 * key written by several branches keeps the value of the last one.
	 */
	public static StateMerger<MapState> overlayMerger() {
		return (original, results) -> {
			MapState merged = original;
			for (MapState result : results) {
				merged = merged.withAll(result.data());
			}
			return merged;
		};
	}

	public Map<String, Object> data() {
		return data;
	}

	public Optional<Object> value(String key) {
		return Optional.ofNullable(data.get(key));
	}

	public <T> Optional<T> value(String key, Class<T> type) {
		return value(key).filter(type::isInstance).map(type::cast);
	}

	@SuppressWarnings("unchecked")
	public <T> T value(String key, T defaultValue) {
		return (T) data.getOrDefault(key, defaultValue);
	}

	public <T> List<T> listValue(String key, Class<T> elementType) {
		return value(key, List.class).map(list -> ((List<?>) list).stream().map(elementType::cast).toList())
			.orElse(List.of());
	}

	public boolean containsKey(String key) {
		return data.containsKey(key);
	}

	public MapState with(String key, Object value) {
		requireNonNull(key, "key cannot be null");
		requireNonNull(value, "value cannot be null");
		Map<String, Object> copy = new LinkedHashMap<>(data);
		copy.put(key, value);
		return new MapState(Collections.unmodifiableMap(copy));
	}

	public MapState withAll(Map<String, Object> updates) {
		if (updates.isEmpty()) {
			return this;
		}
		Map<String, Object> copy = new LinkedHashMap<>(data);
		copy.putAll(updates);
		return of(copy);
	}

	public MapState without(String key) {
		if (!data.containsKey(key)) {
			return this;
		}
		Map<String, Object> copy = new LinkedHashMap<>(data);
		copy.remove(key);
		return new MapState(Collections.unmodifiableMap(copy));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MapState that)) {
			return false;
		}
		return Objects.equals(data, that.data);
	}

	@Override
	public int hashCode() {
		return data.hashCode();
	}

	@Override
	public String toString() {
		return "MapState" + data;
	}

}
