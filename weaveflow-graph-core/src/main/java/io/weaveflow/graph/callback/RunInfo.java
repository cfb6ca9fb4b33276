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

import static java.util.Objects.requireNonNull;

/**
 * Identity of one observed execution.
 *
 * @param name instance name, e.g. a node id
 * @param type concrete type tag, e.g. {@code "Lambda"}
 * @param componentType abstract category
 * @param metadata free-form descriptive data
 */
public record RunInfo(String name, String type, ComponentType componentType, Map<String, Object> metadata) {

	public RunInfo {
		requireNonNull(name, "name cannot be null");
		requireNonNull(type, "type cannot be null");
		requireNonNull(componentType, "componentType cannot be null");
		metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public static RunInfo of(String name, String type, ComponentType componentType) {
		return new RunInfo(name, type, componentType, Map.of());
	}

	public RunInfo withMetadata(Map<String, Object> extra) {
		Map<String, Object> merged = new LinkedHashMap<>(metadata);
		merged.putAll(extra);
		return new RunInfo(name, type, componentType, merged);
	}

}
