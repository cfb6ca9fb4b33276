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
package io.weaveflow.graph.callback.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.lang.Nullable;

/**
 * One finished execution as recorded by {@link MetricsHandler}.
 *
 * @param error the failure, or null when the execution succeeded
 */
public record ExecutionMetrics(String componentName, String componentType, Instant startTime, Instant endTime,
		@Nullable Throwable error, Map<String, Object> metadata) {

	public ExecutionMetrics {
		metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public Duration duration() {
		return Duration.between(startTime, endTime);
	}

	public boolean isSuccess() {
		return error == null;
	}

	public boolean isFailed() {
		return error != null;
	}

}
