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

import java.time.Instant;

import org.springframework.lang.Nullable;

/**
 * One entry of a {@link TracingHandler} trace.
 *
 * @param data the input (start) or output (end) when data capture is on, otherwise null
 * @param error the failure of an {@link Type#ERROR} event
 * @param depth nesting level, 0 for the outermost execution
 */
public record TraceEvent(Instant timestamp, Type eventType, String componentName, String componentType,
		@Nullable Object data, @Nullable Throwable error, int depth) {

	public enum Type {

		START("start"), END("end"), ERROR("error"), STREAM_START("streamStart"), STREAM_END("streamEnd");

		private final String value;

		Type(String value) {
			this.value = value;
		}

		public String getValue() {
			return value;
		}

	}

	@Override
	public String toString() {
		String indent = "  ".repeat(depth);
		return switch (eventType) {
			case START -> "%s[START] %s - %s (%s)".formatted(indent, timestamp, componentName, componentType);
			case END -> "%s[END]   %s - %s".formatted(indent, timestamp, componentName);
			case ERROR -> "%s[ERROR] %s - %s: %s".formatted(indent, timestamp, componentName, error);
			case STREAM_START -> "%s[STREAM START] %s - %s".formatted(indent, timestamp, componentName);
			case STREAM_END -> "%s[STREAM END]   %s - %s".formatted(indent, timestamp, componentName);
		};
	}

}
