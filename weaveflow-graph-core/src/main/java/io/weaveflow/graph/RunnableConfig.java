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
package io.weaveflow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackManager;

import static java.util.Objects.requireNonNull;

/**
 * Per-call options for execution units and compiled graphs.
 * <p>
 * A metadata entry whose key is a node id and whose value is an {@link Executor}
 * overrides the executor used for the parallel fan-out leaving that node.
 */
public final class RunnableConfig {

	private static final RunnableConfig EMPTY = builder().build();

	private final Map<String, Object> metadata;

	private final List<String> tags;

	private final CallbackManager callbackManager;

	private final CallbackContext context;

	private final Executor executor;

	private RunnableConfig(Builder builder) {
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
		this.tags = List.copyOf(builder.tags);
		this.callbackManager = builder.callbackManager;
		this.context = builder.context;
		this.executor = builder.executor;
	}

	public static RunnableConfig empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Builder builder(RunnableConfig config) {
		return new Builder(config);
	}

	public Map<String, Object> metadata() {
		return metadata;
	}

	public Optional<Object> metadata(String key) {
		return Optional.ofNullable(metadata.get(key));
	}

	public List<String> tags() {
		return tags;
	}

	public Optional<CallbackManager> callbackManager() {
		return Optional.ofNullable(callbackManager);
	}

	public CallbackContext context() {
		return context;
	}

	public Optional<Executor> executor() {
		return Optional.ofNullable(executor);
	}

	/**
	 * @return a copy of this config carrying the given callback context
	 */
	public RunnableConfig withContext(CallbackContext context) {
		if (this.context.equals(context)) {
			return this;
		}
		return builder(this).context(context).build();
	}

	@Override
	public String toString() {
		return "RunnableConfig{metadata=" + metadata + ", tags=" + tags + ", context=" + context + '}';
	}

	public static final class Builder {

		private final Map<String, Object> metadata = new LinkedHashMap<>();

		private final List<String> tags = new ArrayList<>();

		private CallbackManager callbackManager;

		private CallbackContext context = CallbackContext.empty();

		private Executor executor;

		private Builder() {
		}

		private Builder(RunnableConfig config) {
			this.metadata.putAll(config.metadata);
			this.tags.addAll(config.tags);
			this.callbackManager = config.callbackManager;
			this.context = config.context;
			this.executor = config.executor;
		}

		public Builder addMetadata(String key, Object value) {
			this.metadata.put(requireNonNull(key, "key cannot be null"), requireNonNull(value, "value cannot be null"));
			return this;
		}

		public Builder metadata(Map<String, Object> metadata) {
			this.metadata.putAll(metadata);
			return this;
		}

		public Builder tag(String tag) {
			this.tags.add(requireNonNull(tag, "tag cannot be null"));
			return this;
		}

		public Builder tags(List<String> tags) {
			this.tags.addAll(tags);
			return this;
		}

		public Builder callbackManager(CallbackManager callbackManager) {
			this.callbackManager = callbackManager;
			return this;
		}

		public Builder context(CallbackContext context) {
			this.context = requireNonNull(context, "context cannot be null");
			return this;
		}

		public Builder executor(Executor executor) {
			this.executor = executor;
			return this;
		}

		public RunnableConfig build() {
			return new RunnableConfig(this);
		}

	}

}
