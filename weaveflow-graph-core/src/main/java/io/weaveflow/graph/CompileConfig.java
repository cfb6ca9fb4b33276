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

import java.util.Optional;
import java.util.concurrent.Executor;

import static java.lang.String.format;

/**
 * Options fixed when a {@link StateGraph} is compiled.
 */
public final class CompileConfig {

	public static final int DEFAULT_RECURSION_LIMIT = 100;

	private int recursionLimit = DEFAULT_RECURSION_LIMIT;

	private Executor executor;

	private CompileConfig() {
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the maximum number of node executions (and parallel fan-outs) per run
	 */
	public int recursionLimit() {
		return recursionLimit;
	}

	/**
	 * @return the executor for parallel branches, if one was configured
	 */
	public Optional<Executor> executor() {
		return Optional.ofNullable(executor);
	}

	public static class Builder {

		private final CompileConfig config = new CompileConfig();

		private Builder() {
		}

		public Builder recursionLimit(int recursionLimit) {
			if (recursionLimit <= 0) {
				throw new IllegalArgumentException(format("recursionLimit must be > 0, was %d", recursionLimit));
			}
			config.recursionLimit = recursionLimit;
			return this;
		}

		public Builder executor(Executor executor) {
			config.executor = executor;
			return this;
		}

		public CompileConfig build() {
			return config;
		}

	}

}
