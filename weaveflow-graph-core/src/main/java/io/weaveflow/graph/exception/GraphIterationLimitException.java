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
package io.weaveflow.graph.exception;

import java.util.List;

import static java.lang.String.format;

/**
 * Raised when a run reaches the configured recursion limit before reaching the end node.
 */
public class GraphIterationLimitException extends GraphRunnerException {

	private final int limit;

	private final List<String> path;

	public GraphIterationLimitException(int limit, List<String> path) {
		super(format("Maximum number of iterations (%d) reached; iteration ceiling exceeded", limit));
		this.limit = limit;
		this.path = List.copyOf(path);
	}

	public int getLimit() {
		return limit;
	}

	/**
	 * @return the nodes visited before the run was aborted
	 */
	public List<String> getPath() {
		return path;
	}

}
