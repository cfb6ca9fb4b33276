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

import static java.lang.String.format;

/**
 * Message templates for graph run-time errors.
 */
public enum RunnableErrors {

	missingNode("node: '%s' not found!"),

	missingRoute("router of node '%s' returned unknown route '%s'!"),

	nodeExecutionError("node '%s' failed: %s"),

	routingError("resolving the edge from node '%s' failed: %s"),

	mergeError("merging the parallel results of '%s' failed: %s"),

	executionError("%s");

	private final String errorMessage;

	RunnableErrors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public GraphRunnerException exception(Object... args) {
		return new GraphRunnerException(format(errorMessage, args));
	}

	public GraphRunnerException exception(Throwable cause, Object... args) {
		return new GraphRunnerException(format(errorMessage, args), cause);
	}

}
