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
 * Message templates for graph declaration errors.
 */
public enum Errors {

	invalidNodeIdentifier("node id cannot be %s!"),

	invalidEdgeIdentifier("edge source cannot be %s!"),

	duplicateNodeError("node with id: %s already exist!"),

	duplicateEdgeError("edge from '%s' already exist!"),

	duplicateEdgeTargetError("edge [%s] has duplicate targets %s!"),

	emptyParallelEdge("parallel edge from '%s' must have at least one target!"),

	missingEntryPoint("missing Entry Point"),

	entryPointNotExist("entryPoint: %s does not exist!"),

	missingNodeReferencedByEdge("edge sourceId '%s' refers to undefined node!"),

	missingEdgeTarget("edge from '%s' refers to undefined target node '%s'!"),

	invalidParallelTarget("parallel edge from '%s' cannot target '%s'!");

	private final String errorMessage;

	Errors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public GraphStateException exception(Object... args) {
		return new GraphStateException(format(errorMessage, args));
	}

}
