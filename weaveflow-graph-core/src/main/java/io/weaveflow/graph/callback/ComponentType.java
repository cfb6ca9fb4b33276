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

/**
 * Abstract category of an observed component.
 */
public enum ComponentType {

	CHAT_MODEL("chat_model"),

	TOOL("tool"),

	CHAIN("chain"),

	RETRIEVER("retriever"),

	EMBEDDER("embedder"),

	PROMPT_TEMPLATE("prompt_template"),

	RUNNABLE("runnable"),

	AGENT("agent"),

	GRAPH("graph"),

	GRAPH_NODE("graph_node"),

	CUSTOM("custom");

	private final String value;

	ComponentType(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

}
