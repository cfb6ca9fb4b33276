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
package io.weaveflow.graph.internal.node;

import java.util.Objects;
import java.util.Optional;

import io.weaveflow.graph.StateGraph;
import io.weaveflow.graph.action.AsyncNodeActionWithConfig;
import io.weaveflow.graph.exception.Errors;
import io.weaveflow.graph.exception.GraphStateException;

import static java.lang.String.format;

/**
 * A named state transform in a graph.
 *
 * @param <S> the state type
 */
public class Node<S> {

	// 私有节点前缀，保留给框架内部使用
	public static final String PRIVATE_PREFIX = "__";

	private final String id;

	private final String description;

	private final AsyncNodeActionWithConfig<S> action;

	public Node(String id, String description, AsyncNodeActionWithConfig<S> action) {
		this.id = id;
		this.description = description;
		this.action = action;
	}

	public Node(String id, AsyncNodeActionWithConfig<S> action) {
		this(id, null, action);
	}

	public void validate() throws GraphStateException {
		if (Objects.equals(id, StateGraph.END) || Objects.equals(id, StateGraph.START)) {
			throw Errors.invalidNodeIdentifier.exception(id);
		}
		if (id == null || id.isBlank()) {
			throw Errors.invalidNodeIdentifier.exception("blank");
		}
		if (id.startsWith(PRIVATE_PREFIX)) {
			throw Errors.invalidNodeIdentifier.exception(format("an id that starts with %s", PRIVATE_PREFIX));
		}
	}

	public String id() {
		return id;
	}

	public Optional<String> description() {
		return Optional.ofNullable(description);
	}

	public AsyncNodeActionWithConfig<S> action() {
		return action;
	}

	public boolean isParallel() {
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o instanceof Node<?> node) {
			return Objects.equals(id, node.id);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		return format("Node(%s,%s)", id, action != null ? "action" : "null");
	}

}
