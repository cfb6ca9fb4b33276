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
package io.weaveflow.graph.internal.edge;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.weaveflow.graph.StateGraph;
import io.weaveflow.graph.exception.Errors;
import io.weaveflow.graph.exception.GraphStateException;

/**
 * The single outgoing edge of a node.
 *
 * @param <S> the state type
 */
public interface Edge<S> {

	String sourceId();

	/**
	 * Resolves the next node(s) against the state produced by the source node. An empty
	 * list means the run ends.
	 */
	List<String> resolve(S state) throws Exception;

	/**
	 * @return the targets known before the run, in declaration order
	 */
	List<String> declaredTargets();

	default boolean isParallel() {
		return false;
	}

	default Optional<String> description() {
		return Optional.empty();
	}

	/**
	 * Checks that the source and every declared target refer to existing nodes.
	 */
	default void validate(StateGraph.Nodes<S> nodes) throws GraphStateException {
		if (!nodes.anyMatchById(sourceId())) {
			throw Errors.missingNodeReferencedByEdge.exception(sourceId());
		}
		for (String target : declaredTargets()) {
			if (!Objects.equals(target, StateGraph.END) && !nodes.anyMatchById(target)) {
				throw Errors.missingEdgeTarget.exception(sourceId(), target);
			}
		}
	}

}
