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

import static java.util.Objects.requireNonNull;

/**
 * Unconditional edge to a single target.
 */
public record DirectEdge<S>(String sourceId, String targetId) implements Edge<S> {

	public DirectEdge {
		requireNonNull(sourceId, "sourceId cannot be null");
		requireNonNull(targetId, "targetId cannot be null");
	}

	@Override
	public List<String> resolve(S state) {
		return List.of(targetId);
	}

	@Override
	public List<String> declaredTargets() {
		return List.of(targetId);
	}

}
