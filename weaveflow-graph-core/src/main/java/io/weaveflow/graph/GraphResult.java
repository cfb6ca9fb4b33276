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

import java.util.List;

/**
 * Outcome of one successful graph run.
 *
 * @param state the final state
 * @param path the nodes the run moved through, in execution order, without the targets of
 * parallel fan-outs
 * @param iterations iterations consumed against the recursion limit
 */
public record GraphResult<S>(S state, List<String> path, int iterations) {

	public GraphResult {
		path = List.copyOf(path);
	}

}
