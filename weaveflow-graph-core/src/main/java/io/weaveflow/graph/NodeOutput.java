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

import java.util.Objects;

import io.weaveflow.graph.internal.node.ParallelNode;

import static java.lang.String.format;

/**
 * State observed after one step of a streamed graph run.
 */
public class NodeOutput<S> {

	private final String node;

	private final S state;

	private final int iteration;

	protected NodeOutput(String node, S state, int iteration) {
		this.node = node;
		this.state = state;
		this.iteration = iteration;
	}

	public static <S> NodeOutput<S> of(String node, S state, int iteration) {
		return new NodeOutput<>(node, state, iteration);
	}

	public String node() {
		return node;
	}

	public S state() {
		return state;
	}

	public int iteration() {
		return iteration;
	}

	public boolean isStart() {
		return Objects.equals(node, StateGraph.START);
	}

	public boolean isEnd() {
		return Objects.equals(node, StateGraph.END);
	}

	public boolean isParallel() {
		return node.startsWith(ParallelNode.PARALLEL_PREFIX);
	}

	@Override
	public String toString() {
		return format("NodeOutput{node=%s, iteration=%d, state=%s}", node, iteration, state);
	}

}
