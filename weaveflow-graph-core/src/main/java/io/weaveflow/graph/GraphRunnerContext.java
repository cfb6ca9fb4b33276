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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Mutable bookkeeping of one graph run. Owned by the thread driving the run; parallel
 * branches only read {@link #getConfig()}.
 */
public class GraphRunnerContext<S> {

	private final CompiledGraph<S> compiledGraph;

	private final RunnableConfig config;

	private final Consumer<NodeOutput<S>> outputListener;

	private final List<String> path = new ArrayList<>();

	private String currentNodeId;

	private S state;

	private int iteration;

	public GraphRunnerContext(CompiledGraph<S> compiledGraph, S initialState, RunnableConfig config,
			Consumer<NodeOutput<S>> outputListener) {
		this.compiledGraph = compiledGraph;
		this.state = initialState;
		this.config = config;
		this.outputListener = outputListener;
	}

	public CompiledGraph<S> getCompiledGraph() {
		return compiledGraph;
	}

	public RunnableConfig getConfig() {
		return config;
	}

	public String getCurrentNodeId() {
		return currentNodeId;
	}

	public void setCurrentNodeId(String currentNodeId) {
		this.currentNodeId = currentNodeId;
	}

	public S getState() {
		return state;
	}

	public void setState(S state) {
		this.state = state;
	}

	public int getIteration() {
		return iteration;
	}

	public int nextIteration() {
		return ++iteration;
	}

	public boolean isMaxIterationsReached() {
		return iteration >= compiledGraph.getMaxIterations();
	}

	public boolean isEndNode() {
		return Objects.equals(currentNodeId, StateGraph.END);
	}

	public List<String> getPath() {
		return List.copyOf(path);
	}

	public void addToPath(String nodeId) {
		path.add(nodeId);
	}

	public void emit(String nodeId) {
		outputListener.accept(NodeOutput.of(nodeId, state, iteration));
	}

	public GraphResult<S> toResult() {
		return new GraphResult<>(state, path, iteration);
	}

}
