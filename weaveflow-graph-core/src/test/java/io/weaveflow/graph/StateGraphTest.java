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
import java.util.Map;

import io.weaveflow.graph.action.AsyncNodeAction;
import io.weaveflow.graph.exception.GraphStateException;
import io.weaveflow.graph.state.MapState;
import org.junit.jupiter.api.Test;

import static io.weaveflow.graph.StateGraph.END;
import static io.weaveflow.graph.StateGraph.START;
import static io.weaveflow.graph.action.AsyncEdgeAction.edge_async;
import static io.weaveflow.graph.action.AsyncNodeAction.node_async;
import static org.junit.jupiter.api.Assertions.*;

class StateGraphTest {

	private static final AsyncNodeAction<MapState> IDENTITY = node_async(state -> state);

	@Test
	void duplicateNodeIsRejected() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY);

		GraphStateException e = assertThrows(GraphStateException.class, () -> graph.addNode("a", IDENTITY));
		assertEquals("node with id: a already exist!", e.getMessage());
	}

	@Test
	void reservedAndBlankIdsAreRejected() {
		StateGraph<MapState> graph = new StateGraph<>();

		assertThrows(GraphStateException.class, () -> graph.addNode(END, IDENTITY));
		assertThrows(GraphStateException.class, () -> graph.addNode(START, IDENTITY));
		assertThrows(GraphStateException.class, () -> graph.addNode("__hidden", IDENTITY));
		assertThrows(GraphStateException.class, () -> graph.addNode(" ", IDENTITY));
	}

	@Test
	void secondOutgoingEdgeIsRejected() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addNode("b", IDENTITY)
			.addEdge("a", "b");

		GraphStateException e = assertThrows(GraphStateException.class, () -> graph.addEdge("a", END));
		assertEquals("edge from 'a' already exist!", e.getMessage());
		assertThrows(GraphStateException.class,
				() -> graph.addConditionalEdge("a", edge_async(state -> END)));
	}

	@Test
	void endCannotBeAnEdgeSource() {
		StateGraph<MapState> graph = new StateGraph<>();

		assertThrows(GraphStateException.class, () -> graph.addEdge(END, "a"));
	}

	@Test
	void startEdgeSetsTheEntryPoint() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY).addEdge(START, "a");

		assertEquals("a", graph.getEntryPoint().orElseThrow());
		assertTrue(graph.edges().isEmpty());
	}

	@Test
	void emptyParallelEdgeIsRejected() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY);

		assertThrows(GraphStateException.class, () -> graph.addParallelEdge("a", List.of()));
	}

	@Test
	void compileRequiresAnExistingEntryPoint() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY);

		assertEquals("missing Entry Point", assertThrows(GraphStateException.class, graph::compile).getMessage());

		graph.setEntryPoint("missing");
		assertEquals("entryPoint: missing does not exist!",
				assertThrows(GraphStateException.class, graph::compile).getMessage());
	}

	@Test
	void compileRejectsEdgesToUndefinedNodes() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addEdge("a", "ghost")
			.setEntryPoint("a");

		GraphStateException e = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("edge from 'a' refers to undefined target node 'ghost'!", e.getMessage());
	}

	@Test
	void compileRejectsEdgesFromUndefinedNodes() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addEdge("ghost", "a")
			.setEntryPoint("a");

		assertThrows(GraphStateException.class, graph::compile);
	}

	@Test
	void compileChecksMultiRouteTargets() throws Exception {
		StateGraph<MapState> graph = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addConditionalRouter("a", Map.of("ghost", state -> true))
			.setEntryPoint("a");

		assertThrows(GraphStateException.class, graph::compile);
	}

	@Test
	void compileRejectsInvalidParallelTargets() throws Exception {
		StateGraph<MapState> toEnd = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addNode("b", IDENTITY)
			.addParallelEdge("a", List.of("b", END))
			.setEntryPoint("a");
		StateGraph<MapState> duplicated = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addNode("b", IDENTITY)
			.addParallelEdge("a", List.of("b", "b"))
			.setEntryPoint("a");
		StateGraph<MapState> undefined = new StateGraph<MapState>().addNode("a", IDENTITY)
			.addParallelEdge("a", List.of("ghost"))
			.setEntryPoint("a");

		assertEquals("parallel edge from 'a' cannot target '__END__'!",
				assertThrows(GraphStateException.class, toEnd::compile).getMessage());
		assertThrows(GraphStateException.class, duplicated::compile);
		assertThrows(GraphStateException.class, undefined::compile);
	}

	@Test
	void recursionLimitMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> CompileConfig.builder().recursionLimit(0));
		assertEquals(CompileConfig.DEFAULT_RECURSION_LIMIT, CompileConfig.builder().build().recursionLimit());
	}

}
