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
package io.weaveflow.graph.diagram;

import java.util.List;
import java.util.Map;

import io.weaveflow.graph.GraphRepresentation;
import io.weaveflow.graph.StateGraph;
import io.weaveflow.graph.state.MapState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.weaveflow.graph.StateGraph.END;
import static io.weaveflow.graph.action.AsyncEdgeAction.edge_async;
import static io.weaveflow.graph.action.AsyncNodeAction.node_async;
import static org.junit.jupiter.api.Assertions.*;

class MermaidGeneratorTest {

	private StateGraph<MapState> graph;

	@BeforeEach
	void setUp() throws Exception {
		graph = new StateGraph<MapState>().addNode("agent", node_async(state -> state))
			.addNode("tool", node_async(state -> state))
			.addNode("left", node_async(state -> state))
			.addNode("right", node_async(state -> state))
			.setEntryPoint("agent")
			.addConditionalEdge("agent", edge_async(state -> "tool"), "needs tool")
			.addParallelEdge("tool", List.of("left", "right"));
	}

	@Test
	void rendersHeaderNodesAndEntryEdge() {
		String content = graph.getGraph(GraphRepresentation.Type.MERMAID, "Agent Flow").content();

		assertTrue(content.startsWith("---\ntitle: Agent Flow\n---\nflowchart TD\n"));
		assertTrue(content.contains("\t__START__((start))\n"));
		assertTrue(content.contains("\tagent(\"agent\")\n"));
		assertTrue(content.contains("\tcondition0{\"check state\"}\n"));
		assertTrue(content.contains("\t__START__:::__START__ --> agent:::agent\n"));
	}

	@Test
	void rendersEachEdgeKind() {
		String content = graph.getGraph(GraphRepresentation.Type.MERMAID, "flow").content();

		assertTrue(content.contains("\tagent:::agent --> condition0:::condition0\n"));
		assertTrue(content.contains("\tcondition0:::condition0 -.->|needs tool| __END__:::__END__\n"));
		assertTrue(content.contains("\ttool:::tool ==> left:::left\n"));
		assertTrue(content.contains("\ttool:::tool ==> right:::right\n"));
		// 没有出边的节点连到结束节点
		assertTrue(content.contains("\tleft:::left --> __END__:::__END__\n"));
		assertTrue(content.contains("\tclassDef __END__"));
	}

	@Test
	void conditionalEdgesCanBeCommentedOut() {
		String content = graph.getGraph(GraphRepresentation.Type.MERMAID, "flow", false).content();

		assertTrue(content.contains("\t%%\tagent:::agent --> condition0:::condition0\n"));
		assertFalse(content.contains("\t%%\ttool:::tool"));
	}

	@Test
	void routerTargetsAreLabelled() throws Exception {
		StateGraph<MapState> routed = new StateGraph<MapState>().addNode("check", node_async(state -> state))
			.addNode("yes", node_async(state -> state))
			.setEntryPoint("check")
			.addConditionalRouter("check", Map.of("yes", state -> true));

		String content = routed.getGraph(GraphRepresentation.Type.MERMAID, null).content();

		assertTrue(content.startsWith("flowchart TD\n"));
		assertTrue(content.contains("\tcondition0:::condition0 -.->|yes| yes:::yes\n"));
		assertTrue(content.contains("\tcondition0:::condition0 -.->|" + END + "| " + END + ":::" + END + "\n"));
	}

}
