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
package io.weaveflow.graph.observation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackManager;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ObservationCallbackHandlerTest {

	private static final RunInfo GRAPH = RunInfo.of("pipeline", "StateGraph", ComponentType.GRAPH);

	private static final RunInfo NODE = RunInfo.of("fetch", "GraphNode", ComponentType.GRAPH_NODE);

	private final List<Observation.Context> stopped = new CopyOnWriteArrayList<>();

	private CallbackManager manager;

	@BeforeEach
	void setUp() {
		ObservationRegistry registry = ObservationRegistry.create();
		registry.observationConfig().observationHandler(new ObservationHandler<Observation.Context>() {
			@Override
			public void onStop(Observation.Context context) {
				stopped.add(context);
			}

			@Override
			public boolean supportsContext(Observation.Context context) {
				return true;
			}
		});
		manager = CallbackManager.of(new ObservationCallbackHandler(registry));
	}

	@Test
	void nestedRunsBecomeChildObservations() throws Exception {
		manager.runWithCallbacks(CallbackContext.empty(), GRAPH, "in",
				ctx -> manager.runWithCallbacks(ctx, NODE, "node-in", inner -> "node-out"));

		assertEquals(2, stopped.size());
		Observation.Context node = stopped.get(0);
		Observation.Context graph = stopped.get(1);
		assertEquals("weaveflow.run", node.getName());
		assertEquals("weaveflow.run.fetch", node.getContextualName());
		assertEquals("graph_node", node.getLowCardinalityKeyValue("weaveflow.kind").getValue());
		assertEquals("node-out", node.getHighCardinalityKeyValue("weaveflow.run.output").getValue());
		assertSame(graph, node.getParentObservation().getContextView());
		assertNull(graph.getParentObservation());
	}

	@Test
	void failuresAreAttachedToTheObservation() {
		IllegalStateException failure = new IllegalStateException("down");

		assertThrows(IllegalStateException.class,
				() -> manager.runWithCallbacks(CallbackContext.empty(), GRAPH, "in", ctx -> {
					throw failure;
				}));

		assertEquals(1, stopped.size());
		assertSame(failure, stopped.get(0).getError());
		assertEquals("pipeline", stopped.get(0).getLowCardinalityKeyValue("weaveflow.component.name").getValue());
		assertNull(stopped.get(0).getHighCardinalityKeyValue("weaveflow.run.output"));
	}

}
