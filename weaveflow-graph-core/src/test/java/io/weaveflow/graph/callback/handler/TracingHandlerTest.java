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
package io.weaveflow.graph.callback.handler;

import java.util.List;

import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackManager;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TracingHandlerTest {

	private static final RunInfo OUTER = RunInfo.of("outer", "StateGraph", ComponentType.GRAPH);

	private static final RunInfo INNER = RunInfo.of("inner", "GraphNode", ComponentType.GRAPH_NODE);

	@Test
	void nestedExecutionsAreIndented() throws Exception {
		TracingHandler tracer = new TracingHandler(true, TracingHandler.DEFAULT_MAX_DEPTH);
		CallbackManager manager = CallbackManager.of(tracer);

		manager.runWithCallbacks(CallbackContext.empty(), OUTER, "x",
				ctx -> manager.runWithCallbacks(ctx, INNER, "y", inner -> "z"));

		List<TraceEvent> events = tracer.getEvents();
		assertEquals(List.of(TraceEvent.Type.START, TraceEvent.Type.START, TraceEvent.Type.END, TraceEvent.Type.END),
				events.stream().map(TraceEvent::eventType).toList());
		assertEquals(List.of(0, 1, 1, 0), events.stream().map(TraceEvent::depth).toList());
		assertEquals("y", events.get(1).data());
		assertEquals(List.of("inner", "outer"), List.copyOf(tracer.getTimeline().keySet()));
		assertEquals(2, tracer.getEventsFor("inner").size());
	}

	@Test
	void eventsBeyondTheMaximumDepthAreDropped() throws Exception {
		TracingHandler tracer = new TracingHandler(false, 1);
		CallbackManager manager = CallbackManager.of(tracer);

		manager.runWithCallbacks(CallbackContext.empty(), OUTER, "x",
				ctx -> manager.runWithCallbacks(ctx, INNER, "y", inner -> "z"));

		assertTrue(tracer.getEventsFor("inner").isEmpty());
		assertEquals(2, tracer.getEventsFor("outer").size());
		assertNull(tracer.getEvents().get(0).data());
	}

	@Test
	void errorsCloseTheExecution() {
		TracingHandler tracer = new TracingHandler();
		CallbackManager manager = CallbackManager.of(tracer);

		assertThrows(IllegalStateException.class,
				() -> manager.runWithCallbacks(CallbackContext.empty(), OUTER, "x", ctx -> {
					throw new IllegalStateException("bad");
				}));

		TraceEvent error = tracer.getEvents().get(1);
		assertEquals(TraceEvent.Type.ERROR, error.eventType());
		assertEquals(0, error.depth());
		assertTrue(tracer.toString().contains("outer"));
	}

	@Test
	void exportsJson() throws Exception {
		TracingHandler tracer = new TracingHandler(true, TracingHandler.DEFAULT_MAX_DEPTH);
		CallbackManager.of(tracer).runWithCallbacks(CallbackContext.empty(), OUTER, "payload", ctx -> "result");

		String json = tracer.toJson();

		assertTrue(json.startsWith("["));
		assertTrue(json.contains("\"eventType\":\"start\""));
		assertTrue(json.contains("\"componentName\":\"outer\""));
		assertTrue(json.contains("\"data\":\"payload\""));
		// 时间戳按 ISO-8601 输出
		assertTrue(json.matches("(?s).*\"timestamp\":\"\\d{4}-\\d{2}-\\d{2}T.*"));

		tracer.clear();
		assertEquals("[]", tracer.toJson());
	}

}
