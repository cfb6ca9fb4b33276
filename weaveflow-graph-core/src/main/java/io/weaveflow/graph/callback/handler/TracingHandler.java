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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackHandler;
import io.weaveflow.graph.callback.CallbackInput;
import io.weaveflow.graph.callback.CallbackOutput;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.streaming.ChannelReader;
import org.springframework.lang.Nullable;

/**
 * Records an ordered trace of observed executions with their nesting depth. The depth
 * travels in the callback context under {@value #DEPTH_KEY}: a start records at the
 * current depth and hands the next depth to nested executions, an end or error records
 * one level up. Executions deeper than {@code maxDepth} are tracked but not recorded.
 */
public class TracingHandler implements CallbackHandler {

	public static final String DEPTH_KEY = "_trace_depth";

	public static final int DEFAULT_MAX_DEPTH = 10;

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule())
		.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	private final boolean captureData;

	private final int maxDepth;

	private final List<TraceEvent> events = new CopyOnWriteArrayList<>();

	public TracingHandler() {
		this(false, DEFAULT_MAX_DEPTH);
	}

	/**
	 * @param captureData keep inputs and outputs in start and end events
	 * @param maxDepth executions at this depth or deeper are not recorded
	 */
	public TracingHandler(boolean captureData, int maxDepth) {
		this.captureData = captureData;
		this.maxDepth = maxDepth;
	}

	public List<TraceEvent> getEvents() {
		return List.copyOf(events);
	}

	public List<TraceEvent> getEventsFor(String componentName) {
		return events.stream().filter(e -> e.componentName().equals(componentName)).toList();
	}

	public void clear() {
		events.clear();
	}

	@Override
	public CallbackContext onStart(CallbackContext context, RunInfo info, CallbackInput input) {
		int depth = depth(context);
		record(TraceEvent.Type.START, info, captureData ? input.data() : null, null, depth);
		return context.with(DEPTH_KEY, depth + 1);
	}

	@Override
	public CallbackContext onEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		int depth = Math.max(depth(context) - 1, 0);
		record(TraceEvent.Type.END, info, captureData ? output.data() : null, null, depth);
		return context.with(DEPTH_KEY, depth);
	}

	@Override
	public CallbackContext onError(CallbackContext context, RunInfo info, Throwable error) {
		int depth = Math.max(depth(context) - 1, 0);
		record(TraceEvent.Type.ERROR, info, null, error, depth);
		return context.with(DEPTH_KEY, depth);
	}

	@Override
	public CallbackContext onStartWithStreamInput(CallbackContext context, RunInfo info, ChannelReader<?> input) {
		int depth = depth(context);
		record(TraceEvent.Type.STREAM_START, info, null, null, depth);
		return context.with(DEPTH_KEY, depth + 1);
	}

	@Override
	public CallbackContext onEndWithStreamOutput(CallbackContext context, RunInfo info, ChannelReader<?> output) {
		int depth = Math.max(depth(context) - 1, 0);
		record(TraceEvent.Type.STREAM_END, info, null, null, depth);
		return context.with(DEPTH_KEY, depth);
	}

	/**
	 * Time from the latest start to the following end of each component, by component
	 * name in order of first completion.
	 */
	public Map<String, Duration> getTimeline() {
		Map<String, Duration> timeline = new LinkedHashMap<>();
		Map<String, Instant> startTimes = new HashMap<>();
		for (TraceEvent event : events) {
			switch (event.eventType()) {
				case START, STREAM_START -> startTimes.put(event.componentName(), event.timestamp());
				case END, STREAM_END -> {
					Instant start = startTimes.get(event.componentName());
					if (start != null) {
						timeline.put(event.componentName(), Duration.between(start, event.timestamp()));
					}
				}
				default -> {
				}
			}
		}
		return timeline;
	}

	/**
	 * Exports the trace as a JSON array. Captured data and errors are rendered with
	 * {@code toString()}.
	 */
	public String toJson() {
		List<Map<String, Object>> rows = new ArrayList<>();
		for (TraceEvent event : events) {
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("timestamp", event.timestamp());
			row.put("eventType", event.eventType().getValue());
			row.put("componentName", event.componentName());
			row.put("componentType", event.componentType());
			row.put("depth", event.depth());
			if (event.data() != null) {
				row.put("data", String.valueOf(event.data()));
			}
			if (event.error() != null) {
				row.put("error", event.error().toString());
			}
			rows.add(row);
		}
		try {
			return OBJECT_MAPPER.writeValueAsString(rows);
		}
		catch (JsonProcessingException e) {
			throw new RuntimeException("Failed to serialize trace events", e);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("=== Execution Trace ===\n");
		events.forEach(event -> sb.append(event).append('\n'));
		return sb.append("=======================").toString();
	}

	private void record(TraceEvent.Type type, RunInfo info, @Nullable Object data, @Nullable Throwable error,
			int depth) {
		if (depth < maxDepth) {
			events.add(new TraceEvent(Instant.now(), type, info.name(), info.type(), data, error, depth));
		}
	}

	private static int depth(CallbackContext context) {
		return context.get(DEPTH_KEY, Integer.class).orElse(0);
	}

}
