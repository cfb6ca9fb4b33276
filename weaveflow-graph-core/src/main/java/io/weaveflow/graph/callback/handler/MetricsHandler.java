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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackHandler;
import io.weaveflow.graph.callback.CallbackInput;
import io.weaveflow.graph.callback.CallbackOutput;
import io.weaveflow.graph.callback.RunInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Times every observed execution. Each finished run is recorded twice: as a sample of
 * the {@value #TIMER_NAME} timer in the meter registry, tagged by name, type, component
 * and outcome, and as an {@link ExecutionMetrics} entry kept in memory for
 * {@link #summary()}.
 * <p>
 * The start instant travels in the callback context, so nested and concurrent runs are
 * timed independently.
 */
public class MetricsHandler implements CallbackHandler {

	public static final String TIMER_NAME = "weaveflow.run.duration";

	static final String START_TIME_KEY = "_metrics_start_time";

	static final String START_NANOS_KEY = "_metrics_start_nanos";

	private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

	private final MeterRegistry registry;

	private final boolean autoLog;

	private final List<ExecutionMetrics> metrics = new CopyOnWriteArrayList<>();

	public MetricsHandler() {
		this(new SimpleMeterRegistry(), false);
	}

	public MetricsHandler(MeterRegistry registry) {
		this(registry, false);
	}

	/**
	 * @param autoLog log each finished execution at {@code info}
	 */
	public MetricsHandler(MeterRegistry registry, boolean autoLog) {
		this.registry = registry;
		this.autoLog = autoLog;
	}

	public MeterRegistry getRegistry() {
		return registry;
	}

	public List<ExecutionMetrics> getMetrics() {
		return List.copyOf(metrics);
	}

	public List<ExecutionMetrics> getMetricsFor(String componentName) {
		return metrics.stream().filter(m -> m.componentName().equals(componentName)).toList();
	}

	public Optional<Duration> getAverageDuration(String componentName) {
		return average(getMetricsFor(componentName));
	}

	public void clear() {
		metrics.clear();
	}

	@Override
	public CallbackContext onStart(CallbackContext context, RunInfo info, CallbackInput input) {
		return context.with(START_TIME_KEY, Instant.now()).with(START_NANOS_KEY, System.nanoTime());
	}

	@Override
	public CallbackContext onEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		record(context, info, null);
		return context;
	}

	@Override
	public CallbackContext onError(CallbackContext context, RunInfo info, Throwable error) {
		record(context, info, error);
		return context;
	}

	/**
	 * Human readable totals: executions, successes, failures, mean duration, and one line
	 * per component.
	 */
	public String summary() {
		List<ExecutionMetrics> snapshot = new ArrayList<>(metrics);
		StringBuilder sb = new StringBuilder();
		sb.append("=== Execution Metrics Summary ===\n");
		sb.append("Total executions: ").append(snapshot.size()).append('\n');
		sb.append("Successful: ").append(snapshot.stream().filter(ExecutionMetrics::isSuccess).count()).append('\n');
		sb.append("Failed: ").append(snapshot.stream().filter(ExecutionMetrics::isFailed).count()).append('\n');
		if (!snapshot.isEmpty()) {
			sb.append("Average duration: ").append(average(snapshot).orElse(Duration.ZERO).toMillis()).append("ms\n");
			Map<String, List<ExecutionMetrics>> byComponent = new LinkedHashMap<>();
			for (ExecutionMetrics m : snapshot) {
				byComponent.computeIfAbsent(m.componentName(), k -> new ArrayList<>()).add(m);
			}
			sb.append("By component:\n");
			byComponent.forEach((name, list) -> sb.append("  ")
				.append(name)
				.append(": ")
				.append(list.size())
				.append(" calls, avg ")
				.append(average(list).orElse(Duration.ZERO).toMillis())
				.append("ms\n"));
		}
		return sb.toString();
	}

	private void record(CallbackContext context, RunInfo info, @Nullable Throwable error) {
		Optional<Long> startNanos = context.get(START_NANOS_KEY, Long.class);
		if (startNanos.isEmpty()) {
			log.debug("no start time in context for '{}', execution not timed", info.name());
			return;
		}
		Duration duration = Duration.ofNanos(System.nanoTime() - startNanos.get());
		Instant startTime = context.get(START_TIME_KEY, Instant.class).orElseGet(() -> Instant.now().minus(duration));

		Timer.builder(TIMER_NAME)
			.description("Duration of observed executions")
			.tag("name", info.name())
			.tag("type", info.type())
			.tag("component", info.componentType().getValue())
			.tag("outcome", error == null ? "success" : "error")
			.register(registry)
			.record(duration);

		metrics.add(new ExecutionMetrics(info.name(), info.type(), startTime, startTime.plus(duration), error,
				info.metadata()));
		if (autoLog) {
			if (error == null) {
				log.info("[metrics] {}: {}ms", info.name(), duration.toMillis());
			}
			else {
				log.info("[metrics] {} FAILED: {}ms - {}", info.name(), duration.toMillis(), error.toString());
			}
		}
	}

	private static Optional<Duration> average(List<ExecutionMetrics> list) {
		if (list.isEmpty()) {
			return Optional.empty();
		}
		long totalNanos = list.stream().mapToLong(m -> m.duration().toNanos()).sum();
		return Optional.of(Duration.ofNanos(totalNanos / list.size()));
	}

}
