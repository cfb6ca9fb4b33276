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

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackHandler;
import io.weaveflow.graph.callback.CallbackInput;
import io.weaveflow.graph.callback.CallbackOutput;
import io.weaveflow.graph.callback.RunInfo;
import org.springframework.lang.Nullable;

/**
 * Bridges the callback chain to Micrometer: every observed execution becomes one
 * {@link Observation}, started on start and stopped on end or error. The running
 * observation is carried in the callback context under {@value #OBSERVATION_KEY}, so
 * executions started from that context (graph nodes under their graph, for instance)
 * become child observations.
 */
public class ObservationCallbackHandler implements CallbackHandler {

	public static final String OBSERVATION_KEY = "_observation";

	private static final RunObservationConvention DEFAULT_CONVENTION = new DefaultRunObservationConvention();

	private final ObservationRegistry registry;

	@Nullable
	private final RunObservationConvention customConvention;

	public ObservationCallbackHandler(ObservationRegistry registry) {
		this(registry, null);
	}

	public ObservationCallbackHandler(ObservationRegistry registry, @Nullable RunObservationConvention customConvention) {
		this.registry = registry;
		this.customConvention = customConvention;
	}

	@Override
	public CallbackContext onStart(CallbackContext context, RunInfo info, CallbackInput input) {
		RunObservationContext observationContext = new RunObservationContext(info, input.data());
		Observation observation = RunObservationDocumentation.RUN.observation(customConvention, DEFAULT_CONVENTION,
				() -> observationContext, registry);
		context.get(OBSERVATION_KEY, Observation.class).ifPresent(observation::parentObservation);
		observation.start();
		return context.with(OBSERVATION_KEY, observation);
	}

	@Override
	public CallbackContext onEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		context.get(OBSERVATION_KEY, Observation.class).ifPresent(observation -> {
			if (observation.getContext() instanceof RunObservationContext runContext) {
				runContext.setOutput(output.data());
			}
			observation.stop();
		});
		return context;
	}

	@Override
	public CallbackContext onError(CallbackContext context, RunInfo info, Throwable error) {
		context.get(OBSERVATION_KEY, Observation.class).ifPresent(observation -> {
			observation.error(error);
			observation.stop();
		});
		return context;
	}

}
