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
import io.weaveflow.graph.callback.RunInfo;
import org.springframework.lang.Nullable;

/**
 * Observation context of one execution reported through the callback chain.
 */
public class RunObservationContext extends Observation.Context {

	private final RunInfo runInfo;

	@Nullable
	private final Object input;

	@Nullable
	private Object output;

	public RunObservationContext(RunInfo runInfo, @Nullable Object input) {
		this.runInfo = runInfo;
		this.input = input;
	}

	public RunInfo getRunInfo() {
		return runInfo;
	}

	@Nullable
	public Object getInput() {
		return input;
	}

	@Nullable
	public Object getOutput() {
		return output;
	}

	public void setOutput(@Nullable Object output) {
		this.output = output;
	}

}
