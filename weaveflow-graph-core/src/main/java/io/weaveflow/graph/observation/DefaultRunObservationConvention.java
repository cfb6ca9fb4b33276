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

import io.micrometer.common.KeyValue;
import io.micrometer.common.KeyValues;
import io.weaveflow.graph.observation.RunObservationDocumentation.HighCardinalityKeyNames;
import io.weaveflow.graph.observation.RunObservationDocumentation.LowCardinalityKeyNames;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public class DefaultRunObservationConvention implements RunObservationConvention {

	public static final String DEFAULT_OPERATION_NAME = "weaveflow.run";

	private final String name;

	public DefaultRunObservationConvention() {
		this(DEFAULT_OPERATION_NAME);
	}

	public DefaultRunObservationConvention(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	@Nullable
	public String getContextualName(RunObservationContext context) {
		if (StringUtils.hasText(context.getRunInfo().name())) {
			return "%s.%s".formatted(this.name, context.getRunInfo().name());
		}
		return this.name;
	}

	@Override
	public KeyValues getLowCardinalityKeyValues(RunObservationContext context) {
		return KeyValues.of(
				KeyValue.of(LowCardinalityKeyNames.KIND, context.getRunInfo().componentType().getValue()),
				KeyValue.of(LowCardinalityKeyNames.COMPONENT_NAME, context.getRunInfo().name()),
				KeyValue.of(LowCardinalityKeyNames.COMPONENT_TYPE, context.getRunInfo().type()));
	}

	@Override
	public KeyValues getHighCardinalityKeyValues(RunObservationContext context) {
		KeyValues keyValues = KeyValues.of(KeyValue.of(HighCardinalityKeyNames.INPUT, String.valueOf(context.getInput())));
		if (context.getOutput() != null) {
			keyValues = keyValues.and(KeyValue.of(HighCardinalityKeyNames.OUTPUT, context.getOutput().toString()));
		}
		return keyValues;
	}

}
