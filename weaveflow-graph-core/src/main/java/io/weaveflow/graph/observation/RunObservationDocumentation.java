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

import io.micrometer.common.docs.KeyName;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationConvention;
import io.micrometer.observation.docs.ObservationDocumentation;

/**
 * Observation emitted for every execution seen by {@link ObservationCallbackHandler}.
 */
public enum RunObservationDocumentation implements ObservationDocumentation {

	RUN {
		@Override
		public Class<? extends ObservationConvention<? extends Observation.Context>> getDefaultConvention() {
			return DefaultRunObservationConvention.class;
		}

		@Override
		public KeyName[] getLowCardinalityKeyNames() {
			return LowCardinalityKeyNames.values();
		}

		@Override
		public KeyName[] getHighCardinalityKeyNames() {
			return HighCardinalityKeyNames.values();
		}
	};

	public enum LowCardinalityKeyNames implements KeyName {

		/**
		 * Component kind, e.g. {@code graph} or {@code graph_node}.
		 */
		KIND {
			@Override
			public String asString() {
				return "weaveflow.kind";
			}
		},

		COMPONENT_NAME {
			@Override
			public String asString() {
				return "weaveflow.component.name";
			}
		},

		COMPONENT_TYPE {
			@Override
			public String asString() {
				return "weaveflow.component.type";
			}
		}

	}

	public enum HighCardinalityKeyNames implements KeyName {

		INPUT {
			@Override
			public String asString() {
				return "weaveflow.run.input";
			}
		},

		OUTPUT {
			@Override
			public String asString() {
				return "weaveflow.run.output";
			}
		}

	}

}
