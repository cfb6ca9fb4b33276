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
package io.weaveflow.graph.compose;

import org.springframework.lang.Nullable;

/**
 * One optional implementation per execution mode. A table built from what a component
 * implements natively is completed by {@link #derive()}.
 */
public record ModeTable<I, O>(@Nullable InvokeMode<I, O> invoke, @Nullable StreamMode<I, O> stream,
		@Nullable CollectMode<I, O> collect, @Nullable TransformMode<I, O> transform) {

	public boolean hasAny() {
		return invoke != null || stream != null || collect != null || transform != null;
	}

	public boolean isComplete() {
		return invoke != null && stream != null && collect != null && transform != null;
	}

	/**
	 * @return a table where every missing mode is derived from the present ones
	 * @throws IllegalArgumentException if no mode is present
	 */
	public ModeTable<I, O> derive() {
		return ModeDerivation.complete(this);
	}

}
