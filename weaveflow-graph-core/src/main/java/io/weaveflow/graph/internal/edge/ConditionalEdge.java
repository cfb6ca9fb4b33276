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
package io.weaveflow.graph.internal.edge;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import io.weaveflow.graph.action.AsyncEdgeAction;
import org.springframework.lang.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Edge whose single target is chosen at run time by a router returning a node id (or
 * {@link io.weaveflow.graph.StateGraph#END}).
 */
public record ConditionalEdge<S>(String sourceId, AsyncEdgeAction<S> router,
		@Nullable String label) implements Edge<S> {

	public ConditionalEdge {
		requireNonNull(sourceId, "sourceId cannot be null");
		requireNonNull(router, "router cannot be null");
	}

	@Override
	public List<String> resolve(S state) throws Exception {
		String route;
		try {
			route = router.apply(state).join();
		}
		catch (CompletionException e) {
			if (e.getCause() instanceof Exception cause) {
				throw cause;
			}
			throw e;
		}
		if (route == null) {
			throw new IllegalStateException("router of '" + sourceId + "' returned null");
		}
		return List.of(route);
	}

	@Override
	public List<String> declaredTargets() {
		return List.of();
	}

	@Override
	public Optional<String> description() {
		return Optional.ofNullable(label);
	}

}
