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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Edge choosing the first route, in declaration order, whose predicate holds for the
 * state; the default route when none does. Only one route is ever taken.
 *
 * @param routes target node id to predicate, iterated in declaration order
 */
public record MultiRouteEdge<S>(String sourceId, Map<String, Predicate<S>> routes,
		String defaultRoute) implements Edge<S> {

	public MultiRouteEdge {
		requireNonNull(sourceId, "sourceId cannot be null");
		requireNonNull(routes, "routes cannot be null");
		requireNonNull(defaultRoute, "defaultRoute cannot be null");
		routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
	}

	@Override
	public List<String> resolve(S state) {
		for (Map.Entry<String, Predicate<S>> route : routes.entrySet()) {
			if (route.getValue().test(state)) {
				return List.of(route.getKey());
			}
		}
		return List.of(defaultRoute);
	}

	@Override
	public List<String> declaredTargets() {
		List<String> targets = new ArrayList<>(routes.keySet());
		if (!targets.contains(defaultRoute)) {
			targets.add(defaultRoute);
		}
		return targets;
	}

}
