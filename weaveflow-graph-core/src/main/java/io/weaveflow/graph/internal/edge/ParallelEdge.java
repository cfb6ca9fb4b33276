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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import io.weaveflow.graph.StateGraph;
import io.weaveflow.graph.action.StateMerger;
import io.weaveflow.graph.exception.Errors;
import io.weaveflow.graph.exception.GraphStateException;
import org.springframework.lang.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Fan-out edge: every target runs concurrently and the results are combined by the
 * merger, or by keeping the last declared target's result when there is none.
 */
public record ParallelEdge<S>(String sourceId, List<String> targets,
		@Nullable StateMerger<S> merger) implements Edge<S> {

	public ParallelEdge {
		requireNonNull(sourceId, "sourceId cannot be null");
		targets = List.copyOf(requireNonNull(targets, "targets cannot be null"));
	}

	public Optional<StateMerger<S>> getMerger() {
		return Optional.ofNullable(merger);
	}

	@Override
	public List<String> resolve(S state) {
		return targets;
	}

	@Override
	public List<String> declaredTargets() {
		return targets;
	}

	@Override
	public boolean isParallel() {
		return true;
	}

	@Override
	public void validate(StateGraph.Nodes<S> nodes) throws GraphStateException {
		if (!nodes.anyMatchById(sourceId)) {
			throw Errors.missingNodeReferencedByEdge.exception(sourceId);
		}
		if (targets.isEmpty()) {
			throw Errors.emptyParallelEdge.exception(sourceId);
		}
		// 检查并行边是否存在重复的目标
		Set<String> duplicates = targets.stream()
			.collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
			.entrySet()
			.stream()
			.filter(entry -> entry.getValue() > 1)
			.map(Map.Entry::getKey)
			.collect(Collectors.toSet());
		if (!duplicates.isEmpty()) {
			throw Errors.duplicateEdgeTargetError.exception(sourceId, duplicates);
		}
		for (String target : targets) {
			if (Objects.equals(target, StateGraph.END) || Objects.equals(target, StateGraph.START)) {
				throw Errors.invalidParallelTarget.exception(sourceId, target);
			}
			if (!nodes.anyMatchById(target)) {
				throw Errors.missingEdgeTarget.exception(sourceId, target);
			}
		}
	}

}
