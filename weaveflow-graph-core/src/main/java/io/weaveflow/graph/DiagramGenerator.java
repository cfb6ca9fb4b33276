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
package io.weaveflow.graph;

import java.util.Optional;

import io.weaveflow.graph.internal.edge.DirectEdge;
import io.weaveflow.graph.internal.edge.Edge;
import io.weaveflow.graph.internal.node.Node;

import static io.weaveflow.graph.StateGraph.END;
import static io.weaveflow.graph.StateGraph.START;
import static java.lang.String.format;

/**
 * Template for rendering a {@link StateGraph} as diagram source. Subclasses supply the
 * syntax of each element; the traversal order is fixed: header, node declarations, the
 * entry edge, one group of calls per outgoing edge, implicit edges to the end node for
 * nodes without an outgoing edge, footer.
 */
public abstract class DiagramGenerator {

	public enum CallStyle {

		DEFAULT, CONDITIONAL, PARALLEL

	}

	public record Context(StringBuilder sb, String title, boolean printConditionalEdges) {

		static Context of(String title, boolean printConditionalEdges) {
			return new Context(new StringBuilder(), title, printConditionalEdges);
		}

		public Optional<String> titleToSnakeCase() {
			return Optional.ofNullable(title).map(t -> t.trim().replaceAll("[^A-Za-z0-9]+", "_").toLowerCase());
		}

		@Override
		public String toString() {
			return sb.toString();
		}

	}

	protected abstract void appendHeader(Context ctx);

	protected abstract void appendFooter(Context ctx);

	protected abstract void call(Context ctx, String from, String to, CallStyle style);

	protected abstract void call(Context ctx, String from, String to, String description, CallStyle style);

	protected abstract void declareConditionalStart(Context ctx, String name);

	protected abstract void declareNode(Context ctx, String name);

	protected abstract void declareConditionalEdge(Context ctx, int ordinal);

	protected abstract void commentLine(Context ctx, boolean yesOrNo);

	public final <S> String generate(StateGraph<S> graph, String title, boolean printConditionalEdges) {
		Context ctx = Context.of(title, printConditionalEdges);

		appendHeader(ctx);

		for (Node<S> node : graph.nodes()) {
			declareNode(ctx, node.id());
		}

		int ordinal = 0;
		for (Edge<S> edge : graph.edges()) {
			if (isConditional(edge)) {
				declareConditionalEdge(ctx, ordinal++);
			}
		}

		graph.getEntryPoint().ifPresent(entryPoint -> call(ctx, START, entryPoint, CallStyle.DEFAULT));

		ordinal = 0;
		for (Edge<S> edge : graph.edges()) {
			if (edge.isParallel()) {
				for (String target : edge.declaredTargets()) {
					call(ctx, edge.sourceId(), target, CallStyle.PARALLEL);
				}
			}
			else if (!isConditional(edge)) {
				call(ctx, edge.sourceId(), edge.declaredTargets().get(0), CallStyle.DEFAULT);
			}
			else {
				String condition = format("condition%d", ordinal++);
				commentLine(ctx, !printConditionalEdges);
				call(ctx, edge.sourceId(), condition, CallStyle.DEFAULT);
				for (String target : edge.declaredTargets()) {
					commentLine(ctx, !printConditionalEdges);
					call(ctx, condition, target, target, CallStyle.CONDITIONAL);
				}
				// 路由目标在运行时才确定，只输出描述
				if (edge.declaredTargets().isEmpty()) {
					String description = edge.description().orElse("route");
					commentLine(ctx, !printConditionalEdges);
					call(ctx, condition, END, description, CallStyle.CONDITIONAL);
				}
			}
		}

		for (Node<S> node : graph.nodes()) {
			if (graph.edges.findBySourceId(node.id()).isEmpty()) {
				call(ctx, node.id(), END, CallStyle.DEFAULT);
			}
		}

		appendFooter(ctx);

		return ctx.toString();
	}

	private static boolean isConditional(Edge<?> edge) {
		return !edge.isParallel() && !(edge instanceof DirectEdge);
	}

}
