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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import io.weaveflow.graph.action.AsyncEdgeAction;
import io.weaveflow.graph.action.AsyncNodeAction;
import io.weaveflow.graph.action.AsyncNodeActionWithConfig;
import io.weaveflow.graph.action.StateMerger;
import io.weaveflow.graph.compose.ExecutionUnit;
import io.weaveflow.graph.exception.Errors;
import io.weaveflow.graph.exception.GraphStateException;
import io.weaveflow.graph.internal.edge.ConditionalEdge;
import io.weaveflow.graph.internal.edge.DirectEdge;
import io.weaveflow.graph.internal.edge.Edge;
import io.weaveflow.graph.internal.edge.MultiRouteEdge;
import io.weaveflow.graph.internal.edge.ParallelEdge;
import io.weaveflow.graph.internal.node.Node;
import org.springframework.lang.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Builder of a state machine: named nodes transforming a state of type {@code S}, wired
 * by at most one outgoing edge per node, and an entry point. Cycles are allowed; every
 * run is bounded by {@link CompileConfig#recursionLimit()}.
 *
 * <pre>{@code
 * CompiledGraph<MapState> graph = new StateGraph<MapState>()
 * 	.addNode("a", node_async(state -> state.with("a", true)))
 * 	.addNode("b", node_async(state -> state.with("b", true)))
 * 	.addEdge("a", "b")
 * 	.addEdge("b", StateGraph.END)
 * 	.setEntryPoint("a")
 * 	.compile();
 * }</pre>
 *
 * @param <S> the state type
 */
public class StateGraph<S> {

	/**
	 * Termination sentinel.
	 */
	public static final String END = "__END__";

	/**
	 * Pseudo node preceding the entry point; {@code addEdge(START, id)} sets the entry
	 * point.
	 */
	public static final String START = "__START__";

	public static final String DEFAULT_NAME = "StateGraph";

	public static class Nodes<S> {

		public final Map<String, Node<S>> elements = new LinkedHashMap<>();

		public boolean anyMatchById(String id) {
			return elements.containsKey(id);
		}

		public Optional<Node<S>> findById(String id) {
			return Optional.ofNullable(elements.get(id));
		}

	}

	public static class Edges<S> {

		public final Map<String, Edge<S>> elements = new LinkedHashMap<>();

		public Optional<Edge<S>> findBySourceId(String sourceId) {
			return Optional.ofNullable(elements.get(sourceId));
		}

	}

	final Nodes<S> nodes = new Nodes<>();

	final Edges<S> edges = new Edges<>();

	private final String name;

	private String entryPoint;

	private UnaryOperator<S> stateCloner = UnaryOperator.identity();

	public StateGraph() {
		this(DEFAULT_NAME);
	}

	public StateGraph(String name) {
		this.name = requireNonNull(name, "name cannot be null");
	}

	public String getName() {
		return name;
	}

	public StateGraph<S> addNode(String id, AsyncNodeAction<S> action) throws GraphStateException {
		return addNode(id, null, action);
	}

	public StateGraph<S> addNode(String id, @Nullable String description, AsyncNodeAction<S> action)
			throws GraphStateException {
		return registerNode(new Node<>(id, description,
				AsyncNodeActionWithConfig.of(requireNonNull(action, "action cannot be null"))));
	}

	public StateGraph<S> addNode(String id, AsyncNodeActionWithConfig<S> action) throws GraphStateException {
		return registerNode(new Node<>(id, requireNonNull(action, "action cannot be null")));
	}

	/**
	 * Registers an execution unit whose input and output are the state.
	 */
	public StateGraph<S> addNode(String id, ExecutionUnit<S, S> unit) throws GraphStateException {
		return registerNode(new Node<>(id, AsyncNodeActionWithConfig.fromUnit(requireNonNull(unit, "unit cannot be null"))));
	}

	/**
	 * Adds an unconditional edge. {@code to} may be {@link #END}; {@code from} may be
	 * {@link #START}, which sets the entry point.
	 */
	public StateGraph<S> addEdge(String from, String to) throws GraphStateException {
		requireNonNull(to, "to cannot be null");
		if (Objects.equals(from, START)) {
			return setEntryPoint(to);
		}
		return registerEdge(new DirectEdge<>(from, to));
	}

	/**
	 * Adds an edge whose target is the node id returned by {@code router}, or
	 * {@link #END}.
	 */
	public StateGraph<S> addConditionalEdge(String from, AsyncEdgeAction<S> router) throws GraphStateException {
		return addConditionalEdge(from, router, null);
	}

	public StateGraph<S> addConditionalEdge(String from, AsyncEdgeAction<S> router, @Nullable String description)
			throws GraphStateException {
		return registerEdge(new ConditionalEdge<>(from, router, description));
	}

	/**
	 * Routes to {@link #END} when no predicate matches.
	 * @see #addConditionalRouter(String, Map, String)
	 */
	public StateGraph<S> addConditionalRouter(String from, Map<String, Predicate<S>> routes)
			throws GraphStateException {
		return addConditionalRouter(from, routes, END);
	}

	/**
	 * Adds an edge taking the first route whose predicate holds. Routes are tried in the
	 * iteration order of {@code routes}; pass a {@link LinkedHashMap} to control it.
	 * @param routes target node id to predicate
	 * @param defaultRoute target when no predicate holds
	 */
	public StateGraph<S> addConditionalRouter(String from, Map<String, Predicate<S>> routes, String defaultRoute)
			throws GraphStateException {
		return registerEdge(new MultiRouteEdge<>(from, routes, defaultRoute));
	}

	/**
	 * Adds a fan-out edge keeping the result of the last declared target.
	 */
	public StateGraph<S> addParallelEdge(String from, List<String> targets) throws GraphStateException {
		return addParallelEdge(from, targets, null);
	}

	public StateGraph<S> addParallelEdge(String from, List<String> targets, @Nullable StateMerger<S> merger)
			throws GraphStateException {
		if (targets.isEmpty()) {
			throw Errors.emptyParallelEdge.exception(from);
		}
		return registerEdge(new ParallelEdge<>(from, targets, merger));
	}

	public StateGraph<S> setEntryPoint(String id) {
		this.entryPoint = requireNonNull(id, "entry point cannot be null");
		return this;
	}

	/**
	 * Sets the function producing each parallel branch's own view of the pre-fan-out
	 * state. Identity by default, which suits immutable states.
	 */
	public StateGraph<S> stateCloner(UnaryOperator<S> stateCloner) {
		this.stateCloner = requireNonNull(stateCloner, "stateCloner cannot be null");
		return this;
	}

	public Optional<String> getEntryPoint() {
		return Optional.ofNullable(entryPoint);
	}

	public UnaryOperator<S> getStateCloner() {
		return stateCloner;
	}

	public Collection<Node<S>> nodes() {
		return nodes.elements.values();
	}

	public Collection<Edge<S>> edges() {
		return edges.elements.values();
	}

	public CompiledGraph<S> compile() throws GraphStateException {
		return compile(CompileConfig.builder().build());
	}

	public CompiledGraph<S> compile(CompileConfig config) throws GraphStateException {
		requireNonNull(config, "config cannot be null");
		return new CompiledGraph<>(this, config);
	}

	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title) {
		return getGraph(type, title, true);
	}

	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title, boolean printConditionalEdges) {
		String content = type.generator.generate(this, title, printConditionalEdges);
		return new GraphRepresentation(type, content);
	}

	void validateGraph() throws GraphStateException {
		if (entryPoint == null) {
			throw Errors.missingEntryPoint.exception();
		}
		if (!nodes.anyMatchById(entryPoint)) {
			throw Errors.entryPointNotExist.exception(entryPoint);
		}
		for (Edge<S> edge : edges.elements.values()) {
			edge.validate(nodes);
		}
	}

	private StateGraph<S> registerNode(Node<S> node) throws GraphStateException {
		node.validate();
		if (nodes.anyMatchById(node.id())) {
			throw Errors.duplicateNodeError.exception(node.id());
		}
		nodes.elements.put(node.id(), node);
		return this;
	}

	private StateGraph<S> registerEdge(Edge<S> edge) throws GraphStateException {
		if (Objects.equals(edge.sourceId(), END) || Objects.equals(edge.sourceId(), START)) {
			throw Errors.invalidEdgeIdentifier.exception(edge.sourceId());
		}
		if (edges.elements.containsKey(edge.sourceId())) {
			throw Errors.duplicateEdgeError.exception(edge.sourceId());
		}
		edges.elements.put(edge.sourceId(), edge);
		return this;
	}

}
