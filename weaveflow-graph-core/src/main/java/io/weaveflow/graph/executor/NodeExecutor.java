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
package io.weaveflow.graph.executor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

import io.weaveflow.graph.GraphRunnerContext;
import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.callback.CallbackManager;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.exception.GraphRunnerException;
import io.weaveflow.graph.exception.RunnableErrors;
import io.weaveflow.graph.internal.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single node action, reporting it to the run's callbacks when present.
 */
public class NodeExecutor<S> {

	private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

	public static final String NODE_TYPE = "GraphNode";

	/**
	 * @return the state produced by the node
	 * @throws GraphRunnerException wrapping whatever the node raised
	 */
	public S execute(Node<S> node, S state, GraphRunnerContext<S> context) {
		RunnableConfig config = context.getConfig();
		CallbackManager callbacks = config.callbackManager().orElse(null);
		log.debug("executing node '{}'", node.id());
		try {
			if (callbacks == null) {
				return await(node, state, config);
			}
			return callbacks.runWithCallbacks(config.context(), runInfo(node), state,
					ctx -> await(node, state, config.withContext(ctx)));
		}
		catch (GraphRunnerException e) {
			throw e;
		}
		catch (Exception e) {
			throw RunnableErrors.nodeExecutionError.exception(e, node.id(), e.getMessage());
		}
	}

	static RunInfo runInfo(Node<?> node) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		node.description().ifPresent(description -> metadata.put("description", description));
		return new RunInfo(node.id(), NODE_TYPE, ComponentType.GRAPH_NODE, metadata);
	}

	private S await(Node<S> node, S state, RunnableConfig config) throws Exception {
		S result;
		try {
			result = node.action().apply(state, config).join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			if (cause instanceof Exception exception) {
				throw exception;
			}
			throw e;
		}
		if (result == null) {
			throw RunnableErrors.executionError.exception("node '" + node.id() + "' returned a null state");
		}
		return result;
	}

}
