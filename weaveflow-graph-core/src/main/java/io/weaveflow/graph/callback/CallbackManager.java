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
package io.weaveflow.graph.callback;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.weaveflow.graph.streaming.ChannelReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Dispatches execution events to an ordered list of {@link CallbackHandler}s.
 * <p>
 * Process-wide global handlers run first, then this manager's own handlers, each in
 * registration order. A handler that throws, including an {@link Error} such as a failed
 * assertion, is logged and skipped: the context keeps the value it had before that
 * handler and later handlers still run. Only a {@link VirtualMachineError} escapes.
 */
public class CallbackManager {

	private static final Logger log = LoggerFactory.getLogger(CallbackManager.class);

	private static final List<CallbackHandler> GLOBAL_HANDLERS = new CopyOnWriteArrayList<>();

	private final List<CallbackHandler> handlers;

	@FunctionalInterface
	private interface Stage {

		CallbackContext apply(CallbackHandler handler, CallbackContext context);

	}

	public CallbackManager() {
		this(List.of());
	}

	public CallbackManager(List<CallbackHandler> handlers) {
		this.handlers = List.copyOf(requireNonNull(handlers, "handlers cannot be null"));
	}

	public static CallbackManager of(CallbackHandler... handlers) {
		return new CallbackManager(Arrays.asList(handlers));
	}

	public static void addGlobalHandler(CallbackHandler handler) {
		GLOBAL_HANDLERS.add(requireNonNull(handler, "handler cannot be null"));
	}

	public static boolean removeGlobalHandler(CallbackHandler handler) {
		return GLOBAL_HANDLERS.remove(handler);
	}

	public static void clearGlobalHandlers() {
		GLOBAL_HANDLERS.clear();
	}

	public static List<CallbackHandler> globalHandlers() {
		return List.copyOf(GLOBAL_HANDLERS);
	}

	public List<CallbackHandler> handlers() {
		return handlers;
	}

	/**
	 * @return a new manager with {@code more} appended to this manager's handlers
	 */
	public CallbackManager withHandlers(CallbackHandler... more) {
		List<CallbackHandler> combined = new ArrayList<>(handlers);
		combined.addAll(Arrays.asList(more));
		return new CallbackManager(combined);
	}

	public CallbackContext triggerStart(CallbackContext context, RunInfo info, CallbackInput input) {
		return dispatch("onStart", context, info, (handler, ctx) -> handler.onStart(ctx, info, input));
	}

	public CallbackContext triggerEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		return dispatch("onEnd", context, info, (handler, ctx) -> handler.onEnd(ctx, info, output));
	}

	public CallbackContext triggerError(CallbackContext context, RunInfo info, Throwable error) {
		return dispatch("onError", context, info, (handler, ctx) -> handler.onError(ctx, info, error));
	}

	public CallbackContext triggerStartWithStreamInput(CallbackContext context, RunInfo info,
			ChannelReader<?> input) {
		return dispatch("onStartWithStreamInput", context, info,
				(handler, ctx) -> handler.onStartWithStreamInput(ctx, info, input));
	}

	public CallbackContext triggerEndWithStreamOutput(CallbackContext context, RunInfo info,
			ChannelReader<?> output) {
		return dispatch("onEndWithStreamOutput", context, info,
				(handler, ctx) -> handler.onEndWithStreamOutput(ctx, info, output));
	}

	/**
	 * Runs {@code fn} between the start hooks and either the end hooks (on success) or the
	 * error hooks (on failure, after which the failure is rethrown unchanged).
	 */
	public <T> T runWithCallbacks(CallbackContext context, RunInfo info, Object input, CallbackFunction<T> fn)
			throws Exception {
		CallbackContext started = triggerStart(context, info, new CallbackInput(input));
		T result;
		try {
			result = fn.apply(started);
		}
		catch (Exception e) {
			triggerError(started, info, e);
			throw e;
		}
		triggerEnd(started, info, new CallbackOutput(result));
		return result;
	}

	private CallbackContext dispatch(String event, CallbackContext context, RunInfo info, Stage stage) {
		CallbackContext current = requireNonNull(context, "context cannot be null");
		for (CallbackHandler handler : allHandlers()) {
			try {
				CallbackContext next = stage.apply(handler, current);
				if (next != null) {
					current = next;
				}
			}
			catch (VirtualMachineError e) {
				throw e;
			}
			catch (RuntimeException | Error e) {
				log.warn("Callback handler {} failed in {} for '{}'", handler.getClass().getName(), event,
						info.name(), e);
			}
		}
		return current;
	}

	private List<CallbackHandler> allHandlers() {
		if (GLOBAL_HANDLERS.isEmpty()) {
			return handlers;
		}
		List<CallbackHandler> all = new ArrayList<>(GLOBAL_HANDLERS);
		all.addAll(handlers);
		return all;
	}

}
