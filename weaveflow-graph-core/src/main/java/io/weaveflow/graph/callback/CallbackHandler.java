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

import io.weaveflow.graph.streaming.ChannelReader;

/**
 * Side-effect hook invoked around an execution. Every method returns the context to hand
 * to the next handler; returning the argument unchanged is the no-op. Implementations
 * override only the events they care about.
 * <p>
 * Handlers may be called concurrently from parallel graph branches.
 */
public interface CallbackHandler {

	default CallbackContext onStart(CallbackContext context, RunInfo info, CallbackInput input) {
		return context;
	}

	default CallbackContext onEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		return context;
	}

	default CallbackContext onError(CallbackContext context, RunInfo info, Throwable error) {
		return context;
	}

	/**
	 * Called when an execution starts with a streamed input. The reader belongs to the
	 * observed execution and must not be read.
	 */
	default CallbackContext onStartWithStreamInput(CallbackContext context, RunInfo info, ChannelReader<?> input) {
		return onStart(context, info, new CallbackInput(input));
	}

	/**
	 * Called when an execution hands back a streamed output. The reader belongs to the
	 * caller and must not be read.
	 */
	default CallbackContext onEndWithStreamOutput(CallbackContext context, RunInfo info, ChannelReader<?> output) {
		return onEnd(context, info, new CallbackOutput(output));
	}

}
