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
package io.weaveflow.graph.callback.handler;

import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackHandler;
import io.weaveflow.graph.callback.CallbackInput;
import io.weaveflow.graph.callback.CallbackOutput;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.streaming.ChannelReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every observed execution through SLF4J. Starts and ends go to {@code info},
 * failures to {@code error}; the context is never changed.
 *
 * <pre>{@code
 * var callbacks = CallbackManager.of(LoggingHandler.builder().verbose(true).logInputs(true).build());
 * graph.invoke(state, RunnableConfig.builder().callbackManager(callbacks).build());
 * }</pre>
 */
public class LoggingHandler implements CallbackHandler {

	public static final String DEFAULT_PREFIX = "[weaveflow]";

	private static final Logger log = LoggerFactory.getLogger(LoggingHandler.class);

	private final boolean verbose;

	private final boolean logInputs;

	private final boolean logOutputs;

	private final String prefix;

	public LoggingHandler() {
		this(builder());
	}

	private LoggingHandler(Builder builder) {
		this.verbose = builder.verbose;
		this.logInputs = builder.logInputs;
		this.logOutputs = builder.logOutputs;
		this.prefix = builder.prefix;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public CallbackContext onStart(CallbackContext context, RunInfo info, CallbackInput input) {
		if (!verbose) {
			log.info("{} START: {}", prefix, info.name());
			return context;
		}
		log.info("{} START: {} ({}) component={} metadata={}", prefix, info.name(), info.type(),
				info.componentType().getValue(), info.metadata());
		if (logInputs) {
			log.info("{}   input: {} metadata={}", prefix, input.data(), input.metadata());
		}
		return context;
	}

	@Override
	public CallbackContext onEnd(CallbackContext context, RunInfo info, CallbackOutput output) {
		log.info("{} END: {}", prefix, info.name());
		if (verbose && logOutputs) {
			log.info("{}   output: {} metadata={}", prefix, output.data(), output.metadata());
		}
		return context;
	}

	@Override
	public CallbackContext onError(CallbackContext context, RunInfo info, Throwable error) {
		if (verbose) {
			log.error("{} ERROR in {} ({} / {})", prefix, info.name(), info.type(), info.componentType().getValue(),
					error);
		}
		else {
			log.error("{} ERROR in {}: {}", prefix, info.name(), error.toString());
		}
		return context;
	}

	@Override
	public CallbackContext onStartWithStreamInput(CallbackContext context, RunInfo info, ChannelReader<?> input) {
		log.info("{} START (streaming input): {}", prefix, info.name());
		return context;
	}

	@Override
	public CallbackContext onEndWithStreamOutput(CallbackContext context, RunInfo info, ChannelReader<?> output) {
		log.info("{} END (streaming output): {}", prefix, info.name());
		return context;
	}

	public static class Builder {

		private boolean verbose;

		private boolean logInputs;

		private boolean logOutputs;

		private String prefix = DEFAULT_PREFIX;

		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		public Builder logInputs(boolean logInputs) {
			this.logInputs = logInputs;
			return this;
		}

		public Builder logOutputs(boolean logOutputs) {
			this.logOutputs = logOutputs;
			return this;
		}

		public Builder prefix(String prefix) {
			this.prefix = prefix;
			return this;
		}

		public LoggingHandler build() {
			return new LoggingHandler(this);
		}

	}

}
