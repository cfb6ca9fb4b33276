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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.callback.CallbackContext;
import io.weaveflow.graph.callback.CallbackInput;
import io.weaveflow.graph.callback.CallbackManager;
import io.weaveflow.graph.callback.CallbackOutput;
import io.weaveflow.graph.callback.ComponentType;
import io.weaveflow.graph.callback.RunInfo;
import io.weaveflow.graph.streaming.ChannelReader;

import static java.util.Objects.requireNonNull;

/**
 * An {@link ExecutionUnit} assembled from plain functions. Any subset of the four modes
 * may be supplied; the others are derived as described in {@link ModeDerivation}.
 * <p>
 * When the {@link RunnableConfig} carries a {@link CallbackManager}, every call is
 * reported to it, and nested units see the context produced by the start hooks.
 */
public final class Lambda<I, O> implements ExecutionUnit<I, O> {

	public static final String TYPE = "Lambda";

	private final String name;

	private final ModeTable<I, O> nativeModes;

	private final ModeTable<I, O> modes;

	private Lambda(String name, ModeTable<I, O> nativeModes) {
		this.name = name;
		this.nativeModes = nativeModes;
		this.modes = nativeModes.derive();
	}

	public static <I, O> Builder<I, O> builder() {
		return new Builder<>();
	}

	public static <I, O> Lambda<I, O> of(Function<I, O> function) {
		return of(TYPE, function);
	}

	public static <I, O> Lambda<I, O> of(String name, Function<I, O> function) {
		requireNonNull(function, "function cannot be null");
		return Lambda.<I, O>builder().name(name).invoke((input, config) -> function.apply(input)).build();
	}

	public static <I, O> Lambda<I, O> async(Function<I, CompletableFuture<O>> function) {
		requireNonNull(function, "function cannot be null");
		return Lambda.<I, O>builder().invoke((input, config) -> function.apply(input).join()).build();
	}

	public static <I, O> Lambda<I, O> streaming(StreamMode<I, O> stream) {
		return Lambda.<I, O>builder().stream(stream).build();
	}

	public String name() {
		return name;
	}

	/**
	 * @return the modes this lambda was built with, before derivation
	 */
	public ModeTable<I, O> nativeModes() {
		return nativeModes;
	}

	@Override
	public RunInfo runInfo() {
		return RunInfo.of(name, TYPE, ComponentType.RUNNABLE);
	}

	@Override
	public O invoke(I input, RunnableConfig config) {
		CallbackManager callbacks = config.callbackManager().orElse(null);
		if (callbacks == null) {
			return call(() -> modes.invoke().invoke(input, config));
		}
		return call(() -> callbacks.runWithCallbacks(config.context(), runInfo(), input,
				ctx -> modes.invoke().invoke(input, config.withContext(ctx))));
	}

	@Override
	public ChannelReader<O> stream(I input, RunnableConfig config) {
		CallbackManager callbacks = config.callbackManager().orElse(null);
		if (callbacks == null) {
			return call(() -> modes.stream().stream(input, config));
		}
		RunInfo info = runInfo();
		CallbackContext started = callbacks.triggerStart(config.context(), info, new CallbackInput(input));
		try {
			ChannelReader<O> output = modes.stream().stream(input, config.withContext(started));
			callbacks.triggerEndWithStreamOutput(started, info, output);
			return output;
		}
		catch (Exception e) {
			callbacks.triggerError(started, info, e);
			throw ModeDerivation.unchecked(e, TYPE);
		}
	}

	@Override
	public O collect(ChannelReader<I> input, RunnableConfig config) {
		CallbackManager callbacks = config.callbackManager().orElse(null);
		if (callbacks == null) {
			return call(() -> modes.collect().collect(input, config));
		}
		RunInfo info = runInfo();
		CallbackContext started = callbacks.triggerStartWithStreamInput(config.context(), info, input);
		try {
			O output = modes.collect().collect(input, config.withContext(started));
			callbacks.triggerEnd(started, info, new CallbackOutput(output));
			return output;
		}
		catch (Exception e) {
			callbacks.triggerError(started, info, e);
			throw ModeDerivation.unchecked(e, TYPE);
		}
	}

	@Override
	public ChannelReader<O> transform(ChannelReader<I> input, RunnableConfig config) {
		CallbackManager callbacks = config.callbackManager().orElse(null);
		if (callbacks == null) {
			return call(() -> modes.transform().transform(input, config));
		}
		RunInfo info = runInfo();
		CallbackContext started = callbacks.triggerStartWithStreamInput(config.context(), info, input);
		try {
			ChannelReader<O> output = modes.transform().transform(input, config.withContext(started));
			callbacks.triggerEndWithStreamOutput(started, info, output);
			return output;
		}
		catch (Exception e) {
			callbacks.triggerError(started, info, e);
			throw ModeDerivation.unchecked(e, TYPE);
		}
	}

	@Override
	public String toString() {
		return "Lambda(" + name + ")";
	}

	private static <T> T call(Callable<T> body) {
		try {
			return body.call();
		}
		catch (Exception e) {
			throw ModeDerivation.unchecked(e, TYPE);
		}
	}

	public static final class Builder<I, O> {

		private String name = TYPE;

		private InvokeMode<I, O> invoke;

		private StreamMode<I, O> stream;

		private CollectMode<I, O> collect;

		private TransformMode<I, O> transform;

		private Builder() {
		}

		public Builder<I, O> name(String name) {
			this.name = requireNonNull(name, "name cannot be null");
			return this;
		}

		public Builder<I, O> invoke(InvokeMode<I, O> invoke) {
			this.invoke = invoke;
			return this;
		}

		public Builder<I, O> stream(StreamMode<I, O> stream) {
			this.stream = stream;
			return this;
		}

		public Builder<I, O> collect(CollectMode<I, O> collect) {
			this.collect = collect;
			return this;
		}

		public Builder<I, O> transform(TransformMode<I, O> transform) {
			this.transform = transform;
			return this;
		}

		/**
		 * @throws IllegalArgumentException if no mode was supplied
		 */
		public Lambda<I, O> build() {
			return new Lambda<>(name, new ModeTable<>(invoke, stream, collect, transform));
		}

	}

}
