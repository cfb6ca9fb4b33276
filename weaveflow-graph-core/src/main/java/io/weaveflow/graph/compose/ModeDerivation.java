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

import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import io.weaveflow.graph.RunnableConfig;
import io.weaveflow.graph.exception.RunnableException;
import io.weaveflow.graph.streaming.Channel;
import io.weaveflow.graph.streaming.ChannelReader;
import io.weaveflow.graph.streaming.ChannelWriter;
import io.weaveflow.graph.streaming.Channels;
import io.weaveflow.graph.streaming.StreamException;
import io.weaveflow.graph.streaming.StreamItem;

/**
 * Derives missing execution modes from native ones.
 * <p>
 * Precedence, first available source wins:
 * <ul>
 * <li>invoke: first item of stream; collect over a single-item channel; first item of
 * transform over a single-item channel</li>
 * <li>stream: invoke wrapped in a single-item channel (eager, failures in-band);
 * transform over a single-item channel; collect over a single-item channel</li>
 * <li>collect: first item of transform; invoke on the first input item only; first item
 * of stream on the first input item only. Inputs after the first are discarded in the
 * last two cases.</li>
 * <li>transform: collect wrapped in a single-item channel; stream per input item,
 * concatenated in input order; invoke per input item</li>
 * </ul>
 */
final class ModeDerivation {

	static final String TYPE = "ModeDerivation";

	private ModeDerivation() {
	}

	static <I, O> ModeTable<I, O> complete(ModeTable<I, O> modes) {
		if (!modes.hasAny()) {
			throw new IllegalArgumentException("at least one execution mode must be provided");
		}
		if (modes.isComplete()) {
			return modes;
		}
		return new ModeTable<>(modes.invoke() != null ? modes.invoke() : deriveInvoke(modes),
				modes.stream() != null ? modes.stream() : deriveStream(modes),
				modes.collect() != null ? modes.collect() : deriveCollect(modes),
				modes.transform() != null ? modes.transform() : deriveTransform(modes));
	}

	static <I, O> InvokeMode<I, O> deriveInvoke(ModeTable<I, O> modes) {
		if (modes.stream() != null) {
			StreamMode<I, O> stream = modes.stream();
			return (input, config) -> first(stream.stream(input, config), "stream produced no output");
		}
		if (modes.collect() != null) {
			CollectMode<I, O> collect = modes.collect();
			return (input, config) -> collect.collect(Channels.single(input), config);
		}
		TransformMode<I, O> transform = modes.transform();
		return (input, config) -> first(transform.transform(Channels.single(input), config),
				"transform produced no output");
	}

	static <I, O> StreamMode<I, O> deriveStream(ModeTable<I, O> modes) {
		if (modes.invoke() != null) {
			InvokeMode<I, O> invoke = modes.invoke();
			return (input, config) -> {
				try {
					return Channels.single(invoke.invoke(input, config));
				}
				catch (Exception e) {
					return Channels.failed(e);
				}
			};
		}
		if (modes.transform() != null) {
			TransformMode<I, O> transform = modes.transform();
			return (input, config) -> transform.transform(Channels.single(input), config);
		}
		CollectMode<I, O> collect = modes.collect();
		return (input, config) -> {
			try {
				return Channels.single(collect.collect(Channels.single(input), config));
			}
			catch (Exception e) {
				return Channels.failed(e);
			}
		};
	}

	static <I, O> CollectMode<I, O> deriveCollect(ModeTable<I, O> modes) {
		if (modes.transform() != null) {
			TransformMode<I, O> transform = modes.transform();
			return (input, config) -> first(transform.transform(input, config), "transform produced no output");
		}
		if (modes.invoke() != null) {
			InvokeMode<I, O> invoke = modes.invoke();
			return (input, config) -> invoke.invoke(first(input, "collect received no input"), config);
		}
		StreamMode<I, O> stream = modes.stream();
		return (input, config) -> first(stream.stream(first(input, "collect received no input"), config),
				"stream produced no output");
	}

	static <I, O> TransformMode<I, O> deriveTransform(ModeTable<I, O> modes) {
		if (modes.collect() != null) {
			CollectMode<I, O> collect = modes.collect();
			return (input, config) -> {
				Channel<O> out = Channels.pipe(1);
				executor(config).execute(() -> {
					ChannelWriter<O> writer = out.writer();
					try {
						writer.write(collect.collect(input, config));
					}
					catch (Exception e) {
						writer.writeError(e);
					}
					finally {
						writer.close();
					}
				});
				return out.reader();
			};
		}
		if (modes.stream() != null) {
			StreamMode<I, O> stream = modes.stream();
			return (input, config) -> streamEach(input, stream, config);
		}
		InvokeMode<I, O> invoke = modes.invoke();
		return (input, config) -> Channels.transform(input, value -> invoke.invoke(value, config), executor(config));
	}

	static Executor executor(RunnableConfig config) {
		return config.executor().orElseGet(Channels::defaultExecutor);
	}

	/**
	 * Reads the first value and retires the reader.
	 */
	static <T> T first(ChannelReader<T> reader, String emptyMessage) throws Exception {
		try {
			StreamItem<T> item = reader.read();
			if (item.isValue()) {
				return item.value();
			}
			if (item.isError()) {
				throw asException(item.error());
			}
			throw new RunnableException(emptyMessage, TYPE);
		}
		finally {
			reader.close();
		}
	}

	static RuntimeException unchecked(Throwable error, String runnableType) {
		if (error instanceof CompletionException && error.getCause() != null) {
			error = error.getCause();
		}
		if (error instanceof RuntimeException runtimeException) {
			return runtimeException;
		}
		if (error instanceof Error e) {
			throw e;
		}
		return new RunnableException(String.valueOf(error.getMessage()), runnableType, error);
	}

	private static Exception asException(Throwable error) {
		if (error instanceof Exception exception) {
			return exception;
		}
		if (error instanceof Error e) {
			throw e;
		}
		return new RunnableException(String.valueOf(error.getMessage()), TYPE, error);
	}

	private static <I, O> ChannelReader<O> streamEach(ChannelReader<I> input, StreamMode<I, O> stream,
			RunnableConfig config) {
		Channel<O> out = Channels.pipe(Channels.DEFAULT_CAPACITY);
		ChannelWriter<O> writer = out.writer();
		executor(config).execute(() -> {
			try {
				while (true) {
					StreamItem<I> item = input.read();
					if (item.isEnd()) {
						return;
					}
					if (item.isError()) {
						if (!writer.writeError(item.error())) {
							input.close();
							return;
						}
						continue;
					}
					if (!forward(stream, item.value(), config, writer)) {
						input.close();
						return;
					}
				}
			}
			catch (StreamException e) {
				writer.writeError(e);
				input.close();
			}
			finally {
				writer.close();
			}
		});
		return out.reader();
	}

	private static <I, O> boolean forward(StreamMode<I, O> stream, I value, RunnableConfig config,
			ChannelWriter<O> writer) {
		ChannelReader<O> output;
		try {
			output = stream.stream(value, config);
		}
		catch (Exception e) {
			return writer.writeError(e);
		}
		while (true) {
			StreamItem<O> item = output.read();
			if (item.isEnd()) {
				return true;
			}
			boolean accepted = item.isValue() ? writer.write(item.value()) : writer.writeError(item.error());
			if (!accepted) {
				output.close();
				return false;
			}
		}
	}

}
