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
package io.weaveflow.graph.streaming;

import static java.lang.String.format;

/**
 * Informational marker emitted in-band by {@link Channels#mergeNamed} once one of the
 * named sources drains. Not a failure.
 */
public class SourceExhaustedException extends StreamException {

	private final String sourceName;

	public SourceExhaustedException(String sourceName) {
		super(format("source exhausted: %s", sourceName));
		this.sourceName = sourceName;
	}

	public String sourceName() {
		return sourceName;
	}

}
