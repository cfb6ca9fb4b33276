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
package io.weaveflow.graph.exception;

/**
 * Failure of an execution unit. Checked exceptions raised by unit functions are wrapped
 * in this type; unchecked ones propagate as they are.
 */
public class RunnableException extends RuntimeException {

	private final String runnableType;

	public RunnableException(String message, String runnableType) {
		super(message);
		this.runnableType = runnableType;
	}

	public RunnableException(String message, String runnableType, Throwable cause) {
		super(message, cause);
		this.runnableType = runnableType;
	}

	public String getRunnableType() {
		return runnableType;
	}

}
