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

import io.weaveflow.graph.diagram.MermaidGenerator;
import io.weaveflow.graph.diagram.PlantUMLGenerator;

/**
 * Diagram source of a graph in one of the supported notations.
 *
 * @param type the notation
 * @param content the diagram source
 */
public record GraphRepresentation(Type type, String content) {

	public enum Type {

		PLANTUML(new PlantUMLGenerator()), MERMAID(new MermaidGenerator());

		final DiagramGenerator generator;

		Type(DiagramGenerator generator) {
			this.generator = generator;
		}

	}

	@Override
	public String toString() {
		return content;
	}

}
