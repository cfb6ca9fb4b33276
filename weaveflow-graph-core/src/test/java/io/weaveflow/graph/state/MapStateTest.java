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
package io.weaveflow.graph.state;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MapStateTest {

	@Test
	void updatesReturnNewInstances() {
		MapState original = MapState.of("a", 1);

		MapState updated = original.with("b", 2);

		assertFalse(original.containsKey("b"));
		assertEquals(Map.of("a", 1, "b", 2), updated.data());
		assertSame(original, original.withAll(Map.of()));
		assertSame(original, original.without("missing"));
		assertEquals(MapState.of(), updated.without("a").without("b"));
	}

	@Test
	void dataIsUnmodifiable() {
		Map<String, Object> source = new HashMap<>();
		source.put("k", "v");
		MapState state = MapState.of(source);
		source.put("k", "changed");

		assertEquals("v", state.value("k", String.class).orElseThrow());
		assertThrows(UnsupportedOperationException.class, () -> state.data().put("x", 1));
	}

	@Test
	void nullValuesAreRejected() {
		assertThrows(NullPointerException.class, () -> MapState.of("k", null));
		Map<String, Object> source = new HashMap<>();
		source.put("k", null);
		assertThrows(NullPointerException.class, () -> MapState.of(source));
	}

	@Test
	void typedAccessors() {
		MapState state = MapState.of("name", "weave").with("items", List.of(1, 2, 3));

		assertEquals("weave", state.value("name", String.class).orElseThrow());
		// 类型不匹配时返回空
		assertTrue(state.value("name", Integer.class).isEmpty());
		assertEquals("fallback", state.value("missing", "fallback"));
		assertEquals(List.of(1, 2, 3), state.listValue("items", Integer.class));
		assertEquals(List.of(), state.listValue("missing", Integer.class));
	}

	@Test
	void overlayMergerAppliesResultsInOrder() throws Exception {
		MapState original = MapState.of("keep", true).with("shared", "original");

		MapState merged = MapState.overlayMerger()
			.merge(original, List.of(MapState.of("shared", "first").with("a", 1), MapState.of("shared", "second")));

		assertEquals(Map.of("keep", true, "shared", "second", "a", 1), merged.data());
	}

	@Test
	void equalityFollowsContents() {
		assertEquals(MapState.of("a", 1).with("b", 2), MapState.of("a", 1).with("b", 2));
		assertEquals(MapState.of("a", 1).hashCode(), MapState.of("a", 1).hashCode());
		assertNotEquals(MapState.of("a", 1), MapState.of("a", 2));
	}

}
