/*
 *  Copyright 2024 Budapest University of Technology and Economics
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package hu.bme.mit.strcheck.analysis;

import hu.bme.mit.strcheck.analysis.graph.RootedGraph;
import org.junit.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public final class TraceTest {

	private static final RootedGraph<Integer> SUCCESSOR = new RootedGraph<>() {
		@Override
		public Collection<Integer> roots() {
			return List.of(0);
		}

		@Override
		public Collection<Integer> neighbours(final Integer source) {
			return List.of(source + 1);
		}
	};

	@Test
	public void testAccessors() {
		final Trace<Integer, String> trace = Trace.of(List.of(0, 1, 2), List.of("a", "b"));
		assertEquals(2, trace.length());
		assertEquals(Integer.valueOf(0), trace.getFirstState());
		assertEquals(Integer.valueOf(2), trace.getLastState());
		assertEquals("b", trace.getAction(1));
		assertEquals(Integer.valueOf(1), trace.getState(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMismatchedLengths() {
		Trace.of(List.of(0, 1), List.of("a", "b"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmpty() {
		Trace.of(List.of(), List.of());
	}

	@Test
	public void testValidity() {
		assertTrue(Trace.of(List.of(0, 1, 2), List.of("s", "s")).isValidIn(SUCCESSOR));
		assertFalse(Trace.of(List.of(1, 2), List.of("s")).isValidIn(SUCCESSOR));
		assertFalse(Trace.of(List.of(0, 2), List.of("s")).isValidIn(SUCCESSOR));
		assertTrue(Trace.single(0).isValidIn(SUCCESSOR));
	}

	@Test
	public void testEquality() {
		assertEquals(Trace.of(List.of(0, 1), List.of("a")), Trace.of(List.of(0, 1), List.of("a")));
		assertEquals(Trace.of(List.of(0, 1), List.of("a")).hashCode(),
				Trace.of(List.of(0, 1), List.of("a")).hashCode());
	}

}
