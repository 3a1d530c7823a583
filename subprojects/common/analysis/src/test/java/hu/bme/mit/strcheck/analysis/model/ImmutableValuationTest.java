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
package hu.bme.mit.strcheck.analysis.model;

import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public final class ImmutableValuationTest {

	@Test
	public void testEqualityIgnoresOrder() {
		final ImmutableValuation v1 = ImmutableValuation.builder().put("x", 1).put("y", "I").build();
		final ImmutableValuation v2 = ImmutableValuation.builder().put("y", "I").put("x", 1).build();
		assertEquals(v1, v2);
		assertEquals(v1.hashCode(), v2.hashCode());
	}

	@Test
	public void testWithCreatesNewValue() {
		final ImmutableValuation v = ImmutableValuation.builder().put("x", 1).put("y", 2).build();
		final ImmutableValuation w = v.with("x", 5);

		assertEquals(Integer.valueOf(1), v.get("x", Integer.class));
		assertEquals(Integer.valueOf(5), w.get("x", Integer.class));
		assertNotEquals(v, w);
		assertEquals(List.of("x", "y"), List.copyOf(w.getVars()));
		assertEquals(v, w.with("x", 1));
	}

	@Test
	public void testWithSameValueReturnsThis() {
		final ImmutableValuation v = ImmutableValuation.builder().put("x", 1).build();
		assertSame(v, v.with("x", 1));
	}

	@Test
	public void testWithNewVariable() {
		final ImmutableValuation v = ImmutableValuation.empty().with("z", true);
		assertEquals(Optional.of(true), v.eval("z"));
		assertTrue(ImmutableValuation.empty().eval("z").isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGetWrongType() {
		ImmutableValuation.builder().put("x", 1).build().get("x", String.class);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGetMissing() {
		ImmutableValuation.empty().get("x", Integer.class);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateVariable() {
		ImmutableValuation.builder().put("x", 1).put("x", 2).build();
	}

	@Test
	public void testToString() {
		assertEquals("(ImmutableValuation (x 1) (y C))",
				ImmutableValuation.builder().put("x", 1).put("y", "C").build().toString());
	}

}
