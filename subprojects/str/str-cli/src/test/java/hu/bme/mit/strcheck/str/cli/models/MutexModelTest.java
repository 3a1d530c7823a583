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
package hu.bme.mit.strcheck.str.cli.models;

import hu.bme.mit.strcheck.analysis.algorithm.PredicateVerifier;
import hu.bme.mit.strcheck.analysis.algorithm.SafetyResult;
import hu.bme.mit.strcheck.analysis.graph.Str2RgAdapter;
import hu.bme.mit.strcheck.str.cli.models.MutexAction.Move;
import hu.bme.mit.strcheck.str.cli.models.MutexModel.Variant;
import hu.bme.mit.strcheck.str.cli.models.MutexState.Location;
import hu.bme.mit.strcheck.str.cli.models.MutexState.Process;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public final class MutexModelTest {

	@Parameter(0)
	public Variant variant;

	@Parameter(1)
	public boolean mutualExclusion;

	@Parameter(2)
	public boolean deadlockFree;

	@Parameter(3)
	public int reachable;

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{Variant.SIMPLE, false, true, 4},
				{Variant.FLAGS, true, false, 8},
				{Variant.PETERSON, true, true, 10},
		});
	}

	@Test
	public void testMutualExclusion() {
		final MutexModel model = MutexModel.create(variant);
		final SafetyResult<MutexState, MutexAction> result = PredicateVerifier.<MutexState>create()
				.check(model, MutexState::isMutuallyExclusive);
		assertEquals(mutualExclusion, result.isSafe());
		if (result.isUnsafe()) {
			assertEquals(true, result.asUnsafe().getTrace().isValidIn(Str2RgAdapter.create(model)));
		}
	}

	@Test
	public void testDeadlockFreedom() {
		final SafetyResult<MutexState, MutexAction> result = PredicateVerifier.<MutexState>create()
				.checkDeadlockFree(MutexModel.create(variant));
		assertEquals(deadlockFree, result.isSafe());
		if (deadlockFree) {
			assertEquals(reachable, result.asSafe().getReachableCount());
		}
	}

	@Test
	public void testInitialActions() {
		final MutexModel model = MutexModel.create(variant);
		final Move first = variant == Variant.SIMPLE ? Move.ENTER : Move.WAIT;
		assertEquals(List.of(MutexAction.of(Process.ALICE, first), MutexAction.of(Process.BOB, first)),
				model.enabled(MutexState.initial()));
	}

	@Test
	public void testSuccessorIsNewValue() {
		final MutexModel model = MutexModel.create(variant);
		final MutexState initial = MutexState.initial();
		final MutexAction action = model.enabled(initial).iterator().next();
		final MutexState next = model.execute(action, initial).iterator().next();
		assertEquals(Location.I, initial.location(Process.ALICE));
		assertEquals(variant == Variant.SIMPLE ? Location.C : Location.W, next.location(Process.ALICE));
	}

}
