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
package hu.bme.mit.strcheck.analysis.algorithm;

import com.google.common.base.Equivalence;
import hu.bme.mit.strcheck.analysis.AliceBob;
import hu.bme.mit.strcheck.analysis.ExplicitStr;
import hu.bme.mit.strcheck.analysis.ExplicitStr.Label;
import hu.bme.mit.strcheck.analysis.Trace;
import hu.bme.mit.strcheck.analysis.graph.RootedGraph;
import hu.bme.mit.strcheck.analysis.graph.Str2RgAdapter;
import hu.bme.mit.strcheck.analysis.graph.UnitAction;
import hu.bme.mit.strcheck.analysis.model.ImmutableValuation;
import hu.bme.mit.strcheck.analysis.str.piecewise.PieceAction;
import hu.bme.mit.strcheck.analysis.str.piecewise.PiecewiseStr;
import hu.bme.mit.strcheck.common.logging.NullLogger;
import org.junit.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public final class PredicateVerifierTest {

	@Test
	public void testDeadlockWitness() {
		final ExplicitStr str = ExplicitStr.builder(0).action(0, "a", 1).build();
		final SafetyResult<Integer, Label> result = PredicateVerifier.<Integer>create().checkDeadlockFree(str);

		assertTrue(result.isUnsafe());
		assertEquals(Integer.valueOf(1), result.asUnsafe().getViolatingConfiguration());
		assertEquals(List.of(0, 1), result.asUnsafe().getTrace().getStates());
		assertEquals(List.of(new Label(0, "a")), result.asUnsafe().getTrace().getActions());
	}

	@Test
	public void testDeadlockFree() {
		final ExplicitStr str = ExplicitStr.builder(0).action(0, "a", 1).action(1, "b", 0).build();
		final SafetyResult<Integer, Label> result = PredicateVerifier.<Integer>create().checkDeadlockFree(str);

		assertTrue(result.isSafe());
		assertEquals(2, result.asSafe().getReachableCount());
		assertTrue(result.getStats().isPresent());
	}

	@Test
	public void testActionWithoutSuccessorsIsNotDeadlock() {
		final ExplicitStr str = ExplicitStr.builder(0).action(0, "stutter").build();
		assertTrue(PredicateVerifier.<Integer>create().checkDeadlockFree(str).isSafe());
	}

	@Test
	public void testSimpleAliceBobViolatesMutualExclusion() {
		final PiecewiseStr<ImmutableValuation> str = AliceBob.simple();
		final SafetyResult<ImmutableValuation, PieceAction<ImmutableValuation>> result =
				PredicateVerifier.<ImmutableValuation>create().check(str, AliceBob.MUTUAL_EXCLUSION);

		assertTrue(result.isUnsafe());
		final Trace<ImmutableValuation, PieceAction<ImmutableValuation>> trace = result.asUnsafe().getTrace();
		final ImmutableValuation last = trace.getLastState();
		assertEquals("C", last.get(AliceBob.ALICE, String.class));
		assertEquals("C", last.get(AliceBob.BOB, String.class));
		assertEquals(2, trace.length());
		assertEquals("a/enter", trace.getAction(0).getName());
		assertEquals("b/enter", trace.getAction(1).getName());
		assertTrue(trace.isValidIn(Str2RgAdapter.create(str)));
	}

	@Test
	public void testFlagsAliceBobKeepsMutualExclusion() {
		final SafetyResult<ImmutableValuation, PieceAction<ImmutableValuation>> result =
				PredicateVerifier.<ImmutableValuation>create().check(AliceBob.flags(), AliceBob.MUTUAL_EXCLUSION);

		assertTrue(result.isSafe());
		assertEquals(8, result.asSafe().getReachableCount());
	}

	@Test
	public void testFlagsAliceBobDeadlocks() {
		final SafetyResult<ImmutableValuation, PieceAction<ImmutableValuation>> result =
				PredicateVerifier.<ImmutableValuation>create().checkDeadlockFree(AliceBob.flags());

		assertTrue(result.isUnsafe());
		final ImmutableValuation deadlock = result.asUnsafe().getViolatingConfiguration();
		assertEquals("W", deadlock.get(AliceBob.ALICE, String.class));
		assertEquals("W", deadlock.get(AliceBob.BOB, String.class));
		assertEquals(2, result.asUnsafe().getTrace().length());
	}

	@Test
	public void testViolatingRoot() {
		final ExplicitStr str = ExplicitStr.builder(0, -1).action(0, "a", 1).build();
		final SafetyResult<Integer, Label> result = PredicateVerifier.<Integer>create().check(str, n -> n >= 0);

		assertTrue(result.isUnsafe());
		assertEquals(List.of(-1), result.asUnsafe().getTrace().getStates());
	}

	@Test
	public void testViolationTracesAreValid() {
		final RootedGraph<Integer> graph = new RootedGraph<>() {
			@Override
			public Collection<Integer> roots() {
				return List.of(3, 5);
			}

			@Override
			public Collection<Integer> neighbours(final Integer source) {
				return List.of((source * 7 + 1) % 100, (source + 13) % 100);
			}
		};
		for (int bad = 0; bad < 100; bad++) {
			final int target = bad;
			final SafetyResult<Integer, UnitAction> result = PredicateVerifier.<Integer>create()
					.check(graph, n -> n != target);
			if (result.isUnsafe()) {
				final Trace<Integer, UnitAction> trace = result.asUnsafe().getTrace();
				assertEquals(Integer.valueOf(target), trace.getLastState());
				assertTrue(trace.isValidIn(graph));
			} else {
				assertTrue(result.isSafe());
			}
		}
	}

	@Test
	public void testBudgetExceededIsUnknown() {
		final RootedGraph<Integer> naturals = new RootedGraph<>() {
			@Override
			public Collection<Integer> roots() {
				return List.of(0);
			}

			@Override
			public Collection<Integer> neighbours(final Integer source) {
				return List.of(source + 1);
			}
		};
		final PredicateVerifier<Integer> verifier = PredicateVerifier.create(
				Reachability.create(SearchStrategy.BFS, ExplorationBudget.maxConfigurations(50),
						Equivalence.equals(), NullLogger.getInstance()),
				NullLogger.getInstance());

		final SafetyResult<Integer, UnitAction> result = verifier.check(naturals, n -> n >= 0);
		assertTrue(result.isUnknown());
		assertEquals(50, result.asUnknown().getExploredCount());

		assertTrue(verifier.check(naturals, n -> n < 20).isUnsafe());
	}

	@Test
	public void testDeadlockFoundWithinBudget() {
		final ExplicitStr str = ExplicitStr.builder(0)
				.action(0, "a", 1, 2)
				.action(1, "b", 3)
				.action(3, "c", 4)
				.action(4, "d", 5)
				.build();
		final PredicateVerifier<Integer> verifier = PredicateVerifier.create(
				Reachability.create(SearchStrategy.BFS, ExplorationBudget.maxConfigurations(3),
						Equivalence.equals(), NullLogger.getInstance()),
				NullLogger.getInstance());

		final SafetyResult<Integer, Label> result = verifier.checkDeadlockFree(str);
		assertTrue(result.isUnsafe());
		assertEquals(Integer.valueOf(2), result.asUnsafe().getViolatingConfiguration());
	}

}
