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

import hu.bme.mit.strcheck.analysis.model.ImmutableValuation;
import hu.bme.mit.strcheck.analysis.str.piecewise.Piece;
import hu.bme.mit.strcheck.analysis.str.piecewise.PiecewiseStr;

import java.util.function.Predicate;

/**
 * Two processes, Alice and Bob, entering and leaving a critical section.
 * Process locations are I (idle), W (waiting) and C (critical).
 */
public final class AliceBob {

	public static final String ALICE = "a";
	public static final String BOB = "b";

	public static final Predicate<ImmutableValuation> MUTUAL_EXCLUSION =
			v -> !(at(v, ALICE, "C") && at(v, BOB, "C"));

	private AliceBob() {
	}

	/**
	 * Each process moves I to C and back without waiting: a' = C if a = I,
	 * a' = I if a = C.
	 */
	public static PiecewiseStr<ImmutableValuation> simple() {
		return PiecewiseStr.<ImmutableValuation>builder()
				.root(ImmutableValuation.builder().put(ALICE, "I").put(BOB, "I").build())
				.piece(simpleProcess(ALICE))
				.piece(simpleProcess(BOB))
				.build();
	}

	/**
	 * Each process raises its flag when it starts waiting, enters only when
	 * the other flag is down and lowers its flag on leaving.
	 */
	public static PiecewiseStr<ImmutableValuation> flags() {
		return PiecewiseStr.<ImmutableValuation>builder()
				.root(ImmutableValuation.builder()
						.put(ALICE, "I").put(flag(ALICE), false)
						.put(BOB, "I").put(flag(BOB), false)
						.build())
				.piece(flagProcess(ALICE, BOB))
				.piece(flagProcess(BOB, ALICE))
				.build();
	}

	private static Piece<ImmutableValuation> simpleProcess(final String p) {
		return Piece.nested(p, v -> true,
				Piece.<ImmutableValuation>update("enter", v -> at(v, p, "I"), v -> v.with(p, "C")),
				Piece.<ImmutableValuation>update("leave", v -> at(v, p, "C"), v -> v.with(p, "I")));
	}

	private static Piece<ImmutableValuation> flagProcess(final String p, final String other) {
		return Piece.nested(p, v -> true,
				Piece.<ImmutableValuation>update("wait", v -> at(v, p, "I"), v -> v.with(p, "W").with(flag(p), true)),
				Piece.<ImmutableValuation>update("enter", v -> at(v, p, "W") && !v.get(flag(other), Boolean.class),
						v -> v.with(p, "C")),
				Piece.<ImmutableValuation>update("leave", v -> at(v, p, "C"), v -> v.with(p, "I").with(flag(p), false)));
	}

	static String flag(final String process) {
		return "flag_" + process;
	}

	static boolean at(final ImmutableValuation v, final String process, final String location) {
		return location.equals(v.get(process, String.class));
	}

}
