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

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.analysis.str.piecewise.PieceAction;
import hu.bme.mit.strcheck.str.cli.models.MutexModel.Variant;

import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bundled transition relation together with the invariant it is checked
 * against.
 */
public final class DemoModel<C, A extends Action> {

	public enum Kind {
		ALICE_BOB_SIMPLE, ALICE_BOB_FLAGS, ALICE_BOB_PETERSON, COUNTER
	}

	private final String name;
	private final SemanticTransitionRelation<C, A> str;
	private final Predicate<? super C> invariant;

	private DemoModel(final String name, final SemanticTransitionRelation<C, A> str,
					  final Predicate<? super C> invariant) {
		this.name = checkNotNull(name);
		this.str = checkNotNull(str);
		this.invariant = checkNotNull(invariant);
	}

	/**
	 * Creates the model of the given kind. The parameter is the initial value
	 * of the counter and is ignored by the other models.
	 */
	public static DemoModel<?, ?> create(final Kind kind, final int parameter) {
		switch (kind) {
			case ALICE_BOB_SIMPLE:
				return mutex(Variant.SIMPLE);
			case ALICE_BOB_FLAGS:
				return mutex(Variant.FLAGS);
			case ALICE_BOB_PETERSON:
				return mutex(Variant.PETERSON);
			case COUNTER:
				return new DemoModel<Integer, PieceAction<Integer>>("counter(" + parameter + ")", CounterModel.create(parameter),
						x -> Math.abs(x) <= parameter);
			default:
				throw new UnsupportedOperationException("Unknown model " + kind);
		}
	}

	private static DemoModel<MutexState, MutexAction> mutex(final Variant variant) {
		return new DemoModel<>("alice-bob-" + variant.name().toLowerCase(), MutexModel.create(variant),
				MutexState::isMutuallyExclusive);
	}

	public String getName() {
		return name;
	}

	public SemanticTransitionRelation<C, A> getStr() {
		return str;
	}

	public Predicate<? super C> getInvariant() {
		return invariant;
	}

	@Override
	public String toString() {
		return name;
	}
}
