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

import com.google.common.collect.ImmutableList;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.common.Utils;
import hu.bme.mit.strcheck.str.cli.models.MutexAction.Move;
import hu.bme.mit.strcheck.str.cli.models.MutexState.Location;
import hu.bme.mit.strcheck.str.cli.models.MutexState.Process;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Alice and Bob sharing a critical section, in three variants of increasing
 * care.
 */
public final class MutexModel implements SemanticTransitionRelation<MutexState, MutexAction> {

	public enum Variant {
		/** I to C and back, no waiting: mutual exclusion is violated. */
		SIMPLE,
		/** Raise a flag while waiting, enter if the other flag is down: safe, but can deadlock. */
		FLAGS,
		/** Flags plus a turn variable (Peterson): safe and deadlock-free. */
		PETERSON
	}

	private final Variant variant;

	private MutexModel(final Variant variant) {
		this.variant = checkNotNull(variant);
	}

	public static MutexModel create(final Variant variant) {
		return new MutexModel(variant);
	}

	public Variant getVariant() {
		return variant;
	}

	@Override
	public Collection<MutexState> roots() {
		return ImmutableList.of(MutexState.initial());
	}

	@Override
	public Collection<MutexAction> enabled(final MutexState state) {
		final List<MutexAction> actions = new ArrayList<>(2);
		for (final Process process : Process.values()) {
			switch (state.location(process)) {
				case I:
					actions.add(MutexAction.of(process, variant == Variant.SIMPLE ? Move.ENTER : Move.WAIT));
					break;
				case W:
					if (mayEnter(state, process)) {
						actions.add(MutexAction.of(process, Move.ENTER));
					}
					break;
				case C:
					actions.add(MutexAction.of(process, Move.LEAVE));
					break;
				default:
					throw new AssertionError();
			}
		}
		return actions;
	}

	private boolean mayEnter(final MutexState state, final Process process) {
		final boolean otherDown = !state.flag(process.other());
		return variant == Variant.PETERSON ? otherDown || state.getTurn() == process : otherDown;
	}

	@Override
	public Collection<MutexState> execute(final MutexAction action, final MutexState state) {
		final Process process = action.getProcess();
		switch (action.getMove()) {
			case WAIT:
				checkArgument(state.location(process) == Location.I);
				MutexState waiting = state.withLocation(process, Location.W).withFlag(process, true);
				if (variant == Variant.PETERSON) {
					waiting = waiting.withTurn(process.other());
				}
				return ImmutableList.of(waiting);
			case ENTER:
				checkArgument(state.location(process) != Location.C);
				return ImmutableList.of(state.withLocation(process, Location.C));
			case LEAVE:
				checkArgument(state.location(process) == Location.C);
				return ImmutableList.of(state.withLocation(process, Location.I).withFlag(process, false));
			default:
				throw new AssertionError();
		}
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(variant).toString();
	}
}
