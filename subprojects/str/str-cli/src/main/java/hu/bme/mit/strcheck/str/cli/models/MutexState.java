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

import hu.bme.mit.strcheck.common.Utils;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Configuration of two processes competing for a critical section: the
 * location and flag of each process and whose turn it is.
 */
public final class MutexState {

	public enum Location {
		/** Idle. */
		I,
		/** Waiting to enter. */
		W,
		/** In the critical section. */
		C
	}

	public enum Process {
		ALICE, BOB;

		public Process other() {
			return this == ALICE ? BOB : ALICE;
		}
	}

	private static final MutexState INITIAL = new MutexState(Location.I, Location.I, false, false, Process.ALICE);

	private final Location alice;
	private final Location bob;
	private final boolean aliceFlag;
	private final boolean bobFlag;
	private final Process turn;

	private MutexState(final Location alice, final Location bob, final boolean aliceFlag, final boolean bobFlag,
					   final Process turn) {
		this.alice = checkNotNull(alice);
		this.bob = checkNotNull(bob);
		this.aliceFlag = aliceFlag;
		this.bobFlag = bobFlag;
		this.turn = checkNotNull(turn);
	}

	public static MutexState initial() {
		return INITIAL;
	}

	public static MutexState of(final Location alice, final Location bob, final boolean aliceFlag,
								final boolean bobFlag, final Process turn) {
		return new MutexState(alice, bob, aliceFlag, bobFlag, turn);
	}

	public Location location(final Process process) {
		return process == Process.ALICE ? alice : bob;
	}

	public boolean flag(final Process process) {
		return process == Process.ALICE ? aliceFlag : bobFlag;
	}

	public Process getTurn() {
		return turn;
	}

	public MutexState withLocation(final Process process, final Location location) {
		return process == Process.ALICE
				? new MutexState(location, bob, aliceFlag, bobFlag, turn)
				: new MutexState(alice, location, aliceFlag, bobFlag, turn);
	}

	public MutexState withFlag(final Process process, final boolean flag) {
		return process == Process.ALICE
				? new MutexState(alice, bob, flag, bobFlag, turn)
				: new MutexState(alice, bob, aliceFlag, flag, turn);
	}

	public MutexState withTurn(final Process process) {
		return new MutexState(alice, bob, aliceFlag, bobFlag, process);
	}

	public boolean isMutuallyExclusive() {
		return !(alice == Location.C && bob == Location.C);
	}

	@Override
	public int hashCode() {
		return Objects.hash(alice, bob, aliceFlag, bobFlag, turn);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof MutexState) {
			final MutexState that = (MutexState) obj;
			return this.alice == that.alice && this.bob == that.bob && this.aliceFlag == that.aliceFlag
					&& this.bobFlag == that.bobFlag && this.turn == that.turn;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName())
				.add("(alice " + alice + (aliceFlag ? " !" : "") + ")")
				.add("(bob " + bob + (bobFlag ? " !" : "") + ")")
				.add("(turn " + turn + ")")
				.toString();
	}
}
