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
import hu.bme.mit.strcheck.common.Utils;
import hu.bme.mit.strcheck.str.cli.models.MutexState.Process;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

public final class MutexAction implements Action {

	public enum Move {
		WAIT, ENTER, LEAVE
	}

	private final Process process;
	private final Move move;

	private MutexAction(final Process process, final Move move) {
		this.process = checkNotNull(process);
		this.move = checkNotNull(move);
	}

	public static MutexAction of(final Process process, final Move move) {
		return new MutexAction(process, move);
	}

	public Process getProcess() {
		return process;
	}

	public Move getMove() {
		return move;
	}

	@Override
	public int hashCode() {
		return Objects.hash(process, move);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof MutexAction) {
			final MutexAction that = (MutexAction) obj;
			return this.process == that.process && this.move == that.move;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(process).add(move).toString();
	}
}
