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

import hu.bme.mit.strcheck.analysis.Trace;
import hu.bme.mit.strcheck.common.Utils;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of checking a property over the reachable configurations: the
 * property holds ({@link Safe}), a witness trace to a violating configuration
 * was found ({@link Unsafe}), or the exploration budget ran out before either
 * could be decided ({@link Unknown}).
 */
public abstract class SafetyResult<C, A> {
	private final Optional<Statistics> stats;

	private SafetyResult(final Optional<Statistics> stats) {
		this.stats = checkNotNull(stats);
	}

	public Optional<Statistics> getStats() {
		return stats;
	}

	public static <C, A> Safe<C, A> safe(final int reachableCount) {
		return new Safe<>(reachableCount, Optional.empty());
	}

	public static <C, A> Safe<C, A> safe(final int reachableCount, final Statistics stats) {
		return new Safe<>(reachableCount, Optional.of(stats));
	}

	public static <C, A> Unsafe<C, A> unsafe(final Trace<C, A> cex) {
		return new Unsafe<>(cex, Optional.empty());
	}

	public static <C, A> Unsafe<C, A> unsafe(final Trace<C, A> cex, final Statistics stats) {
		return new Unsafe<>(cex, Optional.of(stats));
	}

	public static <C, A> Unknown<C, A> unknown(final int exploredCount) {
		return new Unknown<>(exploredCount, Optional.empty());
	}

	public static <C, A> Unknown<C, A> unknown(final int exploredCount, final Statistics stats) {
		return new Unknown<>(exploredCount, Optional.of(stats));
	}

	public abstract boolean isSafe();

	public abstract boolean isUnsafe();

	public boolean isUnknown() {
		return !isSafe() && !isUnsafe();
	}

	public Safe<C, A> asSafe() {
		throw new ClassCastException(
				"Cannot cast " + getClass().getSimpleName() + " to " + Safe.class.getSimpleName());
	}

	public Unsafe<C, A> asUnsafe() {
		throw new ClassCastException(
				"Cannot cast " + getClass().getSimpleName() + " to " + Unsafe.class.getSimpleName());
	}

	public Unknown<C, A> asUnknown() {
		throw new ClassCastException(
				"Cannot cast " + getClass().getSimpleName() + " to " + Unknown.class.getSimpleName());
	}

	////

	public static final class Safe<C, A> extends SafetyResult<C, A> {
		private final int reachableCount;

		private Safe(final int reachableCount, final Optional<Statistics> stats) {
			super(stats);
			checkArgument(reachableCount >= 0);
			this.reachableCount = reachableCount;
		}

		/**
		 * Number of reachable configurations the property was checked on.
		 */
		public int getReachableCount() {
			return reachableCount;
		}

		@Override
		public boolean isSafe() {
			return true;
		}

		@Override
		public boolean isUnsafe() {
			return false;
		}

		@Override
		public Safe<C, A> asSafe() {
			return this;
		}

		@Override
		public String toString() {
			return Utils.lispStringBuilder(SafetyResult.class.getSimpleName()).add(Safe.class.getSimpleName())
					.add("Holds for all " + reachableCount + " reachable configurations").toString();
		}
	}

	public static final class Unsafe<C, A> extends SafetyResult<C, A> {
		private final Trace<C, A> cex;

		private Unsafe(final Trace<C, A> cex, final Optional<Statistics> stats) {
			super(stats);
			this.cex = checkNotNull(cex);
		}

		public Trace<C, A> getTrace() {
			return cex;
		}

		public C getViolatingConfiguration() {
			return cex.getLastState();
		}

		@Override
		public boolean isSafe() {
			return false;
		}

		@Override
		public boolean isUnsafe() {
			return true;
		}

		@Override
		public Unsafe<C, A> asUnsafe() {
			return this;
		}

		@Override
		public String toString() {
			return Utils.lispStringBuilder(SafetyResult.class.getSimpleName()).add(Unsafe.class.getSimpleName())
					.add("Trace length: " + cex.length()).toString();
		}
	}

	public static final class Unknown<C, A> extends SafetyResult<C, A> {
		private final int exploredCount;

		private Unknown(final int exploredCount, final Optional<Statistics> stats) {
			super(stats);
			checkArgument(exploredCount >= 0);
			this.exploredCount = exploredCount;
		}

		/**
		 * Number of configurations discovered before the budget was exceeded.
		 */
		public int getExploredCount() {
			return exploredCount;
		}

		@Override
		public boolean isSafe() {
			return false;
		}

		@Override
		public boolean isUnsafe() {
			return false;
		}

		@Override
		public Unknown<C, A> asUnknown() {
			return this;
		}

		@Override
		public String toString() {
			return Utils.lispStringBuilder(SafetyResult.class.getSimpleName()).add(Unknown.class.getSimpleName())
					.add("Budget exceeded after " + exploredCount + " configurations").toString();
		}
	}

}
