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

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.graph.LabelledRootedGraph;
import hu.bme.mit.strcheck.analysis.graph.RootedGraph;
import hu.bme.mit.strcheck.analysis.graph.RootedGraphs;
import hu.bme.mit.strcheck.analysis.graph.Str2RgAdapter;
import hu.bme.mit.strcheck.analysis.graph.UnitAction;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.common.Utils;
import hu.bme.mit.strcheck.common.logging.Logger;
import hu.bme.mit.strcheck.common.logging.Logger.Level;
import hu.bme.mit.strcheck.common.logging.NullLogger;

import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks invariants and deadlock freedom over the reachable configurations,
 * using a {@link Reachability} exploration. Violations are reported as
 * {@link SafetyResult.Unsafe} results carrying a root-to-violation trace;
 * running out of budget is reported as {@link SafetyResult.Unknown}.
 *
 * @param <C> type of configurations
 */
public final class PredicateVerifier<C> {

	private final Reachability<C> reachability;
	private final Logger logger;

	private PredicateVerifier(final Reachability<C> reachability, final Logger logger) {
		this.reachability = checkNotNull(reachability);
		this.logger = checkNotNull(logger);
	}

	public static <C> PredicateVerifier<C> create() {
		return new PredicateVerifier<>(Reachability.create(), NullLogger.getInstance());
	}

	public static <C> PredicateVerifier<C> create(final Reachability<C> reachability, final Logger logger) {
		return new PredicateVerifier<>(reachability, logger);
	}

	/**
	 * Evaluates the predicate on every newly discovered configuration and
	 * stops at the first one that violates it.
	 */
	public <A> SafetyResult<C, A> check(final LabelledRootedGraph<C, A> graph, final Predicate<? super C> predicate) {
		checkNotNull(predicate);
		logger.write(Level.INFO, "Configuration: %s%n", this);
		logger.write(Level.MAINSTEP, "Checking invariant...%n");
		final ReachabilityResult<C, A> reach = reachability.run(graph, c -> !predicate.test(c));

		final SafetyResult<C, A> result;
		switch (reach.getTermination()) {
			case STOPPED:
				final C violating = reach.getStoppedAt().get();
				logger.write(Level.MAINSTEP, "| Invariant violated in %s%n", violating);
				result = SafetyResult.unsafe(reach.traceTo(violating), reach.getStats());
				break;
			case COMPLETED:
				result = SafetyResult.safe(reach.size(), reach.getStats());
				break;
			case BUDGET_EXCEEDED:
				result = SafetyResult.unknown(reach.size(), reach.getStats());
				break;
			default:
				throw new AssertionError("Unknown termination " + reach.getTermination());
		}

		logger.write(Level.RESULT, "%s%n", result);
		logger.write(Level.INFO, "%s%n", reach.getStats());
		return result;
	}

	public SafetyResult<C, UnitAction> check(final RootedGraph<C> graph, final Predicate<? super C> predicate) {
		return check(RootedGraphs.unitLabelled(graph), predicate);
	}

	public <A extends Action> SafetyResult<C, A> check(final SemanticTransitionRelation<C, A> str,
													   final Predicate<? super C> predicate) {
		return check(Str2RgAdapter.create(str), predicate);
	}

	/**
	 * Explores the reachable configurations and reports the first one, in
	 * order of discovery, that has no enabled action. If the budget is
	 * exceeded, deadlocks among the configurations discovered so far are
	 * still reported; otherwise the result is unknown.
	 */
	public <A extends Action> SafetyResult<C, A> checkDeadlockFree(final SemanticTransitionRelation<C, A> str) {
		checkNotNull(str);
		logger.write(Level.INFO, "Configuration: %s%n", this);
		logger.write(Level.MAINSTEP, "Checking deadlock freedom...%n");
		final ReachabilityResult<C, A> reach = reachability.run(Str2RgAdapter.create(str));

		SafetyResult<C, A> result = null;
		for (final C configuration : reach.getReachableSet()) {
			if (str.enabled(configuration).isEmpty()) {
				logger.write(Level.MAINSTEP, "| Deadlock in %s%n", configuration);
				result = SafetyResult.unsafe(reach.traceTo(configuration), reach.getStats());
				break;
			}
		}
		if (result == null) {
			result = reach.isComplete()
					? SafetyResult.safe(reach.size(), reach.getStats())
					: SafetyResult.unknown(reach.size(), reach.getStats());
		}

		logger.write(Level.RESULT, "%s%n", result);
		logger.write(Level.INFO, "%s%n", reach.getStats());
		return result;
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(reachability).toString();
	}
}
