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
import com.google.common.base.Stopwatch;
import hu.bme.mit.strcheck.analysis.graph.Edge;
import hu.bme.mit.strcheck.analysis.graph.LabelledRootedGraph;
import hu.bme.mit.strcheck.analysis.graph.RootedGraph;
import hu.bme.mit.strcheck.analysis.graph.RootedGraphs;
import hu.bme.mit.strcheck.analysis.graph.UnitAction;
import hu.bme.mit.strcheck.common.Utils;
import hu.bme.mit.strcheck.common.logging.Logger;
import hu.bme.mit.strcheck.common.logging.Logger.Level;
import hu.bme.mit.strcheck.common.logging.NullLogger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Explicit-state exploration of a rooted graph. Computes the set of
 * configurations reachable from the roots and records, for every non-root
 * configuration, the configuration and edge label that discovered it first.
 * <p>
 * The exploration terminates only if the reachable set is finite, unless an
 * {@link ExplorationBudget} limits it. It can also be stopped as soon as a
 * newly discovered configuration satisfies a stop condition. Cancellation is
 * checked once per frontier element. Each call to {@code run} owns its
 * reachable set and parent map, so an instance can be reused.
 *
 * @param <C> type of configurations
 */
public final class Reachability<C> {

	private static final int PROGRESS_INTERVAL = 10_000;

	private final SearchStrategy search;
	private final ExplorationBudget budget;
	private final Equivalence<? super C> equivalence;
	private final Logger logger;

	private Reachability(final SearchStrategy search, final ExplorationBudget budget,
						 final Equivalence<? super C> equivalence, final Logger logger) {
		this.search = checkNotNull(search);
		this.budget = checkNotNull(budget);
		this.equivalence = checkNotNull(equivalence);
		this.logger = checkNotNull(logger);
	}

	public static <C> Reachability<C> create() {
		return new Reachability<>(SearchStrategy.BFS, ExplorationBudget.unlimited(), Equivalence.equals(),
				NullLogger.getInstance());
	}

	public static <C> Reachability<C> create(final SearchStrategy search, final ExplorationBudget budget,
											 final Equivalence<? super C> equivalence, final Logger logger) {
		return new Reachability<>(search, budget, equivalence, logger);
	}

	public SearchStrategy getSearch() {
		return search;
	}

	public ExplorationBudget getBudget() {
		return budget;
	}

	public <A> ReachabilityResult<C, A> run(final LabelledRootedGraph<C, A> graph) {
		return run(graph, c -> false);
	}

	public ReachabilityResult<C, UnitAction> run(final RootedGraph<C> graph) {
		return run(RootedGraphs.unitLabelled(graph), c -> false);
	}

	public ReachabilityResult<C, UnitAction> run(final RootedGraph<C> graph, final Predicate<? super C> stopWhen) {
		return run(RootedGraphs.unitLabelled(graph), stopWhen);
	}

	/**
	 * Explores the graph until the frontier is empty, the budget is exceeded,
	 * or the stop condition holds for a newly discovered configuration (roots
	 * included). Configurations are tested in order of discovery.
	 */
	public <A> ReachabilityResult<C, A> run(final LabelledRootedGraph<C, A> graph,
											 final Predicate<? super C> stopWhen) {
		checkNotNull(graph);
		checkNotNull(stopWhen);
		logger.write(Level.SUBSTEP, "|  Exploring %s%n", graph);
		final Stopwatch stopwatch = Stopwatch.createStarted();
		final ParentTracer<C, A> tracer = ParentTracer.create(equivalence);
		final Deque<C> frontier = new ArrayDeque<>();
		Termination termination = Termination.COMPLETED;
		C stoppedAt = null;
		int explored = 0;
		long transitions = 0;

		for (final C root : graph.roots()) {
			if (tracer.contains(root)) {
				continue;
			}
			if (!budget.allowsAnother(tracer.size())) {
				termination = Termination.BUDGET_EXCEEDED;
				break;
			}
			tracer.recordRoot(root);
			frontier.addLast(root);
			logger.write(Level.VERBOSE, "|  |  Root %s%n", root);
			if (stopWhen.test(root)) {
				termination = Termination.STOPPED;
				stoppedAt = root;
				break;
			}
		}

		exploration:
		while (termination == Termination.COMPLETED && !frontier.isEmpty()) {
			if (budget.isExpired(stopwatch.elapsed())) {
				termination = Termination.BUDGET_EXCEEDED;
				break;
			}
			final C current = search.next(frontier);
			explored++;
			if (explored % PROGRESS_INTERVAL == 0) {
				logger.write(Level.SUBSTEP, "|  |  Explored %d, reachable %d, frontier %d%n", explored,
						tracer.size(), frontier.size());
			}
			for (final Edge<C, A> edge : graph.edges(current)) {
				transitions++;
				final C target = edge.getTarget();
				if (tracer.contains(target)) {
					continue;
				}
				if (!budget.allowsAnother(tracer.size())) {
					termination = Termination.BUDGET_EXCEEDED;
					break exploration;
				}
				tracer.record(target, current, edge.getAction());
				frontier.addLast(target);
				logger.write(Level.VERBOSE, "|  |  %s --%s--> %s%n", current, edge.getAction(), target);
				if (stopWhen.test(target)) {
					termination = Termination.STOPPED;
					stoppedAt = target;
					break exploration;
				}
			}
		}

		stopwatch.stop();
		final ReachabilityStatistics stats = new ReachabilityStatistics(stopwatch.elapsed().toMillis(),
				tracer.size(), explored, transitions, termination);
		logger.write(Level.SUBSTEP, "|  Exploration done: %s, %d reachable configurations%n", termination,
				tracer.size());
		return new ReachabilityResult<>(tracer, termination, Optional.ofNullable(stoppedAt), stats);
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(search).add(budget).toString();
	}
}
