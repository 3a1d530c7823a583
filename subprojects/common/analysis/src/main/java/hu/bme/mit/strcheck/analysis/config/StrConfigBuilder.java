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
package hu.bme.mit.strcheck.analysis.config;

import com.google.common.base.Equivalence;
import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.algorithm.ExplorationBudget;
import hu.bme.mit.strcheck.analysis.algorithm.PredicateVerifier;
import hu.bme.mit.strcheck.analysis.algorithm.Reachability;
import hu.bme.mit.strcheck.analysis.algorithm.SearchStrategy;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.common.logging.Logger;
import hu.bme.mit.strcheck.common.logging.NullLogger;

import java.time.Duration;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

public final class StrConfigBuilder<C> {

	private Logger logger = NullLogger.getInstance();
	private SearchStrategy search = SearchStrategy.BFS;
	private ExplorationBudget budget = ExplorationBudget.unlimited();
	private Equivalence<? super C> equivalence = Equivalence.equals();

	public StrConfigBuilder<C> logger(final Logger logger) {
		this.logger = checkNotNull(logger);
		return this;
	}

	public StrConfigBuilder<C> search(final SearchStrategy search) {
		this.search = checkNotNull(search);
		return this;
	}

	public StrConfigBuilder<C> budget(final ExplorationBudget budget) {
		this.budget = checkNotNull(budget);
		return this;
	}

	public StrConfigBuilder<C> maxConfigurations(final int maxConfigurations) {
		this.budget = budget.withMaxConfigurations(maxConfigurations);
		return this;
	}

	public StrConfigBuilder<C> timeout(final Duration timeout) {
		this.budget = budget.withTimeout(timeout);
		return this;
	}

	public StrConfigBuilder<C> equivalence(final Equivalence<? super C> equivalence) {
		this.equivalence = checkNotNull(equivalence);
		return this;
	}

	public PredicateVerifier<C> buildVerifier() {
		final Reachability<C> reachability = Reachability.create(search, budget, equivalence, logger);
		return PredicateVerifier.create(reachability, logger);
	}

	public <A extends Action> StrConfig<C, A> build(final SemanticTransitionRelation<C, A> str,
													final Predicate<? super C> invariant) {
		return StrConfig.invariant(buildVerifier(), str, invariant);
	}

	public <A extends Action> StrConfig<C, A> buildDeadlockCheck(final SemanticTransitionRelation<C, A> str) {
		return StrConfig.deadlockFreedom(buildVerifier(), str);
	}

}
