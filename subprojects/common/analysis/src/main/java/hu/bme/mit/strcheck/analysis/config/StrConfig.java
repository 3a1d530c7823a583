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

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.algorithm.PredicateVerifier;
import hu.bme.mit.strcheck.analysis.algorithm.SafetyResult;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;

import java.util.function.Function;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A verifier bound to one transition relation and one property, ready to be
 * checked.
 */
public final class StrConfig<C, A extends Action> {
	private final PredicateVerifier<C> verifier;
	private final SemanticTransitionRelation<C, A> str;
	private final Function<PredicateVerifier<C>, SafetyResult<C, A>> property;

	private StrConfig(final PredicateVerifier<C> verifier, final SemanticTransitionRelation<C, A> str,
					  final Function<PredicateVerifier<C>, SafetyResult<C, A>> property) {
		this.verifier = checkNotNull(verifier);
		this.str = checkNotNull(str);
		this.property = checkNotNull(property);
	}

	public static <C, A extends Action> StrConfig<C, A> invariant(
			final PredicateVerifier<C> verifier, final SemanticTransitionRelation<C, A> str,
			final Predicate<? super C> invariant) {
		checkNotNull(invariant);
		return new StrConfig<>(verifier, str, v -> v.check(str, invariant));
	}

	public static <C, A extends Action> StrConfig<C, A> deadlockFreedom(
			final PredicateVerifier<C> verifier, final SemanticTransitionRelation<C, A> str) {
		return new StrConfig<>(verifier, str, v -> v.checkDeadlockFree(str));
	}

	public PredicateVerifier<C> getVerifier() {
		return verifier;
	}

	public SemanticTransitionRelation<C, A> getStr() {
		return str;
	}

	public SafetyResult<C, A> check() {
		return property.apply(verifier);
	}

}
