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
package hu.bme.mit.strcheck.analysis.str;

import hu.bme.mit.strcheck.analysis.Action;

import java.util.Collection;

/**
 * Intensional description of a transition system: a finite set of initial
 * configurations, the actions enabled in a configuration, and the execution of
 * an action yielding the successor configurations.
 * <p>
 * Configurations must be immutable values with consistent {@code equals} and
 * {@code hashCode} (or be explored under an explicit equivalence). Both
 * {@link #enabled(Object)} and {@link #execute(Action, Object)} must be pure:
 * calling them twice with the same arguments yields the same result.
 *
 * @param <C> type of configurations
 * @param <A> type of actions
 */
public interface SemanticTransitionRelation<C, A extends Action> {

	/**
	 * Returns the initial configurations. Must be finite.
	 */
	Collection<C> roots();

	/**
	 * Returns the leaf-level actions whose guard holds in the given
	 * configuration. Guards need not be mutually exclusive. An empty result
	 * means the configuration is a deadlock.
	 */
	Collection<A> enabled(C configuration);

	/**
	 * Executes an action in the configuration it was enabled in. The result
	 * may be empty or contain several successors. Passing an action that was
	 * not returned by {@link #enabled(Object)} for the same configuration is
	 * not supported.
	 */
	Collection<C> execute(A action, C configuration);

}
