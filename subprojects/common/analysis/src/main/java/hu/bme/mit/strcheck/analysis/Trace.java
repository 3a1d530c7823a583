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
package hu.bme.mit.strcheck.analysis;

import com.google.common.collect.ImmutableList;
import hu.bme.mit.strcheck.analysis.graph.RootedGraph;
import hu.bme.mit.strcheck.common.Utils;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Represents an immutable, alternating trace in the form of a (C, A, C, A,
 * ..., C, A, C) sequence of configurations and actions. A trace always
 * contains at least one configuration and one more configuration than
 * actions.
 */
public final class Trace<C, A> {

	private final List<C> states;
	private final List<A> actions;

	private Trace(final List<? extends C> states, final List<? extends A> actions) {
		checkArgument(!states.isEmpty(), "A trace must contain at least one configuration");
		checkArgument(states.size() == actions.size() + 1,
				"Number of configurations (%s) must be one more than the number of actions (%s)",
				states.size(), actions.size());
		this.states = ImmutableList.copyOf(states);
		this.actions = ImmutableList.copyOf(actions);
	}

	public static <C, A> Trace<C, A> of(final List<? extends C> states, final List<? extends A> actions) {
		return new Trace<>(states, actions);
	}

	public static <C, A> Trace<C, A> single(final C state) {
		return new Trace<>(ImmutableList.of(state), ImmutableList.of());
	}

	/**
	 * Number of steps, that is, the number of actions.
	 */
	public int length() {
		return actions.size();
	}

	public C getState(final int index) {
		checkElementIndex(index, states.size());
		return states.get(index);
	}

	public A getAction(final int index) {
		checkElementIndex(index, actions.size());
		return actions.get(index);
	}

	public List<C> getStates() {
		return states;
	}

	public List<A> getActions() {
		return actions;
	}

	public C getFirstState() {
		return states.get(0);
	}

	public C getLastState() {
		return states.get(states.size() - 1);
	}

	/**
	 * Checks that the trace starts in a root of the graph and every
	 * consecutive pair of configurations is connected by a neighbour step.
	 */
	public boolean isValidIn(final RootedGraph<? super C> graph) {
		if (!graph.roots().contains(getFirstState())) {
			return false;
		}
		for (int i = 0; i < actions.size(); i++) {
			if (!graph.neighbours(states.get(i)).contains(states.get(i + 1))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return 31 * states.hashCode() + actions.hashCode();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Trace) {
			final Trace<?, ?> that = (Trace<?, ?>) obj;
			return this.states.equals(that.states) && this.actions.equals(that.actions);
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		final var builder = Utils.lispStringBuilder(getClass().getSimpleName()).body();
		for (int i = 0; i < actions.size(); i++) {
			builder.add(states.get(i)).add(actions.get(i));
		}
		return builder.add(getLastState()).toString();
	}

}
