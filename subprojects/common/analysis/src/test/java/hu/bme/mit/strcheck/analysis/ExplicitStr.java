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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Transition relation over integers given by an explicit table of labelled
 * actions, used as a fixture in tests.
 */
public final class ExplicitStr implements SemanticTransitionRelation<Integer, ExplicitStr.Label> {

	private final List<Integer> roots;
	private final ListMultimap<Integer, Label> enabled;
	private final Map<Label, List<Integer>> targets;

	private ExplicitStr(final List<Integer> roots, final ListMultimap<Integer, Label> enabled,
						final Map<Label, List<Integer>> targets) {
		this.roots = roots;
		this.enabled = enabled;
		this.targets = targets;
	}

	public static Builder builder(final Integer... roots) {
		return new Builder(ImmutableList.copyOf(roots));
	}

	@Override
	public Collection<Integer> roots() {
		return roots;
	}

	@Override
	public Collection<Label> enabled(final Integer configuration) {
		return enabled.get(configuration);
	}

	@Override
	public Collection<Integer> execute(final Label action, final Integer configuration) {
		checkArgument(action.source == configuration.intValue(), "%s is not enabled in %s", action, configuration);
		return targets.get(action);
	}

	public static final class Label implements Action {
		private final int source;
		private final String name;

		public Label(final int source, final String name) {
			this.source = source;
			this.name = name;
		}

		@Override
		public int hashCode() {
			return 31 * source + name.hashCode();
		}

		@Override
		public boolean equals(final Object obj) {
			if (obj instanceof Label) {
				final Label that = (Label) obj;
				return this.source == that.source && this.name.equals(that.name);
			}
			return false;
		}

		@Override
		public String toString() {
			return name + "@" + source;
		}
	}

	public static final class Builder {
		private final List<Integer> roots;
		private final ListMultimap<Integer, Label> enabled = ArrayListMultimap.create();
		private final Map<Label, List<Integer>> targets = new HashMap<>();

		private Builder(final List<Integer> roots) {
			this.roots = roots;
		}

		public Builder action(final int source, final String name, final Integer... successors) {
			final Label label = new Label(source, name);
			enabled.put(source, label);
			targets.put(label, new ArrayList<>(List.of(successors)));
			return this;
		}

		public ExplicitStr build() {
			return new ExplicitStr(roots, enabled, targets);
		}
	}
}
