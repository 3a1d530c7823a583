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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import hu.bme.mit.strcheck.analysis.Trace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Records, for every discovered configuration, the configuration and action
 * that discovered it first, and reconstructs root-to-target traces from these
 * records. Roots are recorded without a parent. Later discoveries of an
 * already recorded configuration are ignored, so the reconstructed trace is a
 * witness, not necessarily the shortest one.
 * <p>
 * Configurations are identified up to the given equivalence. The instance
 * recorded first is the one that appears in traces.
 */
public final class ParentTracer<C, A> {

	private final Equivalence<? super C> equivalence;
	private final Map<Equivalence.Wrapper<C>, Link<C, A>> links;

	private ParentTracer(final Equivalence<? super C> equivalence) {
		this.equivalence = checkNotNull(equivalence);
		this.links = new LinkedHashMap<>();
	}

	public static <C, A> ParentTracer<C, A> create() {
		return new ParentTracer<>(Equivalence.equals());
	}

	public static <C, A> ParentTracer<C, A> create(final Equivalence<? super C> equivalence) {
		return new ParentTracer<>(equivalence);
	}

	/**
	 * Records a root. Returns false if the configuration was already recorded.
	 */
	public boolean recordRoot(final C root) {
		final Equivalence.Wrapper<C> key = equivalence.wrap(checkNotNull(root));
		if (links.containsKey(key)) {
			return false;
		}
		links.put(key, new Link<>(root, null, null));
		return true;
	}

	/**
	 * Records that the child was discovered from the parent via the action.
	 * Returns false, and changes nothing, if the child already has a record.
	 */
	public boolean record(final C child, final C parent, final A action) {
		checkNotNull(child);
		checkNotNull(action);
		final Equivalence.Wrapper<C> parentKey = equivalence.wrap(checkNotNull(parent));
		checkArgument(links.containsKey(parentKey), "Parent %s has not been recorded", parent);
		final Equivalence.Wrapper<C> key = equivalence.wrap(child);
		if (links.containsKey(key)) {
			return false;
		}
		links.put(key, new Link<>(child, parentKey, action));
		return true;
	}

	public boolean contains(final C configuration) {
		return links.containsKey(equivalence.wrap(checkNotNull(configuration)));
	}

	public boolean isRoot(final C configuration) {
		return lookup(configuration).parent == null;
	}

	/**
	 * Returns the recorded parent of a configuration, or empty for roots.
	 */
	public Optional<C> getParent(final C configuration) {
		final Link<C, A> link = lookup(configuration);
		return link.parent == null ? Optional.empty() : Optional.of(links.get(link.parent).configuration);
	}

	/**
	 * Returns the action that discovered a configuration, or empty for roots.
	 */
	public Optional<A> getAction(final C configuration) {
		return Optional.ofNullable(lookup(configuration).action);
	}

	public int size() {
		return links.size();
	}

	/**
	 * The recorded configurations in order of discovery.
	 */
	public Collection<C> getConfigurations() {
		final List<C> result = new ArrayList<>(links.size());
		for (final Link<C, A> link : links.values()) {
			result.add(link.configuration);
		}
		return Collections.unmodifiableList(result);
	}

	/**
	 * Walks the parent records from the target back to a root and returns the
	 * trace in root-to-target order.
	 *
	 * @throws UnreachableConfigurationException if the target was never recorded
	 */
	public Trace<C, A> traceback(final C target) {
		final List<C> states = new ArrayList<>();
		final List<A> actions = new ArrayList<>();
		Link<C, A> link = lookup(target);
		states.add(link.configuration);
		while (link.parent != null) {
			actions.add(link.action);
			link = links.get(link.parent);
			states.add(link.configuration);
		}
		return Trace.of(ImmutableList.copyOf(Lists.reverse(states)), ImmutableList.copyOf(Lists.reverse(actions)));
	}

	private Link<C, A> lookup(final C configuration) {
		final Link<C, A> link = links.get(equivalence.wrap(checkNotNull(configuration)));
		if (link == null) {
			throw new UnreachableConfigurationException(configuration);
		}
		return link;
	}

	private static final class Link<C, A> {
		private final C configuration;
		private final Equivalence.Wrapper<C> parent;
		private final A action;

		private Link(final C configuration, final Equivalence.Wrapper<C> parent, final A action) {
			this.configuration = configuration;
			this.parent = parent;
			this.action = action;
		}
	}

}
