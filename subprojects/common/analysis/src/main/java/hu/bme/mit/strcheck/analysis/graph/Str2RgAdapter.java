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
package hu.bme.mit.strcheck.analysis.graph;

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.common.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stateless view of a semantic transition relation as a rooted graph. The
 * neighbours of a configuration are the union of the successors of every
 * enabled action; the edges keep the action that produced each successor.
 */
public final class Str2RgAdapter<C, A extends Action> implements LabelledRootedGraph<C, A> {

	private final SemanticTransitionRelation<C, A> str;

	private Str2RgAdapter(final SemanticTransitionRelation<C, A> str) {
		this.str = checkNotNull(str);
	}

	public static <C, A extends Action> Str2RgAdapter<C, A> create(final SemanticTransitionRelation<C, A> str) {
		return new Str2RgAdapter<>(str);
	}

	public SemanticTransitionRelation<C, A> getStr() {
		return str;
	}

	@Override
	public Collection<C> roots() {
		return str.roots();
	}

	@Override
	public Collection<Edge<C, A>> edges(final C source) {
		final List<Edge<C, A>> result = new ArrayList<>();
		for (final A action : str.enabled(source)) {
			for (final C target : str.execute(action, source)) {
				result.add(Edge.of(action, target));
			}
		}
		return result;
	}

	@Override
	public Collection<C> neighbours(final C source) {
		final Set<C> result = new LinkedHashSet<>();
		for (final A action : str.enabled(source)) {
			result.addAll(str.execute(action, source));
		}
		return result;
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).body().add(str).toString();
	}
}
