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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

public final class RootedGraphs {

	private RootedGraphs() {
	}

	/**
	 * Views a plain rooted graph as a labelled one, where every edge is
	 * labelled with {@link UnitAction}.
	 */
	public static <C> LabelledRootedGraph<C, UnitAction> unitLabelled(final RootedGraph<C> graph) {
		checkNotNull(graph);
		return new LabelledRootedGraph<>() {
			@Override
			public Collection<Edge<C, UnitAction>> edges(final C source) {
				final Collection<C> targets = graph.neighbours(source);
				final List<Edge<C, UnitAction>> result = new ArrayList<>(targets.size());
				for (final C target : targets) {
					result.add(Edge.of(UnitAction.getInstance(), target));
				}
				return result;
			}

			@Override
			public Collection<C> neighbours(final C source) {
				return graph.neighbours(source);
			}

			@Override
			public Collection<C> roots() {
				return graph.roots();
			}

			@Override
			public String toString() {
				return graph.toString();
			}
		};
	}

}
