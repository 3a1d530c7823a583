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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Rooted graph whose edges carry the action that produced them.
 *
 * @param <C> type of vertices (configurations)
 * @param <A> type of edge labels
 */
public interface LabelledRootedGraph<C, A> extends RootedGraph<C> {

	Collection<Edge<C, A>> edges(C source);

	@Override
	default Collection<C> neighbours(final C source) {
		final Set<C> result = new LinkedHashSet<>();
		for (final Edge<C, A> edge : edges(source)) {
			result.add(edge.getTarget());
		}
		return result;
	}

}
