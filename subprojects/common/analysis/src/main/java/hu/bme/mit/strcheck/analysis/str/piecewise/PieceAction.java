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
package hu.bme.mit.strcheck.analysis.str.piecewise;

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.common.Utils;

import java.util.Collection;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A resolved leaf of a piecewise relation. Identified by its qualified name,
 * which is the path of piece names from the outermost piece to the leaf.
 */
public final class PieceAction<C> implements Action {

	private final String name;
	private final Function<? super C, ? extends Collection<? extends C>> body;

	PieceAction(final String name, final Function<? super C, ? extends Collection<? extends C>> body) {
		this.name = checkNotNull(name);
		this.body = checkNotNull(body);
	}

	public String getName() {
		return name;
	}

	Collection<? extends C> apply(final C configuration) {
		return checkNotNull(body.apply(configuration), "Piece %s returned null", name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof PieceAction) {
			final PieceAction<?> that = (PieceAction<?>) obj;
			return this.name.equals(that.name);
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(name).toString();
	}
}
