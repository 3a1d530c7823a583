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

import com.google.common.collect.ImmutableList;
import hu.bme.mit.strcheck.analysis.str.SemanticTransitionRelation;
import hu.bme.mit.strcheck.common.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Semantic transition relation given as a list of (possibly nested, possibly
 * overlapping) guarded pieces. The guard tree is resolved eagerly in
 * {@link #enabled(Object)}, which only exposes the leaf actions.
 */
public final class PiecewiseStr<C> implements SemanticTransitionRelation<C, PieceAction<C>> {

	private final List<C> roots;
	private final List<Piece<C>> pieces;

	private PiecewiseStr(final Builder<C> builder) {
		this.roots = builder.roots.build();
		this.pieces = builder.pieces.build();
	}

	public static <C> Builder<C> builder() {
		return new Builder<>();
	}

	public List<Piece<C>> getPieces() {
		return pieces;
	}

	@Override
	public Collection<C> roots() {
		return roots;
	}

	@Override
	public Collection<PieceAction<C>> enabled(final C configuration) {
		checkNotNull(configuration);
		final List<PieceAction<C>> actions = new ArrayList<>();
		for (final Piece<C> piece : pieces) {
			piece.resolve(configuration, "", actions);
		}
		return actions;
	}

	@Override
	public Collection<C> execute(final PieceAction<C> action, final C configuration) {
		return ImmutableList.copyOf(action.apply(checkNotNull(configuration)));
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add("roots: " + roots).body().addAll(pieces)
				.toString();
	}

	public static final class Builder<C> {
		private final ImmutableList.Builder<C> roots;
		private final ImmutableList.Builder<Piece<C>> pieces;
		private boolean hasRoot;

		private Builder() {
			roots = ImmutableList.builder();
			pieces = ImmutableList.builder();
			hasRoot = false;
		}

		public Builder<C> root(final C root) {
			roots.add(root);
			hasRoot = true;
			return this;
		}

		public Builder<C> piece(final Piece<C> piece) {
			pieces.add(piece);
			return this;
		}

		public PiecewiseStr<C> build() {
			checkState(hasRoot, "At least one root is required");
			return new PiecewiseStr<>(this);
		}
	}

}
