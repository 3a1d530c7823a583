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
import hu.bme.mit.strcheck.common.Utils;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One guarded piece of a piecewise transition relation. A piece is either a
 * {@link Leaf}, whose body computes the successors of a configuration, or a
 * {@link Nested} piece, whose body is itself a list of guarded pieces.
 *
 * @param <C> type of configurations
 */
public abstract class Piece<C> {

	static final String SEPARATOR = "/";

	private final String name;
	private final Predicate<? super C> guard;

	private Piece(final String name, final Predicate<? super C> guard) {
		checkArgument(!name.isEmpty(), "Piece name must not be empty");
		this.name = name;
		this.guard = checkNotNull(guard);
	}

	/**
	 * Creates a leaf piece whose body yields any number of successors.
	 */
	public static <C> Piece<C> leaf(final String name, final Predicate<? super C> guard,
									final Function<? super C, ? extends Collection<? extends C>> body) {
		return new Leaf<>(name, guard, body);
	}

	/**
	 * Creates a leaf piece whose body yields exactly one successor.
	 */
	public static <C> Piece<C> update(final String name, final Predicate<? super C> guard,
									  final Function<? super C, ? extends C> update) {
		checkNotNull(update);
		return new Leaf<C>(name, guard, c -> ImmutableList.of(update.apply(c)));
	}

	public static <C> Piece<C> nested(final String name, final Predicate<? super C> guard,
									  final List<? extends Piece<C>> pieces) {
		return new Nested<>(name, guard, pieces);
	}

	@SafeVarargs
	public static <C> Piece<C> nested(final String name, final Predicate<? super C> guard,
									  final Piece<C>... pieces) {
		return new Nested<>(name, guard, ImmutableList.copyOf(pieces));
	}

	public String getName() {
		return name;
	}

	public final boolean holds(final C configuration) {
		return guard.test(configuration);
	}

	/**
	 * Adds the leaf actions enabled in the configuration to the list, outer
	 * guards first and siblings left to right.
	 */
	abstract void resolve(C configuration, String prefix, List<PieceAction<C>> into);

	////

	public static final class Leaf<C> extends Piece<C> {
		private final Function<? super C, ? extends Collection<? extends C>> body;

		private Leaf(final String name, final Predicate<? super C> guard,
					 final Function<? super C, ? extends Collection<? extends C>> body) {
			super(name, guard);
			this.body = checkNotNull(body);
		}

		@Override
		void resolve(final C configuration, final String prefix, final List<PieceAction<C>> into) {
			if (holds(configuration)) {
				into.add(new PieceAction<>(prefix + getName(), body));
			}
		}

		@Override
		public String toString() {
			return Utils.lispStringBuilder(getClass().getSimpleName()).add(getName()).toString();
		}
	}

	public static final class Nested<C> extends Piece<C> {
		private final List<Piece<C>> pieces;

		private Nested(final String name, final Predicate<? super C> guard, final List<? extends Piece<C>> pieces) {
			super(name, guard);
			this.pieces = ImmutableList.copyOf(pieces);
		}

		public List<Piece<C>> getPieces() {
			return pieces;
		}

		@Override
		void resolve(final C configuration, final String prefix, final List<PieceAction<C>> into) {
			if (holds(configuration)) {
				final String childPrefix = prefix + getName() + SEPARATOR;
				for (final Piece<C> piece : pieces) {
					piece.resolve(configuration, childPrefix, into);
				}
			}
		}

		@Override
		public String toString() {
			return Utils.lispStringBuilder(getClass().getSimpleName()).add(getName()).body().addAll(pieces)
					.toString();
		}
	}

}
