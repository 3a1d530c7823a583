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
package hu.bme.mit.strcheck.str.cli.models;

import com.google.common.collect.ImmutableList;
import hu.bme.mit.strcheck.analysis.str.piecewise.Piece;
import hu.bme.mit.strcheck.analysis.str.piecewise.PiecewiseStr;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An integer that, while positive, is non-deterministically negated or
 * decremented, and while negative is incremented. Zero has no successor.
 */
public final class CounterModel {

	private CounterModel() {
	}

	public static PiecewiseStr<Integer> create(final int root) {
		checkArgument(root >= 0, "Root must not be negative");
		return PiecewiseStr.<Integer>builder()
				.root(root)
				.piece(Piece.nested("nonzero", x -> x != 0,
						Piece.<Integer>leaf("branch", x -> x > 0, x -> ImmutableList.of(-x, x - 1)),
						Piece.<Integer>update("increment", x -> x < 0, x -> x + 1)))
				.build();
	}

}
