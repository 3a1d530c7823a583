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

import hu.bme.mit.strcheck.common.Utils;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

public final class Edge<C, A> {

	private final A action;
	private final C target;

	private Edge(final A action, final C target) {
		this.action = checkNotNull(action);
		this.target = checkNotNull(target);
	}

	public static <C, A> Edge<C, A> of(final A action, final C target) {
		return new Edge<>(action, target);
	}

	public A getAction() {
		return action;
	}

	public C getTarget() {
		return target;
	}

	@Override
	public int hashCode() {
		return Objects.hash(action, target);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Edge) {
			final Edge<?, ?> that = (Edge<?, ?>) obj;
			return this.action.equals(that.action) && this.target.equals(that.target);
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(action).add(target).toString();
	}
}
