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
package hu.bme.mit.strcheck.analysis.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import hu.bme.mit.strcheck.common.Utils;

/**
 * Immutable assignment of values to named variables, usable as a
 * configuration. Updates create new instances ({@link #with(String, Object)}),
 * so a successor never shares mutable state with its predecessor. Equality is
 * independent of the order in which variables were put.
 */
public final class ImmutableValuation {

	private static final class LazyHolder {
		private static final ImmutableValuation EMPTY = new Builder().build();
	}

	private final Map<String, Object> varToValue;
	private final int hashCode;

	private ImmutableValuation(final Map<String, Object> varToValue) {
		this.varToValue = varToValue;
		this.hashCode = varToValue.hashCode();
	}

	public static ImmutableValuation empty() {
		return LazyHolder.EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Collection<String> getVars() {
		return varToValue.keySet();
	}

	public Optional<Object> eval(final String var) {
		return Optional.ofNullable(varToValue.get(checkNotNull(var)));
	}

	/**
	 * Returns the value of a variable, which must be present and of the given
	 * type.
	 */
	public <T> T get(final String var, final Class<T> type) {
		final Object value = varToValue.get(checkNotNull(var));
		checkArgument(value != null, "Variable %s has no value", var);
		checkArgument(type.isInstance(value), "Variable %s has value %s, not of type %s", var, value,
				type.getSimpleName());
		return type.cast(value);
	}

	/**
	 * Returns a copy in which the variable has the given value.
	 */
	public ImmutableValuation with(final String var, final Object value) {
		checkNotNull(var);
		checkNotNull(value);
		if (value.equals(varToValue.get(var))) {
			return this;
		}
		final Builder builder = builder();
		varToValue.forEach((k, v) -> builder.put(k, k.equals(var) ? value : v));
		if (!varToValue.containsKey(var)) {
			builder.put(var, value);
		}
		return builder.build();
	}

	public Map<String, Object> toMap() {
		return varToValue;
	}

	@Override
	public int hashCode() {
		return hashCode;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof ImmutableValuation) {
			final ImmutableValuation that = (ImmutableValuation) obj;
			return this.hashCode == that.hashCode && this.varToValue.equals(that.varToValue);
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		final var builder = Utils.lispStringBuilder(getClass().getSimpleName());
		varToValue.forEach((var, value) -> builder.add("(" + var + " " + value + ")"));
		return builder.toString();
	}

	public final static class Builder {
		private final ImmutableMap.Builder<String, Object> builder;

		private Builder() {
			builder = ImmutableMap.builder();
		}

		public Builder put(final String var, final Object value) {
			checkArgument(!var.isEmpty(), "Variable name must not be empty");
			builder.put(var, checkNotNull(value));
			return this;
		}

		public ImmutableValuation build() {
			return new ImmutableValuation(builder.buildOrThrow());
		}

	}

}
