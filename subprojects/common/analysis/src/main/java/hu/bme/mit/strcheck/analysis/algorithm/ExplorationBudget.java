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

import hu.bme.mit.strcheck.common.Utils;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Optional limits on an exploration: the number of distinct configurations
 * that may be discovered and the wall-clock time it may take. Exceeding either
 * ends the exploration with {@link Termination#BUDGET_EXCEEDED}.
 */
public final class ExplorationBudget {

	private static final ExplorationBudget UNLIMITED = new ExplorationBudget(OptionalInt.empty(), Optional.empty());

	private final OptionalInt maxConfigurations;
	private final Optional<Duration> timeout;

	private ExplorationBudget(final OptionalInt maxConfigurations, final Optional<Duration> timeout) {
		this.maxConfigurations = checkNotNull(maxConfigurations);
		this.timeout = checkNotNull(timeout);
	}

	public static ExplorationBudget unlimited() {
		return UNLIMITED;
	}

	public static ExplorationBudget maxConfigurations(final int maxConfigurations) {
		return unlimited().withMaxConfigurations(maxConfigurations);
	}

	public static ExplorationBudget timeout(final Duration timeout) {
		return unlimited().withTimeout(timeout);
	}

	public ExplorationBudget withMaxConfigurations(final int maxConfigurations) {
		checkArgument(maxConfigurations > 0, "Configuration limit must be positive");
		return new ExplorationBudget(OptionalInt.of(maxConfigurations), timeout);
	}

	public ExplorationBudget withTimeout(final Duration timeout) {
		checkArgument(!timeout.isNegative(), "Timeout must not be negative");
		return new ExplorationBudget(maxConfigurations, Optional.of(timeout));
	}

	public OptionalInt getMaxConfigurations() {
		return maxConfigurations;
	}

	public Optional<Duration> getTimeout() {
		return timeout;
	}

	public boolean isUnlimited() {
		return maxConfigurations.isEmpty() && timeout.isEmpty();
	}

	boolean allowsAnother(final int discovered) {
		return maxConfigurations.isEmpty() || discovered < maxConfigurations.getAsInt();
	}

	boolean isExpired(final Duration elapsed) {
		return timeout.isPresent() && elapsed.compareTo(timeout.get()) >= 0;
	}

	@Override
	public String toString() {
		final var builder = Utils.lispStringBuilder(getClass().getSimpleName());
		if (isUnlimited()) {
			builder.add("unlimited");
		}
		maxConfigurations.ifPresent(max -> builder.add("configurations: " + max));
		timeout.ifPresent(t -> builder.add("timeout: " + t.toMillis() + " ms"));
		return builder.toString();
	}

}
