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

import hu.bme.mit.strcheck.analysis.Trace;
import hu.bme.mit.strcheck.common.Utils;

import java.util.Collection;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of one exploration: the reachable set and parent map (both held by
 * the {@link ParentTracer}), how the exploration ended, and statistics. The
 * result is owned by the caller; nothing is shared between runs.
 */
public final class ReachabilityResult<C, A> {

	private final ParentTracer<C, A> tracer;
	private final Termination termination;
	private final Optional<C> stoppedAt;
	private final ReachabilityStatistics stats;

	ReachabilityResult(final ParentTracer<C, A> tracer, final Termination termination, final Optional<C> stoppedAt,
					   final ReachabilityStatistics stats) {
		checkArgument(stoppedAt.isPresent() == (termination == Termination.STOPPED),
				"A stopping configuration is present exactly when the exploration was stopped");
		this.tracer = checkNotNull(tracer);
		this.termination = checkNotNull(termination);
		this.stoppedAt = stoppedAt;
		this.stats = checkNotNull(stats);
	}

	/**
	 * The distinct configurations discovered, in order of discovery. Exact
	 * when the termination is {@link Termination#COMPLETED}.
	 */
	public Collection<C> getReachableSet() {
		return tracer.getConfigurations();
	}

	public int size() {
		return tracer.size();
	}

	public boolean contains(final C configuration) {
		return tracer.contains(configuration);
	}

	public ParentTracer<C, A> getParentTracer() {
		return tracer;
	}

	public Termination getTermination() {
		return termination;
	}

	public boolean isComplete() {
		return termination == Termination.COMPLETED;
	}

	/**
	 * The configuration for which the stop condition held, if the exploration
	 * was stopped.
	 */
	public Optional<C> getStoppedAt() {
		return stoppedAt;
	}

	public ReachabilityStatistics getStats() {
		return stats;
	}

	public Trace<C, A> traceTo(final C target) {
		return tracer.traceback(target);
	}

	@Override
	public String toString() {
		return Utils.lispStringBuilder(getClass().getSimpleName()).add(termination)
				.add("Reachable: " + tracer.size()).toString();
	}
}
