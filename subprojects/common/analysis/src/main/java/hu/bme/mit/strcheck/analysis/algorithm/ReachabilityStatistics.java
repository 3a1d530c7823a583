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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

public final class ReachabilityStatistics extends Statistics {

	private final long elapsedMillis;
	private final int reachable;
	private final int explored;
	private final long transitions;
	private final Termination termination;

	public ReachabilityStatistics(final long elapsedMillis, final int reachable, final int explored,
								  final long transitions, final Termination termination) {
		this.elapsedMillis = elapsedMillis;
		this.reachable = reachable;
		this.explored = explored;
		this.transitions = transitions;
		this.termination = checkNotNull(termination);
	}

	public static String[] header() {
		return new String[]{"ElapsedMs", "Reachable", "Explored", "Transitions", "Termination"};
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}

	/**
	 * Number of distinct configurations discovered.
	 */
	public int getReachable() {
		return reachable;
	}

	/**
	 * Number of configurations whose neighbours were computed.
	 */
	public int getExplored() {
		return explored;
	}

	/**
	 * Number of edges followed, including those leading to known
	 * configurations.
	 */
	public long getTransitions() {
		return transitions;
	}

	public Termination getTermination() {
		return termination;
	}

	@Override
	public Map<String, Object> toMap() {
		final String[] header = header();
		return ImmutableMap.of(
				header[0], elapsedMillis,
				header[1], reachable,
				header[2], explored,
				header[3], transitions,
				header[4], termination);
	}

}
