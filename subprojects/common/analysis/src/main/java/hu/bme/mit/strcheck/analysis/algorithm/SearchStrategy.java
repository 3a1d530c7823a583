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

import java.util.Deque;

/**
 * Order in which the frontier is processed. Only the reachable set and the
 * existence of some witness are guaranteed, so both are correct; breadth-first
 * search yields shortest witnesses.
 */
public enum SearchStrategy {

	BFS {
		@Override
		<T> T next(final Deque<T> frontier) {
			return frontier.pollFirst();
		}
	},

	DFS {
		@Override
		<T> T next(final Deque<T> frontier) {
			return frontier.pollLast();
		}
	};

	abstract <T> T next(Deque<T> frontier);

}
