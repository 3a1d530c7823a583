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
package hu.bme.mit.strcheck.common.logging;

/**
 * Interface for logging within algorithms. Messages are formatted with
 * {@link String#format(String, Object...)} patterns.
 */
public interface Logger {

	enum Level {
		RESULT(1), MAINSTEP(2), SUBSTEP(3), INFO(4), DETAIL(5), VERBOSE(6);

		private final int value;

		Level(final int value) {
			this.value = value;
		}

		public int getValue() {
			return value;
		}
	}

	Logger write(Level level, String pattern, Object... objects);

}
