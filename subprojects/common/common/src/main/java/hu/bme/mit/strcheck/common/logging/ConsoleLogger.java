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

import java.io.PrintStream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Logger that writes to a print stream, {@link System#out} by default.
 */
public final class ConsoleLogger extends BaseLogger {

	private final PrintStream out;

	public ConsoleLogger(final Level minLevel) {
		this(minLevel, System.out);
	}

	public ConsoleLogger(final Level minLevel, final PrintStream out) {
		super(minLevel);
		this.out = checkNotNull(out);
	}

	@Override
	protected void writeStr(final String str) {
		out.print(str);
	}

}
