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
package hu.bme.mit.strcheck.common.table;

import java.io.PrintStream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Delimiter separated table writer. Cells are wrapped between the given
 * prefix and postfix, and any occurrence of the delimiter inside a cell is
 * removed.
 */
public final class BasicTableWriter implements TableWriter {

	private final PrintStream stream;
	private final String delimiter;
	private final String cellPrefix;
	private final String cellPostfix;
	private boolean firstCell;

	public BasicTableWriter(final PrintStream stream, final String delimiter, final String cellPrefix,
							final String cellPostfix) {
		this.stream = checkNotNull(stream);
		this.delimiter = checkNotNull(delimiter);
		this.cellPrefix = checkNotNull(cellPrefix);
		this.cellPostfix = checkNotNull(cellPostfix);
		this.firstCell = true;
	}

	@Override
	public TableWriter cell(final Object obj) {
		if (!firstCell) {
			stream.print(delimiter);
		}
		stream.print(cellPrefix + String.valueOf(obj).replace(delimiter, "") + cellPostfix);
		firstCell = false;
		return this;
	}

	@Override
	public TableWriter newRow() {
		stream.println();
		firstCell = true;
		return this;
	}

}
