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
import hu.bme.mit.strcheck.common.table.TableWriter;

import java.util.Map;

/**
 * Base class of algorithm statistics, exposed as an ordered map of named
 * values.
 */
public abstract class Statistics {

	public abstract Map<String, Object> toMap();

	public final void writeData(final TableWriter writer) {
		toMap().values().forEach(writer::cell);
		writer.newRow();
	}

	@Override
	public String toString() {
		final var builder = Utils.lispStringBuilder(getClass().getSimpleName()).body();
		toMap().forEach((key, value) -> builder.add(key + ": " + value));
		return builder.toString();
	}

}
