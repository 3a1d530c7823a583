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

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public final class BasicTableWriterTest {

	@Test
	public void testRows() {
		final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		final PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		final TableWriter writer = new BasicTableWriter(stream, ",", "\"", "\"");

		writer.cell("a").cell(1).newRow();
		writer.cell("b,c").newRow();

		final String nl = System.lineSeparator();
		assertEquals("\"a\",\"1\"" + nl + "\"bc\"" + nl, bytes.toString(StandardCharsets.UTF_8));
	}

}
