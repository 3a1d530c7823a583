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
package hu.bme.mit.strcheck.common;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds strings of the form {@code (Head a b c)} used by {@code toString}
 * throughout the project. Elements added after {@link #body()} are placed on
 * separate, indented lines.
 */
public final class LispStringBuilder {

	private static final String INDENT = "    ";

	private final String head;
	private final List<String> aligned;
	private final List<String> body;
	private boolean inBody;

	LispStringBuilder(final String head) {
		this.head = checkNotNull(head);
		this.aligned = new ArrayList<>();
		this.body = new ArrayList<>();
		this.inBody = false;
	}

	public LispStringBuilder add(final Object object) {
		final String str = String.valueOf(object);
		if (inBody) {
			body.add(str);
		} else {
			aligned.add(str);
		}
		return this;
	}

	public LispStringBuilder addAll(final Collection<?> objects) {
		for (final Object object : objects) {
			add(object);
		}
		return this;
	}

	public LispStringBuilder body() {
		inBody = true;
		return this;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder("(");
		final StringJoiner alignedJoiner = new StringJoiner(" ");
		if (!head.isEmpty()) {
			alignedJoiner.add(head);
		}
		aligned.forEach(alignedJoiner::add);
		sb.append(alignedJoiner);
		for (final String elem : body) {
			sb.append(System.lineSeparator()).append(INDENT).append(elem.replace(System.lineSeparator(),
					System.lineSeparator() + INDENT));
		}
		sb.append(')');
		return sb.toString();
	}

}
