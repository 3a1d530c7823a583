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

/**
 * Thrown when a trace is requested to a configuration that was never
 * discovered by the exploration.
 */
public final class UnreachableConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 4302847151626330271L;

	private final Object configuration;

	public UnreachableConfigurationException(final Object configuration) {
		super("Target not reachable: " + configuration);
		this.configuration = configuration;
	}

	public Object getConfiguration() {
		return configuration;
	}

}
