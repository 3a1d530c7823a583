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
package hu.bme.mit.strcheck.str.cli;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import hu.bme.mit.strcheck.analysis.Action;
import hu.bme.mit.strcheck.analysis.Trace;
import hu.bme.mit.strcheck.analysis.algorithm.ReachabilityStatistics;
import hu.bme.mit.strcheck.analysis.algorithm.SafetyResult;
import hu.bme.mit.strcheck.analysis.algorithm.SearchStrategy;
import hu.bme.mit.strcheck.analysis.algorithm.Statistics;
import hu.bme.mit.strcheck.analysis.config.StrConfig;
import hu.bme.mit.strcheck.analysis.config.StrConfigBuilder;
import hu.bme.mit.strcheck.common.logging.ConsoleLogger;
import hu.bme.mit.strcheck.common.logging.Logger;
import hu.bme.mit.strcheck.common.logging.NullLogger;
import hu.bme.mit.strcheck.common.table.BasicTableWriter;
import hu.bme.mit.strcheck.common.table.TableWriter;
import hu.bme.mit.strcheck.str.cli.models.DemoModel;

/**
 * Command line front end that checks an invariant or deadlock freedom on one
 * of the bundled models.
 */
public final class StrCli {
	private static final String JAR_NAME = "strcheck-cli.jar";
	private final String[] args;
	private final PrintStream out;
	private final TableWriter writer;

	enum Property {
		INVARIANT, DEADLOCK
	}

	@Parameter(names = {"--model", "-m"}, description = "Model to check", required = true)
	DemoModel.Kind model;

	@Parameter(names = {"--parameter", "-p"}, description = "Initial value of the counter model")
	int parameter = 3;

	@Parameter(names = {"--property", "-P"}, description = "Property to check")
	Property property = Property.INVARIANT;

	@Parameter(names = {"--search", "-s"}, description = "Search strategy")
	SearchStrategy search = SearchStrategy.BFS;

	@Parameter(names = "--max-configurations", description = "Stop after discovering this many configurations")
	Integer maxConfigurations = null;

	@Parameter(names = "--timeout", description = "Stop after this many seconds")
	Long timeoutSeconds = null;

	@Parameter(names = "--loglevel", description = "Detailedness of logging")
	Logger.Level logLevel = Logger.Level.SUBSTEP;

	@Parameter(names = {"--benchmark", "-b"}, description = "Benchmark mode (only print metrics)")
	Boolean benchmarkMode = false;

	@Parameter(names = {"--header", "-h"}, description = "Print only a header (for benchmarks)", help = true)
	boolean headerOnly = false;

	@Parameter(names = "--stacktrace", description = "Print full stack trace in case of exception")
	boolean stacktrace = false;

	public StrCli(final String[] args) {
		this(args, System.out);
	}

	StrCli(final String[] args, final PrintStream out) {
		this.args = args;
		this.out = out;
		this.writer = new BasicTableWriter(out, ",", "\"", "\"");
	}

	public static void main(final String[] args) {
		final StrCli mainApp = new StrCli(args);
		final int status = mainApp.run();
		if (status != 0) {
			System.exit(status);
		}
	}

	int run() {
		try {
			JCommander.newBuilder().addObject(this).programName(JAR_NAME).build().parse(args);
		} catch (final ParameterException ex) {
			out.println("Invalid parameters, details:");
			out.println(ex.getMessage());
			ex.usage();
			return 1;
		}

		if (headerOnly) {
			writer.cell("Result");
			for (final String column : ReachabilityStatistics.header()) {
				writer.cell(column);
			}
			writer.newRow();
			return 0;
		}

		try {
			final DemoModel<?, ?> demo = DemoModel.create(model, parameter);
			final SafetyResult<?, ?> result = check(demo);
			printResult(result);
			return 0;
		} catch (final Throwable ex) {
			printError(ex);
			return 1;
		}
	}

	private <C, A extends Action> SafetyResult<C, A> check(final DemoModel<C, A> demo) throws Exception {
		final Logger logger = benchmarkMode ? NullLogger.getInstance() : new ConsoleLogger(logLevel, out);
		final StrConfigBuilder<C> builder = new StrConfigBuilder<C>().logger(logger).search(search);
		if (maxConfigurations != null) {
			builder.maxConfigurations(maxConfigurations);
		}
		if (timeoutSeconds != null) {
			builder.timeout(Duration.ofSeconds(timeoutSeconds));
		}
		final StrConfig<C, A> config = property == Property.DEADLOCK
				? builder.buildDeadlockCheck(demo.getStr())
				: builder.build(demo.getStr(), demo.getInvariant());
		try {
			return config.check();
		} catch (final Exception ex) {
			final String message = ex.getMessage() == null ? "(no message)" : ex.getMessage();
			throw new Exception("Error while running algorithm: " + ex.getClass().getSimpleName() + " " + message, ex);
		}
	}

	private void printResult(final SafetyResult<?, ?> result) {
		if (benchmarkMode) {
			writer.cell(result.isSafe() ? "Safe" : result.isUnsafe() ? "Unsafe" : "Unknown");
			if (result.getStats().isPresent()) {
				result.getStats().get().writeData(writer);
			} else {
				writer.newRow();
			}
		} else {
			out.println(result);
			if (result.isUnsafe()) {
				final Trace<?, ?> trace = result.asUnsafe().getTrace();
				out.println(trace);
			}
			result.getStats().map(Statistics::toString).ifPresent(out::println);
		}
	}

	private void printError(final Throwable ex) {
		final String message = ex.getMessage() == null ? "" : ": " + ex.getMessage();
		if (benchmarkMode) {
			writer.cell("[EX] " + ex.getClass().getSimpleName() + message);
			writer.newRow();
		} else {
			out.println(ex.getClass().getSimpleName() + " occurred, message: " + message);
			if (stacktrace) {
				final StringWriter errors = new StringWriter();
				ex.printStackTrace(new PrintWriter(errors));
				out.println("Trace:");
				out.println(errors);
			} else {
				out.println("Use --stacktrace for stack trace");
			}
		}
	}

}
