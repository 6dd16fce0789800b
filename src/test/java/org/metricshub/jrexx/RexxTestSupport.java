package org.metricshub.jrexx;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.address.AddressTarget;
import org.metricshub.jrexx.address.AddressTargetRegistry;
import org.metricshub.jrexx.ext.RexxModule;
import org.metricshub.jrexx.util.RexxSettings;

/**
 * Helpers for building and executing Jrexx tests. The fluent builders
 * ({@link #rexxTest(String)} and {@link #cliTest(String)}) let tests describe
 * a script, its arguments and variables, and the expected output before
 * running it either through the {@link Rexx} API or through the {@link Cli}.
 */
public final class RexxTestSupport {

	private RexxTestSupport() {}

	/**
	 * Creates a builder for a test that runs a script through {@link Rexx}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return the builder
	 */
	public static RexxTestBuilder rexxTest(String description) {
		return new RexxTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that runs the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return the builder
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Outcome of a configured test: the captured output, the exit code and
	 * the exception thrown, checked against the builder expectations.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final int exitCode;
		private final Expectations expectations;
		private final Throwable thrownException;

		TestResult(String description, String output, int exitCode, Expectations expectations, Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.exitCode = exitCode;
			this.expectations = expectations;
			this.thrownException = thrownException;
		}

		public String output() {
			return output;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @return the output split into lines, without the trailing newline
		 */
		public List<String> lines() {
			return normalizeOutputLines(output);
		}

		/**
		 * Verifies the output, the exit code or the thrown exception.
		 */
		public void assertExpected() {
			if (expectations.exception != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception " + expectations.exception.getName() + " for " + description
									+ " but execution completed successfully");
				}
				if (!expectations.exception.isInstance(thrownException)) {
					AssertionError error = new AssertionError(
							"Expected exception " + expectations.exception.getName() + " for " + description + " but got "
									+ thrownException.getClass().getName());
					error.initCause(thrownException);
					throw error;
				}
				return;
			}
			if (thrownException != null) {
				AssertionError error = new AssertionError("Unexpected exception for " + description + ": " + thrownException);
				error.initCause(thrownException);
				throw error;
			}
			if (expectations.lines != null) {
				assertEquals("Unexpected output for " + description, expectations.lines, normalizeOutputLines(output));
			} else if (expectations.output != null) {
				assertEquals("Unexpected output for " + description, expectations.output, output);
			}
			int expectedExitCode = expectations.exitCode == null ? 0 : expectations.exitCode.intValue();
			assertEquals("Unexpected exit code for " + description, expectedExitCode, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n").replace("\r", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	private static final class Expectations {
		private String output;
		private List<String> lines;
		private Integer exitCode;
		private Class<? extends Throwable> exception;
	}

	/**
	 * Common parts of both builders.
	 *
	 * @param <B> concrete builder type
	 */
	@SuppressWarnings("unchecked")
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		final String description;
		final Expectations expectations = new Expectations();
		String script;
		final List<String> arguments = new ArrayList<String>();

		BaseTestBuilder(String description) {
			this.description = description;
		}

		public B script(String value) {
			this.script = value;
			return (B) this;
		}

		public B arguments(String... values) {
			arguments.addAll(Arrays.asList(values));
			return (B) this;
		}

		public B expect(String value) {
			expectations.output = value;
			return (B) this;
		}

		public B expectLines(String... values) {
			expectations.lines = Arrays.asList(values);
			return (B) this;
		}

		public B expectExit(int code) {
			expectations.exitCode = Integer.valueOf(code);
			return (B) this;
		}

		public B expectThrow(Class<? extends Throwable> type) {
			expectations.exception = type;
			return (B) this;
		}

		/**
		 * Runs the test without asserting anything.
		 *
		 * @return the captured result
		 * @throws Exception when the test cannot be set up
		 */
		public abstract TestResult run() throws Exception;

		/**
		 * Runs the test and asserts the expectations.
		 *
		 * @throws Exception when the test cannot be set up
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Builds a test run through {@link Rexx#invoke}.
	 */
	public static final class RexxTestBuilder extends BaseTestBuilder<RexxTestBuilder> {
		private final Map<String, Object> variables = new LinkedHashMap<String, Object>();
		private final List<RexxModule> modules = new ArrayList<RexxModule>();
		private final Map<String, AddressTarget> targets = new LinkedHashMap<String, AddressTarget>();
		private AddressTargetRegistry registry;
		private RexxSettings settings = new RexxSettings();

		RexxTestBuilder(String description) {
			super(description);
		}

		public RexxTestBuilder variable(String name, Object value) {
			variables.put(name, value);
			return this;
		}

		public RexxTestBuilder withModules(RexxModule... values) {
			modules.addAll(Arrays.asList(values));
			return this;
		}

		public RexxTestBuilder withTarget(String name, AddressTarget target) {
			targets.put(name, target);
			return this;
		}

		public RexxTestBuilder withRegistry(AddressTargetRegistry value) {
			this.registry = value;
			return this;
		}

		public RexxTestBuilder withSettings(RexxSettings value) {
			this.settings = value;
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
			for (Map.Entry<String, Object> variable : variables.entrySet()) {
				settings.putVariable(variable.getKey(), variable.getValue());
			}
			for (String argument : arguments) {
				settings.addArgument(argument);
			}
			int exitCode = 0;
			Throwable thrown = null;
			try {
				Rexx rexx = new Rexx(registry == null ? AddressTargetRegistry.withBuiltins() : registry, modules);
				for (Map.Entry<String, AddressTarget> target : targets.entrySet()) {
					rexx.registerAddressTarget(target.getKey(), target.getValue());
				}
				rexx.invoke(rexx.compile(script), settings);
			} catch (ExitException e) {
				exitCode = e.getCode();
			} catch (Exception e) {
				thrown = e;
			}
			return new TestResult(description, out.toString(StandardCharsets.UTF_8.name()), exitCode, expectations, thrown);
		}
	}

	/**
	 * Builds a test run through {@link Cli#create}.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> options = new ArrayList<String>();

		CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder option(String... values) {
			options.addAll(Arrays.asList(values));
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			List<String> args = new ArrayList<String>(options);
			if (script != null) {
				args.add(script);
			}
			args.addAll(arguments);
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int exitCode = 0;
			Throwable thrown = null;
			try {
				Cli
						.create(
								args.toArray(new String[0]),
								System.in,
								new PrintStream(out, true, StandardCharsets.UTF_8.name()),
								new PrintStream(err, true, StandardCharsets.UTF_8.name()));
			} catch (ExitException e) {
				exitCode = e.getCode();
			} catch (Exception e) {
				thrown = e;
			}
			return new TestResult(description, out.toString(StandardCharsets.UTF_8.name()), exitCode, expectations, thrown);
		}
	}
}
