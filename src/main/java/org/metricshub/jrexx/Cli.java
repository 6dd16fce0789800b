package org.metricshub.jrexx;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jrexx
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jrexx.frontend.Program;
import org.metricshub.jrexx.jrt.InterpolationPattern;
import org.metricshub.jrexx.jrt.RexxCondition;
import org.metricshub.jrexx.util.RexxSettings;
import org.metricshub.jrexx.util.ScriptFileSource;
import org.metricshub.jrexx.util.ScriptSource;

/**
 * Command-line interface for Jrexx.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jrexx.jar";
		}
		JAR_NAME = myName;
	}

	private final RexxSettings settings = new RexxSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. Scripts read no input,
	 * so the input stream is unused; so is the error stream, which the
	 * {@link #main(String[])} method handles.
	 *
	 * @param in stream from which program input would be read
	 * @param out stream where program output is written
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(@SuppressWarnings("unused") InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link RexxSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public RexxSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script given with <code>-f</code> or inline, or {@code null}
	 *         when only the usage was requested
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the script and its arguments follow
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-v")) {
				// -v name=val : assign a variable before execution
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-l") || arg.equals("--load")) {
				// -l/--load module : load a module before the script starts
				checkParameterHasArgument(args, argIdx);
				settings.addModule(args[++argIdx]);
			} else if (arg.equals("--search-path")) {
				checkParameterHasArgument(args, argIdx);
				settings.addSearchPath(Paths.get(args[++argIdx]));
			} else if (arg.equals("--registry")) {
				checkParameterHasArgument(args, argIdx);
				settings.addRegistryFile(Paths.get(args[++argIdx]));
			} else if (arg.equals("--digits")) {
				checkParameterHasArgument(args, argIdx);
				settings.setDigits(parsePositive(arg, args[++argIdx]));
			} else if (arg.equals("--interpolation")) {
				checkParameterHasArgument(args, argIdx);
				settings.setInterpolation(InterpolationPattern.of(args[++argIdx]));
			} else if (arg.equals("--checkpoint-timeout")) {
				// --checkpoint-timeout ms : 0 disables the timeout
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				long millis = value.equals("0") ? 0 : parsePositive(arg, value);
				settings.setCheckpointTimeout(millis == 0 ? null : Duration.ofMillis(millis));
			} else if (arg.equals("--novalue-fatal")) {
				settings.setNovalueFatal(true);
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax tree instead of running
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Rexx script not provided.");
			}
			scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
		} else {
			try {
				scriptSource.getReader().close();
			} catch (IOException ex) {
				throw new IllegalArgumentException(
						"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
						ex);
			}
		}

		while (argIdx < args.length) {
			settings.addArgument(args[argIdx++]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parsePositive(String option, String value) {
		try {
			int number = Integer.parseInt(value);
			if (number > 0) {
				return number;
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects a positive number, not '" + value + "'", e);
		}
		throw new IllegalArgumentException(option + " expects a positive number, not '" + value + "'");
	}

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z@#$?!][_0-9a-zA-Z@#$?!.]*)=(.*)", Pattern.DOTALL);

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance. Values are kept as strings.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(RexxSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.putVariable(m.group(1), m.group(2));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if compilation or execution fails
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		Rexx rexx = new Rexx();
		Program program = rexx.compile(scriptSource);
		if (dumpSyntaxTree) {
			program.dump(out);
			return;
		}
		rexx.invoke(program, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-l module]..." +
								" [--search-path dir]..." +
								" [--registry file]..." +
								" [--digits n]" +
								" [--interpolation pattern]" +
								" [--checkpoint-timeout ms]" +
								" [--novalue-fatal]" +
								" [--dump-syntax]" +
								" [-v name=val]..." +
								" [script]" +
								" [argument]...");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -l module = Load a module (path, registry:name or bare name) before the script starts.");
		dest.println(" --load module = Same as -l.");
		dest.println(" --search-path dir = Directory searched for <name>.jar modules.");
		dest.println(" --registry file = Properties file mapping registry:names to classes or jars.");
		dest.println(" -v name=val = Initial variable assignments.");
		dest.println();
		dest.println(" --digits n = Initial NUMERIC DIGITS (default 9).");
		dest.println(" --interpolation pattern = brace, handlebars, shell, batch, doubledollar or open...close (default brace).");
		dest.println(" --checkpoint-timeout ms = Timeout of checkpoint requests, 0 for none (default 30000).");
		dest.println(" --novalue-fatal = Unset variables raise NOVALUE even when it is not trapped.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws Exception {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (RexxCondition e) {
			System.err.printf("%s\n", e.report());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
