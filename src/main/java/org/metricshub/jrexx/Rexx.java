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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.metricshub.jrexx.address.AddressRegistration;
import org.metricshub.jrexx.address.AddressTarget;
import org.metricshub.jrexx.address.AddressTargetRegistry;
import org.metricshub.jrexx.backend.Execution;
import org.metricshub.jrexx.ext.LoadedModule;
import org.metricshub.jrexx.ext.ModuleLoader;
import org.metricshub.jrexx.ext.ModuleRegistry;
import org.metricshub.jrexx.ext.RexxModule;
import org.metricshub.jrexx.frontend.Program;
import org.metricshub.jrexx.frontend.RexxParser;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.metricshub.jrexx.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point for hosts embedding the interpreter.
 * <p>
 * An instance owns the loaded modules and the address targets. Compiled
 * {@link Program}s can be run any number of times, each run getting its own
 * {@link Execution} with fresh variables.
 *
 * <pre>
 * Rexx rexx = new Rexx();
 * String output = rexx.run("say 'Hello' 1 + 1");
 * </pre>
 */
public class Rexx {

	private static final Logger LOG = RexxLogger.getLogger(Rexx.class);

	private final AddressTargetRegistry addressTargets;

	private final ModuleRegistry modules = new ModuleRegistry();

	private final ModuleLoader loader;

	/**
	 * Create a new interpreter with the built-in address targets and no module
	 */
	public Rexx() {
		this(AddressTargetRegistry.withBuiltins(), Collections.<RexxModule> emptyList());
	}

	/**
	 * Create a new interpreter with the specified modules already loaded.
	 *
	 * @param modules module instances
	 */
	public Rexx(RexxModule... modules) {
		this(AddressTargetRegistry.withBuiltins(), Arrays.asList(modules));
	}

	/**
	 * Create a new interpreter with the specified modules already loaded.
	 *
	 * @param modules module instances
	 */
	public Rexx(Collection<? extends RexxModule> modules) {
		this(AddressTargetRegistry.withBuiltins(), modules);
	}

	/**
	 * Create a new interpreter using an address target registry that other
	 * interpreters may share.
	 *
	 * @param addressTargets address targets available to scripts
	 * @param modules module instances loaded before any script runs
	 * @throws org.metricshub.jrexx.ext.ModuleLoadException when a module
	 *         conflicts with another one
	 */
	public Rexx(AddressTargetRegistry addressTargets, Collection<? extends RexxModule> modules) {
		this.addressTargets = addressTargets;
		this.loader = new ModuleLoader(this.modules, addressTargets);
		RexxSettings defaults = new RexxSettings();
		for (RexxModule module : modules) {
			if (module == null) {
				throw new IllegalArgumentException("Module instance must not be null");
			}
			loader.load(module, null, defaults);
		}
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public AddressTargetRegistry getAddressTargets() {
		return addressTargets;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ModuleRegistry getModules() {
		return modules;
	}

	/**
	 * Registers an address target under its own name.
	 *
	 * @param target the target
	 * @return the registration
	 */
	public AddressRegistration registerAddressTarget(AddressTarget target) {
		return addressTargets.register(target);
	}

	/**
	 * Registers an address target under the given name.
	 *
	 * @param name case-insensitive name used by <code>ADDRESS</code>
	 * @param target the target
	 * @return the registration
	 */
	public AddressRegistration registerAddressTarget(String name, AddressTarget target) {
		return addressTargets.register(name, target);
	}

	/**
	 * Loads a module the way <code>REQUIRE</code> does.
	 *
	 * @param specifier path, <code>registry:</code> name or bare name
	 * @param as prefix or address target name, may be {@code null}
	 * @param settings search path and registry files
	 * @return the loaded module
	 * @throws org.metricshub.jrexx.ext.ModuleLoadException when the module cannot be loaded
	 */
	public LoadedModule load(String specifier, String as, RexxSettings settings) {
		return loader.load(specifier, as, settings);
	}

	/**
	 * Compiles a script.
	 *
	 * @param source script to compile
	 * @return the program
	 * @throws IOException if the script cannot be read
	 * @throws org.metricshub.jrexx.frontend.LexerException on syntax errors
	 */
	public Program compile(ScriptSource source) throws IOException {
		return RexxParser.parse(source);
	}

	/**
	 * Compiles a script given as text.
	 *
	 * @param script script text
	 * @return the program
	 * @throws IOException never for in-memory text
	 */
	public Program compile(String script) throws IOException {
		return compile(ScriptSource.of(ScriptSource.DESCRIPTION_INLINE_SCRIPT, script));
	}

	/**
	 * Prepares a run of a program. The modules listed in the settings are
	 * loaded first; the script itself starts with {@link Execution#run()}.
	 *
	 * @param program compiled script
	 * @param settings settings of this run
	 * @return the execution, not started
	 */
	public Execution start(Program program, RexxSettings settings) {
		for (String module : settings.getModules()) {
			loader.load(module, null, settings);
		}
		LOG.debug("Starting {} with {}", program.getDescription(), settings.toDescriptionString());
		return new Execution(program, settings, addressTargets, modules, loader);
	}

	/**
	 * Runs a program to its end, waiting for any suspension to be resumed.
	 *
	 * @param program compiled script
	 * @param settings settings of this run
	 * @return the value of EXIT or RETURN, or {@code null}
	 * @throws ExitException if the script exits with a non-zero code
	 * @throws org.metricshub.jrexx.jrt.RexxCondition on an untrapped condition
	 */
	public RexxValue invoke(Program program, RexxSettings settings) throws ExitException {
		Execution execution = start(program, settings).run();
		execution.getCompletion().join();
		if (execution.getFailure() != null) {
			throw execution.getFailure();
		}
		int code = execution.getExitCode();
		if (code != 0) {
			throw new ExitException(code, program.getDescription() + " exited with code " + code);
		}
		return execution.getResult();
	}

	/**
	 * Compiles and runs a script.
	 *
	 * @param script script source
	 * @param settings settings of this run
	 * @return the value of EXIT or RETURN, or {@code null}
	 * @throws IOException if the script cannot be read
	 * @throws ExitException if the script exits with a non-zero code
	 */
	public RexxValue invoke(ScriptSource script, RexxSettings settings) throws IOException, ExitException {
		return invoke(compile(script), settings);
	}

	/**
	 * Runs a script and returns what it wrote with <code>SAY</code>.
	 *
	 * @param script script text
	 * @param arguments arguments of the main program
	 * @return the output
	 * @throws IOException if the script cannot be read
	 * @throws ExitException if the script exits with a non-zero code
	 */
	public String run(String script, String... arguments) throws IOException, ExitException {
		return run(ScriptSource.of(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, script), arguments);
	}

	/**
	 * Runs a script and returns what it wrote with <code>SAY</code>.
	 *
	 * @param script script reader
	 * @param arguments arguments of the main program
	 * @return the output
	 * @throws IOException if the script cannot be read
	 * @throws ExitException if the script exits with a non-zero code
	 */
	public String run(Reader script, String... arguments) throws IOException, ExitException {
		return run(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, script), arguments);
	}

	private String run(ScriptSource source, String... arguments) throws IOException, ExitException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RexxSettings settings = new RexxSettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		List<String> args = Arrays.asList(arguments);
		settings.setArguments(args);
		invoke(source, settings);
		return out.toString(StandardCharsets.UTF_8.name());
	}

	/**
	 * Evaluates a single expression.
	 *
	 * @param expression expression text
	 * @return its value
	 * @throws IOException never for in-memory text
	 * @throws org.metricshub.jrexx.frontend.ParserException when the text is
	 *         not exactly one expression
	 */
	public RexxValue eval(String expression) throws IOException {
		return eval(expression, new RexxSettings());
	}

	/**
	 * Evaluates a single expression with the given variables and settings.
	 *
	 * @param expression expression text
	 * @param settings variables and numeric settings
	 * @return its value
	 * @throws IOException never for in-memory text
	 * @throws org.metricshub.jrexx.jrt.RexxCondition on an untrapped condition
	 */
	public RexxValue eval(String expression, RexxSettings settings) throws IOException {
		new RexxParser(expression, ScriptSource.DESCRIPTION_INLINE_SCRIPT).parseStandaloneExpression();
		Program program = compile("RETURN " + expression);
		Execution execution = start(program, settings).run();
		execution.getCompletion().join();
		if (execution.getFailure() != null) {
			throw execution.getFailure();
		}
		return execution.getResult();
	}
}
