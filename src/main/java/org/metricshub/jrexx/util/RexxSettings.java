package org.metricshub.jrexx.util;

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
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.address.CheckpointBroker;
import org.metricshub.jrexx.jrt.InterpolationPattern;
import org.metricshub.jrexx.jrt.NumericSettings;

/**
 * Settings of one script execution, filled in by the command line or by
 * hosts invoking Jrexx from Java code.
 */
public class RexxSettings {

	/** Default time a checkpoint request may stay unanswered */
	public static final Duration DEFAULT_CHECKPOINT_TIMEOUT = Duration.ofSeconds(30);

	/**
	 * Where <code>SAY</code> and unrouted commands write;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Variables assigned before the script starts (-v assignments).
	 * Values are converted to strings.
	 */
	private Map<String, Object> variables = new LinkedHashMap<String, Object>();

	/**
	 * Arguments of the main program, read with <code>ARG</code> and
	 * <code>PARSE ARG</code>.
	 */
	private List<String> arguments = new ArrayList<String>();

	/** Initial <code>NUMERIC DIGITS</code> */
	private int digits = NumericSettings.DEFAULT_DIGITS;

	/** Initial <code>NUMERIC FUZZ</code> */
	private int fuzz = 0;

	/** Marker syntax substituted in string literals */
	private InterpolationPattern interpolation = InterpolationPattern.BRACE;

	/**
	 * Broker that checkpoint-style address targets issue requests through;
	 * <code>null</code> when the host answers no checkpoints.
	 */
	private CheckpointBroker checkpointBroker;

	/** Timeout of each checkpoint request; <code>null</code> for none */
	private Duration checkpointTimeout = DEFAULT_CHECKPOINT_TIMEOUT;

	/** Directories searched for <code>name.jar</code> modules */
	private List<Path> searchPath = new ArrayList<Path>();

	/** Property files mapping <code>registry:</code> names to modules */
	private List<Path> registryFiles = new ArrayList<Path>();

	/** Module specifiers loaded before the script starts (-l) */
	private List<String> modules = new ArrayList<String>();

	/**
	 * Whether reading an unset variable outside a NOVALUE trap is an error;
	 * <code>false</code> by default, the variable then reads as its own name.
	 */
	private boolean novalueFatal = false;

	/**
	 * @return a human readable representation of the settings
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		final char newLine = '\n';
		desc.append("variables = ").append(variables).append(newLine);
		desc.append("arguments = ").append(arguments).append(newLine);
		desc.append("digits = ").append(digits).append(newLine);
		desc.append("fuzz = ").append(fuzz).append(newLine);
		desc.append("interpolation = ").append(interpolation).append(newLine);
		desc.append("checkpointTimeout = ").append(checkpointTimeout).append(newLine);
		desc.append("searchPath = ").append(searchPath).append(newLine);
		desc.append("registryFiles = ").append(registryFiles).append(newLine);
		desc.append("modules = ").append(modules).append(newLine);
		desc.append("novalueFatal = ").append(novalueFatal).append(newLine);
		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, Object> getVariables() {
		return variables;
	}

	public void setVariables(Map<String, Object> variables) {
		this.variables = new LinkedHashMap<String, Object>(variables);
	}

	/**
	 * Assigns a variable before the script starts.
	 *
	 * @param name variable name, any case
	 * @param value value, converted to a string
	 */
	public void putVariable(String name, Object value) {
		variables.put(name, value);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<String> getArguments() {
		return arguments;
	}

	public void setArguments(List<String> arguments) {
		this.arguments = new ArrayList<String>(arguments);
	}

	public void addArgument(String argument) {
		arguments.add(argument);
	}

	public int getDigits() {
		return digits;
	}

	public void setDigits(int digits) {
		this.digits = digits;
	}

	public int getFuzz() {
		return fuzz;
	}

	public void setFuzz(int fuzz) {
		this.fuzz = fuzz;
	}

	public InterpolationPattern getInterpolation() {
		return interpolation;
	}

	public void setInterpolation(InterpolationPattern interpolation) {
		this.interpolation = interpolation;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CheckpointBroker getCheckpointBroker() {
		return checkpointBroker;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setCheckpointBroker(CheckpointBroker checkpointBroker) {
		this.checkpointBroker = checkpointBroker;
	}

	public Duration getCheckpointTimeout() {
		return checkpointTimeout;
	}

	public void setCheckpointTimeout(Duration checkpointTimeout) {
		this.checkpointTimeout = checkpointTimeout;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<Path> getSearchPath() {
		return searchPath;
	}

	public void addSearchPath(Path directory) {
		searchPath.add(directory);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<Path> getRegistryFiles() {
		return registryFiles;
	}

	public void addRegistryFile(Path file) {
		registryFiles.add(file);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<String> getModules() {
		return modules;
	}

	public void addModule(String specifier) {
		modules.add(specifier);
	}

	public boolean isNovalueFatal() {
		return novalueFatal;
	}

	public void setNovalueFatal(boolean novalueFatal) {
		this.novalueFatal = novalueFatal;
	}
}
