package org.metricshub.jrexx.address;

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
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.jrexx.jrt.RexxValue;

/**
 * One request sent to an {@link AddressTarget}.
 */
public final class AddressInvocation {

	/** Parameter holding the text of a command string */
	public static final String COMMAND_PARAMETER = "command";

	/** What the script sent. */
	public enum Kind {
		/** A bare command string or HEREDOC */
		COMMAND,
		/** A function call or operation statement */
		METHOD
	}

	private final String targetName;
	private final Kind kind;
	private final String name;
	private final Map<String, RexxValue> parameters;
	private final AuthContext auth;
	private final Map<String, RexxValue> variables;
	private final int line;
	private final CheckpointBroker broker;
	private final Duration checkpointTimeout;

	/**
	 * @param targetName name the script used to select the target
	 * @param kind command or method call
	 * @param name the command text, or the method name
	 * @param parameters ordered parameters
	 * @param auth credentials of the ADDRESS selection, may be {@code null}
	 * @param variables snapshot of the caller's variables
	 * @param line script line of the statement
	 * @param broker checkpoint broker of the host, may be {@code null}
	 * @param checkpointTimeout how long checkpoint requests may stay unanswered, {@code null} for no limit
	 */
	public AddressInvocation(
			String targetName,
			Kind kind,
			String name,
			Map<String, RexxValue> parameters,
			AuthContext auth,
			Map<String, RexxValue> variables,
			int line,
			CheckpointBroker broker,
			Duration checkpointTimeout) {
		this.targetName = targetName;
		this.kind = kind;
		this.name = name;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<String, RexxValue>(parameters));
		this.auth = auth;
		this.variables = variables;
		this.line = line;
		this.broker = broker;
		this.checkpointTimeout = checkpointTimeout;
	}

	public String getTargetName() {
		return targetName;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the command text for commands, the method name for method calls
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return for commands, the single <code>command</code> parameter; for
	 *         methods, named arguments by name and positional arguments as
	 *         <code>arg1</code> .. <code>argN</code>
	 */
	public Map<String, RexxValue> getParameters() {
		return parameters;
	}

	/**
	 * @param key parameter name
	 * @return the parameter as a string, or {@code null} when absent
	 */
	public String getParameter(String key) {
		RexxValue value = parameters.get(key);
		return value == null ? null : value.asString();
	}

	public AuthContext getAuth() {
		return auth;
	}

	/**
	 * @return read-only snapshot of the caller's variables, taken when the
	 *         statement executed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, RexxValue> getVariables() {
		return variables;
	}

	public int getLine() {
		return line;
	}

	/**
	 * @return the broker that checkpoint-style targets issue their requests
	 *         through, or {@code null} when the host configured none
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CheckpointBroker getBroker() {
		return broker;
	}

	/**
	 * @return how long a checkpoint request issued for this invocation may stay
	 *         unanswered, or {@code null} for no limit
	 */
	public Duration getCheckpointTimeout() {
		return checkpointTimeout;
	}

	@Override
	public String toString() {
		return targetName + " " + kind + " " + name;
	}
}
