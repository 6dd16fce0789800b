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

import java.time.Duration;
import java.util.Map;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.jrt.VariablePool;
import org.metricshub.jrexx.util.RexxLogger;
import org.slf4j.Logger;

/**
 * Sends commands and method calls to address targets and publishes their
 * results as <code>RC</code>, <code>RESULT</code> and <code>ERRORTEXT</code>.
 * A target that fails, or does not accept what it is sent, yields a failure
 * result rather than an exception.
 */
public final class AddressDispatcher {

	private static final Logger LOG = RexxLogger.getLogger(AddressDispatcher.class);

	/** Return code pseudo-variable */
	public static final String RC = "RC";

	/** Result payload pseudo-variable */
	public static final String RESULT = "RESULT";

	/** Error text pseudo-variable, only set after a failure */
	public static final String ERRORTEXT = "ERRORTEXT";

	private final CheckpointBroker broker;
	private final Duration checkpointTimeout;

	/**
	 * @param broker broker handed to checkpoint-style targets, may be {@code null}
	 * @param checkpointTimeout timeout of checkpoint requests, {@code null} for none
	 */
	public AddressDispatcher(CheckpointBroker broker, Duration checkpointTimeout) {
		this.broker = broker;
		this.checkpointTimeout = checkpointTimeout;
	}

	/**
	 * Sends one command or method call.
	 *
	 * @param registration target to send to
	 * @param auth credentials of the current selection, {@code null} to use the registration's
	 * @param kind command or method call
	 * @param name command text or method name
	 * @param parameters parameters of the invocation
	 * @param variables snapshot of the caller's variables
	 * @param line script line
	 * @return the reply, never {@code null}
	 */
	public AddressReply dispatch(
			AddressRegistration registration,
			AuthContext auth,
			AddressInvocation.Kind kind,
			String name,
			Map<String, RexxValue> parameters,
			Map<String, RexxValue> variables,
			int line) {
		AddressTarget target = registration.getTarget();
		if (kind == AddressInvocation.Kind.COMMAND && !target.supportsCommandString()) {
			return AddressReply.immediate(AddressResult.failure("ADDRESS " + registration.getName() + " does not accept command strings"));
		}
		if (kind == AddressInvocation.Kind.METHOD && !target.supportsMethodCall()) {
			return AddressReply.immediate(AddressResult.failure("ADDRESS " + registration.getName() + " does not accept method calls"));
		}
		AddressInvocation invocation = new AddressInvocation(
				registration.getName(),
				kind,
				name,
				parameters,
				auth == null ? registration.getAuth() : auth,
				variables,
				line,
				broker,
				checkpointTimeout);
		LOG.debug("Dispatching {} (line {})", invocation, line);
		try {
			AddressReply reply = target.handle(invocation);
			return reply == null ? AddressReply.immediate(AddressResult.success(null)) : reply;
		} catch (Exception e) {
			LOG.debug("ADDRESS {} failed on line {}", registration.getName(), line, e);
			String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
			return AddressReply.immediate(AddressResult.failure(message));
		}
	}

	/**
	 * Writes a result into the caller's variables.
	 *
	 * @param result dispatch result
	 * @param pool caller's variables
	 */
	public static void publish(AddressResult result, VariablePool pool) {
		pool.setSimple(RC, RexxValue.of(result.isSuccess() ? 0 : result.getStatus()));
		pool.setSimple(RESULT, result.getOutput() == null ? RexxValue.EMPTY : RexxValue.of(result.getOutput()));
		if (result.isSuccess()) {
			pool.dropSimple(ERRORTEXT);
		} else {
			pool.setSimple(ERRORTEXT, RexxValue.of(result.getError() == null ? "" : result.getError()));
		}
		for (Map.Entry<String, Object> variable : result.getVariables().entrySet()) {
			pool.set(variable.getKey(), RexxValue.fromObject(variable.getValue()));
		}
	}
}
