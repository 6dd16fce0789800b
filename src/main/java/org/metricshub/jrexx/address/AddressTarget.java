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

/**
 * An external command destination scripts select with <code>ADDRESS</code>.
 * <p>
 * Bare command strings and HEREDOCs are sent as {@link AddressInvocation.Kind#COMMAND}
 * invocations; function calls and operation statements that nothing else
 * resolves are sent as {@link AddressInvocation.Kind#METHOD} invocations to
 * targets that support them.
 */
public interface AddressTarget {

	/**
	 * @return the name the target is registered under by default
	 */
	String getName();

	/**
	 * @return {@code true} when the target accepts bare command strings
	 */
	default boolean supportsCommandString() {
		return true;
	}

	/**
	 * @return {@code true} when the target accepts method calls
	 */
	default boolean supportsMethodCall() {
		return false;
	}

	/**
	 * Handles one command or method call.
	 *
	 * @param invocation the command or method call
	 * @return the result, available now or later
	 * @throws Exception when the target fails; the failure is published as a
	 *         non-zero <code>RC</code> with the exception message in
	 *         <code>ERRORTEXT</code>
	 */
	AddressReply handle(AddressInvocation invocation) throws Exception;
}
