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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an ADDRESS dispatch, published to the caller as <code>RC</code>,
 * <code>RESULT</code> and <code>ERRORTEXT</code>.
 */
public final class AddressResult {

	private final boolean success;
	private final boolean unavailable;
	private final String output;
	private final int status;
	private final String error;
	private final Map<String, Object> variables;

	private AddressResult(boolean success, boolean unavailable, String output, int status, String error, Map<String, Object> variables) {
		this.success = success;
		this.unavailable = unavailable;
		this.output = output;
		this.status = status;
		this.error = error;
		this.variables = variables;
	}

	/**
	 * @param output output of the command, may be {@code null}
	 * @return a successful result
	 */
	public static AddressResult success(String output) {
		return new AddressResult(true, false, output, 0, null, Collections.<String, Object>emptyMap());
	}

	/**
	 * @param status non-zero status published as <code>RC</code>; zero is published as 1
	 * @param error error message
	 * @return a failed result
	 */
	public static AddressResult failure(int status, String error) {
		return new AddressResult(false, false, null, status == 0 ? 1 : status, error, Collections.<String, Object>emptyMap());
	}

	/**
	 * @param error error message
	 * @return a failed result with status 1
	 */
	public static AddressResult failure(String error) {
		return failure(1, error);
	}

	/**
	 * A result for a request that never got a reply (cancelled, timed out,
	 * transport failure). It raises <code>FAILURE</code> rather than
	 * <code>ERROR</code> when trapped.
	 *
	 * @param error error message
	 * @return a failed result with status 1
	 */
	public static AddressResult unavailable(String error) {
		return new AddressResult(false, true, null, 1, error, Collections.<String, Object>emptyMap());
	}

	/**
	 * Returns a copy of this result that also assigns a variable in the caller
	 * once published.
	 *
	 * @param name variable name
	 * @param value value, converted to a string
	 * @return the new result
	 */
	public AddressResult withVariable(String name, Object value) {
		Map<String, Object> copy = new LinkedHashMap<String, Object>(variables);
		copy.put(name, value);
		return new AddressResult(success, unavailable, output, status, error, Collections.unmodifiableMap(copy));
	}

	public boolean isSuccess() {
		return success;
	}

	/**
	 * @return {@code true} when no reply could be obtained at all
	 */
	public boolean isUnavailable() {
		return unavailable;
	}

	public String getOutput() {
		return output;
	}

	/**
	 * @return 0 on success, the non-zero failure status otherwise
	 */
	public int getStatus() {
		return status;
	}

	public String getError() {
		return error;
	}

	/**
	 * @return extra variables to assign in the caller
	 */
	public Map<String, Object> getVariables() {
		return variables;
	}

	@Override
	public String toString() {
		if (success) {
			return "success(" + output + ")";
		}
		return (unavailable ? "unavailable(" : "failure(") + status + ", " + error + ")";
	}
}
