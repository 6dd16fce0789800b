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
 * A request sent to the host through a {@link CheckpointTransport}.
 */
public final class CheckpointRequest {

	private final String requestId;
	private final String operation;
	private final Map<String, Object> parameters;

	/**
	 * @param requestId correlation id
	 * @param operation operation to perform
	 * @param parameters operation parameters
	 */
	public CheckpointRequest(String requestId, String operation, Map<String, Object> parameters) {
		this.requestId = requestId;
		this.operation = operation;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(parameters));
	}

	public String getRequestId() {
		return requestId;
	}

	public String getOperation() {
		return operation;
	}

	public Map<String, Object> getParameters() {
		return parameters;
	}

	@Override
	public String toString() {
		return requestId + " " + operation + " " + parameters;
	}
}
