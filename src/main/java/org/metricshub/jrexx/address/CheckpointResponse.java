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
 * The answer to a {@link CheckpointRequest}, matched by its request id.
 */
public final class CheckpointResponse {

	private final String requestId;
	private final CheckpointStatus status;
	private final Object result;
	private final String error;

	/**
	 * @param requestId correlation id of the request answered
	 * @param status outcome
	 * @param result result payload, for {@link CheckpointStatus#DONE}
	 * @param error error text, for {@link CheckpointStatus#ERROR}
	 */
	public CheckpointResponse(String requestId, CheckpointStatus status, Object result, String error) {
		this.requestId = requestId;
		this.status = status;
		this.result = result;
		this.error = error;
	}

	public static CheckpointResponse done(String requestId, Object result) {
		return new CheckpointResponse(requestId, CheckpointStatus.DONE, result, null);
	}

	public static CheckpointResponse error(String requestId, String error) {
		return new CheckpointResponse(requestId, CheckpointStatus.ERROR, null, error);
	}

	public String getRequestId() {
		return requestId;
	}

	public CheckpointStatus getStatus() {
		return status;
	}

	public Object getResult() {
		return result;
	}

	public String getError() {
		return error;
	}

	@Override
	public String toString() {
		return requestId + " " + status.getWireName() + (status == CheckpointStatus.DONE ? " " + result : " " + error);
	}
}
