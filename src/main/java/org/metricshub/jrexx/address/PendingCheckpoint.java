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

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * An issued checkpoint request waiting for its response.
 */
public final class PendingCheckpoint {

	private final CheckpointRequest request;
	private final Instant deadline;
	private final CompletableFuture<CheckpointResponse> completion = new CompletableFuture<CheckpointResponse>();

	PendingCheckpoint(CheckpointRequest request, Instant deadline) {
		this.request = request;
		this.deadline = deadline;
	}

	public CheckpointRequest getRequest() {
		return request;
	}

	public String getRequestId() {
		return request.getRequestId();
	}

	/**
	 * @return when the request expires, or {@code null} when it never does
	 */
	public Instant getDeadline() {
		return deadline;
	}

	/**
	 * @return completes with the response, or exceptionally when the request
	 *         is cancelled, times out or could not be sent
	 */
	public CompletableFuture<CheckpointResponse> getCompletion() {
		return completion;
	}

	public boolean isDone() {
		return completion.isDone();
	}

	@Override
	public String toString() {
		return "PendingCheckpoint[" + request + "]";
	}
}
