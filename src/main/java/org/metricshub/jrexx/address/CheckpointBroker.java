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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import org.metricshub.jrexx.util.RexxLogger;
import org.slf4j.Logger;

/**
 * Correlates checkpoint requests with their responses.
 * <p>
 * Every request gets a fresh id (<code>cp-1</code>, <code>cp-2</code>...)
 * that is never reused. A response completes the request with the same id,
 * whatever the order responses arrive in, and only once: responses to unknown,
 * completed or cancelled requests are logged and ignored. One broker may be
 * shared by several interpreter instances.
 */
public class CheckpointBroker {

	private static final Logger LOG = RexxLogger.getLogger(CheckpointBroker.class);

	private final CheckpointTransport transport;
	private final Duration defaultTimeout;
	private final AtomicLong sequence = new AtomicLong();
	private final ConcurrentMap<String, PendingCheckpoint> outstanding = new ConcurrentHashMap<String, PendingCheckpoint>();

	/**
	 * Creates a broker whose requests never time out unless a timeout is given
	 * when issuing them.
	 *
	 * @param transport carries requests to the host
	 */
	public CheckpointBroker(CheckpointTransport transport) {
		this(transport, null);
	}

	/**
	 * @param transport carries requests to the host
	 * @param defaultTimeout timeout of requests issued without one, {@code null} for none
	 */
	public CheckpointBroker(CheckpointTransport transport, Duration defaultTimeout) {
		if (transport == null) {
			throw new IllegalArgumentException("A checkpoint broker needs a transport");
		}
		this.transport = transport;
		this.defaultTimeout = defaultTimeout;
	}

	/**
	 * Issues a request with the default timeout.
	 *
	 * @param operation operation to perform
	 * @param parameters operation parameters
	 * @return the pending request
	 */
	public PendingCheckpoint issue(String operation, Map<String, Object> parameters) {
		return issue(operation, parameters, defaultTimeout);
	}

	/**
	 * Issues a request and hands it to the transport.
	 *
	 * @param operation operation to perform
	 * @param parameters operation parameters
	 * @param timeout time after which the request fails, {@code null} or zero for none
	 * @return the pending request
	 */
	public PendingCheckpoint issue(String operation, Map<String, Object> parameters, Duration timeout) {
		final String id = "cp-" + sequence.incrementAndGet();
		boolean expires = timeout != null && !timeout.isZero() && !timeout.isNegative();
		CheckpointRequest request = new CheckpointRequest(id, operation, parameters);
		final PendingCheckpoint pending = new PendingCheckpoint(request, expires ? Instant.now().plus(timeout) : null);
		outstanding.put(id, pending);
		pending.getCompletion().whenComplete(new BiConsumer<CheckpointResponse, Throwable>() {
			@Override
			public void accept(CheckpointResponse response, Throwable error) {
				outstanding.remove(id, pending);
			}
		});
		if (expires) {
			pending.getCompletion().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		LOG.debug("Issuing checkpoint {} for {}", id, operation);
		try {
			transport.send(request);
		} catch (Exception e) {
			LOG.debug("Transport failed for checkpoint {}", id, e);
			pending.getCompletion().completeExceptionally(new CheckpointException("Checkpoint " + id + " could not be sent: " + e.getMessage(), e));
		}
		return pending;
	}

	/**
	 * Completes the request a response answers.
	 *
	 * @param response the response
	 * @return {@code true} when a pending request was completed
	 */
	public boolean deliver(CheckpointResponse response) {
		PendingCheckpoint pending = outstanding.remove(response.getRequestId());
		if (pending == null || !pending.getCompletion().complete(response)) {
			LOG.warn("Ignoring response for unknown or completed checkpoint {}", response.getRequestId());
			return false;
		}
		LOG.debug("Delivered checkpoint {}: {}", response.getRequestId(), response.getStatus().getWireName());
		return true;
	}

	/**
	 * Cancels a pending request. The suspended statement resumes with a failure.
	 *
	 * @param requestId id of the request
	 * @param reason why the request is cancelled
	 * @return {@code true} when a pending request was cancelled
	 */
	public boolean cancel(String requestId, String reason) {
		PendingCheckpoint pending = outstanding.remove(requestId);
		if (pending == null) {
			return false;
		}
		LOG.debug("Cancelling checkpoint {}: {}", requestId, reason);
		return pending.getCompletion().completeExceptionally(new CheckpointException("Checkpoint " + requestId + " cancelled: " + reason));
	}

	/**
	 * Cancels every request whose deadline has passed. Requests normally
	 * expire on their own; hosts driving time themselves can call this instead.
	 *
	 * @return number of requests cancelled
	 */
	public int expireOverdue() {
		Instant now = Instant.now();
		List<String> overdue = new ArrayList<String>();
		for (PendingCheckpoint pending : outstanding.values()) {
			if (pending.getDeadline() != null && !pending.getDeadline().isAfter(now)) {
				overdue.add(pending.getRequestId());
			}
		}
		int count = 0;
		for (String id : overdue) {
			if (cancel(id, "deadline expired")) {
				count++;
			}
		}
		return count;
	}

	/**
	 * @return number of requests waiting for a response
	 */
	public int getOutstandingCount() {
		return outstanding.size();
	}

	/**
	 * @return the default timeout, or {@code null}
	 */
	public Duration getDefaultTimeout() {
		return defaultTimeout;
	}
}
