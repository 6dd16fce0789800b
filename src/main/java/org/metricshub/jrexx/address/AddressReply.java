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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * What a target returns from {@link AddressTarget#handle(AddressInvocation)}:
 * a result available now, an awaitable completed in-process, or a checkpoint
 * answered through the host's {@link CheckpointBroker}.
 */
public final class AddressReply {

	private final CompletableFuture<AddressResult> completion;
	private final PendingCheckpoint checkpoint;

	private AddressReply(CompletableFuture<AddressResult> completion, PendingCheckpoint checkpoint) {
		this.completion = completion;
		this.checkpoint = checkpoint;
	}

	/**
	 * @param result the result
	 * @return a reply available immediately
	 */
	public static AddressReply immediate(AddressResult result) {
		return new AddressReply(CompletableFuture.completedFuture(result), null);
	}

	/**
	 * @param stage completes with the result; an exceptional completion is a
	 *        failure carrying the exception message
	 * @return a direct reply completed later
	 */
	public static AddressReply deferred(CompletionStage<AddressResult> stage) {
		CompletableFuture<AddressResult> completion = stage
				.toCompletableFuture()
				.handle(new BiFunction<AddressResult, Throwable, AddressResult>() {
					@Override
					public AddressResult apply(AddressResult result, Throwable error) {
						if (error != null) {
							return AddressResult.failure(unwrap(error).getMessage());
						}
						return result == null ? AddressResult.success(null) : result;
					}
				});
		return new AddressReply(completion, null);
	}

	/**
	 * @param pending request issued through the host's broker
	 * @return a reply completed when the matching response is delivered
	 */
	public static AddressReply checkpoint(PendingCheckpoint pending) {
		final String id = pending.getRequestId();
		CompletableFuture<AddressResult> completion = pending
				.getCompletion()
				.handle(new BiFunction<CheckpointResponse, Throwable, AddressResult>() {
					@Override
					public AddressResult apply(CheckpointResponse response, Throwable error) {
						if (error == null) {
							return CheckpointAddressTarget.toResult(response);
						}
						Throwable cause = unwrap(error);
						if (cause instanceof TimeoutException) {
							return AddressResult.unavailable("Checkpoint " + id + " timed out");
						}
						return AddressResult.unavailable(cause.getMessage());
					}
				});
		return new AddressReply(completion, pending);
	}

	private static Throwable unwrap(Throwable error) {
		Throwable cause = error;
		while (cause instanceof CompletionException && cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause;
	}

	/**
	 * @return completes with the result; never completes exceptionally
	 */
	public CompletableFuture<AddressResult> getCompletion() {
		return completion;
	}

	/**
	 * @return the checkpoint behind this reply, or {@code null} for direct replies
	 */
	public PendingCheckpoint getCheckpoint() {
		return checkpoint;
	}

	/**
	 * @return {@code true} when the result is already known
	 */
	public boolean isDone() {
		return completion.isDone();
	}
}
