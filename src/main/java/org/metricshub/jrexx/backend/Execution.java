package org.metricshub.jrexx.backend;

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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import org.metricshub.jrexx.address.AddressTargetRegistry;
import org.metricshub.jrexx.address.PendingCheckpoint;
import org.metricshub.jrexx.ext.ModuleLoader;
import org.metricshub.jrexx.ext.ModuleRegistry;
import org.metricshub.jrexx.frontend.Program;
import org.metricshub.jrexx.jrt.RexxCondition;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.slf4j.Logger;

/**
 * One run of a program.
 * <p>
 * {@link #run()} executes the script on the calling thread until it completes
 * or waits for a reply that has not arrived, typically a checkpoint. The
 * execution then resumes by itself on the thread that delivers the reply.
 * Use {@link #await(Duration)} or {@link #getCompletion()} to wait for the end.
 * <p>
 * Executions are independent of each other: several of them may share the
 * same {@link org.metricshub.jrexx.address.CheckpointBroker} and be resumed
 * in any order.
 */
public final class Execution {

	private static final Logger LOG = RexxLogger.getLogger(Execution.class);

	/** Life cycle of an execution. */
	public enum State {
		READY,
		RUNNING,
		SUSPENDED,
		COMPLETED,
		FAILED
	}

	private final ExecutionEngine engine;
	private final String description;
	private final CompletableFuture<Execution> completion = new CompletableFuture<Execution>();
	private State state = State.READY;
	private CallJournal.Entry waitingFor;
	private RuntimeException failure;

	/**
	 * Prepares an execution; nothing runs before {@link #run()}.
	 *
	 * @param program compiled script
	 * @param settings output, variables, arguments and numeric settings of the run
	 * @param targets address targets the script can select
	 * @param modules functions and operations already loaded
	 * @param loader loader used by <code>REQUIRE</code>
	 */
	public Execution(
			Program program,
			RexxSettings settings,
			AddressTargetRegistry targets,
			ModuleRegistry modules,
			ModuleLoader loader) {
		this.engine = new ExecutionEngine(program, settings, targets, modules, loader);
		this.description = program.getDescription();
	}

	/**
	 * Starts the script.
	 *
	 * @return this execution
	 * @throws IllegalStateException when the execution was already started
	 */
	public Execution run() {
		synchronized (this) {
			if (state != State.READY) {
				throw new IllegalStateException("Execution of " + description + " already started");
			}
		}
		drive();
		return this;
	}

	private void drive() {
		CallJournal.Entry entry;
		synchronized (this) {
			state = State.RUNNING;
			waitingFor = null;
			try {
				entry = engine.run();
			} catch (RuntimeException e) {
				LOG.debug("Execution of {} failed", description, e);
				failure = e;
				state = State.FAILED;
				completion.complete(this);
				return;
			}
			if (entry == null) {
				state = State.COMPLETED;
				completion.complete(this);
				return;
			}
			state = State.SUSPENDED;
			waitingFor = entry;
		}
		entry.getCompletion().whenComplete(new BiConsumer<Object, Throwable>() {
			@Override
			public void accept(Object value, Throwable error) {
				resume();
			}
		});
	}

	private void resume() {
		synchronized (this) {
			if (state != State.SUSPENDED) {
				return;
			}
		}
		LOG.debug("Resuming {}", description);
		drive();
	}

	/**
	 * Waits for the script to complete or fail.
	 *
	 * @param timeout maximum time to wait
	 * @return {@code true} when the execution is done
	 * @throws InterruptedException when the waiting thread is interrupted
	 */
	public boolean await(Duration timeout) throws InterruptedException {
		try {
			completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			return true;
		} catch (TimeoutException e) {
			return false;
		} catch (ExecutionException e) {
			// the completion future never fails
			throw new IllegalStateException(e);
		}
	}

	/**
	 * @return a future completed with this execution once it is done
	 */
	public CompletableFuture<Execution> getCompletion() {
		return completion;
	}

	public synchronized State getState() {
		return state;
	}

	public synchronized boolean isDone() {
		return state == State.COMPLETED || state == State.FAILED;
	}

	/**
	 * @return the checkpoint the execution waits for, or {@code null}
	 */
	public synchronized PendingCheckpoint getPending() {
		return waitingFor == null ? null : waitingFor.getCheckpoint();
	}

	/**
	 * @return the value of <code>EXIT</code> or <code>RETURN</code>, or
	 *         {@code null} when the script returned none
	 */
	public synchronized RexxValue getResult() {
		return engine.getResult();
	}

	/**
	 * @return whether the script ended with <code>EXIT</code> rather than
	 *         running off its end
	 */
	public synchronized boolean isExited() {
		return engine.isExited();
	}

	/**
	 * Exit code of the script: 1 when it failed, the value of
	 * <code>EXIT</code> when that is a whole number, 0 otherwise.
	 *
	 * @return the exit code
	 */
	public synchronized int getExitCode() {
		if (state == State.FAILED) {
			return 1;
		}
		RexxValue value = engine.getResult();
		if (value == null) {
			return 0;
		}
		BigDecimal number = value.toNumber();
		if (number == null) {
			return 0;
		}
		try {
			return number.stripTrailingZeros().intValueExact();
		} catch (ArithmeticException e) {
			return 0;
		}
	}

	/**
	 * @return the untrapped condition or host exception that ended the
	 *         script, or {@code null}
	 */
	public synchronized RuntimeException getFailure() {
		return failure;
	}

	/**
	 * @return the untrapped condition that ended the script, or {@code null}
	 */
	public synchronized RexxCondition getCondition() {
		return failure instanceof RexxCondition ? (RexxCondition) failure : null;
	}

	/**
	 * @return the variables of the main program
	 */
	public synchronized Map<String, RexxValue> getVariables() {
		return engine.getMainPool().snapshot();
	}

	@Override
	public synchronized String toString() {
		return "Execution of " + description + " [" + state + "]";
	}
}
