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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.metricshub.jrexx.address.PendingCheckpoint;

/**
 * Records the external calls made while one statement of a frame runs:
 * module calls, address dispatches and internal function calls.
 * <p>
 * When a statement has to be run again, after a suspension or after an
 * internal function returned, its calls are replayed from the journal in the
 * order they were first made instead of being issued twice. The journal is
 * rewound when a statement starts and cleared when it completes.
 */
final class CallJournal {

	/**
	 * One recorded call and its eventual result.
	 */
	static final class Entry {
		private final CompletableFuture<?> completion;
		private final PendingCheckpoint checkpoint;

		Entry(CompletableFuture<?> completion, PendingCheckpoint checkpoint) {
			this.completion = completion;
			this.checkpoint = checkpoint;
		}

		CompletableFuture<?> getCompletion() {
			return completion;
		}

		/**
		 * @return the checkpoint the call waits for, or {@code null}
		 */
		PendingCheckpoint getCheckpoint() {
			return checkpoint;
		}

		boolean isDone() {
			return completion.isDone();
		}

		/**
		 * @return the result; only valid once {@link #isDone()}
		 */
		Object value() {
			return completion.join();
		}

		@SuppressWarnings("unchecked")
		void complete(Object value) {
			((CompletableFuture<Object>) completion).complete(value);
		}
	}

	private final List<Entry> entries = new ArrayList<Entry>();
	private int position;

	void rewind() {
		position = 0;
	}

	void clear() {
		entries.clear();
		position = 0;
	}

	/**
	 * @return the next recorded call when replaying, or {@code null} when the
	 *         statement reaches a call it has not made yet
	 */
	Entry next() {
		if (position < entries.size()) {
			return entries.get(position++);
		}
		return null;
	}

	Entry record(CompletableFuture<?> completion, PendingCheckpoint checkpoint) {
		Entry entry = new Entry(completion, checkpoint);
		entries.add(entry);
		position++;
		return entry;
	}
}
