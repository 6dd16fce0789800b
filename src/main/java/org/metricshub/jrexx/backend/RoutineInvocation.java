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

import java.util.List;
import org.metricshub.jrexx.jrt.RexxValue;

/**
 * Thrown by the evaluator when an expression calls an internal routine. The
 * engine pushes a frame for the routine; its <code>RETURN</code> value
 * completes the journal entry and the calling statement runs again.
 */
final class RoutineInvocation extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String routine;
	private final transient List<RexxValue> arguments;
	private final transient CallJournal.Entry entry;
	private final int line;

	RoutineInvocation(String routine, List<RexxValue> arguments, CallJournal.Entry entry, int line) {
		super(routine, null, false, false);
		this.routine = routine;
		this.arguments = arguments;
		this.entry = entry;
		this.line = line;
	}

	String getRoutine() {
		return routine;
	}

	List<RexxValue> getArguments() {
		return arguments;
	}

	CallJournal.Entry getEntry() {
		return entry;
	}

	int getLine() {
		return line;
	}
}
