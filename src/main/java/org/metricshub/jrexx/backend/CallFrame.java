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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.address.AuthContext;
import org.metricshub.jrexx.jrt.ConditionInfo;
import org.metricshub.jrexx.jrt.ConditionType;
import org.metricshub.jrexx.jrt.NumericSettings;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.jrt.VariablePool;

/**
 * One activation: the main program or a called routine. A routine frame
 * starts with copies of its caller's numeric settings, traps and ADDRESS
 * selection, and with an empty variable pool. Only the names listed by
 * <code>PROCEDURE EXPOSE</code> are shared with the caller.
 */
final class CallFrame {

	/** How the frame was entered, which decides what its RETURN does. */
	enum Kind {
		MAIN,
		CALL,
		FUNCTION
	}

	private final Kind kind;
	private final String routineName;
	private final List<RexxValue> arguments;
	private final NumericSettings numeric;
	private final Map<ConditionType, String> traps = new EnumMap<ConditionType, String>(ConditionType.class);
	private final Deque<BlockCursor> cursors = new ArrayDeque<BlockCursor>();
	private final CallJournal journal = new CallJournal();
	private final CallJournal.Entry resultEntry;
	private final VariablePool pool;
	private VariablePool callerPool;
	private String addressName;
	private AuthContext auth;
	private ConditionInfo lastCondition;
	private boolean procedureAllowed;
	private int line;

	private CallFrame(
			Kind kind,
			String routineName,
			List<RexxValue> arguments,
			VariablePool pool,
			NumericSettings numeric,
			CallJournal.Entry resultEntry) {
		this.kind = kind;
		this.routineName = routineName;
		this.arguments = Collections.unmodifiableList(arguments);
		this.pool = pool;
		this.numeric = numeric;
		this.resultEntry = resultEntry;
	}

	static CallFrame main(List<RexxValue> arguments, VariablePool pool, NumericSettings numeric) {
		return new CallFrame(Kind.MAIN, null, arguments, pool, numeric, null);
	}

	/**
	 * Creates the frame of a routine called from this one.
	 *
	 * @param kind {@link Kind#CALL} or {@link Kind#FUNCTION}
	 * @param name upper-case routine name
	 * @param args evaluated arguments
	 * @param entry journal entry receiving the function result, {@code null} for CALL
	 * @return the new frame
	 */
	CallFrame routine(Kind kind, String name, List<RexxValue> args, CallJournal.Entry entry) {
		CallFrame frame = new CallFrame(kind, name, args, new VariablePool(), numeric.copy(), entry);
		frame.callerPool = pool;
		frame.traps.putAll(traps);
		frame.addressName = addressName;
		frame.auth = auth;
		frame.procedureAllowed = true;
		return frame;
	}

	Kind getKind() {
		return kind;
	}

	String getRoutineName() {
		return routineName;
	}

	List<RexxValue> getArguments() {
		return arguments;
	}

	NumericSettings getNumeric() {
		return numeric;
	}

	Map<ConditionType, String> getTraps() {
		return traps;
	}

	Deque<BlockCursor> getCursors() {
		return cursors;
	}

	CallJournal getJournal() {
		return journal;
	}

	CallJournal.Entry getResultEntry() {
		return resultEntry;
	}

	VariablePool getPool() {
		return pool;
	}

	/**
	 * @return pool of the calling frame, {@code null} for the main frame
	 */
	VariablePool getCallerPool() {
		return callerPool;
	}

	String getAddressName() {
		return addressName;
	}

	AuthContext getAuth() {
		return auth;
	}

	void selectAddress(String name, AuthContext auth) {
		this.addressName = name;
		this.auth = auth;
	}

	ConditionInfo getLastCondition() {
		return lastCondition;
	}

	void setLastCondition(ConditionInfo lastCondition) {
		this.lastCondition = lastCondition;
	}

	boolean isProcedureAllowed() {
		return procedureAllowed;
	}

	void setProcedureAllowed(boolean procedureAllowed) {
		this.procedureAllowed = procedureAllowed;
	}

	/**
	 * @return line of the statement the frame is running
	 */
	int getLine() {
		return line;
	}

	void setLine(int line) {
		this.line = line;
	}
}
