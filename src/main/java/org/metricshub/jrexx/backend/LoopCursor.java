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
import java.util.List;
import org.metricshub.jrexx.frontend.ast.Statement;

/**
 * State of a repetitive <code>DO</code> loop.
 * <p>
 * A loop alternates between two phases, each run as one step: {@link Phase#CHECK}
 * tests the exhaustion conditions and <code>WHILE</code>, then enters the body;
 * {@link Phase#STEP} runs once the body is done (or on <code>ITERATE</code>),
 * tests <code>UNTIL</code> and increments the control variable.
 */
final class LoopCursor extends BlockCursor {

	enum Phase {
		CHECK,
		STEP
	}

	private static final int UNLIMITED = -1;

	private final Statement.Do statement;
	private Phase phase = Phase.CHECK;
	private BigDecimal limit;
	private BigDecimal increment = BigDecimal.ONE;
	private int remaining = UNLIMITED;
	private List<String> items;
	private int itemIndex;

	LoopCursor(Statement.Do statement) {
		this.statement = statement;
	}

	Statement.Do getStatement() {
		return statement;
	}

	/**
	 * @return name of the control variable, or {@code null}
	 */
	String getControlName() {
		return statement.control == null ? null : statement.control.name;
	}

	/**
	 * @return {@code true} when the loop steps a numeric control variable
	 */
	boolean isCounting() {
		return statement.control != null && items == null;
	}

	Phase getPhase() {
		return phase;
	}

	void setPhase(Phase phase) {
		this.phase = phase;
	}

	BigDecimal getLimit() {
		return limit;
	}

	void setLimit(BigDecimal limit) {
		this.limit = limit;
	}

	BigDecimal getIncrement() {
		return increment;
	}

	void setIncrement(BigDecimal increment) {
		this.increment = increment;
	}

	/**
	 * Limits the number of iterations. With both <code>FOR</code> and a
	 * repetition count only the smaller one matters.
	 *
	 * @param count maximum number of iterations left
	 */
	void limitIterations(int count) {
		if (remaining == UNLIMITED || count < remaining) {
			remaining = count;
		}
	}

	boolean isIterationLimitReached() {
		return remaining == 0;
	}

	void countIteration() {
		if (remaining > 0) {
			remaining--;
		}
	}

	void setItems(List<String> items) {
		this.items = items;
	}

	/**
	 * @return the next <code>OVER</code> item, or {@code null} when exhausted
	 */
	String peekItem() {
		return itemIndex < items.size() ? items.get(itemIndex) : null;
	}

	boolean hasItems() {
		return items != null;
	}

	void nextItem() {
		itemIndex++;
	}

	/**
	 * @param name label of a <code>LEAVE</code> or <code>ITERATE</code>, or {@code null}
	 * @return {@code true} when the instruction refers to this loop
	 */
	boolean matches(String name) {
		return name == null || name.equals(getControlName());
	}
}
