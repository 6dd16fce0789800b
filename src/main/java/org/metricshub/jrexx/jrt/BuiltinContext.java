package org.metricshub.jrexx.jrt;

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

/**
 * State of the calling frame that built-in functions may read.
 */
public interface BuiltinContext {

	NumericSettings numeric();

	/**
	 * @return arguments of the current routine; omitted arguments are {@code null}
	 */
	List<RexxValue> arguments();

	/**
	 * @return name of the active ADDRESS target, empty when none
	 */
	String addressName();

	/**
	 * @return the last trapped condition of the frame, or {@code null}
	 */
	ConditionInfo condition();

	/**
	 * @param symbol variable name as written in a script (case-insensitive, compound tails derived)
	 * @return the value, or {@code null} when the variable is unset
	 */
	RexxValue variable(String symbol);

	/**
	 * @return number of lines waiting on the data stack
	 */
	int queued();
}
