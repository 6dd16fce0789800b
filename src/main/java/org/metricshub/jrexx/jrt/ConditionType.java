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

import java.util.Locale;

/**
 * Named runtime conditions that a script can trap with <code>SIGNAL ON</code>.
 */
public enum ConditionType {
	/** A dispatched command reported a failure (non-zero return code). */
	ERROR,

	/** A dispatched command could not produce a reply (cancelled, timed out, transport failure). */
	FAILURE,

	/** An unset symbol was referenced. */
	NOVALUE,

	/** A language-level error was detected while evaluating the script. */
	SYNTAX;

	/**
	 * Resolves a condition name as written in a script.
	 *
	 * @param name condition name, case-insensitive
	 * @return the matching condition, or {@code null} when the name is unknown
	 */
	public static ConditionType fromName(String name) {
		if (name == null) {
			return null;
		}
		String upper = name.toUpperCase(Locale.ROOT);
		for (ConditionType type : values()) {
			if (type.name().equals(upper)) {
				return type;
			}
		}
		return null;
	}

	/**
	 * Returns whether raising this condition sets the <code>RC</code> variable
	 * when trapped.
	 *
	 * @return {@code true} for ERROR, FAILURE and SYNTAX
	 */
	public boolean setsReturnCode() {
		return this != NOVALUE;
	}
}
