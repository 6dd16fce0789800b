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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stem: the default value assigned with <code>stem. = value</code> plus the
 * explicitly assigned tails. Reading an unset tail falls back to the default.
 */
public final class Stem {

	private RexxValue defaultValue;
	private final Map<String, RexxValue> tails = new LinkedHashMap<String, RexxValue>();

	/**
	 * Reads a tail, falling back to the stem default.
	 *
	 * @param tail derived tail
	 * @return the value, or {@code null} when neither the tail nor the default is set
	 */
	public RexxValue get(String tail) {
		RexxValue value = tails.get(tail);
		return value != null ? value : defaultValue;
	}

	public void set(String tail, RexxValue value) {
		tails.put(tail, value);
	}

	public void drop(String tail) {
		tails.remove(tail);
	}

	/**
	 * Assigns the stem itself: every tail is discarded and the value becomes
	 * the default of all tails.
	 *
	 * @param value new default
	 */
	public void assignAll(RexxValue value) {
		tails.clear();
		defaultValue = value;
	}

	/**
	 * Drops the default value and all tails.
	 */
	public void dropAll() {
		tails.clear();
		defaultValue = null;
	}

	public RexxValue getDefaultValue() {
		return defaultValue;
	}

	/**
	 * @return the explicitly assigned tails, in assignment order
	 */
	public List<String> tails() {
		return new ArrayList<String>(tails.keySet());
	}

	Map<String, RexxValue> entries() {
		return tails;
	}
}
