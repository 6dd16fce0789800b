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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Variables of one call frame. Simple variables live in {@link Variable}
 * cells and stems in {@link Stem} objects; exposing a name to a routine makes
 * the routine's pool share the caller's cell or stem.
 * <p>
 * Names given to the <code>Simple</code>, <code>Compound</code> and
 * <code>Stem</code> methods are expected in upper case, with the tail of a
 * compound symbol already derived. Stem names include their trailing dot.
 */
public class VariablePool {

	private final Map<String, Variable> simple = new HashMap<String, Variable>();
	private final Map<String, Stem> stems = new HashMap<String, Stem>();

	public RexxValue getSimple(String name) {
		Variable variable = simple.get(name);
		return variable == null ? null : variable.get();
	}

	public void setSimple(String name, RexxValue value) {
		cell(name).set(value);
	}

	public void dropSimple(String name) {
		Variable variable = simple.get(name);
		if (variable != null) {
			variable.drop();
		}
	}

	public RexxValue getCompound(String stemName, String tail) {
		Stem stem = stems.get(stemName);
		return stem == null ? null : stem.get(tail);
	}

	public void setCompound(String stemName, String tail, RexxValue value) {
		stem(stemName).set(tail, value);
	}

	public void dropCompound(String stemName, String tail) {
		Stem stem = stems.get(stemName);
		if (stem != null) {
			stem.drop(tail);
		}
	}

	/**
	 * Assigns a whole stem (<code>stem. = value</code>).
	 *
	 * @param stemName stem name including the trailing dot
	 * @param value new default for every tail
	 */
	public void assignStem(String stemName, RexxValue value) {
		stem(stemName).assignAll(value);
	}

	public void dropStem(String stemName) {
		Stem stem = stems.get(stemName);
		if (stem != null) {
			stem.dropAll();
		}
	}

	/**
	 * Returns the stem with the given name, creating it when needed.
	 *
	 * @param stemName stem name including the trailing dot
	 * @return the stem
	 */
	public Stem stem(String stemName) {
		Stem stem = stems.get(stemName);
		if (stem == null) {
			stem = new Stem();
			stems.put(stemName, stem);
		}
		return stem;
	}

	private Variable cell(String name) {
		Variable variable = simple.get(name);
		if (variable == null) {
			variable = new Variable();
			simple.put(name, variable);
		}
		return variable;
	}

	/**
	 * Shares a variable or a whole stem of another pool with this one. Later
	 * assignments through either pool are visible through both.
	 *
	 * @param owner pool that owns the variable
	 * @param name upper-case simple name, or stem name with trailing dot
	 */
	public void expose(VariablePool owner, String name) {
		if (name.endsWith(".")) {
			stems.put(name, owner.stem(name));
		} else {
			simple.put(name, owner.cell(name));
		}
	}

	/**
	 * Assigns a variable by its full name, as hosts and the CLI do. The name is
	 * upper-cased; a compound name uses its tail literally.
	 *
	 * @param name simple, compound or stem name
	 * @param value value to assign
	 */
	public void set(String name, RexxValue value) {
		String upper = name.toUpperCase(Locale.ROOT);
		int dot = upper.indexOf('.');
		if (dot < 0) {
			setSimple(upper, value);
		} else if (dot == upper.length() - 1) {
			assignStem(upper, value);
		} else {
			setCompound(upper.substring(0, dot + 1), upper.substring(dot + 1), value);
		}
	}

	/**
	 * Reads a variable by its full name, see {@link #set(String, RexxValue)}.
	 *
	 * @param name simple or compound name
	 * @return the value, or {@code null} when unset
	 */
	public RexxValue get(String name) {
		String upper = name.toUpperCase(Locale.ROOT);
		int dot = upper.indexOf('.');
		if (dot < 0) {
			return getSimple(upper);
		}
		if (dot == upper.length() - 1) {
			Stem stem = stems.get(upper);
			return stem == null ? null : stem.getDefaultValue();
		}
		return getCompound(upper.substring(0, dot + 1), upper.substring(dot + 1));
	}

	/**
	 * Returns every set variable, compound variables under their full
	 * <code>STEM.TAIL</code> name, sorted by name.
	 *
	 * @return read-only snapshot
	 */
	public Map<String, RexxValue> snapshot() {
		Map<String, RexxValue> result = new TreeMap<String, RexxValue>();
		for (Map.Entry<String, Variable> entry : simple.entrySet()) {
			if (entry.getValue().isSet()) {
				result.put(entry.getKey(), entry.getValue().get());
			}
		}
		for (Map.Entry<String, Stem> entry : stems.entrySet()) {
			Stem stem = entry.getValue();
			if (stem.getDefaultValue() != null) {
				result.put(entry.getKey(), stem.getDefaultValue());
			}
			for (Map.Entry<String, RexxValue> tail : stem.entries().entrySet()) {
				result.put(entry.getKey() + tail.getKey(), tail.getValue());
			}
		}
		return Collections.unmodifiableMap(result);
	}
}
