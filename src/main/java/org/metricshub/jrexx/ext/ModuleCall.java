package org.metricshub.jrexx.ext;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.jrt.NumericSettings;
import org.metricshub.jrexx.jrt.RexxValue;

/**
 * Arguments of a call to a module function or operation.
 */
public final class ModuleCall {

	private final String name;
	private final List<RexxValue> arguments;
	private final Map<String, RexxValue> namedArguments;
	private final NumericSettings numeric;

	/**
	 * @param name name the script used
	 * @param arguments positional arguments; omitted ones are {@code null}
	 * @param namedArguments <code>key=value</code> arguments of operation statements
	 * @param numeric numeric settings of the caller
	 */
	public ModuleCall(String name, List<RexxValue> arguments, Map<String, RexxValue> namedArguments, NumericSettings numeric) {
		this.name = name;
		this.arguments = Collections.unmodifiableList(arguments);
		this.namedArguments = Collections.unmodifiableMap(new LinkedHashMap<String, RexxValue>(namedArguments));
		this.numeric = numeric.copy();
	}

	public String getName() {
		return name;
	}

	public List<RexxValue> getArguments() {
		return arguments;
	}

	/**
	 * @param index 0-based index
	 * @return the argument, or {@code null} when omitted or absent
	 */
	public RexxValue argument(int index) {
		return index < arguments.size() ? arguments.get(index) : null;
	}

	public Map<String, RexxValue> getNamedArguments() {
		return namedArguments;
	}

	/**
	 * @param key case-insensitive argument name
	 * @return the argument, or {@code null}
	 */
	public RexxValue named(String key) {
		for (Map.Entry<String, RexxValue> entry : namedArguments.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(key)) {
				return entry.getValue();
			}
		}
		return null;
	}

	public NumericSettings getNumeric() {
		return numeric.copy();
	}
}
