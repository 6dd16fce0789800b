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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A function or operation declared by a module. Descriptions and parameter
 * names are for introspection only.
 */
public final class FunctionDescriptor {

	private final String name;
	private final String description;
	private final List<String> parameters;
	private final ModuleCallable callable;

	/**
	 * @param name function name, stored in upper case
	 * @param description one-line description
	 * @param parameters parameter names
	 * @param callable implementation
	 */
	public FunctionDescriptor(String name, String description, List<String> parameters, ModuleCallable callable) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Function name must not be empty");
		}
		if (callable == null) {
			throw new IllegalArgumentException("Function " + name + " has no implementation");
		}
		this.name = name.trim().toUpperCase(Locale.ROOT);
		this.description = description == null ? "" : description;
		this.parameters = Collections.unmodifiableList(parameters);
		this.callable = callable;
	}

	public FunctionDescriptor(String name, ModuleCallable callable, String... parameters) {
		this(name, "", Arrays.asList(parameters), callable);
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public ModuleCallable getCallable() {
		return callable;
	}

	@Override
	public String toString() {
		return name + parameters;
	}
}
