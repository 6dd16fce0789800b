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

/**
 * A module found by a {@link ModuleResolver}, not instantiated yet.
 */
public interface ModuleSource {

	/**
	 * @return identifies the source, e.g. the absolute jar path; two specifiers
	 *         resolving to the same key load the module once
	 */
	String getKey();

	/**
	 * @return human readable origin, used in messages
	 */
	String getDescription();

	/**
	 * @return a new instance of the module
	 * @throws ModuleLoadException when the module cannot be instantiated or has
	 *         no detection entry point
	 */
	RexxModule instantiate();

	/**
	 * Releases what {@link #instantiate()} allocated for a module instance that
	 * will not be used, e.g. because a module with the same id is already loaded.
	 */
	void discard();
}
