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
 * A module instance supplied by the host or found by {@link java.util.ServiceLoader}.
 */
final class InstanceModuleSource implements ModuleSource {

	private final RexxModule module;
	private final String description;

	InstanceModuleSource(RexxModule module, String description) {
		this.module = module;
		this.description = description;
	}

	@Override
	public String getKey() {
		return "class:" + module.getClass().getName();
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public RexxModule instantiate() {
		return module;
	}

	@Override
	public void discard() {
		// nothing allocated
	}
}
