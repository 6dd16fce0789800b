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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A module registered in an interpreter, with the names it was registered
 * under.
 */
public final class LoadedModule {

	private final ModuleMetadata metadata;
	private final String source;
	private final List<String> functionNames;
	private final List<String> operationNames;
	private final String addressName;

	LoadedModule(ModuleMetadata metadata, String source, List<String> functionNames, List<String> operationNames, String addressName) {
		this.metadata = metadata;
		this.source = source;
		this.functionNames = Collections.unmodifiableList(new ArrayList<String>(functionNames));
		this.operationNames = Collections.unmodifiableList(new ArrayList<String>(operationNames));
		this.addressName = addressName;
	}

	public String getId() {
		return metadata.getId();
	}

	public ModuleMetadata getMetadata() {
		return metadata;
	}

	/**
	 * @return description of where the module was loaded from
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @return function names as registered, prefix included
	 */
	public List<String> getFunctionNames() {
		return functionNames;
	}

	/**
	 * @return operation names as registered, prefix included
	 */
	public List<String> getOperationNames() {
		return operationNames;
	}

	/**
	 * @return the address target name, or {@code null}
	 */
	public String getAddressName() {
		return addressName;
	}

	@Override
	public String toString() {
		return metadata + " from " + source;
	}
}
