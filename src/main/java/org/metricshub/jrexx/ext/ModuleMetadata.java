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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.address.AddressTarget;

/**
 * Declaration returned by a module's detection entry point: its canonical
 * id and the functions, operations or address target it provides.
 */
public final class ModuleMetadata {

	private final String id;
	private final String version;
	private final String description;
	private final Map<String, FunctionDescriptor> functions;
	private final Map<String, FunctionDescriptor> operations;
	private final AddressTarget addressTarget;
	private final List<String> dependencies;

	private ModuleMetadata(Builder builder) {
		this.id = builder.id;
		this.version = builder.version;
		this.description = builder.description;
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<String, FunctionDescriptor>(builder.functions));
		this.operations = Collections.unmodifiableMap(new LinkedHashMap<String, FunctionDescriptor>(builder.operations));
		this.addressTarget = builder.addressTarget;
		this.dependencies = Collections.unmodifiableList(new ArrayList<String>(builder.dependencies));
	}

	/**
	 * @param id canonical id, e.g. <code>org.example/strings</code>
	 * @return a builder
	 */
	public static Builder builder(String id) {
		return new Builder(id);
	}

	/**
	 * @return the canonical id
	 */
	public String getId() {
		return id;
	}

	/**
	 * @return the part of the id after its last <code>/</code>
	 */
	public String getShortName() {
		return id.substring(id.lastIndexOf('/') + 1);
	}

	public String getVersion() {
		return version;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return functions by upper-case name
	 */
	public Map<String, FunctionDescriptor> getFunctions() {
		return functions;
	}

	/**
	 * @return operations by upper-case name
	 */
	public Map<String, FunctionDescriptor> getOperations() {
		return operations;
	}

	/**
	 * @return the address target, or {@code null} for function modules
	 */
	public AddressTarget getAddressTarget() {
		return addressTarget;
	}

	/**
	 * @return specifiers of modules to load first
	 */
	public List<String> getDependencies() {
		return dependencies;
	}

	@Override
	public String toString() {
		return id + (version == null ? "" : "@" + version);
	}

	/**
	 * Builds {@link ModuleMetadata}.
	 */
	public static final class Builder {
		private final String id;
		private String version;
		private String description = "";
		private final Map<String, FunctionDescriptor> functions = new LinkedHashMap<String, FunctionDescriptor>();
		private final Map<String, FunctionDescriptor> operations = new LinkedHashMap<String, FunctionDescriptor>();
		private AddressTarget addressTarget;
		private final List<String> dependencies = new ArrayList<String>();

		private Builder(String id) {
			if (id == null || id.trim().isEmpty()) {
				throw new IllegalArgumentException("Module id must not be empty");
			}
			this.id = id.trim();
		}

		public Builder version(String value) {
			this.version = value;
			return this;
		}

		public Builder description(String value) {
			this.description = value == null ? "" : value;
			return this;
		}

		public Builder function(FunctionDescriptor function) {
			functions.put(function.getName(), function);
			return this;
		}

		public Builder function(String name, ModuleCallable callable, String... parameters) {
			return function(new FunctionDescriptor(name, callable, parameters));
		}

		public Builder operation(FunctionDescriptor operation) {
			operations.put(operation.getName(), operation);
			return this;
		}

		public Builder operation(String name, ModuleCallable callable, String... parameters) {
			return operation(new FunctionDescriptor(name, callable, parameters));
		}

		public Builder addressTarget(AddressTarget target) {
			this.addressTarget = target;
			return this;
		}

		public Builder dependencies(String... specifiers) {
			dependencies.addAll(Arrays.asList(specifiers));
			return this;
		}

		/**
		 * @return the metadata
		 * @throws IllegalStateException when an address target is declared with
		 *         functions or operations
		 */
		public ModuleMetadata build() {
			if (addressTarget != null && (!functions.isEmpty() || !operations.isEmpty())) {
				throw new IllegalStateException(
						"Module " + id + " declares an address target together with functions or operations");
			}
			return new ModuleMetadata(this);
		}
	}
}
