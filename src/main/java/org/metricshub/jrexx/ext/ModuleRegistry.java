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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jrexx.jrt.BuiltinFunctions;

/**
 * Functions and operations of the modules loaded in one interpreter, keyed
 * by upper-case name, each remembering the canonical id that provides it.
 */
public final class ModuleRegistry {

	/**
	 * A registered function or operation.
	 */
	public static final class Entry {
		private final String name;
		private final FunctionDescriptor descriptor;
		private final String canonicalId;

		Entry(String name, FunctionDescriptor descriptor, String canonicalId) {
			this.name = name;
			this.descriptor = descriptor;
			this.canonicalId = canonicalId;
		}

		/**
		 * @return name as registered, prefix included
		 */
		public String getName() {
			return name;
		}

		public FunctionDescriptor getDescriptor() {
			return descriptor;
		}

		public ModuleCallable getCallable() {
			return descriptor.getCallable();
		}

		public String getCanonicalId() {
			return canonicalId;
		}
	}

	private final ConcurrentMap<String, Entry> functions = new ConcurrentHashMap<String, Entry>();
	private final ConcurrentMap<String, Entry> operations = new ConcurrentHashMap<String, Entry>();
	private final Map<String, LoadedModule> modules = new LinkedHashMap<String, LoadedModule>();
	private final ConcurrentMap<String, String> sources = new ConcurrentHashMap<String, String>();

	private static String key(String name) {
		return name.toUpperCase(Locale.ROOT);
	}

	/**
	 * @param name case-insensitive function name
	 * @return the function, or {@code null}
	 */
	public Entry function(String name) {
		return functions.get(key(name));
	}

	/**
	 * @param name case-insensitive operation name
	 * @return the operation, or {@code null}
	 */
	public Entry operation(String name) {
		return operations.get(key(name));
	}

	/**
	 * @param id canonical id
	 * @return the loaded module, or {@code null}
	 */
	public synchronized LoadedModule module(String id) {
		return modules.get(id);
	}

	/**
	 * @param sourceKey key of a resolved module source
	 * @return the module loaded from that source, or {@code null}
	 */
	public synchronized LoadedModule moduleFromSource(String sourceKey) {
		String id = sources.get(sourceKey);
		return id == null ? null : modules.get(id);
	}

	synchronized void rememberSource(String sourceKey, String id) {
		sources.put(sourceKey, id);
	}

	/**
	 * @return loaded modules in load order
	 */
	public synchronized List<LoadedModule> modules() {
		return Collections.unmodifiableList(new ArrayList<LoadedModule>(modules.values()));
	}

	/**
	 * Registers a module after checking that none of its names is a built-in
	 * or provided by another module. Nothing is registered when a check fails.
	 *
	 * @param module the module
	 * @param sourceKey key of the source it was loaded from
	 * @param moduleFunctions functions by registered name
	 * @param moduleOperations operations by registered name
	 * @throws ModuleLoadException on a conflict
	 */
	synchronized void register(
			LoadedModule module,
			String sourceKey,
			Map<String, FunctionDescriptor> moduleFunctions,
			Map<String, FunctionDescriptor> moduleOperations) {
		String id = module.getId();
		for (String name : moduleFunctions.keySet()) {
			if (BuiltinFunctions.isBuiltin(name)) {
				throw new ModuleLoadException("Module " + id + " cannot redefine built-in function " + name);
			}
			checkConflict(functions.get(key(name)), "function", name, id);
		}
		for (String name : moduleOperations.keySet()) {
			checkConflict(operations.get(key(name)), "operation", name, id);
		}
		for (Map.Entry<String, FunctionDescriptor> function : moduleFunctions.entrySet()) {
			functions.put(key(function.getKey()), new Entry(function.getKey(), function.getValue(), id));
		}
		for (Map.Entry<String, FunctionDescriptor> operation : moduleOperations.entrySet()) {
			operations.put(key(operation.getKey()), new Entry(operation.getKey(), operation.getValue(), id));
		}
		modules.put(id, module);
		sources.put(sourceKey, id);
	}

	private static void checkConflict(Entry existing, String kind, String name, String id) {
		if (existing != null && !existing.getCanonicalId().equals(id)) {
			throw new ModuleLoadException(
					"Module " + id + " declares " + kind + " " + name + ", already provided by module " + existing.getCanonicalId());
		}
	}
}
