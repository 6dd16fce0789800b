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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jrexx.address.AddressRegistration;
import org.metricshub.jrexx.address.AddressTarget;
import org.metricshub.jrexx.address.AddressTargetRegistry;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.slf4j.Logger;

/**
 * Loads modules and registers what they provide, once per canonical id.
 * <p>
 * Specifiers are resolved by the first resolver that recognizes them:
 * explicit paths, <code>registry:</code> names, then bare names searched in
 * the search path and on the classpath.
 */
public final class ModuleLoader {

	private static final Logger LOG = RexxLogger.getLogger(ModuleLoader.class);

	private static final Pattern PREFIX_PATTERN = Pattern.compile("([A-Za-z0-9_]+)\\(\\.\\*\\)");
	private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z0-9_]+");

	private final ModuleRegistry registry;
	private final AddressTargetRegistry targets;
	private final List<ModuleResolver> resolvers;

	/**
	 * @param registry functions and operations of the interpreter
	 * @param targets address targets of the interpreter
	 */
	public ModuleLoader(ModuleRegistry registry, AddressTargetRegistry targets) {
		this(registry, targets, Arrays.<ModuleResolver>asList(
				new PathModuleResolver(),
				new RegistryModuleResolver(),
				new SearchPathModuleResolver(),
				new ClasspathModuleResolver()));
	}

	/**
	 * @param registry functions and operations of the interpreter
	 * @param targets address targets of the interpreter
	 * @param resolvers resolvers, tried in order
	 */
	public ModuleLoader(ModuleRegistry registry, AddressTargetRegistry targets, List<ModuleResolver> resolvers) {
		this.registry = registry;
		this.targets = targets;
		this.resolvers = Collections.unmodifiableList(new ArrayList<ModuleResolver>(resolvers));
	}

	/**
	 * Loads a module, its dependencies first.
	 *
	 * @param specifier path, <code>registry:</code> name or bare name
	 * @param as registration prefix for functions and operations, or name of
	 *        the address target; {@code null} for the module's own names
	 * @param settings search path and registry files
	 * @return the loaded module, or the cached one when its canonical id is
	 *         already loaded
	 * @throws ModuleLoadException when the module cannot be loaded
	 */
	public LoadedModule load(String specifier, String as, RexxSettings settings) {
		return load(specifier, as, settings, new ArrayDeque<String>());
	}

	/**
	 * Registers a module instance supplied by the host.
	 *
	 * @param module the module
	 * @param as registration prefix or address target name, may be {@code null}
	 * @param settings used to load the module's dependencies
	 * @return the loaded module
	 * @throws ModuleLoadException when the module cannot be registered
	 */
	public LoadedModule load(RexxModule module, String as, RexxSettings settings) {
		InstanceModuleSource source = new InstanceModuleSource(module, "host module " + module.getClass().getName());
		return load(source, as, settings, new ArrayDeque<String>());
	}

	private LoadedModule load(String specifier, String as, RexxSettings settings, Deque<String> chain) {
		String spec = specifier == null ? "" : specifier.trim();
		if (spec.isEmpty()) {
			throw new ModuleLoadException("REQUIRE needs a module specifier");
		}
		return load(resolve(spec, settings), as, settings, chain);
	}

	private ModuleSource resolve(String specifier, RexxSettings settings) {
		for (ModuleResolver resolver : resolvers) {
			ModuleSource source = resolver.resolve(specifier, settings);
			if (source != null) {
				LOG.debug("Module {} resolved to {}", specifier, source.getDescription());
				return source;
			}
		}
		throw new ModuleLoadException("Cannot resolve module " + specifier);
	}

	private LoadedModule load(ModuleSource source, String as, RexxSettings settings, Deque<String> chain) {
		LoadedModule cached = registry.moduleFromSource(source.getKey());
		if (cached != null) {
			LOG.debug("Module {} already loaded from {}", cached.getId(), source.getDescription());
			return cached;
		}
		RexxModule module = source.instantiate();
		boolean kept = false;
		try {
			ModuleMetadata metadata;
			try {
				metadata = module.describe();
			} catch (RuntimeException e) {
				throw new ModuleLoadException("Module " + source.getDescription() + " failed to describe itself: " + e.getMessage(), e);
			}
			if (metadata == null) {
				throw new ModuleLoadException("Module " + source.getDescription() + " has no detection entry point: describe() returned nothing");
			}
			String id = metadata.getId();
			LoadedModule existing = registry.module(id);
			if (existing != null) {
				registry.rememberSource(source.getKey(), id);
				LOG.debug("Module {} already loaded", id);
				return existing;
			}
			if (chain.contains(id)) {
				throw new ModuleLoadException("Circular module dependency: " + describeCycle(chain, id));
			}
			chain.push(id);
			try {
				for (String dependency : metadata.getDependencies()) {
					load(dependency, null, settings, chain);
				}
			} finally {
				chain.pop();
			}
			LoadedModule loaded = metadata.getAddressTarget() != null
					? registerAddressModule(metadata, source, as)
					: registerFunctionModule(metadata, source, as);
			LOG.debug("Loaded module {} from {}", id, source.getDescription());
			kept = true;
			return loaded;
		} finally {
			if (!kept) {
				source.discard();
			}
		}
	}

	private LoadedModule registerAddressModule(ModuleMetadata metadata, ModuleSource source, String as) {
		AddressTarget target = metadata.getAddressTarget();
		if (as != null && !PLAIN_NAME.matcher(as).matches()) {
			throw new ModuleLoadException("Address module " + metadata.getId() + " cannot be registered AS pattern " + as);
		}
		String name = (as == null ? target.getName() : as).toLowerCase(Locale.ROOT);
		AddressRegistration existing = targets.resolve(name);
		if (existing != null && !metadata.getId().equals(existing.getCanonicalId())) {
			String owner = existing.getCanonicalId() == null ? "the host" : "module " + existing.getCanonicalId();
			throw new ModuleLoadException(
					"Module " + metadata.getId() + " declares address target " + name + ", already provided by " + owner);
		}
		LoadedModule loaded = new LoadedModule(
				metadata,
				source.getDescription(),
				Collections.<String>emptyList(),
				Collections.<String>emptyList(),
				name);
		registry.register(
				loaded,
				source.getKey(),
				Collections.<String, FunctionDescriptor>emptyMap(),
				Collections.<String, FunctionDescriptor>emptyMap());
		targets.register(new AddressRegistration(name, target, null, metadata.getId()));
		return loaded;
	}

	private LoadedModule registerFunctionModule(ModuleMetadata metadata, ModuleSource source, String as) {
		String prefix = prefix(as);
		Map<String, FunctionDescriptor> functions = prefixed(prefix, metadata.getFunctions());
		Map<String, FunctionDescriptor> operations = prefixed(prefix, metadata.getOperations());
		LoadedModule loaded = new LoadedModule(
				metadata,
				source.getDescription(),
				new ArrayList<String>(functions.keySet()),
				new ArrayList<String>(operations.keySet()),
				null);
		registry.register(loaded, source.getKey(), functions, operations);
		return loaded;
	}

	/**
	 * Computes the registration prefix of an <code>AS</code> clause:
	 * <code>AS math</code> and <code>AS math_</code> give <code>MATH_</code>,
	 * <code>AS m_(.*)</code> gives <code>M_</code>.
	 *
	 * @param as the AS clause, may be {@code null}
	 * @return the upper-case prefix, empty when there is none
	 */
	static String prefix(String as) {
		if (as == null || as.isEmpty()) {
			return "";
		}
		Matcher pattern = PREFIX_PATTERN.matcher(as);
		String prefix;
		if (pattern.matches()) {
			prefix = pattern.group(1);
		} else if (PLAIN_NAME.matcher(as).matches()) {
			prefix = as.endsWith("_") ? as : as + "_";
		} else {
			throw new ModuleLoadException("Unsupported AS pattern " + as + ", use a name or prefix_(.*)");
		}
		return prefix.toUpperCase(Locale.ROOT);
	}

	private static Map<String, FunctionDescriptor> prefixed(String prefix, Map<String, FunctionDescriptor> descriptors) {
		Map<String, FunctionDescriptor> result = new LinkedHashMap<String, FunctionDescriptor>();
		for (FunctionDescriptor descriptor : descriptors.values()) {
			result.put(prefix + descriptor.getName(), descriptor);
		}
		return result;
	}

	private static String describeCycle(Deque<String> chain, String id) {
		StringBuilder cycle = new StringBuilder();
		Iterator<String> ids = chain.descendingIterator();
		while (ids.hasNext()) {
			cycle.append(ids.next()).append(" -> ");
		}
		return cycle.append(id).toString();
	}
}
