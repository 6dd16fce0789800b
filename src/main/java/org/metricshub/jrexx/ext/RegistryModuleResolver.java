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

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.Properties;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.slf4j.Logger;

/**
 * Resolves <code>registry:namespace/name</code> specifiers through registry
 * property files: the settings' registry files first, then every
 * <code>META-INF/jrexx/registry.properties</code> on the classpath. A value
 * ending with <code>.jar</code> is a jar path, relative to the registry
 * file; any other value is a module class name.
 */
public final class RegistryModuleResolver implements ModuleResolver {

	private static final Logger LOG = RexxLogger.getLogger(RegistryModuleResolver.class);

	/** Prefix of registry specifiers */
	public static final String PREFIX = "registry:";

	/** Classpath location of registry files */
	public static final String CLASSPATH_REGISTRY = "META-INF/jrexx/registry.properties";

	@Override
	public ModuleSource resolve(String specifier, RexxSettings settings) {
		if (!specifier.startsWith(PREFIX)) {
			return null;
		}
		String name = specifier.substring(PREFIX.length()).trim();
		if (name.isEmpty()) {
			throw new ModuleLoadException("Empty registry name in " + specifier);
		}
		for (Path file : settings.getRegistryFiles()) {
			Properties registry = new Properties();
			try (InputStream in = Files.newInputStream(file)) {
				registry.load(in);
			} catch (IOException e) {
				throw new ModuleLoadException("Cannot read module registry " + file + ": " + e.getMessage(), e);
			}
			String value = registry.getProperty(name);
			if (value != null) {
				LOG.debug("{} found in registry {}", specifier, file);
				return source(value.trim(), file.toAbsolutePath().getParent(), file.toString());
			}
		}
		ClassLoader classLoader = classLoader();
		try {
			Enumeration<URL> resources = classLoader.getResources(CLASSPATH_REGISTRY);
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				Properties registry = new Properties();
				try (InputStream in = url.openStream()) {
					registry.load(in);
				}
				String value = registry.getProperty(name);
				if (value != null) {
					LOG.debug("{} found in registry {}", specifier, url);
					return source(value.trim(), directoryOf(url), url.toString());
				}
			}
		} catch (IOException e) {
			throw new ModuleLoadException("Cannot read module registries: " + e.getMessage(), e);
		}
		throw new ModuleLoadException("Module " + name + " is not in any registry");
	}

	private ModuleSource source(String value, Path baseDirectory, String registry) {
		if (value.endsWith(".jar")) {
			Path jar = Paths.get(value);
			if (!jar.isAbsolute()) {
				if (baseDirectory == null) {
					throw new ModuleLoadException("Registry " + registry + " maps to a relative jar path but is not a file: " + value);
				}
				jar = baseDirectory.resolve(value);
			}
			if (!Files.isRegularFile(jar)) {
				throw new ModuleLoadException("Module file not found: " + jar + " (from registry " + registry + ")");
			}
			return new JarModuleSource(jar);
		}
		return new ClassModuleSource(value, classLoader(), "registry " + registry);
	}

	private static Path directoryOf(URL url) {
		if (!"file".equals(url.getProtocol())) {
			return null;
		}
		try {
			return Paths.get(url.toURI()).getParent();
		} catch (URISyntaxException e) {
			return null;
		}
	}

	static ClassLoader classLoader() {
		ClassLoader context = Thread.currentThread().getContextClassLoader();
		return context != null ? context : RegistryModuleResolver.class.getClassLoader();
	}
}
