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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.metricshub.jrexx.util.RexxLogger;
import org.slf4j.Logger;

/**
 * A module packaged as a jar, loaded in its own class loader. The module
 * class is named by the <code>Rexx-Module</code> manifest attribute, or by
 * the first entry of the <code>RexxModule</code> service file.
 */
final class JarModuleSource implements ModuleSource {

	private static final Logger LOG = RexxLogger.getLogger(JarModuleSource.class);

	/** Manifest attribute naming the module class */
	static final String MANIFEST_ATTRIBUTE = "Rexx-Module";

	static final String SERVICE_ENTRY = "META-INF/services/" + RexxModule.class.getName();

	private final Path jar;
	private URLClassLoader loader;

	JarModuleSource(Path jar) {
		this.jar = jar.toAbsolutePath().normalize();
	}

	@Override
	public String getKey() {
		return "jar:" + jar;
	}

	@Override
	public String getDescription() {
		return jar.toString();
	}

	@Override
	public RexxModule instantiate() {
		String className = detectModuleClass();
		if (className == null) {
			throw new ModuleLoadException(
					"Module " + jar + " has no detection entry point: no " + MANIFEST_ATTRIBUTE
							+ " manifest attribute and no " + SERVICE_ENTRY + " entry");
		}
		URLClassLoader created;
		try {
			created = new URLClassLoader(new URL[] { jar.toUri().toURL() }, RexxModule.class.getClassLoader());
		} catch (MalformedURLException e) {
			throw new ModuleLoadException("Invalid module path " + jar, e);
		}
		RexxModule module;
		try {
			module = new ClassModuleSource(className, created, jar.toString()).instantiate();
		} catch (RuntimeException | LinkageError e) {
			close(created, e);
			throw e;
		}
		loader = created;
		return module;
	}

	@Override
	public void discard() {
		if (loader != null) {
			close(loader, null);
			loader = null;
		}
	}

	/**
	 * @return the class loader of the last instance, {@code null} once discarded
	 */
	URLClassLoader getClassLoader() {
		return loader;
	}

	private void close(URLClassLoader classLoader, Throwable failure) {
		try {
			classLoader.close();
		} catch (IOException e) {
			if (failure != null) {
				failure.addSuppressed(e);
			} else {
				LOG.warn("Cannot close class loader of module {}: {}", jar, e.getMessage());
			}
		}
	}

	private String detectModuleClass() {
		try (JarFile file = new JarFile(jar.toFile())) {
			Manifest manifest = file.getManifest();
			if (manifest != null) {
				String className = manifest.getMainAttributes().getValue(MANIFEST_ATTRIBUTE);
				if (className != null && !className.trim().isEmpty()) {
					return className.trim();
				}
			}
			JarEntry entry = file.getJarEntry(SERVICE_ENTRY);
			if (entry == null) {
				return null;
			}
			try (InputStream in = file.getInputStream(entry)) {
				return firstServiceLine(in);
			}
		} catch (IOException e) {
			throw new ModuleLoadException("Cannot read module jar " + jar + ": " + e.getMessage(), e);
		}
	}

	static String firstServiceLine(InputStream in) throws IOException {
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		String line;
		while ((line = reader.readLine()) != null) {
			int comment = line.indexOf('#');
			String name = (comment >= 0 ? line.substring(0, comment) : line).trim();
			if (!name.isEmpty()) {
				return name;
			}
		}
		return null;
	}
}
