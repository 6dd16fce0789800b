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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;
import org.metricshub.jrexx.util.RexxSettings;

/**
 * Resolves explicit paths: specifiers starting with <code>./</code>,
 * <code>../</code>, <code>/</code> or a drive letter, or ending with
 * <code>.jar</code>.
 */
public final class PathModuleResolver implements ModuleResolver {

	private static final Pattern DRIVE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

	static boolean isPath(String specifier) {
		return specifier.startsWith("./")
				|| specifier.startsWith("../")
				|| specifier.startsWith("/")
				|| specifier.startsWith(".\\")
				|| specifier.startsWith("..\\")
				|| DRIVE.matcher(specifier).matches()
				|| specifier.endsWith(".jar");
	}

	@Override
	public ModuleSource resolve(String specifier, RexxSettings settings) {
		if (!isPath(specifier)) {
			return null;
		}
		Path path = Paths.get(specifier);
		if (!Files.isRegularFile(path)) {
			throw new ModuleLoadException("Module file not found: " + specifier);
		}
		if (!specifier.endsWith(".jar")) {
			throw new ModuleLoadException("Module file " + specifier + " is not a jar");
		}
		return new JarModuleSource(path);
	}
}
