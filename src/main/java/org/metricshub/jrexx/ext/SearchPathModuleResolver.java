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
import org.metricshub.jrexx.util.RexxSettings;

/**
 * Resolves a bare name to <code>name.jar</code> in the first search
 * directory that has one.
 */
public final class SearchPathModuleResolver implements ModuleResolver {

	@Override
	public ModuleSource resolve(String specifier, RexxSettings settings) {
		if (specifier.indexOf('/') >= 0 || specifier.indexOf('\\') >= 0 || specifier.indexOf(':') >= 0) {
			return null;
		}
		for (Path directory : settings.getSearchPath()) {
			Path jar = directory.resolve(specifier + ".jar");
			if (Files.isRegularFile(jar)) {
				return new JarModuleSource(jar);
			}
		}
		return null;
	}
}
