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

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.slf4j.Logger;

/**
 * Resolves a name against the modules on the classpath: first the
 * {@link ServiceLoader} modules whose canonical id or short name matches
 * (case-insensitive), then a module class with that name.
 */
public final class ClasspathModuleResolver implements ModuleResolver {

	private static final Logger LOG = RexxLogger.getLogger(ClasspathModuleResolver.class);

	@Override
	public ModuleSource resolve(String specifier, RexxSettings settings) {
		ClassLoader classLoader = RegistryModuleResolver.classLoader();
		try {
			for (RexxModule module : ServiceLoader.load(RexxModule.class, classLoader)) {
				ModuleMetadata metadata;
				try {
					metadata = module.describe();
				} catch (RuntimeException e) {
					LOG.warn("Skipping module {} that cannot describe itself: {}", module.getClass().getName(), e.getMessage());
					continue;
				}
				if (metadata.getId().equalsIgnoreCase(specifier) || metadata.getShortName().equalsIgnoreCase(specifier)) {
					return new InstanceModuleSource(module, "classpath service " + module.getClass().getName());
				}
			}
		} catch (ServiceConfigurationError e) {
			LOG.warn("Ignoring invalid module service declaration: {}", e.getMessage());
		}
		if (ClassModuleSource.isModuleClass(specifier, classLoader)) {
			return new ClassModuleSource(specifier, classLoader, "classpath");
		}
		return null;
	}
}
