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

import java.lang.reflect.InvocationTargetException;

/**
 * A module class instantiated through its public no-argument constructor.
 */
final class ClassModuleSource implements ModuleSource {

	private final String className;
	private final ClassLoader classLoader;
	private final String description;

	ClassModuleSource(String className, ClassLoader classLoader, String description) {
		this.className = className;
		this.classLoader = classLoader;
		this.description = description;
	}

	@Override
	public String getKey() {
		return "class:" + className;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public RexxModule instantiate() {
		Class<?> clazz;
		try {
			clazz = Class.forName(className, true, classLoader);
		} catch (ClassNotFoundException | LinkageError e) {
			throw new ModuleLoadException("Module class " + className + " not found in " + description, e);
		}
		if (!RexxModule.class.isAssignableFrom(clazz)) {
			throw new ModuleLoadException(
					"Class " + className + " has no detection entry point: it does not implement " + RexxModule.class.getName());
		}
		try {
			return clazz.asSubclass(RexxModule.class).getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new ModuleLoadException("Cannot instantiate module " + className, e);
		} catch (InvocationTargetException e) {
			throw new ModuleLoadException("Cannot instantiate module " + className + ": " + e.getCause().getMessage(), e.getCause());
		}
	}

	/**
	 * @param className a class name
	 * @param classLoader loader to look in
	 * @return {@code true} when the class exists and implements {@link RexxModule}
	 */
	static boolean isModuleClass(String className, ClassLoader classLoader) {
		try {
			return RexxModule.class.isAssignableFrom(Class.forName(className, false, classLoader));
		} catch (ClassNotFoundException | LinkageError e) {
			return false;
		}
	}

	@Override
	public void discard() {
		// nothing allocated
	}
}
