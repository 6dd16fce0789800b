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

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.metricshub.jrexx.ext.annotations.ModuleFunction;
import org.metricshub.jrexx.ext.annotations.ModuleOperation;

/**
 * Base class of modules written as plain Java methods annotated with
 * {@link ModuleFunction} and {@link ModuleOperation}.
 *
 * <pre>
 * public class TextModule extends AbstractModule {
 * 	public TextModule() {
 * 		super("example/text", "1.0", "Text helpers");
 * 	}
 *
 * 	&#64;ModuleFunction(value = "SHOUT", params = { "text" })
 * 	public String shout(String text) {
 * 		return text.toUpperCase() + "!";
 * 	}
 * }
 * </pre>
 */
public abstract class AbstractModule implements RexxModule {

	private final String id;
	private final String version;
	private final String description;

	protected AbstractModule(String id, String version, String description) {
		this.id = id;
		this.version = version;
		this.description = description;
	}

	@Override
	public ModuleMetadata describe() {
		ModuleMetadata.Builder builder = ModuleMetadata.builder(id).version(version).description(description);
		for (Method method : annotatedMethods()) {
			ModuleFunction function = method.getAnnotation(ModuleFunction.class);
			if (function != null) {
				ReflectiveCallable callable = new ReflectiveCallable(function.value(), this, method, function.params());
				builder.function(new FunctionDescriptor(function.value(), function.description(), Arrays.asList(function.params()), callable));
			}
			ModuleOperation operation = method.getAnnotation(ModuleOperation.class);
			if (operation != null) {
				ReflectiveCallable callable = new ReflectiveCallable(operation.value(), this, method, operation.params());
				builder.operation(new FunctionDescriptor(operation.value(), operation.description(), Arrays.asList(operation.params()), callable));
			}
		}
		configure(builder);
		return builder.build();
	}

	/**
	 * Adds to the metadata built from annotations, e.g. dependencies.
	 *
	 * @param builder metadata being built
	 */
	protected void configure(ModuleMetadata.Builder builder) {}

	private List<Method> annotatedMethods() {
		List<Method> methods = new ArrayList<Method>();
		for (Class<?> type = getClass(); type != null && type != AbstractModule.class; type = type.getSuperclass()) {
			for (Method method : type.getDeclaredMethods()) {
				if (method.isAnnotationPresent(ModuleFunction.class) || method.isAnnotationPresent(ModuleOperation.class)) {
					methods.add(method);
				}
			}
		}
		Collections.sort(methods, new Comparator<Method>() {
			@Override
			public int compare(Method first, Method second) {
				return first.getName().compareTo(second.getName());
			}
		});
		return methods;
	}
}
