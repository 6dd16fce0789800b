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

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.metricshub.jrexx.jrt.RexxValue;

/**
 * Calls an annotated module method, converting script values to the Java
 * parameter types.
 * <p>
 * Supported parameter types: {@link RexxValue}, {@link String}, <code>int</code>,
 * <code>long</code>, <code>double</code> and their wrappers, {@link BigDecimal},
 * <code>boolean</code>, a {@link Map} receiving the named arguments, a
 * {@link ModuleCall} receiving the whole call, and a trailing varargs array of
 * any of the scalar types. Named arguments are mapped to positions through the
 * declared parameter names.
 */
final class ReflectiveCallable implements ModuleCallable {

	private final String keyword;
	private final Object target;
	private final Method method;
	private final Class<?>[] parameterTypes;
	private final List<String> parameterNames;
	private final boolean varArgs;
	private final int valueParameterCount;

	ReflectiveCallable(String keyword, Object target, Method method, String[] parameterNames) {
		this.keyword = validateKeyword(keyword, method);
		this.target = Objects.requireNonNull(target, "target");
		this.method = prepareMethod(method);
		this.parameterTypes = method.getParameterTypes();
		this.parameterNames = Arrays.asList(parameterNames);
		this.varArgs = method.isVarArgs();
		int count = 0;
		for (Class<?> type : parameterTypes) {
			if (type != ModuleCall.class && type != Map.class) {
				count++;
			}
		}
		this.valueParameterCount = varArgs ? count - 1 : count;
	}

	private static String validateKeyword(String keyword, Method method) {
		Objects.requireNonNull(method, "method");
		if (keyword == null || keyword.trim().isEmpty()) {
			throw new IllegalStateException("Module function " + method + " must declare a non-empty name");
		}
		return keyword.trim().toUpperCase(Locale.ROOT);
	}

	private static Method prepareMethod(Method method) {
		if (Modifier.isStatic(method.getModifiers())) {
			throw new IllegalStateException("Module functions cannot be static methods: " + method.toGenericString());
		}
		method.setAccessible(true);
		return method;
	}

	String getKeyword() {
		return keyword;
	}

	/**
	 * @return number of arguments required, varargs excluded
	 */
	int getArity() {
		return valueParameterCount;
	}

	@Override
	public Object invoke(ModuleCall call) throws Exception {
		List<RexxValue> values = positionalValues(call);
		verifyArgCount(values.size());
		Object[] invocationArgs = new Object[parameterTypes.length];
		int next = 0;
		for (int idx = 0; idx < parameterTypes.length; idx++) {
			Class<?> type = parameterTypes[idx];
			if (type == ModuleCall.class) {
				invocationArgs[idx] = call;
			} else if (type == Map.class) {
				invocationArgs[idx] = call.getNamedArguments();
			} else if (varArgs && idx == parameterTypes.length - 1) {
				Class<?> componentType = type.getComponentType();
				int count = Math.max(0, values.size() - next);
				Object array = Array.newInstance(componentType, count);
				for (int v = 0; v < count; v++) {
					Array.set(array, v, convert(values.get(next + v), componentType, next + v));
				}
				invocationArgs[idx] = array;
			} else {
				invocationArgs[idx] = convert(next < values.size() ? values.get(next) : null, type, next);
				next++;
			}
		}
		try {
			return method.invoke(target, invocationArgs);
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Unable to access module function method for '" + keyword + "'", e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Invocation of module function '" + keyword + "' failed", cause);
		}
	}

	/**
	 * Merges positional and named arguments. A named argument whose name is a
	 * declared parameter takes that parameter's position; the others stay in
	 * the named map.
	 */
	private List<RexxValue> positionalValues(ModuleCall call) {
		List<RexxValue> values = new ArrayList<RexxValue>(call.getArguments());
		boolean takesMap = Arrays.asList(parameterTypes).contains(Map.class);
		for (Map.Entry<String, RexxValue> entry : call.getNamedArguments().entrySet()) {
			int position = indexOfParameter(entry.getKey());
			if (position < 0) {
				if (!takesMap) {
					throw new IllegalArgumentException(keyword + " has no parameter named " + entry.getKey());
				}
				continue;
			}
			while (values.size() <= position) {
				values.add(null);
			}
			values.set(position, entry.getValue());
		}
		return values;
	}

	private int indexOfParameter(String name) {
		for (int i = 0; i < parameterNames.size(); i++) {
			if (parameterNames.get(i).equalsIgnoreCase(name)) {
				return i;
			}
		}
		return -1;
	}

	private void verifyArgCount(int argCount) {
		if (!varArgs && argCount > valueParameterCount) {
			throw new IllegalArgumentException(
					keyword + " expects at most " + valueParameterCount + " argument(s), not " + argCount);
		}
	}

	private Object convert(RexxValue value, Class<?> type, int index) {
		if (value == null) {
			if (type.isPrimitive()) {
				throw new IllegalArgumentException("Argument " + (index + 1) + " of " + keyword + " is required");
			}
			return null;
		}
		if (type == RexxValue.class || type == Object.class) {
			return value;
		}
		if (type == String.class) {
			return value.asString();
		}
		if (type == BigDecimal.class) {
			return number(value, index);
		}
		try {
			if (type == int.class || type == Integer.class) {
				return Integer.valueOf(whole(value, index).intValueExact());
			}
			if (type == long.class || type == Long.class) {
				return Long.valueOf(whole(value, index).longValueExact());
			}
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Argument " + (index + 1) + " of " + keyword + " is out of range", e);
		}
		if (type == double.class || type == Double.class) {
			return Double.valueOf(number(value, index).doubleValue());
		}
		if (type == boolean.class || type == Boolean.class) {
			String text = value.asString().trim();
			if ("1".equals(text) || "true".equalsIgnoreCase(text)) {
				return Boolean.TRUE;
			}
			if ("0".equals(text) || "false".equalsIgnoreCase(text)) {
				return Boolean.FALSE;
			}
			throw new IllegalArgumentException("Argument " + (index + 1) + " of " + keyword + " must be 0 or 1, not " + value);
		}
		throw new IllegalStateException("Unsupported parameter type " + type.getName() + " in " + method);
	}

	private BigDecimal number(RexxValue value, int index) {
		BigDecimal number = value.toNumber();
		if (number == null) {
			throw new IllegalArgumentException("Argument " + (index + 1) + " of " + keyword + " must be a number, not '" + value + "'");
		}
		return number;
	}

	private BigDecimal whole(RexxValue value, int index) {
		BigDecimal number = number(value, index);
		if (number.stripTrailingZeros().scale() > 0) {
			throw new IllegalArgumentException("Argument " + (index + 1) + " of " + keyword + " must be a whole number, not '" + value + "'");
		}
		return number;
	}
}
