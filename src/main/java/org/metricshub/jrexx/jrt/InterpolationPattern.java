package org.metricshub.jrexx.jrt;

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

import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Marker syntax used to substitute variables into string literals at
 * evaluation time, <code>{name}</code> by default.
 * <p>
 * A marker is only substituted when its content is a symbol naming a set
 * variable. Anything else between the delimiters (JSON objects, unset names)
 * stays in the string untouched.
 */
public final class InterpolationPattern {

	/** <code>{name}</code> */
	public static final InterpolationPattern BRACE = new InterpolationPattern("brace", "{", "}");

	/** <code>{{name}}</code> */
	public static final InterpolationPattern HANDLEBARS = new InterpolationPattern("handlebars", "{{", "}}");

	/** <code>${name}</code> */
	public static final InterpolationPattern SHELL = new InterpolationPattern("shell", "${", "}");

	/** <code>%name%</code> */
	public static final InterpolationPattern BATCH = new InterpolationPattern("batch", "%", "%");

	/** <code>$$name$$</code> */
	public static final InterpolationPattern DOUBLE_DOLLAR = new InterpolationPattern("doubledollar", "$$", "$$");

	private static final InterpolationPattern[] PREDEFINED = { BRACE, HANDLEBARS, SHELL, BATCH, DOUBLE_DOLLAR };

	private static final Pattern SYMBOL = Pattern.compile("[A-Za-z_@#$?][A-Za-z0-9_.@#$?]*");

	private final String name;
	private final String open;
	private final String close;

	private InterpolationPattern(String name, String open, String close) {
		this.name = name;
		this.open = open;
		this.close = close;
	}

	/**
	 * Resolves a pattern by predefined name (<code>brace</code>,
	 * <code>handlebars</code>, <code>shell</code>, <code>batch</code>,
	 * <code>doubledollar</code>) or from an example such as <code>[[v]]</code>,
	 * where <code>v</code> stands for the variable name.
	 *
	 * @param spec pattern name or example
	 * @return the pattern
	 * @throws IllegalArgumentException when the example has no delimiters on
	 *         both sides of <code>v</code>
	 */
	public static InterpolationPattern of(String spec) {
		if (spec == null || spec.isEmpty()) {
			throw new IllegalArgumentException("Interpolation pattern must not be empty");
		}
		String lower = spec.toLowerCase(Locale.ROOT);
		for (InterpolationPattern pattern : PREDEFINED) {
			if (pattern.name.equals(lower)) {
				return pattern;
			}
		}
		int marker = spec.indexOf('v');
		if (marker <= 0 || marker == spec.length() - 1 || spec.indexOf('v', marker + 1) >= 0) {
			throw new IllegalArgumentException(
					"Interpolation pattern '" + spec + "' must be a known name or an example like {v} with delimiters around a single v");
		}
		return new InterpolationPattern("custom", spec.substring(0, marker), spec.substring(marker + 1));
	}

	public String getName() {
		return name;
	}

	public String getOpen() {
		return open;
	}

	public String getClose() {
		return close;
	}

	/**
	 * Substitutes every marker whose content is a set variable.
	 *
	 * @param text literal text
	 * @param lookup returns the value of a variable, or {@code null} when unset
	 * @return the interpolated text
	 */
	public String interpolate(String text, Function<String, String> lookup) {
		int start = text.indexOf(open);
		if (start < 0) {
			return text;
		}
		StringBuilder result = new StringBuilder(text.length() + 16);
		int position = 0;
		while (start >= 0) {
			int contentStart = start + open.length();
			int end = text.indexOf(close, contentStart);
			if (end < 0) {
				break;
			}
			String content = text.substring(contentStart, end);
			String replacement = SYMBOL.matcher(content).matches() ? lookup.apply(content) : null;
			if (replacement != null) {
				result.append(text, position, start).append(replacement);
				position = end + close.length();
				start = text.indexOf(open, position);
			} else {
				start = text.indexOf(open, start + 1);
			}
		}
		result.append(text, position, text.length());
		return result.toString();
	}

	@Override
	public String toString() {
		return open + "v" + close;
	}
}
