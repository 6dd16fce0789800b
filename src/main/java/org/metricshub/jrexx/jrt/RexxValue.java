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

import java.math.BigDecimal;

/**
 * A script value. Every value is a string; its numeric interpretation is
 * computed on first use and cached, so that a value produced by arithmetic and
 * one read from a literal behave the same way.
 */
public final class RexxValue {

	/** The empty string. */
	public static final RexxValue EMPTY = new RexxValue("");

	/** Logical true, the string "1". */
	public static final RexxValue TRUE = new RexxValue("1");

	/** Logical false, the string "0". */
	public static final RexxValue FALSE = new RexxValue("0");

	private static final BigDecimal NOT_A_NUMBER = new BigDecimal(-1);

	private final String text;
	private BigDecimal number;

	private RexxValue(String text) {
		this.text = text;
	}

	private RexxValue(String text, BigDecimal number) {
		this.text = text;
		this.number = number;
	}

	/**
	 * @param text string value, {@code null} is treated as empty
	 * @return the value
	 */
	public static RexxValue of(String text) {
		if (text == null || text.isEmpty()) {
			return EMPTY;
		}
		return new RexxValue(text);
	}

	/**
	 * @param value integer value
	 * @return the value, formatted without exponent
	 */
	public static RexxValue of(long value) {
		return new RexxValue(Long.toString(value), BigDecimal.valueOf(value));
	}

	/**
	 * @param value logical value
	 * @return "1" or "0"
	 */
	public static RexxValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	/**
	 * Creates a value from an arithmetic result, formatted under the supplied
	 * numeric settings.
	 *
	 * @param value numeric value
	 * @param settings numeric settings in effect
	 * @return the value
	 */
	public static RexxValue of(BigDecimal value, NumericSettings settings) {
		String formatted = RexxNumbers.format(value, settings);
		return new RexxValue(formatted);
	}

	/**
	 * Converts a host object (e.g. a value returned by a module function) to a
	 * script value.
	 *
	 * @param value any object, {@code null} becomes the empty string
	 * @return the value
	 */
	public static RexxValue fromObject(Object value) {
		if (value == null) {
			return EMPTY;
		}
		if (value instanceof RexxValue) {
			return (RexxValue) value;
		}
		if (value instanceof Boolean) {
			return of(((Boolean) value).booleanValue());
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return of(((Number) value).longValue());
		}
		if (value instanceof BigDecimal) {
			return of(((BigDecimal) value).toPlainString());
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
				return of((long) d);
			}
			return of(BigDecimal.valueOf(d).stripTrailingZeros().toPlainString());
		}
		return of(value.toString());
	}

	/**
	 * @return the string form
	 */
	public String asString() {
		return text;
	}

	/**
	 * @return {@code true} when the string is a valid number
	 */
	public boolean isNumber() {
		return toNumber() != null;
	}

	/**
	 * @return the numeric view, or {@code null} when the string is not a number
	 */
	public BigDecimal toNumber() {
		BigDecimal cached = number;
		if (cached == null) {
			BigDecimal parsed = RexxNumbers.parse(text);
			cached = parsed == null ? NOT_A_NUMBER : parsed;
			number = cached;
		}
		return cached == NOT_A_NUMBER ? null : cached;
	}

	/**
	 * Returns the numeric view for an arithmetic context.
	 *
	 * @return the number
	 * @throws RexxCondition SYNTAX 41 when the string is not a number
	 */
	public BigDecimal requireNumber() {
		BigDecimal value = toNumber();
		if (value == null) {
			throw RexxCondition.syntax(RexxCondition.BAD_ARITHMETIC, "Bad arithmetic conversion: \"" + text + "\" is not a number");
		}
		return value;
	}

	/**
	 * @param settings numeric settings in effect
	 * @return the value as an integer
	 * @throws RexxCondition SYNTAX 26 when the value is not a whole number
	 */
	public int requireWholeNumber(NumericSettings settings) {
		BigDecimal value = toNumber();
		if (value == null) {
			throw RexxCondition.syntax(RexxCondition.INVALID_WHOLE_NUMBER, "Whole number expected, got \"" + text + "\"");
		}
		return RexxNumbers.toWholeNumber(value, settings);
	}

	/**
	 * @return the logical value
	 * @throws RexxCondition SYNTAX 34 when the value is neither 0 nor 1
	 */
	public boolean requireLogical() {
		String trimmed = text.trim();
		if ("1".equals(trimmed)) {
			return true;
		}
		if ("0".equals(trimmed)) {
			return false;
		}
		throw RexxCondition.syntax(RexxCondition.LOGICAL_VALUE, "Logical value must be 0 or 1, got \"" + text + "\"");
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof RexxValue)) {
			return false;
		}
		return text.equals(((RexxValue) other).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
