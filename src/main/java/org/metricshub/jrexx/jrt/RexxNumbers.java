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
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Numeric rules of the language: recognizing numbers in strings, arithmetic
 * under the current <code>NUMERIC DIGITS</code>, fuzzy comparison and the
 * canonical string form of numeric results.
 */
public final class RexxNumbers {

	private RexxNumbers() {}

	/**
	 * Parses a string as a number. Leading and trailing blanks are allowed, as
	 * are blanks between a sign and the digits.
	 *
	 * @param text candidate string
	 * @return the exact value, or {@code null} when the string is not a number
	 */
	public static BigDecimal parse(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && isBlank(text.charAt(start))) {
			start++;
		}
		while (end > start && isBlank(text.charAt(end - 1))) {
			end--;
		}
		if (start == end) {
			return null;
		}
		StringBuilder normalized = new StringBuilder(end - start);
		int i = start;
		char c = text.charAt(i);
		if (c == '+' || c == '-') {
			if (c == '-') {
				normalized.append('-');
			}
			i++;
			while (i < end && isBlank(text.charAt(i))) {
				i++;
			}
		}
		int digits = 0;
		while (i < end && isDigit(text.charAt(i))) {
			normalized.append(text.charAt(i++));
			digits++;
		}
		if (i < end && text.charAt(i) == '.') {
			normalized.append('.');
			i++;
			while (i < end && isDigit(text.charAt(i))) {
				normalized.append(text.charAt(i++));
				digits++;
			}
		}
		if (digits == 0) {
			return null;
		}
		if (i < end && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
			normalized.append('E');
			i++;
			if (i < end && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
				normalized.append(text.charAt(i++));
			}
			int exponentDigits = 0;
			while (i < end && isDigit(text.charAt(i))) {
				normalized.append(text.charAt(i++));
				exponentDigits++;
			}
			if (exponentDigits == 0) {
				return null;
			}
		}
		if (i != end) {
			return null;
		}
		try {
			return new BigDecimal(normalized.toString());
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static boolean isBlank(char c) {
		return c == ' ' || c == '\t';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * Formats a numeric result. The value is rounded to the current digits;
	 * exponential notation is used when the integer part needs more digits than
	 * that, or when the number is too small to show in plain form.
	 *
	 * @param value value to format
	 * @param settings numeric settings in effect
	 * @return the canonical string form
	 */
	public static String format(BigDecimal value, NumericSettings settings) {
		int digits = settings.getDigits();
		BigDecimal rounded = value.round(settings.mathContext());
		if (rounded.signum() == 0) {
			return "0";
		}
		int adjusted = rounded.precision() - rounded.scale() - 1;
		if (adjusted >= digits || rounded.scale() > 2 * digits) {
			return exponential(rounded, adjusted, settings.getForm());
		}
		if (rounded.scale() < 0) {
			rounded = rounded.setScale(0);
		}
		return rounded.toPlainString();
	}

	private static String exponential(BigDecimal value, int adjusted, NumericSettings.Form form) {
		int exponent = adjusted;
		if (form == NumericSettings.Form.ENGINEERING) {
			exponent = adjusted - Math.floorMod(adjusted, 3);
		}
		BigDecimal mantissa = value.scaleByPowerOfTen(-exponent).stripTrailingZeros();
		StringBuilder builder = new StringBuilder(mantissa.toPlainString());
		if (exponent != 0) {
			builder.append('E').append(exponent > 0 ? '+' : '-').append(Math.abs(exponent));
		}
		return builder.toString();
	}

	/**
	 * @param left left operand
	 * @param right right operand
	 * @param settings numeric settings in effect
	 * @return the rounded sum
	 */
	public static BigDecimal add(BigDecimal left, BigDecimal right, NumericSettings settings) {
		return left.add(right, settings.mathContext());
	}

	/**
	 * @param left left operand
	 * @param right right operand
	 * @param settings numeric settings in effect
	 * @return the rounded difference
	 */
	public static BigDecimal subtract(BigDecimal left, BigDecimal right, NumericSettings settings) {
		return left.subtract(right, settings.mathContext());
	}

	/**
	 * @param left left operand
	 * @param right right operand
	 * @param settings numeric settings in effect
	 * @return the rounded product
	 */
	public static BigDecimal multiply(BigDecimal left, BigDecimal right, NumericSettings settings) {
		return left.multiply(right, settings.mathContext());
	}

	/**
	 * Divides, dropping insignificant trailing zeros from the quotient.
	 *
	 * @param left dividend
	 * @param right divisor
	 * @param settings numeric settings in effect
	 * @return the rounded quotient
	 */
	public static BigDecimal divide(BigDecimal left, BigDecimal right, NumericSettings settings) {
		checkDivisor(right);
		BigDecimal quotient = left.divide(right, settings.mathContext()).stripTrailingZeros();
		if (quotient.scale() < 0) {
			quotient = quotient.setScale(0);
		}
		return quotient;
	}

	/**
	 * Integer division (<code>%</code>): the integer part of the quotient.
	 *
	 * @param left dividend
	 * @param right divisor
	 * @param settings numeric settings in effect
	 * @return the truncated quotient
	 */
	public static BigDecimal integerDivide(BigDecimal left, BigDecimal right, NumericSettings settings) {
		checkDivisor(right);
		BigDecimal quotient = left.divideToIntegralValue(right);
		if (quotient.precision() - quotient.scale() > settings.getDigits()) {
			throw RexxCondition.syntax(RexxCondition.INVALID_WHOLE_NUMBER, "Integer division result exceeds NUMERIC DIGITS");
		}
		return quotient.setScale(0, RoundingMode.DOWN);
	}

	/**
	 * Remainder (<code>//</code>), carrying the sign of the dividend.
	 *
	 * @param left dividend
	 * @param right divisor
	 * @param settings numeric settings in effect
	 * @return the remainder
	 */
	public static BigDecimal remainder(BigDecimal left, BigDecimal right, NumericSettings settings) {
		checkDivisor(right);
		return left.remainder(right, settings.mathContext());
	}

	/**
	 * Raises to a whole-number power.
	 *
	 * @param base base
	 * @param exponent exponent, must be a whole number
	 * @param settings numeric settings in effect
	 * @return the rounded power
	 */
	public static BigDecimal power(BigDecimal base, BigDecimal exponent, NumericSettings settings) {
		int n = toWholeNumber(exponent, settings);
		try {
			return base.pow(n, settings.mathContext());
		} catch (ArithmeticException e) {
			throw new RexxCondition(ConditionType.SYNTAX, RexxCondition.ARITHMETIC_OVERFLOW, e.getMessage(), e);
		}
	}

	/**
	 * Converts to an <code>int</code>, requiring a whole number.
	 *
	 * @param value numeric value
	 * @param settings numeric settings in effect
	 * @return the integer
	 */
	public static int toWholeNumber(BigDecimal value, NumericSettings settings) {
		BigDecimal rounded = value.round(settings.mathContext()).stripTrailingZeros();
		try {
			return rounded.intValueExact();
		} catch (ArithmeticException e) {
			throw RexxCondition.syntax(RexxCondition.INVALID_WHOLE_NUMBER, "Whole number expected, got " + value.toPlainString());
		}
	}

	/**
	 * Compares two numbers, ignoring differences beyond
	 * <code>DIGITS - FUZZ</code> significant digits.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @param settings numeric settings in effect
	 * @return negative, zero or positive
	 */
	public static int compare(BigDecimal left, BigDecimal right, NumericSettings settings) {
		MathContext context = settings.comparisonContext();
		return left.round(context).compareTo(right.round(context));
	}

	private static void checkDivisor(BigDecimal divisor) {
		if (divisor.signum() == 0) {
			throw RexxCondition.syntax(RexxCondition.ARITHMETIC_OVERFLOW, "Division by zero");
		}
	}
}
