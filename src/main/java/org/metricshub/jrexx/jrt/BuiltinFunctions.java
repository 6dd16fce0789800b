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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Functions built into the interpreter. They resolve before any function
 * provided by a loaded module.
 */
public final class BuiltinFunctions {

	private static final Set<String> NAMES = Collections
			.unmodifiableSet(
					new TreeSet<String>(
							Arrays
									.asList(
											"ABS",
											"ADDRESS",
											"ARG",
											"COPIES",
											"CONDITION",
											"DATATYPE",
											"DIGITS",
											"FUZZ",
											"LEFT",
											"LENGTH",
											"LOWER",
											"MAX",
											"MIN",
											"POS",
											"QUEUED",
											"REVERSE",
											"RIGHT",
											"SIGN",
											"SPACE",
											"STRIP",
											"SUBSTR",
											"SYMBOL",
											"TRUNC",
											"UPPER",
											"VALUE",
											"WORD",
											"WORDPOS",
											"WORDS")));

	private static final Pattern SYMBOL = Pattern.compile("[A-Za-z_@#$?.][A-Za-z0-9_.@#$?]*|[0-9][A-Za-z0-9_.@#$?]*");

	private BuiltinFunctions() {}

	/**
	 * @param name upper-case function name
	 * @return {@code true} when the name is a built-in function
	 */
	public static boolean isBuiltin(String name) {
		return NAMES.contains(name);
	}

	/**
	 * @return names of all built-in functions, sorted
	 */
	public static Set<String> names() {
		return NAMES;
	}

	/**
	 * Calls a built-in function.
	 *
	 * @param name upper-case function name
	 * @param args evaluated arguments, {@code null} for omitted ones
	 * @param context state of the calling frame
	 * @return the function result
	 * @throws RexxCondition SYNTAX 40 when the arguments are invalid
	 */
	public static RexxValue call(String name, List<RexxValue> args, BuiltinContext context) {
		NumericSettings numeric = context.numeric();
		switch (name) {
		case "ABS":
			arity(name, args, 1, 1);
			return RexxValue.of(number(name, args, 0).abs(), numeric);
		case "ADDRESS":
			arity(name, args, 0, 0);
			return RexxValue.of(context.addressName());
		case "ARG":
			return arg(args, context);
		case "COPIES": {
			arity(name, args, 2, 2);
			String text = string(name, args, 0);
			int count = nonNegative(name, args, 1, numeric);
			StringBuilder builder = new StringBuilder(text.length() * count);
			for (int i = 0; i < count; i++) {
				builder.append(text);
			}
			return RexxValue.of(builder.toString());
		}
		case "CONDITION":
			return condition(args, context);
		case "DATATYPE":
			return datatype(args);
		case "DIGITS":
			arity(name, args, 0, 0);
			return RexxValue.of(numeric.getDigits());
		case "FUZZ":
			arity(name, args, 0, 0);
			return RexxValue.of(numeric.getFuzz());
		case "LEFT": {
			arity(name, args, 2, 3);
			String text = string(name, args, 0);
			int length = nonNegative(name, args, 1, numeric);
			char pad = pad(name, args, 2);
			return RexxValue.of(text.length() >= length ? text.substring(0, length) : padRight(text, length, pad));
		}
		case "LENGTH":
			arity(name, args, 1, 1);
			return RexxValue.of(string(name, args, 0).length());
		case "LOWER":
			arity(name, args, 1, 1);
			return RexxValue.of(string(name, args, 0).toLowerCase(Locale.ROOT));
		case "MAX":
		case "MIN":
			return extreme(name, args, numeric);
		case "POS": {
			arity(name, args, 2, 3);
			String needle = string(name, args, 0);
			String haystack = string(name, args, 1);
			int start = optionalPositive(name, args, 2, 1, numeric);
			if (needle.isEmpty() || start > haystack.length()) {
				return RexxValue.of(0);
			}
			return RexxValue.of(haystack.indexOf(needle, start - 1) + 1);
		}
		case "QUEUED":
			arity(name, args, 0, 0);
			return RexxValue.of(context.queued());
		case "REVERSE":
			arity(name, args, 1, 1);
			return RexxValue.of(new StringBuilder(string(name, args, 0)).reverse().toString());
		case "RIGHT": {
			arity(name, args, 2, 3);
			String text = string(name, args, 0);
			int length = nonNegative(name, args, 1, numeric);
			char pad = pad(name, args, 2);
			if (text.length() >= length) {
				return RexxValue.of(text.substring(text.length() - length));
			}
			StringBuilder builder = new StringBuilder(length);
			for (int i = text.length(); i < length; i++) {
				builder.append(pad);
			}
			return RexxValue.of(builder.append(text).toString());
		}
		case "SIGN":
			arity(name, args, 1, 1);
			return RexxValue.of(number(name, args, 0).round(numeric.mathContext()).signum());
		case "SPACE":
			return space(args, numeric);
		case "STRIP":
			return strip(args);
		case "SUBSTR":
			return substr(args, numeric);
		case "SYMBOL": {
			arity(name, args, 1, 1);
			String symbol = string(name, args, 0);
			if (!SYMBOL.matcher(symbol).matches()) {
				return RexxValue.of("BAD");
			}
			return RexxValue.of(context.variable(symbol) != null ? "VAR" : "LIT");
		}
		case "TRUNC": {
			arity(name, args, 1, 2);
			BigDecimal value = number(name, args, 0).round(numeric.mathContext());
			int decimals = args.size() > 1 && args.get(1) != null ? nonNegative(name, args, 1, numeric) : 0;
			return RexxValue.of(value.setScale(decimals, RoundingMode.DOWN).toPlainString());
		}
		case "UPPER":
			arity(name, args, 1, 1);
			return RexxValue.of(string(name, args, 0).toUpperCase(Locale.ROOT));
		case "VALUE": {
			arity(name, args, 1, 1);
			String symbol = string(name, args, 0);
			RexxValue value = context.variable(symbol);
			return value != null ? value : RexxValue.of(symbol.toUpperCase(Locale.ROOT));
		}
		case "WORD": {
			arity(name, args, 2, 2);
			List<String> words = words(string(name, args, 0));
			int index = optionalPositive(name, args, 1, 1, numeric);
			return RexxValue.of(index <= words.size() ? words.get(index - 1) : "");
		}
		case "WORDPOS":
			return wordpos(args, numeric);
		case "WORDS":
			arity(name, args, 1, 1);
			return RexxValue.of(words(string(name, args, 0)).size());
		default:
			throw RexxCondition.syntax(RexxCondition.ROUTINE_NOT_FOUND, "Unknown built-in function " + name);
		}
	}

	private static RexxValue arg(List<RexxValue> args, BuiltinContext context) {
		arity("ARG", args, 0, 2);
		List<RexxValue> frameArgs = context.arguments();
		if (args.isEmpty() || args.get(0) == null) {
			return RexxValue.of(frameArgs.size());
		}
		int index = optionalPositive("ARG", args, 0, 1, context.numeric());
		RexxValue value = index <= frameArgs.size() ? frameArgs.get(index - 1) : null;
		if (args.size() < 2 || args.get(1) == null) {
			return value == null ? RexxValue.EMPTY : value;
		}
		String option = option("ARG", args, 1);
		if (option.equals("E")) {
			return RexxValue.of(value != null);
		}
		if (option.equals("O")) {
			return RexxValue.of(value == null);
		}
		throw invalid("ARG", "option must be E or O, not " + option);
	}

	private static RexxValue condition(List<RexxValue> args, BuiltinContext context) {
		arity("CONDITION", args, 0, 1);
		String option = args.isEmpty() || args.get(0) == null ? "I" : option("CONDITION", args, 0);
		ConditionInfo info = context.condition();
		if (info == null) {
			return RexxValue.EMPTY;
		}
		switch (option) {
		case "C":
			return RexxValue.of(info.getType().name());
		case "D":
			return RexxValue.of(info.getDescription());
		case "I":
			return RexxValue.of("SIGNAL");
		case "S":
			return RexxValue.of("OFF");
		case "M":
			return RexxValue.of(info.getMessage());
		default:
			throw invalid("CONDITION", "option must be C, D, I, M or S, not " + option);
		}
	}

	private static RexxValue datatype(List<RexxValue> args) {
		arity("DATATYPE", args, 1, 2);
		RexxValue value = args.get(0);
		if (value == null) {
			throw invalid("DATATYPE", "argument 1 is required");
		}
		String text = value.asString();
		if (args.size() < 2 || args.get(1) == null) {
			return RexxValue.of(value.isNumber() ? "NUM" : "CHAR");
		}
		String type = option("DATATYPE", args, 1);
		if (text.isEmpty()) {
			return RexxValue.FALSE;
		}
		switch (type) {
		case "A":
			return RexxValue.of(text.matches("[A-Za-z0-9]+"));
		case "B":
			return RexxValue.of(text.matches("[01 ]+"));
		case "L":
			return RexxValue.of(text.matches("[a-z]+"));
		case "M":
			return RexxValue.of(text.matches("[A-Za-z]+"));
		case "N":
			return RexxValue.of(value.isNumber());
		case "S":
			return RexxValue.of(SYMBOL.matcher(text).matches());
		case "U":
			return RexxValue.of(text.matches("[A-Z]+"));
		case "W": {
			BigDecimal number = value.toNumber();
			return RexxValue.of(number != null && number.stripTrailingZeros().scale() <= 0);
		}
		case "X":
			return RexxValue.of(text.matches("[0-9A-Fa-f ]+"));
		default:
			throw invalid("DATATYPE", "unknown type " + type);
		}
	}

	private static RexxValue extreme(String name, List<RexxValue> args, NumericSettings numeric) {
		if (args.isEmpty()) {
			throw invalid(name, "at least one argument is required");
		}
		BigDecimal best = null;
		for (int i = 0; i < args.size(); i++) {
			BigDecimal candidate = number(name, args, i);
			if (best == null) {
				best = candidate;
			} else {
				int comparison = RexxNumbers.compare(candidate, best, numeric);
				if (name.equals("MAX") ? comparison > 0 : comparison < 0) {
					best = candidate;
				}
			}
		}
		return RexxValue.of(best, numeric);
	}

	private static RexxValue space(List<RexxValue> args, NumericSettings numeric) {
		arity("SPACE", args, 1, 3);
		List<String> words = words(string("SPACE", args, 0));
		int count = args.size() > 1 && args.get(1) != null ? nonNegative("SPACE", args, 1, numeric) : 1;
		char pad = pad("SPACE", args, 2);
		StringBuilder separator = new StringBuilder();
		for (int i = 0; i < count; i++) {
			separator.append(pad);
		}
		return RexxValue.of(String.join(separator, words));
	}

	private static RexxValue strip(List<RexxValue> args) {
		arity("STRIP", args, 1, 3);
		String text = string("STRIP", args, 0);
		String option = args.size() > 1 && args.get(1) != null ? option("STRIP", args, 1) : "B";
		char strip = args.size() > 2 && args.get(2) != null ? pad("STRIP", args, 2) : ' ';
		if (!option.equals("B") && !option.equals("L") && !option.equals("T")) {
			throw invalid("STRIP", "option must be B, L or T, not " + option);
		}
		int start = 0;
		int end = text.length();
		if (!option.equals("T")) {
			while (start < end && text.charAt(start) == strip) {
				start++;
			}
		}
		if (!option.equals("L")) {
			while (end > start && text.charAt(end - 1) == strip) {
				end--;
			}
		}
		return RexxValue.of(text.substring(start, end));
	}

	private static RexxValue substr(List<RexxValue> args, NumericSettings numeric) {
		arity("SUBSTR", args, 2, 4);
		String text = string("SUBSTR", args, 0);
		int start = optionalPositive("SUBSTR", args, 1, 1, numeric);
		char pad = pad("SUBSTR", args, 3);
		int available = Math.max(0, text.length() - (start - 1));
		int length = args.size() > 2 && args.get(2) != null ? nonNegative("SUBSTR", args, 2, numeric) : available;
		StringBuilder builder = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			int index = start - 1 + i;
			builder.append(index < text.length() ? text.charAt(index) : pad);
		}
		return RexxValue.of(builder.toString());
	}

	private static RexxValue wordpos(List<RexxValue> args, NumericSettings numeric) {
		arity("WORDPOS", args, 2, 3);
		List<String> phrase = words(string("WORDPOS", args, 0));
		List<String> words = words(string("WORDPOS", args, 1));
		int start = optionalPositive("WORDPOS", args, 2, 1, numeric);
		if (phrase.isEmpty()) {
			return RexxValue.of(0);
		}
		for (int i = start - 1; i + phrase.size() <= words.size(); i++) {
			if (words.subList(i, i + phrase.size()).equals(phrase)) {
				return RexxValue.of(i + 1);
			}
		}
		return RexxValue.of(0);
	}

	/**
	 * Splits a string into blank-delimited words.
	 *
	 * @param text string to split
	 * @return the words, possibly empty
	 */
	public static List<String> words(String text) {
		List<String> result = new ArrayList<String>();
		for (String word : text.trim().split("[ \t]+")) {
			if (!word.isEmpty()) {
				result.add(word);
			}
		}
		return result;
	}

	private static String padRight(String text, int length, char pad) {
		StringBuilder builder = new StringBuilder(length).append(text);
		while (builder.length() < length) {
			builder.append(pad);
		}
		return builder.toString();
	}

	private static void arity(String name, List<RexxValue> args, int min, int max) {
		if (args.size() > max) {
			throw invalid(name, "expects at most " + max + " argument(s), not " + args.size());
		}
		for (int i = 0; i < min; i++) {
			if (i >= args.size() || args.get(i) == null) {
				throw invalid(name, "argument " + (i + 1) + " is required");
			}
		}
	}

	private static String string(String name, List<RexxValue> args, int index) {
		RexxValue value = index < args.size() ? args.get(index) : null;
		if (value == null) {
			throw invalid(name, "argument " + (index + 1) + " is required");
		}
		return value.asString();
	}

	private static BigDecimal number(String name, List<RexxValue> args, int index) {
		BigDecimal value = RexxValue.of(string(name, args, index)).toNumber();
		if (value == null) {
			throw invalid(name, "argument " + (index + 1) + " must be a number, not \"" + args.get(index) + "\"");
		}
		return value;
	}

	private static int nonNegative(String name, List<RexxValue> args, int index, NumericSettings numeric) {
		int value = whole(name, args, index, numeric);
		if (value < 0) {
			throw invalid(name, "argument " + (index + 1) + " must not be negative");
		}
		return value;
	}

	private static int optionalPositive(String name, List<RexxValue> args, int index, int defaultValue, NumericSettings numeric) {
		if (index >= args.size() || args.get(index) == null) {
			return defaultValue;
		}
		int value = whole(name, args, index, numeric);
		if (value < 1) {
			throw invalid(name, "argument " + (index + 1) + " must be positive");
		}
		return value;
	}

	private static int whole(String name, List<RexxValue> args, int index, NumericSettings numeric) {
		BigDecimal value = number(name, args, index);
		BigDecimal stripped = value.round(numeric.mathContext()).stripTrailingZeros();
		if (stripped.scale() > 0) {
			throw invalid(name, "argument " + (index + 1) + " must be a whole number");
		}
		try {
			return stripped.intValueExact();
		} catch (ArithmeticException e) {
			throw invalid(name, "argument " + (index + 1) + " is too large");
		}
	}

	private static char pad(String name, List<RexxValue> args, int index) {
		if (index >= args.size() || args.get(index) == null) {
			return ' ';
		}
		String text = args.get(index).asString();
		if (text.length() != 1) {
			throw invalid(name, "argument " + (index + 1) + " must be a single character");
		}
		return text.charAt(0);
	}

	private static String option(String name, List<RexxValue> args, int index) {
		String text = string(name, args, index).trim();
		if (text.isEmpty()) {
			throw invalid(name, "argument " + (index + 1) + " must not be empty");
		}
		return text.substring(0, 1).toUpperCase(Locale.ROOT);
	}

	private static RexxCondition invalid(String name, String message) {
		return RexxCondition.syntax(RexxCondition.INCORRECT_CALL, "Incorrect call to " + name + ": " + message);
	}
}
