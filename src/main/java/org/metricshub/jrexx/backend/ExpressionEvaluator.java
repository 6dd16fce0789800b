package org.metricshub.jrexx.backend;

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
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import org.metricshub.jrexx.frontend.ast.Expression;
import org.metricshub.jrexx.jrt.BuiltinContext;
import org.metricshub.jrexx.jrt.ConditionInfo;
import org.metricshub.jrexx.jrt.InterpolationPattern;
import org.metricshub.jrexx.jrt.NumericSettings;
import org.metricshub.jrexx.jrt.RexxNumbers;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.jrt.VariablePool;

/**
 * Evaluates expressions against a call frame.
 * <p>
 * Everything is a string: arithmetic operators convert their operands with
 * the numeric settings of the frame, comparisons are numeric when both sides
 * are numbers and blank-padded string comparisons otherwise. Function calls
 * are resolved by the {@link ExecutionEngine}, which may suspend the
 * evaluation.
 */
final class ExpressionEvaluator {

	private final ExecutionEngine engine;
	private final InterpolationPattern interpolation;

	ExpressionEvaluator(ExecutionEngine engine, InterpolationPattern interpolation) {
		this.engine = engine;
		this.interpolation = interpolation;
	}

	/**
	 * @param expression expression to evaluate
	 * @param frame frame providing variables and numeric settings
	 * @return the value
	 */
	RexxValue evaluate(Expression expression, CallFrame frame) {
		if (expression instanceof Expression.Literal) {
			return RexxValue.of(interpolate(((Expression.Literal) expression).text, frame));
		}
		if (expression instanceof Expression.NumberLiteral) {
			return RexxValue.of(((Expression.NumberLiteral) expression).text);
		}
		if (expression instanceof Expression.Symbol) {
			return symbol((Expression.Symbol) expression, frame);
		}
		if (expression instanceof Expression.FunctionCall) {
			Expression.FunctionCall call = (Expression.FunctionCall) expression;
			List<RexxValue> args = evaluateArguments(call.arguments, frame);
			return engine.callFunction(frame, call.name, args, call.getLine());
		}
		if (expression instanceof Expression.Unary) {
			return unary((Expression.Unary) expression, frame);
		}
		if (expression instanceof Expression.Binary) {
			return binary((Expression.Binary) expression, frame);
		}
		throw new IllegalStateException("Unknown expression " + expression.getClass().getSimpleName());
	}

	/**
	 * @return the value, or {@code null} when the expression is absent
	 */
	RexxValue evaluateOptional(Expression expression, CallFrame frame) {
		return expression == null ? null : evaluate(expression, frame);
	}

	/**
	 * Evaluates arguments left to right; omitted arguments stay {@code null}.
	 */
	List<RexxValue> evaluateArguments(List<Expression> arguments, CallFrame frame) {
		List<RexxValue> values = new ArrayList<RexxValue>(arguments.size());
		for (Expression argument : arguments) {
			values.add(evaluateOptional(argument, frame));
		}
		return values;
	}

	/**
	 * Replaces the interpolation markers of a literal with the values of the
	 * variables they name. Markers naming unset variables stay as written.
	 */
	String interpolate(String text, CallFrame frame) {
		final VariablePool pool = frame.getPool();
		return interpolation.interpolate(text, new Function<String, String>() {
			@Override
			public String apply(String name) {
				RexxValue value = lookup(name, pool);
				return value == null ? null : value.asString();
			}
		});
	}

	/**
	 * Reads a variable by the name a script would write, deriving compound tails.
	 *
	 * @param name symbol in any case
	 * @param pool variables
	 * @return the value, or {@code null} when unset
	 */
	static RexxValue lookup(String name, VariablePool pool) {
		String upper = name.trim().toUpperCase(Locale.ROOT);
		if (upper.isEmpty()) {
			return null;
		}
		Expression.Symbol symbol = new Expression.Symbol(0, upper);
		switch (symbol.kind) {
		case SIMPLE:
			return pool.getSimple(upper);
		case STEM:
			return pool.get(upper);
		case COMPOUND:
			return pool.getCompound(symbol.stemName(), deriveTail(symbol.tail(), pool));
		default:
			return null;
		}
	}

	/**
	 * Substitutes each tail component that names a set simple variable.
	 *
	 * @param tail tail as written, upper-case
	 * @param pool variables
	 * @return the derived tail
	 */
	static String deriveTail(String tail, VariablePool pool) {
		StringBuilder derived = new StringBuilder();
		int start = 0;
		while (true) {
			int dot = tail.indexOf('.', start);
			String component = dot < 0 ? tail.substring(start) : tail.substring(start, dot);
			RexxValue value = null;
			if (!component.isEmpty() && !Character.isDigit(component.charAt(0))) {
				value = pool.getSimple(component);
			}
			derived.append(value == null ? component : value.asString());
			if (dot < 0) {
				return derived.toString();
			}
			derived.append('.');
			start = dot + 1;
		}
	}

	private RexxValue symbol(Expression.Symbol symbol, CallFrame frame) {
		VariablePool pool = frame.getPool();
		switch (symbol.kind) {
		case CONSTANT:
			return RexxValue.of(symbol.name);
		case SIMPLE: {
			RexxValue value = pool.getSimple(symbol.name);
			return value != null ? value : engine.novalue(symbol.name);
		}
		case STEM: {
			RexxValue value = pool.get(symbol.name);
			return value != null ? value : engine.novalue(symbol.name);
		}
		case COMPOUND: {
			String tail = deriveTail(symbol.tail(), pool);
			RexxValue value = pool.getCompound(symbol.stemName(), tail);
			return value != null ? value : engine.novalue(symbol.stemName() + tail);
		}
		default:
			throw new IllegalStateException("Unknown symbol kind " + symbol.kind);
		}
	}

	private RexxValue unary(Expression.Unary unary, CallFrame frame) {
		RexxValue operand = evaluate(unary.operand, frame);
		NumericSettings numeric = frame.getNumeric();
		switch (unary.operator) {
		case NOT:
			return RexxValue.of(!operand.requireLogical());
		case NEGATE:
			return RexxValue.of(RexxNumbers.subtract(BigDecimal.ZERO, operand.requireNumber(), numeric), numeric);
		case PLUS:
			return RexxValue.of(RexxNumbers.add(BigDecimal.ZERO, operand.requireNumber(), numeric), numeric);
		default:
			throw new IllegalStateException("Not a prefix operator: " + unary.operator);
		}
	}

	private RexxValue binary(Expression.Binary binary, CallFrame frame) {
		RexxValue left = evaluate(binary.left, frame);
		RexxValue right = evaluate(binary.right, frame);
		NumericSettings numeric = frame.getNumeric();
		switch (binary.operator) {
		case CONCAT:
		case ABUT:
			return RexxValue.of(left.asString() + right.asString());
		case BLANK_CONCAT:
			return RexxValue.of(left.asString() + " " + right.asString());
		case ADD:
			return RexxValue.of(RexxNumbers.add(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case SUBTRACT:
			return RexxValue.of(RexxNumbers.subtract(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case MULTIPLY:
			return RexxValue.of(RexxNumbers.multiply(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case DIVIDE:
			return RexxValue.of(RexxNumbers.divide(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case INTEGER_DIVIDE:
			return RexxValue.of(RexxNumbers.integerDivide(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case REMAINDER:
			return RexxValue.of(RexxNumbers.remainder(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case POWER:
			return RexxValue.of(RexxNumbers.power(left.requireNumber(), right.requireNumber(), numeric), numeric);
		case EQUAL:
			return RexxValue.of(compare(left, right, numeric) == 0);
		case NOT_EQUAL:
			return RexxValue.of(compare(left, right, numeric) != 0);
		case GREATER:
			return RexxValue.of(compare(left, right, numeric) > 0);
		case LESS:
			return RexxValue.of(compare(left, right, numeric) < 0);
		case GREATER_OR_EQUAL:
			return RexxValue.of(compare(left, right, numeric) >= 0);
		case LESS_OR_EQUAL:
			return RexxValue.of(compare(left, right, numeric) <= 0);
		case STRICT_EQUAL:
			return RexxValue.of(left.asString().equals(right.asString()));
		case STRICT_NOT_EQUAL:
			return RexxValue.of(!left.asString().equals(right.asString()));
		case AND:
			return RexxValue.of(left.requireLogical() & right.requireLogical());
		case OR:
			return RexxValue.of(left.requireLogical() | right.requireLogical());
		case XOR:
			return RexxValue.of(left.requireLogical() ^ right.requireLogical());
		default:
			throw new IllegalStateException("Not a binary operator: " + binary.operator);
		}
	}

	/**
	 * Non-strict comparison: numeric when both values are numbers, otherwise
	 * the strings without leading and trailing blanks, the shorter one padded
	 * with blanks.
	 *
	 * @return negative, zero or positive
	 */
	static int compare(RexxValue left, RexxValue right, NumericSettings numeric) {
		BigDecimal leftNumber = left.toNumber();
		BigDecimal rightNumber = right.toNumber();
		if (leftNumber != null && rightNumber != null) {
			return RexxNumbers.compare(leftNumber, rightNumber, numeric);
		}
		String a = stripBlanks(left.asString());
		String b = stripBlanks(right.asString());
		int length = Math.max(a.length(), b.length());
		for (int i = 0; i < length; i++) {
			char ca = i < a.length() ? a.charAt(i) : ' ';
			char cb = i < b.length() ? b.charAt(i) : ' ';
			if (ca != cb) {
				return ca < cb ? -1 : 1;
			}
		}
		return 0;
	}

	private static String stripBlanks(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && text.charAt(start) == ' ') {
			start++;
		}
		while (end > start && text.charAt(end - 1) == ' ') {
			end--;
		}
		return text.substring(start, end);
	}

	/**
	 * State of a frame as seen by the built-in functions.
	 */
	static BuiltinContext context(final CallFrame frame, final Deque<String> dataStack) {
		return new BuiltinContext() {
			@Override
			public NumericSettings numeric() {
				return frame.getNumeric();
			}

			@Override
			public List<RexxValue> arguments() {
				return frame.getArguments();
			}

			@Override
			public String addressName() {
				return frame.getAddressName() == null ? "" : frame.getAddressName();
			}

			@Override
			public ConditionInfo condition() {
				return frame.getLastCondition();
			}

			@Override
			public RexxValue variable(String symbol) {
				return lookup(symbol, frame.getPool());
			}

			@Override
			public int queued() {
				return dataStack.size();
			}
		};
	}
}
