package org.metricshub.jrexx.frontend.ast;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jrexx.frontend.QuoteKind;

/**
 * Expression nodes.
 */
public abstract class Expression extends AstNode {

	protected Expression(int line) {
		super(line);
	}

	/**
	 * @return the expression in source form, fully parenthesized
	 */
	public abstract String toSource();

	@Override
	public void dump(PrintStream out, int indent) {
		printIndent(out, indent);
		out.println(toSource());
	}

	/** Binary and prefix operators, from the lowest to the highest precedence group. */
	public enum Operator {
		OR("|"),
		XOR("&&"),
		AND("&"),
		EQUAL("="),
		NOT_EQUAL("\\="),
		GREATER(">"),
		LESS("<"),
		GREATER_OR_EQUAL(">="),
		LESS_OR_EQUAL("<="),
		STRICT_EQUAL("=="),
		STRICT_NOT_EQUAL("\\=="),
		CONCAT("||"),
		ABUT(""),
		BLANK_CONCAT(" "),
		ADD("+"),
		SUBTRACT("-"),
		MULTIPLY("*"),
		DIVIDE("/"),
		INTEGER_DIVIDE("%"),
		REMAINDER("//"),
		POWER("**"),
		NOT("\\"),
		NEGATE("-"),
		PLUS("+");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	/**
	 * A string literal in any quote form. Interpolation markers in its text are
	 * resolved each time it is evaluated.
	 */
	public static final class Literal extends Expression {
		public final String text;
		public final QuoteKind quoteKind;

		public Literal(int line, String text, QuoteKind quoteKind) {
			super(line);
			this.text = text;
			this.quoteKind = quoteKind;
		}

		@Override
		public String toSource() {
			if (quoteKind == QuoteKind.HEREDOC) {
				String label = heredocLabel(text);
				StringBuilder builder = new StringBuilder("<<").append(label).append('\n');
				if (!text.isEmpty()) {
					builder.append(text).append('\n');
				}
				return builder.append(label).append('\n').toString();
			}
			String quote = quoteKind.getOpening();
			return quote + text.replace(quote, quote + quote) + quote;
		}

		/**
		 * Picks a terminating label that no line of the body matches.
		 */
		private static String heredocLabel(String body) {
			Set<String> lines = new HashSet<String>();
			for (String line : body.split("\n", -1)) {
				lines.add(line.trim());
			}
			String label = "EOT";
			for (int i = 1; lines.contains(label); i++) {
				label = "EOT" + i;
			}
			return label;
		}
	}

	/**
	 * A number written in the source.
	 */
	public static final class NumberLiteral extends Expression {
		public final String text;

		public NumberLiteral(int line, String text) {
			super(line);
			this.text = text;
		}

		@Override
		public String toSource() {
			return text;
		}
	}

	/**
	 * A symbol: simple variable, compound variable, stem or constant symbol.
	 */
	public static final class Symbol extends Expression {

		/** Kinds of symbols. */
		public enum Kind {
			SIMPLE,
			COMPOUND,
			STEM,
			CONSTANT
		}

		public final String name;
		public final Kind kind;

		/**
		 * @param line source line
		 * @param name upper-case symbol name
		 */
		public Symbol(int line, String name) {
			super(line);
			this.name = name;
			this.kind = classify(name);
		}

		private static Kind classify(String name) {
			char first = name.charAt(0);
			if ((first >= '0' && first <= '9') || first == '.') {
				return Kind.CONSTANT;
			}
			int dot = name.indexOf('.');
			if (dot < 0) {
				return Kind.SIMPLE;
			}
			return dot == name.length() - 1 ? Kind.STEM : Kind.COMPOUND;
		}

		/**
		 * @return the stem part including its dot, for compound symbols and stems
		 */
		public String stemName() {
			return name.substring(0, name.indexOf('.') + 1);
		}

		/**
		 * @return the tail as written, for compound symbols
		 */
		public String tail() {
			return name.substring(name.indexOf('.') + 1);
		}

		@Override
		public String toSource() {
			return name;
		}
	}

	/**
	 * A function call <code>name(arg, ...)</code>. Omitted arguments are {@code null}.
	 */
	public static final class FunctionCall extends Expression {
		public final String name;
		public final List<Expression> arguments;

		public FunctionCall(int line, String name, List<Expression> arguments) {
			super(line);
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
		}

		@Override
		public String toSource() {
			StringBuilder builder = new StringBuilder(name).append('(');
			for (int i = 0; i < arguments.size(); i++) {
				if (i > 0) {
					builder.append(", ");
				}
				if (arguments.get(i) != null) {
					builder.append(arguments.get(i).toSource());
				}
			}
			return builder.append(')').toString();
		}
	}

	/**
	 * A binary operation, including the three forms of concatenation.
	 */
	public static final class Binary extends Expression {
		public final Operator operator;
		public final Expression left;
		public final Expression right;

		public Binary(int line, Operator operator, Expression left, Expression right) {
			super(line);
			this.operator = operator;
			this.left = left;
			this.right = right;
		}

		@Override
		public String toSource() {
			String separator;
			if (operator == Operator.ABUT) {
				separator = "";
			} else if (operator == Operator.BLANK_CONCAT) {
				separator = " ";
			} else {
				separator = " " + operator.getSymbol() + " ";
			}
			return "(" + left.toSource() + separator + right.toSource() + ")";
		}
	}

	/**
	 * A prefix operation.
	 */
	public static final class Unary extends Expression {
		public final Operator operator;
		public final Expression operand;

		public Unary(int line, Operator operator, Expression operand) {
			super(line);
			this.operator = operator;
			this.operand = operand;
		}

		@Override
		public String toSource() {
			return operator.getSymbol() + operand.toSource();
		}
	}
}
