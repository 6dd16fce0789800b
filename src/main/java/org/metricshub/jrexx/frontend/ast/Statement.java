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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.frontend.QuoteKind;
import org.metricshub.jrexx.jrt.ConditionType;
import org.metricshub.jrexx.jrt.ParseTemplate;

/**
 * Statement nodes. The {@link Kind} of a statement tells the execution engine
 * which subclass it is.
 */
public abstract class Statement extends AstNode {

	/** Statement variants. */
	public enum Kind {
		ASSIGNMENT,
		SAY,
		NOP,
		DROP,
		IF,
		DO,
		LEAVE,
		ITERATE,
		SELECT,
		CALL,
		LABEL,
		PROCEDURE,
		RETURN,
		EXIT,
		SIGNAL,
		PARSE,
		ADDRESS,
		BARE_COMMAND,
		OPERATION,
		FUNCTION_CALL,
		REQUIRE,
		NUMERIC,
		INTERPRET,
		PUSH,
		QUEUE,
		TRACE,
		NO_INTERPRET
	}

	protected Statement(int line) {
		super(line);
	}

	/**
	 * @return the variant of this statement
	 */
	public abstract Kind getKind();

	/**
	 * @return one-line description used by {@link #dump(PrintStream, int)}
	 */
	protected abstract String describe();

	@Override
	public void dump(PrintStream out, int indent) {
		printIndent(out, indent);
		out.println(describe() + " [line " + getLine() + "]");
	}

	protected static String source(Expression expression) {
		return expression == null ? "" : expression.toSource();
	}

	protected static List<Statement> immutable(List<Statement> statements) {
		return statements == null ? null : Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	protected static void dumpBlock(PrintStream out, int indent, String header, List<Statement> block) {
		printIndent(out, indent);
		out.println(header);
		for (Statement statement : block) {
			statement.dump(out, indent + 1);
		}
	}

	/** <code>[LET] target = value</code> */
	public static final class Assignment extends Statement {
		public final Expression.Symbol target;
		public final Expression value;

		public Assignment(int line, Expression.Symbol target, Expression value) {
			super(line);
			this.target = target;
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.ASSIGNMENT;
		}

		@Override
		protected String describe() {
			return "LET " + target.name + " = " + source(value);
		}
	}

	/** <code>SAY [expression]</code> */
	public static final class Say extends Statement {
		public final Expression value;

		public Say(int line, Expression value) {
			super(line);
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.SAY;
		}

		@Override
		protected String describe() {
			return "SAY " + source(value);
		}
	}

	/** <code>NOP</code> */
	public static final class Nop extends Statement {
		public Nop(int line) {
			super(line);
		}

		@Override
		public Kind getKind() {
			return Kind.NOP;
		}

		@Override
		protected String describe() {
			return "NOP";
		}
	}

	/** <code>DROP name...</code> */
	public static final class Drop extends Statement {
		public final List<Expression.Symbol> names;

		public Drop(int line, List<Expression.Symbol> names) {
			super(line);
			this.names = Collections.unmodifiableList(new ArrayList<Expression.Symbol>(names));
		}

		@Override
		public Kind getKind() {
			return Kind.DROP;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("DROP");
			for (Expression.Symbol name : names) {
				builder.append(' ').append(name.name);
			}
			return builder.toString();
		}
	}

	/** <code>IF condition THEN ... [ELSE ...]</code> in all its forms. */
	public static final class If extends Statement {
		public final Expression condition;
		public final List<Statement> thenBranch;
		public final List<Statement> elseBranch;

		public If(int line, Expression condition, List<Statement> thenBranch, List<Statement> elseBranch) {
			super(line);
			this.condition = condition;
			this.thenBranch = immutable(thenBranch);
			this.elseBranch = immutable(elseBranch);
		}

		@Override
		public Kind getKind() {
			return Kind.IF;
		}

		@Override
		protected String describe() {
			return "IF " + source(condition);
		}

		@Override
		public void dump(PrintStream out, int indent) {
			super.dump(out, indent);
			dumpBlock(out, indent, "THEN", thenBranch);
			if (elseBranch != null) {
				dumpBlock(out, indent, "ELSE", elseBranch);
			}
		}
	}

	/**
	 * <code>DO</code> group or loop. Which header fields are set depends on
	 * the form: controlled (<code>DO i = a TO b BY c FOR n</code>), collection
	 * (<code>DO k OVER stem.</code>), repetitive (<code>DO n</code>),
	 * <code>FOREVER</code>, or a plain group when nothing is set.
	 */
	public static final class Do extends Statement {
		public final Expression.Symbol control;
		public final Expression initial;
		public final Expression to;
		public final Expression by;
		public final Expression forCount;
		public final Expression over;
		public final Expression repeat;
		public final boolean forever;
		public final Expression whileCondition;
		public final Expression untilCondition;
		public final List<Statement> body;

		public Do(
				int line,
				Expression.Symbol control,
				Expression initial,
				Expression to,
				Expression by,
				Expression forCount,
				Expression over,
				Expression repeat,
				boolean forever,
				Expression whileCondition,
				Expression untilCondition,
				List<Statement> body) {
			super(line);
			this.control = control;
			this.initial = initial;
			this.to = to;
			this.by = by;
			this.forCount = forCount;
			this.over = over;
			this.repeat = repeat;
			this.forever = forever;
			this.whileCondition = whileCondition;
			this.untilCondition = untilCondition;
			this.body = immutable(body);
		}

		/**
		 * @return {@code true} for a plain <code>DO ... END</code> group that does not loop
		 */
		public boolean isSimpleGroup() {
			return control == null
					&& repeat == null
					&& !forever
					&& whileCondition == null
					&& untilCondition == null;
		}

		@Override
		public Kind getKind() {
			return Kind.DO;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("DO");
			if (control != null) {
				builder.append(' ').append(control.name);
				if (over != null) {
					builder.append(" OVER ").append(source(over));
				} else {
					builder.append(" = ").append(source(initial));
				}
			}
			if (to != null) {
				builder.append(" TO ").append(source(to));
			}
			if (by != null) {
				builder.append(" BY ").append(source(by));
			}
			if (forCount != null) {
				builder.append(" FOR ").append(source(forCount));
			}
			if (repeat != null) {
				builder.append(' ').append(source(repeat));
			}
			if (forever) {
				builder.append(" FOREVER");
			}
			if (whileCondition != null) {
				builder.append(" WHILE ").append(source(whileCondition));
			}
			if (untilCondition != null) {
				builder.append(" UNTIL ").append(source(untilCondition));
			}
			return builder.toString();
		}

		@Override
		public void dump(PrintStream out, int indent) {
			super.dump(out, indent);
			for (Statement statement : body) {
				statement.dump(out, indent + 1);
			}
			printIndent(out, indent);
			out.println("END");
		}
	}

	/** <code>LEAVE [name]</code> */
	public static final class Leave extends Statement {
		public final String name;

		public Leave(int line, String name) {
			super(line);
			this.name = name;
		}

		@Override
		public Kind getKind() {
			return Kind.LEAVE;
		}

		@Override
		protected String describe() {
			return name == null ? "LEAVE" : "LEAVE " + name;
		}
	}

	/** <code>ITERATE [name]</code> */
	public static final class Iterate extends Statement {
		public final String name;

		public Iterate(int line, String name) {
			super(line);
			this.name = name;
		}

		@Override
		public Kind getKind() {
			return Kind.ITERATE;
		}

		@Override
		protected String describe() {
			return name == null ? "ITERATE" : "ITERATE " + name;
		}
	}

	/** A <code>WHEN condition THEN ...</code> branch of a SELECT. */
	public static final class When {
		public final Expression condition;
		public final List<Statement> body;

		public When(Expression condition, List<Statement> body) {
			this.condition = condition;
			this.body = immutable(body);
		}
	}

	/** <code>SELECT WHEN ... [OTHERWISE ...] END</code> */
	public static final class Select extends Statement {
		public final List<When> whens;
		public final List<Statement> otherwise;

		public Select(int line, List<When> whens, List<Statement> otherwise) {
			super(line);
			this.whens = Collections.unmodifiableList(new ArrayList<When>(whens));
			this.otherwise = immutable(otherwise);
		}

		@Override
		public Kind getKind() {
			return Kind.SELECT;
		}

		@Override
		protected String describe() {
			return "SELECT";
		}

		@Override
		public void dump(PrintStream out, int indent) {
			super.dump(out, indent);
			for (When when : whens) {
				dumpBlock(out, indent + 1, "WHEN " + source(when.condition), when.body);
			}
			if (otherwise != null) {
				dumpBlock(out, indent + 1, "OTHERWISE", otherwise);
			}
			printIndent(out, indent);
			out.println("END");
		}
	}

	/** <code>CALL name [arg, ...]</code> */
	public static final class Call extends Statement {
		public final String name;
		public final List<Expression> arguments;

		public Call(int line, String name, List<Expression> arguments) {
			super(line);
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
		}

		@Override
		public Kind getKind() {
			return Kind.CALL;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("CALL ").append(name);
			for (int i = 0; i < arguments.size(); i++) {
				builder.append(i == 0 ? " " : ", ").append(source(arguments.get(i)));
			}
			return builder.toString();
		}
	}

	/** <code>name:</code> */
	public static final class Label extends Statement {
		public final String name;

		public Label(int line, String name) {
			super(line);
			this.name = name;
		}

		@Override
		public Kind getKind() {
			return Kind.LABEL;
		}

		@Override
		protected String describe() {
			return name + ":";
		}
	}

	/** <code>PROCEDURE [EXPOSE name...]</code> */
	public static final class Procedure extends Statement {
		public final List<String> exposed;

		public Procedure(int line, List<String> exposed) {
			super(line);
			this.exposed = Collections.unmodifiableList(new ArrayList<String>(exposed));
		}

		@Override
		public Kind getKind() {
			return Kind.PROCEDURE;
		}

		@Override
		protected String describe() {
			return exposed.isEmpty() ? "PROCEDURE" : "PROCEDURE EXPOSE " + String.join(" ", exposed);
		}
	}

	/** <code>RETURN [expression]</code> */
	public static final class Return extends Statement {
		public final Expression value;

		public Return(int line, Expression value) {
			super(line);
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.RETURN;
		}

		@Override
		protected String describe() {
			return "RETURN " + source(value);
		}
	}

	/**
	 * <code>EXIT [expression]</code>, or
	 * <code>EXIT [expression] UNLESS condition [, message]</code> which only
	 * exits, after saying the message, when the condition is 0.
	 */
	public static final class Exit extends Statement {
		public final Expression value;
		public final Expression unless;
		public final Expression message;

		public Exit(int line, Expression value) {
			this(line, value, null, null);
		}

		public Exit(int line, Expression value, Expression unless, Expression message) {
			super(line);
			this.value = value;
			this.unless = unless;
			this.message = message;
		}

		@Override
		public Kind getKind() {
			return Kind.EXIT;
		}

		@Override
		protected String describe() {
			if (unless == null) {
				return "EXIT " + source(value);
			}
			return "EXIT " + source(value) + " UNLESS " + source(unless) + (message == null ? "" : ", " + source(message));
		}
	}

	/**
	 * <code>SIGNAL label</code>, <code>SIGNAL ON condition [NAME label]</code>
	 * or <code>SIGNAL OFF condition</code>.
	 */
	public static final class Signal extends Statement {

		/** The three forms of SIGNAL. */
		public enum Mode {
			JUMP,
			ON,
			OFF
		}

		public final Mode mode;
		public final ConditionType condition;
		public final String label;

		public Signal(int line, Mode mode, ConditionType condition, String label) {
			super(line);
			this.mode = mode;
			this.condition = condition;
			this.label = label;
		}

		@Override
		public Kind getKind() {
			return Kind.SIGNAL;
		}

		@Override
		protected String describe() {
			switch (mode) {
			case ON:
				return "SIGNAL ON " + condition + " NAME " + label;
			case OFF:
				return "SIGNAL OFF " + condition;
			default:
				return "SIGNAL " + label;
			}
		}
	}

	/** <code>PARSE [UPPER] ARG|PULL|VAR name|VALUE expr WITH template</code> */
	public static final class Parse extends Statement {

		/** Where the parsed string comes from. */
		public enum Source {
			ARG,
			VAR,
			VALUE,
			PULL
		}

		public final Source source;
		public final boolean upper;
		public final Expression.Symbol variable;
		public final Expression value;
		public final List<ParseTemplate> templates;

		public Parse(int line, Source source, boolean upper, Expression.Symbol variable, Expression value, List<ParseTemplate> templates) {
			super(line);
			this.source = source;
			this.upper = upper;
			this.variable = variable;
			this.value = value;
			this.templates = Collections.unmodifiableList(new ArrayList<ParseTemplate>(templates));
		}

		@Override
		public Kind getKind() {
			return Kind.PARSE;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("PARSE ");
			if (upper) {
				builder.append("UPPER ");
			}
			builder.append(source);
			if (variable != null) {
				builder.append(' ').append(variable.name);
			}
			if (value != null) {
				builder.append(' ').append(source(value)).append(" WITH");
			}
			return builder.append(" (").append(templates.size()).append(" template(s))").toString();
		}
	}

	/**
	 * <code>ADDRESS</code> in its three forms: reset to no target, switch the
	 * active target (optionally with an auth context and an alias), or send one
	 * command to a target without switching.
	 */
	public static final class Address extends Statement {

		/** Forms of ADDRESS. */
		public enum Mode {
			RESET,
			SWITCH,
			COMMAND
		}

		public final Mode mode;
		public final String target;
		public final Expression auth;
		public final String alias;
		public final Expression command;

		public Address(int line, Mode mode, String target, Expression auth, String alias, Expression command) {
			super(line);
			this.mode = mode;
			this.target = target;
			this.auth = auth;
			this.alias = alias;
			this.command = command;
		}

		@Override
		public Kind getKind() {
			return Kind.ADDRESS;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("ADDRESS");
			if (target != null) {
				builder.append(' ').append(target);
			}
			if (auth != null) {
				builder.append(" AUTH ").append(source(auth));
			}
			if (alias != null) {
				builder.append(" AS ").append(alias);
			}
			if (command != null) {
				builder.append(' ').append(source(command));
			}
			return builder.toString();
		}
	}

	/**
	 * A clause that starts with a string literal or a HEREDOC. Its value is
	 * sent to the active ADDRESS target.
	 */
	public static final class BareCommand extends Statement {
		public final Expression command;
		public final QuoteKind quoteKind;

		public BareCommand(int line, Expression command, QuoteKind quoteKind) {
			super(line);
			this.command = command;
			this.quoteKind = quoteKind;
		}

		@Override
		public Kind getKind() {
			return Kind.BARE_COMMAND;
		}

		@Override
		protected String describe() {
			return "COMMAND " + source(command);
		}
	}

	/**
	 * <code>NAME key=value ...</code> or <code>NAME arg, ...</code>: an
	 * operation, function or target method invoked for its side effect.
	 */
	public static final class Operation extends Statement {
		public final String name;
		public final Map<String, Expression> namedArguments;
		public final List<Expression> positionalArguments;

		public Operation(int line, String name, Map<String, Expression> namedArguments, List<Expression> positionalArguments) {
			super(line);
			this.name = name;
			this.namedArguments = Collections.unmodifiableMap(new LinkedHashMap<String, Expression>(namedArguments));
			this.positionalArguments = Collections.unmodifiableList(new ArrayList<Expression>(positionalArguments));
		}

		@Override
		public Kind getKind() {
			return Kind.OPERATION;
		}

		@Override
		protected String describe() {
			StringBuilder builder = new StringBuilder("OPERATION ").append(name);
			for (Map.Entry<String, Expression> entry : namedArguments.entrySet()) {
				builder.append(' ').append(entry.getKey()).append('=').append(source(entry.getValue()));
			}
			for (int i = 0; i < positionalArguments.size(); i++) {
				builder.append(i == 0 ? " " : ", ").append(source(positionalArguments.get(i)));
			}
			return builder.toString();
		}
	}

	/** <code>name(args)</code> as a clause on its own; the result goes to RESULT. */
	public static final class FunctionCallStatement extends Statement {
		public final Expression.FunctionCall call;

		public FunctionCallStatement(int line, Expression.FunctionCall call) {
			super(line);
			this.call = call;
		}

		@Override
		public Kind getKind() {
			return Kind.FUNCTION_CALL;
		}

		@Override
		protected String describe() {
			return "CALL " + call.toSource();
		}
	}

	/** <code>REQUIRE specifier [AS prefix]</code> */
	public static final class Require extends Statement {
		public final Expression specifier;
		public final String as;

		public Require(int line, Expression specifier, String as) {
			super(line);
			this.specifier = specifier;
			this.as = as;
		}

		@Override
		public Kind getKind() {
			return Kind.REQUIRE;
		}

		@Override
		protected String describe() {
			return "REQUIRE " + source(specifier) + (as == null ? "" : " AS " + as);
		}
	}

	/** <code>NUMERIC DIGITS|FUZZ [expr]</code> or <code>NUMERIC FORM [SCIENTIFIC|ENGINEERING]</code> */
	public static final class Numeric extends Statement {

		/** The setting changed. */
		public enum Setting {
			DIGITS,
			FUZZ,
			FORM
		}

		public final Setting setting;
		public final Expression value;
		public final String form;

		public Numeric(int line, Setting setting, Expression value, String form) {
			super(line);
			this.setting = setting;
			this.value = value;
			this.form = form;
		}

		@Override
		public Kind getKind() {
			return Kind.NUMERIC;
		}

		@Override
		protected String describe() {
			if (setting == Setting.FORM) {
				return "NUMERIC FORM " + (form == null ? "" : form);
			}
			return "NUMERIC " + setting + " " + source(value);
		}
	}

	/** <code>INTERPRET expression</code> */
	public static final class Interpret extends Statement {
		public final Expression code;

		public Interpret(int line, Expression code) {
			super(line);
			this.code = code;
		}

		@Override
		public Kind getKind() {
			return Kind.INTERPRET;
		}

		@Override
		protected String describe() {
			return "INTERPRET " + source(code);
		}
	}

	/**
	 * <code>PUSH [expression]</code> puts a line on top of the data stack and
	 * <code>QUEUE [expression]</code> adds one at the bottom.
	 */
	public static final class Push extends Statement {
		public final Expression value;
		public final boolean queue;

		public Push(int line, Expression value, boolean queue) {
			super(line);
			this.value = value;
			this.queue = queue;
		}

		@Override
		public Kind getKind() {
			return queue ? Kind.QUEUE : Kind.PUSH;
		}

		@Override
		protected String describe() {
			return (queue ? "QUEUE " : "PUSH ") + source(value);
		}
	}

	/** <code>TRACE [setting]</code>, accepted and ignored. */
	public static final class Trace extends Statement {
		public final String setting;

		public Trace(int line, String setting) {
			super(line);
			this.setting = setting;
		}

		@Override
		public Kind getKind() {
			return Kind.TRACE;
		}

		@Override
		protected String describe() {
			return setting == null ? "TRACE" : "TRACE " + setting;
		}
	}

	/** <code>NO-INTERPRET</code>: INTERPRET fails for the rest of the execution. */
	public static final class NoInterpret extends Statement {

		public NoInterpret(int line) {
			super(line);
		}

		@Override
		public Kind getKind() {
			return Kind.NO_INTERPRET;
		}

		@Override
		protected String describe() {
			return "NO-INTERPRET";
		}
	}
}
