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

/**
 * A condition raised while a script runs. Conditions travel up the call frame
 * stack until a frame with a matching <code>SIGNAL ON</code> trap intercepts
 * them; an untrapped condition terminates the script and reaches the host as
 * this exception.
 */
public class RexxCondition extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Error 7: WHEN or OTHERWISE expected. */
	public static final int WHEN_EXPECTED = 7;

	/** Error 16: label not found. */
	public static final int LABEL_NOT_FOUND = 16;

	/** Error 17: unexpected PROCEDURE. */
	public static final int UNEXPECTED_PROCEDURE = 17;

	/** Error 26: invalid whole number. */
	public static final int INVALID_WHOLE_NUMBER = 26;

	/** Error 28: LEAVE or ITERATE outside a matching loop. */
	public static final int INVALID_LEAVE = 28;

	/** Error 33: invalid NUMERIC setting. */
	public static final int INVALID_NUMERIC = 33;

	/** Error 34: logical value not 0 or 1. */
	public static final int LOGICAL_VALUE = 34;

	/** Error 38: unresolved ADDRESS target. */
	public static final int UNRESOLVED_TARGET = 38;

	/** Error 40: incorrect call to routine. */
	public static final int INCORRECT_CALL = 40;

	/** Error 41: bad arithmetic conversion. */
	public static final int BAD_ARITHMETIC = 41;

	/** Error 42: arithmetic overflow or division by zero. */
	public static final int ARITHMETIC_OVERFLOW = 42;

	/** Error 43: routine not found. */
	public static final int ROUTINE_NOT_FOUND = 43;

	/** Error 44: function did not return data. */
	public static final int NO_RETURN_DATA = 44;

	/** Error 48: failure in system service (module loading). */
	public static final int SYSTEM_SERVICE = 48;

	/** Error 49: INTERPRET source could not be parsed. */
	public static final int INTERPRETATION = 49;

	private final ConditionType type;
	private final int code;
	private final String description;
	private int lineNumber = -1;
	private String sourceDescription;

	/**
	 * Creates a condition.
	 *
	 * @param type the condition raised
	 * @param code REXX error number for SYNTAX, the return code for ERROR and
	 *        FAILURE, zero for NOVALUE
	 * @param message human readable message, also published as ERRORTEXT
	 * @param description the condition description returned by
	 *        <code>CONDITION('D')</code>
	 */
	public RexxCondition(ConditionType type, int code, String message, String description) {
		super(message);
		this.type = type;
		this.code = code;
		this.description = description == null ? "" : description;
	}

	/**
	 * Creates a condition wrapping a Java failure.
	 *
	 * @param type the condition raised
	 * @param code REXX error number
	 * @param message human readable message
	 * @param cause underlying exception
	 */
	public RexxCondition(ConditionType type, int code, String message, Throwable cause) {
		super(message, cause);
		this.type = type;
		this.code = code;
		this.description = "";
	}

	/**
	 * Creates a SYNTAX condition.
	 *
	 * @param code REXX error number
	 * @param message human readable message
	 * @return the condition, ready to be thrown
	 */
	public static RexxCondition syntax(int code, String message) {
		return new RexxCondition(ConditionType.SYNTAX, code, message, "");
	}

	/**
	 * Creates a NOVALUE condition for the given symbol.
	 *
	 * @param symbol upper-case name of the unset variable
	 * @return the condition, ready to be thrown
	 */
	public static RexxCondition novalue(String symbol) {
		return new RexxCondition(ConditionType.NOVALUE, 0, "Variable " + symbol + " has no value", symbol);
	}

	public ConditionType getType() {
		return type;
	}

	public int getCode() {
		return code;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return the script line where the condition was raised, or -1 when unknown
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return description of the script source, or {@code null} when unknown
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * Records where the condition was raised, unless a location is already known.
	 *
	 * @param source description of the script source
	 * @param line 1-based line number
	 * @return this condition
	 */
	public RexxCondition locate(String source, int line) {
		if (lineNumber < 0) {
			this.lineNumber = line;
			this.sourceDescription = source;
		}
		return this;
	}

	/**
	 * Formats the condition the way uncaught conditions are reported.
	 *
	 * @return e.g. <code>SYNTAX 41 in script.rexx, line 3: Bad arithmetic conversion</code>
	 */
	public String report() {
		StringBuilder builder = new StringBuilder();
		builder.append(type.name());
		if (type != ConditionType.NOVALUE) {
			builder.append(' ').append(code);
		}
		if (sourceDescription != null) {
			builder.append(" in ").append(sourceDescription);
		}
		if (lineNumber >= 0) {
			builder.append(", line ").append(lineNumber);
		}
		builder.append(": ").append(getMessage());
		return builder.toString();
	}
}
