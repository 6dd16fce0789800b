package org.metricshub.jrexx.frontend;

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
 * Kinds of tokens produced by {@link RexxLexer}.
 */
public enum TokenKind {
	/** A symbol: variable name, keyword, label or constant symbol. */
	SYMBOL,
	/** A number literal. */
	NUMBER,
	/** A string literal in any of the quote forms, including HEREDOC bodies. */
	STRING,
	/** An operator such as <code>+</code>, <code>||</code> or <code>\==</code>. */
	OPERATOR,
	LEFT_PAREN,
	RIGHT_PAREN,
	COMMA,
	COLON,
	/** End of a clause: a newline or a semicolon. */
	END_OF_CLAUSE,
	END_OF_SOURCE
}
