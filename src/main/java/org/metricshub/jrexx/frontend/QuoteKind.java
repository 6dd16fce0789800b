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
 * The lexical form a string literal was written in. Once parsed, all forms
 * behave the same way; the kind is kept for diagnostics and syntax dumps.
 */
public enum QuoteKind {
	DOUBLE("\""),
	SINGLE("'"),
	BACKTICK("`"),
	HEREDOC("<<");

	private final String opening;

	QuoteKind(String opening) {
		this.opening = opening;
	}

	/**
	 * @return the characters that open a literal of this kind
	 */
	public String getOpening() {
		return opening;
	}

	/**
	 * @param quote a quote character
	 * @return the matching kind, or {@code null} when the character is not a quote
	 */
	public static QuoteKind forQuote(char quote) {
		switch (quote) {
		case '"':
			return DOUBLE;
		case '\'':
			return SINGLE;
		case '`':
			return BACKTICK;
		default:
			return null;
		}
	}
}
