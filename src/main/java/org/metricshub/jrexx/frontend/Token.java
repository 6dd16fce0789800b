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

import java.util.Locale;

/**
 * A token with its source position.
 */
public final class Token {

	private final TokenKind kind;
	private String text;
	private final QuoteKind quoteKind;
	private final int line;
	private final int column;
	private final boolean blankBefore;

	Token(TokenKind kind, String text, QuoteKind quoteKind, int line, int column, boolean blankBefore) {
		this.kind = kind;
		this.text = text;
		this.quoteKind = quoteKind;
		this.line = line;
		this.column = column;
		this.blankBefore = blankBefore;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @return the symbol or operator as written, the number literal, or the
	 *         content of a string literal without its quotes
	 */
	public String getText() {
		return text;
	}

	void setText(String text) {
		this.text = text;
	}

	/**
	 * @return the quote form of a {@link TokenKind#STRING} token, {@code null} otherwise
	 */
	public QuoteKind getQuoteKind() {
		return quoteKind;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @return {@code true} when blanks separate this token from the previous one
	 *         on the same line
	 */
	public boolean isBlankBefore() {
		return blankBefore;
	}

	/**
	 * @return the text in upper case, as symbols are compared
	 */
	public String upper() {
		return text.toUpperCase(Locale.ROOT);
	}

	/**
	 * @param keyword upper-case keyword
	 * @return {@code true} when this token is the symbol {@code keyword}
	 */
	public boolean isKeyword(String keyword) {
		return kind == TokenKind.SYMBOL && upper().equals(keyword);
	}

	/**
	 * @param operator operator text
	 * @return {@code true} when this token is that operator
	 */
	public boolean isOperator(String operator) {
		return kind == TokenKind.OPERATOR && text.equals(operator);
	}

	@Override
	public String toString() {
		switch (kind) {
		case STRING:
			return quoteKind == QuoteKind.HEREDOC ? "<<heredoc>>" : quoteKind.getOpening() + text + quoteKind.getOpening();
		case END_OF_CLAUSE:
			return "end of clause";
		case END_OF_SOURCE:
			return "end of source";
		default:
			return text;
		}
	}
}
