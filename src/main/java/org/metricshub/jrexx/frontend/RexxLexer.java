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

import java.util.ArrayList;
import java.util.List;

/**
 * Turns script text into tokens.
 * <p>
 * Clauses end at a newline or a semicolon. Newlines inside parentheses, and
 * a newline right after a trailing comma, do not end the clause. A HEREDOC
 * marker (<code>&lt;&lt;LABEL</code>) produces a string token whose content is
 * read from the lines that follow the marker's line, up to the line whose
 * trimmed text is <code>LABEL</code>.
 */
public class RexxLexer {

	private static final String[] OPERATORS = {
			"\\==",
			"¬==",
			"!==",
			"**",
			"||",
			"//",
			"&&",
			"\\=",
			"¬=",
			"!=",
			"==",
			"<>",
			"><",
			">=",
			"<=",
			"\\>",
			"\\<",
			"¬>",
			"¬<",
			"+",
			"-",
			"*",
			"/",
			"%",
			"|",
			"&",
			"\\",
			"¬",
			"=",
			">",
			"<" };

	private final String source;
	private final String description;
	private final List<Token> tokens = new ArrayList<Token>();
	private final List<Token> pendingHeredocs = new ArrayList<Token>();
	private final List<String> pendingLabels = new ArrayList<String>();

	private int pos;
	private int line = 1;
	private int lineStart;
	private int parenDepth;
	private boolean blank;

	/**
	 * @param source script text
	 * @param description description of the source used in error messages
	 */
	public RexxLexer(String source, String description) {
		this.source = source;
		this.description = description;
	}

	/**
	 * Tokenizes the whole source.
	 *
	 * @return the tokens, ending with {@link TokenKind#END_OF_SOURCE}
	 * @throws LexerException on malformed input
	 */
	public List<Token> tokenize() {
		while (pos < source.length()) {
			char c = source.charAt(pos);
			if (c == '\r') {
				pos++;
			} else if (c == '\n') {
				newline();
			} else if (c == ' ' || c == '\t') {
				blank = true;
				pos++;
			} else if (source.startsWith("/*", pos)) {
				skipBlockComment();
			} else if (source.startsWith("--", pos)) {
				while (pos < source.length() && source.charAt(pos) != '\n') {
					pos++;
				}
			} else if (QuoteKind.forQuote(c) != null) {
				readString(c);
			} else if (c == '<' && isHeredocMarker()) {
				readHeredocMarker();
			} else if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
				readNumber();
			} else if (isSymbolStart(c)) {
				readSymbol();
			} else if (c == '(') {
				parenDepth++;
				add(TokenKind.LEFT_PAREN, "(", 1);
			} else if (c == ')') {
				parenDepth = Math.max(0, parenDepth - 1);
				add(TokenKind.RIGHT_PAREN, ")", 1);
			} else if (c == ',') {
				add(TokenKind.COMMA, ",", 1);
			} else if (c == ':') {
				add(TokenKind.COLON, ":", 1);
			} else if (c == ';') {
				add(TokenKind.END_OF_CLAUSE, ";", 1);
			} else {
				readOperator();
			}
		}
		if (!pendingHeredocs.isEmpty()) {
			Token heredoc = pendingHeredocs.get(0);
			throw new LexerException(
					"Unterminated HEREDOC <<" + pendingLabels.get(0),
					description,
					heredoc.getLine(),
					heredoc.getColumn());
		}
		tokens.add(new Token(TokenKind.END_OF_CLAUSE, "", null, line, column(), false));
		tokens.add(new Token(TokenKind.END_OF_SOURCE, "", null, line, column(), false));
		return tokens;
	}

	private int column() {
		return pos - lineStart + 1;
	}

	private void add(TokenKind kind, String text, int length) {
		tokens.add(new Token(kind, text, null, line, column(), blank));
		pos += length;
		blank = false;
	}

	private void newline() {
		boolean continued = !tokens.isEmpty() && tokens.get(tokens.size() - 1).getKind() == TokenKind.COMMA;
		if (parenDepth == 0 && !continued) {
			tokens.add(new Token(TokenKind.END_OF_CLAUSE, "\n", null, line, column(), false));
		}
		pos++;
		line++;
		lineStart = pos;
		blank = false;
		if (!pendingHeredocs.isEmpty()) {
			readHeredocBodies();
		}
	}

	private void skipBlockComment() {
		int startLine = line;
		int startColumn = column();
		int depth = 0;
		while (pos < source.length()) {
			if (source.startsWith("/*", pos)) {
				depth++;
				pos += 2;
			} else if (source.startsWith("*/", pos)) {
				depth--;
				pos += 2;
				if (depth == 0) {
					blank = true;
					return;
				}
			} else {
				if (source.charAt(pos) == '\n') {
					line++;
					lineStart = pos + 1;
				}
				pos++;
			}
		}
		throw new LexerException("Unterminated comment", description, startLine, startColumn);
	}

	private void readString(char quote) {
		int startColumn = column();
		StringBuilder content = new StringBuilder();
		int i = pos + 1;
		while (true) {
			if (i >= source.length() || source.charAt(i) == '\n') {
				throw new LexerException("Unterminated string literal", description, line, startColumn);
			}
			char c = source.charAt(i);
			if (c == quote) {
				if (i + 1 < source.length() && source.charAt(i + 1) == quote) {
					content.append(quote);
					i += 2;
					continue;
				}
				i++;
				break;
			}
			content.append(c);
			i++;
		}
		tokens.add(new Token(TokenKind.STRING, content.toString(), QuoteKind.forQuote(quote), line, startColumn, blank));
		pos = i;
		blank = false;
	}

	private boolean isHeredocMarker() {
		return source.startsWith("<<", pos)
				&& pos + 2 < source.length()
				&& (Character.isLetter(source.charAt(pos + 2)) || source.charAt(pos + 2) == '_');
	}

	private void readHeredocMarker() {
		int startColumn = column();
		int i = pos + 2;
		while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
			i++;
		}
		String label = source.substring(pos + 2, i);
		Token token = new Token(TokenKind.STRING, "", QuoteKind.HEREDOC, line, startColumn, blank);
		tokens.add(token);
		pendingHeredocs.add(token);
		pendingLabels.add(label);
		pos = i;
		blank = false;
	}

	private void readHeredocBodies() {
		for (int h = 0; h < pendingHeredocs.size(); h++) {
			Token token = pendingHeredocs.get(h);
			String label = pendingLabels.get(h);
			List<String> body = new ArrayList<String>();
			while (true) {
				if (pos >= source.length()) {
					throw new LexerException("Unterminated HEREDOC <<" + label, description, token.getLine(), token.getColumn());
				}
				int end = source.indexOf('\n', pos);
				if (end < 0) {
					end = source.length();
				}
				String text = source.substring(pos, end);
				if (text.endsWith("\r")) {
					text = text.substring(0, text.length() - 1);
				}
				pos = Math.min(end + 1, source.length());
				line++;
				lineStart = pos;
				if (text.trim().equals(label)) {
					break;
				}
				body.add(text);
			}
			token.setText(String.join("\n", body));
		}
		pendingHeredocs.clear();
		pendingLabels.clear();
	}

	private void readNumber() {
		int start = pos;
		int i = pos;
		while (i < source.length() && isDigit(source.charAt(i))) {
			i++;
		}
		if (i < source.length() && source.charAt(i) == '.') {
			i++;
			while (i < source.length() && isDigit(source.charAt(i))) {
				i++;
			}
		}
		if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
			int exponent = i + 1;
			if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
				exponent++;
			}
			if (exponent < source.length() && isDigit(source.charAt(exponent))) {
				i = exponent;
				while (i < source.length() && isDigit(source.charAt(i))) {
					i++;
				}
			}
		}
		if (i < source.length() && isSymbolPart(source.charAt(i))) {
			// constant symbol such as 12abc
			while (i < source.length() && isSymbolPart(source.charAt(i))) {
				i++;
			}
			add(TokenKind.SYMBOL, source.substring(start, i), i - start);
			return;
		}
		add(TokenKind.NUMBER, source.substring(start, i), i - start);
	}

	private void readSymbol() {
		int i = pos + 1;
		while (i < source.length() && isSymbolPart(source.charAt(i))) {
			i++;
		}
		add(TokenKind.SYMBOL, source.substring(pos, i), i - pos);
	}

	private void readOperator() {
		for (String operator : OPERATORS) {
			if (source.startsWith(operator, pos)) {
				add(TokenKind.OPERATOR, operator, operator.length());
				return;
			}
		}
		throw new LexerException("Unexpected character '" + source.charAt(pos) + "'", description, line, column());
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	static boolean isSymbolStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '@' || c == '#' || c == '$' || c == '?' || c == '.';
	}

	static boolean isSymbolPart(char c) {
		return isSymbolStart(c) || isDigit(c);
	}
}
