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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.jrexx.frontend.ast.Expression;
import org.metricshub.jrexx.frontend.ast.Expression.Operator;
import org.metricshub.jrexx.frontend.ast.Statement;
import org.metricshub.jrexx.jrt.ConditionType;
import org.metricshub.jrexx.jrt.ParseTemplate;
import org.metricshub.jrexx.util.ScriptSource;

/**
 * Recursive descent parser producing the syntax tree of a script.
 * <p>
 * Keywords are only reserved where the grammar expects them: an expression
 * stops at <code>THEN</code> inside an IF, at <code>TO</code>, <code>BY</code>,
 * <code>FOR</code>, <code>WHILE</code> and <code>UNTIL</code> in a DO header,
 * and so on. Anywhere else those words are ordinary symbols.
 */
public class RexxParser {

	private static final Set<String> NO_STOPS = Collections.emptySet();
	private static final Set<String> THEN = set("THEN");
	private static final Set<String> DO_INITIAL = set("TO", "BY", "FOR", "WHILE", "UNTIL");
	private static final Set<String> DO_CONDITION = set("WHILE", "UNTIL");
	private static final Set<String> WITH = set("WITH");
	private static final Set<String> AS = set("AS");
	private static final Set<String> UNLESS = set("UNLESS");
	private static final String TRACE_OPTIONS = "ACEFILNOR";
	private static final Set<String> END = set("END");
	private static final Set<String> ENDIF = set("ENDIF");
	private static final Set<String> ELSE_OR_ENDIF = set("ELSE", "ENDIF");
	private static final Set<String> SELECT_BRANCH = set("WHEN", "OTHERWISE", "END");

	private static final Map<String, Operator> COMPARISONS = new HashMap<String, Operator>();

	static {
		COMPARISONS.put("=", Operator.EQUAL);
		COMPARISONS.put("\\=", Operator.NOT_EQUAL);
		COMPARISONS.put("¬=", Operator.NOT_EQUAL);
		COMPARISONS.put("!=", Operator.NOT_EQUAL);
		COMPARISONS.put("<>", Operator.NOT_EQUAL);
		COMPARISONS.put("><", Operator.NOT_EQUAL);
		COMPARISONS.put(">", Operator.GREATER);
		COMPARISONS.put("<", Operator.LESS);
		COMPARISONS.put(">=", Operator.GREATER_OR_EQUAL);
		COMPARISONS.put("\\<", Operator.GREATER_OR_EQUAL);
		COMPARISONS.put("¬<", Operator.GREATER_OR_EQUAL);
		COMPARISONS.put("<=", Operator.LESS_OR_EQUAL);
		COMPARISONS.put("\\>", Operator.LESS_OR_EQUAL);
		COMPARISONS.put("¬>", Operator.LESS_OR_EQUAL);
		COMPARISONS.put("==", Operator.STRICT_EQUAL);
		COMPARISONS.put("\\==", Operator.STRICT_NOT_EQUAL);
		COMPARISONS.put("¬==", Operator.STRICT_NOT_EQUAL);
		COMPARISONS.put("!==", Operator.STRICT_NOT_EQUAL);
	}

	private final String description;
	private final List<Token> tokens;
	private int pos;
	private Set<String> stops = NO_STOPS;
	private boolean elseStops;

	/**
	 * @param source script text
	 * @param description description of the source used in error messages
	 * @throws LexerException when the text cannot be tokenized
	 */
	public RexxParser(String source, String description) {
		this.description = description;
		this.tokens = new RexxLexer(source, description).tokenize();
	}

	private static Set<String> set(String... words) {
		return Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(words)));
	}

	/**
	 * Reads and parses a script source.
	 *
	 * @param source the source to read
	 * @return the program
	 * @throws IOException when the source cannot be read
	 * @throws LexerException on syntax errors
	 */
	public static Program parse(ScriptSource source) throws IOException {
		StringBuilder text = new StringBuilder();
		try (Reader reader = source.getReader()) {
			char[] buffer = new char[8192];
			int read;
			while ((read = reader.read(buffer)) != -1) {
				text.append(buffer, 0, read);
			}
		}
		return new RexxParser(text.toString(), source.getDescription()).parseProgram();
	}

	/**
	 * Parses a complete script.
	 *
	 * @return the program
	 * @throws ParserException on syntax errors
	 */
	public Program parseProgram() {
		List<Statement> statements = new ArrayList<Statement>();
		Map<String, Integer> labels = new HashMap<String, Integer>();
		while (true) {
			skipClauseEnds();
			if (peek().getKind() == TokenKind.END_OF_SOURCE) {
				break;
			}
			if (isLabel()) {
				Token name = next();
				next();
				if (!labels.containsKey(name.upper())) {
					labels.put(name.upper(), Integer.valueOf(statements.size()));
				}
				statements.add(new Statement.Label(name.getLine(), name.upper()));
				continue;
			}
			statements.add(parseStatement());
			expectClauseEnd();
		}
		return new Program(description, statements, labels);
	}

	/**
	 * Parses code run by <code>INTERPRET</code>, where labels are not allowed.
	 *
	 * @return the statements
	 * @throws ParserException on syntax errors
	 */
	public List<Statement> parseStatements() {
		List<Statement> statements = new ArrayList<Statement>();
		while (true) {
			skipClauseEnds();
			if (peek().getKind() == TokenKind.END_OF_SOURCE) {
				return statements;
			}
			if (isLabel()) {
				throw error("Labels are not allowed here", peek());
			}
			statements.add(parseStatement());
			expectClauseEnd();
		}
	}

	// Token helpers

	private Token peek() {
		return tokens.get(pos);
	}

	private Token peek(int offset) {
		int index = Math.min(pos + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private Token next() {
		Token token = tokens.get(pos);
		if (pos < tokens.size() - 1) {
			pos++;
		}
		return token;
	}

	private boolean isLabel() {
		return peek().getKind() == TokenKind.SYMBOL && peek(1).getKind() == TokenKind.COLON;
	}

	private void skipClauseEnds() {
		while (peek().getKind() == TokenKind.END_OF_CLAUSE) {
			next();
		}
	}

	private boolean atClauseEnd() {
		Token token = peek();
		return token.getKind() == TokenKind.END_OF_CLAUSE
				|| token.getKind() == TokenKind.END_OF_SOURCE
				|| (elseStops && token.isKeyword("ELSE"));
	}

	private void expectClauseEnd() {
		if (!atClauseEnd()) {
			throw error("Unexpected " + peek() + " at end of clause", peek());
		}
	}

	private Token expectKeyword(String keyword) {
		if (!peek().isKeyword(keyword)) {
			throw error(keyword + " expected, found " + peek(), peek());
		}
		return next();
	}

	private Token expect(TokenKind kind, String what) {
		if (peek().getKind() != kind) {
			throw error(what + " expected, found " + peek(), peek());
		}
		return next();
	}

	private boolean isKeywordAtClauseStart(Set<String> keywords) {
		Token token = peek();
		return token.getKind() == TokenKind.SYMBOL
				&& keywords.contains(token.upper())
				&& !peek(1).isOperator("=")
				&& peek(1).getKind() != TokenKind.COLON;
	}

	private ParserException error(String message, Token token) {
		return new ParserException(message, description, token.getLine(), token.getColumn());
	}

	/**
	 * Reads a name given as a symbol or a string literal.
	 */
	private String parseName(String what) {
		Token token = peek();
		if (token.getKind() == TokenKind.SYMBOL) {
			next();
			return token.upper();
		}
		if (token.getKind() == TokenKind.STRING && token.getQuoteKind() != QuoteKind.HEREDOC) {
			next();
			return token.getText();
		}
		throw error(what + " expected, found " + token, token);
	}

	// Statements

	private List<Statement> parseBlock(Set<String> terminators) {
		boolean savedElseStops = elseStops;
		elseStops = false;
		try {
			List<Statement> block = new ArrayList<Statement>();
			while (true) {
				skipClauseEnds();
				Token token = peek();
				if (token.getKind() == TokenKind.END_OF_SOURCE) {
					throw error("Missing " + String.join(" or ", terminators), token);
				}
				if (isKeywordAtClauseStart(terminators)) {
					return block;
				}
				if (isLabel()) {
					throw error("Labels are not allowed inside a block", token);
				}
				block.add(parseStatement());
				expectClauseEnd();
			}
		} finally {
			elseStops = savedElseStops;
		}
	}

	private Statement parseStatement() {
		Token token = peek();
		if (token.getKind() == TokenKind.STRING) {
			Expression command = parseExpression(NO_STOPS);
			return new Statement.BareCommand(token.getLine(), command, token.getQuoteKind());
		}
		if (token.getKind() != TokenKind.SYMBOL) {
			return new Statement.BareCommand(token.getLine(), parseExpression(NO_STOPS), null);
		}
		if (peek(1).isOperator("=")) {
			return parseAssignment();
		}
		switch (token.upper()) {
		case "LET":
			next();
			return parseAssignment();
		case "SAY":
			next();
			return new Statement.Say(token.getLine(), atClauseEnd() ? null : parseExpression(NO_STOPS));
		case "NOP":
			next();
			return new Statement.Nop(token.getLine());
		case "DROP":
			return parseDrop();
		case "IF":
			return parseIf();
		case "DO":
			return parseDo();
		case "LEAVE":
			next();
			return new Statement.Leave(token.getLine(), atClauseEnd() ? null : expect(TokenKind.SYMBOL, "Loop name").upper());
		case "ITERATE":
			next();
			return new Statement.Iterate(token.getLine(), atClauseEnd() ? null : expect(TokenKind.SYMBOL, "Loop name").upper());
		case "SELECT":
			return parseSelect();
		case "CALL":
			next();
			return new Statement.Call(token.getLine(), parseName("Routine name"), parseArgumentList());
		case "PROCEDURE":
			return parseProcedure();
		case "RETURN":
			next();
			return new Statement.Return(token.getLine(), atClauseEnd() ? null : parseExpression(NO_STOPS));
		case "EXIT":
			return parseExit();
		case "SIGNAL":
			return parseSignal();
		case "PARSE":
			return parseParse();
		case "ARG":
			next();
			return new Statement.Parse(token.getLine(), Statement.Parse.Source.ARG, true, null, null, parseTemplates(true));
		case "ADDRESS":
			return parseAddress();
		case "REQUIRE":
			return parseRequire();
		case "NUMERIC":
			return parseNumeric();
		case "INTERPRET":
			next();
			return new Statement.Interpret(token.getLine(), parseExpression(NO_STOPS));
		case "PUSH":
		case "QUEUE":
			next();
			return new Statement.Push(token.getLine(), atClauseEnd() ? null : parseExpression(NO_STOPS), "QUEUE".equals(token.upper()));
		case "PULL":
			next();
			return new Statement.Parse(token.getLine(), Statement.Parse.Source.PULL, true, null, null, parseTemplates(false));
		case "TRACE":
			return parseTrace();
		case "NO_INTERPRET":
			next();
			return new Statement.NoInterpret(token.getLine());
		case "NO":
			if (peek(1).isOperator("-") && !peek(1).isBlankBefore() && peek(2).isKeyword("INTERPRET") && !peek(2).isBlankBefore()) {
				next();
				next();
				next();
				return new Statement.NoInterpret(token.getLine());
			}
			break;
		case "THEN":
		case "ELSE":
		case "END":
		case "ENDIF":
		case "WHEN":
		case "OTHERWISE":
			throw error("Unexpected " + token.upper(), token);
		default:
			break;
		}
		if (peek(1).getKind() == TokenKind.LEFT_PAREN && !peek(1).isBlankBefore()) {
			Expression expression = parseExpression(NO_STOPS);
			if (expression instanceof Expression.FunctionCall) {
				return new Statement.FunctionCallStatement(token.getLine(), (Expression.FunctionCall) expression);
			}
			return new Statement.BareCommand(token.getLine(), expression, null);
		}
		return parseOperation();
	}

	private Statement parseAssignment() {
		Token target = expect(TokenKind.SYMBOL, "Variable name");
		Expression.Symbol symbol = new Expression.Symbol(target.getLine(), target.upper());
		if (symbol.kind == Expression.Symbol.Kind.CONSTANT) {
			throw error("Cannot assign to constant symbol " + target.getText(), target);
		}
		if (!peek().isOperator("=")) {
			throw error("= expected after " + target.getText() + ", found " + peek(), peek());
		}
		next();
		return new Statement.Assignment(target.getLine(), symbol, parseExpression(NO_STOPS));
	}

	private Statement parseExit() {
		Token keyword = next();
		Expression value = atClauseEnd() || peek().isKeyword("UNLESS") ? null : parseExpression(UNLESS);
		if (!peek().isKeyword("UNLESS")) {
			return new Statement.Exit(keyword.getLine(), value);
		}
		Token unless = next();
		if (atClauseEnd()) {
			throw error("EXIT UNLESS needs a condition", unless);
		}
		Expression condition = parseExpression(NO_STOPS);
		Expression message = null;
		if (peek().getKind() == TokenKind.COMMA) {
			next();
			message = parseExpression(NO_STOPS);
		}
		return new Statement.Exit(keyword.getLine(), value, condition, message);
	}

	private Statement parseTrace() {
		Token keyword = next();
		if (atClauseEnd()) {
			return new Statement.Trace(keyword.getLine(), null);
		}
		Token setting = next();
		if (setting.getKind() != TokenKind.SYMBOL && setting.getKind() != TokenKind.STRING) {
			throw error("TRACE setting expected, found " + setting, setting);
		}
		String text = setting.getText().trim().toUpperCase(Locale.ROOT);
		String option = text.startsWith("?") ? text.substring(1) : text;
		if (!option.isEmpty() && TRACE_OPTIONS.indexOf(option.charAt(0)) < 0) {
			throw error("Unknown TRACE setting " + setting.getText(), setting);
		}
		return new Statement.Trace(keyword.getLine(), text);
	}

	private Statement parseDrop() {
		Token keyword = next();
		List<Expression.Symbol> names = new ArrayList<Expression.Symbol>();
		while (!atClauseEnd()) {
			Token name = expect(TokenKind.SYMBOL, "Variable name");
			names.add(new Expression.Symbol(name.getLine(), name.upper()));
		}
		if (names.isEmpty()) {
			throw error("DROP needs at least one variable name", keyword);
		}
		return new Statement.Drop(keyword.getLine(), names);
	}

	private Statement parseIf() {
		Token keyword = next();
		Expression condition = parseExpression(THEN);
		skipClauseEnds();
		expectKeyword("THEN");
		if (!atClauseEnd() || peek().isKeyword("ELSE")) {
			// THEN followed by a clause on the same line
			List<Statement> thenBranch = Collections.singletonList(parseThenClause());
			return new Statement.If(keyword.getLine(), condition, thenBranch, parseOptionalElse());
		}
		skipClauseEnds();
		if (peek().isKeyword("DO") && !peek(1).isOperator("=")) {
			List<Statement> thenBranch = Collections.singletonList(parseThenClause());
			return new Statement.If(keyword.getLine(), condition, thenBranch, parseOptionalElse());
		}
		// block form closed by ENDIF
		List<Statement> thenBranch = parseBlock(ELSE_OR_ENDIF);
		List<Statement> elseBranch = null;
		if (peek().isKeyword("ELSE")) {
			next();
			if (peek().isKeyword("IF")) {
				elseBranch = Collections.singletonList(parseIf());
				return new Statement.If(keyword.getLine(), condition, thenBranch, elseBranch);
			}
			elseBranch = parseBlock(ENDIF);
		}
		expectKeyword("ENDIF");
		return new Statement.If(keyword.getLine(), condition, thenBranch, elseBranch);
	}

	private Statement parseThenClause() {
		boolean saved = elseStops;
		elseStops = true;
		try {
			Statement statement = parseStatement();
			expectClauseEnd();
			return statement;
		} finally {
			elseStops = saved;
		}
	}

	private List<Statement> parseOptionalElse() {
		int saved = pos;
		skipClauseEnds();
		if (!peek().isKeyword("ELSE")) {
			pos = saved;
			return null;
		}
		next();
		skipClauseEnds();
		return Collections.singletonList(parseThenClause());
	}

	private Statement parseDo() {
		Token keyword = next();
		Expression.Symbol control = null;
		Expression initial = null;
		Expression to = null;
		Expression by = null;
		Expression forCount = null;
		Expression over = null;
		Expression repeat = null;
		boolean forever = false;
		Expression whileCondition = null;
		Expression untilCondition = null;

		if (!atClauseEnd()) {
			Token first = peek();
			if (first.isKeyword("FOREVER") && !peek(1).isOperator("=")) {
				next();
				forever = true;
			} else if (first.getKind() == TokenKind.SYMBOL && peek(1).isOperator("=")) {
				next();
				next();
				control = new Expression.Symbol(first.getLine(), first.upper());
				initial = parseExpression(DO_INITIAL);
				while (true) {
					if (peek().isKeyword("TO") && to == null) {
						next();
						to = parseExpression(DO_INITIAL);
					} else if (peek().isKeyword("BY") && by == null) {
						next();
						by = parseExpression(DO_INITIAL);
					} else if (peek().isKeyword("FOR") && forCount == null) {
						next();
						forCount = parseExpression(DO_INITIAL);
					} else {
						break;
					}
				}
			} else if (first.getKind() == TokenKind.SYMBOL && peek(1).isKeyword("OVER")) {
				next();
				next();
				control = new Expression.Symbol(first.getLine(), first.upper());
				over = parseExpression(DO_CONDITION);
			} else if (!first.isKeyword("WHILE") && !first.isKeyword("UNTIL")) {
				repeat = parseExpression(DO_CONDITION);
			}
			if (peek().isKeyword("WHILE")) {
				next();
				whileCondition = parseExpression(NO_STOPS);
			} else if (peek().isKeyword("UNTIL")) {
				next();
				untilCondition = parseExpression(NO_STOPS);
			}
		}
		expectClauseEnd();
		List<Statement> body = parseBlock(END);
		Token end = next();
		if (!atClauseEnd()) {
			Token name = expect(TokenKind.SYMBOL, "Loop name");
			if (control == null || !control.name.equals(name.upper())) {
				throw error("END " + name.getText() + " does not match the DO on line " + keyword.getLine(), end);
			}
		}
		if (control != null && control.kind == Expression.Symbol.Kind.CONSTANT) {
			throw error("Loop control variable cannot be a constant symbol", keyword);
		}
		return new Statement.Do(
				keyword.getLine(),
				control,
				initial,
				to,
				by,
				forCount,
				over,
				repeat,
				forever,
				whileCondition,
				untilCondition,
				body);
	}

	private Statement parseSelect() {
		Token keyword = next();
		expectClauseEnd();
		List<Statement.When> whens = new ArrayList<Statement.When>();
		List<Statement> otherwise = null;
		while (true) {
			skipClauseEnds();
			Token token = peek();
			if (token.isKeyword("WHEN") && otherwise == null) {
				next();
				Expression condition = parseExpression(THEN);
				skipClauseEnds();
				expectKeyword("THEN");
				whens.add(new Statement.When(condition, parseBlock(SELECT_BRANCH)));
			} else if (token.isKeyword("OTHERWISE") && otherwise == null) {
				next();
				otherwise = parseBlock(END);
			} else if (token.isKeyword("END")) {
				next();
				break;
			} else {
				throw error("WHEN, OTHERWISE or END expected in SELECT, found " + token, token);
			}
		}
		if (whens.isEmpty()) {
			throw error("SELECT needs at least one WHEN", keyword);
		}
		return new Statement.Select(keyword.getLine(), whens, otherwise);
	}

	private Statement parseProcedure() {
		Token keyword = next();
		List<String> exposed = new ArrayList<String>();
		if (peek().isKeyword("EXPOSE")) {
			next();
			while (!atClauseEnd()) {
				exposed.add(expect(TokenKind.SYMBOL, "Variable name").upper());
			}
		}
		return new Statement.Procedure(keyword.getLine(), exposed);
	}

	private Statement parseSignal() {
		Token keyword = next();
		Token first = peek();
		if ((first.isKeyword("ON") || first.isKeyword("OFF")) && peek(1).getKind() == TokenKind.SYMBOL) {
			next();
			Token conditionName = next();
			ConditionType condition = ConditionType.fromName(conditionName.getText());
			if (condition == null) {
				throw error("Unknown condition " + conditionName.getText(), conditionName);
			}
			if (first.isKeyword("OFF")) {
				return new Statement.Signal(keyword.getLine(), Statement.Signal.Mode.OFF, condition, null);
			}
			String label = condition.name();
			if (peek().isKeyword("NAME")) {
				next();
				label = parseName("Label name").toUpperCase(java.util.Locale.ROOT);
			}
			return new Statement.Signal(keyword.getLine(), Statement.Signal.Mode.ON, condition, label);
		}
		String label = parseName("Label name").toUpperCase(java.util.Locale.ROOT);
		return new Statement.Signal(keyword.getLine(), Statement.Signal.Mode.JUMP, null, label);
	}

	private Statement parseParse() {
		Token keyword = next();
		boolean upper = false;
		if (peek().isKeyword("UPPER")) {
			next();
			upper = true;
		}
		Token source = expect(TokenKind.SYMBOL, "ARG, PULL, VAR or VALUE");
		switch (source.upper()) {
		case "ARG":
			return new Statement.Parse(keyword.getLine(), Statement.Parse.Source.ARG, upper, null, null, parseTemplates(true));
		case "PULL":
			return new Statement.Parse(keyword.getLine(), Statement.Parse.Source.PULL, upper, null, null, parseTemplates(false));
		case "VAR": {
			Token name = expect(TokenKind.SYMBOL, "Variable name");
			Expression.Symbol variable = new Expression.Symbol(name.getLine(), name.upper());
			return new Statement.Parse(keyword.getLine(), Statement.Parse.Source.VAR, upper, variable, null, parseTemplates(false));
		}
		case "VALUE": {
			Expression value = atClauseEnd() || peek().isKeyword("WITH") ? null : parseExpression(WITH);
			expectKeyword("WITH");
			return new Statement.Parse(keyword.getLine(), Statement.Parse.Source.VALUE, upper, null, value, parseTemplates(false));
		}
		default:
			throw error("ARG, PULL, VAR or VALUE expected after PARSE, found " + source, source);
		}
	}

	private List<ParseTemplate> parseTemplates(boolean allowComma) {
		List<ParseTemplate> templates = new ArrayList<ParseTemplate>();
		List<ParseTemplate.Element> elements = new ArrayList<ParseTemplate.Element>();
		while (!atClauseEnd()) {
			Token token = next();
			switch (token.getKind()) {
			case SYMBOL:
				elements.add(ParseTemplate.Element.target(token.upper()));
				break;
			case STRING:
				elements.add(ParseTemplate.Element.literal(token.getText()));
				break;
			case LEFT_PAREN: {
				Token name = expect(TokenKind.SYMBOL, "Variable name");
				expect(TokenKind.RIGHT_PAREN, ")");
				elements.add(ParseTemplate.Element.variable(name.upper()));
				break;
			}
			case NUMBER:
				elements.add(ParseTemplate.Element.absolute(position(token)));
				break;
			case OPERATOR:
				if (token.isOperator("=")) {
					elements.add(ParseTemplate.Element.absolute(position(expect(TokenKind.NUMBER, "Position"))));
				} else if (token.isOperator("+")) {
					elements.add(ParseTemplate.Element.relative(position(expect(TokenKind.NUMBER, "Position"))));
				} else if (token.isOperator("-")) {
					elements.add(ParseTemplate.Element.relative(-position(expect(TokenKind.NUMBER, "Position"))));
				} else {
					throw error("Unexpected " + token + " in parsing template", token);
				}
				break;
			case COMMA:
				if (!allowComma) {
					throw error("Only PARSE ARG accepts several templates", token);
				}
				templates.add(new ParseTemplate(elements));
				elements.clear();
				break;
			default:
				throw error("Unexpected " + token + " in parsing template", token);
			}
		}
		templates.add(new ParseTemplate(elements));
		return templates;
	}

	private int position(Token number) {
		try {
			return Integer.parseInt(number.getText());
		} catch (NumberFormatException e) {
			throw error("Whole number expected in parsing template, found " + number, number);
		}
	}

	private Statement parseAddress() {
		Token keyword = next();
		if (atClauseEnd()) {
			return new Statement.Address(keyword.getLine(), Statement.Address.Mode.RESET, null, null, null, null);
		}
		Token targetToken = peek();
		String target;
		if (targetToken.getKind() == TokenKind.SYMBOL) {
			target = targetToken.getText();
			next();
		} else if (targetToken.getKind() == TokenKind.STRING && targetToken.getQuoteKind() != QuoteKind.HEREDOC) {
			target = targetToken.getText();
			next();
		} else {
			throw error("ADDRESS target name expected, found " + targetToken, targetToken);
		}
		if (atClauseEnd()) {
			return new Statement.Address(keyword.getLine(), Statement.Address.Mode.SWITCH, target, null, null, null);
		}
		if (peek().isKeyword("AUTH") || peek().isKeyword("AS")) {
			Expression auth = null;
			String alias = null;
			if (peek().isKeyword("AUTH")) {
				next();
				auth = parseExpression(AS);
			}
			if (peek().isKeyword("AS")) {
				next();
				alias = parseName("Alias name");
			}
			return new Statement.Address(keyword.getLine(), Statement.Address.Mode.SWITCH, target, auth, alias, null);
		}
		return new Statement.Address(
				keyword.getLine(),
				Statement.Address.Mode.COMMAND,
				target,
				null,
				null,
				parseExpression(NO_STOPS));
	}

	private Statement parseRequire() {
		Token keyword = next();
		Expression specifier = parseExpression(AS);
		String as = null;
		if (peek().isKeyword("AS")) {
			next();
			Token name = peek();
			if (name.getKind() == TokenKind.SYMBOL) {
				as = name.getText();
				next();
			} else {
				as = parseName("Prefix");
			}
		}
		return new Statement.Require(keyword.getLine(), specifier, as);
	}

	private Statement parseNumeric() {
		Token keyword = next();
		Token setting = expect(TokenKind.SYMBOL, "DIGITS, FUZZ or FORM");
		switch (setting.upper()) {
		case "DIGITS":
			return new Statement.Numeric(
					keyword.getLine(),
					Statement.Numeric.Setting.DIGITS,
					atClauseEnd() ? null : parseExpression(NO_STOPS),
					null);
		case "FUZZ":
			return new Statement.Numeric(
					keyword.getLine(),
					Statement.Numeric.Setting.FUZZ,
					atClauseEnd() ? null : parseExpression(NO_STOPS),
					null);
		case "FORM": {
			String form = null;
			if (!atClauseEnd()) {
				Token value = expect(TokenKind.SYMBOL, "SCIENTIFIC or ENGINEERING");
				if (!value.isKeyword("SCIENTIFIC") && !value.isKeyword("ENGINEERING")) {
					throw error("SCIENTIFIC or ENGINEERING expected, found " + value, value);
				}
				form = value.upper();
			}
			return new Statement.Numeric(keyword.getLine(), Statement.Numeric.Setting.FORM, null, form);
		}
		default:
			throw error("DIGITS, FUZZ or FORM expected after NUMERIC, found " + setting, setting);
		}
	}

	private Statement parseOperation() {
		Token name = next();
		Map<String, Expression> named = new LinkedHashMap<String, Expression>();
		List<Expression> positional = new ArrayList<Expression>();
		if (peek().getKind() == TokenKind.SYMBOL && peek(1).isOperator("=")) {
			while (!atClauseEnd()) {
				Token key = expect(TokenKind.SYMBOL, "Parameter name");
				if (!peek().isOperator("=")) {
					throw error("= expected after parameter " + key.getText(), peek());
				}
				next();
				named.put(key.getText(), parsePrefix());
				if (peek().getKind() == TokenKind.COMMA) {
					next();
				}
			}
		} else {
			positional.addAll(parseArgumentList());
		}
		return new Statement.Operation(name.getLine(), name.upper(), named, positional);
	}

	private List<Expression> parseArgumentList() {
		List<Expression> arguments = new ArrayList<Expression>();
		if (atClauseEnd()) {
			return arguments;
		}
		while (true) {
			boolean omitted = peek().getKind() == TokenKind.COMMA || atClauseEnd();
			arguments.add(omitted ? null : parseExpression(NO_STOPS));
			if (peek().getKind() == TokenKind.COMMA) {
				next();
				continue;
			}
			return arguments;
		}
	}

	// Expressions

	/**
	 * Parses a standalone expression, as used by hosts evaluating a single
	 * expression.
	 *
	 * @return the expression
	 * @throws ParserException when the text is not exactly one expression
	 */
	public Expression parseStandaloneExpression() {
		skipClauseEnds();
		Expression expression = parseExpression(NO_STOPS);
		skipClauseEnds();
		if (peek().getKind() != TokenKind.END_OF_SOURCE) {
			throw error("Unexpected " + peek() + " after expression", peek());
		}
		return expression;
	}

	private Expression parseExpression(Set<String> stopWords) {
		Set<String> saved = stops;
		stops = stopWords;
		try {
			return parseOr();
		} finally {
			stops = saved;
		}
	}

	private boolean isStop(Token token) {
		return token.getKind() == TokenKind.SYMBOL
				&& (stops.contains(token.upper()) || (elseStops && token.isKeyword("ELSE")));
	}

	private Expression parseOr() {
		Expression left = parseAnd();
		while (peek().isOperator("|") || peek().isOperator("&&")) {
			Token operator = next();
			Expression right = parseAnd();
			left = new Expression.Binary(operator.getLine(), operator.isOperator("|") ? Operator.OR : Operator.XOR, left, right);
		}
		return left;
	}

	private Expression parseAnd() {
		Expression left = parseComparison();
		while (peek().isOperator("&")) {
			Token operator = next();
			left = new Expression.Binary(operator.getLine(), Operator.AND, left, parseComparison());
		}
		return left;
	}

	private Expression parseComparison() {
		Expression left = parseConcatenation();
		while (peek().getKind() == TokenKind.OPERATOR && COMPARISONS.containsKey(peek().getText())) {
			Token operator = next();
			left = new Expression.Binary(operator.getLine(), COMPARISONS.get(operator.getText()), left, parseConcatenation());
		}
		return left;
	}

	private Expression parseConcatenation() {
		Expression left = parseAdditive();
		while (true) {
			Token token = peek();
			if (token.isOperator("||")) {
				next();
				left = new Expression.Binary(token.getLine(), Operator.CONCAT, left, parseAdditive());
			} else if (startsTerm(token)) {
				Operator operator = token.isBlankBefore() ? Operator.BLANK_CONCAT : Operator.ABUT;
				left = new Expression.Binary(token.getLine(), operator, left, parseAdditive());
			} else {
				return left;
			}
		}
	}

	private boolean startsTerm(Token token) {
		switch (token.getKind()) {
		case STRING:
		case NUMBER:
		case LEFT_PAREN:
			return true;
		case SYMBOL:
			return !isStop(token);
		default:
			return false;
		}
	}

	private Expression parseAdditive() {
		Expression left = parseMultiplicative();
		while (peek().isOperator("+") || peek().isOperator("-")) {
			Token operator = next();
			Operator op = operator.isOperator("+") ? Operator.ADD : Operator.SUBTRACT;
			left = new Expression.Binary(operator.getLine(), op, left, parseMultiplicative());
		}
		return left;
	}

	private Expression parseMultiplicative() {
		Expression left = parsePower();
		while (true) {
			Token operator = peek();
			Operator op;
			if (operator.isOperator("*")) {
				op = Operator.MULTIPLY;
			} else if (operator.isOperator("/")) {
				op = Operator.DIVIDE;
			} else if (operator.isOperator("%")) {
				op = Operator.INTEGER_DIVIDE;
			} else if (operator.isOperator("//")) {
				op = Operator.REMAINDER;
			} else {
				return left;
			}
			next();
			left = new Expression.Binary(operator.getLine(), op, left, parsePower());
		}
	}

	private Expression parsePower() {
		Expression left = parsePrefix();
		while (peek().isOperator("**")) {
			Token operator = next();
			left = new Expression.Binary(operator.getLine(), Operator.POWER, left, parsePrefix());
		}
		return left;
	}

	private Expression parsePrefix() {
		Token token = peek();
		if (token.isOperator("\\") || token.isOperator("¬")) {
			next();
			return new Expression.Unary(token.getLine(), Operator.NOT, parsePrefix());
		}
		if (token.isOperator("-")) {
			next();
			return new Expression.Unary(token.getLine(), Operator.NEGATE, parsePrefix());
		}
		if (token.isOperator("+")) {
			next();
			return new Expression.Unary(token.getLine(), Operator.PLUS, parsePrefix());
		}
		return parsePrimary();
	}

	private Expression parsePrimary() {
		Token token = next();
		switch (token.getKind()) {
		case STRING:
			return new Expression.Literal(token.getLine(), token.getText(), token.getQuoteKind());
		case NUMBER:
			return new Expression.NumberLiteral(token.getLine(), token.getText());
		case SYMBOL:
			if (peek().getKind() == TokenKind.LEFT_PAREN && !peek().isBlankBefore()) {
				return new Expression.FunctionCall(token.getLine(), token.upper(), parseCallArguments());
			}
			return new Expression.Symbol(token.getLine(), token.upper());
		case LEFT_PAREN: {
			Expression inner = parseExpression(NO_STOPS);
			expect(TokenKind.RIGHT_PAREN, ")");
			return inner;
		}
		default:
			throw error("Expression expected, found " + token, token);
		}
	}

	private List<Expression> parseCallArguments() {
		boolean savedElseStops = elseStops;
		elseStops = false;
		try {
			expect(TokenKind.LEFT_PAREN, "(");
			List<Expression> arguments = new ArrayList<Expression>();
			if (peek().getKind() == TokenKind.RIGHT_PAREN) {
				next();
				return arguments;
			}
			while (true) {
				Token token = peek();
				boolean omitted = token.getKind() == TokenKind.COMMA || token.getKind() == TokenKind.RIGHT_PAREN;
				arguments.add(omitted ? null : parseExpression(NO_STOPS));
				if (peek().getKind() == TokenKind.COMMA) {
					next();
					continue;
				}
				expect(TokenKind.RIGHT_PAREN, ")");
				return arguments;
			}
		} finally {
			elseStops = savedElseStops;
		}
	}
}
