package org.metricshub.jrexx.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class RexxLexerTest {

	private static List<Token> tokenize(String source) {
		return new RexxLexer(source, "test").tokenize();
	}

	private static List<TokenKind> kinds(String source) {
		List<TokenKind> kinds = new ArrayList<TokenKind>();
		for (Token token : tokenize(source)) {
			kinds.add(token.getKind());
		}
		return kinds;
	}

	private static void assertLexerError(String source, int expectedLine, String expectedMessagePart) {
		try {
			tokenize(source);
			fail("Expected a lexer error for " + source);
		} catch (LexerException e) {
			assertEquals(expectedLine, e.getLineNumber());
			assertTrue(e.getMessage(), e.getMessage().contains(expectedMessagePart));
		}
	}

	@Test
	public void testQuoteForms() {
		List<Token> tokens = tokenize("\"double\" 'single' `back`");
		assertEquals(QuoteKind.DOUBLE, tokens.get(0).getQuoteKind());
		assertEquals("double", tokens.get(0).getText());
		assertEquals(QuoteKind.SINGLE, tokens.get(1).getQuoteKind());
		assertEquals("single", tokens.get(1).getText());
		assertEquals(QuoteKind.BACKTICK, tokens.get(2).getQuoteKind());
		assertEquals("back", tokens.get(2).getText());
	}

	@Test
	public void testDoubledQuoteIsEscape() {
		assertEquals("it's", tokenize("'it''s'").get(0).getText());
		assertEquals("say \"hi\"", tokenize("\"say \"\"hi\"\"\"").get(0).getText());
		assertEquals("a'b", tokenize("\"a'b\"").get(0).getText());
	}

	@Test
	public void testHeredoc() {
		List<Token> tokens = tokenize("x = <<END\nline one\n  line {two}\nEND\nsay x");
		Token heredoc = tokens.get(2);
		assertEquals(TokenKind.STRING, heredoc.getKind());
		assertEquals(QuoteKind.HEREDOC, heredoc.getQuoteKind());
		assertEquals("line one\n  line {two}", heredoc.getText());
		assertEquals(TokenKind.END_OF_CLAUSE, tokens.get(3).getKind());
		assertEquals("say", tokens.get(4).getText());
		assertEquals(5, tokens.get(4).getLine());
	}

	@Test
	public void testEmptyHeredoc() {
		assertEquals("", tokenize("x = <<EOT\nEOT").get(2).getText());
	}

	@Test
	public void testComments() {
		assertEquals(
				Arrays.asList(TokenKind.SYMBOL, TokenKind.NUMBER, TokenKind.END_OF_CLAUSE, TokenKind.END_OF_SOURCE),
				kinds("/* a /* nested */\n comment */ say 1 -- trailing"));
		assertEquals(2, tokenize("/* a /* nested */\n comment */ say 1").get(0).getLine());
	}

	@Test
	public void testClauseEnds() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.SYMBOL,
								TokenKind.END_OF_CLAUSE,
								TokenKind.SYMBOL,
								TokenKind.END_OF_CLAUSE,
								TokenKind.SYMBOL,
								TokenKind.END_OF_CLAUSE,
								TokenKind.END_OF_SOURCE),
				kinds("a; b\nc"));
	}

	@Test
	public void testTrailingCommaContinuesClause() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.SYMBOL,
								TokenKind.SYMBOL,
								TokenKind.NUMBER,
								TokenKind.COMMA,
								TokenKind.NUMBER,
								TokenKind.END_OF_CLAUSE,
								TokenKind.END_OF_SOURCE),
				kinds("call f 1,\n  2"));
	}

	@Test
	public void testNewlineInsideParentheses() {
		assertFalse(kinds("x = (1 +\n 2)").subList(0, 7).contains(TokenKind.END_OF_CLAUSE));
	}

	@Test
	public void testOperators() {
		List<Token> tokens = tokenize("a \\== b || c // d ** e >= f");
		assertEquals("\\==", tokens.get(1).getText());
		assertEquals("||", tokens.get(3).getText());
		assertEquals("//", tokens.get(5).getText());
		assertEquals("**", tokens.get(7).getText());
		assertEquals(">=", tokens.get(9).getText());
		assertTrue(tokens.get(1).isOperator("\\=="));
	}

	@Test
	public void testNumbersAndConstantSymbols() {
		List<Token> tokens = tokenize("1.5e3 12abc .5 7");
		assertEquals(TokenKind.NUMBER, tokens.get(0).getKind());
		assertEquals("1.5e3", tokens.get(0).getText());
		assertEquals(TokenKind.SYMBOL, tokens.get(1).getKind());
		assertEquals("12abc", tokens.get(1).getText());
		assertEquals(TokenKind.NUMBER, tokens.get(2).getKind());
		assertEquals(".5", tokens.get(2).getText());
	}

	@Test
	public void testSymbolsKeepCaseAndCompoundParts() {
		Token token = tokenize("row.i.Name").get(0);
		assertEquals("row.i.Name", token.getText());
		assertEquals("ROW.I.NAME", token.upper());
		assertTrue(tokenize("Say").get(0).isKeyword("SAY"));
	}

	@Test
	public void testBlankBefore() {
		List<Token> tokens = tokenize("f(x) f (x)");
		assertFalse(tokens.get(1).isBlankBefore());
		assertTrue(tokens.get(5).isBlankBefore());
	}

	@Test
	public void testUnterminatedString() {
		assertLexerError("say 1\nsay 'oops", 2, "Unterminated string literal");
	}

	@Test
	public void testStringCannotSpanLines() {
		assertLexerError("x = \"a\nb\"", 1, "Unterminated string literal");
	}

	@Test
	public void testUnterminatedComment() {
		assertLexerError("say 1\n/* never closed", 2, "Unterminated comment");
	}

	@Test
	public void testUnterminatedHeredoc() {
		assertLexerError("x = <<END\nbody", 1, "Unterminated HEREDOC <<END");
	}

	@Test
	public void testUnexpectedCharacter() {
		assertLexerError("x = 1 ~ 2", 1, "Unexpected character '~'");
	}
}
