package org.metricshub.jrexx.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jrexx.frontend.ast.Expression;
import org.metricshub.jrexx.frontend.ast.Statement;
import org.metricshub.jrexx.jrt.ConditionType;

public class RexxParserTest {

	private static Program parse(String source) {
		return new RexxParser(source, "test").parseProgram();
	}

	private static List<Statement.Kind> kinds(String source) {
		List<Statement.Kind> kinds = new ArrayList<Statement.Kind>();
		for (Statement statement : parse(source).getStatements()) {
			kinds.add(statement.getKind());
		}
		return kinds;
	}

	private static ParserException parseError(String source) {
		try {
			parse(source);
		} catch (ParserException e) {
			return e;
		}
		throw new AssertionError("Expected a parse error for " + source);
	}

	private static String expression(String source) {
		return new RexxParser(source, "test").parseStandaloneExpression().toSource();
	}

	@Test
	public void testStatementKinds() {
		assertEquals(
				Arrays
						.asList(
								Statement.Kind.ASSIGNMENT,
								Statement.Kind.SAY,
								Statement.Kind.NOP,
								Statement.Kind.DROP,
								Statement.Kind.CALL,
								Statement.Kind.FUNCTION_CALL,
								Statement.Kind.BARE_COMMAND,
								Statement.Kind.OPERATION,
								Statement.Kind.REQUIRE,
								Statement.Kind.NUMERIC,
								Statement.Kind.INTERPRET,
								Statement.Kind.PARSE,
								Statement.Kind.EXIT),
				kinds(
						"x = 1\nsay x\nnop\ndrop x\ncall f 1\nf(2)\n'ls -l'\nstore key=1\nrequire 'registry:a/b' as p\n"
								+ "numeric digits 20\ninterpret 'say 1'\nparse arg a b\nexit"));
	}

	@Test
	public void testKeywordsAreVariablesWhenAssigned() {
		List<Statement> statements = parse("say = 1\nif = 2").getStatements();
		assertEquals(Statement.Kind.ASSIGNMENT, statements.get(0).getKind());
		assertEquals("SAY", ((Statement.Assignment) statements.get(0)).target.name);
		assertEquals(Statement.Kind.ASSIGNMENT, statements.get(1).getKind());
	}

	@Test
	public void testLabels() {
		Program program = parse("call sub\nexit\nsub:\n  return 1\nSub:\nother: nop");
		assertTrue(program.hasLabel("SUB"));
		assertTrue(program.hasLabel("OTHER"));
		assertFalse(program.hasLabel("sub"));
		assertEquals(2, program.labelIndex("SUB"));
		assertEquals(-1, program.labelIndex("MISSING"));
	}

	@Test
	public void testIfForms() {
		Statement.If sameLine = (Statement.If) parse("if a then say 1; else say 2").getStatements().get(0);
		assertEquals(1, sameLine.thenBranch.size());
		assertEquals(1, sameLine.elseBranch.size());

		Statement.If nextLineElse = (Statement.If) parse("if a then say 1\nelse say 2").getStatements().get(0);
		assertNotNull(nextLineElse.elseBranch);

		Statement.If group = (Statement.If) parse("if a then\ndo\n  say 1\n  say 2\nend").getStatements().get(0);
		assertEquals(Statement.Kind.DO, group.thenBranch.get(0).getKind());
		assertNull(group.elseBranch);

		Statement.If block = (Statement.If) parse("if a then\n  say 1\n  say 2\nelse\n  say 3\nendif").getStatements().get(0);
		assertEquals(2, block.thenBranch.size());
		assertEquals(1, block.elseBranch.size());

		Statement.If chain = (Statement.If) parse("if a then\n  say 1\nelse if b then\n  say 2\nendif").getStatements().get(0);
		assertEquals(Statement.Kind.IF, chain.elseBranch.get(0).getKind());
	}

	@Test
	public void testDoForms() {
		Statement.Do controlled = (Statement.Do) parse("do i = 1 to 10 by 2 for 3 while i < 5\nend i").getStatements().get(0);
		assertEquals("I", controlled.control.name);
		assertNotNull(controlled.to);
		assertNotNull(controlled.by);
		assertNotNull(controlled.forCount);
		assertNotNull(controlled.whileCondition);

		Statement.Do over = (Statement.Do) parse("do item over list.\n  say item\nend").getStatements().get(0);
		assertNotNull(over.over);
		assertEquals(1, over.body.size());

		assertTrue(((Statement.Do) parse("do forever\n  leave\nend").getStatements().get(0)).forever);
		assertNotNull(((Statement.Do) parse("do 3\nend").getStatements().get(0)).repeat);
		assertNotNull(((Statement.Do) parse("do until x > 3\nend").getStatements().get(0)).untilCondition);
	}

	@Test
	public void testSelect() {
		Statement.Select select = (Statement.Select) parse("select\n  when a then say 1\n  when b\n  then say 2\n  otherwise say 3\nend")
				.getStatements()
				.get(0);
		assertEquals(2, select.whens.size());
		assertEquals(1, select.otherwise.size());
	}

	@Test
	public void testSignal() {
		List<Statement> statements = parse("signal on error name handler\nsignal off novalue\nsignal done\ndone:").getStatements();
		Statement.Signal on = (Statement.Signal) statements.get(0);
		assertEquals(ConditionType.ERROR, on.condition);
		assertEquals("HANDLER", on.label);
		assertEquals(ConditionType.NOVALUE, ((Statement.Signal) statements.get(1)).condition);
		assertEquals("DONE", ((Statement.Signal) statements.get(2)).label);
	}

	@Test
	public void testAddressForms() {
		List<Statement> statements = parse("address\naddress echo\naddress db auth 'k' || suffix as reports\naddress echo 'cmd' x")
				.getStatements();
		assertEquals(Statement.Address.Mode.RESET, ((Statement.Address) statements.get(0)).mode);
		Statement.Address select = (Statement.Address) statements.get(1);
		assertEquals(Statement.Address.Mode.SWITCH, select.mode);
		assertEquals("echo", select.target);
		Statement.Address auth = (Statement.Address) statements.get(2);
		assertEquals(Statement.Address.Mode.SWITCH, auth.mode);
		assertEquals("('k' || SUFFIX)", auth.auth.toSource());
		assertEquals("REPORTS", auth.alias);
		Statement.Address command = (Statement.Address) statements.get(3);
		assertEquals(Statement.Address.Mode.COMMAND, command.mode);
		assertEquals("('cmd' X)", command.command.toSource());
	}

	@Test
	public void testOperationArguments() {
		Statement.Operation named = (Statement.Operation) parse("store key='a', value=2 ttl=-1").getStatements().get(0);
		assertEquals("STORE", named.name);
		assertEquals(Arrays.asList("key", "value", "ttl"), new ArrayList<String>(named.namedArguments.keySet()));
		assertTrue(named.positionalArguments.isEmpty());

		Statement.Operation positional = (Statement.Operation) parse("log 'a', , 3").getStatements().get(0);
		assertEquals(3, positional.positionalArguments.size());
		assertNull(positional.positionalArguments.get(1));
	}

	@Test
	public void testRequire() {
		Statement.Require plain = (Statement.Require) parse("require 'text'").getStatements().get(0);
		assertNull(plain.as);
		assertEquals("t", ((Statement.Require) parse("require 'text' as t").getStatements().get(0)).as);
		assertEquals("t_(.*)", ((Statement.Require) parse("require 'text' as 't_(.*)'").getStatements().get(0)).as);
	}

	@Test
	public void testExpressionPrecedence() {
		assertEquals("(1 + (2 * (3 ** 2)))", expression("1 + 2 * 3 ** 2"));
		assertEquals("(((A = B) & C) | D)", expression("a = b & c | d"));
		assertEquals("((A B) || 'c')", expression("a b || 'c'"));
		assertEquals("('x'Y)", expression("'x'y"));
		assertEquals("LENGTH('abc', )", expression("length('abc', )"));
	}

	@Test
	public void testStandaloneExpressionRejectsTrailingTokens() {
		try {
			expression("1 + 2 )");
			fail("trailing parenthesis accepted");
		} catch (ParserException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("after expression"));
		}
	}

	@Test
	public void testErrorsCarryLine() {
		assertEquals(3, parseError("do i = 1 to 2\n  say i\nend j").getLineNumber());
		assertTrue(parseError("do i = 1 to 2\nsay i\nend j").getMessage().contains("END j does not match the DO on line 1"));
		assertTrue(parseError("do\n  say 1").getMessage().contains("Missing END"));
		assertTrue(parseError("select\nend").getMessage().contains("SELECT needs at least one WHEN"));
		assertTrue(parseError("3x = 1").getMessage().contains("Cannot assign to constant symbol 3x"));
		assertTrue(parseError("do\nsub:\nend").getMessage().contains("Labels are not allowed inside a block"));
		assertTrue(parseError("parse value x with a, b").getMessage().contains("Only PARSE ARG accepts several templates"));
		assertTrue(parseError("signal on bogus").getMessage().contains("Unknown condition bogus"));
		assertTrue(parseError("else say 1").getMessage().contains("Unexpected ELSE"));
		assertEquals(2, parseError("say 1\nsay (2").getLineNumber());
	}

	@Test
	public void testHeredocSourceParsesBack() {
		String body = "say \"double\"\n'single'\n\n`back` quote\n  \nlast";
		Expression literal = new RexxParser("<<END\n" + body + "\nEND", "test").parseStandaloneExpression();
		String source = literal.toSource();
		assertTrue(source.startsWith("<<EOT\n"));
		Expression reparsed = new RexxParser(source, "again").parseStandaloneExpression();
		assertEquals(QuoteKind.HEREDOC, ((Expression.Literal) reparsed).quoteKind);
		assertEquals(body, ((Expression.Literal) reparsed).text);
	}

	@Test
	public void testHeredocSourceAvoidsBodyLabel() {
		Expression.Literal literal = new Expression.Literal(1, "EOT\n  EOT1  \nend", QuoteKind.HEREDOC);
		String source = literal.toSource();
		assertTrue(source.startsWith("<<EOT2\n"));
		Expression reparsed = new RexxParser(source, "again").parseStandaloneExpression();
		assertEquals("EOT\n  EOT1  \nend", ((Expression.Literal) reparsed).text);
	}

	@Test
	public void testDataStackStatements() {
		assertEquals(
				Arrays
						.asList(
								Statement.Kind.PUSH,
								Statement.Kind.QUEUE,
								Statement.Kind.PARSE,
								Statement.Kind.PARSE,
								Statement.Kind.PUSH),
				kinds("push 'a' b\nqueue x\npull first rest\nparse pull line\npush"));
		Statement.Parse pull = (Statement.Parse) parse("pull a b").getStatements().get(0);
		assertEquals(Statement.Parse.Source.PULL, pull.source);
		assertTrue(pull.upper);
		assertFalse(((Statement.Parse) parse("parse pull a").getStatements().get(0)).upper);
		assertTrue(((Statement.Parse) parse("parse upper pull a").getStatements().get(0)).upper);
		Statement.Push queue = (Statement.Push) parse("queue").getStatements().get(0);
		assertTrue(queue.queue);
		assertNull(queue.value);
		assertEquals(Statement.Kind.ASSIGNMENT, parse("push = 1").getStatements().get(0).getKind());
	}

	@Test
	public void testExitUnless() {
		Statement.Exit exit = (Statement.Exit) parse("exit 2 unless count > 0, 'none:' count").getStatements().get(0);
		assertEquals("2", exit.value.toSource());
		assertEquals("(COUNT > 0)", exit.unless.toSource());
		assertEquals("('none:' COUNT)", exit.message.toSource());

		Statement.Exit bare = (Statement.Exit) parse("exit unless ok").getStatements().get(0);
		assertNull(bare.value);
		assertEquals("OK", bare.unless.toSource());
		assertNull(bare.message);

		Statement.Exit plain = (Statement.Exit) parse("exit rc").getStatements().get(0);
		assertNull(plain.unless);
		assertTrue(parseError("exit 1 unless").getMessage().contains("EXIT UNLESS needs a condition"));
	}

	@Test
	public void testNoInterpretSpellings() {
		assertEquals(
				Arrays.asList(Statement.Kind.NO_INTERPRET, Statement.Kind.NO_INTERPRET, Statement.Kind.ASSIGNMENT),
				kinds("no-interpret\nNO_INTERPRET\nno = 1"));
	}

	@Test
	public void testTraceIsAccepted() {
		assertEquals(
				Arrays.asList(Statement.Kind.TRACE, Statement.Kind.TRACE, Statement.Kind.TRACE, Statement.Kind.TRACE),
				kinds("trace ?r\ntrace off\ntrace 'N'\ntrace"));
		assertEquals("?R", ((Statement.Trace) parse("trace ?r").getStatements().get(0)).setting);
		assertNull(((Statement.Trace) parse("trace").getStatements().get(0)).setting);
		assertTrue(parseError("trace bogus").getMessage().contains("Unknown TRACE setting bogus"));
	}

	@Test
	public void testInterpretedCodeRejectsLabels() {
		try {
			new RexxParser("x:\nsay 1", "interpret").parseStatements();
			fail("label accepted");
		} catch (ParserException e) {
			assertTrue(e.getMessage().contains("Labels are not allowed here"));
		}
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("say 'hi'").dump(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		assertTrue(out.toString(StandardCharsets.UTF_8.name()).contains("[line 1]"));
	}
}
