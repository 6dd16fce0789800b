package org.metricshub.jrexx;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.jrexx.RexxTestSupport.TestResult;
import org.metricshub.jrexx.jrt.ConditionType;
import org.metricshub.jrexx.jrt.RexxCondition;

/**
 * End-to-end tests of the language run through {@link Rexx}.
 */
public class RexxTest {

	@Test
	public void testSayConcatenatesWithBlank() throws Exception {
		RexxTestSupport.rexxTest("say with blank concatenation").script("say 'Hello' 1 + 1").expectLines("Hello 2").runAndAssert();
	}

	@Test
	public void testAbuttalAndConcatOperator() throws Exception {
		RexxTestSupport
				.rexxTest("abuttal")
				.script("x = 'a'\nsay x'b' || 'c' x")
				.expectLines("abc a")
				.runAndAssert();
	}

	@Test
	public void testInterpolation() throws Exception {
		RexxTestSupport
				.rexxTest("brace interpolation")
				.script("name = 'World'\nsay \"Hello {name}\"\nsay 'kept {missing}'")
				.expectLines("Hello World", "kept {missing}")
				.runAndAssert();
	}

	@Test
	public void testInterpolationOfCompoundVariable() throws Exception {
		RexxTestSupport
				.rexxTest("compound interpolation")
				.script("i = 2\nrow.2 = 'second'\nsay 'row {row.i}'")
				.expectLines("row second")
				.runAndAssert();
	}

	@Test
	public void testAllQuoteForms() throws Exception {
		RexxTestSupport
				.rexxTest("quote forms")
				.script("say 'single' \"double\" `back`\nsay 'it''s'\ntext = <<EOT\nfirst line\nsecond line\nEOT\nsay text")
				.expectLines("single double back", "it's", "first line", "second line")
				.runAndAssert();
	}

	@Test
	public void testUnsetVariableReadsAsItsName() throws Exception {
		RexxTestSupport.rexxTest("unset variable").script("say hello world").expectLines("HELLO WORLD").runAndAssert();
	}

	@Test
	public void testDropRestoresName() throws Exception {
		RexxTestSupport.rexxTest("drop").script("x = 1; drop x; say x").expectLines("X").runAndAssert();
	}

	@Test
	public void testStemsAndDerivedTails() throws Exception {
		RexxTestSupport
				.rexxTest("stems")
				.script("a. = 0\na.1 = 'one'\ni = 1\nsay a.i a.7\ndrop a.1\nsay a.1")
				.expectLines("one 0", "0")
				.runAndAssert();
	}

	@Test
	public void testArithmetic() throws Exception {
		RexxTestSupport
				.rexxTest("arithmetic")
				.script("say 0.1 + 0.2\nsay 7 % 2 7 // 2\nsay 2 ** 10\nsay 1 / 3\nsay -5 + 2\nsay 10 / 4")
				.expectLines("0.3", "3 1", "1024", "0.333333333", "-3", "2.5")
				.runAndAssert();
	}

	@Test
	public void testNumericDigits() throws Exception {
		RexxTestSupport
				.rexxTest("numeric digits")
				.script("numeric digits 5\nsay 1 / 3\nsay digits()\nnumeric digits\nsay digits()")
				.expectLines("0.33333", "5", "9")
				.runAndAssert();
	}

	@Test
	public void testComparisons() throws Exception {
		RexxTestSupport
				.rexxTest("comparisons")
				.script("say 'abc' = '  abc  '\nsay 'abc' == ' abc'\nsay 10 > 9\nsay '10' = '10.0'\nsay 'b' > 'a' & 1 < 2")
				.expectLines("1", "0", "1", "1", "1")
				.runAndAssert();
	}

	@Test
	public void testBadArithmeticIsSyntaxError() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("bad arithmetic")
				.script("say 'abc' + 1")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		RexxCondition condition = (RexxCondition) result.thrownException();
		assertEquals(ConditionType.SYNTAX, condition.getType());
		assertEquals(RexxCondition.BAD_ARITHMETIC, condition.getCode());
		assertEquals(1, condition.getLineNumber());
	}

	@Test
	public void testIfThenElse() throws Exception {
		RexxTestSupport
				.rexxTest("if then else")
				.script("x = 5\nif x > 3 then say 'big'; else say 'small'\nif x < 3 then say 'no'\nelse say 'yes'")
				.expectLines("big", "yes")
				.runAndAssert();
	}

	@Test
	public void testIfBlockClosedByEndif() throws Exception {
		RexxTestSupport
				.rexxTest("endif block")
				.script("x = 1\nif x = 2 then\n  say 'two'\nelse\n  say 'not two'\n  say 'really'\nendif\nsay 'done'")
				.expectLines("not two", "really", "done")
				.runAndAssert();
	}

	@Test
	public void testIfWithDoGroup() throws Exception {
		RexxTestSupport
				.rexxTest("if with do group")
				.script("if 1 then do\n  say 'a'\n  say 'b'\nend\nelse say 'c'")
				.expectLines("a", "b")
				.runAndAssert();
	}

	@Test
	public void testNonLogicalConditionIsSyntaxError() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("logical value")
				.script("if 2 then say 'x'")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.LOGICAL_VALUE, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testControlledLoop() throws Exception {
		RexxTestSupport
				.rexxTest("controlled loop")
				.script("do i = 1 to 3\n  say i\nend\nsay 'after' i")
				.expectLines("1", "2", "3", "after 4")
				.runAndAssert();
	}

	@Test
	public void testLoopWithNegativeStep() throws Exception {
		RexxTestSupport
				.rexxTest("negative step")
				.script("do i = 10 to 1 by -3; say i; end")
				.expectLines("10", "7", "4", "1")
				.runAndAssert();
	}

	@Test
	public void testLoopWithForLimit() throws Exception {
		RexxTestSupport
				.rexxTest("for limit")
				.script("do i = 1 by 2 for 3; say i; end")
				.expectLines("1", "3", "5")
				.runAndAssert();
	}

	@Test
	public void testRepetitionCount() throws Exception {
		RexxTestSupport.rexxTest("repeat count").script("do 3\n  say 'x'\nend").expectLines("x", "x", "x").runAndAssert();
	}

	@Test
	public void testWhileAndUntil() throws Exception {
		RexxTestSupport
				.rexxTest("while and until")
				.script("n = 0; do while n < 3; n = n + 1; end; say n\nm = 5; do until m > 3; m = m + 1; end; say m")
				.expectLines("3", "6")
				.runAndAssert();
	}

	@Test
	public void testLeaveAndIterate() throws Exception {
		RexxTestSupport
				.rexxTest("leave and iterate")
				.script("do i = 1 to 10\n  if i = 3 then iterate\n  if i > 4 then leave\n  say i\nend")
				.expectLines("1", "2", "4")
				.runAndAssert();
	}

	@Test
	public void testLeaveOuterLoopByName() throws Exception {
		RexxTestSupport
				.rexxTest("named leave")
				.script("do i = 1 to 3\n  do j = 1 to 3\n    if j = 2 then leave i\n    say i j\n  end j\nend i\nsay 'out'")
				.expectLines("1 1", "out")
				.runAndAssert();
	}

	@Test
	public void testLeaveOutsideLoop() throws Exception {
		TestResult result = RexxTestSupport.rexxTest("leave outside loop").script("leave").expectThrow(RexxCondition.class).run();
		result.assertExpected();
		assertEquals(RexxCondition.INVALID_LEAVE, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testForeverWithLeave() throws Exception {
		RexxTestSupport
				.rexxTest("forever")
				.script("n = 0\ndo forever\n  n = n + 1\n  if n = 4 then leave\nend\nsay n")
				.expectLines("4")
				.runAndAssert();
	}

	@Test
	public void testDoOverStemAndWords() throws Exception {
		RexxTestSupport
				.rexxTest("do over")
				.script("colors.red = 1; colors.blue = 2\ndo c over colors.\n  say c colors.c\nend\ndo w over 'x y'\n  say w\nend")
				.expectLines("RED 1", "BLUE 2", "x", "y")
				.runAndAssert();
	}

	@Test
	public void testSelect() throws Exception {
		RexxTestSupport
				.rexxTest("select")
				.script("do x = 1 to 3\n  select\n    when x = 1 then say 'one'\n    when x = 2 then say 'two'\n    otherwise say 'many'\n  end\nend")
				.expectLines("one", "two", "many")
				.runAndAssert();
	}

	@Test
	public void testSelectWithoutMatch() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("select without match")
				.script("select\n  when 0 then say 'no'\nend")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.WHEN_EXPECTED, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testInternalFunction() throws Exception {
		RexxTestSupport
				.rexxTest("internal function")
				.script("say double(21)\nexit\ndouble: procedure\n  arg n\n  return n * 2")
				.expectLines("42")
				.runAndAssert();
	}

	@Test
	public void testRecursion() throws Exception {
		RexxTestSupport
				.rexxTest("recursion")
				.script("say fact(6)\nexit\nfact: procedure\n  parse arg n\n  if n <= 1 then return 1\n  return n * fact(n - 1)")
				.expectLines("720")
				.runAndAssert();
	}

	@Test
	public void testProcedureHidesCallerVariables() throws Exception {
		RexxTestSupport
				.rexxTest("procedure isolation")
				.script("x = 1\ncall bump\nsay x result\nexit\nbump: procedure\n  x = 99\n  return 'done'")
				.expectLines("1 done")
				.runAndAssert();
	}

	@Test
	public void testProcedureExpose() throws Exception {
		RexxTestSupport
				.rexxTest("procedure expose")
				.script("count = 0\nlist.0 = 0\ncall incr; call incr\nsay count list.0\nexit\nincr: procedure expose count list.\n  count = count + 1\n  list.0 = count\n  return")
				.expectLines("2 2")
				.runAndAssert();
	}

	@Test
	public void testRoutineStartsWithFreshVariables() throws Exception {
		RexxTestSupport
				.rexxTest("fresh routine variables")
				.script("x = 1\ncall r\nsay x\nexit\nr:\n  say x\n  x = 2\n  return")
				.expectLines("X", "1")
				.runAndAssert();
	}

	@Test
	public void testRoutineSeesArgumentsAndCallLine() throws Exception {
		RexxTestSupport
				.rexxTest("routine arguments")
				.script("call setit 'v'\nsay shared result\nexit\nsetit:\n  shared = arg(1) arg()\n  return shared sigl")
				.expectLines("SHARED v 1 1")
				.runAndAssert();
	}

	@Test
	public void testExposeOfCompoundNameSharesStem() throws Exception {
		RexxTestSupport
				.rexxTest("expose compound name")
				.script("row.1 = 'a'\nkept = 'k'\ncall fill\nsay row.1 row.2 kept\nexit\nfill: procedure expose row.1\n  row.2 = 'b'\n  kept = 'lost'\n  return")
				.expectLines("a b k")
				.runAndAssert();
	}

	@Test
	public void testCallWithoutReturnValueDropsResult() throws Exception {
		RexxTestSupport
				.rexxTest("drop result")
				.script("result = 'old'\ncall nothing\nsay result\nexit\nnothing: return")
				.expectLines("RESULT")
				.runAndAssert();
	}

	@Test
	public void testProcedureNotFirst() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("late procedure")
				.script("call late\nexit\nlate:\n  x = 1\n  procedure")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.UNEXPECTED_PROCEDURE, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testFunctionWithoutReturnValue() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("no return data")
				.script("x = f()\nexit\nf: return")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		RexxCondition condition = (RexxCondition) result.thrownException();
		assertEquals(RexxCondition.NO_RETURN_DATA, condition.getCode());
		assertEquals(1, condition.getLineNumber());
	}

	@Test
	public void testRoutineNotFound() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("routine not found")
				.script("x = nosuch(1)")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.ROUTINE_NOT_FOUND, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testExitCode() throws Exception {
		RexxTestSupport.rexxTest("exit code").script("say 'bye'\nexit 3\nsay 'never'").expectLines("bye").expectExit(3).runAndAssert();
	}

	@Test
	public void testExitUnlessStopsWhenConditionFails() throws Exception {
		RexxTestSupport
				.rexxTest("exit unless")
				.script("status = 404\nexit 2 unless status = 200, 'Status not 200:' status\nsay 'never'")
				.expectLines("Status not 200: 404")
				.expectExit(2)
				.runAndAssert();
	}

	@Test
	public void testExitUnlessContinuesWhenConditionHolds() throws Exception {
		RexxTestSupport
				.rexxTest("exit unless passes")
				.script("count = 3\nexit 1 unless count > 0, 'empty'\nexit unless count = 3\nsay 'reached' count")
				.expectLines("reached 3")
				.runAndAssert();
	}

	@Test
	public void testExitUnlessWithoutCodeEndsNormally() throws Exception {
		RexxTestSupport
				.rexxTest("exit unless default code")
				.script("exit unless 0\nsay 'never'")
				.expectLines()
				.runAndAssert();
	}

	@Test
	public void testDataStack() throws Exception {
		RexxTestSupport
				.rexxTest("data stack")
				.script(
						"push 'second'\npush 'first'\nqueue 'third word'\nsay queued()\n"
								+ "pull a\nparse pull b\nparse pull c d\nsay a b c '/' d queued()\n"
								+ "pull empty\nsay '[' || empty || ']'")
				.expectLines("3", "FIRST second third / word 0", "[]")
				.runAndAssert();
	}

	@Test
	public void testDataStackIsSharedWithRoutines() throws Exception {
		RexxTestSupport
				.rexxTest("data stack routines")
				.script("call produce\ndo while queued() > 0\n  parse pull line\n  say line\nend\nexit\nproduce: procedure\n  queue 'a'\n  queue 'b'\n  return")
				.expectLines("a", "b")
				.runAndAssert();
	}

	@Test
	public void testNoInterpretBlocksLaterInterpret() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("no interpret")
				.script("interpret 'say 1'\nno-interpret\ninterpret 'say 2'")
				.expectLines("1")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.INTERPRETATION, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testTraceIsIgnored() throws Exception {
		RexxTestSupport.rexxTest("trace").script("trace ?r\nsay 'ok'\ntrace off").expectLines("ok").runAndAssert();
	}

	@Test
	public void testArguments() throws Exception {
		RexxTestSupport
				.rexxTest("main arguments")
				.script("parse arg first, second\nsay arg() first second arg(3, 'E')")
				.arguments("one", "two")
				.expectLines("2 one two 0")
				.runAndAssert();
	}

	@Test
	public void testHostVariables() throws Exception {
		RexxTestSupport
				.rexxTest("host variables")
				.script("say greeting cfg.port")
				.variable("greeting", "hi")
				.variable("cfg.port", Integer.valueOf(8080))
				.expectLines("hi 8080")
				.runAndAssert();
	}

	@Test
	public void testInterpret() throws Exception {
		RexxTestSupport
				.rexxTest("interpret")
				.script("op = '+'\ninterpret 'x = 2' op '3'\nsay x")
				.expectLines("5")
				.runAndAssert();
	}

	@Test
	public void testInterpretSyntaxError() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("interpret error")
				.script("interpret 'say (1'")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.INTERPRETATION, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testSignalJumpSetsSigl() throws Exception {
		RexxTestSupport
				.rexxTest("signal jump")
				.script("signal there\nsay 'skipped'\nthere:\nsay 'sigl' sigl")
				.expectLines("sigl 1")
				.runAndAssert();
	}

	@Test
	public void testSignalToMissingLabel() throws Exception {
		TestResult result = RexxTestSupport.rexxTest("missing label").script("signal nowhere").expectThrow(RexxCondition.class).run();
		result.assertExpected();
		assertEquals(RexxCondition.LABEL_NOT_FOUND, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testLabelsFallThrough() throws Exception {
		RexxTestSupport
				.rexxTest("label fall-through")
				.script("say 'a'\nmiddle:\nsay 'b'")
				.expectLines("a", "b")
				.runAndAssert();
	}

	@Test
	public void testBareCommandWithoutAddressIsPrinted() throws Exception {
		RexxTestSupport.rexxTest("bare command").script("'ls -l'").expectLines("ls -l").runAndAssert();
	}

	@Test
	public void testEval() throws Exception {
		Rexx rexx = new Rexx();
		assertEquals("7", rexx.eval("1 + 2 * 3").asString());
		assertEquals("ABC", rexx.eval("upper('abc')").asString());
	}

	@Test
	public void testRunReturnsOutput() throws Exception {
		String output = new Rexx().run("parse arg who\nsay 'hi' who", "there");
		assertTrue(output.startsWith("hi there"));
	}
}
