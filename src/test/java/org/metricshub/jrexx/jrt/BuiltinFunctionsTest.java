package org.metricshub.jrexx.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.junit.Before;
import org.junit.Test;

public class BuiltinFunctionsTest {

	private VariablePool pool;
	private List<RexxValue> arguments;
	private ConditionInfo condition;
	private BuiltinContext context;
	private int queued;

	@Before
	public void setUp() {
		pool = new VariablePool();
		arguments = new ArrayList<RexxValue>();
		condition = null;
		queued = 0;
		final NumericSettings numeric = new NumericSettings();
		context = new BuiltinContext() {
			@Override
			public NumericSettings numeric() {
				return numeric;
			}

			@Override
			public List<RexxValue> arguments() {
				return arguments;
			}

			@Override
			public String addressName() {
				return "echo";
			}

			@Override
			public ConditionInfo condition() {
				return condition;
			}

			@Override
			public RexxValue variable(String symbol) {
				return pool.get(symbol.toUpperCase(Locale.ROOT));
			}

			@Override
			public int queued() {
				return queued;
			}
		};
	}

	/**
	 * Calls a function; a {@code null} argument stands for an omitted one.
	 */
	private String call(String name, String... args) {
		List<RexxValue> values = new ArrayList<RexxValue>();
		for (String arg : args) {
			values.add(arg == null ? null : RexxValue.of(arg));
		}
		return BuiltinFunctions.call(name, values, context).asString();
	}

	private void assertIncorrectCall(String name, String... args) {
		try {
			call(name, args);
			fail(name + " must reject " + Arrays.toString(args));
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.INCORRECT_CALL, e.getCode());
		}
	}

	@Test
	public void testQueued() {
		assertEquals("0", call("QUEUED"));
		queued = 3;
		assertEquals("3", call("QUEUED"));
		assertTrue(BuiltinFunctions.isBuiltin("QUEUED"));
	}

	@Test
	public void testPadding() {
		assertEquals("abc..", call("LEFT", "abc", "5", "."));
		assertEquals("abc", call("LEFT", "abcdef", "3"));
		assertEquals("007", call("RIGHT", "7", "3", "0"));
		assertEquals("ef", call("RIGHT", "abcdef", "2"));
		assertEquals("ababab", call("COPIES", "ab", "3"));
		assertEquals("", call("COPIES", "ab", "0"));
	}

	@Test
	public void testSubstringsAndSearch() {
		assertEquals("ell", call("SUBSTR", "hello", "2", "3"));
		assertEquals("i***", call("SUBSTR", "hi", "2", "4", "*"));
		assertEquals("llo", call("SUBSTR", "hello", "3"));
		assertEquals("4", call("POS", "b", "abcb", "3"));
		assertEquals("0", call("POS", "z", "abc"));
		assertEquals("cba", call("REVERSE", "abc"));
		assertEquals("3", call("LENGTH", "abc"));
		assertEquals("ABC", call("UPPER", "aBc"));
		assertEquals("abc", call("LOWER", "aBc"));
	}

	@Test
	public void testStripAndSpace() {
		assertEquals("x  ", call("STRIP", "  x  ", "L"));
		assertEquals("  x", call("STRIP", "  x  ", "trailing"));
		assertEquals("x", call("STRIP", "--x--", null, "-"));
		assertEquals("a b c", call("SPACE", " a   b c "));
		assertEquals("a--b", call("SPACE", "a b", "2", "-"));
		assertEquals("ab", call("SPACE", "a b", "0"));
	}

	@Test
	public void testWords() {
		assertEquals("two", call("WORD", "one two three", "2"));
		assertEquals("", call("WORD", "one", "5"));
		assertEquals("3", call("WORDS", "  one two  three "));
		assertEquals("2", call("WORDPOS", "two three", "one two three"));
		assertEquals("0", call("WORDPOS", "three two", "one two three"));
	}

	@Test
	public void testNumbers() {
		assertEquals("2.50", call("ABS", "-2.50"));
		assertEquals("-1", call("SIGN", "-3"));
		assertEquals("0", call("SIGN", "-0.0"));
		assertEquals("3.7", call("TRUNC", "3.789", "1"));
		assertEquals("-3", call("TRUNC", "-3.7"));
		assertEquals("10", call("MAX", "3", "10", "2.5"));
		assertEquals("2.5", call("MIN", "3", "10", "2.5"));
		assertEquals("9", call("DIGITS"));
		assertEquals("0", call("FUZZ"));
	}

	@Test
	public void testDatatype() {
		assertEquals("NUM", call("DATATYPE", " 12 "));
		assertEquals("CHAR", call("DATATYPE", "x1"));
		assertEquals("1", call("DATATYPE", "12.0", "W"));
		assertEquals("0", call("DATATYPE", "12.5", "Whole"));
		assertEquals("0", call("DATATYPE", "ab", "U"));
		assertEquals("1", call("DATATYPE", "ab", "L"));
		assertEquals("1", call("DATATYPE", "1f a0", "X"));
		assertEquals("0", call("DATATYPE", "", "A"));
	}

	@Test
	public void testSymbolAndValue() {
		pool.set("x", RexxValue.of("5"));
		assertEquals("VAR", call("SYMBOL", "x"));
		assertEquals("LIT", call("SYMBOL", "y"));
		assertEquals("BAD", call("SYMBOL", "a b"));
		assertEquals("5", call("VALUE", "x"));
		assertEquals("MISSING", call("VALUE", "missing"));
	}

	@Test
	public void testArgAndCondition() {
		arguments.add(RexxValue.of("a"));
		arguments.add(null);
		arguments.add(RexxValue.of("c"));
		assertEquals("3", call("ARG"));
		assertEquals("c", call("ARG", "3"));
		assertEquals("", call("ARG", "2"));
		assertEquals("0", call("ARG", "2", "E"));
		assertEquals("1", call("ARG", "2", "O"));
		assertEquals("echo", call("ADDRESS"));

		assertEquals("", call("CONDITION", "C"));
		condition = new ConditionInfo(ConditionType.ERROR, "'drop table'", "2 permission denied");
		assertEquals("ERROR", call("CONDITION", "C"));
		assertEquals("'drop table'", call("CONDITION", "D"));
		assertEquals("2 permission denied", call("CONDITION", "M"));
		assertEquals("SIGNAL", call("CONDITION"));
	}

	@Test
	public void testInvalidCalls() {
		assertIncorrectCall("LENGTH", "abc", "x");
		assertIncorrectCall("LEFT", "abc");
		assertIncorrectCall("LEFT", "abc", "-1");
		assertIncorrectCall("SUBSTR", "abc", "0");
		assertIncorrectCall("COPIES", "a", "1.5");
		assertIncorrectCall("ABS", "ten");
		assertIncorrectCall("RIGHT", "a", "3", "ab");
		assertIncorrectCall("STRIP", "a", "X");
		assertIncorrectCall("MAX");
		assertIncorrectCall("ARG", "1", "Q");
	}

	@Test
	public void testNamesAndUnknownFunction() {
		assertTrue(BuiltinFunctions.isBuiltin("SUBSTR"));
		assertEquals("ABS", BuiltinFunctions.names().iterator().next());
		try {
			call("NOPE");
			fail("Unknown functions are not built in");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.ROUTINE_NOT_FOUND, e.getCode());
		}
		assertEquals(Arrays.asList("a", "b"), BuiltinFunctions.words(" a \tb "));
	}
}
