package org.metricshub.jrexx.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;
import org.junit.Test;

public class RexxNumbersTest {

	private static final NumericSettings DEFAULT = new NumericSettings();

	private static BigDecimal n(String text) {
		return new BigDecimal(text);
	}

	@Test
	public void testParseAcceptsBlanksAroundSign() {
		assertEquals(n("-12.5"), RexxNumbers.parse(" - 12.5 "));
		assertEquals(n("7"), RexxNumbers.parse("+7"));
		assertEquals(n("0.5"), RexxNumbers.parse(".5"));
		assertEquals(0, RexxNumbers.parse("1e3").compareTo(n("1000")));
		assertEquals(0, RexxNumbers.parse("2.5E-2").compareTo(n("0.025")));
	}

	@Test
	public void testParseRejectsNonNumbers() {
		assertNull(RexxNumbers.parse(""));
		assertNull(RexxNumbers.parse("   "));
		assertNull(RexxNumbers.parse("abc"));
		assertNull(RexxNumbers.parse("1e"));
		assertNull(RexxNumbers.parse("1 2"));
		assertNull(RexxNumbers.parse("-"));
		assertNull(RexxNumbers.parse("."));
		assertNull(RexxNumbers.parse("0x10"));
	}

	@Test
	public void testFormatPlain() {
		assertEquals("123456789", RexxNumbers.format(n("123456789"), DEFAULT));
		assertEquals("1.50", RexxNumbers.format(n("1.50"), DEFAULT));
		assertEquals("1000", RexxNumbers.format(n("1E+3"), DEFAULT));
		assertEquals("0", RexxNumbers.format(n("0.000"), DEFAULT));
		assertEquals("-0.25", RexxNumbers.format(n("-0.25"), DEFAULT));
	}

	@Test
	public void testFormatSwitchesToExponentialBeyondDigits() {
		assertEquals("1.23456789E+9", RexxNumbers.format(n("1234567890"), DEFAULT));
		assertEquals("12.3456789E+9", RexxNumbers.format(n("12345678901"), new NumericSettings(9, 0, NumericSettings.Form.ENGINEERING)));
		assertEquals("1E-20", RexxNumbers.format(n("1E-20"), DEFAULT));
	}

	@Test
	public void testDivision() {
		assertEquals("0.333333333", RexxNumbers.format(RexxNumbers.divide(n("1"), n("3"), DEFAULT), DEFAULT));
		assertEquals("3", RexxNumbers.format(RexxNumbers.divide(n("6"), n("2"), DEFAULT), DEFAULT));
		assertEquals("2.5", RexxNumbers.format(RexxNumbers.divide(n("10"), n("4"), DEFAULT), DEFAULT));
		assertEquals("100", RexxNumbers.format(RexxNumbers.divide(n("100"), n("1"), DEFAULT), DEFAULT));
		assertEquals("0.33333", RexxNumbers.format(RexxNumbers.divide(n("1"), n("3"), new NumericSettings(5, 0, NumericSettings.Form.SCIENTIFIC)), DEFAULT));
	}

	@Test
	public void testIntegerDivisionAndRemainder() {
		assertEquals(n("3"), RexxNumbers.integerDivide(n("7"), n("2"), DEFAULT));
		assertEquals(n("-3"), RexxNumbers.integerDivide(n("-7"), n("2"), DEFAULT));
		assertEquals(0, RexxNumbers.remainder(n("7"), n("2"), DEFAULT).compareTo(n("1")));
		assertEquals(0, RexxNumbers.remainder(n("-7"), n("2"), DEFAULT).compareTo(n("-1")));
	}

	@Test
	public void testDivisionByZero() {
		try {
			RexxNumbers.divide(n("1"), n("0"), DEFAULT);
			fail("Division by zero must raise a condition");
		} catch (RexxCondition e) {
			assertEquals(ConditionType.SYNTAX, e.getType());
			assertEquals(RexxCondition.ARITHMETIC_OVERFLOW, e.getCode());
		}
		try {
			RexxNumbers.remainder(n("1"), n("0.0"), DEFAULT);
			fail("Remainder by zero must raise a condition");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.ARITHMETIC_OVERFLOW, e.getCode());
		}
	}

	@Test
	public void testPower() {
		assertEquals("1024", RexxNumbers.format(RexxNumbers.power(n("2"), n("10"), DEFAULT), DEFAULT));
		assertEquals("0.25", RexxNumbers.format(RexxNumbers.power(n("2"), n("-2"), DEFAULT), DEFAULT));
		try {
			RexxNumbers.power(n("2"), n("0.5"), DEFAULT);
			fail("Fractional exponent must be rejected");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.INVALID_WHOLE_NUMBER, e.getCode());
		}
	}

	@Test
	public void testArithmeticRoundsToDigits() {
		assertEquals("0.3", RexxNumbers.format(RexxNumbers.add(n("0.1"), n("0.2"), DEFAULT), DEFAULT));
		assertEquals("1.23456789E+9", RexxNumbers.format(RexxNumbers.multiply(n("123456789"), n("10"), DEFAULT), DEFAULT));
		assertEquals("-1", RexxNumbers.format(RexxNumbers.subtract(n("2"), n("3"), DEFAULT), DEFAULT));
	}

	@Test
	public void testCompareHonorsFuzz() {
		assertTrue(RexxNumbers.compare(n("1.00000001"), n("1.00000002"), DEFAULT) < 0);
		assertEquals(0, RexxNumbers.compare(n("1.00000001"), n("1.00000002"), new NumericSettings(9, 1, NumericSettings.Form.SCIENTIFIC)));
		assertEquals(0, RexxNumbers.compare(n("2.0"), n("2"), DEFAULT));
	}

	@Test
	public void testNumericSettingsValidation() {
		try {
			new NumericSettings(0, 0, NumericSettings.Form.SCIENTIFIC);
			fail("Zero digits must be rejected");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.INVALID_NUMERIC, e.getCode());
		}
		NumericSettings settings = new NumericSettings(9, 2, NumericSettings.Form.SCIENTIFIC);
		try {
			settings.setDigits(2);
			fail("Digits must stay above fuzz");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.INVALID_NUMERIC, e.getCode());
		}
		assertEquals(9, settings.getDigits());
		NumericSettings copy = settings.copy();
		copy.setFuzz(0);
		assertEquals(2, settings.getFuzz());
	}

	@Test
	public void testValueCachesNumericView() {
		RexxValue value = RexxValue.of(" 42 ");
		assertTrue(value.isNumber());
		assertEquals(" 42 ", value.asString());
		assertEquals(n("42"), value.requireNumber());
		assertEquals("2.5", RexxValue.fromObject(Double.valueOf(2.5)).asString());
		assertEquals("3", RexxValue.fromObject(Double.valueOf(3.0)).asString());
		assertEquals("1", RexxValue.fromObject(Boolean.TRUE).asString());
		assertEquals("", RexxValue.fromObject(null).asString());
		try {
			RexxValue.of("abc").requireNumber();
			fail("Non-numeric string must not convert");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.BAD_ARITHMETIC, e.getCode());
		}
		try {
			RexxValue.of("2").requireLogical();
			fail("2 is not a logical value");
		} catch (RexxCondition e) {
			assertEquals(RexxCondition.LOGICAL_VALUE, e.getCode());
		}
	}
}
