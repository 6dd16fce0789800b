package org.metricshub.jrexx.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jrexx.jrt.ParseTemplate.Element;

public class ParseTemplateTest {

	/**
	 * Collects assignments in a map and resolves variable patterns from it.
	 */
	private static final class MapBinding implements ParseTemplate.Binding {
		final Map<String, String> values = new HashMap<String, String>();

		@Override
		public void assign(String name, String value) {
			values.put(name, value);
		}

		@Override
		public String lookup(String name) {
			String value = values.get(name);
			return value == null ? name : value;
		}
	}

	private static MapBinding parse(String source, Element... elements) {
		MapBinding binding = new MapBinding();
		new ParseTemplate(Arrays.asList(elements)).apply(source, binding);
		return binding;
	}

	@Test
	public void testWordsWithLastTargetTakingTheRest() {
		MapBinding binding = parse("  alpha beta gamma ", Element.target("FIRST"), Element.target("REST"));
		assertEquals("alpha", binding.values.get("FIRST"));
		assertEquals("beta gamma ", binding.values.get("REST"));
	}

	@Test
	public void testSingleTargetKeepsBlanks() {
		assertEquals("  x  ", parse("  x  ", Element.target("ALL")).values.get("ALL"));
	}

	@Test
	public void testMissingWordsAreEmpty() {
		MapBinding binding = parse("one", Element.target("A"), Element.target("B"), Element.target("C"));
		assertEquals("one", binding.values.get("A"));
		assertEquals("", binding.values.get("B"));
		assertEquals("", binding.values.get("C"));
	}

	@Test
	public void testLiteralPattern() {
		MapBinding binding = parse("k1,v1", Element.target("KEY"), Element.literal(","), Element.target("VALUE"));
		assertEquals("k1", binding.values.get("KEY"));
		assertEquals("v1", binding.values.get("VALUE"));
	}

	@Test
	public void testUnmatchedLiteralConsumesEverything() {
		MapBinding binding = parse("abc", Element.target("A"), Element.literal(";"), Element.target("B"));
		assertEquals("abc", binding.values.get("A"));
		assertEquals("", binding.values.get("B"));
	}

	@Test
	public void testPlaceholderSkipsWord() {
		MapBinding binding = parse("skip keep this", Element.target("."), Element.target("B"));
		assertEquals("keep this", binding.values.get("B"));
		assertFalse(binding.values.containsKey("."));
	}

	@Test
	public void testVariablePattern() {
		MapBinding binding = new MapBinding();
		binding.values.put("SEP", "::");
		new ParseTemplate(Arrays.asList(Element.target("A"), Element.variable("SEP"), Element.target("B"))).apply("a::b", binding);
		assertEquals("a", binding.values.get("A"));
		assertEquals("b", binding.values.get("B"));
	}

	@Test
	public void testAbsolutePositions() {
		MapBinding binding = parse("abcdef", Element.target("A"), Element.absolute(4), Element.target("B"));
		assertEquals("abc", binding.values.get("A"));
		assertEquals("def", binding.values.get("B"));
	}

	@Test
	public void testBackwardPositionRescans() {
		MapBinding binding = parse(
				"abcdef",
				Element.target("A"),
				Element.absolute(3),
				Element.target("B"),
				Element.absolute(1),
				Element.target("C"));
		assertEquals("ab", binding.values.get("A"));
		assertEquals("cdef", binding.values.get("B"));
		assertEquals("abcdef", binding.values.get("C"));
	}

	@Test
	public void testRelativePositionFromLastMatch() {
		MapBinding binding = parse(
				"x-abcdef",
				Element.target("A"),
				Element.literal("-"),
				Element.target("B"),
				Element.relative(3),
				Element.target("C"));
		assertEquals("x", binding.values.get("A"));
		assertEquals("ab", binding.values.get("B"));
		assertEquals("cdef", binding.values.get("C"));
	}

	@Test
	public void testElementSourceForm() {
		assertEquals("\",\"", Element.literal(",").toString());
		assertEquals("(SEP)", Element.variable("SEP").toString());
		assertEquals("=4", Element.absolute(4).toString());
		assertEquals("-2", Element.relative(-2).toString());
		assertEquals(ParseTemplate.Kind.PLACEHOLDER, Element.target(".").getKind());
	}
}
