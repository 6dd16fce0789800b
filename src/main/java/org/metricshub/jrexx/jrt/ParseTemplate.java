package org.metricshub.jrexx.jrt;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A <code>PARSE</code> template: target variables separated by patterns.
 * Targets between two patterns split their segment into blank-delimited
 * words, the last one receiving the rest of the segment.
 */
public final class ParseTemplate {

	/**
	 * Receives the assignments made while parsing.
	 */
	public interface Binding {
		/**
		 * @param name upper-case target name, compound tails already derived by the implementation
		 * @param value value to assign
		 */
		void assign(String name, String value);

		/**
		 * @param name upper-case variable name used by a <code>(name)</code> pattern
		 * @return the variable value
		 */
		String lookup(String name);
	}

	/** Kinds of template elements. */
	public enum Kind {
		TARGET,
		PLACEHOLDER,
		LITERAL,
		VARIABLE,
		ABSOLUTE,
		RELATIVE
	}

	/**
	 * One element of a template.
	 */
	public static final class Element {
		private final Kind kind;
		private final String text;
		private final int position;

		private Element(Kind kind, String text, int position) {
			this.kind = kind;
			this.text = text;
			this.position = position;
		}

		public static Element target(String name) {
			return ".".equals(name) ? new Element(Kind.PLACEHOLDER, name, 0) : new Element(Kind.TARGET, name, 0);
		}

		public static Element literal(String text) {
			return new Element(Kind.LITERAL, text, 0);
		}

		public static Element variable(String name) {
			return new Element(Kind.VARIABLE, name, 0);
		}

		public static Element absolute(int position) {
			return new Element(Kind.ABSOLUTE, null, position);
		}

		public static Element relative(int offset) {
			return new Element(Kind.RELATIVE, null, offset);
		}

		public Kind getKind() {
			return kind;
		}

		public String getText() {
			return text;
		}

		public int getPosition() {
			return position;
		}

		@Override
		public String toString() {
			switch (kind) {
			case LITERAL:
				return "\"" + text + "\"";
			case VARIABLE:
				return "(" + text + ")";
			case ABSOLUTE:
				return "=" + position;
			case RELATIVE:
				return (position >= 0 ? "+" : "") + position;
			default:
				return text;
			}
		}
	}

	private final List<Element> elements;

	public ParseTemplate(List<Element> elements) {
		this.elements = Collections.unmodifiableList(new ArrayList<Element>(elements));
	}

	public List<Element> getElements() {
		return elements;
	}

	/**
	 * Parses a string into the template targets.
	 *
	 * @param source string to parse
	 * @param binding receives assignments and resolves variable patterns
	 */
	public void apply(String source, Binding binding) {
		List<Element> pending = new ArrayList<Element>();
		int cursor = 0;
		int lastMatchStart = 0;
		for (Element element : elements) {
			switch (element.kind) {
			case TARGET:
			case PLACEHOLDER:
				pending.add(element);
				break;
			case LITERAL:
			case VARIABLE: {
				String pattern = element.kind == Kind.LITERAL ? element.text : binding.lookup(element.text);
				int match = pattern.isEmpty() ? -1 : source.indexOf(pattern, cursor);
				if (match < 0) {
					assignWords(pending, source.substring(cursor), binding);
					cursor = source.length();
					lastMatchStart = source.length();
				} else {
					assignWords(pending, source.substring(cursor, match), binding);
					lastMatchStart = match;
					cursor = match + pattern.length();
				}
				pending.clear();
				break;
			}
			case ABSOLUTE:
			case RELATIVE: {
				int target = element.kind == Kind.ABSOLUTE ? element.position - 1 : lastMatchStart + element.position;
				target = Math.max(0, Math.min(target, source.length()));
				String segment = target > cursor ? source.substring(cursor, target) : source.substring(cursor);
				assignWords(pending, segment, binding);
				pending.clear();
				cursor = target;
				lastMatchStart = target;
				break;
			}
			default:
				throw new IllegalStateException("Unknown template element " + element.kind);
			}
		}
		assignWords(pending, cursor < source.length() ? source.substring(cursor) : "", binding);
	}

	private static void assignWords(List<Element> targets, String segment, Binding binding) {
		int position = 0;
		for (int i = 0; i < targets.size(); i++) {
			Element target = targets.get(i);
			String value;
			if (i == targets.size() - 1) {
				value = i == 0 ? segment : segment.substring(Math.min(position, segment.length()));
			} else {
				while (position < segment.length() && segment.charAt(position) == ' ') {
					position++;
				}
				int end = segment.indexOf(' ', position);
				if (end < 0) {
					end = segment.length();
				}
				value = segment.substring(position, end);
				position = end < segment.length() ? end + 1 : end;
			}
			if (target.kind == Kind.TARGET) {
				binding.assign(target.text, value);
			}
		}
	}

	/**
	 * Prints the template in source form.
	 *
	 * @param out destination
	 */
	public void dump(PrintStream out) {
		StringBuilder builder = new StringBuilder();
		for (Element element : elements) {
			if (builder.length() > 0) {
				builder.append(' ');
			}
			builder.append(element);
		}
		out.print(builder);
	}
}
