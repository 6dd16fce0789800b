package org.metricshub.jrexx.jsr223;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;

/**
 * Registers the REXX interpreter with <code>javax.script</code> under the
 * names <code>rexx</code> and <code>jrexx</code> and the <code>.rexx</code>,
 * <code>.rex</code> and <code>.rx</code> extensions.
 */
public class JrexxScriptEngineFactory implements ScriptEngineFactory {

	private static final List<String> NAMES = Collections.unmodifiableList(Arrays.asList("rexx", "REXX", "Rexx", "jrexx"));

	private static final List<String> EXTENSIONS = Collections.unmodifiableList(Arrays.asList("rexx", "rex", "rx"));

	private static final List<String> MIME_TYPES = Collections.unmodifiableList(Arrays.asList("text/x-rexx", "application/x-rexx"));

	private static final String ENGINE_VERSION = "1.0.0-SNAPSHOT";

	@Override
	public String getEngineName() {
		return "Jrexx";
	}

	@Override
	public String getEngineVersion() {
		return ENGINE_VERSION;
	}

	@Override
	public List<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public List<String> getMimeTypes() {
		return MIME_TYPES;
	}

	@Override
	public List<String> getNames() {
		return NAMES;
	}

	@Override
	public String getLanguageName() {
		return "REXX";
	}

	@Override
	public String getLanguageVersion() {
		return "Classic REXX with ADDRESS targets and REQUIRE";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key)) {
			return NAMES.get(0);
		}
		if (ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	/**
	 * REXX has no objects: the method is called as a routine with
	 * <code>CALL</code>, its value lands in <code>RESULT</code>. A method of
	 * the active ADDRESS target resolves the same way.
	 */
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		StringBuilder call = new StringBuilder("CALL ").append(m);
		for (int i = 0; i < args.length; i++) {
			call.append(i == 0 ? " " : ", ").append(args[i]);
		}
		return call.toString();
	}

	/**
	 * A <code>SAY</code> clause with the text as a double-quoted literal. Each
	 * <code>{</code> gets a literal of its own so that no <code>{name}</code>
	 * marker is interpolated.
	 */
	@Override
	public String getOutputStatement(String toDisplay) {
		StringBuilder say = new StringBuilder("SAY ");
		String[] parts = toDisplay.split("\\{", -1);
		for (int i = 0; i < parts.length; i++) {
			if (i > 0) {
				say.append(" || \"{\" || ");
			}
			say.append('"').append(parts[i].replace("\"", "\"\"")).append('"');
		}
		return say.toString();
	}

	/** One clause per line. */
	@Override
	public String getProgram(String... statements) {
		StringBuilder program = new StringBuilder();
		for (String statement : statements) {
			program.append(statement).append('\n');
		}
		return program.toString();
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new JrexxScriptEngine(this);
	}
}
