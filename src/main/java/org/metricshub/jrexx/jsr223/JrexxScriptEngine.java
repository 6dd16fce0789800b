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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jrexx.ExitException;
import org.metricshub.jrexx.Rexx;
import org.metricshub.jrexx.jrt.RexxCondition;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.util.RexxSettings;
import org.metricshub.jrexx.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jrexx. Engine-scope bindings become
 * variables of the script; what the script says goes to the context writer.
 * The value of <code>EXIT</code> or <code>RETURN</code> is the result of
 * {@code eval}.
 */
public class JrexxScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	private final Rexx rexx = new Rexx();

	public JrexxScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		ByteArrayOutputStream result = new ByteArrayOutputStream();
		try {
			RexxSettings settings = new RexxSettings();
			settings.setOutputStream(new PrintStream(result, true, StandardCharsets.UTF_8.name()));
			Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
			if (bindings != null) {
				for (Map.Entry<String, Object> binding : bindings.entrySet()) {
					if (!binding.getKey().startsWith("javax.script.")) {
						settings.putVariable(binding.getKey(), binding.getValue());
					}
				}
			}
			RexxValue value = rexx.invoke(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader), settings);
			flush(result, context);
			return value == null ? null : value.asString();
		} catch (ExitException e) {
			throw new ScriptException(e);
		} catch (RexxCondition e) {
			ScriptException exception = new ScriptException(e.report(), e.getSourceDescription(), e.getLineNumber());
			exception.initCause(e);
			throw exception;
		} catch (Exception e) {
			throw new ScriptException(e);
		}
	}

	private static void flush(ByteArrayOutputStream result, ScriptContext context) throws IOException {
		Writer writer = context.getWriter();
		if (writer != null) {
			writer.write(result.toString(StandardCharsets.UTF_8.name()));
			writer.flush();
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
