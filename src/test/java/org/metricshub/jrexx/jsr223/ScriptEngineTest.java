package org.metricshub.jrexx.jsr223;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.PrintWriter;
import java.io.StringWriter;
import javax.script.Bindings;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.jrexx.jrt.RexxCondition;

public class ScriptEngineTest {

	@Test
	public void testJrexxScriptEngine() throws Exception {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("jrexx");
		assertNotNull("Jrexx ScriptEngine not found", engine);

		Bindings bindings = engine.createBindings();
		bindings.put("name", "world");
		bindings.put("count", Integer.valueOf(2));

		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));

		Object value = engine.eval("say upper(\"hello {name}\")\nreturn 'total' count * 21", bindings);

		assertEquals("HELLO WORLD\n", result.toString());
		assertEquals("total 42", value);
	}

	@Test
	public void testEngineLookupByExtension() {
		for (String extension : new String[] { "rexx", "rex", "rx" }) {
			ScriptEngine engine = new ScriptEngineManager().getEngineByExtension(extension);
			assertNotNull(extension, engine);
			assertEquals("REXX", engine.getFactory().getLanguageName());
		}
		assertNotNull(new ScriptEngineManager().getEngineByMimeType("text/x-rexx"));
	}

	@Test
	public void testFactorySyntax() {
		ScriptEngineFactory factory = new JrexxScriptEngineFactory();
		assertEquals("SAY \"it's \"\"quoted\"\"\"", factory.getOutputStatement("it's \"quoted\""));
		assertEquals("SAY \"a \" || \"{\" || \"x}\"", factory.getOutputStatement("a {x}"));
		assertEquals("CALL f a, b", factory.getMethodCallSyntax("obj", "f", "a", "b"));
		assertEquals("CALL f", factory.getMethodCallSyntax(null, "f"));
		assertEquals("x = 1\nSAY x\n", factory.getProgram("x = 1", "SAY x"));
		assertEquals("rexx", factory.getParameter(ScriptEngine.NAME));
	}

	@Test
	public void testGeneratedProgramRuns() throws Exception {
		ScriptEngine engine = new ScriptEngineManager().getEngineByName("rexx");
		ScriptEngineFactory factory = engine.getFactory();
		Bindings bindings = engine.createBindings();
		bindings.put("x", "set");
		StringWriter output = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(output));

		String program = factory
				.getProgram(
						factory.getOutputStatement("say \"{x}\" 'as is'"),
						"n = 20",
						factory.getMethodCallSyntax(null, "double", "n"),
						"return 'doubled' result",
						"double: return arg(1) * 2");
		Object value = engine.eval(program, bindings);

		assertEquals("say \"{x}\" 'as is'\n", output.toString());
		assertEquals("doubled 40", value);
	}

	@Test
	public void testConditionBecomesScriptException() {
		ScriptEngine engine = new ScriptEngineManager().getEngineByName("rexx");
		try {
			engine.eval("x = 1\nsay 'a' + 1");
			fail("Bad arithmetic must fail the script");
		} catch (ScriptException e) {
			assertEquals(2, e.getLineNumber());
			assertTrue(e.getCause() instanceof RexxCondition);
		}
	}
}
