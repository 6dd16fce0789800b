package org.metricshub.jrexx.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jrexx.Rexx;
import org.metricshub.jrexx.RexxTestSupport;
import org.metricshub.jrexx.RexxTestSupport.TestResult;
import org.metricshub.jrexx.address.EchoAddressTarget;
import org.metricshub.jrexx.jrt.RexxCondition;
import org.metricshub.jrexx.util.RexxSettings;

public class ModuleLoaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static void assertLoadFails(Rexx rexx, String specifier, String expectedMessagePart) {
		try {
			rexx.load(specifier, null, new RexxSettings());
			fail("Loading " + specifier + " should have failed");
		} catch (ModuleLoadException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(expectedMessagePart));
		}
	}

	private static RexxCondition syntaxFailure(String script) throws Exception {
		TestResult result = RexxTestSupport.rexxTest(script).script(script).expectThrow(RexxCondition.class).run();
		result.assertExpected();
		return (RexxCondition) result.thrownException();
	}

	private Path jar(String name, String moduleClass) throws IOException {
		Path jar = folder.getRoot().toPath().resolve(name + ".jar");
		Manifest manifest = new Manifest();
		manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
		if (moduleClass != null) {
			manifest.getMainAttributes().putValue(JarModuleSource.MANIFEST_ATTRIBUTE, moduleClass);
		}
		try (OutputStream out = Files.newOutputStream(jar); JarOutputStream jarOut = new JarOutputStream(out, manifest)) {
			jarOut.flush();
		}
		return jar;
	}

	@Test
	public void testHostModuleFunctions() throws Exception {
		RexxTestSupport
				.rexxTest("host module")
				.script("say shout('hi') repeat('ab', 3) total(1, 2, 3.5)")
				.withModules(new TextModule())
				.expectLines("HI! ababab 6.5")
				.runAndAssert();
	}

	@Test
	public void testOperationWithNamedArguments() throws Exception {
		RexxTestSupport
				.rexxTest("operation")
				.script("tag name='db' level=2 color='red'\nsay result")
				.withModules(new TextModule())
				.expectLines("db@2{color=red, level=2, name=db}")
				.runAndAssert();
	}

	@Test
	public void testOperationReceivesCallContext() throws Exception {
		RexxTestSupport
				.rexxTest("call context")
				.script("numeric digits 12\ncallinfo 'a', 'b'\nsay result")
				.withModules(new TextModule())
				.expectLines("CALLINFO:2:12")
				.runAndAssert();
	}

	@Test
	public void testRequireFromClasspathRegistry() throws Exception {
		RexxTestSupport
				.rexxTest("registry")
				.script("require 'registry:test/text'\nsay shout('x')")
				.expectLines("X!")
				.runAndAssert();
	}

	@Test
	public void testRequireServiceByShortNameWithPrefix() throws Exception {
		RexxTestSupport
				.rexxTest("service with prefix")
				.script("require 'text' as t\nsay t_shout('x')\nsay t_repeat('y', 2)")
				.expectLines("X!", "yy")
				.runAndAssert();
	}

	@Test
	public void testRequireWithPrefixPattern() throws Exception {
		RexxTestSupport
				.rexxTest("prefix pattern")
				.script("require 'org.metricshub.jrexx.ext.TextModule' as 'm_(.*)'\nsay m_repeat('x', 2)")
				.expectLines("xx")
				.runAndAssert();
	}

	@Test
	public void testRequireIsIdempotent() throws Exception {
		Rexx rexx = new Rexx();
		RexxSettings settings = new RexxSettings();
		LoadedModule first = rexx.load("registry:test/text", null, settings);
		LoadedModule second = rexx.load("text", null, settings);
		LoadedModule third = rexx.load(TextModule.class.getName(), "other", settings);
		assertSame(first, second);
		assertSame(first, third);
		assertEquals(1, rexx.getModules().modules().size());
		assertNull(rexx.getModules().function("OTHER_SHOUT"));
		assertEquals("1.2", first.getMetadata().getVersion());
	}

	@Test
	public void testDependenciesLoadFirst() throws Exception {
		Rexx rexx = new Rexx();
		rexx.load("registry:test/dependent", null, new RexxSettings());
		assertEquals("test/text", rexx.getModules().modules().get(0).getId());
		assertEquals("test/dependent", rexx.getModules().modules().get(1).getId());
		assertEquals("test/dependent", rexx.getModules().function("greet").getCanonicalId());
		assertEquals(Arrays.asList("GREET"), rexx.getModules().modules().get(1).getFunctionNames());
	}

	@Test
	public void testCircularDependency() {
		assertLoadFails(
				new Rexx(),
				CycleFirstModule.class.getName(),
				"Circular module dependency: test/cycle-a -> test/cycle-b -> test/cycle-a");
	}

	@Test
	public void testConflictingFunction() {
		Rexx rexx = new Rexx(new TextModule());
		assertLoadFails(rexx, ConflictingModule.class.getName(), "declares function SHOUT, already provided by module test/text");
		assertEquals("test/text", rexx.getModules().function("SHOUT").getCanonicalId());
	}

	@Test
	public void testBuiltinCannotBeRedefined() {
		assertLoadFails(new Rexx(), BuiltinClashModule.class.getName(), "cannot redefine built-in function LENGTH");
	}

	@Test
	public void testModuleWithoutEntryPoint() {
		assertLoadFails(new Rexx(), SilentModule.class.getName(), "has no detection entry point");
		assertLoadFails(new Rexx(), String.class.getName(), "Cannot resolve module java.lang.String");
	}

	@Test
	public void testUnknownModule() {
		assertLoadFails(new Rexx(), "nowhere", "Cannot resolve module nowhere");
		assertLoadFails(new Rexx(), "registry:test/unknown", "Module test/unknown is not in any registry");
		assertLoadFails(new Rexx(), "registry:test/missing", "Module class org.metricshub.jrexx.ext.NoSuchModule not found");
		assertLoadFails(new Rexx(), "registry:test/jarless", "Module file not found");
		assertLoadFails(new Rexx(), "./missing.jar", "Module file not found: ./missing.jar");
	}

	@Test
	public void testRequireFailureRaisesSyntax() throws Exception {
		assertEquals(RexxCondition.SYSTEM_SERVICE, syntaxFailure("require 'nowhere'").getCode());
		RexxTestSupport
				.rexxTest("trapped require")
				.script("signal on syntax\nrequire 'registry:test/unknown'\nexit\nsyntax:\nsay rc")
				.expectLines("48")
				.runAndAssert();
	}

	@Test
	public void testModuleFunctionErrors() throws Exception {
		RexxCondition explode = syntaxFailure("require 'text'\nsay explode()");
		assertEquals(RexxCondition.INCORRECT_CALL, explode.getCode());
		assertTrue(explode.getMessage(), explode.getMessage().contains("Incorrect call to EXPLODE: kaboom"));
		assertEquals(RexxCondition.INCORRECT_CALL, syntaxFailure("require 'text'\nsay shout('a', 'b')").getCode());
		assertEquals(RexxCondition.INCORRECT_CALL, syntaxFailure("require 'text'\nsay repeat('a', 'many')").getCode());
		assertEquals(RexxCondition.NO_RETURN_DATA, syntaxFailure("require 'text'\nsay nothing()").getCode());
	}

	@Test
	public void testCallWithoutValueDropsResult() throws Exception {
		RexxTestSupport
				.rexxTest("call nothing")
				.script("result = 'x'\ncall nothing\nsay result")
				.withModules(new TextModule())
				.expectLines("RESULT")
				.runAndAssert();
	}

	@Test
	public void testAddressModule() throws Exception {
		RexxTestSupport
				.rexxTest("address module")
				.script("require 'test/kv'\naddress kv\n'color blue'\nsay rc result\nsay lookup('color')\n'bad'\nsay rc errortext")
				.expectLines("0 blue", "blue", "2 usage: key value")
				.runAndAssert();
	}

	@Test
	public void testAddressModuleUnderAlias() throws Exception {
		Rexx rexx = new Rexx();
		LoadedModule loaded = rexx.load("test/kv", "store", new RexxSettings());
		assertEquals("store", loaded.getAddressName());
		assertTrue(rexx.getAddressTargets().contains("STORE"));
		assertTrue(!rexx.getAddressTargets().contains("kv"));
		assertEquals("1", rexx.run("address store 'a 1'\nsay result").trim());
	}

	@Test
	public void testAddressModuleConflictsWithHostTarget() {
		Rexx rexx = new Rexx();
		rexx.registerAddressTarget("kv", new EchoAddressTarget());
		assertLoadFails(rexx, "test/kv", "already provided by the host");
	}

	@Test
	public void testModulesFromSettings() throws Exception {
		RexxSettings settings = new RexxSettings();
		settings.addModule("registry:test/text");
		RexxTestSupport.rexxTest("settings modules").script("say shout('s')").withSettings(settings).expectLines("S!").runAndAssert();
	}

	@Test
	public void testRegistryFile() throws Exception {
		Path registry = folder.newFile("modules.properties").toPath();
		Files.write(registry, ("local/text=" + TextModule.class.getName() + "\nlocal/jar=text.jar\n").getBytes(StandardCharsets.ISO_8859_1));
		jar("text", TextModule.class.getName());
		RexxSettings settings = new RexxSettings();
		settings.addRegistryFile(registry);

		Rexx rexx = new Rexx();
		assertEquals("test/text", rexx.load("registry:local/text", null, settings).getId());
		LoadedModule fromJar = new Rexx().load("registry:local/jar", null, settings);
		assertEquals("test/text", fromJar.getId());
		assertTrue(fromJar.getSource().endsWith("text.jar"));
	}

	@Test
	public void testSearchPathAndExplicitJar() throws Exception {
		Path jar = jar("textjar", TextModule.class.getName());
		RexxSettings settings = new RexxSettings();
		settings.addSearchPath(folder.getRoot().toPath());
		assertEquals("test/text", new Rexx().load("textjar", null, settings).getId());
		assertEquals("test/text", new Rexx().load(jar.toAbsolutePath().toString(), null, new RexxSettings()).getId());
	}

	@Test
	public void testJarWithoutEntryPoint() throws Exception {
		Path jar = jar("empty", null);
		assertLoadFails(new Rexx(), jar.toAbsolutePath().toString(), "has no detection entry point");
	}

	@Test
	public void testJarWithFailingConstructor() throws Exception {
		Path jar = jar("broken", BrokenModule.class.getName());
		assertLoadFails(new Rexx(), jar.toAbsolutePath().toString(), "Cannot instantiate module " + BrokenModule.class.getName() + ": broken on purpose");
	}

	@Test
	public void testJarClassLoaderClosedWhenModuleIsDiscarded() throws Exception {
		final JarModuleSource first = new JarModuleSource(jar("first", TextModule.class.getName()));
		final JarModuleSource second = new JarModuleSource(jar("second", TextModule.class.getName()));
		final JarModuleSource silent = new JarModuleSource(jar("silent", SilentModule.class.getName()));
		ModuleResolver resolver = new ModuleResolver() {
			@Override
			public ModuleSource resolve(String specifier, RexxSettings settings) {
				if ("first".equals(specifier)) {
					return first;
				}
				if ("second".equals(specifier)) {
					return second;
				}
				return "silent".equals(specifier) ? silent : null;
			}
		};
		Rexx rexx = new Rexx();
		ModuleLoader loader = new ModuleLoader(rexx.getModules(), rexx.getAddressTargets(), Arrays.asList(resolver));
		RexxSettings settings = new RexxSettings();

		LoadedModule loaded = loader.load("first", null, settings);
		URLClassLoader kept = first.getClassLoader();
		assertNotNull(kept);
		assertNotNull(kept.findResource(JarFile.MANIFEST_NAME));

		// same module id from another jar: the registered module is reused
		assertSame(loaded, loader.load("second", null, settings));
		assertNull(second.getClassLoader());
		assertSame(kept, first.getClassLoader());

		try {
			loader.load("silent", null, settings);
			fail("module without metadata accepted");
		} catch (ModuleLoadException e) {
			assertTrue(e.getMessage().contains("describe() returned nothing"));
		}
		assertNull(silent.getClassLoader());
	}

	@Test
	public void testDiscardClosesJarClassLoader() throws Exception {
		JarModuleSource source = new JarModuleSource(jar("closing", TextModule.class.getName()));
		source.instantiate();
		URLClassLoader classLoader = source.getClassLoader();
		assertNotNull(classLoader.findResource(JarFile.MANIFEST_NAME));
		source.discard();
		assertNull(source.getClassLoader());
		assertNull(classLoader.findResource(JarFile.MANIFEST_NAME));
		source.discard();
	}

	@Test
	public void testPrefix() {
		assertEquals("", ModuleLoader.prefix(null));
		assertEquals("MATH_", ModuleLoader.prefix("math"));
		assertEquals("MATH_", ModuleLoader.prefix("math_"));
		assertEquals("M_", ModuleLoader.prefix("m_(.*)"));
		try {
			ModuleLoader.prefix("a-b");
			fail("a-b is not a prefix");
		} catch (ModuleLoadException e) {
			assertTrue(e.getMessage().startsWith("Unsupported AS pattern a-b"));
		}
	}

	@Test
	public void testMetadataRejectsAddressTargetWithFunctions() {
		try {
			ModuleMetadata.builder("test/mixed").function("F", call -> "x").addressTarget(new EchoAddressTarget()).build();
			fail("mixed module accepted");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("test/mixed"));
		}
	}
}
