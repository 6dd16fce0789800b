package org.metricshub.jrexx;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.jrexx.RexxTestSupport.TestResult;
import org.metricshub.jrexx.address.AddressInvocation;
import org.metricshub.jrexx.address.AddressReply;
import org.metricshub.jrexx.address.AddressResult;
import org.metricshub.jrexx.address.AddressTarget;
import org.metricshub.jrexx.jrt.RexxCondition;

/**
 * Tests of the <code>ADDRESS</code> instruction and of the variables it
 * publishes.
 */
public class AddressTest {

	/**
	 * Records the invocations it receives and answers with their parameters.
	 */
	static final class RecordingTarget implements AddressTarget {
		final List<AddressInvocation> invocations = new ArrayList<AddressInvocation>();

		@Override
		public String getName() {
			return "recorder";
		}

		@Override
		public boolean supportsMethodCall() {
			return true;
		}

		@Override
		public AddressReply handle(AddressInvocation invocation) {
			invocations.add(invocation);
			return AddressReply
					.immediate(
							AddressResult
									.success(invocation.getKind() + ":" + invocation.getName() + invocation.getParameters())
									.withVariable("last.call", invocation.getName()));
		}
	}

	@Test
	public void testEchoPublishesCommandAsResult() throws Exception {
		RexxTestSupport
				.rexxTest("echo round trip")
				.script("tbl = 'x_a'\naddress echo\n\"CREATE TABLE {tbl} (id INTEGER)\"\nsay rc\nsay result")
				.expectLines("0", "CREATE TABLE x_a (id INTEGER)")
				.runAndAssert();
	}

	@Test
	public void testAddressWithCommand() throws Exception {
		RexxTestSupport
				.rexxTest("address with command")
				.script("address echo 'hello'\nsay result'|'address()'|'")
				.expectLines("hello||")
				.runAndAssert();
	}

	@Test
	public void testAddressFunctionAndReset() throws Exception {
		RexxTestSupport
				.rexxTest("address function")
				.script("address echo\nsay address()\naddress\nsay '['address()']'")
				.expectLines("echo", "[]")
				.runAndAssert();
	}

	@Test
	public void testSuccessDropsErrortext() throws Exception {
		RexxTestSupport
				.rexxTest("errortext dropped")
				.script("errortext = 'stale'\naddress echo 'ok'\nsay errortext")
				.expectLines("ERRORTEXT")
				.runAndAssert();
	}

	@Test
	public void testUnknownTarget() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("unknown target")
				.script("address nowhere")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.UNRESOLVED_TARGET, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testTargetNamesAreCaseInsensitive() throws Exception {
		RexxTestSupport.rexxTest("case-insensitive target").script("address ECHO 'x'\nsay rc").expectLines("0").runAndAssert();
	}

	@Test
	public void testMethodCallsReachTarget() throws Exception {
		RecordingTarget target = new RecordingTarget();
		RexxTestSupport
				.rexxTest("method calls")
				.script("address recorder\nsay lookup('k', 2)\nstore key='a', value=(1 + 1)\nsay result\nsay last.call\ncall ping 'x'\nsay rc result")
				.withTarget("recorder", target)
				.expectLines(
						"METHOD:LOOKUP{arg1=k, arg2=2}",
						"METHOD:STORE{key=a, value=2}",
						"STORE",
						"0 METHOD:PING{arg1=x}")
				.runAndAssert();
		assertEquals(3, target.invocations.size());
		assertEquals(AddressInvocation.Kind.METHOD, target.invocations.get(0).getKind());
	}

	@Test
	public void testCommandsCarryVariablesSnapshot() throws Exception {
		RecordingTarget target = new RecordingTarget();
		RexxTestSupport
				.rexxTest("variables snapshot")
				.script("user = 'ann'\naddress recorder 'whoami'")
				.withTarget("recorder", target)
				.expectLines()
				.runAndAssert();
		AddressInvocation invocation = target.invocations.get(0);
		assertEquals("whoami", invocation.getParameter(AddressInvocation.COMMAND_PARAMETER));
		assertEquals("ann", invocation.getVariables().get("USER").asString());
	}

	@Test
	public void testAuthAndAlias() throws Exception {
		RecordingTarget target = new RecordingTarget();
		RexxTestSupport
				.rexxTest("auth and alias")
				.script("address recorder auth 'token-1' as admin\n'first'\naddress echo\naddress admin 'second'\nsay address()")
				.withTarget("recorder", target)
				.expectLines("echo")
				.runAndAssert();
		assertEquals(2, target.invocations.size());
		assertEquals("ADMIN", target.invocations.get(0).getTargetName());
		assertEquals("token-1", target.invocations.get(0).getAuth().getCredential());
		assertEquals("token-1", target.invocations.get(1).getAuth().getCredential());
	}

	@Test
	public void testTargetExceptionBecomesFailedCommand() throws Exception {
		RexxTestSupport
				.rexxTest("throwing target")
				.script("address broken 'x'\nsay rc errortext")
				.withTarget("broken", new AddressTarget() {
					@Override
					public String getName() {
						return "broken";
					}

					@Override
					public AddressReply handle(AddressInvocation invocation) throws Exception {
						throw new IllegalStateException("connection refused");
					}
				})
				.expectLines("1 connection refused")
				.runAndAssert();
	}

	@Test
	public void testCommandOnlyTargetRejectsMethodCall() throws Exception {
		TestResult result = RexxTestSupport
				.rexxTest("no method on echo")
				.script("address echo\nsay lookup('k')")
				.expectThrow(RexxCondition.class)
				.run();
		result.assertExpected();
		assertEquals(RexxCondition.ROUTINE_NOT_FOUND, ((RexxCondition) result.thrownException()).getCode());
	}

	@Test
	public void testRoutineInheritsAddressButNotBack() throws Exception {
		RexxTestSupport
				.rexxTest("address in routine")
				.script("address echo\ncall sub\nsay address()\nexit\nsub:\n  say address()\n  address\n  return")
				.expectLines("echo", "echo")
				.runAndAssert();
	}
}
