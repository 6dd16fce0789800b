package org.metricshub.jrexx.address;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import org.junit.Before;
import org.junit.Test;

public class CheckpointBrokerTest {

	private final List<CheckpointRequest> sent = Collections.synchronizedList(new ArrayList<CheckpointRequest>());
	private CheckpointBroker broker;

	@Before
	public void setUp() {
		broker = new CheckpointBroker(sent::add);
	}

	private static Map<String, Object> parameters(String key, Object value) {
		Map<String, Object> parameters = new LinkedHashMap<String, Object>();
		parameters.put(key, value);
		return parameters;
	}

	@Test
	public void testIssueSendsRequestWithFreshIds() {
		PendingCheckpoint first = broker.issue("db", parameters("command", "a"));
		PendingCheckpoint second = broker.issue("db", parameters("command", "b"));
		assertEquals("cp-1", first.getRequestId());
		assertEquals("cp-2", second.getRequestId());
		assertEquals(2, sent.size());
		assertEquals("a", sent.get(0).getParameters().get("command"));
		assertNull(first.getDeadline());
		assertEquals(2, broker.getOutstandingCount());
	}

	@Test
	public void testDeliverOutOfOrder() {
		PendingCheckpoint first = broker.issue("db", parameters("command", "a"));
		PendingCheckpoint second = broker.issue("db", parameters("command", "b"));

		assertTrue(broker.deliver(CheckpointResponse.done(second.getRequestId(), "B")));
		assertTrue(second.isDone());
		assertFalse(first.isDone());
		assertTrue(broker.deliver(CheckpointResponse.done(first.getRequestId(), "A")));
		assertEquals("A", first.getCompletion().join().getResult());
		assertEquals("B", second.getCompletion().join().getResult());
		assertEquals(0, broker.getOutstandingCount());
	}

	@Test
	public void testLateAndUnknownResponses() {
		PendingCheckpoint pending = broker.issue("db", parameters("command", "a"));
		assertFalse(broker.deliver(CheckpointResponse.done("cp-42", "?")));
		assertTrue(broker.deliver(CheckpointResponse.error(pending.getRequestId(), "boom")));
		assertFalse(broker.deliver(CheckpointResponse.done(pending.getRequestId(), "again")));
		assertEquals(CheckpointStatus.ERROR, pending.getCompletion().join().getStatus());
	}

	@Test
	public void testCancel() {
		PendingCheckpoint pending = broker.issue("db", parameters("command", "a"));
		assertTrue(broker.cancel(pending.getRequestId(), "shutdown"));
		assertFalse(broker.cancel(pending.getRequestId(), "shutdown"));
		try {
			pending.getCompletion().join();
			fail("cancelled checkpoint completed normally");
		} catch (CompletionException e) {
			assertTrue(e.getCause() instanceof CheckpointException);
			assertEquals("Checkpoint cp-1 cancelled: shutdown", e.getCause().getMessage());
		}
		assertFalse(broker.deliver(CheckpointResponse.done(pending.getRequestId(), "late")));
	}

	@Test
	public void testTimeout() {
		PendingCheckpoint pending = broker.issue("db", parameters("command", "a"), Duration.ofMillis(20));
		assertNotNull(pending.getDeadline());
		try {
			pending.getCompletion().join();
			fail("checkpoint never timed out");
		} catch (CompletionException e) {
			assertTrue(e.getCause() instanceof TimeoutException);
		}
		assertFalse(broker.deliver(CheckpointResponse.done(pending.getRequestId(), "late")));
	}

	@Test
	public void testDefaultTimeoutAndExpireOverdue() throws Exception {
		broker = new CheckpointBroker(sent::add, Duration.ofHours(1));
		PendingCheckpoint pending = broker.issue("db", parameters("command", "a"));
		assertEquals(Duration.ofHours(1), broker.getDefaultTimeout());
		assertEquals(0, broker.expireOverdue());

		PendingCheckpoint overdue = broker.issue("db", parameters("command", "b"), Duration.ofMillis(1));
		Thread.sleep(5);
		broker.expireOverdue();
		assertTrue(overdue.isDone());
		assertFalse(pending.isDone());
	}

	@Test
	public void testTransportFailure() {
		broker = new CheckpointBroker(request -> {
			throw new IllegalStateException("socket closed");
		});
		PendingCheckpoint pending = broker.issue("db", parameters("command", "a"));
		assertTrue(pending.getCompletion().isCompletedExceptionally());
		AddressResult result = AddressReply.checkpoint(pending).getCompletion().join();
		assertTrue(result.isUnavailable());
		assertEquals("Checkpoint cp-1 could not be sent: socket closed", result.getError());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTransportIsRequired() {
		new CheckpointBroker(null);
	}

	@Test
	public void testResponseMapping() {
		assertEquals("rows", CheckpointAddressTarget.toResult(CheckpointResponse.done("cp-1", "rows")).getOutput());
		assertEquals("[1,2]", CheckpointAddressTarget.toResult(CheckpointResponse.done("cp-1", java.util.Arrays.asList(1, 2))).getOutput());

		Map<String, Object> ok = new LinkedHashMap<String, Object>();
		ok.put("success", Boolean.TRUE);
		ok.put("output", "3 rows");
		AddressResult success = CheckpointAddressTarget.toResult(CheckpointResponse.done("cp-1", ok));
		assertTrue(success.isSuccess());
		assertEquals("3 rows", success.getOutput());

		Map<String, Object> ko = new LinkedHashMap<String, Object>();
		ko.put("success", "false");
		ko.put("error", "locked");
		AddressResult failure = CheckpointAddressTarget.toResult(CheckpointResponse.done("cp-1", ko));
		assertFalse(failure.isSuccess());
		assertEquals(1, failure.getStatus());
		assertEquals("locked", failure.getError());

		AddressResult error = CheckpointAddressTarget.toResult(CheckpointResponse.error("cp-7", null));
		assertEquals("Checkpoint cp-7 failed", error.getError());
		assertFalse(error.isUnavailable());
	}
}
