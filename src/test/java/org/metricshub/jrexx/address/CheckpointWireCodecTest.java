package org.metricshub.jrexx.address;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class CheckpointWireCodecTest {

	private final CheckpointWireCodec codec = new CheckpointWireCodec();

	@Test
	public void testEncodeRequest() {
		Map<String, Object> parameters = new LinkedHashMap<String, Object>();
		parameters.put("command", "select '<a>'");
		parameters.put("auth", "secret");
		String json = codec.encodeRequest(new CheckpointRequest("cp-3", "db", parameters));
		assertEquals("{\"requestId\":\"cp-3\",\"operation\":\"db\",\"parameters\":{\"command\":\"select '<a>'\",\"auth\":\"secret\"}}", json);

		CheckpointRequest decoded = codec.decodeRequest(json);
		assertEquals("cp-3", decoded.getRequestId());
		assertEquals("db", decoded.getOperation());
		assertEquals(parameters, decoded.getParameters());
	}

	@Test
	public void testDecodeRequestWithoutParameters() {
		CheckpointRequest request = codec.decodeRequest("{\"requestId\":\"cp-1\",\"operation\":\"db\"}");
		assertTrue(request.getParameters().isEmpty());
	}

	@Test
	public void testEncodeResponses() {
		assertEquals("{\"requestId\":\"cp-1\",\"status\":\"done\",\"result\":\"row\"}", codec.encodeResponse(CheckpointResponse.done("cp-1", "row")));
		assertEquals("{\"requestId\":\"cp-2\",\"status\":\"error\",\"error\":\"denied\"}", codec.encodeResponse(CheckpointResponse.error("cp-2", "denied")));
	}

	@Test
	public void testDecodeStructuredResult() {
		CheckpointResponse response = codec
				.decodeResponse("{\"requestId\":\"cp-9\",\"status\":\"DONE\",\"result\":{\"success\":true,\"rows\":[1,2]}}");
		assertEquals(CheckpointStatus.DONE, response.getStatus());
		Map<?, ?> result = (Map<?, ?>) response.getResult();
		assertEquals(Boolean.TRUE, result.get("success"));
		assertEquals(2, ((List<?>) result.get("rows")).size());
		assertNull(response.getError());
	}

	@Test
	public void testDecodeError() {
		CheckpointResponse response = codec.decodeResponse("{\"requestId\":\"cp-4\",\"status\":\"error\",\"error\":\"timeout on host\"}");
		assertEquals(CheckpointStatus.ERROR, response.getStatus());
		assertEquals("timeout on host", response.getError());
		assertNull(response.getResult());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsArray() {
		codec.decodeResponse("[1, 2]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsMalformedJson() {
		codec.decodeResponse("{\"requestId\": ");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsMissingId() {
		codec.decodeResponse("{\"status\":\"done\"}");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsUnknownStatus() {
		codec.decodeResponse("{\"requestId\":\"cp-1\",\"status\":\"pending\"}");
	}
}
