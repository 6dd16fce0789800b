package org.metricshub.jrexx.address;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.jrt.RexxValue;

/**
 * Target whose commands and method calls are answered out of process. Each
 * invocation becomes a checkpoint request named after the target, carrying
 * <code>method</code> (or <code>command</code>) and the invocation parameters.
 * <p>
 * A <code>done</code> response whose result is an object with a
 * <code>success</code> member is read as a full result (<code>success</code>,
 * <code>output</code>, <code>status</code>, <code>error</code>); any other result
 * is the output.
 */
public class CheckpointAddressTarget implements AddressTarget {

	private static final CheckpointWireCodec CODEC = new CheckpointWireCodec();

	private final String name;

	/**
	 * @param name target name, also the operation of every request
	 */
	public CheckpointAddressTarget(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public boolean supportsMethodCall() {
		return true;
	}

	@Override
	public AddressReply handle(AddressInvocation invocation) {
		CheckpointBroker broker = invocation.getBroker();
		if (broker == null) {
			return AddressReply.immediate(AddressResult.unavailable("No checkpoint broker is configured for ADDRESS " + name));
		}
		Map<String, Object> parameters = new LinkedHashMap<String, Object>();
		if (invocation.getKind() == AddressInvocation.Kind.METHOD) {
			parameters.put("method", invocation.getName());
		}
		for (Map.Entry<String, RexxValue> entry : invocation.getParameters().entrySet()) {
			parameters.put(entry.getKey(), entry.getValue().asString());
		}
		if (invocation.getAuth() != null) {
			parameters.put("auth", invocation.getAuth().getCredential());
		}
		PendingCheckpoint pending = invocation.getCheckpointTimeout() == null
				? broker.issue(name, parameters)
				: broker.issue(name, parameters, invocation.getCheckpointTimeout());
		return AddressReply.checkpoint(pending);
	}

	/**
	 * Maps a checkpoint response onto a dispatch result.
	 *
	 * @param response the response
	 * @return the result
	 */
	static AddressResult toResult(CheckpointResponse response) {
		if (response.getStatus() == CheckpointStatus.ERROR) {
			return AddressResult.failure(1, response.getError() == null ? "Checkpoint " + response.getRequestId() + " failed" : response.getError());
		}
		Object result = response.getResult();
		if (result instanceof Map && ((Map<?, ?>) result).containsKey("success")) {
			Map<?, ?> shape = (Map<?, ?>) result;
			String output = text(shape.get("output"));
			if (Boolean.TRUE.equals(shape.get("success")) || "true".equals(String.valueOf(shape.get("success")))) {
				return AddressResult.success(output);
			}
			Object status = shape.get("status");
			int code = status instanceof Number ? ((Number) status).intValue() : 1;
			return AddressResult.failure(code, text(shape.get("error")));
		}
		return AddressResult.success(text(result));
	}

	private static String text(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Map || value instanceof List) {
			return CODEC.toJson(value);
		}
		return RexxValue.fromObject(value).asString();
	}
}
