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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of checkpoint messages:
 * <pre>
 * request:  { "requestId": "cp-1", "operation": "sql", "parameters": { ... } }
 * response: { "requestId": "cp-1", "status": "done"|"error", "result": ..., "error": "..." }
 * </pre>
 */
public final class CheckpointWireCodec {

	private static final Type PARAMETERS_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

	private final Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

	/**
	 * @param request request to encode
	 * @return the JSON text
	 */
	public String encodeRequest(CheckpointRequest request) {
		JsonObject json = new JsonObject();
		json.addProperty("requestId", request.getRequestId());
		json.addProperty("operation", request.getOperation());
		json.add("parameters", gson.toJsonTree(request.getParameters()));
		return gson.toJson(json);
	}

	/**
	 * @param text JSON text
	 * @return the request
	 * @throws IllegalArgumentException when the text is not a request
	 */
	public CheckpointRequest decodeRequest(String text) {
		JsonObject json = parseObject(text);
		Map<String, Object> parameters = json.has("parameters") && !json.get("parameters").isJsonNull()
				? gson.<Map<String, Object>>fromJson(json.get("parameters"), PARAMETERS_TYPE)
				: new LinkedHashMap<String, Object>();
		return new CheckpointRequest(requiredString(json, "requestId"), requiredString(json, "operation"), parameters);
	}

	/**
	 * @param response response to encode
	 * @return the JSON text
	 */
	public String encodeResponse(CheckpointResponse response) {
		JsonObject json = new JsonObject();
		json.addProperty("requestId", response.getRequestId());
		json.addProperty("status", response.getStatus().getWireName());
		if (response.getStatus() == CheckpointStatus.DONE) {
			json.add("result", gson.toJsonTree(response.getResult()));
		} else {
			json.addProperty("error", response.getError());
		}
		return gson.toJson(json);
	}

	/**
	 * @param text JSON text
	 * @return the response; JSON objects in <code>result</code> become maps,
	 *         arrays become lists and numbers become doubles
	 * @throws IllegalArgumentException when the text is not a response
	 */
	public CheckpointResponse decodeResponse(String text) {
		JsonObject json = parseObject(text);
		CheckpointStatus status = CheckpointStatus.fromWireName(requiredString(json, "status"));
		Object result = json.has("result") ? gson.fromJson(json.get("result"), Object.class) : null;
		String error = json.has("error") && !json.get("error").isJsonNull() ? json.get("error").getAsString() : null;
		return new CheckpointResponse(requiredString(json, "requestId"), status, result, error);
	}

	/**
	 * @param value any result payload
	 * @return its JSON text
	 */
	public String toJson(Object value) {
		return gson.toJson(value);
	}

	private static JsonObject parseObject(String text) {
		try {
			JsonElement element = JsonParser.parseString(text);
			if (!element.isJsonObject()) {
				throw new IllegalArgumentException("Checkpoint message must be a JSON object: " + text);
			}
			return element.getAsJsonObject();
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Invalid checkpoint message: " + e.getMessage(), e);
		}
	}

	private static String requiredString(JsonObject json, String name) {
		JsonElement element = json.get(name);
		if (element == null || element.isJsonNull()) {
			throw new IllegalArgumentException("Checkpoint message has no " + name);
		}
		return element.getAsString();
	}
}
