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

/**
 * A target registered under a name, optionally with default credentials and
 * the canonical id of the module that provided it.
 */
public final class AddressRegistration {

	private final String name;
	private final AddressTarget target;
	private final AuthContext auth;
	private final String canonicalId;

	/**
	 * @param name name scripts select the target with
	 * @param target the target
	 * @param auth default credentials, may be {@code null}
	 * @param canonicalId id of the providing module, {@code null} for host registrations
	 */
	public AddressRegistration(String name, AddressTarget target, AuthContext auth, String canonicalId) {
		this.name = name;
		this.target = target;
		this.auth = auth;
		this.canonicalId = canonicalId;
	}

	public String getName() {
		return name;
	}

	public AddressTarget getTarget() {
		return target;
	}

	public AuthContext getAuth() {
		return auth;
	}

	public String getCanonicalId() {
		return canonicalId;
	}

	@Override
	public String toString() {
		return name + (canonicalId == null ? "" : " (" + canonicalId + ")");
	}
}
