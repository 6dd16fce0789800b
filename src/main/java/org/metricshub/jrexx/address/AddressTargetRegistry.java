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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jrexx.util.RexxLogger;
import org.slf4j.Logger;

/**
 * Address targets by case-insensitive name. One registry belongs to one
 * {@code Rexx} instance unless the host passes the same registry to several.
 */
public final class AddressTargetRegistry {

	private static final Logger LOG = RexxLogger.getLogger(AddressTargetRegistry.class);

	private final ConcurrentMap<String, AddressRegistration> targets = new ConcurrentHashMap<String, AddressRegistration>();

	/**
	 * @return a registry holding the targets every interpreter provides
	 */
	public static AddressTargetRegistry withBuiltins() {
		AddressTargetRegistry registry = new AddressTargetRegistry();
		registry.register(new EchoAddressTarget());
		return registry;
	}

	private static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Registers a target under its own name, replacing any previous one.
	 *
	 * @param target the target
	 * @return the registration
	 */
	public AddressRegistration register(AddressTarget target) {
		return register(new AddressRegistration(target.getName(), target, null, null));
	}

	/**
	 * Registers a target under the given name, replacing any previous one.
	 *
	 * @param name name scripts select the target with
	 * @param target the target
	 * @return the registration
	 */
	public AddressRegistration register(String name, AddressTarget target) {
		return register(new AddressRegistration(name, target, null, null));
	}

	/**
	 * @param registration registration to add, replacing any previous one with the same name
	 * @return the registration
	 */
	public AddressRegistration register(AddressRegistration registration) {
		if (registration.getName() == null || registration.getName().isEmpty()) {
			throw new IllegalArgumentException("Address target name must not be empty");
		}
		AddressRegistration previous = targets.put(key(registration.getName()), registration);
		if (previous != null && previous.getTarget() != registration.getTarget()) {
			LOG.debug("Address target {} replaced", registration.getName());
		} else {
			LOG.debug("Address target {} registered", registration.getName());
		}
		return registration;
	}

	/**
	 * Registers another name for an existing target, with its own credentials.
	 *
	 * @param alias new name
	 * @param base registration the alias refers to
	 * @param auth credentials of the alias, {@code null} to keep the base ones
	 * @return the alias registration
	 */
	public AddressRegistration registerAlias(String alias, AddressRegistration base, AuthContext auth) {
		return register(new AddressRegistration(alias, base.getTarget(), auth == null ? base.getAuth() : auth, base.getCanonicalId()));
	}

	/**
	 * @param name case-insensitive target name
	 * @return the registration, or {@code null} when unknown
	 */
	public AddressRegistration resolve(String name) {
		return name == null ? null : targets.get(key(name));
	}

	/**
	 * @param name case-insensitive target name
	 * @return {@code true} when a target is registered under that name
	 */
	public boolean contains(String name) {
		return resolve(name) != null;
	}

	/**
	 * @return registered names, sorted
	 */
	public List<String> names() {
		List<String> names = new ArrayList<String>();
		for (AddressRegistration registration : targets.values()) {
			names.add(registration.getName());
		}
		Collections.sort(names);
		return names;
	}
}
