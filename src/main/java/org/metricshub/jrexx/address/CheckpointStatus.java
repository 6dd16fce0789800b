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

import java.util.Locale;

/**
 * Status of a {@link CheckpointResponse}, written in lower case on the wire.
 */
public enum CheckpointStatus {
	DONE("done"),
	ERROR("error");

	private final String wireName;

	CheckpointStatus(String wireName) {
		this.wireName = wireName;
	}

	public String getWireName() {
		return wireName;
	}

	/**
	 * @param wireName <code>done</code> or <code>error</code>, any case
	 * @return the status
	 * @throws IllegalArgumentException for any other value
	 */
	public static CheckpointStatus fromWireName(String wireName) {
		if (wireName != null) {
			String lower = wireName.toLowerCase(Locale.ROOT);
			for (CheckpointStatus status : values()) {
				if (status.wireName.equals(lower)) {
					return status;
				}
			}
		}
		throw new IllegalArgumentException("Unknown checkpoint status: " + wireName);
	}
}
