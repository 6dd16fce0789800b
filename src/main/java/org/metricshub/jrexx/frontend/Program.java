package org.metricshub.jrexx.frontend;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jrexx.frontend.ast.Statement;

/**
 * A parsed script: its top-level statements and the index of each label.
 * Programs are immutable and can be executed any number of times.
 */
public final class Program {

	private final String description;
	private final List<Statement> statements;
	private final Map<String, Integer> labels;

	Program(String description, List<Statement> statements, Map<String, Integer> labels) {
		this.description = description;
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
		this.labels = Collections.unmodifiableMap(new HashMap<String, Integer>(labels));
	}

	/**
	 * @return description of the script source
	 */
	public String getDescription() {
		return description;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	/**
	 * @param name upper-case label name
	 * @return index of the label statement in {@link #getStatements()}, or -1
	 */
	public int labelIndex(String name) {
		Integer index = labels.get(name);
		return index == null ? -1 : index.intValue();
	}

	/**
	 * @param name upper-case label name
	 * @return {@code true} when the program defines the label
	 */
	public boolean hasLabel(String name) {
		return labels.containsKey(name);
	}

	/**
	 * Prints the syntax tree.
	 *
	 * @param out destination
	 */
	public void dump(PrintStream out) {
		for (Statement statement : statements) {
			statement.dump(out, 0);
		}
	}
}
