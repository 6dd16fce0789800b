package org.metricshub.jrexx.frontend.ast;

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

/**
 * Base class of syntax tree nodes. Every node remembers the line it starts
 * on, so that runtime conditions can point at the source.
 */
public abstract class AstNode {

	private final int line;

	protected AstNode(int line) {
		this.line = line;
	}

	/**
	 * @return 1-based source line where the node starts
	 */
	public int getLine() {
		return line;
	}

	/**
	 * Prints the node and its children, one node per line.
	 *
	 * @param out destination
	 * @param indent nesting depth
	 */
	public abstract void dump(PrintStream out, int indent);

	/**
	 * Prints the node and its children.
	 *
	 * @param out destination
	 */
	public void dump(PrintStream out) {
		dump(out, 0);
	}

	protected static void printIndent(PrintStream out, int indent) {
		for (int i = 0; i < indent; i++) {
			out.print("  ");
		}
	}
}
