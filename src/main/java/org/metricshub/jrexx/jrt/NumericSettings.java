package org.metricshub.jrexx.jrt;

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

import java.math.MathContext;
import java.math.RoundingMode;

/**
 * The <code>NUMERIC</code> state of a call frame: the number of significant
 * digits kept by arithmetic, the fuzz digits ignored by numeric comparisons,
 * and the exponential notation form.
 */
public final class NumericSettings {

	/** Default number of significant digits. */
	public static final int DEFAULT_DIGITS = 9;

	/** Exponential notation styles. */
	public enum Form {
		SCIENTIFIC,
		ENGINEERING
	}

	private int digits;
	private int fuzz;
	private Form form;

	/**
	 * Creates settings with the default values (9 digits, fuzz 0, scientific).
	 */
	public NumericSettings() {
		this(DEFAULT_DIGITS, 0, Form.SCIENTIFIC);
	}

	/**
	 * Creates settings with explicit values.
	 *
	 * @param digits significant digits, at least 1
	 * @param fuzz fuzz digits, between 0 and digits - 1
	 * @param form exponential notation form
	 */
	public NumericSettings(int digits, int fuzz, Form form) {
		validate(digits, fuzz);
		this.digits = digits;
		this.fuzz = fuzz;
		this.form = form;
	}

	private static void validate(int digits, int fuzz) {
		if (digits < 1) {
			throw RexxCondition.syntax(RexxCondition.INVALID_NUMERIC, "NUMERIC DIGITS must be positive, not " + digits);
		}
		if (fuzz < 0 || fuzz >= digits) {
			throw RexxCondition
					.syntax(
							RexxCondition.INVALID_NUMERIC,
							"NUMERIC FUZZ " + fuzz + " must be between 0 and DIGITS - 1 (" + (digits - 1) + ")");
		}
	}

	/**
	 * @return an independent copy of these settings
	 */
	public NumericSettings copy() {
		return new NumericSettings(digits, fuzz, form);
	}

	public int getDigits() {
		return digits;
	}

	/**
	 * Sets the significant digits.
	 *
	 * @param digits new value, must stay greater than the current fuzz
	 */
	public void setDigits(int digits) {
		validate(digits, fuzz);
		this.digits = digits;
	}

	public int getFuzz() {
		return fuzz;
	}

	/**
	 * Sets the fuzz digits.
	 *
	 * @param fuzz new value, must be lower than the current digits
	 */
	public void setFuzz(int fuzz) {
		validate(digits, fuzz);
		this.fuzz = fuzz;
	}

	public Form getForm() {
		return form;
	}

	public void setForm(Form form) {
		this.form = form;
	}

	/**
	 * @return math context rounding to the current digits
	 */
	public MathContext mathContext() {
		return new MathContext(digits, RoundingMode.HALF_UP);
	}

	/**
	 * @return math context used by numeric comparisons (digits minus fuzz)
	 */
	public MathContext comparisonContext() {
		return new MathContext(digits - fuzz, RoundingMode.HALF_UP);
	}
}
