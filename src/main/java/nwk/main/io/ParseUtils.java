/*******************************************************************************
 * NWK - Newick trees parsing and manipulation
 * Copyright 2016 Jorge Duitama
 *
 * This file is part of NWK.
 *
 *     NWK is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     NWK is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with NWK.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package nwk.main.io;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

public class ParseUtils {
	private static final Pattern DECIMAL_NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

	/**
	 * Checks if the given text is a signed decimal number, optionally in scientific notation.
	 * Unlike Double.parseDouble, suffixes such as d or f and hexadecimal literals are rejected
	 * @param s Text to check
	 * @return boolean true if the text is a decimal number
	 */
	public static boolean isDecimalNumber(String s) {
		return DECIMAL_NUMBER.matcher(s).matches();
	}

	/**
	 * Formats the given number keeping at most the given number of significant digits.
	 * Trailing zeros are removed and scientific notation is used only for very small or large exponents
	 * (0.2, 47, 0.333, 1.23e+03, 1e-05)
	 * @param value Number to format
	 * @param significantDigits Maximum number of significant digits
	 * @return String formatted number
	 */
	public static String formatSignificantDigits(double value, int significantDigits) {
		if (significantDigits < 1) throw new IllegalArgumentException("Number of significant digits must be positive. Given: "+significantDigits);
		if (Double.isNaN(value)) return "NaN";
		if (Double.isInfinite(value)) return value > 0 ? "+Inf" : "-Inf";
		if (value == 0) return (1/value < 0) ? "-0" : "0";
		BigDecimal rounded = new BigDecimal(value).round(new MathContext(significantDigits, RoundingMode.HALF_EVEN)).stripTrailingZeros();
		int digits = rounded.precision();
		int exponent = digits - rounded.scale() - 1;
		if (exponent < -4 || exponent >= significantDigits) {
			BigDecimal mantissa = rounded.movePointLeft(exponent);
			StringBuilder answer = new StringBuilder(mantissa.toPlainString());
			answer.append('e');
			answer.append(exponent < 0 ? '-' : '+');
			int absExp = Math.abs(exponent);
			if (absExp < 10) answer.append('0');
			answer.append(absExp);
			return answer.toString();
		}
		return rounded.toPlainString();
	}
}
