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
package nwk.trees.io;

/**
 * Rewrites raw Newick records into a text that can be split by the NewickLexer.
 * Comments are enclosed by C style block comment markers, single quotes are replaced by double quotes
 * and branch lengths are quoted so that they are read as a single token
 * @author Jorge Duitama
 *
 */
public class NewickTextNormalizer {
	public static final char STRING_DELIMITER = '"';
	public static final String COMMENT_START = "/*";
	public static final String COMMENT_END = "*/";
	public static final char NEWICK_QUOTE = '\'';
	public static final char NEWICK_COMMENT_START = '[';
	public static final char NEWICK_COMMENT_END = ']';
	public static final char LENGTH_SEPARATOR = ':';

	/**
	 * Normalizes one Newick record
	 * @param record Raw record, usually ending with a semicolon
	 * @return String normalized text
	 */
	public static String normalize(String record) {
		char [] a = record.toCharArray();
		StringBuilder answer = new StringBuilder(a.length+16);
		boolean inQuote = false;
		boolean inComment = false;
		boolean inNumber = false;
		boolean emptyNumber = false;
		for (int i=0;i<a.length;i++) {
			char c = a[i];
			if(inComment) {
				if(c == NEWICK_COMMENT_END) {
					answer.append(COMMENT_END);
					inComment = false;
				} else {
					answer.append(c);
				}
				continue;
			}
			if(inQuote) {
				if(c == NEWICK_QUOTE) {
					if(i+1<a.length && a[i+1]==NEWICK_QUOTE) {
						//Two quotes within a quoted label denote a literal quote
						answer.append(NEWICK_QUOTE);
						i++;
					} else {
						answer.append(STRING_DELIMITER);
						inQuote = false;
					}
				} else if (c == STRING_DELIMITER || c == '\\') {
					answer.append('\\');
					answer.append(c);
				} else {
					answer.append(c);
				}
				continue;
			}
			if(inNumber) {
				if(emptyNumber && Character.isWhitespace(c)) continue;
				if(endsNumber(c)) {
					answer.append(STRING_DELIMITER);
					inNumber = false;
				} else {
					answer.append(c);
					emptyNumber = false;
					continue;
				}
			}
			if(c == LENGTH_SEPARATOR) {
				answer.append(STRING_DELIMITER);
				answer.append(c);
				inNumber = true;
				emptyNumber = true;
			} else if (c == NEWICK_QUOTE) {
				answer.append(STRING_DELIMITER);
				inQuote = true;
			} else if (c == NEWICK_COMMENT_START) {
				answer.append(COMMENT_START);
				inComment = true;
			} else if (c == STRING_DELIMITER) {
				//Keep a stray double quote as a one character label
				answer.append(STRING_DELIMITER).append('\\').append(c).append(STRING_DELIMITER);
			} else {
				answer.append(c);
			}
		}
		if(inNumber) answer.append(STRING_DELIMITER);
		return answer.toString();
	}

	private static boolean endsNumber(char c) {
		return c == ',' || c == ';' || c == ')' || c == NEWICK_COMMENT_START || Character.isWhitespace(c);
	}
}
