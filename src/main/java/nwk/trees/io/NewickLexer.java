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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits normalized Newick text into tokens. See NewickTextNormalizer for the expected input
 * @author Jorge Duitama
 *
 */
public class NewickLexer {

	/**
	 * Splits the given normalized text
	 * @param text Output of NewickTextNormalizer
	 * @return List<NewickToken> tokens in order of appearance. Comments and whitespace are discarded
	 * @throws NewickFormatException If a comment or a quoted text is not terminated or if a quoted text has malformed escapes
	 */
	public static List<NewickToken> tokenize(String text) throws NewickFormatException {
		List<NewickToken> tokens = new ArrayList<>();
		int n = text.length();
		int i = 0;
		while (i<n) {
			char c = text.charAt(i);
			if(Character.isWhitespace(c)) {
				i++;
			} else if (text.startsWith(NewickTextNormalizer.COMMENT_START, i)) {
				int end = text.indexOf(NewickTextNormalizer.COMMENT_END, i+2);
				if(end<0) throw new NewickFormatException("Unterminated comment", i);
				i = end+2;
			} else if (c == '(') {
				tokens.add(new NewickToken(NewickToken.Type.OPEN, "(", i++));
			} else if (c == ')') {
				tokens.add(new NewickToken(NewickToken.Type.CLOSE, ")", i++));
			} else if (c == ',') {
				tokens.add(new NewickToken(NewickToken.Type.COMMA, ",", i++));
			} else if (c == ';') {
				tokens.add(new NewickToken(NewickToken.Type.END, ";", i++));
			} else if (c == NewickTextNormalizer.STRING_DELIMITER) {
				int end = findStringEnd(text, i);
				String value = unquote(text, i+1, end);
				NewickToken.Type type = NewickToken.Type.LABEL;
				if(value.length()>0 && value.charAt(0)==NewickTextNormalizer.LENGTH_SEPARATOR) type = NewickToken.Type.LENGTH;
				tokens.add(new NewickToken(type, value, i));
				i = end+1;
			} else {
				int start = i;
				while (i<n && !endsFragment(text,i)) i++;
				String fragment = text.substring(start,i).replace('_', ' ');
				tokens.add(new NewickToken(NewickToken.Type.LABEL, fragment, start));
			}
		}
		return tokens;
	}

	private static boolean endsFragment(String text, int i) {
		char c = text.charAt(i);
		if (Character.isWhitespace(c)) return true;
		if (c == '(' || c == ')' || c == ',' || c == ';' || c == NewickTextNormalizer.STRING_DELIMITER) return true;
		return text.startsWith(NewickTextNormalizer.COMMENT_START, i);
	}

	private static int findStringEnd(String text, int start) throws NewickFormatException {
		for (int i=start+1;i<text.length();i++) {
			char c = text.charAt(i);
			if(c == '\\') i++;
			else if (c == NewickTextNormalizer.STRING_DELIMITER) return i;
		}
		throw new NewickFormatException("Unterminated quoted text", start);
	}

	/**
	 * Resolves the escape sequences of a quoted text
	 * @param text Text containing the quoted span
	 * @param start First position after the opening delimiter
	 * @param end Position of the closing delimiter
	 * @return String unquoted text
	 * @throws NewickFormatException If an escape sequence is malformed
	 */
	static String unquote(String text, int start, int end) throws NewickFormatException {
		StringBuilder answer = new StringBuilder(end-start);
		for (int i=start;i<end;i++) {
			char c = text.charAt(i);
			if(c!='\\') {
				answer.append(c);
				continue;
			}
			i++;
			if(i>=end) throw new NewickFormatException("Incomplete escape sequence", i-1);
			char e = text.charAt(i);
			switch (e) {
			case '"':
			case '\'':
			case '\\':
				answer.append(e);
				break;
			case 'n':
				answer.append('\n');
				break;
			case 't':
				answer.append('\t');
				break;
			case 'r':
				answer.append('\r');
				break;
			case 'b':
				answer.append('\b');
				break;
			case 'f':
				answer.append('\f');
				break;
			case 'u':
				if(i+4>=end) throw new NewickFormatException("Incomplete unicode escape", i-1);
				int code = 0;
				for (int j=i+1;j<=i+4;j++) {
					int digit = Character.digit(text.charAt(j), 16);
					if(digit<0) throw new NewickFormatException("Malformed unicode escape "+text.substring(i-1, i+5), i-1);
					code = 16*code+digit;
				}
				answer.append((char)code);
				i+=4;
				break;
			default:
				throw new NewickFormatException("Unknown escape sequence \\"+e, i-1);
			}
		}
		return answer.toString();
	}
}
