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

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

import nwk.main.io.ParseUtils;
import nwk.trees.NewickNode;

/**
 * Writes trees in Newick format
 * @author Jorge Duitama
 *
 */
public class NewickTreeWriter {
	public static final int DEF_LENGTH_SIGNIFICANT_DIGITS = 3;
	/**
	 * Characters that force a label to be written between single quotes
	 */
	public static final String QUOTE_TRIGGER_CHARS = "(),:;[]'_\"";

	private int lengthSignificantDigits = DEF_LENGTH_SIGNIFICANT_DIGITS;
	private boolean writeRootLength = false;

	public int getLengthSignificantDigits() {
		return lengthSignificantDigits;
	}
	public void setLengthSignificantDigits(int lengthSignificantDigits) {
		if (lengthSignificantDigits < 1) throw new IllegalArgumentException("Significant digits must be positive. Given: "+lengthSignificantDigits);
		this.lengthSignificantDigits = lengthSignificantDigits;
	}

	public boolean isWriteRootLength() {
		return writeRootLength;
	}
	/**
	 * @param writeRootLength If true, the branch length of the root is written when it is available
	 */
	public void setWriteRootLength(boolean writeRootLength) {
		this.writeRootLength = writeRootLength;
	}

	/**
	 * Writes the given tree followed by a new line
	 * @param root Root of the tree to write
	 * @param out Stream to write
	 */
	public void printTree(NewickNode root, PrintStream out) {
		out.println(write(root));
	}

	/**
	 * Writes the given node in Newick format. If the node is the root, the output is the complete tree.
	 * Otherwise the output includes the following siblings of the node and the parenthesis that closes
	 * the list of children of the parent
	 * @param v Node to write
	 * @return String Newick text
	 */
	public String write(NewickNode v) {
		StringBuilder out = new StringBuilder();
		Deque<NewickNode> nodes = new ArrayDeque<>();
		Deque<Integer> stages = new ArrayDeque<>();
		nodes.push(v);
		stages.push(0);
		while (!nodes.isEmpty()) {
			NewickNode x = nodes.peek();
			int stage = stages.pop();
			NewickNode parent = x.getParent();
			if (stage == 0) {
				if (parent != null && !parent.getFirstChild().isSameNode(x)) out.append(',');
				stages.push(1);
				if (x.getFirstChild() != null) {
					out.append('(');
					nodes.push(x.getFirstChild());
					stages.push(0);
				}
			} else if (stage == 1) {
				writeLabel(x, out);
				stages.push(2);
				if (x.getNextSibling() != null) {
					nodes.push(x.getNextSibling());
					stages.push(0);
				}
			} else {
				if (parent != null && x.getNextSibling() == null) out.append(')');
				if (parent == null) out.append(';');
				nodes.pop();
			}
		}
		return out.toString();
	}

	private void writeLabel(NewickNode v, StringBuilder out) {
		out.append(encodeLabel(v.getLabel()));
		if (v.hasLength() && (v.getParent() != null || writeRootLength)) {
			out.append(':');
			out.append(ParseUtils.formatSignificantDigits(v.getLength(), lengthSignificantDigits));
		}
	}

	/**
	 * Encodes a label. Labels with characters that have a meaning in Newick are quoted doubling the
	 * single quotes. Otherwise, spaces are replaced by underscores
	 * @param label Label to encode
	 * @return String encoded label
	 */
	public static String encodeLabel(String label) {
		if (needsQuotes(label)) {
			return "'"+label.replace("'", "''")+"'";
		}
		return label.replace(' ', '_');
	}

	private static boolean needsQuotes(String label) {
		for (int i=0;i<label.length();i++) {
			char c = label.charAt(i);
			if (QUOTE_TRIGGER_CHARS.indexOf(c)>=0) return true;
			//The lexer splits unquoted labels at any whitespace
			if (c != ' ' && Character.isWhitespace(c)) return true;
		}
		return label.contains(NewickTextNormalizer.COMMENT_START);
	}
}
