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

import java.util.List;
import java.util.logging.Logger;

import nwk.main.io.ParseUtils;
import nwk.trees.NewickNode;
import nwk.trees.NodeIdGenerator;

/**
 * Builds trees from Newick tokens moving a single cursor over the nodes being created
 * @author Jorge Duitama
 *
 */
public class NewickTreeBuilder {

	private Logger log = Logger.getLogger(NewickTreeBuilder.class.getName());

	private final NodeIdGenerator ids;

	public NewickTreeBuilder() {
		this(new NodeIdGenerator());
	}

	/**
	 * @param ids Generator for the ids of the nodes created by this builder
	 */
	public NewickTreeBuilder(NodeIdGenerator ids) {
		if (ids == null) throw new NullPointerException("Id generator can not be null");
		this.ids = ids;
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public NodeIdGenerator getIds() {
		return ids;
	}

	/**
	 * Parses a single raw Newick record
	 * @param record Raw text of the tree terminated by a semicolon
	 * @return NewickNode root of the tree. null if the record does not have an opening parenthesis
	 * @throws NewickFormatException If the record is malformed
	 */
	public NewickNode parse(String record) throws NewickFormatException {
		String normalized = NewickTextNormalizer.normalize(record);
		List<NewickToken> tokens = NewickLexer.tokenize(normalized);
		return build(tokens);
	}

	/**
	 * Builds a tree from the given tokens. Tokens after the first semicolon are ignored
	 * @param tokens Output of the NewickLexer
	 * @return NewickNode root of the tree. null if no opening parenthesis is found before the semicolon
	 * @throws NewickFormatException If a branch length is not a number or the tokens do not end with a semicolon
	 * @throws UnbalancedNewickException If parentheses are not balanced or a comma appears outside parentheses
	 */
	public NewickNode build(List<NewickToken> tokens) throws NewickFormatException {
		NewickNode v = null;
		boolean terminated = false;
		for (NewickToken t : tokens) {
			NewickToken.Type type = t.getType();
			if (type == NewickToken.Type.OPEN) {
				if (v == null) v = ids.createNode();
				NewickNode c = ids.createNode();
				v.addChild(c);
				v = c;
			} else if (type == NewickToken.Type.CLOSE) {
				if (v == null || v.getParent() == null) throw new UnbalancedNewickException("Closing parenthesis without matching opening parenthesis", t.getOffset());
				v = v.getParent();
			} else if (type == NewickToken.Type.COMMA) {
				if (v == null || v.getParent() == null) throw new UnbalancedNewickException("Comma outside parentheses", t.getOffset());
				NewickNode s = ids.createNode();
				v.insertSibling(s);
				v = s;
			} else if (type == NewickToken.Type.END) {
				terminated = true;
				break;
			} else if (v == null) {
				log.warning("Ignoring token "+t.getText()+" found before the first opening parenthesis");
			} else if (type == NewickToken.Type.LENGTH) {
				v.setLength(parseLength(t));
			} else {
				v.setLabel(v.getLabel()+t.getText());
			}
		}
		if (!terminated) throw new NewickFormatException("Tree not terminated by semicolon");
		if (v == null) return null;
		if (v.getParent() != null) throw new UnbalancedNewickException("Tree terminated with unclosed parentheses", -1);
		return v;
	}

	private double parseLength(NewickToken t) throws NewickFormatException {
		String number = t.getText().substring(1);
		if (!ParseUtils.isDecimalNumber(number)) throw new NewickFormatException("Branch length "+number+" is not a number", t.getOffset());
		double length = Double.parseDouble(number);
		if (Double.isInfinite(length)) throw new NewickFormatException("Branch length "+number+" is out of range", t.getOffset());
		return length;
	}
}
