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
 * Syntactic unit of a Newick record
 * @author Jorge Duitama
 *
 */
public class NewickToken {
	public enum Type {
		OPEN, CLOSE, COMMA, END, LENGTH, LABEL
	}

	private final Type type;
	private final String text;
	private final int offset;

	public NewickToken(Type type, String text, int offset) {
		this.type = type;
		this.text = text;
		this.offset = offset;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return String text of the token. Quoted tokens are already unquoted. Length tokens include the leading colon
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return int position of the token in the normalized text
	 */
	public int getOffset() {
		return offset;
	}

	@Override
	public String toString() {
		return type+":"+text;
	}
}
