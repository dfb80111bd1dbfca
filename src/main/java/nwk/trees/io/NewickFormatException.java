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

import java.io.IOException;

/**
 * Signals malformed Newick text: broken quoting or comments, non numeric branch lengths
 * or records that end prematurely
 * @author Jorge Duitama
 *
 */
public class NewickFormatException extends IOException {
	private static final long serialVersionUID = 1L;
	private final int offset;

	public NewickFormatException(String message) {
		this(message, -1);
	}

	/**
	 * @param message Description of the problem
	 * @param offset Position in the processed text where the problem was found. -1 if unknown
	 */
	public NewickFormatException(String message, int offset) {
		super(offset >= 0 ? message+" at position "+offset : message);
		this.offset = offset;
	}

	/**
	 * @return int Position in the processed text where the problem was found. -1 if unknown
	 */
	public int getOffset() {
		return offset;
	}
}
