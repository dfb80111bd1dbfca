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
package nwk.trees;

/**
 * Thrown when a child is requested to be removed from a node without children
 * @author Jorge Duitama
 *
 */
public class NoChildrenException extends TreeOperationException {
	private static final long serialVersionUID = 1L;
	private final int parentId;

	public NoChildrenException(int parentId) {
		super("Node "+parentId+" does not have children");
		this.parentId = parentId;
	}

	public int getParentId() {
		return parentId;
	}
}
