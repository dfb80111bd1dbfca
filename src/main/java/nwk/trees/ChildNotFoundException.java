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
 * Thrown when the id of a node to remove is not found among the children of a node
 * @author Jorge Duitama
 *
 */
public class ChildNotFoundException extends TreeOperationException {
	private static final long serialVersionUID = 1L;
	private final int parentId;
	private final int childId;

	public ChildNotFoundException(int parentId, int childId) {
		super("Node "+childId+" is not a child of node "+parentId);
		this.parentId = parentId;
		this.childId = childId;
	}

	public int getParentId() {
		return parentId;
	}

	public int getChildId() {
		return childId;
	}
}
