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
 * Thrown when a distance is requested to a node that is not an ancestor of the source node
 * @author Jorge Duitama
 *
 */
public class NotAncestorException extends TreeOperationException {
	private static final long serialVersionUID = 1L;
	private final int nodeId;
	private final int ancestorId;

	public NotAncestorException(int nodeId, int ancestorId) {
		super("Can not find ancestor "+ancestorId+" walking up from node "+nodeId);
		this.nodeId = nodeId;
		this.ancestorId = ancestorId;
	}

	public int getNodeId() {
		return nodeId;
	}

	public int getAncestorId() {
		return ancestorId;
	}
}
