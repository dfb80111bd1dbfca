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
 * Outcome of detaching a clade from its tree
 * @author Jorge Duitama
 *
 */
public enum CladeRemovalResult {
	/**
	 * The clade was unlinked from its parent. The remaining tree is still valid
	 * and the removed node is now the root of a standalone tree
	 */
	DETACHED,
	/**
	 * The node was the root of its tree, so the whole tree was removed.
	 * References to the former root should be discarded
	 */
	TREE_DESTROYED
}
