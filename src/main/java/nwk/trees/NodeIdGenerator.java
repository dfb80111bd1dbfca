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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Source of node ids for a family of trees. Ids are handed out in strictly
 * increasing order and are never reused by the same generator
 * @author Jorge Duitama
 *
 */
public class NodeIdGenerator {
	public static final int DEF_FIRST_ID = 1;

	private final AtomicInteger nextId;

	public NodeIdGenerator() {
		this(DEF_FIRST_ID);
	}

	/**
	 * Creates a generator whose first id is the given number
	 * @param firstId Id of the first node created by this generator
	 */
	public NodeIdGenerator(int firstId) {
		nextId = new AtomicInteger(firstId);
	}

	/**
	 * @return int Next available id. Consumes the id
	 */
	public int nextId() {
		return nextId.getAndIncrement();
	}

	/**
	 * @return int Id that the next call to nextId will return
	 */
	public int peekNextId() {
		return nextId.get();
	}

	/**
	 * Creates a new node without label or length stamped with the next id
	 * @return NewickNode new standalone node
	 */
	public NewickNode createNode() {
		return new NewickNode(nextId());
	}

	/**
	 * Creates a new leaf with the given label
	 * @param label of the new node
	 * @return NewickNode new standalone node
	 */
	public NewickNode createNode(String label) {
		NewickNode node = createNode();
		node.setLabel(label);
		return node;
	}
}
