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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import nwk.trees.io.NewickTreeWriter;

/**
 * Node of a rooted tree loaded from or written to the Newick format.
 * Each node owns a link to its first child and a link to its next sibling.
 * The link to the parent is used only to navigate upwards.
 * Two references denote the same node if and only if they have the same id
 * @author Jorge Duitama
 *
 */
public class NewickNode {
	/**
	 * Indentation used for each level by the print method
	 */
	public static final String PRINT_INDENT = "   ";
	/**
	 * Text printed for nodes without label
	 */
	public static final String PRINT_EMPTY_LABEL = "*";

	private final int id;
	private String label = "";
	private double length = 0;
	private boolean hasLength = false;
	private NewickNode parent;
	private NewickNode child;
	private NewickNode sib;

	/**
	 * Creates a standalone node. Ids should be obtained from a NodeIdGenerator
	 * @param id Unique id of the node
	 */
	public NewickNode(int id) {
		this.id = id;
	}

	public int getId() {
		return id;
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		if (label == null) throw new NullPointerException("Label can not be null");
		this.label = label;
	}

	/**
	 * @return double length of the branch to the parent. Only meaningful if hasLength is true
	 */
	public double getLength() {
		return length;
	}

	/**
	 * @return true if a branch length was specified for this node, even if the length is zero
	 */
	public boolean hasLength() {
		return hasLength;
	}

	/**
	 * Sets the length of the branch to the parent
	 * @param length New branch length. Must be a finite number
	 */
	public void setLength(double length) {
		if (Double.isNaN(length) || Double.isInfinite(length)) throw new IllegalArgumentException("Branch length of node "+id+" must be finite. Given: "+length);
		this.length = length;
		this.hasLength = true;
	}

	/**
	 * Removes the branch length of this node
	 */
	public void clearLength() {
		this.length = 0;
		this.hasLength = false;
	}

	public NewickNode getParent() {
		return parent;
	}

	public NewickNode getFirstChild() {
		return child;
	}

	public NewickNode getNextSibling() {
		return sib;
	}

	/**
	 * Links the given node as the next sibling of this node.
	 * The former next sibling, if any, becomes the next sibling of the given node
	 * @param node Node to link. It takes the parent of this node
	 */
	public void insertSibling(NewickNode node) {
		if (parent == null) throw new IllegalStateException("Root node "+id+" can not have siblings");
		checkDetached(node);
		node.parent = parent;
		node.sib = sib;
		sib = node;
	}

	public boolean isLeaf() {
		return child == null;
	}

	public boolean isRoot() {
		return parent == null;
	}

	/**
	 * @param other Node to compare
	 * @return true if the given reference denotes this node
	 */
	public boolean isSameNode(NewickNode other) {
		return other != null && other.id == id;
	}

	/**
	 * @return NewickNode root of the tree where this node is located
	 */
	public NewickNode getRoot() {
		NewickNode v = this;
		while (v.parent != null) v = v.parent;
		return v;
	}

	/**
	 * @return List<NewickNode> direct children in declaration order
	 */
	public List<NewickNode> getChildren() {
		List<NewickNode> children = new ArrayList<>();
		for (NewickNode w = child; w != null; w = w.sib) children.add(w);
		return children;
	}

	/**
	 * @return List<NewickNode> leaves of the clade rooted at this node, from left to right
	 */
	public List<NewickNode> getLeaves() {
		List<NewickNode> leaves = new ArrayList<>();
		Deque<NewickNode> agenda = new ArrayDeque<>();
		agenda.push(this);
		while (!agenda.isEmpty()) {
			NewickNode v = agenda.pop();
			if (v.child == null) {
				leaves.add(v);
				continue;
			}
			List<NewickNode> children = v.getChildren();
			for (int i = children.size() - 1; i >= 0; i--) agenda.push(children.get(i));
		}
		return leaves;
	}

	/**
	 * @return int Number of nodes in the clade rooted at this node
	 */
	public int getSize() {
		return collectClade().size();
	}

	/**
	 * @return double sum of the branch lengths of the descendants of this node
	 */
	public double getBranchLengthSum() {
		double sum = 0;
		for (NewickNode v : collectClade()) {
			if (v != this && v.hasLength) sum += v.length;
		}
		return sum;
	}

	/**
	 * Adds the given node as the last child of this node
	 * @param v New child
	 */
	public void addChild(NewickNode v) {
		checkDetached(v);
		v.parent = this;
		if (child == null) {
			child = v;
		} else {
			NewickNode w = child;
			while (w.sib != null) w = w.sib;
			w.sib = v;
		}
	}

	/**
	 * Verifies that the given node can be linked below or next to this node.
	 * The node must be the root of a standalone tree that does not contain this node
	 * @param v Node to link
	 */
	private void checkDetached(NewickNode v) {
		if (v.parent != null || v.sib != null) throw new IllegalArgumentException("Node "+v.id+" is already linked to a tree. Remove it first");
		if (v == this) throw new IllegalArgumentException("Node "+id+" can not be linked to itself");
		//A standalone root is an ancestor of this node only if it is the root of this tree
		if (v.child != null && getRoot() == v) throw new IllegalArgumentException("Node "+v.id+" is an ancestor of node "+id);
	}

	/**
	 * Removes the direct child with the given id. The removed node becomes a standalone tree
	 * @param childId Id of the child to remove
	 * @return NewickNode the removed child
	 * @throws NoChildrenException If this node is a leaf
	 * @throws ChildNotFoundException If no child of this node has the given id
	 */
	public NewickNode removeChild(int childId) throws NoChildrenException, ChildNotFoundException {
		if (child == null) throw new NoChildrenException(id);
		NewickNode removed = unlinkChild(childId);
		if (removed == null) throw new ChildNotFoundException(id, childId);
		return removed;
	}

	/**
	 * Removes the given node if it is a direct child of this node
	 * @param c Child to remove
	 * @return NewickNode the removed child
	 * @throws NoChildrenException If this node is a leaf
	 * @throws ChildNotFoundException If the given node is not a child of this node
	 */
	public NewickNode removeChild(NewickNode c) throws NoChildrenException, ChildNotFoundException {
		return removeChild(c.id);
	}

	/**
	 * Detaches the clade rooted at this node from its tree. After the call this node is a root
	 * @return CladeRemovalResult DETACHED if this node had a parent, TREE_DESTROYED if this node was already
	 * the root, in which case the whole tree is gone and the caller should discard its references to it
	 */
	public CladeRemovalResult removeClade() {
		if (parent == null) return CladeRemovalResult.TREE_DESTROYED;
		if (parent.unlinkChild(id) == null) {
			throw new IllegalStateException("Node "+id+" is not linked from the children of its parent "+parent.id);
		}
		return CladeRemovalResult.DETACHED;
	}

	private NewickNode unlinkChild(int childId) {
		if (child == null) return null;
		NewickNode w = child;
		if (w.id == childId) {
			child = w.sib;
		} else {
			while (w.sib != null && w.sib.id != childId) w = w.sib;
			if (w.sib == null) return null;
			NewickNode x = w.sib;
			w.sib = x.sib;
			w = x;
		}
		w.sib = null;
		w.parent = null;
		return w;
	}

	/**
	 * Finds the lowest common ancestor of this node and the given node.
	 * The ancestors of this node are kept in a local set, so concurrent queries over the same tree are safe
	 * @param other Second node
	 * @return NewickNode the deepest node that is ancestor of both nodes, or null if they are in different trees
	 */
	public NewickNode getLCA(NewickNode other) {
		Set<Integer> path = new HashSet<>();
		for (NewickNode v = this; v != null; v = v.parent) path.add(v.id);
		NewickNode w = other;
		while (w != null && !path.contains(w.id)) w = w.parent;
		return w;
	}

	/**
	 * Calculates the distance from this node up to the given ancestor, adding the lengths of the branches
	 * of this node and of every node in between
	 * @param ancestor Ancestor of this node
	 * @return double sum of the branch lengths between the two nodes
	 * @throws NotAncestorException If the root is reached without finding the given node
	 */
	public double upDistance(NewickNode ancestor) throws NotAncestorException {
		double s = 0;
		NewickNode x = this;
		while (x != null && x.id != ancestor.id) {
			s += x.length;
			x = x.parent;
		}
		if (x == null) throw new NotAncestorException(id, ancestor.id);
		return s;
	}

	/**
	 * Relabels nodes with the given prefix followed by the node id. Visits the descendants of this node and
	 * the following siblings of this node with their descendants
	 * @param prefix for the new labels
	 */
	public void uniformLabels(String prefix) {
		Deque<NewickNode> agenda = new ArrayDeque<>();
		agenda.push(this);
		while (!agenda.isEmpty()) {
			NewickNode v = agenda.pop();
			v.label = prefix + v.id;
			if (v.sib != null) agenda.push(v.sib);
			if (v.child != null) agenda.push(v.child);
		}
	}

	/**
	 * Builds a key for the clade rooted at this node. The key does not depend on the order of the children
	 * @param separator to join the labels
	 * @return String Sorted non empty labels of this node and its descendants, without repetitions
	 */
	public String getKey(String separator) {
		Set<String> labels = new TreeSet<>();
		for (NewickNode v : collectClade()) {
			if (!v.label.isEmpty()) labels.add(v.label);
		}
		return String.join(separator, labels);
	}

	/**
	 * Renders this node, its following siblings and their descendants as an indented list. Siblings are
	 * printed before the node itself, so children appear in reverse order
	 * @return String one line per node
	 */
	public String print() {
		StringBuilder out = new StringBuilder();
		Deque<NewickNode> nodes = new ArrayDeque<>();
		Deque<Integer> depths = new ArrayDeque<>();
		Deque<Boolean> expanded = new ArrayDeque<>();
		nodes.push(this);
		depths.push(0);
		expanded.push(false);
		while (!nodes.isEmpty()) {
			NewickNode v = nodes.pop();
			int h = depths.pop();
			if (expanded.pop()) {
				for (int i = 0; i < h; i++) out.append(PRINT_INDENT);
				out.append(v.label.isEmpty() ? PRINT_EMPTY_LABEL : v.label).append('\n');
				continue;
			}
			if (v.child != null) {
				nodes.push(v.child);
				depths.push(h + 1);
				expanded.push(false);
			}
			nodes.push(v);
			depths.push(h);
			expanded.push(true);
			if (v.sib != null) {
				nodes.push(v.sib);
				depths.push(h);
				expanded.push(false);
			}
		}
		return out.toString();
	}

	/**
	 * Creates an independent copy of the clade rooted at this node. Labels and lengths are copied and new
	 * ids are taken from the given generator. The copy is a standalone tree
	 * @param ids Generator for the ids of the new nodes
	 * @return NewickNode root of the copy
	 */
	public NewickNode copyClade(NodeIdGenerator ids) {
		NewickNode copyRoot = copyAttributes(ids);
		Deque<NewickNode> originals = new ArrayDeque<>();
		Deque<NewickNode> copies = new ArrayDeque<>();
		originals.push(this);
		copies.push(copyRoot);
		while (!originals.isEmpty()) {
			NewickNode v = originals.pop();
			NewickNode vCopy = copies.pop();
			List<NewickNode> children = v.getChildren();
			List<NewickNode> childrenCopies = new ArrayList<>(children.size());
			for (NewickNode c : children) {
				NewickNode cCopy = c.copyAttributes(ids);
				vCopy.addChild(cCopy);
				childrenCopies.add(cCopy);
			}
			for (int i = children.size() - 1; i >= 0; i--) {
				originals.push(children.get(i));
				copies.push(childrenCopies.get(i));
			}
		}
		return copyRoot;
	}

	private NewickNode copyAttributes(NodeIdGenerator ids) {
		NewickNode copy = ids.createNode(label);
		copy.length = length;
		copy.hasLength = hasLength;
		return copy;
	}

	/**
	 * @return List<NewickNode> this node and all its descendants in pre order
	 */
	private List<NewickNode> collectClade() {
		List<NewickNode> clade = new ArrayList<>();
		Deque<NewickNode> agenda = new ArrayDeque<>();
		agenda.push(this);
		while (!agenda.isEmpty()) {
			NewickNode v = agenda.pop();
			clade.add(v);
			List<NewickNode> children = v.getChildren();
			for (int i = children.size() - 1; i >= 0; i--) agenda.push(children.get(i));
		}
		return clade;
	}

	/**
	 * @return String Newick text of this node written with the default writer
	 */
	public String toNewick() {
		return new NewickTreeWriter().write(this);
	}

	@Override
	public String toString() {
		return toNewick();
	}
}
