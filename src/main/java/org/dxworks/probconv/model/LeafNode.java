package org.dxworks.probconv.model;

/**
 * A node that holds only scalar attributes. Leaf nodes are immutable.
 */
public abstract class LeafNode extends Node {
}
