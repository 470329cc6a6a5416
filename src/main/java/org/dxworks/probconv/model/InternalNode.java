package org.dxworks.probconv.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node owning an ordered list of children.
 * <p>
 * Every child is checked against {@link NodeSchema} when it is added, whether through a
 * constructor, {@link #addChild(Node)} or {@link #withChildren(List)}.
 */
public abstract class InternalNode extends Node {

    private final List<Node> children = new ArrayList<>();

    protected InternalNode(List<? extends Node> children) {
        Objects.requireNonNull(children, "children");
        for (Node child : children) {
            addChild(child);
        }
    }

    /**
     * Appends a child.
     *
     * @throws org.dxworks.probconv.exception.IllegalChildException if this node type does not accept the child's type
     */
    public final void addChild(Node child) {
        Objects.requireNonNull(child, "child");
        NodeSchema.checkChild(getType(), child.getType());
        children.add(child);
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Returns a copy of this node, attributes included, holding {@code children} instead.
     */
    public abstract InternalNode withChildren(List<? extends Node> children);

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && children.equals(((InternalNode) o).children);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + children.hashCode();
    }

    @Override
    public String toString() {
        return super.toString() + children;
    }
}
