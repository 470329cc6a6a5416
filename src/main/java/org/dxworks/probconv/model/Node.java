package org.dxworks.probconv.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a problem tree.
 * <p>
 * Nodes are value objects: two nodes are equal when they have the same concrete type,
 * the same attributes and (for internal nodes) equal children in the same order.
 * Each node type lists its scalar attributes once, in {@link #attributes()}.
 */
public abstract class Node {

    public abstract NodeType getType();

    /**
     * Ordered attribute name to value map. Empty for types without attributes.
     */
    public Map<String, Object> attributes() {
        return Collections.emptyMap();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return attributes().equals(((Node) o).attributes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), attributes());
    }

    @Override
    public String toString() {
        Map<String, Object> attributes = attributes();
        return attributes.isEmpty()
                ? getType().getDisplayName()
                : getType().getDisplayName() + attributes;
    }
}
