package org.dxworks.probconv.exception;

import org.dxworks.probconv.model.NodeType;

/**
 * Raised when a node of a disallowed type is placed under a parent.
 */
public class IllegalChildException extends ProbconvException {

    private final NodeType parentType;
    private final NodeType childType;

    public IllegalChildException(NodeType parentType, NodeType childType) {
        super("Cannot add child of type " + childType.getDisplayName()
                + " to " + parentType.getDisplayName() + ".");
        this.parentType = parentType;
        this.childType = childType;
    }

    public NodeType getParentType() {
        return parentType;
    }

    public NodeType getChildType() {
        return childType;
    }
}
