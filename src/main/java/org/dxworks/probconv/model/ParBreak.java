package org.dxworks.probconv.model;

/**
 * Transient marker for a forced paragraph boundary inside a {@link Blob}.
 */
public final class ParBreak extends LeafNode {

    @Override
    public NodeType getType() {
        return NodeType.PAR_BREAK;
    }
}
