package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * Select-all-that-apply response area holding {@link Choice} nodes.
 */
public final class MultipleSelect extends InternalNode {

    public MultipleSelect(Node... children) {
        this(Arrays.asList(children));
    }

    public MultipleSelect(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.MULTIPLE_SELECT;
    }

    @Override
    public MultipleSelect withChildren(List<? extends Node> children) {
        return new MultipleSelect(children);
    }
}
