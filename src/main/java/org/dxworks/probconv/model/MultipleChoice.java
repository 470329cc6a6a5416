package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * Pick-one response area holding {@link Choice} nodes.
 */
public final class MultipleChoice extends InternalNode {

    public MultipleChoice(Node... children) {
        this(Arrays.asList(children));
    }

    public MultipleChoice(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.MULTIPLE_CHOICE;
    }

    @Override
    public MultipleChoice withChildren(List<? extends Node> children) {
        return new MultipleChoice(children);
    }
}
