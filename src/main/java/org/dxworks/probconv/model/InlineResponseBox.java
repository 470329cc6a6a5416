package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * Short-answer box shown inline with the text; its children are the expected answer.
 */
public final class InlineResponseBox extends InternalNode {

    public InlineResponseBox(Node... children) {
        this(Arrays.asList(children));
    }

    public InlineResponseBox(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.INLINE_RESPONSE_BOX;
    }

    @Override
    public InlineResponseBox withChildren(List<? extends Node> children) {
        return new InlineResponseBox(children);
    }
}
