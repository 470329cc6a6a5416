package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * Root of every canonical tree.
 */
public final class Problem extends InternalNode {

    public Problem(Node... children) {
        this(Arrays.asList(children));
    }

    public Problem(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.PROBLEM;
    }

    @Override
    public Problem withChildren(List<? extends Node> children) {
        return new Problem(children);
    }
}
