package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

public final class Solution extends InternalNode {

    public Solution(Node... children) {
        this(Arrays.asList(children));
    }

    public Solution(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.SOLUTION;
    }

    @Override
    public Solution withChildren(List<? extends Node> children) {
        return new Solution(children);
    }
}
