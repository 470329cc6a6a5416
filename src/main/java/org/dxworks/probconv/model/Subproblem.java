package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * A part of a problem. Subproblems hold everything a problem may hold except other subproblems.
 */
public final class Subproblem extends InternalNode {

    public Subproblem(Node... children) {
        this(Arrays.asList(children));
    }

    public Subproblem(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.SUBPROBLEM;
    }

    @Override
    public Subproblem withChildren(List<? extends Node> children) {
        return new Subproblem(children);
    }
}
