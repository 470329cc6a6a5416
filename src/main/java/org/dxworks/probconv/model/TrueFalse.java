package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * True/false response area; {@code solution} is the correct answer.
 */
public final class TrueFalse extends LeafNode {

    private final boolean solution;

    public TrueFalse(boolean solution) {
        this.solution = solution;
    }

    public boolean getSolution() {
        return solution;
    }

    @Override
    public NodeType getType() {
        return NodeType.TRUE_FALSE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("solution", solution);
        return attributes;
    }
}
