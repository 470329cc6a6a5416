package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * LaTeX math typeset as its own block.
 */
public final class DisplayMath extends LeafNode {

    private final String latex;

    public DisplayMath(String latex) {
        this.latex = Objects.requireNonNull(latex, "latex");
    }

    public String getLatex() {
        return latex;
    }

    @Override
    public NodeType getType() {
        return NodeType.DISPLAY_MATH;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("latex", latex);
        return attributes;
    }
}
