package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * LaTeX math typeset inline with the surrounding text.
 */
public final class InlineMath extends LeafNode {

    private final String latex;

    public InlineMath(String latex) {
        this.latex = Objects.requireNonNull(latex, "latex");
    }

    public String getLatex() {
        return latex;
    }

    @Override
    public NodeType getType() {
        return NodeType.INLINE_MATH;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("latex", latex);
        return attributes;
    }
}
