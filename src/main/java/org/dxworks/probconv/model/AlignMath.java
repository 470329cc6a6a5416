package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Body of an {@code align} (or, when starred, {@code align*}) environment.
 */
public final class AlignMath extends LeafNode {

    private final String latex;
    private final boolean starred;

    public AlignMath(String latex, boolean starred) {
        this.latex = Objects.requireNonNull(latex, "latex");
        this.starred = starred;
    }

    public String getLatex() {
        return latex;
    }

    public boolean isStarred() {
        return starred;
    }

    public String environmentName() {
        return starred ? "align*" : "align";
    }

    @Override
    public NodeType getType() {
        return NodeType.ALIGN_MATH;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("latex", latex);
        attributes.put("starred", starred);
        return attributes;
    }
}
