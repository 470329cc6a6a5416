package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * A paragraph of inline content: text, inline math, inline code and inline response boxes.
 */
public final class Paragraph extends InternalNode {

    public Paragraph(Node... children) {
        this(Arrays.asList(children));
    }

    public Paragraph(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.PARAGRAPH;
    }

    @Override
    public Paragraph withChildren(List<? extends Node> children) {
        return new Paragraph(children);
    }
}
