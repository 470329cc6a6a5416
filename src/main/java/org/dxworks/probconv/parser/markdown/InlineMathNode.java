package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.CustomNode;

public class InlineMathNode extends CustomNode {

    private final String latex;

    public InlineMathNode(String latex) {
        this.latex = latex;
    }

    public String getLatex() {
        return latex;
    }
}
