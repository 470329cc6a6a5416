package org.dxworks.probconv.parser.latex;

import java.util.List;

/**
 * A {@code {...}} group, or a {@code [...]} group when it is an optional argument.
 */
public final class LatexGroup extends LatexNode {

    private final boolean optional;
    private final List<LatexNode> contents;
    private final String rawContents;

    public LatexGroup(boolean optional, List<LatexNode> contents, String rawContents) {
        this.optional = optional;
        this.contents = List.copyOf(contents);
        this.rawContents = rawContents;
    }

    /** True for a bracket group. */
    public boolean isOptional() {
        return optional;
    }

    public List<LatexNode> getContents() {
        return contents;
    }

    /** Source between the delimiters. */
    public String getRawContents() {
        return rawContents;
    }

    @Override
    public String getSource() {
        return optional ? "[" + rawContents + "]" : "{" + rawContents + "}";
    }

    @Override
    public String toString() {
        return "LatexGroup" + getSource();
    }
}
