package org.dxworks.probconv.parser.latex;

/**
 * Element of the syntax tree {@link LatexReader} produces.
 */
public abstract class LatexNode {

    /** Source text this node was read from, as written. */
    public abstract String getSource();

    /**
     * True for text holding nothing but whitespace.
     */
    public boolean isBlank() {
        return false;
    }
}
