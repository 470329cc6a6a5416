package org.dxworks.probconv.parser.latex;

/**
 * Plain text, with escapes already resolved and comments removed.
 */
public final class LatexText extends LatexNode {

    private final String text;
    private final String source;

    public LatexText(String text) {
        this(text, text);
    }

    LatexText(String text, String source) {
        this.text = text;
        this.source = source;
    }

    public String getText() {
        return text;
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return "LatexText[" + text + "]";
    }
}
