package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A run of text, optionally bold and/or italic.
 * <p>
 * The text is never empty nor whitespace-only, and every whitespace run in it (newlines
 * included) is collapsed to a single space on construction.
 */
public final class Text extends LeafNode {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final String text;
    private final boolean bold;
    private final boolean italic;

    public Text(String text) {
        this(text, false, false);
    }

    public Text(String text, boolean bold, boolean italic) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text must contain non-whitespace characters, got: '" + text + "'");
        }
        this.text = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        this.bold = bold;
        this.italic = italic;
    }

    public static Text bold(String text) {
        return new Text(text, true, false);
    }

    public static Text italic(String text) {
        return new Text(text, false, true);
    }

    public String getText() {
        return text;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    /** Same styling, different text. */
    public Text withText(String newText) {
        return new Text(newText, bold, italic);
    }

    /** Same text with the given styles added to the existing ones. */
    public Text withStyle(boolean addBold, boolean addItalic) {
        return new Text(text, bold || addBold, italic || addItalic);
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("text", text);
        attributes.put("bold", bold);
        attributes.put("italic", italic);
        return attributes;
    }
}
