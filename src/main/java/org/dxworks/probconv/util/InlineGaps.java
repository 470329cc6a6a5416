package org.dxworks.probconv.util;

import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace between two inline nodes, which no {@link Text} can hold on its own.
 * <p>
 * Parsers mark such a gap with a {@code null} entry in a list of converted siblings. The gap
 * becomes a trailing space on the text ending the previous sibling or, failing that, a leading
 * space on the text starting the next one. A gap with no text on either side is dropped.
 */
public final class InlineGaps {

    private InlineGaps() {
        // utility class
    }

    public static List<Node> carry(List<Node> siblings) {
        List<Node> nodes = new ArrayList<>(siblings);
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) != null) {
                continue;
            }
            Node previous = i > 0 ? nodes.get(i - 1) : null;
            Node next = i + 1 < nodes.size() ? nodes.get(i + 1) : null;
            Node spaced = previous == null ? null : appendSpace(previous);
            if (spaced != null) {
                nodes.set(i - 1, spaced);
                continue;
            }
            spaced = next == null ? null : prependSpace(next);
            if (spaced != null) {
                nodes.set(i + 1, spaced);
            }
        }

        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    /** The node with a space after its last text, or null when it does not end with text. */
    static Node appendSpace(Node node) {
        if (node instanceof Text text) {
            return text.getText().endsWith(" ") ? text : text.withText(text.getText() + " ");
        }
        if (node instanceof Blob blob && blob.getChildCount() > 0) {
            List<Node> children = new ArrayList<>(blob.getChildren());
            Node last = appendSpace(children.get(children.size() - 1));
            if (last == null) {
                return null;
            }
            children.set(children.size() - 1, last);
            return blob.withChildren(children);
        }
        return null;
    }

    /** The node with a space before its first text, or null when it does not start with text. */
    static Node prependSpace(Node node) {
        if (node instanceof Text text) {
            return text.getText().startsWith(" ") ? text : text.withText(" " + text.getText());
        }
        if (node instanceof Blob blob && blob.getChildCount() > 0) {
            List<Node> children = new ArrayList<>(blob.getChildren());
            Node first = prependSpace(children.get(0));
            if (first == null) {
                return null;
            }
            children.set(0, first);
            return blob.withChildren(children);
        }
        return null;
    }
}
