package org.dxworks.probconv.parser.markdown;

import org.dxworks.probconv.model.Node;

import java.util.List;

/**
 * Callback handed to converters for converting nested Markdown.
 */
public interface MarkdownConversion {

    /**
     * Converts one node through the converter table. Inline results come back wrapped in a
     * {@link org.dxworks.probconv.model.Blob}.
     */
    Node convert(org.commonmark.node.Node element);

    List<Node> convertChildren(org.commonmark.node.Node parent);

    /**
     * Converts the children of {@code parent}, which must all be inline, flattening blobs.
     */
    List<Node> convertInlineChildren(org.commonmark.node.Node parent);
}
