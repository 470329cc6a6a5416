package org.dxworks.probconv.parser.markdown;

import org.dxworks.probconv.model.Node;

/**
 * Converts one commonmark node into a problem tree node.
 */
@FunctionalInterface
public interface MarkdownConverter {

    Node convert(org.commonmark.node.Node element, MarkdownConversion conversion);
}
