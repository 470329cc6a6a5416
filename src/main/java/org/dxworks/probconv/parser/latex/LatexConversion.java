package org.dxworks.probconv.parser.latex;

import org.dxworks.probconv.model.Node;

import java.util.List;

/**
 * Callback handed to converters for converting nested LaTeX.
 */
public interface LatexConversion {

    /**
     * Converts one node through the converter tables. Inline results come back wrapped in a
     * {@link org.dxworks.probconv.model.Blob}.
     *
     * @throws org.dxworks.probconv.exception.ParseException if no converter handles the node
     */
    Node convert(LatexNode node);

    List<Node> convertAll(List<LatexNode> nodes);

    /**
     * Converts content that must be inline and returns it unwrapped: blobs are flattened, and
     * paragraph breaks are kept. A block-level result is a parse error.
     */
    List<Node> convertInline(List<LatexNode> nodes);
}
