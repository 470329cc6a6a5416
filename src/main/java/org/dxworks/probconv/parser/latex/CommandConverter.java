package org.dxworks.probconv.parser.latex;

import org.dxworks.probconv.model.Node;

/**
 * Converts one LaTeX command into a problem tree node.
 */
@FunctionalInterface
public interface CommandConverter {

    Node convert(LatexCommand command, LatexConversion conversion);
}
