package org.dxworks.probconv.parser.latex;

import org.dxworks.probconv.model.Node;

/**
 * Converts one LaTeX environment into a problem tree node.
 */
@FunctionalInterface
public interface EnvironmentConverter {

    Node convert(LatexEnvironment environment, LatexConversion conversion);
}
