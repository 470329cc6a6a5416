package org.dxworks.probconv.render;

import org.dxworks.probconv.model.Problem;

/**
 * Renders a canonical problem tree to one output format.
 */
public interface ProblemRenderer {

    /**
     * @throws org.dxworks.probconv.exception.RenderException if the tree holds a transient node or
     *                                                        a node the format cannot express
     */
    String render(Problem problem);
}
