package org.dxworks.probconv.render;

import org.dxworks.probconv.model.Node;

/**
 * Renders one node type. Children are rendered through {@code rendering} so that overrides
 * apply at every depth.
 */
@FunctionalInterface
public interface NodeRenderer {

    String render(Node node, NodeRendering rendering);
}
