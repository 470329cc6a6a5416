package org.dxworks.probconv.render;

import org.dxworks.probconv.model.Node;

import java.util.List;

/**
 * State of a single render call, handed to every {@link NodeRenderer}.
 */
public interface NodeRendering {

    String render(Node node);

    List<String> renderAll(List<Node> nodes);

    /**
     * Next value, starting at 1, of a counter that lives as long as this render call.
     */
    int nextSequence(String counter);
}
