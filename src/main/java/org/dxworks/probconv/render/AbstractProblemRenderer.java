package org.dxworks.probconv.render;

import org.dxworks.probconv.exception.RenderException;
import org.dxworks.probconv.model.InternalNode;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.Problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Table-driven renderer: one {@link NodeRenderer} per node type, built from the format's
 * defaults with the caller's overrides merged on top. Transient nodes, types without a
 * renderer and types the format declares unsupported are rejected with a
 * {@link RenderException}.
 */
public abstract class AbstractProblemRenderer implements ProblemRenderer {

    private final String formatName;
    private final Map<NodeType, NodeRenderer> renderers = new EnumMap<>(NodeType.class);
    private final Map<NodeType, String> unsupported;

    protected AbstractProblemRenderer(String formatName,
                                      Map<NodeType, NodeRenderer> defaults,
                                      Map<NodeType, String> unsupported,
                                      Map<NodeType, NodeRenderer> overrides) {
        this.formatName = formatName;
        this.renderers.putAll(defaults);
        this.renderers.putAll(overrides);
        // an override makes an otherwise unsupported type renderable
        Map<NodeType, String> rejected = new EnumMap<>(NodeType.class);
        rejected.putAll(unsupported);
        rejected.keySet().removeAll(overrides.keySet());
        this.unsupported = Collections.unmodifiableMap(rejected);
    }

    @Override
    public String render(Problem problem) {
        return finish(new Rendering().render(problem));
    }

    /** Post-processes the rendered problem. */
    protected String finish(String output) {
        return output;
    }

    protected String getFormatName() {
        return formatName;
    }

    /**
     * Renders the children of {@code node} as blocks separated by an empty line, skipping
     * children that render to nothing.
     */
    protected static String blocks(InternalNode node, NodeRendering rendering) {
        return joinBlocks(rendering.renderAll(node.getChildren()));
    }

    protected static String joinBlocks(List<String> rendered) {
        List<String> blocks = new ArrayList<>(rendered.size());
        for (String block : rendered) {
            if (!block.isBlank()) {
                blocks.add(block);
            }
        }
        return String.join("\n\n", blocks);
    }

    /** Concatenates the rendered children of an inline container. */
    protected static String inline(InternalNode node, NodeRendering rendering) {
        return String.join("", rendering.renderAll(node.getChildren()));
    }

    private class Rendering implements NodeRendering {
        private final Map<String, Integer> counters = new HashMap<>();

        @Override
        public String render(Node node) {
            NodeType type = node.getType();
            if (type.isTransient()) {
                throw new RenderException("Cannot render transient node " + type.getDisplayName()
                        + "; reconstruct paragraphs before rendering");
            }
            String reason = unsupported.get(type);
            if (reason != null) {
                throw new RenderException(reason);
            }
            NodeRenderer renderer = renderers.get(type);
            if (renderer == null) {
                throw new RenderException("No " + formatName + " renderer for " + type.getDisplayName());
            }
            return renderer.render(node, this);
        }

        @Override
        public List<String> renderAll(List<Node> nodes) {
            List<String> rendered = new ArrayList<>(nodes.size());
            for (Node node : nodes) {
                rendered.add(render(node));
            }
            return rendered;
        }

        @Override
        public int nextSequence(String counter) {
            return counters.merge(counter, 1, Integer::sum);
        }
    }
}
