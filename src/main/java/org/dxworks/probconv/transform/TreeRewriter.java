package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.InternalNode;
import org.dxworks.probconv.model.LeafNode;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.Problem;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree, replacing leaves through a callback. Internal nodes keep their type and
 * attributes; the input is left untouched.
 */
final class TreeRewriter {

    @FunctionalInterface
    interface LeafRewrite {
        Node apply(LeafNode leaf) throws IOException;
    }

    private TreeRewriter() {
        // utility class
    }

    static Problem rewriteLeaves(Problem tree, LeafRewrite rewrite) throws IOException {
        return tree.withChildren(rewriteChildren(tree, rewrite));
    }

    private static List<Node> rewriteChildren(InternalNode node, LeafRewrite rewrite) throws IOException {
        List<Node> children = new ArrayList<>(node.getChildCount());
        for (Node child : node.getChildren()) {
            if (child instanceof InternalNode internal) {
                children.add(internal.withChildren(rewriteChildren(internal, rewrite)));
            } else {
                children.add(rewrite.apply((LeafNode) child));
            }
        }
        return children;
    }
}
