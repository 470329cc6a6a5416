package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.InternalNode;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.NodeSchema;
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw tree, where inline content may still sit in {@link Blob}s separated by
 * {@link org.dxworks.probconv.model.ParBreak} markers, into a canonical tree where every run
 * of inline content is wrapped in {@link Paragraph}s.
 * <p>
 * For each internal node, parent first:
 * <ol>
 *     <li>blob children are replaced by their own children;</li>
 *     <li>if the node accepts paragraphs, maximal runs of paragraph-eligible children are cut
 *     at paragraph breaks and each non-empty piece becomes one paragraph whose outer
 *     whitespace is trimmed; otherwise paragraph breaks are dropped;</li>
 *     <li>every internal child, new paragraphs included, is processed the same way.</li>
 * </ol>
 * The input tree is never modified. Running this on a canonical tree returns an equal tree.
 */
public final class ParagraphReconstructor {

    private ParagraphReconstructor() {
        // utility class
    }

    public static Problem reconstruct(Problem problem) {
        return problem.withChildren(canonicalChildren(problem));
    }

    private static List<Node> canonicalChildren(InternalNode node) {
        List<Node> exploded = explodeBlobs(node.getChildren());

        List<Node> grouped = NodeSchema.allows(node.getType(), NodeType.PARAGRAPH)
                ? groupIntoParagraphs(exploded)
                : dropParBreaks(exploded);

        List<Node> children = new ArrayList<>(grouped.size());
        for (Node child : grouped) {
            children.add(child instanceof InternalNode internal ? internal.withChildren(canonicalChildren(internal)) : child);
        }
        return children;
    }

    private static List<Node> explodeBlobs(List<Node> children) {
        List<Node> exploded = new ArrayList<>();
        for (Node child : children) {
            if (child instanceof Blob blob) {
                exploded.addAll(explodeBlobs(blob.getChildren()));
            } else {
                exploded.add(child);
            }
        }
        return exploded;
    }

    private static List<Node> dropParBreaks(List<Node> children) {
        List<Node> kept = new ArrayList<>(children.size());
        for (Node child : children) {
            if (child.getType() != NodeType.PAR_BREAK) {
                kept.add(child);
            }
        }
        return kept;
    }

    private static List<Node> groupIntoParagraphs(List<Node> children) {
        List<Node> result = new ArrayList<>();
        List<Node> pending = new ArrayList<>();
        for (Node child : children) {
            NodeType type = child.getType();
            if (type == NodeType.PAR_BREAK) {
                flush(pending, result);
            } else if (NodeSchema.isParagraphEligible(type)) {
                pending.add(child);
            } else {
                flush(pending, result);
                result.add(child);
            }
        }
        flush(pending, result);
        return result;
    }

    private static void flush(List<Node> pending, List<Node> result) {
        if (pending.isEmpty()) {
            return;
        }
        result.add(new Paragraph(trimBoundaryWhitespace(pending)));
        pending.clear();
    }

    /**
     * Strips leading whitespace from a first text child and trailing whitespace from a last one.
     */
    public static List<Node> trimBoundaryWhitespace(List<? extends Node> inline) {
        List<Node> trimmed = new ArrayList<>(inline);
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        if (trimmed.get(0) instanceof Text first) {
            trimmed.set(0, first.withText(first.getText().stripLeading()));
        }
        int last = trimmed.size() - 1;
        if (trimmed.get(last) instanceof Text lastText) {
            trimmed.set(last, lastText.withText(lastText.getText().stripTrailing()));
        }
        return trimmed;
    }
}
