package org.dxworks.probconv.model;

import org.dxworks.probconv.exception.IllegalChildException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static table of the child types each internal node type accepts.
 */
public final class NodeSchema {

    private static final Map<NodeType, Set<NodeType>> ALLOWED_CHILDREN = new EnumMap<>(NodeType.class);

    static {
        Set<NodeType> problem = EnumSet.of(
                NodeType.SUBPROBLEM,
                NodeType.PARAGRAPH,
                NodeType.BLOB,
                NodeType.CODE,
                NodeType.CODE_FILE,
                NodeType.DISPLAY_MATH,
                NodeType.ALIGN_MATH,
                NodeType.IMAGE_FILE,
                NodeType.MULTIPLE_CHOICE,
                NodeType.MULTIPLE_SELECT,
                NodeType.TRUE_FALSE,
                NodeType.INLINE_RESPONSE_BOX,
                NodeType.SOLUTION);

        // subproblems do not nest
        Set<NodeType> subproblem = EnumSet.copyOf(problem);
        subproblem.remove(NodeType.SUBPROBLEM);

        Set<NodeType> choice = EnumSet.of(
                NodeType.BLOB,
                NodeType.PARAGRAPH,
                NodeType.IMAGE_FILE,
                NodeType.CODE,
                NodeType.CODE_FILE,
                NodeType.DISPLAY_MATH,
                NodeType.ALIGN_MATH);

        register(NodeType.PROBLEM, problem);
        register(NodeType.SUBPROBLEM, subproblem);
        register(NodeType.PARAGRAPH, EnumSet.of(
                NodeType.TEXT,
                NodeType.INLINE_MATH,
                NodeType.INLINE_CODE,
                NodeType.INLINE_RESPONSE_BOX,
                NodeType.BLOB));
        register(NodeType.BLOB, EnumSet.of(
                NodeType.TEXT,
                NodeType.INLINE_MATH,
                NodeType.INLINE_CODE,
                NodeType.INLINE_RESPONSE_BOX,
                NodeType.PAR_BREAK));
        register(NodeType.CHOICE, choice);
        register(NodeType.SOLUTION, EnumSet.copyOf(choice));
        register(NodeType.MULTIPLE_CHOICE, EnumSet.of(NodeType.CHOICE));
        register(NodeType.MULTIPLE_SELECT, EnumSet.of(NodeType.CHOICE));
        register(NodeType.INLINE_RESPONSE_BOX, EnumSet.of(
                NodeType.TEXT,
                NodeType.INLINE_MATH,
                NodeType.INLINE_CODE));

        for (NodeType type : NodeType.values()) {
            ALLOWED_CHILDREN.putIfAbsent(type, Collections.emptySet());
        }
    }

    private NodeSchema() {
    }

    private static void register(NodeType parent, Set<NodeType> children) {
        ALLOWED_CHILDREN.put(parent, Collections.unmodifiableSet(children));
    }

    /**
     * Returns the child types {@code parent} accepts. Empty for leaf types.
     */
    public static Set<NodeType> allowedChildren(NodeType parent) {
        return ALLOWED_CHILDREN.get(parent);
    }

    public static boolean allows(NodeType parent, NodeType child) {
        return ALLOWED_CHILDREN.get(parent).contains(child);
    }

    /**
     * A node type is paragraph-eligible when a {@link Paragraph} may hold it directly.
     */
    public static boolean isParagraphEligible(NodeType type) {
        return allows(NodeType.PARAGRAPH, type) && type != NodeType.BLOB;
    }

    static void checkChild(NodeType parent, NodeType child) {
        if (!allows(parent, child)) {
            throw new IllegalChildException(parent, child);
        }
    }
}
