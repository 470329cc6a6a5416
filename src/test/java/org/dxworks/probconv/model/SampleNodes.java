package org.dxworks.probconv.model;

import java.util.List;

/**
 * One representative node per type, for tests that iterate over {@link NodeType#values()}.
 */
final class SampleNodes {

    private SampleNodes() {
        // utility class
    }

    static Node sample(NodeType type) {
        return switch (type) {
            case TEXT -> new Text("sample");
            case PAR_BREAK -> new ParBreak();
            case INLINE_MATH -> new InlineMath("x^2");
            case DISPLAY_MATH -> new DisplayMath("x^2");
            case ALIGN_MATH -> new AlignMath("x &= 1", true);
            case CODE -> new Code("python", "print(1)\n");
            case INLINE_CODE -> new InlineCode("text", "x = 1");
            case CODE_FILE -> new CodeFile("python", "code/sample.py");
            case IMAGE_FILE -> new ImageFile("images/sample.png");
            case TRUE_FALSE -> new TrueFalse(true);
            default -> construct(type, List.of());
        };
    }

    static InternalNode construct(NodeType type, List<? extends Node> children) {
        return switch (type) {
            case PROBLEM -> new Problem(children);
            case SUBPROBLEM -> new Subproblem(children);
            case PARAGRAPH -> new Paragraph(children);
            case BLOB -> new Blob(children);
            case CHOICE -> new Choice(false, children);
            case SOLUTION -> new Solution(children);
            case MULTIPLE_CHOICE -> new MultipleChoice(children);
            case MULTIPLE_SELECT -> new MultipleSelect(children);
            case INLINE_RESPONSE_BOX -> new InlineResponseBox(children);
            default -> throw new IllegalArgumentException(type + " is a leaf type");
        };
    }
}
