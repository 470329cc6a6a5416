package org.dxworks.probconv.model;

/**
 * Closed set of node kinds in a problem tree.
 */
public enum NodeType {
    PROBLEM("problem", "Problem", true, false),
    SUBPROBLEM("subproblem", "Subproblem", true, false),
    PARAGRAPH("paragraph", "Paragraph", true, false),
    BLOB("blob", "Blob", true, true),
    CHOICE("choice", "Choice", true, false),
    SOLUTION("solution", "Solution", true, false),
    MULTIPLE_CHOICE("multiple_choice", "MultipleChoice", true, false),
    MULTIPLE_SELECT("multiple_select", "MultipleSelect", true, false),
    INLINE_RESPONSE_BOX("inline_response_box", "InlineResponseBox", true, false),
    TEXT("text", "Text", false, false),
    PAR_BREAK("par_break", "ParBreak", false, true),
    INLINE_MATH("inline_math", "InlineMath", false, false),
    DISPLAY_MATH("display_math", "DisplayMath", false, false),
    ALIGN_MATH("align_math", "AlignMath", false, false),
    CODE("code", "Code", false, false),
    INLINE_CODE("inline_code", "InlineCode", false, false),
    CODE_FILE("code_file", "CodeFile", false, false),
    IMAGE_FILE("image_file", "ImageFile", false, false),
    TRUE_FALSE("true_false", "TrueFalse", false, false);

    private final String name;
    private final String displayName;
    private final boolean internal;
    private final boolean transientKind;

    NodeType(String name, String displayName, boolean internal, boolean transientKind) {
        this.name = name;
        this.displayName = displayName;
        this.internal = internal;
        this.transientKind = transientKind;
    }

    /** Snake-case name used in serialized trees. */
    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isInternal() {
        return internal;
    }

    /**
     * Blob and ParBreak only live between a parser and the paragraph reconstructor.
     */
    public boolean isTransient() {
        return transientKind;
    }
}
