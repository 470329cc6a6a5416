package org.dxworks.probconv.parser.markdown;

import java.util.List;

/**
 * A run of consecutive source lines of one kind.
 */
public final class GradescopeBlock {

    public enum Kind {
        MARKDOWN,
        /** {@code ( )} / {@code (x)} lines */
        CHOICES,
        /** {@code [ ]} / {@code [x]} lines */
        SELECTS,
        /** {@code [[...]]} lines */
        SOLUTIONS
    }

    private final Kind kind;
    private final List<String> lines;

    public GradescopeBlock(Kind kind, List<String> lines) {
        this.kind = kind;
        this.lines = List.copyOf(lines);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getLines() {
        return lines;
    }

    public String text() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return kind + lines.toString();
    }
}
