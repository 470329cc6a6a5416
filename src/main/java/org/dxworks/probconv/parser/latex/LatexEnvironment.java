package org.dxworks.probconv.parser.latex;

import java.util.List;

/**
 * A {@code \begin{name}...\end{name}} block. Math delimiters are read as environments too:
 * {@code $...$} and {@code \(...\)} are named {@code $}, {@code $$...$$} is named {@code $$}
 * and {@code \[...\]} is named {@code displaymath}.
 * <p>
 * Verbatim-like and math environments have their contents captured as raw text only: for
 * them {@link #getContents()} holds a single {@link LatexText} with the raw source.
 */
public final class LatexEnvironment extends LatexArguments {

    private final List<LatexNode> contents;
    private final String rawContents;

    public LatexEnvironment(String name, List<LatexGroup> args, List<LatexNode> contents, String rawContents) {
        super(name, args);
        this.contents = List.copyOf(contents);
        this.rawContents = rawContents;
    }

    public List<LatexNode> getContents() {
        return contents;
    }

    /** Source between the arguments and the end of the environment, as written. */
    public String getRawContents() {
        return rawContents;
    }

    @Override
    public String getSource() {
        return switch (getName()) {
            case "$" -> "$" + rawContents + "$";
            case "$$" -> "$$" + rawContents + "$$";
            default -> "\\begin{" + getName() + "}" + argsSource() + rawContents + "\\end{" + getName() + "}";
        };
    }

    @Override
    public String toString() {
        return "LatexEnvironment[" + getName() + "]";
    }
}
