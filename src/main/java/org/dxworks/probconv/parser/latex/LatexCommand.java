package org.dxworks.probconv.parser.latex;

import java.util.List;

/**
 * A control sequence such as {@code \textbf{x}}. The name excludes the backslash, except for
 * the line break command whose name is {@code \\}.
 */
public final class LatexCommand extends LatexArguments {

    public LatexCommand(String name, List<LatexGroup> args) {
        super(name, args);
    }

    @Override
    public String getSource() {
        return (getName().equals("\\\\") ? getName() : "\\" + getName()) + argsSource();
    }

    @Override
    public String toString() {
        return "LatexCommand[" + getSource() + "]";
    }
}
