package org.dxworks.probconv.parser.latex;

import java.util.List;
import java.util.Optional;

/**
 * Argument access shared by commands and environments.
 */
public abstract class LatexArguments extends LatexNode {

    private final String name;
    private final List<LatexGroup> args;

    protected LatexArguments(String name, List<LatexGroup> args) {
        this.name = name;
        this.args = List.copyOf(args);
    }

    public String getName() {
        return name;
    }

    public List<LatexGroup> getArgs() {
        return args;
    }

    /**
     * The {@code index}-th brace argument, ignoring bracket arguments.
     */
    public Optional<LatexGroup> requiredArg(int index) {
        int seen = 0;
        for (LatexGroup arg : args) {
            if (!arg.isOptional()) {
                if (seen == index) {
                    return Optional.of(arg);
                }
                seen++;
            }
        }
        return Optional.empty();
    }

    public Optional<LatexGroup> optionalArg(int index) {
        int seen = 0;
        for (LatexGroup arg : args) {
            if (arg.isOptional()) {
                if (seen == index) {
                    return Optional.of(arg);
                }
                seen++;
            }
        }
        return Optional.empty();
    }

    public Optional<LatexGroup> lastRequiredArg() {
        for (int i = args.size() - 1; i >= 0; i--) {
            if (!args.get(i).isOptional()) {
                return Optional.of(args.get(i));
            }
        }
        return Optional.empty();
    }

    protected String argsSource() {
        StringBuilder out = new StringBuilder();
        for (LatexGroup arg : args) {
            out.append(arg.getSource());
        }
        return out.toString();
    }
}
