package org.dxworks.probconv.parser.latex;

import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.parser.latex.generated.LatexLexer;
import org.dxworks.probconv.parser.latex.generated.LatexParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the subset of LaTeX used by problem sources into {@link LatexNode}s.
 * <p>
 * The ANTLR grammar does not expand macros: it only splits the source into text, commands with
 * their argument groups, environments and bare groups. Comments are dropped and the escaped
 * characters {@code \% \$ \& \# \_ \{ \}} and {@code \ } are read as text.
 */
public final class LatexReader {

    /**
     * Turns the first syntax error into a {@link ParseException}.
     */
    static final ANTLRErrorListener FAILING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            throw new ParseException("LaTeX line " + line + ": " + msg, e);
        }
    };

    private final CharStream input;
    private final CommonTokenStream tokens;
    // tokens up to this index were consumed by a comment
    private int skipThrough = -1;

    private LatexReader(CharStream input, CommonTokenStream tokens) {
        this.input = input;
        this.tokens = tokens;
    }

    /**
     * Reads a whole document.
     *
     * @throws ParseException on unbalanced groups, unterminated math or mismatched environments
     */
    public static List<LatexNode> read(String source) {
        CharStream input = CharStreams.fromString(source);
        LatexLexer lexer = new LatexLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FAILING_LISTENER);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LatexParser parser = new LatexParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(FAILING_LISTENER);

        LatexParser.DocumentContext document = parser.document();
        return new LatexReader(input, tokens).nodes(document.content());
    }

    private List<LatexNode> nodes(ParserRuleContext content) {
        List<LatexNode> nodes = new ArrayList<>();
        TextRun text = new TextRun();
        if (content.children == null) {
            return nodes;
        }
        for (ParseTree child : content.children) {
            if (child instanceof TerminalNode) {
                text.append(((TerminalNode) child).getSymbol());
                continue;
            }
            ParseTree element = child.getChild(0);
            if (element instanceof LatexParser.TextRunContext) {
                Token token = ((LatexParser.TextRunContext) element).getStart();
                if (token.getTokenIndex() > skipThrough) {
                    text.append(token);
                }
                continue;
            }
            text.flushInto(nodes);
            nodes.add(structure(element));
        }
        text.flushInto(nodes);
        return nodes;
    }

    private LatexNode structure(ParseTree element) {
        if (element instanceof LatexParser.EnvironmentContext) {
            return environment((LatexParser.EnvironmentContext) element);
        }
        if (element instanceof LatexParser.RawEnvironmentContext) {
            return rawEnvironment((LatexParser.RawEnvironmentContext) element);
        }
        if (element instanceof LatexParser.MathContext) {
            return math(((LatexParser.MathContext) element).getStart());
        }
        if (element instanceof LatexParser.CommandContext) {
            return command((LatexParser.CommandContext) element);
        }
        return group((LatexParser.GroupContext) element);
    }

    private LatexEnvironment environment(LatexParser.EnvironmentContext ctx) {
        String name = environmentName(ctx.BEGIN().getSymbol());
        Token end = ctx.END().getSymbol();
        String endName = environmentName(end);
        if (!name.equals(endName)) {
            throw error(end, "Expected \\end{" + name + "} but found \\end{" + endName + "}");
        }

        List<LatexGroup> args = new ArrayList<>();
        Token lastHeader = ctx.BEGIN().getSymbol();
        for (LatexParser.ArgumentContext arg : ctx.argument()) {
            args.add(argument(arg));
            lastHeader = arg.getStop();
        }
        String raw = between(lastHeader, end);
        return new LatexEnvironment(name, args, nodes(ctx.content()), raw);
    }

    private LatexEnvironment rawEnvironment(LatexParser.RawEnvironmentContext ctx) {
        String name = environmentName(ctx.RAW_BEGIN().getSymbol());
        Token end = ctx.RAW_END().getSymbol();
        String endName = environmentName(end);
        if (!name.equals(endName)) {
            throw error(end, "Expected \\end{" + name + "} but found \\end{" + endName + "}");
        }

        List<LatexGroup> args = new ArrayList<>();
        Token lastHeader = ctx.RAW_BEGIN().getSymbol();
        for (TerminalNode arg : ctx.RAW_ARG()) {
            String text = arg.getText();
            String inner = text.substring(1, text.length() - 1);
            args.add(new LatexGroup(text.startsWith("["), List.of(new LatexText(inner)), inner));
            lastHeader = arg.getSymbol();
        }
        String raw = between(lastHeader, end);
        return new LatexEnvironment(name, args, List.of(new LatexText(raw)), raw);
    }

    private static LatexEnvironment math(Token token) {
        String text = token.getText();
        return switch (token.getType()) {
            case LatexLexer.DISPLAY_DOLLAR_MATH -> mathEnvironment("$$", text.substring(2, text.length() - 2));
            case LatexLexer.INLINE_DOLLAR_MATH -> mathEnvironment("$", text.substring(1, text.length() - 1));
            case LatexLexer.PAREN_MATH -> mathEnvironment("$", text.substring(2, text.length() - 2));
            default -> mathEnvironment("displaymath", text.substring(2, text.length() - 2));
        };
    }

    private static LatexEnvironment mathEnvironment(String name, String raw) {
        return new LatexEnvironment(name, List.of(), List.of(new LatexText(raw)), raw);
    }

    private LatexCommand command(LatexParser.CommandContext ctx) {
        if (ctx.LINE_BREAK() != null) {
            return new LatexCommand("\\\\", List.of());
        }
        if (ctx.SYMBOL_COMMAND() != null) {
            return new LatexCommand(ctx.SYMBOL_COMMAND().getText().substring(1), List.of());
        }
        List<LatexGroup> args = new ArrayList<>();
        for (LatexParser.ArgumentContext arg : ctx.argument()) {
            args.add(argument(arg));
        }
        return new LatexCommand(ctx.COMMAND().getText().substring(1), args);
    }

    private LatexGroup argument(LatexParser.ArgumentContext ctx) {
        if (ctx.group() != null) {
            return group(ctx.group());
        }
        LatexParser.OptionalGroupContext optional = ctx.optionalGroup();
        return new LatexGroup(true, nodes(optional.bracketContent()),
                between(optional.LBRACK().getSymbol(), optional.RBRACK().getSymbol()));
    }

    private LatexGroup group(LatexParser.GroupContext ctx) {
        return new LatexGroup(false, nodes(ctx.content()),
                between(ctx.LBRACE().getSymbol(), ctx.RBRACE().getSymbol()));
    }

    /** Source strictly between two tokens. */
    private String between(Token from, Token to) {
        int start = from.getStopIndex() + 1;
        int stop = to.getStartIndex() - 1;
        return stop < start ? "" : input.getText(Interval.of(start, stop));
    }

    private static String environmentName(Token token) {
        String text = token.getText();
        return text.substring(text.indexOf('{') + 1, text.lastIndexOf('}')).strip();
    }

    private static ParseException error(Token token, String message) {
        return new ParseException("LaTeX line " + token.getLine() + ": " + message);
    }

    /**
     * Consecutive text tokens, read as one {@link LatexText}.
     */
    private final class TextRun {

        private final StringBuilder text = new StringBuilder();
        private Token first;
        private Token last;

        void append(Token token) {
            if (first == null) {
                first = token;
            }
            last = token;
            switch (token.getType()) {
                case LatexLexer.ESCAPED_CHAR -> {
                    char escaped = token.getText().charAt(1);
                    text.append(escaped == '\n' ? ' ' : escaped);
                }
                case LatexLexer.COMMENT -> skipLineEnd(token);
                default -> text.append(token.getText());
            }
        }

        /**
         * A comment also drops the newline ending it and the next line's indentation, unless
         * that line is blank: the blank line still separates paragraphs.
         */
        private void skipLineEnd(Token comment) {
            int index = comment.getTokenIndex() + 1;
            if (tokens.get(index).getType() != LatexLexer.NEWLINE) {
                return;
            }
            int next = index + 1;
            if (tokens.get(next).getType() == LatexLexer.SPACE) {
                next++;
            }
            int type = tokens.get(next).getType();
            if (type != LatexLexer.NEWLINE && type != Token.EOF) {
                skipThrough = next - 1;
            }
        }

        void flushInto(List<LatexNode> nodes) {
            if (text.length() > 0) {
                String source = input.getText(Interval.of(first.getStartIndex(), last.getStopIndex()));
                nodes.add(new LatexText(text.toString(), source));
            }
            text.setLength(0);
            first = null;
            last = null;
        }
    }
}
