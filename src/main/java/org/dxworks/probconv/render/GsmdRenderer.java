package org.dxworks.probconv.render;

import org.dxworks.probconv.exception.RenderException;
import org.dxworks.probconv.model.AlignMath;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.Code;
import org.dxworks.probconv.model.DisplayMath;
import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.InlineCode;
import org.dxworks.probconv.model.InlineMath;
import org.dxworks.probconv.model.InternalNode;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.Text;
import org.dxworks.probconv.model.TrueFalse;
import org.dxworks.probconv.util.TextBlocks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders Gradescope Markdown. Blocks are separated by an empty line and the output is
 * stripped.
 * <p>
 * The format has no subproblems and no file references, and every choice must fit on a
 * single line.
 */
public class GsmdRenderer extends AbstractProblemRenderer {

    private static final String MARKDOWN_SPECIALS = "\\`*_[]<#$";

    public GsmdRenderer() {
        this(Collections.emptyMap());
    }

    public GsmdRenderer(Map<NodeType, NodeRenderer> overrides) {
        super("Gradescope Markdown", defaultRenderers(), unsupportedTypes(), overrides);
    }

    public static Map<NodeType, NodeRenderer> defaultRenderers() {
        Map<NodeType, NodeRenderer> renderers = new EnumMap<>(NodeType.class);
        renderers.put(NodeType.PROBLEM, (node, r) -> blocks((InternalNode) node, r));
        renderers.put(NodeType.PARAGRAPH, (node, r) -> inline((InternalNode) node, r));
        renderers.put(NodeType.TEXT, (node, r) -> renderText((Text) node));
        renderers.put(NodeType.INLINE_MATH, (node, r) -> "$$" + ((InlineMath) node).getLatex() + "$$");
        renderers.put(NodeType.INLINE_CODE, (node, r) -> renderInlineCode((InlineCode) node));
        renderers.put(NodeType.INLINE_RESPONSE_BOX, (node, r) -> "[____](" + inline((InternalNode) node, r) + ")");
        renderers.put(NodeType.DISPLAY_MATH, (node, r) -> "$$" + ((DisplayMath) node).getLatex() + "$$");
        renderers.put(NodeType.ALIGN_MATH, (node, r) ->
                "$$\\begin{aligned}" + ((AlignMath) node).getLatex() + "\\end{aligned}$$");
        renderers.put(NodeType.CODE, (node, r) -> {
            Code code = (Code) node;
            return "```" + code.getLanguage() + "\n" + TextBlocks.stripTrailingNewline(code.getCode()) + "\n```";
        });
        renderers.put(NodeType.IMAGE_FILE, (node, r) -> "![](" + ((ImageFile) node).getRelativePath() + ")");
        renderers.put(NodeType.TRUE_FALSE, (node, r) -> ((TrueFalse) node).getSolution()
                ? "(x) True\n( ) False"
                : "( ) True\n(x) False");
        renderers.put(NodeType.SOLUTION, (node, r) -> renderSolution((InternalNode) node, r));
        renderers.put(NodeType.MULTIPLE_CHOICE, (node, r) -> choiceLines((InternalNode) node, r, "(x)", "( )"));
        renderers.put(NodeType.MULTIPLE_SELECT, (node, r) -> choiceLines((InternalNode) node, r, "[x]", "[ ]"));
        renderers.put(NodeType.CHOICE, (node, r) -> blocks((InternalNode) node, r).strip());
        return renderers;
    }

    private static Map<NodeType, String> unsupportedTypes() {
        Map<NodeType, String> unsupported = new EnumMap<>(NodeType.class);
        unsupported.put(NodeType.CODE_FILE, "The problem references a code file, which Gradescope Markdown cannot express;"
                + " inline the code first");
        unsupported.put(NodeType.SUBPROBLEM, "Gradescope Markdown has no subproblems");
        return unsupported;
    }

    @Override
    protected String finish(String output) {
        return output.strip();
    }

    /**
     * Every line of the rendered solution becomes its own {@code [[...]]} line.
     */
    private static String renderSolution(InternalNode solution, NodeRendering rendering) {
        String contents = TextBlocks.collapseBlankLines(blocks(solution, rendering));
        List<String> lines = new ArrayList<>();
        for (String line : contents.split("\n")) {
            if (!line.isBlank()) {
                lines.add("[[" + line + "]]");
            }
        }
        return String.join("\n", lines);
    }

    private static String choiceLines(InternalNode list, NodeRendering rendering, String correct, String incorrect) {
        List<String> lines = new ArrayList<>();
        for (Node child : list.getChildren()) {
            String content = rendering.render(child);
            if (content.contains("\n")) {
                throw new RenderException("Gradescope Markdown does not support multi-line choice options: " + content);
            }
            String marker = child instanceof Choice choice && choice.isCorrect() ? correct : incorrect;
            lines.add(content.isEmpty() ? marker : marker + " " + content);
        }
        return String.join("\n", lines);
    }

    /**
     * Emphasis markers must hug the text, so surrounding spaces are moved outside them.
     */
    private static String renderText(Text text) {
        String raw = text.getText();
        String core = raw.strip();
        String leading = raw.startsWith(" ") ? " " : "";
        String trailing = raw.endsWith(" ") ? " " : "";
        String marker = text.isBold() && text.isItalic() ? "***" : text.isBold() ? "**" : text.isItalic() ? "*" : "";
        if (marker.isEmpty()) {
            return escapeMarkdown(raw);
        }
        return leading + marker + escapeMarkdown(core) + marker + trailing;
    }

    private static String renderInlineCode(InlineCode code) {
        if (code.getCode().contains("`")) {
            return "`` " + code.getCode() + " ``";
        }
        return "`" + code.getCode() + "`";
    }

    static String escapeMarkdown(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (MARKDOWN_SPECIALS.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }
}
