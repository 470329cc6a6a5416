package org.dxworks.probconv.render;

import org.dxworks.probconv.model.AlignMath;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.Code;
import org.dxworks.probconv.model.CodeFile;
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
 * Renders DSCTeX: a {@code prob} environment whose blocks are indented by four spaces and
 * separated by empty lines. Consecutive subproblems share one {@code subprobset}.
 */
public class DscTexRenderer extends AbstractProblemRenderer {

    private static final String INDENT = "    ";

    public DscTexRenderer() {
        this(Collections.emptyMap());
    }

    public DscTexRenderer(Map<NodeType, NodeRenderer> overrides) {
        super("DSCTeX", defaultRenderers(), Collections.emptyMap(), overrides);
    }

    public static Map<NodeType, NodeRenderer> defaultRenderers() {
        Map<NodeType, NodeRenderer> renderers = new EnumMap<>(NodeType.class);
        renderers.put(NodeType.PROBLEM, (node, r) -> environment("prob", "", problemBlocks((InternalNode) node, r)));
        renderers.put(NodeType.SUBPROBLEM, (node, r) -> environment("subprob", "", blocks((InternalNode) node, r)));
        renderers.put(NodeType.PARAGRAPH, (node, r) -> inline((InternalNode) node, r));
        renderers.put(NodeType.TEXT, (node, r) -> renderText((Text) node));
        renderers.put(NodeType.INLINE_MATH, (node, r) -> "$" + ((InlineMath) node).getLatex() + "$");
        renderers.put(NodeType.INLINE_CODE, (node, r) -> {
            InlineCode code = (InlineCode) node;
            return "\\mintinline{" + code.getLanguage() + "}{" + code.getCode() + "}";
        });
        renderers.put(NodeType.INLINE_RESPONSE_BOX, (node, r) ->
                "\\inlineresponsebox{" + inline((InternalNode) node, r) + "}");
        renderers.put(NodeType.DISPLAY_MATH, (node, r) ->
                "\\[\n" + TextBlocks.indent(((DisplayMath) node).getLatex(), INDENT) + "\n\\]");
        renderers.put(NodeType.ALIGN_MATH, (node, r) -> {
            AlignMath math = (AlignMath) node;
            return environment(math.environmentName(), "", math.getLatex());
        });
        renderers.put(NodeType.CODE, (node, r) -> {
            Code code = (Code) node;
            return "\\begin{minted}{" + code.getLanguage() + "}\n"
                    + TextBlocks.stripTrailingNewline(code.getCode())
                    + "\n\\end{minted}";
        });
        renderers.put(NodeType.CODE_FILE, (node, r) -> {
            CodeFile file = (CodeFile) node;
            return "\\inputminted{" + file.getLanguage() + "}{" + file.getRelativePath() + "}";
        });
        renderers.put(NodeType.IMAGE_FILE, (node, r) -> "\\includegraphics{" + ((ImageFile) node).getRelativePath() + "}");
        renderers.put(NodeType.TRUE_FALSE, (node, r) -> ((TrueFalse) node).getSolution() ? "\\Tf{}" : "\\tF{}");
        renderers.put(NodeType.SOLUTION, (node, r) -> environment("soln", "", blocks((InternalNode) node, r)));
        renderers.put(NodeType.MULTIPLE_CHOICE, (node, r) -> environment("choices", "", choices((InternalNode) node, r)));
        renderers.put(NodeType.MULTIPLE_SELECT, (node, r) ->
                environment("choices", "[rectangle]", choices((InternalNode) node, r)));
        renderers.put(NodeType.CHOICE, (node, r) -> renderChoice((Choice) node, r));
        return renderers;
    }

    @Override
    protected String finish(String output) {
        return output + "\n";
    }

    private static String problemBlocks(InternalNode problem, NodeRendering rendering) {
        List<String> rendered = new ArrayList<>();
        List<String> subproblems = new ArrayList<>();
        for (Node child : problem.getChildren()) {
            if (child.getType() == NodeType.SUBPROBLEM) {
                subproblems.add(rendering.render(child));
                continue;
            }
            flushSubproblems(subproblems, rendered);
            rendered.add(rendering.render(child));
        }
        flushSubproblems(subproblems, rendered);
        return joinBlocks(rendered);
    }

    private static void flushSubproblems(List<String> subproblems, List<String> rendered) {
        if (!subproblems.isEmpty()) {
            rendered.add(environment("subprobset", "", joinBlocks(subproblems)));
            subproblems.clear();
        }
    }

    private static String choices(InternalNode list, NodeRendering rendering) {
        return String.join("\n", rendering.renderAll(list.getChildren()));
    }

    /**
     * The content goes in the marker's brace argument, so that text starting with a bracket
     * is not read back as an optional argument.
     */
    private static String renderChoice(Choice choice, NodeRendering rendering) {
        String marker = choice.isCorrect() ? "\\correctchoice" : "\\choice";
        String content = blocks(choice, rendering);
        if (!content.contains("\n")) {
            return marker + "{" + content + "}";
        }
        return marker + "{\n" + TextBlocks.indent(content, INDENT) + "\n}";
    }

    private static String renderText(Text text) {
        String escaped = TextBlocks.escapeLatex(text.getText());
        if (text.isItalic()) {
            escaped = "\\textit{" + escaped + "}";
        }
        if (text.isBold()) {
            escaped = "\\textbf{" + escaped + "}";
        }
        return escaped;
    }

    private static String environment(String name, String args, String body) {
        String begin = "\\begin{" + name + "}" + args;
        String end = "\\end{" + name + "}";
        if (body.isEmpty()) {
            return begin + "\n" + end;
        }
        return begin + "\n" + TextBlocks.indent(body, INDENT) + "\n" + end;
    }
}
