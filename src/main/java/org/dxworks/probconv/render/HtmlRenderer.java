package org.dxworks.probconv.render;

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
 * Renders a standalone HTML fragment. Math is left for MathJax-style typesetting between
 * {@code \( \)} and {@code \[ \]} delimiters.
 * <p>
 * Subproblems are numbered "Part 1)", "Part 2)", ... and every response box and choice group
 * gets an id that is unique within one render.
 */
public class HtmlRenderer extends AbstractProblemRenderer {

    public HtmlRenderer() {
        this(Collections.emptyMap());
    }

    public HtmlRenderer(Map<NodeType, NodeRenderer> overrides) {
        super("HTML", defaultRenderers(), unsupportedTypes(), overrides);
    }

    public static Map<NodeType, NodeRenderer> defaultRenderers() {
        Map<NodeType, NodeRenderer> renderers = new EnumMap<>(NodeType.class);
        renderers.put(NodeType.PROBLEM, (node, r) -> "<div class=\"problem\">\n"
                + "    <div class=\"problem-body\">\n"
                + lines((InternalNode) node, r) + "\n"
                + "    </div>\n"
                + "</div>");
        renderers.put(NodeType.SUBPROBLEM, (node, r) -> "<div class=\"subproblem\">\n"
                + "    <h3 class=\"subproblem-id\">Part " + r.nextSequence("subproblem") + ")</h3>\n"
                + lines((InternalNode) node, r) + "\n"
                + "</div>");
        renderers.put(NodeType.PARAGRAPH, (node, r) -> "<p>" + inline((InternalNode) node, r) + "</p>");
        renderers.put(NodeType.TEXT, (node, r) -> renderText((Text) node));
        renderers.put(NodeType.INLINE_MATH, (node, r) ->
                "<span class=\"math\">\\(" + TextBlocks.escapeHtml(((InlineMath) node).getLatex()) + "\\)</span>");
        renderers.put(NodeType.INLINE_CODE, (node, r) ->
                "<span class=\"inline-code\"><code>" + TextBlocks.escapeHtml(((InlineCode) node).getCode()) + "</code></span>");
        renderers.put(NodeType.INLINE_RESPONSE_BOX, (node, r) -> renderResponseBox((InternalNode) node, r));
        renderers.put(NodeType.DISPLAY_MATH, (node, r) ->
                "<div class=\"math\">\\[" + TextBlocks.escapeHtml(((DisplayMath) node).getLatex()) + "\\]</div>");
        renderers.put(NodeType.ALIGN_MATH, (node, r) -> {
            AlignMath math = (AlignMath) node;
            return "<div class=\"math\">\\begin{" + math.environmentName() + "}"
                    + TextBlocks.escapeHtml(math.getLatex())
                    + "\\end{" + math.environmentName() + "}</div>";
        });
        renderers.put(NodeType.CODE, (node, r) -> {
            Code code = (Code) node;
            return "<pre class=\"code\"><code class=\"language-" + TextBlocks.escapeHtml(code.getLanguage()) + "\">"
                    + TextBlocks.escapeHtml(TextBlocks.stripTrailingNewline(code.getCode()))
                    + "</code></pre>";
        });
        renderers.put(NodeType.IMAGE_FILE, (node, r) ->
                "<div class=\"image\"><img src=\"" + TextBlocks.escapeHtml(((ImageFile) node).getRelativePath()) + "\" /></div>");
        renderers.put(NodeType.TRUE_FALSE, (node, r) -> renderTrueFalse((TrueFalse) node, r));
        renderers.put(NodeType.SOLUTION, (node, r) -> "<details class=\"solution\">\n"
                + "    <summary>Solution</summary>\n"
                + lines((InternalNode) node, r) + "\n"
                + "</details>");
        renderers.put(NodeType.MULTIPLE_CHOICE, (node, r) ->
                choiceGroup((InternalNode) node, r, "multiple-choice", "radio"));
        renderers.put(NodeType.MULTIPLE_SELECT, (node, r) ->
                choiceGroup((InternalNode) node, r, "multiple-select", "checkbox"));
        renderers.put(NodeType.CHOICE, (node, r) -> lines((InternalNode) node, r));
        return renderers;
    }

    private static Map<NodeType, String> unsupportedTypes() {
        Map<NodeType, String> unsupported = new EnumMap<>(NodeType.class);
        unsupported.put(NodeType.CODE_FILE, "The problem references a code file; inline the code before rendering HTML");
        return unsupported;
    }

    private static String lines(InternalNode node, NodeRendering rendering) {
        return String.join("\n", rendering.renderAll(node.getChildren()));
    }

    private static String renderText(Text text) {
        String html = TextBlocks.escapeHtml(text.getText());
        if (text.isBold()) {
            html = "<b>" + html + "</b>";
        }
        if (text.isItalic()) {
            html = "<i>" + html + "</i>";
        }
        return html;
    }

    private static String choiceGroup(InternalNode list, NodeRendering rendering, String cssClass, String inputType) {
        String name = "choice-" + rendering.nextSequence("choices");
        List<String> choices = new ArrayList<>();
        for (Node child : list.getChildren()) {
            String checked = child instanceof Choice choice && choice.isCorrect() ? " data-correct=\"true\"" : "";
            choices.add("    <div class=\"choice\"><label><input name=\"" + name + "\" type=\"" + inputType + "\"" + checked + " />"
                    + rendering.render(child) + "</label></div>");
        }
        return "<div class=\"" + cssClass + "\">\n" + String.join("\n", choices) + "\n</div>";
    }

    private static String renderTrueFalse(TrueFalse node, NodeRendering rendering) {
        String name = "true-false-" + rendering.nextSequence("true-false");
        String answer = node.getSolution() ? "true" : "false";
        return "<div class=\"true-false\" data-answer=\"" + answer + "\">\n"
                + "    <label><input type=\"radio\" name=\"" + name + "\" value=\"true\" /> True</label>\n"
                + "    <label><input type=\"radio\" name=\"" + name + "\" value=\"false\" /> False</label>\n"
                + "</div>";
    }

    private static String renderResponseBox(InternalNode box, NodeRendering rendering) {
        int id = rendering.nextSequence("response-box");
        String answerId = "answer-" + id;
        String buttonId = "button-" + id;
        return "<span class=\"inline-response-box\">"
                + "<span id=\"" + answerId + "\" style=\"display: none\">" + inline(box, rendering) + "</span>"
                + "<button type=\"button\" id=\"" + buttonId + "\" onclick=\""
                + "document.getElementById('" + answerId + "').style.display = 'inline';"
                + " document.getElementById('" + buttonId + "').style.display = 'none'\">Show Answer</button>"
                + "</span>";
    }
}
