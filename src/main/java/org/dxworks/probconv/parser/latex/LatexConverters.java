package org.dxworks.probconv.parser.latex;

import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.model.AlignMath;
import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.Code;
import org.dxworks.probconv.model.CodeFile;
import org.dxworks.probconv.model.DisplayMath;
import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.InlineCode;
import org.dxworks.probconv.model.InlineMath;
import org.dxworks.probconv.model.InlineResponseBox;
import org.dxworks.probconv.model.MultipleChoice;
import org.dxworks.probconv.model.MultipleSelect;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.ParBreak;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.model.Subproblem;
import org.dxworks.probconv.model.Text;
import org.dxworks.probconv.model.TrueFalse;
import org.dxworks.probconv.transform.ParagraphReconstructor;
import org.dxworks.probconv.util.Segments;
import org.dxworks.probconv.util.TextBlocks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Built-in DSCTeX converter tables.
 */
public final class LatexConverters {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");

    private static final Set<String> CHOICE_MARKERS = Set.of("choice", "correctchoice");

    private LatexConverters() {
        // utility class
    }

    public static Map<String, EnvironmentConverter> defaultEnvironmentConverters() {
        Map<String, EnvironmentConverter> converters = new LinkedHashMap<>();
        converters.put("prob", LatexConverters::convertProb);
        converters.put("subprob", (env, conversion) -> new Subproblem(conversion.convertAll(env.getContents())));
        converters.put("soln", (env, conversion) -> new Solution(conversion.convertAll(env.getContents())));
        converters.put("choices", LatexConverters::convertChoices);
        converters.put("minted", LatexConverters::convertMinted);
        converters.put("$", (env, conversion) -> new InlineMath(env.getRawContents()));
        converters.put("$$", LatexConverters::convertDisplayMath);
        converters.put("displaymath", LatexConverters::convertDisplayMath);
        converters.put("equation", LatexConverters::convertDisplayMath);
        converters.put("equation*", LatexConverters::convertDisplayMath);
        converters.put("align", LatexConverters::convertAlign);
        converters.put("align*", LatexConverters::convertAlign);
        return converters;
    }

    public static Map<String, CommandConverter> defaultCommandConverters() {
        Map<String, CommandConverter> converters = new LinkedHashMap<>();
        converters.put("textbf", (cmd, conversion) -> styled(cmd, conversion, true, false));
        converters.put("textit", (cmd, conversion) -> styled(cmd, conversion, false, true));
        converters.put("emph", (cmd, conversion) -> styled(cmd, conversion, false, true));
        converters.put("texttt", (cmd, conversion) -> new InlineCode("text", requiredArg(cmd, 0).getRawContents()));
        converters.put("includegraphics", (cmd, conversion) ->
                new ImageFile(lastRequiredArg(cmd).getRawContents().strip()));
        converters.put("inputminted", (cmd, conversion) -> new CodeFile(
                requiredArg(cmd, 0).getRawContents().strip(),
                requiredArg(cmd, 1).getRawContents().strip()));
        converters.put("mintinline", (cmd, conversion) -> new InlineCode(
                requiredArg(cmd, 0).getRawContents().strip(),
                requiredArg(cmd, 1).getRawContents()));
        converters.put("inlineresponsebox", LatexConverters::convertResponseBox);
        converters.put("Tf", (cmd, conversion) -> new TrueFalse(true));
        converters.put("tF", (cmd, conversion) -> new TrueFalse(false));
        converters.put("par", (cmd, conversion) -> new ParBreak());
        converters.put("\\\\", (cmd, conversion) -> new ParBreak());
        converters.put("textbackslash", (cmd, conversion) -> new Text("\\"));
        return converters;
    }

    /**
     * Text as a blob: a {@link Text} per blank-line separated chunk, with a
     * {@link ParBreak} between chunks. Whitespace-only chunks give no text.
     */
    public static Blob textBlob(String text) {
        Blob blob = new Blob();
        String[] chunks = PARAGRAPH_BREAK.split(text, -1);
        for (int i = 0; i < chunks.length; i++) {
            if (i > 0) {
                blob.addChild(new ParBreak());
            }
            if (!chunks[i].isBlank()) {
                blob.addChild(new Text(chunks[i]));
            }
        }
        return blob;
    }

    /**
     * Whitespace with no paragraph break in it, such as the space in
     * {@code \textbf{a} \textit{b}}.
     */
    public static boolean isWhitespaceGap(LatexNode node) {
        return node instanceof LatexText text
                && text.isBlank()
                && !PARAGRAPH_BREAK.matcher(text.getText()).find();
    }

    private static Problem convertProb(LatexEnvironment env, LatexConversion conversion) {
        List<LatexNode> contents = new ArrayList<>();
        for (LatexNode child : env.getContents()) {
            if (child instanceof LatexEnvironment nested && nested.getName().equals("subprobset")) {
                contents.addAll(nested.getContents());
            } else {
                contents.add(child);
            }
        }
        return new Problem(conversion.convertAll(contents));
    }

    /**
     * Each {@code \choice} or {@code \correctchoice} starts a choice holding the marker's
     * brace argument, if any, followed by everything up to the next marker.
     */
    private static Node convertChoices(LatexEnvironment env, LatexConversion conversion) {
        List<List<LatexNode>> segments = Segments.segment(env.getContents(), LatexConverters::isChoiceMarker);

        List<Choice> choices = new ArrayList<>();
        for (List<LatexNode> segment : segments) {
            if (!isChoiceMarker(segment.get(0))) {
                if (!segment.stream().allMatch(LatexNode::isBlank)) {
                    throw new ParseException("Content before the first \\choice in a choices environment");
                }
                continue;
            }
            LatexCommand marker = (LatexCommand) segment.get(0);
            List<Node> children = new ArrayList<>();
            marker.requiredArg(0).ifPresent(arg -> children.addAll(conversion.convertAll(arg.getContents())));
            children.addAll(conversion.convertAll(segment.subList(1, segment.size())));
            choices.add(new Choice(marker.getName().equals("correctchoice"), children));
        }

        boolean rectangle = env.optionalArg(0)
                .map(arg -> arg.getRawContents().strip().equals("rectangle"))
                .orElse(false);
        return rectangle ? new MultipleSelect(choices) : new MultipleChoice(choices);
    }

    private static boolean isChoiceMarker(LatexNode node) {
        return node instanceof LatexCommand command && CHOICE_MARKERS.contains(command.getName());
    }

    private static Code convertMinted(LatexEnvironment env, LatexConversion conversion) {
        String language = env.lastRequiredArg()
                .orElseThrow(() -> new ParseException("minted environment without a language"))
                .getRawContents()
                .strip();
        String code = TextBlocks.dedent(env.getRawContents());
        if (code.startsWith("\n")) {
            code = code.substring(1);
        }
        code = code.stripTrailing();
        return new Code(language, code.isEmpty() ? "" : code + "\n");
    }

    private static DisplayMath convertDisplayMath(LatexEnvironment env, LatexConversion conversion) {
        return new DisplayMath(mathBlock(env.getRawContents()));
    }

    private static AlignMath convertAlign(LatexEnvironment env, LatexConversion conversion) {
        return new AlignMath(mathBlock(env.getRawContents()), env.getName().endsWith("*"));
    }

    private static String mathBlock(String raw) {
        return TextBlocks.dedent(raw).strip();
    }

    private static Blob styled(LatexCommand cmd, LatexConversion conversion, boolean bold, boolean italic) {
        Blob blob = new Blob();
        for (Node node : conversion.convertInline(requiredArg(cmd, 0).getContents())) {
            if (node.getType() == NodeType.PAR_BREAK) {
                throw new ParseException("Paragraph break inside \\" + cmd.getName());
            }
            blob.addChild(node instanceof Text text ? text.withStyle(bold, italic) : node);
        }
        return blob;
    }

    private static InlineResponseBox convertResponseBox(LatexCommand cmd, LatexConversion conversion) {
        List<Node> answer = conversion.convertInline(lastRequiredArg(cmd).getContents());
        if (answer.isEmpty() || answer.stream().anyMatch(node -> node.getType() == NodeType.PAR_BREAK)) {
            throw new ParseException("Inline response box answer should be a single paragraph");
        }
        return new InlineResponseBox(ParagraphReconstructor.trimBoundaryWhitespace(answer));
    }

    private static LatexGroup requiredArg(LatexCommand cmd, int index) {
        return cmd.requiredArg(index).orElseThrow(() -> new ParseException(
                "\\" + cmd.getName() + " expects at least " + (index + 1) + " argument(s)"));
    }

    private static LatexGroup lastRequiredArg(LatexCommand cmd) {
        return cmd.lastRequiredArg().orElseThrow(() -> new ParseException(
                "\\" + cmd.getName() + " expects an argument"));
    }
}
