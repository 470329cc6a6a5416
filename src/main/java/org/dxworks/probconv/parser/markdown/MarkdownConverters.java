package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.Code;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.InlineCode;
import org.dxworks.probconv.model.InlineMath;
import org.dxworks.probconv.model.InlineResponseBox;
import org.dxworks.probconv.model.MultipleChoice;
import org.dxworks.probconv.model.MultipleSelect;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.transform.ParagraphReconstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in Gradescope Markdown converter table, keyed by construct name.
 */
public final class MarkdownConverters {

    private static final String DEFAULT_CODE_LANGUAGE = "text";

    private MarkdownConverters() {
        // utility class
    }

    public static Map<String, MarkdownConverter> defaultConverters() {
        Map<String, MarkdownConverter> converters = new LinkedHashMap<>();
        converters.put("document", (element, conversion) -> new Problem(conversion.convertChildren(element)));
        converters.put("paragraph", MarkdownConverters::convertParagraph);
        converters.put("text", (element, conversion) -> convertText((Text) element));
        converters.put("soft_line_break", (element, conversion) -> new Blob());
        converters.put("hard_line_break", (element, conversion) -> new Blob());
        converters.put("emphasis", (element, conversion) -> styled(element, conversion, false, true));
        converters.put("strong_emphasis", (element, conversion) -> styled(element, conversion, true, false));
        converters.put("code", (element, conversion) ->
                new InlineCode(DEFAULT_CODE_LANGUAGE, ((Code) element).getLiteral()));
        converters.put("fenced_code", MarkdownConverters::convertFencedCode);
        converters.put("indented_code", (element, conversion) ->
                new org.dxworks.probconv.model.Code(DEFAULT_CODE_LANGUAGE, ((IndentedCodeBlock) element).getLiteral()));
        converters.put("image", (element, conversion) -> {
            throw new ParseException("Inline images are not supported: " + ((Image) element).getDestination());
        });
        converters.put("inline_math", (element, conversion) -> new InlineMath(((InlineMathNode) element).getLatex()));
        converters.put("response_box", MarkdownConverters::convertResponseBox);
        converters.put("choices", MarkdownConverters::convertChoices);
        converters.put("solution", (element, conversion) -> new Solution(conversion.convertChildren(element)));
        return converters;
    }

    /**
     * Name under which a commonmark node is looked up in the converter table. Constructs with
     * no built-in converter get their class name in snake case, for example {@code bullet_list}.
     */
    public static String constructName(org.commonmark.node.Node element) {
        if (element instanceof Document) {
            return "document";
        } else if (element instanceof Paragraph) {
            return "paragraph";
        } else if (element instanceof Text) {
            return "text";
        } else if (element instanceof SoftLineBreak) {
            return "soft_line_break";
        } else if (element instanceof HardLineBreak) {
            return "hard_line_break";
        } else if (element instanceof Emphasis) {
            return "emphasis";
        } else if (element instanceof StrongEmphasis) {
            return "strong_emphasis";
        } else if (element instanceof Code) {
            return "code";
        } else if (element instanceof FencedCodeBlock) {
            return "fenced_code";
        } else if (element instanceof IndentedCodeBlock) {
            return "indented_code";
        } else if (element instanceof Image) {
            return "image";
        } else if (element instanceof InlineMathNode) {
            return "inline_math";
        } else if (element instanceof ResponseBoxNode) {
            return "response_box";
        } else if (element instanceof ChoiceListBlock) {
            return "choices";
        } else if (element instanceof SolutionBlock) {
            return "solution";
        }
        return element.getClass().getSimpleName()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase();
    }

    /**
     * A paragraph holding nothing but an image is a block image.
     */
    private static Node convertParagraph(org.commonmark.node.Node element, MarkdownConversion conversion) {
        Image image = loneImage(element);
        if (image != null) {
            return new ImageFile(image.getDestination());
        }
        return new org.dxworks.probconv.model.Paragraph(conversion.convertChildren(element));
    }

    private static Image loneImage(org.commonmark.node.Node paragraph) {
        Image image = null;
        for (org.commonmark.node.Node child = paragraph.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof Image candidate && image == null) {
                image = candidate;
            } else if (!(child instanceof Text text && text.getLiteral().isBlank())
                    && !(child instanceof SoftLineBreak)) {
                return null;
            }
        }
        return image;
    }

    /**
     * Line breaks become spaces carried by the neighbouring text, since text nodes cannot be
     * whitespace only.
     */
    private static Node convertText(Text text) {
        String literal = text.getLiteral();
        if (literal.isBlank()) {
            return new Blob();
        }
        if (isLineBreak(text.getNext())) {
            literal = literal + " ";
        }
        org.commonmark.node.Node previous = text.getPrevious();
        if (isLineBreak(previous) && previous.getPrevious() != null && !carriesTrailingSpace(previous.getPrevious())) {
            literal = " " + literal;
        }
        return new org.dxworks.probconv.model.Text(literal);
    }

    private static Blob styled(org.commonmark.node.Node element, MarkdownConversion conversion,
                               boolean bold, boolean italic) {
        List<Node> children = conversion.convertInlineChildren(element);
        Blob blob = new Blob();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child instanceof org.dxworks.probconv.model.Text text) {
                org.dxworks.probconv.model.Text styledText = text.withStyle(bold, italic);
                boolean last = i == children.size() - 1;
                if (last && isLineBreak(element.getNext()) && !styledText.getText().endsWith(" ")) {
                    styledText = styledText.withText(styledText.getText() + " ");
                }
                child = styledText;
            }
            blob.addChild(child);
        }
        return blob;
    }

    private static Node convertFencedCode(org.commonmark.node.Node element, MarkdownConversion conversion) {
        FencedCodeBlock block = (FencedCodeBlock) element;
        String info = block.getInfo() == null ? "" : block.getInfo().strip();
        String language = info.isEmpty() ? DEFAULT_CODE_LANGUAGE : info.split("\\s+")[0];
        return new org.dxworks.probconv.model.Code(language, block.getLiteral());
    }

    private static Node convertResponseBox(org.commonmark.node.Node element, MarkdownConversion conversion) {
        List<Node> answer = conversion.convertInlineChildren(element);
        if (answer.isEmpty()) {
            throw new ParseException("Inline response box does not contain an answer");
        }
        return new InlineResponseBox(ParagraphReconstructor.trimBoundaryWhitespace(answer));
    }

    private static Node convertChoices(org.commonmark.node.Node element, MarkdownConversion conversion) {
        List<Choice> choices = new ArrayList<>();
        for (org.commonmark.node.Node child = element.getFirstChild(); child != null; child = child.getNext()) {
            ChoiceItem item = (ChoiceItem) child;
            choices.add(new Choice(item.isCorrect(), conversion.convertChildren(item)));
        }
        return ((ChoiceListBlock) element).isSelect() ? new MultipleSelect(choices) : new MultipleChoice(choices);
    }

    private static boolean isLineBreak(org.commonmark.node.Node node) {
        return node instanceof SoftLineBreak || node instanceof HardLineBreak;
    }

    /**
     * Blank text between two inline nodes, such as the space in {@code **a** *b*}.
     */
    public static boolean isWhitespaceGap(org.commonmark.node.Node node) {
        return node instanceof Text text && text.getLiteral().isBlank();
    }

    /**
     * Emphasis carries the space only when its own last child is text.
     */
    private static boolean carriesTrailingSpace(org.commonmark.node.Node node) {
        if (node instanceof Emphasis || node instanceof StrongEmphasis) {
            return carriesTrailingSpace(node.getLastChild());
        }
        return node instanceof Text text && !text.getLiteral().isBlank();
    }
}
