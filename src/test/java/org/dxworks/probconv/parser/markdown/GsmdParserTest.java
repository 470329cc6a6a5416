package org.dxworks.probconv.parser.markdown;

import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.Code;
import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.InlineCode;
import org.dxworks.probconv.model.InlineMath;
import org.dxworks.probconv.model.InlineResponseBox;
import org.dxworks.probconv.model.MultipleChoice;
import org.dxworks.probconv.model.MultipleSelect;
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.model.Text;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GsmdParserTest {

    private final GsmdParser parser = new GsmdParser();

    @Test
    void parsesSingleParagraph() {
        assertEquals(new Problem(new Paragraph(new Text("This is the problem."))), parser.parse("This is the problem."));
    }

    @Test
    void parsesParagraphsAndLineBreaks() {
        Problem problem = parser.parse("First line\nsecond line\n\nNext paragraph.");

        assertEquals(new Problem(
                new Paragraph(new Text("First line "), new Text("second line")),
                new Paragraph(new Text("Next paragraph."))), problem);
    }

    @Test
    void parsesInlineConstructs() {
        Problem problem = parser.parse("Let $$x^2$$ be *big* and **bold** with `code`.");

        assertEquals(new Problem(new Paragraph(
                new Text("Let "),
                new InlineMath("x^2"),
                new Text(" be "),
                Text.italic("big"),
                new Text(" and "),
                Text.bold("bold"),
                new Text(" with "),
                new InlineCode("text", "code"),
                new Text("."))), problem);
    }

    @Test
    void keepsSpaceBetweenEmphasizedWords() {
        Problem problem = parser.parse("**very** *important*");

        assertEquals(new Problem(new Paragraph(Text.bold("very "), Text.italic("important"))), problem);
    }

    @Test
    void spaceBetweenNonTextNodesMovesToFollowingText() {
        Problem problem = parser.parse("`a` **b**");

        assertEquals(new Problem(new Paragraph(new InlineCode("text", "a"), Text.bold(" b"))), problem);
    }

    @Test
    void lineBreakAfterEmphasisEndingInCodeKeepsSpace() {
        Problem problem = parser.parse("**a `c`**\nnext");

        assertEquals(new Problem(new Paragraph(
                Text.bold("a "),
                new InlineCode("text", "c"),
                new Text(" next"))), problem);
    }

    @Test
    void mathIsNotReadAsEmphasis() {
        Problem problem = parser.parse("$$a*b*c$$");

        assertEquals(new Problem(new Paragraph(new InlineMath("a*b*c"))), problem);
    }

    @Test
    void parsesChoicesInOrder() {
        Problem problem = parser.parse(String.join("\n",
                "What is 1+1?",
                "",
                "( ) 1",
                "( ) 3",
                "(x) 2"));

        assertEquals(new Problem(
                new Paragraph(new Text("What is 1+1?")),
                new MultipleChoice(
                        new Choice(false, new Paragraph(new Text("1"))),
                        new Choice(false, new Paragraph(new Text("3"))),
                        new Choice(true, new Paragraph(new Text("2"))))), problem);
    }

    @Test
    void parsesSelectsWithInlineContent() {
        Problem problem = parser.parse("[x] $$x$$\n[ ] `y`");

        assertEquals(new Problem(new MultipleSelect(
                new Choice(true, new Paragraph(new InlineMath("x"))),
                new Choice(false, new Paragraph(new InlineCode("text", "y"))))), problem);
    }

    @Test
    void parsesSolutionLines() {
        Problem problem = parser.parse("Why?\n\n[[Because.]]\n[[*Really.*]]");

        assertEquals(new Problem(
                new Paragraph(new Text("Why?")),
                new Solution(
                        new Paragraph(new Text("Because.")),
                        new Paragraph(Text.italic("Really.")))), problem);
    }

    @Test
    void parsesResponseBoxes() {
        Problem problem = parser.parse("Answer: [____]( $$42$$ units )");

        assertEquals(new Problem(new Paragraph(
                new Text("Answer: "),
                new InlineResponseBox(new InlineMath("42"), new Text(" units")))), problem);
    }

    @Test
    void parsesCodeBlocks() {
        Problem problem = parser.parse("```python\nprint(1)\n( ) not a choice\n```\n\n    indented\n");

        assertEquals(new Problem(
                new Code("python", "print(1)\n( ) not a choice\n"),
                new Code("text", "indented\n")), problem);
    }

    @Test
    void codeKeepsShieldedSyntax() {
        Problem problem = parser.parse("`$$x$$`");

        assertEquals(new Problem(new Paragraph(new InlineCode("text", "$$x$$"))), problem);
    }

    @Test
    void loneImageIsBlockImage() {
        assertEquals(new Problem(new ImageFile("figs/a.png")), parser.parse("![plot](figs/a.png)"));
    }

    @Test
    void rejectsInlineImages() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("See ![](a.png) here"));

        assertEquals("Inline images are not supported: a.png", e.getMessage());
    }

    @Test
    void rejectsUnsupportedConstructs() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("- item"));

        assertEquals("Unsupported Markdown construct: bullet_list", e.getMessage());
    }

    @Test
    void rejectsResponseBoxWithoutSingleParagraph() {
        assertThrows(ParseException.class, () -> parser.parse("[____]()"));
        assertThrows(ParseException.class, () -> parser.parse("Answer [____](# heading)"));
    }

    @Test
    void optionsAddConverters() {
        GsmdParser custom = new GsmdParser(GsmdParserOptions.builder()
                .converter("heading", (element, conversion) -> new Paragraph(conversion.convertChildren(element)))
                .build());

        Problem problem = custom.parse("# Title\n\nBody.");

        assertEquals(new Problem(
                new Paragraph(new Text("Title")),
                new Paragraph(new Text("Body."))), problem);
    }
}
