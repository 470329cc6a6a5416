package org.dxworks.probconv.parser.latex;

import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.model.AlignMath;
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
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.model.Subproblem;
import org.dxworks.probconv.model.Text;
import org.dxworks.probconv.model.TrueFalse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DscTexParserTest {

    private final DscTexParser parser = new DscTexParser();

    @Test
    void parsesSingleParagraph() {
        Problem problem = parser.parse("\\begin{prob}This is the problem.\\end{prob}");

        assertEquals(new Problem(new Paragraph(new Text("This is the problem."))), problem);
    }

    @Test
    void splitsParagraphsAtBlankLines() {
        Problem problem = parser.parse("\\begin{prob}\n    First line\n    continues.\n\n    Second.\n\\end{prob}\n");

        assertEquals(new Problem(
                new Paragraph(new Text("First line continues.")),
                new Paragraph(new Text("Second."))), problem);
    }

    @Test
    void parsesChoicesInOrder() {
        Problem problem = parser.parse(String.join("\n",
                "\\begin{prob}",
                "    What is 1+1?",
                "    \\begin{choices}",
                "        \\choice 1",
                "        \\choice 3",
                "        \\correctchoice 2",
                "    \\end{choices}",
                "\\end{prob}"));

        assertEquals(new Problem(
                new Paragraph(new Text("What is 1+1?")),
                new MultipleChoice(
                        new Choice(false, new Paragraph(new Text("1"))),
                        new Choice(false, new Paragraph(new Text("3"))),
                        new Choice(true, new Paragraph(new Text("2"))))), problem);
    }

    @Test
    void parsesBraceChoicesAndRectangleSelects() {
        Problem problem = parser.parse(
                "\\begin{prob}\\begin{choices}[rectangle]\\correctchoice{$x$}\\choice{}\\end{choices}\\end{prob}");

        assertEquals(new Problem(new MultipleSelect(
                new Choice(true, new Paragraph(new InlineMath("x"))),
                new Choice(false))), problem);
    }

    @Test
    void rejectsContentBeforeFirstChoice() {
        assertThrows(ParseException.class, () -> parser.parse(
                "\\begin{prob}\\begin{choices}stray\\choice a\\end{choices}\\end{prob}"));
    }

    @Test
    void parsesInlineConstructs() {
        Problem problem = parser.parse("\\begin{prob}Let $x$ be \\textbf{very \\textit{big}} and "
                + "\\texttt{x = 1} or \\mintinline{python}{y}: \\inlineresponsebox[2in]{ 42 }\\end{prob}");

        assertEquals(new Problem(new Paragraph(
                new Text("Let "),
                new InlineMath("x"),
                new Text(" be "),
                Text.bold("very "),
                new Text("big", true, true),
                new Text(" and "),
                new InlineCode("text", "x = 1"),
                new Text(" or "),
                new InlineCode("python", "y"),
                new Text(": "),
                new InlineResponseBox(new Text("42")))), problem);
    }

    @Test
    void keepsSpaceBetweenStyledWords() {
        Problem problem = parser.parse("\\begin{prob}\\textbf{very} \\textbf{important}\\end{prob}");

        assertEquals(new Problem(new Paragraph(Text.bold("very "), Text.bold("important"))), problem);
    }

    @Test
    void spaceAfterMathMovesToFollowingText() {
        Problem problem = parser.parse("\\begin{prob}$x$ \\textit{y} $z$\\end{prob}");

        assertEquals(new Problem(new Paragraph(
                new InlineMath("x"),
                Text.italic(" y "),
                new InlineMath("z"))), problem);
    }

    @Test
    void parsesBlockConstructs() {
        Problem problem = parser.parse(String.join("\n",
                "\\begin{prob}",
                "    \\[",
                "        x^2",
                "    \\]",
                "    \\begin{align*}",
                "        a &= b",
                "    \\end{align*}",
                "    \\begin{minted}{python}",
                "    def f():",
                "        return 1",
                "    \\end{minted}",
                "    \\inputminted{java}{code/Main.java}",
                "    \\includegraphics[width=2in]{figs/plot.png}",
                "    \\tF",
                "\\end{prob}"));

        assertEquals(new Problem(
                new DisplayMath("x^2"),
                new AlignMath("a &= b", true),
                new Code("python", "def f():\n    return 1\n"),
                new CodeFile("java", "code/Main.java"),
                new ImageFile("figs/plot.png"),
                new TrueFalse(false)), problem);
    }

    @Test
    void flattensSubproblemSetsAndParsesSolutions() {
        Problem problem = parser.parse(String.join("\n",
                "\\begin{prob}",
                "    Intro.",
                "    \\begin{subprobset}",
                "        \\begin{subprob}",
                "            Part one. \\Tf{}",
                "            \\begin{soln}",
                "                Because.",
                "            \\end{soln}",
                "        \\end{subprob}",
                "        \\begin{subprob}",
                "            Part two.",
                "        \\end{subprob}",
                "    \\end{subprobset}",
                "\\end{prob}"));

        assertEquals(new Problem(
                new Paragraph(new Text("Intro.")),
                new Subproblem(
                        new Paragraph(new Text("Part one.")),
                        new TrueFalse(true),
                        new Solution(new Paragraph(new Text("Because.")))),
                new Subproblem(new Paragraph(new Text("Part two.")))), problem);
    }

    @Test
    void lineBreakCommandsSplitParagraphs() {
        Problem problem = parser.parse("\\begin{prob}One\\\\Two\\par Three\\end{prob}");

        assertEquals(new Problem(
                new Paragraph(new Text("One")),
                new Paragraph(new Text("Two")),
                new Paragraph(new Text("Three"))), problem);
    }

    @Test
    void rejectsZeroOrSeveralProblems() {
        assertThrows(ParseException.class, () -> parser.parse("no problem here"));
        assertThrows(ParseException.class, () -> parser.parse(""));
        assertThrows(ParseException.class, () -> parser.parse("\\begin{prob}a\\end{prob}\\begin{prob}b\\end{prob}"));
    }

    @Test
    void ignoresBlankSurroundings() {
        Problem problem = parser.parse("% header comment\n\n\\begin{prob}a\\end{prob}\n\n");

        assertEquals(new Problem(new Paragraph(new Text("a"))), problem);
    }

    @Test
    void rejectsUnknownCommandsAndEnvironments() {
        ParseException command = assertThrows(ParseException.class,
                () -> parser.parse("\\begin{prob}\\unknown{x}\\end{prob}"));
        assertEquals("Unknown command \\unknown{x}", command.getMessage());

        ParseException environment = assertThrows(ParseException.class,
                () -> parser.parse("\\begin{prob}\\begin{itemize}\\end{itemize}\\end{prob}"));
        assertEquals("Unknown environment 'itemize'", environment.getMessage());
    }

    @Test
    void rejectsBlockContentInsideInlineCommand() {
        assertThrows(ParseException.class,
                () -> parser.parse("\\begin{prob}\\textbf{\\includegraphics{a.png}}\\end{prob}"));
    }

    @Test
    void rejectsResponseBoxWithoutSingleParagraph() {
        assertThrows(ParseException.class, () -> parser.parse("\\begin{prob}\\inlineresponsebox{}\\end{prob}"));
        assertThrows(ParseException.class, () -> parser.parse("\\begin{prob}\\inlineresponsebox{a\n\nb}\\end{prob}"));
    }

    @Test
    void rejectsStructureTheSchemaForbids() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(
                "\\begin{prob}\\begin{subprob}\\begin{subprob}x\\end{subprob}\\end{subprob}\\end{prob}"));

        assertEquals("Invalid problem structure: Cannot add child of type Subproblem to Subproblem.", e.getMessage());
    }

    @Test
    void optionsReplaceAndExtendConverters() {
        DscTexParser custom = new DscTexParser(DscTexParserOptions.builder()
                .commandConverter("answer", (cmd, conversion) -> new Text("ANSWER"))
                .commandConverter("Tf", (cmd, conversion) -> new TrueFalse(false))
                .environmentConverter("hint", (env, conversion) -> new Solution(conversion.convertAll(env.getContents())))
                .build());

        Problem problem = custom.parse("\\begin{prob}Say \\answer{} now. \\Tf\\begin{hint}Think.\\end{hint}\\end{prob}");

        assertEquals(new Problem(
                new Paragraph(new Text("Say "), new Text("ANSWER"), new Text(" now.")),
                new TrueFalse(false),
                new Solution(new Paragraph(new Text("Think.")))), problem);
    }
}
