package org.dxworks.probconv.render;

import org.dxworks.probconv.exception.RenderException;
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
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.model.Subproblem;
import org.dxworks.probconv.model.Text;
import org.dxworks.probconv.model.TrueFalse;
import org.dxworks.probconv.parser.latex.DscTexParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DscTexRendererTest {

    private final DscTexRenderer renderer = new DscTexRenderer();

    @Test
    void rendersChoicesAndSolution() {
        Problem problem = new Problem(
                new Paragraph(new Text("What is "), new InlineMath("x"), new Text("?")),
                new MultipleChoice(new Choice(true, new Paragraph(new Text("A"))), new Choice(false)),
                new Solution(new Paragraph(new Text("50% off"))));

        assertEquals(String.join("\n",
                "\\begin{prob}",
                "    What is $x$?",
                "",
                "    \\begin{choices}",
                "        \\correctchoice{A}",
                "        \\choice{}",
                "    \\end{choices}",
                "",
                "    \\begin{soln}",
                "        50\\% off",
                "    \\end{soln}",
                "\\end{prob}",
                ""), renderer.render(problem));
    }

    @Test
    void groupsConsecutiveSubproblems() {
        Problem problem = new Problem(
                new Paragraph(new Text("Intro")),
                new Subproblem(new Paragraph(new Text("a"))),
                new Subproblem(new TrueFalse(true)));

        assertEquals(String.join("\n",
                "\\begin{prob}",
                "    Intro",
                "",
                "    \\begin{subprobset}",
                "        \\begin{subprob}",
                "            a",
                "        \\end{subprob}",
                "",
                "        \\begin{subprob}",
                "            \\Tf{}",
                "        \\end{subprob}",
                "    \\end{subprobset}",
                "\\end{prob}",
                ""), renderer.render(problem));
    }

    @Test
    void rendersBlocks() {
        Problem problem = new Problem(
                new DisplayMath("x^2"),
                new AlignMath("a &= b", false),
                new Code("python", "def f():\n    return 1\n"),
                new CodeFile("java", "Main.java"),
                new ImageFile("figs/a.png"));

        assertEquals(String.join("\n",
                "\\begin{prob}",
                "    \\[",
                "        x^2",
                "    \\]",
                "",
                "    \\begin{align}",
                "        a &= b",
                "    \\end{align}",
                "",
                "    \\begin{minted}{python}",
                "    def f():",
                "        return 1",
                "    \\end{minted}",
                "",
                "    \\inputminted{java}{Main.java}",
                "",
                "    \\includegraphics{figs/a.png}",
                "\\end{prob}",
                ""), renderer.render(problem));
    }

    @Test
    void rendersStyledTextAndInlineNodes() {
        Problem problem = new Problem(new Paragraph(
                new Text("a_b ", true, true),
                new InlineCode("python", "x"),
                new Text(" and "),
                new InlineResponseBox(new Text("42"))));

        assertEquals("\\begin{prob}\n    \\textbf{\\textit{a\\_b }}\\mintinline{python}{x} and \\inlineresponsebox{42}\n\\end{prob}\n",
                renderer.render(problem));
    }

    @Test
    void rendersMultiLineChoiceInsideBraces() {
        Problem problem = new Problem(new MultipleSelect(
                new Choice(false, new Paragraph(new Text("a")), new DisplayMath("x"))));

        assertEquals(String.join("\n",
                "\\begin{prob}",
                "    \\begin{choices}[rectangle]",
                "        \\choice{",
                "            a",
                "",
                "            \\[",
                "                x",
                "            \\]",
                "        }",
                "    \\end{choices}",
                "\\end{prob}",
                ""), renderer.render(problem));
    }

    @Test
    void emptyProblemRendersEmptyEnvironment() {
        assertEquals("\\begin{prob}\n\\end{prob}\n", renderer.render(new Problem()));
    }

    @Test
    void outputParsesBackToTheSameTree() {
        Problem problem = new Problem(
                new Paragraph(new Text("Compute "), new InlineMath("\\sum_i x_i"), new Text(" for 100% & more.")),
                new Subproblem(
                        new Paragraph(Text.bold("Bold"), new Text(" then "), new InlineResponseBox(new Text("7"))),
                        new MultipleChoice(
                                new Choice(false, new Paragraph(new Text("[not an option]"))),
                                new Choice(true, new Paragraph(new Text("yes"))))),
                new Subproblem(new TrueFalse(false), new Solution(new Code("python", "x = {1}\n"))));

        assertEquals(problem, new DscTexParser().parse(renderer.render(problem)));
    }

    @Test
    void rejectsBlob() {
        RenderException e = assertThrows(RenderException.class,
                () -> renderer.render(new Problem(new Blob(new Text("x")))));

        assertEquals("Cannot render transient node Blob; reconstruct paragraphs before rendering", e.getMessage());
    }

    @Test
    void overridesReplaceDefaults() {
        DscTexRenderer custom = new DscTexRenderer(Map.of(
                NodeType.TEXT, (node, r) -> ((Text) node).getText().toUpperCase()));

        assertEquals("\\begin{prob}\n    HELLO\n\\end{prob}\n",
                custom.render(new Problem(new Paragraph(new Text("hello")))));
    }
}
