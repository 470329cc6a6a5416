package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.DisplayMath;
import org.dxworks.probconv.model.InlineMath;
import org.dxworks.probconv.model.InlineResponseBox;
import org.dxworks.probconv.model.MultipleChoice;
import org.dxworks.probconv.model.ParBreak;
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Solution;
import org.dxworks.probconv.model.Text;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParagraphReconstructorTest {

    @Test
    void groupsInlineRunIntoOneParagraph() {
        Problem raw = new Problem(new Blob(new Text("Let "), new InlineMath("x"), new Text(" be real.")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("Let "), new InlineMath("x"), new Text(" be real."))), canonical);
    }

    @Test
    void splitsAtParagraphBreaks() {
        Problem raw = new Problem(new Blob(new Text("First."), new ParBreak(), new ParBreak(), new Text("Second.")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("First.")), new Paragraph(new Text("Second."))), canonical);
    }

    @Test
    void breaksAtBoundariesProduceNoEmptyParagraphs() {
        Problem raw = new Problem(new Blob(new ParBreak(), new Text("Only."), new ParBreak()));

        assertEquals(new Problem(new Paragraph(new Text("Only."))), ParagraphReconstructor.reconstruct(raw));
    }

    @Test
    void blockNodesSplitRunsAndKeepTheirPlace() {
        Problem raw = new Problem(
                new Blob(new Text("Before ")),
                new DisplayMath("x^2"),
                new Blob(new Text(" after")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(
                new Paragraph(new Text("Before")),
                new DisplayMath("x^2"),
                new Paragraph(new Text("after"))), canonical);
    }

    @Test
    void adjacentBlobsMergeIntoOneParagraph() {
        Problem raw = new Problem(new Blob(new Text("This is a ")), new Blob(Text.bold("bold")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("This is a "), Text.bold("bold"))), canonical);
    }

    @Test
    void siblingBlobsAroundInlineMathMergeIntoOneRun() {
        Problem raw = new Problem(new Blob(new Text("a ")), new Blob(new InlineMath("b")), new Blob(new Text(" c")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("a "), new InlineMath("b"), new Text(" c"))), canonical);
    }

    @Test
    void trimsOnlyBoundaryText() {
        Problem raw = new Problem(new Blob(new InlineMath("x"), new Text(" and "), new InlineMath("y")));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new InlineMath("x"), new Text(" and "), new InlineMath("y"))), canonical);
    }

    @Test
    void recursesIntoNestedContainers() {
        Problem raw = new Problem(
                new MultipleChoice(new Choice(true, new Blob(new Text(" yes "))), new Choice(false)),
                new Solution(new Blob(new Text("Because."), new ParBreak(), new Text("Really."))));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(
                new MultipleChoice(new Choice(true, new Paragraph(new Text("yes"))), new Choice(false)),
                new Solution(new Paragraph(new Text("Because.")), new Paragraph(new Text("Really.")))), canonical);
    }

    @Test
    void paragraphsDoNotNest() {
        Problem raw = new Problem(new Paragraph(new Blob(new Text("a"), new ParBreak(), new Text("b"))));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("a"), new Text("b"))), canonical);
    }

    @Test
    void responseBoxIsWrappedWithSurroundingText() {
        Problem raw = new Problem(new Blob(new Text("Answer: "), new InlineResponseBox(new Text("42"))));

        Problem canonical = ParagraphReconstructor.reconstruct(raw);

        assertEquals(new Problem(new Paragraph(new Text("Answer: "), new InlineResponseBox(new Text("42")))), canonical);
    }

    @Test
    void isIdempotent() {
        Problem raw = new Problem(
                new Blob(new Text(" Intro "), new ParBreak(), new Text("more")),
                new DisplayMath("x"),
                new Solution(new Blob(new Text("s"))));

        Problem once = ParagraphReconstructor.reconstruct(raw);
        Problem twice = ParagraphReconstructor.reconstruct(once);

        assertEquals(once, twice);
    }

    @Test
    void leavesInputUntouched() {
        Problem raw = new Problem(new Blob(new Text("a")));
        Problem copy = new Problem(new Blob(new Text("a")));

        ParagraphReconstructor.reconstruct(raw);

        assertEquals(copy, raw);
    }

    @Test
    void trimBoundaryWhitespaceHandlesEmptyAndNonText() {
        assertTrue(ParagraphReconstructor.trimBoundaryWhitespace(List.of()).isEmpty());
        assertEquals(List.of(new InlineMath("x")), ParagraphReconstructor.trimBoundaryWhitespace(List.of(new InlineMath("x"))));
        assertEquals(List.of(new Text("a b")), ParagraphReconstructor.trimBoundaryWhitespace(List.of(new Text(" a b "))));
    }
}
