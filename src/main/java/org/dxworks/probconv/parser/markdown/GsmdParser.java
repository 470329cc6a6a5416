package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Paragraph;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.dxworks.probconv.exception.IllegalChildException;
import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.model.Blob;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.NodeSchema;
import org.dxworks.probconv.model.NodeType;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.parser.ProblemParser;
import org.dxworks.probconv.transform.ParagraphReconstructor;
import org.dxworks.probconv.util.InlineGaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Parses Gradescope Markdown: CommonMark plus choice lines ({@code ( )}, {@code (x)},
 * {@code [ ]}, {@code [x]}), solution lines ({@code [[...]]}), {@code $$...$$} inline math
 * and {@code [____](answer)} response boxes.
 * <p>
 * The line-based extensions are split off first and the remaining Markdown is parsed with
 * commonmark. The combined commonmark tree is then converted node by node through a table
 * keyed by construct name.
 */
public class GsmdParser implements ProblemParser {

    private static final Logger LOG = LoggerFactory.getLogger(GsmdParser.class);

    private final Parser parser;
    private final Map<String, MarkdownConverter> converters;
    private final MarkdownConversion conversion = new Conversion();

    public GsmdParser() {
        this(GsmdParserOptions.defaults());
    }

    public GsmdParser(GsmdParserOptions options) {
        this.parser = Parser.builder().build();
        this.converters = new HashMap<>(MarkdownConverters.defaultConverters());
        this.converters.putAll(options.getConverters());
    }

    @Override
    public Problem parse(String source) {
        Document document = buildDocument(source);
        try {
            Node converted = conversion.convert(document);
            if (!(converted instanceof Problem problem)) {
                throw new ParseException("The document converted to " + converted.getType().getDisplayName()
                        + " instead of a Problem");
            }
            Problem canonical = ParagraphReconstructor.reconstruct(problem);
            LOG.debug("Parsed Gradescope Markdown problem with {} top-level blocks", canonical.getChildCount());
            return canonical;
        } catch (IllegalChildException e) {
            throw new ParseException("Invalid problem structure: " + e.getMessage(), e);
        }
    }

    /**
     * Builds one commonmark document for the whole source, with the Gradescope line runs
     * turned into custom blocks.
     */
    Document buildDocument(String source) {
        Document document = new Document();
        for (GradescopeBlock block : GradescopeBlockSplitter.split(source)) {
            switch (block.getKind()) {
                case MARKDOWN -> moveChildren(parseMarkdown(block.text()), document);
                case CHOICES, SELECTS -> {
                    ChoiceListBlock list = new ChoiceListBlock(block.getKind() == GradescopeBlock.Kind.SELECTS);
                    for (String line : block.getLines()) {
                        ChoiceItem item = new ChoiceItem(GradescopeBlockSplitter.isCorrectChoice(line));
                        moveChildren(parseMarkdown(GradescopeBlockSplitter.choiceContent(line)), item);
                        list.appendChild(item);
                    }
                    document.appendChild(list);
                }
                case SOLUTIONS -> {
                    SolutionBlock solution = new SolutionBlock();
                    for (String line : block.getLines()) {
                        moveChildren(parseMarkdown(GradescopeBlockSplitter.solutionContent(line)), solution);
                    }
                    document.appendChild(solution);
                }
            }
        }
        return document;
    }

    private org.commonmark.node.Node parseMarkdown(String markdown) {
        InlineShield shield = new InlineShield();
        org.commonmark.node.Node document = parser.parse(shield.shield(markdown));

        ShieldedNodeCollector collector = new ShieldedNodeCollector();
        document.accept(collector);
        for (org.commonmark.node.Node code : collector.codeNodes) {
            restoreCode(code, shield);
        }
        for (Text text : collector.textNodes) {
            expandPlaceholders(text, shield);
        }
        return document;
    }

    private static void restoreCode(org.commonmark.node.Node node, InlineShield shield) {
        if (node instanceof Code code) {
            code.setLiteral(shield.restore(code.getLiteral()));
        } else if (node instanceof FencedCodeBlock fenced) {
            fenced.setLiteral(shield.restore(fenced.getLiteral()));
        } else if (node instanceof IndentedCodeBlock indented) {
            indented.setLiteral(shield.restore(indented.getLiteral()));
        }
    }

    /**
     * Splits a text node around its placeholders, inserting math and response box nodes
     * between the remaining pieces of text.
     */
    private void expandPlaceholders(Text text, InlineShield shield) {
        String literal = text.getLiteral();
        Matcher matcher = InlineShield.PLACEHOLDER.matcher(literal);
        if (!matcher.find()) {
            return;
        }
        matcher.reset();
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                text.insertBefore(new Text(literal.substring(last, matcher.start())));
            }
            text.insertBefore(expand(shield.get(Integer.parseInt(matcher.group(1)))));
            last = matcher.end();
        }
        if (last < literal.length()) {
            text.insertBefore(new Text(literal.substring(last)));
        }
        text.unlink();
    }

    private CustomNode expand(InlineShield.Shielded shielded) {
        if (shielded.kind == InlineShield.Kind.MATH) {
            return new InlineMathNode(shielded.content);
        }
        org.commonmark.node.Node answer = parseMarkdown(shielded.content);
        org.commonmark.node.Node paragraph = answer.getFirstChild();
        if (paragraph != null && (!(paragraph instanceof Paragraph) || paragraph.getNext() != null)) {
            throw new ParseException("Inline response box answer should be a single paragraph: " + shielded.original);
        }
        ResponseBoxNode box = new ResponseBoxNode();
        if (paragraph != null) {
            moveChildren(paragraph, box);
        }
        return box;
    }

    private static void moveChildren(org.commonmark.node.Node from, org.commonmark.node.Node to) {
        org.commonmark.node.Node child = from.getFirstChild();
        while (child != null) {
            org.commonmark.node.Node next = child.getNext();
            to.appendChild(child);
            child = next;
        }
    }

    private static class ShieldedNodeCollector extends AbstractVisitor {
        private final List<Text> textNodes = new ArrayList<>();
        private final List<org.commonmark.node.Node> codeNodes = new ArrayList<>();

        @Override
        public void visit(Text text) {
            textNodes.add(text);
        }

        @Override
        public void visit(Code code) {
            codeNodes.add(code);
        }

        @Override
        public void visit(FencedCodeBlock fencedCodeBlock) {
            codeNodes.add(fencedCodeBlock);
        }

        @Override
        public void visit(IndentedCodeBlock indentedCodeBlock) {
            codeNodes.add(indentedCodeBlock);
        }
    }

    private class Conversion implements MarkdownConversion {

        @Override
        public Node convert(org.commonmark.node.Node element) {
            String name = MarkdownConverters.constructName(element);
            MarkdownConverter converter = converters.get(name);
            if (converter == null) {
                throw new ParseException("Unsupported Markdown construct: " + name);
            }
            Node result = converter.convert(element, this);
            if (result == null) {
                throw new ParseException("No node produced for Markdown construct " + name);
            }
            return NodeSchema.allows(NodeType.BLOB, result.getType()) ? new Blob(result) : result;
        }

        @Override
        public List<Node> convertChildren(org.commonmark.node.Node parent) {
            List<Node> converted = new ArrayList<>();
            for (org.commonmark.node.Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                converted.add(MarkdownConverters.isWhitespaceGap(child) ? null : convert(child));
            }
            return InlineGaps.carry(converted);
        }

        @Override
        public List<Node> convertInlineChildren(org.commonmark.node.Node parent) {
            List<Node> inline = new ArrayList<>();
            for (Node node : convertChildren(parent)) {
                if (!(node instanceof Blob blob)) {
                    throw new ParseException(node.getType().getDisplayName() + " is not allowed in inline content");
                }
                inline.addAll(blob.getChildren());
            }
            return inline;
        }
    }
}
