package org.dxworks.probconv.parser.latex;

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

/**
 * Parses problems written with the DSCTeX LaTeX macros: a single {@code prob} environment
 * holding text, subproblems, choices, solutions, code, math and images.
 * <p>
 * Every LaTeX node goes through one dispatch point that looks up a converter by command or
 * environment name. Text becomes blobs split at blank lines, and inline results are wrapped in
 * blobs, so paragraphs are only decided by {@link ParagraphReconstructor} at the end.
 */
public class DscTexParser implements ProblemParser {

    private static final Logger LOG = LoggerFactory.getLogger(DscTexParser.class);

    private final Map<String, CommandConverter> commandConverters;
    private final Map<String, EnvironmentConverter> environmentConverters;
    private final LatexConversion conversion = new Conversion();

    public DscTexParser() {
        this(DscTexParserOptions.defaults());
    }

    public DscTexParser(DscTexParserOptions options) {
        this.commandConverters = new HashMap<>(LatexConverters.defaultCommandConverters());
        this.commandConverters.putAll(options.getCommandConverters());
        this.environmentConverters = new HashMap<>(LatexConverters.defaultEnvironmentConverters());
        this.environmentConverters.putAll(options.getEnvironmentConverters());
    }

    @Override
    public Problem parse(String source) {
        LatexEnvironment prob = findProblem(LatexReader.read(source));
        try {
            Node converted = conversion.convert(prob);
            if (!(converted instanceof Problem problem)) {
                throw new ParseException("The prob environment converted to " + converted.getType().getDisplayName()
                        + " instead of a Problem");
            }
            Problem canonical = ParagraphReconstructor.reconstruct(problem);
            LOG.debug("Parsed DSCTeX problem with {} top-level blocks", canonical.getChildCount());
            return canonical;
        } catch (IllegalChildException e) {
            throw new ParseException("Invalid problem structure: " + e.getMessage(), e);
        }
    }

    private static LatexEnvironment findProblem(List<LatexNode> document) {
        List<LatexEnvironment> problems = new ArrayList<>();
        for (LatexNode node : document) {
            if (node instanceof LatexEnvironment env && env.getName().equals("prob")) {
                problems.add(env);
            } else if (!node.isBlank()) {
                throw new ParseException("Unexpected content outside the prob environment: " + node.getSource().strip());
            }
        }
        if (problems.size() != 1) {
            throw new ParseException("Expected exactly one prob environment, found " + problems.size());
        }
        return problems.get(0);
    }

    private class Conversion implements LatexConversion {

        @Override
        public Node convert(LatexNode node) {
            Node result;
            if (node instanceof LatexText text) {
                result = LatexConverters.textBlob(text.getText());
            } else if (node instanceof LatexGroup group) {
                result = new Blob(convertInline(group.getContents()));
            } else if (node instanceof LatexCommand command) {
                CommandConverter converter = commandConverters.get(command.getName());
                if (converter == null) {
                    throw new ParseException("Unknown command " + command.getSource());
                }
                result = converter.convert(command, this);
            } else if (node instanceof LatexEnvironment environment) {
                EnvironmentConverter converter = environmentConverters.get(environment.getName());
                if (converter == null) {
                    throw new ParseException("Unknown environment '" + environment.getName() + "'");
                }
                result = converter.convert(environment, this);
            } else {
                throw new IllegalStateException("Unexpected LaTeX node: " + node);
            }

            if (result == null) {
                throw new ParseException("No node produced for " + node.getSource());
            }
            return NodeSchema.allows(NodeType.BLOB, result.getType()) ? new Blob(result) : result;
        }

        @Override
        public List<Node> convertAll(List<LatexNode> nodes) {
            List<Node> converted = new ArrayList<>(nodes.size());
            for (LatexNode node : nodes) {
                converted.add(LatexConverters.isWhitespaceGap(node) ? null : convert(node));
            }
            return InlineGaps.carry(converted);
        }

        @Override
        public List<Node> convertInline(List<LatexNode> nodes) {
            List<Node> inline = new ArrayList<>();
            for (Node node : convertAll(nodes)) {
                if (!(node instanceof Blob blob)) {
                    throw new ParseException(node.getType().getDisplayName() + " is not allowed in inline content");
                }
                inline.addAll(blob.getChildren());
            }
            return inline;
        }
    }
}
