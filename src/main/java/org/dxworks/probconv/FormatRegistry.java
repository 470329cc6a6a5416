package org.dxworks.probconv;

import org.dxworks.probconv.parser.ProblemParser;
import org.dxworks.probconv.parser.latex.DscTexParser;
import org.dxworks.probconv.parser.markdown.GsmdParser;
import org.dxworks.probconv.render.DscTexRenderer;
import org.dxworks.probconv.render.GsmdRenderer;
import org.dxworks.probconv.render.HtmlRenderer;
import org.dxworks.probconv.render.ProblemRenderer;
import org.dxworks.probconv.render.TreeJsonWriter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class FormatRegistry {

    public static Optional<Format> byName(String name) {
        for (Format format : Format.values()) {
            if (format.getName().equals(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static List<String> parserNames() {
        return Arrays.stream(Format.values())
                .filter(Format::isReadable)
                .map(Format::getName)
                .collect(Collectors.toList());
    }

    public static List<String> rendererNames() {
        return Arrays.stream(Format.values())
                .filter(Format::isWritable)
                .map(Format::getName)
                .collect(Collectors.toList());
    }

    public static ProblemParser createParser(Format format) {
        return switch (format) {
            case DSCTEX -> new DscTexParser();
            case GSMD -> new GsmdParser();
            case HTML, JSON -> throw new IllegalArgumentException("No parser for format: " + format.getName());
        };
    }

    public static ProblemRenderer createRenderer(Format format) {
        return switch (format) {
            case DSCTEX -> new DscTexRenderer();
            case GSMD -> new GsmdRenderer();
            case HTML -> new HtmlRenderer();
            case JSON -> new TreeJsonWriter();
        };
    }
}
