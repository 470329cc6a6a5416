package org.dxworks.probconv;

import org.dxworks.probconv.model.Problem;

import java.util.List;

/**
 * Entry point for converting a problem held in memory.
 */
public final class Probconv {

    private Probconv() {
        // utility class
    }

    /**
     * Parses {@code source} with the named parser and renders the result with the named renderer.
     *
     * @param parserName   {@code dsctex} or {@code gsmd}
     * @param rendererName {@code dsctex}, {@code gsmd}, {@code html} or {@code json}
     * @throws IllegalArgumentException if either name is unknown
     * @throws org.dxworks.probconv.exception.ParseException  if the source cannot be parsed
     * @throws org.dxworks.probconv.exception.RenderException if the renderer cannot express the problem
     */
    public static String convert(String source, String parserName, String rendererName) {
        Format parserFormat = lookup(parserName, "parser", FormatRegistry.parserNames());
        Format rendererFormat = lookup(rendererName, "renderer", FormatRegistry.rendererNames());
        Problem problem = FormatRegistry.createParser(parserFormat).parse(source);
        return FormatRegistry.createRenderer(rendererFormat).render(problem);
    }

    private static Format lookup(String name, String role, List<String> validNames) {
        if (!validNames.contains(name)) {
            throw new IllegalArgumentException("Unknown " + role + " '" + name + "'; expected one of "
                    + String.join(", ", validNames));
        }
        return FormatRegistry.byName(name).orElseThrow();
    }
}
