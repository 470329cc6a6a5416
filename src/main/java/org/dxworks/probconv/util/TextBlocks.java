package org.dxworks.probconv.util;

import java.util.regex.Pattern;

/**
 * Line-oriented helpers for building and cleaning up multi-line text.
 */
public final class TextBlocks {

    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{2,}");

    private TextBlocks() {
        // utility class
    }

    /**
     * Removes the whitespace prefix common to every non-blank line. Lines holding only
     * whitespace come out empty and do not take part in the computation.
     */
    public static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        String common = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String prefix = leadingWhitespace(line);
            common = common == null ? prefix : commonPrefix(common, prefix);
        }
        int cut = common == null ? 0 : common.length();

        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            String line = lines[i];
            if (!line.isBlank()) {
                out.append(line, cut, line.length());
            }
        }
        return out.toString();
    }

    /**
     * Prefixes every line that is not blank with {@code prefix}.
     */
    public static String indent(String text, String prefix) {
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            if (!lines[i].isBlank()) {
                out.append(prefix);
            }
            out.append(lines[i]);
        }
        return out.toString();
    }

    /** Collapses every run of two or more newlines into exactly one empty line. */
    public static String collapseBlankLines(String text) {
        return BLANK_LINE_RUN.matcher(text).replaceAll("\n\n");
    }

    public static String stripTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    public static String escapeHtml(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Escapes the characters LaTeX treats specially in running text.
     */
    public static String escapeLatex(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\textbackslash{}");
                case '%', '$', '&', '#', '_', '{', '}' -> out.append('\\').append(c);
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    private static String commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }
}
