package org.dxworks.probconv.parser.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Gradescope Markdown into runs of plain Markdown lines and runs of the line-based
 * Gradescope extensions, which plain Markdown would otherwise read as paragraphs or links.
 * Lines inside fenced code blocks are always plain Markdown.
 */
public final class GradescopeBlockSplitter {

    private static final Pattern FENCE_OPEN = Pattern.compile("^ {0,3}(`{3,}|~{3,})");
    private static final Pattern SOLUTION_LINE = Pattern.compile("^\\s*\\[\\[(.+)\\]\\]\\s*$");

    private GradescopeBlockSplitter() {
        // utility class
    }

    public static List<GradescopeBlock> split(String source) {
        List<GradescopeBlock> blocks = new ArrayList<>();
        GradescopeBlock.Kind currentKind = null;
        List<String> current = new ArrayList<>();
        String openFence = null;

        for (String line : source.split("\\r?\\n", -1)) {
            GradescopeBlock.Kind kind;
            if (openFence != null) {
                kind = GradescopeBlock.Kind.MARKDOWN;
                if (closesFence(line, openFence)) {
                    openFence = null;
                }
            } else {
                Matcher fence = FENCE_OPEN.matcher(line);
                if (fence.find()) {
                    openFence = fence.group(1);
                }
                kind = classify(line);
            }

            if (kind != currentKind && !current.isEmpty()) {
                blocks.add(new GradescopeBlock(currentKind, current));
                current = new ArrayList<>();
            }
            currentKind = kind;
            current.add(line);
        }
        if (!current.isEmpty()) {
            blocks.add(new GradescopeBlock(currentKind, current));
        }
        return blocks;
    }

    static GradescopeBlock.Kind classify(String line) {
        if (line.startsWith("( )") || line.startsWith("(x)")) {
            return GradescopeBlock.Kind.CHOICES;
        }
        if (line.startsWith("[ ]") || line.startsWith("[x]")) {
            return GradescopeBlock.Kind.SELECTS;
        }
        if (SOLUTION_LINE.matcher(line).matches()) {
            return GradescopeBlock.Kind.SOLUTIONS;
        }
        return GradescopeBlock.Kind.MARKDOWN;
    }

    /** True for a {@code (x)} or {@code [x]} line. */
    public static boolean isCorrectChoice(String line) {
        return line.startsWith("(x)") || line.startsWith("[x]");
    }

    /** The text after the choice marker. */
    public static String choiceContent(String line) {
        return line.substring(3);
    }

    /** The text between {@code [[} and {@code ]]}. */
    public static String solutionContent(String line) {
        Matcher matcher = SOLUTION_LINE.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a solution line: " + line);
        }
        return matcher.group(1);
    }

    private static boolean closesFence(String line, String openFence) {
        String stripped = line.strip();
        char fenceChar = openFence.charAt(0);
        if (stripped.length() < openFence.length() || line.length() - line.stripLeading().length() > 3) {
            return false;
        }
        for (int i = 0; i < stripped.length(); i++) {
            if (stripped.charAt(i) != fenceChar) {
                return false;
            }
        }
        return true;
    }
}
