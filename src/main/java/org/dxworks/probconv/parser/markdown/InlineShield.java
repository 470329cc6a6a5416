package org.dxworks.probconv.parser.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hides {@code $$...$$} math and {@code [____](answer)} response boxes from the Markdown
 * parser behind private-use placeholders, so that emphasis markers inside math and the
 * link-like response box syntax are not interpreted.
 * <p>
 * One shield belongs to one parse: placeholders are numbered in order of appearance.
 */
final class InlineShield {

    static final char OPEN = '\uE000';
    static final char CLOSE = '\uE001';
    static final Pattern PLACEHOLDER = Pattern.compile(OPEN + "(\\d+)" + CLOSE);

    private static final String RESPONSE_BOX_OPENING = "[____](";

    enum Kind {
        MATH, RESPONSE_BOX
    }

    static final class Shielded {
        final Kind kind;
        final String content;
        final String original;

        Shielded(Kind kind, String content, String original) {
            this.kind = kind;
            this.content = content;
            this.original = original;
        }
    }

    private final List<Shielded> shielded = new ArrayList<>();

    String shield(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (text.startsWith("$$", i) && text.indexOf("$$", i + 2) > i + 2) {
                int close = text.indexOf("$$", i + 2);
                i = addPlaceholder(out, Kind.MATH, text.substring(i + 2, close), text.substring(i, close + 2), close + 2);
            } else if (text.startsWith(RESPONSE_BOX_OPENING, i) && matchingParen(text, i + RESPONSE_BOX_OPENING.length() - 1) > 0) {
                int close = matchingParen(text, i + RESPONSE_BOX_OPENING.length() - 1);
                String answer = text.substring(i + RESPONSE_BOX_OPENING.length(), close);
                i = addPlaceholder(out, Kind.RESPONSE_BOX, answer, text.substring(i, close + 1), close + 1);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Puts the original text back in place of every placeholder. */
    String restore(String text) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(get(Integer.parseInt(matcher.group(1))).original));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    Shielded get(int index) {
        return shielded.get(index);
    }

    private int addPlaceholder(StringBuilder out, Kind kind, String content, String original, int next) {
        out.append(OPEN).append(shielded.size()).append(CLOSE);
        shielded.add(new Shielded(kind, content, original));
        return next;
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
