package org.yamlkeeper.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal ({@code |}) and folded ({@code >}) block scalar recognition and consumption.
 */
public final class BlockScalars {

    /** Block header after {@code key:}: style, optional chomping and indentation indicators, optional comment. */
    private static final Pattern HEADER = Pattern.compile("^([|>][+-]?[1-9]?[+-]?)\\s*(#.*)?$");

    private BlockScalars() {
    }

    /**
     * Block content consumed after a header line.
     *
     * @param value     dedented content, with one trailing newline when non-empty
     * @param rawLines  the consumed source lines, verbatim
     * @param lastIndex index of the last consumed line, or the header index when nothing was consumed
     */
    public record Block(String value, List<String> rawLines, int lastIndex) {
    }

    /**
     * Returns the indicator ({@code |}, {@code >-}, {@code |2}...) if {@code remainder}
     * is a block scalar header, otherwise {@code null}.
     */
    public static String headerIndicator(String remainder) {
        Matcher m = HEADER.matcher(remainder);
        return m.matches() ? m.group(1) : null;
    }

    /**
     * Consumes the content lines of a block whose header is {@code lines[headerIndex]}.
     * The base indent is taken from the first non-blank line and must be deeper than the
     * key; blank lines only count as content when a later line is still block content.
     */
    public static Block consume(String[] lines, int headerIndex, int keyIndent) {
        int first = headerIndex + 1;
        while (first < lines.length && lines[first].isBlank()) {
            first++;
        }
        if (first >= lines.length || Lexer.indentOf(lines[first]) <= keyIndent) {
            return new Block("", List.of(), headerIndex);
        }
        int base = Lexer.indentOf(lines[first]);

        int last = headerIndex;
        for (int i = headerIndex + 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            if (Lexer.indentOf(lines[i]) < base) {
                break;
            }
            last = i;
        }

        List<String> raw = new ArrayList<>();
        List<String> content = new ArrayList<>();
        for (int i = headerIndex + 1; i <= last; i++) {
            String line = lines[i];
            raw.add(line);
            if (line.isBlank()) {
                content.add(line.length() > base ? line.substring(base) : "");
            } else {
                content.add(line.substring(base));
            }
        }
        String value = content.isEmpty() ? "" : String.join("\n", content) + "\n";
        return new Block(value, raw, last);
    }
}
