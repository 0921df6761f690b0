package org.yamlkeeper.dumper;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamlkeeper.DumpOptions;
import org.yamlkeeper.ast.Node;
import org.yamlkeeper.ast.NodeType;
import org.yamlkeeper.value.YamlValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a node list back to text.
 * <p>
 * A line is reproduced from its original text whenever the node's value still means
 * the same thing; only changed or new nodes are formatted from their values.
 */
public final class Dumper {

    private static final Logger logger = LoggerFactory.getLogger(Dumper.class);

    private Dumper() {
    }

    public static String dump(List<Node> nodes, DumpOptions options, String lineTerminator) {
        List<String> lines = new ArrayList<>();
        for (Node node : nodes) {
            render(node, options, lines);
        }
        if (lines.isEmpty()) {
            return lineTerminator;
        }
        String text = String.join(lineTerminator, lines);
        return text.endsWith(lineTerminator) ? text : text + lineTerminator;
    }

    private static void render(Node node, DumpOptions options, List<String> out) {
        if (node.getAttachedComment() != null) {
            addLines(node.getAttachedComment(), out);
        }
        switch (node.getType()) {
            case Comment -> out.add(node.getRawLine() != null ? node.getRawLine() : indent(node) + "#");
            case BlankLine -> out.add(node.getRawLine() != null ? node.getRawLine() : "");
            case KeyValue -> out.add(renderKeyValue(node, options));
            case SequenceItem -> out.add(renderSequenceItem(node, options));
            case MappingStart -> out.add(node.getRawLine() != null ? node.getRawLine() : indent(node) + node.getKey() + ":");
            case LiteralBlock, FoldedBlock -> renderBlock(node, options, out);
        }
        for (Node child : node.getChildren()) {
            render(child, options, out);
        }
    }

    private static String renderKeyValue(Node node, DumpOptions options) {
        String raw = node.getRawLine();
        if (raw == null) {
            return indent(node) + node.getKey() + ": " + ScalarFormatter.format(node.getValue(), options.getQuotingStyle());
        }
        if (node.isPristine()) {
            return raw;
        }
        int colon = raw.indexOf(':', node.getIndent() + node.getKey().length());
        InlineValue inline = InlineValue.split(colon < 0 ? "" : raw.substring(colon + 1));
        if (sameValue(inline.value(), node, true)) {
            return raw;
        }
        return raw.substring(0, node.getIndent()) + node.getKey() + ": "
                + ScalarFormatter.format(node.getValue(), options.getQuotingStyle()) + inline.comment();
    }

    private static String renderSequenceItem(Node node, DumpOptions options) {
        String raw = node.getRawLine();
        if (raw == null) {
            return indent(node) + "- " + ScalarFormatter.format(node.getValue(), options.getQuotingStyle());
        }
        if (node.isPristine()) {
            return raw;
        }
        InlineValue inline = InlineValue.split(raw.substring(Math.min(raw.length(), node.getIndent() + 1)));
        if (sameValue(inline.value(), node, false)) {
            return raw;
        }
        return raw.substring(0, node.getIndent()) + "- "
                + formatItemValue(node.getValue(), inline.value(), options) + inline.comment();
    }

    /**
     * An item written as {@code - key: value} keeps that form, so keys on the following
     * lines still belong to the same mapping.
     */
    private static String formatItemValue(Object value, String rawValue, DumpOptions options) {
        if (value instanceof Map<?, ?> map && map.size() == 1 && !rawValue.stripLeading().startsWith("{")) {
            Map.Entry<?, ?> entry = map.entrySet().iterator().next();
            return entry.getKey() + ": " + ScalarFormatter.format(entry.getValue(), options.getQuotingStyle());
        }
        return ScalarFormatter.format(value, options.getQuotingStyle());
    }

    private static boolean sameValue(String rawValue, Node node, boolean keyed) {
        try {
            Object parsed = keyed
                    ? YamlValues.parseEntryValue(node.getKey(), rawValue)
                    : YamlValues.parseSequenceValue(rawValue);
            return YamlValues.semanticallyEqual(parsed, node.getValue());
        } catch (JsonProcessingException e) {
            logger.debug("Original text '{}' no longer parses, formatting value", rawValue);
            return false;
        }
    }

    private static void renderBlock(Node node, DumpOptions options, List<String> out) {
        boolean collapse = options.isCollapseLiteralBlockEmptyLines();
        String raw = node.getRawLine();
        if (raw != null && node.isPristine()) {
            String[] rawLines = raw.split("\n", -1);
            out.add(rawLines[0]);
            for (int i = 1; i < rawLines.length; i++) {
                if (!collapse || !rawLines[i].isBlank()) {
                    out.add(rawLines[i]);
                }
            }
            return;
        }

        String header;
        if (raw != null) {
            header = raw.split("\n", -1)[0];
        } else {
            header = indent(node) + node.getKey() + ": " + (node.getType() == NodeType.LiteralBlock ? "|" : ">");
        }
        out.add(header);

        String value = node.getValue() == null ? "" : node.getValue().toString();
        if (value.isEmpty()) {
            return;
        }
        if (value.endsWith("\n")) {
            value = value.substring(0, value.length() - 1);
        }
        String contentIndent = " ".repeat(node.getIndent() + 2);
        for (String line : value.split("\n", -1)) {
            if (line.isBlank()) {
                if (!collapse) {
                    out.add("");
                }
            } else {
                out.add(contentIndent + line);
            }
        }
    }

    private static void addLines(String text, List<String> out) {
        for (String line : text.split("\n", -1)) {
            out.add(line);
        }
    }

    private static String indent(Node node) {
        return " ".repeat(node.getIndent());
    }

    /**
     * Value text of a line and the inline comment that follows it, if any. The comment
     * part keeps its leading whitespace so it can be re-appended unchanged.
     */
    record InlineValue(String value, String comment) {

        static InlineValue split(String text) {
            boolean single = false;
            boolean dbl = false;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\'' && !dbl) {
                    single = !single;
                } else if (c == '"' && !single) {
                    dbl = !dbl;
                } else if (c == '#' && !single && !dbl && i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
                    int start = i;
                    while (start > 0 && Character.isWhitespace(text.charAt(start - 1))) {
                        start--;
                    }
                    return new InlineValue(text.substring(0, start).trim(), text.substring(start));
                }
            }
            return new InlineValue(text.trim(), "");
        }
    }
}
