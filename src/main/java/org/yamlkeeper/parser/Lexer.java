package org.yamlkeeper.parser;

import org.yamlkeeper.ast.Node;
import org.yamlkeeper.ast.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line tokenizer. Produces one node per physical line, except block scalars which
 * collapse their header and content into a single node.
 * <p>
 * Lines are classified in priority order: blank, comment, sequence item, mapping
 * header, block scalar header, key/value. Anything else becomes a comment so that
 * tokenizing never fails and the line is still reproduced verbatim.
 */
public final class Lexer {

    private static final Pattern EOL_PATTERN = Pattern.compile("\r\n|\r|\n");
    private static final Pattern SEQUENCE_ITEM = Pattern.compile("^- (.+)$");
    private static final Pattern KEY = Pattern.compile("^([^\\s:#]+):(?:\\s+(.*))?$");

    private Lexer() {
    }

    /**
     * Dominant line terminator: CRLF if present, else CR, else LF.
     */
    public static String detectLineTerminator(String content) {
        if (content.contains("\r\n")) {
            return "\r\n";
        }
        if (content.indexOf('\r') >= 0) {
            return "\r";
        }
        return "\n";
    }

    public static List<Node> tokenize(String content) {
        String[] lines = EOL_PATTERN.split(content, -1);
        List<Node> tokens = new ArrayList<>(lines.length);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                tokens.add(Node.blankLine(line));
                continue;
            }
            int indent = indentOf(line);
            String body = line.substring(indent);

            if (body.startsWith("#")) {
                tokens.add(Node.comment(line, indent));
                continue;
            }

            Matcher item = SEQUENCE_ITEM.matcher(body);
            if (item.matches()) {
                Node node = Node.sequenceItem(item.group(1).trim(), indent);
                node.setRawLine(line);
                tokens.add(node);
                continue;
            }

            Matcher entry = KEY.matcher(body);
            if (!entry.matches()) {
                tokens.add(Node.comment(line, indent));
                continue;
            }
            String key = entry.group(1);
            String remainder = entry.group(2) == null ? "" : entry.group(2).trim();

            if (remainder.isEmpty() || remainder.startsWith("#")) {
                Node node = Node.mappingStart(key, indent);
                node.setRawLine(line);
                tokens.add(node);
                continue;
            }

            String indicator = BlockScalars.headerIndicator(remainder);
            if (indicator != null) {
                BlockScalars.Block block = BlockScalars.consume(lines, i, indent);
                NodeType type = indicator.charAt(0) == '|' ? NodeType.LiteralBlock : NodeType.FoldedBlock;
                Node node = new Node(type, key, block.value(), indent);
                List<String> raw = new ArrayList<>();
                raw.add(line);
                raw.addAll(block.rawLines());
                node.setRawLine(String.join("\n", raw));
                tokens.add(node);
                i = block.lastIndex();
                continue;
            }

            Node node = Node.keyValue(key, remainder, indent);
            node.setRawLine(line);
            tokens.add(node);
        }
        return tokens;
    }

    /**
     * Leading run of spaces and tabs; a tab counts as one.
     */
    public static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }
}
