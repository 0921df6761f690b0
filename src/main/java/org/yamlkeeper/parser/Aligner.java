package org.yamlkeeper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamlkeeper.ast.Node;
import org.yamlkeeper.ast.NodeHierarchy;
import org.yamlkeeper.ast.NodeType;
import org.yamlkeeper.value.YamlValues;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles lexer tokens with the mirror built from the parsed document value.
 * <p>
 * Tokens keep their order and raw text; only their values are replaced by the
 * authoritative ones. A key/value token whose raw text already parses to the mirror
 * value keeps its own parsed form, so its formatting survives rendering. Tokens
 * without a mirror counterpart get their raw text parsed on their own.
 * <p>
 * Tokens are matched on (type, ancestor keys, key or item ordinal, indent). With
 * duplicate keys the first unconsumed mirror node wins.
 */
public final class Aligner {

    private static final Logger logger = LoggerFactory.getLogger(Aligner.class);

    private Aligner() {
    }

    /**
     * @param tokens tokens after comment attachment; not modified
     * @param mirror nodes built from the document value, may be empty
     * @return aligned copies of the tokens, all marked pristine
     */
    public static List<Node> align(List<Node> tokens, List<Node> mirror) {
        Set<String> blockKeys = new HashSet<>();
        for (Node token : tokens) {
            if (token.getType().isBlock()) {
                blockKeys.add(token.getKey() + "|" + token.getIndent());
            }
        }

        Map<String, Deque<Node>> lookup = new HashMap<>();
        index(mirror, new ArrayList<>(), blockKeys, lookup);

        List<Node> aligned = new ArrayList<>(tokens.size());
        for (Node token : tokens) {
            aligned.add(token.copy());
        }

        Map<Integer, Integer> itemOrdinals = new HashMap<>();
        int matched = 0;
        for (int i = 0; i < aligned.size(); i++) {
            Node token = aligned.get(i);
            if (!token.isStructural()) {
                continue;
            }
            String local;
            if (token.getType() == NodeType.SequenceItem) {
                int parent = NodeHierarchy.parentIndex(aligned, i);
                int ordinal = itemOrdinals.merge(parent, 1, Integer::sum) - 1;
                local = String.valueOf(ordinal);
            } else {
                local = token.getKey();
            }
            String lookupKey = lookupKey(token.getType(), NodeHierarchy.ancestorKeys(aligned, i), local, token.getIndent());
            Deque<Node> candidates = lookup.get(lookupKey);
            if (candidates == null && token.getType() == NodeType.SequenceItem) {
                // items written at their key's indent, built one step deeper in the mirror
                candidates = lookup.get(lookupKey(token.getType(), NodeHierarchy.ancestorKeys(aligned, i), local,
                        token.getIndent() + NodeHierarchy.INDENT_STEP));
            }
            Node match = candidates == null ? null : candidates.pollFirst();

            if (match != null) {
                matched++;
                if (token.getType() == NodeType.KeyValue) {
                    token.setValue(reconcile(token, match.getValue()));
                } else {
                    token.setValue(match.getValue());
                }
            } else if (token.getType() == NodeType.KeyValue) {
                token.setValue(YamlValues.parseEntryValueOrRaw(token.getKey(), (String) token.getValue()));
            } else if (token.getType() == NodeType.SequenceItem) {
                token.setValue(YamlValues.parseSequenceValueOrRaw((String) token.getValue()));
            }
        }

        aligned.forEach(Node::markPristine);
        logger.debug("Aligned {} token(s), {} matched against the mirror", aligned.size(), matched);
        return aligned;
    }

    private static Object reconcile(Node token, Object authoritative) {
        try {
            Object parsed = YamlValues.parseEntryValue(token.getKey(), (String) token.getValue());
            return YamlValues.semanticallyEqual(parsed, authoritative) ? parsed : authoritative;
        } catch (JsonProcessingException e) {
            logger.debug("Raw value of '{}' does not parse on its own, using document value", token.getKey());
            return authoritative;
        }
    }

    private static void index(List<Node> nodes, List<String> path, Set<String> blockKeys,
                              Map<String, Deque<Node>> lookup) {
        int ordinal = 0;
        for (Node node : nodes) {
            if (node.getType() == NodeType.KeyValue && blockKeys.contains(node.getKey() + "|" + node.getIndent())) {
                continue;
            }
            String local = node.getType() == NodeType.SequenceItem ? String.valueOf(ordinal++) : node.getKey();
            lookup.computeIfAbsent(lookupKey(node.getType(), path, local, node.getIndent()), k -> new ArrayDeque<>())
                    .addLast(node);
            if (!node.getChildren().isEmpty()) {
                List<String> childPath = new ArrayList<>(path);
                if (node.getKey() != null) {
                    childPath.add(node.getKey());
                }
                index(node.getChildren(), childPath, blockKeys, lookup);
            }
        }
    }

    private static String lookupKey(NodeType type, List<String> ancestors, String local, int indent) {
        return type.name() + "|" + String.join(".", ancestors) + "|" + local + "|" + indent;
    }
}
