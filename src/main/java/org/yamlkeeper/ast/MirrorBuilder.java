package org.yamlkeeper.ast;

import org.yamlkeeper.value.YamlValues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds nodes from native values.
 * <p>
 * Used twice: once per parse to turn the authoritative document value into a
 * reference node tree for alignment, and by the tree whenever a new key or a
 * composite value has to be materialized. Built nodes carry their descendants in
 * {@link Node#getChildren()}; {@link #flatten(Collection)} turns them into the
 * flat, indentation-driven form the tree stores.
 */
public final class MirrorBuilder {

    private MirrorBuilder() {
    }

    /**
     * Builds the nodes for a whole document value at the given indent.
     * Maps produce one entry per key, list documents produce sequence items,
     * scalars and {@code null} produce nothing.
     */
    public static List<Node> build(Object value, int indent) {
        List<Node> nodes = new ArrayList<>();
        if (YamlValues.isList(value)) {
            for (Object item : YamlValues.asList(value)) {
                nodes.add(buildItem(item, indent));
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                nodes.add(buildEntry(String.valueOf(entry.getKey()), entry.getValue(), indent));
            }
        }
        return nodes;
    }

    /**
     * Builds a single {@code key: value} entry. Non-empty lists become a mapping header
     * followed by sequence items, non-empty maps a mapping header followed by nested
     * entries, both one indentation step deeper. Everything else is a key/value node.
     */
    public static Node buildEntry(String key, Object value, int indent) {
        if (YamlValues.isList(value)) {
            Node start = Node.mappingStart(key, indent);
            for (Object item : YamlValues.asList(value)) {
                start.addChild(buildItem(item, indent + NodeHierarchy.INDENT_STEP));
            }
            return start;
        }
        if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            Node start = Node.mappingStart(key, indent);
            build(map, indent + NodeHierarchy.INDENT_STEP).forEach(start::addChild);
            return start;
        }
        return Node.keyValue(key, value, indent);
    }

    /**
     * Sequence items keep composite values whole; they are rendered in flow style.
     */
    public static Node buildItem(Object value, int indent) {
        return Node.sequenceItem(value, indent);
    }

    /**
     * Splices built nodes and their descendants into one list in document order.
     * Children are moved out of their parents, so the result carries hierarchy
     * through indentation only.
     */
    public static List<Node> flatten(Collection<Node> nodes) {
        List<Node> flat = new ArrayList<>();
        for (Node node : nodes) {
            flat.add(node);
            if (!node.getChildren().isEmpty()) {
                List<Node> children = new ArrayList<>(node.getChildren());
                node.getChildren().clear();
                flat.addAll(flatten(children));
            }
        }
        return flat;
    }
}
