package org.yamlkeeper.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Infers parent/child relationships of a flat node list from indentation.
 * <p>
 * The parent of a node is the nearest preceding structural node with a strictly
 * smaller indent; comments and blank lines never act as parents. Sequence items written
 * at the same indent as the mapping header above them ({@code key:} then {@code - a})
 * belong to that header. Every component
 * that needs hierarchy (alignment, path lookup, insertion, deletion, visiting)
 * goes through these methods so they all agree on what belongs to what.
 */
public final class NodeHierarchy {

    /** Indentation width used for nodes created from native values. */
    public static final int INDENT_STEP = 2;

    /** Index used to denote the document root. */
    public static final int ROOT = -1;

    private NodeHierarchy() {
    }

    /**
     * Returns the index of the parent of {@code nodes.get(index)}, or {@link #ROOT}.
     */
    public static int parentIndex(List<Node> nodes, int index) {
        Node node = nodes.get(index);
        for (int i = index - 1; i >= 0; i--) {
            Node candidate = nodes.get(i);
            if (candidate.isStructural() && owns(candidate, node)) {
                return i;
            }
        }
        return ROOT;
    }

    private static boolean owns(Node owner, Node node) {
        if (node.getIndent() > owner.getIndent()) {
            return true;
        }
        return node.getIndent() == owner.getIndent()
                && owner.getType() == NodeType.MappingStart
                && node.getType() == NodeType.SequenceItem;
    }

    /**
     * Keys of all keyed ancestors of {@code nodes.get(index)}, outermost first.
     */
    public static List<String> ancestorKeys(List<Node> nodes, int index) {
        List<String> keys = new ArrayList<>();
        int parent = parentIndex(nodes, index);
        while (parent != ROOT) {
            Node node = nodes.get(parent);
            if (node.getKey() != null) {
                keys.add(node.getKey());
            }
            parent = parentIndex(nodes, parent);
        }
        Collections.reverse(keys);
        return keys;
    }

    /**
     * Exclusive end index of the span owned by {@code nodes.get(index)}: the node itself and
     * every following node up to the next structural node it does not own.
     * Trailing comments and blank lines that are not indented deeper than the owner are
     * left outside the span, they separate the owner from whatever follows.
     */
    public static int spanEnd(List<Node> nodes, int index) {
        if (index == ROOT) {
            return nodes.size();
        }
        Node owner = nodes.get(index);
        int ownerIndent = owner.getIndent();
        int end = index + 1;
        while (end < nodes.size()) {
            Node node = nodes.get(end);
            if (node.isStructural() && !owns(owner, node)) {
                break;
            }
            end++;
        }
        while (end - 1 > index) {
            Node last = nodes.get(end - 1);
            if (last.isStructural() || last.getIndent() > ownerIndent) {
                break;
            }
            end--;
        }
        return end;
    }

    /**
     * Indices of the structural nodes whose parent is {@code nodes.get(index)}
     * (or the root when {@code index} is {@link #ROOT}), in document order.
     */
    public static List<Integer> directChildren(List<Node> nodes, int index) {
        List<Integer> children = new ArrayList<>();
        int end = spanEnd(nodes, index);
        for (int i = index + 1; i < end; i++) {
            if (nodes.get(i).isStructural() && parentIndex(nodes, i) == index) {
                children.add(i);
            }
        }
        return children;
    }

    /**
     * True if the node at {@code index} owns at least one structural descendant.
     */
    public static boolean hasChildren(List<Node> nodes, int index) {
        int end = spanEnd(nodes, index);
        for (int i = index + 1; i < end; i++) {
            if (nodes.get(i).isStructural()) {
                return true;
            }
        }
        return false;
    }
}
