package org.yamlkeeper.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamlkeeper.YamlEditorException;
import org.yamlkeeper.value.YamlValues;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable, lossless view of a YAML document.
 * <p>
 * The tree owns one flat list of {@link Node}s in document order. Hierarchy is never
 * stored; every lookup recomputes it from indentation through {@link NodeHierarchy}.
 * <p>
 * Paths are lists of keys. A segment that is a non-negative integer and matches no key
 * selects the n-th sequence item among the children of the previous segment, so
 * {@code services/0/port} addresses the port of the first service.
 * <p>
 * Not thread-safe.
 */
public class YamlTree {

    private static final Logger logger = LoggerFactory.getLogger(YamlTree.class);

    private static final int NOT_FOUND = -2;
    private static final Object MISSING = new Object();

    private final List<Node> nodes;

    public YamlTree(List<Node> nodes) {
        this.nodes = new ArrayList<>(nodes);
    }

    public static YamlTree empty() {
        return new YamlTree(Collections.emptyList());
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    // ==================== Lookup ====================

    /**
     * Node whose line {@code path} ends on, or {@code null}. Keys inside a line's value
     * have no node of their own.
     */
    public Node findNode(List<String> path) {
        int index = resolve(path);
        return index >= 0 ? nodes.get(index) : null;
    }

    public boolean has(List<String> path) {
        return lookup(path) != MISSING;
    }

    /**
     * Current value at {@code path}. Mapping headers are assembled from their live
     * children, so edits made below them are visible here. An empty path returns the
     * whole document.
     *
     * @throws YamlEditorException {@code PATH_NOT_FOUND} if nothing resolves
     */
    public Object getValue(List<String> path) {
        Object value = lookup(path);
        if (value == MISSING) {
            throw YamlEditorException.pathNotFound(path);
        }
        return value;
    }

    private Object lookup(List<String> path) {
        int current = NodeHierarchy.ROOT;
        for (int depth = 0; depth < path.size(); depth++) {
            int next = findChild(current, path.get(depth));
            if (next == NOT_FOUND) {
                if (current == NodeHierarchy.ROOT) {
                    return MISSING;
                }
                // e.g. "name" inside "- name: web", which lives on the item line itself
                return lookupInValue(assemble(current), path.subList(depth, path.size()));
            }
            current = next;
        }
        return assemble(current);
    }

    private static Object lookupInValue(Object value, List<String> rest) {
        Object current = value;
        for (String segment : rest) {
            if (current instanceof Map<?, ?> map && matchingKey(map, segment) != null) {
                current = map.get(matchingKey(map, segment));
            } else if (YamlValues.isList(current) && isIndex(segment)
                    && Integer.parseInt(segment) < YamlValues.asList(current).size()) {
                current = YamlValues.asList(current).get(Integer.parseInt(segment));
            } else {
                return MISSING;
            }
        }
        return current;
    }

    private Object assemble(int index) {
        List<Integer> children = NodeHierarchy.directChildren(nodes, index);
        Object own = index == NodeHierarchy.ROOT ? null : nodes.get(index).getValue();
        if (children.isEmpty()) {
            return own;
        }
        boolean allItems = true;
        for (int child : children) {
            if (nodes.get(child).getType() != NodeType.SequenceItem) {
                allItems = false;
                break;
            }
        }
        if (allItems) {
            List<Object> list = new ArrayList<>();
            for (int child : children) {
                list.add(assemble(child));
            }
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (own instanceof Map<?, ?> inline) {
            // a sequence item such as "- name: web" followed by more keys
            Set<String> childKeys = new HashSet<>();
            for (int child : children) {
                childKeys.add(nodes.get(child).getKey());
            }
            for (Map.Entry<?, ?> entry : inline.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!childKeys.contains(key)) {
                    map.put(key, entry.getValue());
                }
            }
        }
        int ordinal = 0;
        for (int child : children) {
            Node node = nodes.get(child);
            String key = node.getKey() != null ? node.getKey() : String.valueOf(ordinal++);
            map.put(key, assemble(child));
        }
        return map;
    }

    private int resolve(List<String> path) {
        int current = NodeHierarchy.ROOT;
        for (String segment : path) {
            current = findChild(current, segment);
            if (current == NOT_FOUND) {
                return NOT_FOUND;
            }
        }
        return current;
    }

    private int findChild(int parent, String segment) {
        List<Integer> children = NodeHierarchy.directChildren(nodes, parent);
        for (int child : children) {
            if (segment.equals(nodes.get(child).getKey())) {
                return child;
            }
        }
        if (isIndex(segment)) {
            int wanted = Integer.parseInt(segment);
            int ordinal = 0;
            for (int child : children) {
                if (nodes.get(child).getType() == NodeType.SequenceItem && ordinal++ == wanted) {
                    return child;
                }
            }
        }
        return NOT_FOUND;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // ==================== Mutation ====================

    /**
     * Writes {@code value} at {@code path}. Scalars on existing scalar nodes are written
     * in place; anything that changes the shape of the node rebuilds its span. A path
     * that does not resolve is created under its parent.
     *
     * @throws YamlEditorException {@code EMPTY_PATH}, or {@code PARENT_NOT_FOUND} when creating
     * @throws IllegalArgumentException if the value is not a supported YAML value
     */
    public void setValue(List<String> path, Object value) {
        if (path.isEmpty()) {
            throw YamlEditorException.emptyPath("set");
        }
        YamlValues.requireSupported(value);
        int index = resolve(path);
        if (index == NOT_FOUND) {
            if (!setInline(path, value)) {
                addKey(path.subList(0, path.size() - 1), path.get(path.size() - 1), value, null);
            }
            return;
        }
        Node node = nodes.get(index);
        boolean leaf = !NodeHierarchy.hasChildren(nodes, index);
        if (!YamlValues.isComposite(value)) {
            if (leaf && (node.getType() == NodeType.KeyValue || node.getType() == NodeType.SequenceItem)) {
                node.setValue(value);
                logger.debug("Set {} in place", String.join(".", path));
                return;
            }
            if (node.getType().isBlock() && value instanceof String text) {
                node.setValue(normalizeBlock(text));
                logger.debug("Set block {} in place", String.join(".", path));
                return;
            }
        }
        replaceSpan(index, value);
        logger.debug("Rebuilt {} for new value", String.join(".", path));
    }

    /**
     * Writes into the value held on the deepest node line of {@code path}, as in
     * {@code a: {b: 1}} or {@code - name: web}. Returns false when the path does not end
     * inside such a value.
     */
    private boolean setInline(List<String> path, Object value) {
        int current = NodeHierarchy.ROOT;
        int depth = 0;
        while (depth < path.size()) {
            int next = findChild(current, path.get(depth));
            if (next == NOT_FOUND) {
                break;
            }
            current = next;
            depth++;
        }
        if (current == NodeHierarchy.ROOT || !YamlValues.isComposite(nodes.get(current).getValue())) {
            return false;
        }
        Node node = nodes.get(current);
        List<String> rest = path.subList(depth, path.size());
        Object updated = copyComposite(node.getValue());

        Object container = updated;
        for (String segment : rest.subList(0, rest.size() - 1)) {
            container = inlineChild(container, segment);
            if (!YamlValues.isComposite(container)) {
                return false;
            }
        }
        String last = rest.get(rest.size() - 1);
        if (container instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<Object, Object> target = (Map<Object, Object>) map;
            Object existing = matchingKey(target, last);
            if (existing == null) {
                // new keys directly below an item with nested lines go on their own line
                if (rest.size() == 1 && NodeHierarchy.hasChildren(nodes, current)) {
                    return false;
                }
                existing = last;
            }
            target.put(existing, value);
        } else if (container instanceof List<?> list && isIndex(last) && Integer.parseInt(last) < list.size()) {
            @SuppressWarnings("unchecked")
            List<Object> target = (List<Object>) list;
            target.set(Integer.parseInt(last), value);
        } else {
            return false;
        }
        if (updated instanceof Map<?, ?> top) {
            // keys that have lines of their own are not part of the line's value
            for (int child : NodeHierarchy.directChildren(nodes, current)) {
                String childKey = nodes.get(child).getKey();
                if (childKey != null) {
                    top.keySet().removeIf(k -> childKey.equals(String.valueOf(k)));
                }
            }
        }
        node.setValue(updated);
        logger.debug("Set {} inside the value of line '{}'", String.join(".", path), node.getKey());
        return true;
    }

    private static Object inlineChild(Object container, String segment) {
        if (container instanceof Map<?, ?> map) {
            Object key = matchingKey(map, segment);
            return key == null ? null : map.get(key);
        }
        if (container instanceof List<?> list && isIndex(segment) && Integer.parseInt(segment) < list.size()) {
            return list.get(Integer.parseInt(segment));
        }
        return null;
    }

    private static Object matchingKey(Map<?, ?> map, String key) {
        for (Object candidate : map.keySet()) {
            if (key.equals(String.valueOf(candidate))) {
                return candidate;
            }
        }
        return null;
    }

    private static Object copyComposite(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, copyComposite(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyComposite(item)));
            return copy;
        }
        return value;
    }

    private void replaceSpan(int index, Object value) {
        Node old = nodes.get(index);
        Node built = old.getKey() != null
                ? MirrorBuilder.buildEntry(old.getKey(), value, old.getIndent())
                : MirrorBuilder.buildItem(value, old.getIndent());
        List<Node> fresh = MirrorBuilder.flatten(List.of(built));
        fresh.get(0).setAttachedComment(old.getAttachedComment());
        int end = NodeHierarchy.spanEnd(nodes, index);
        nodes.subList(index, end).clear();
        nodes.addAll(index, fresh);
    }

    private static String normalizeBlock(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return end == 0 ? "" : text.substring(0, end) + "\n";
    }

    /**
     * Adds {@code key: value} as the last child of {@code parentPath}, or at the end of the
     * document when the parent path is empty. New nodes are indented two spaces per
     * parent path segment.
     *
     * @throws YamlEditorException {@code PARENT_NOT_FOUND}
     */
    public void addKey(List<String> parentPath, String key, Object value, String comment) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        YamlValues.requireSupported(value);
        int parent = NodeHierarchy.ROOT;
        if (!parentPath.isEmpty()) {
            parent = resolve(parentPath);
            if (parent == NOT_FOUND) {
                throw YamlEditorException.parentNotFound(parentPath);
            }
        }
        int indent = parentPath.size() * NodeHierarchy.INDENT_STEP;
        List<Node> fresh = MirrorBuilder.flatten(List.of(MirrorBuilder.buildEntry(key, value, indent)));
        if (comment != null) {
            fresh.get(0).setAttachedComment(normalizeComment(comment, indent));
        }

        int insertAt;
        if (parent == NodeHierarchy.ROOT) {
            insertAt = nodes.size();
            while (insertAt > 0 && nodes.get(insertAt - 1).getType() == NodeType.BlankLine) {
                insertAt--;
            }
        } else {
            Node parentNode = nodes.get(parent);
            if (parentNode.getType() == NodeType.KeyValue && YamlValues.isComposite(parentNode.getValue())) {
                addToFlowValue(parentNode, parentPath, key, value, comment);
                return;
            }
            if (parentNode.getType() == NodeType.KeyValue) {
                // scalar turns into a mapping
                parentNode.setType(NodeType.MappingStart);
                parentNode.setValue(null);
                parentNode.setRawLine(null);
            }
            insertAt = NodeHierarchy.spanEnd(nodes, parent);
        }
        nodes.addAll(insertAt, fresh);
        logger.debug("Added {} node(s) for key '{}' under '{}'", fresh.size(), key, String.join(".", parentPath));
    }

    private static void addToFlowValue(Node parentNode, List<String> parentPath, String key, Object value,
                                       String comment) {
        if (!(parentNode.getValue() instanceof Map<?, ?> flow)) {
            throw new IllegalArgumentException("Cannot add key '" + key + "' to the list at "
                    + String.join(".", parentPath));
        }
        @SuppressWarnings("unchecked")
        Map<Object, Object> merged = (Map<Object, Object>) copyComposite(flow);
        Object existing = matchingKey(merged, key);
        merged.put(existing != null ? existing : key, value);
        parentNode.setValue(merged);
        if (comment != null) {
            logger.warn("Comment for '{}' dropped, keys inside {} have no line of their own", key, String.join(".", parentPath));
        }
        logger.debug("Added key '{}' inside the value of '{}'", key, String.join(".", parentPath));
    }

    /**
     * Removes the node at {@code path} together with everything indented under it.
     *
     * @throws YamlEditorException {@code EMPTY_PATH} or {@code PATH_NOT_FOUND}
     */
    public void deleteKey(List<String> path) {
        if (path.isEmpty()) {
            throw YamlEditorException.emptyPath("delete");
        }
        int index = resolve(path);
        if (index == NOT_FOUND) {
            throw YamlEditorException.pathNotFound(path);
        }
        int end = NodeHierarchy.spanEnd(nodes, index);
        nodes.subList(index, end).clear();
        logger.debug("Deleted {} ({} node(s))", String.join(".", path), end - index);
    }

    public String getComment(List<String> path) {
        return requireNode(path).getAttachedComment();
    }

    /**
     * Replaces the comment lines attached above the node. Lines missing a {@code #} get one,
     * unindented lines are indented like the node. {@code null} removes the comment.
     */
    public void setComment(List<String> path, String comment) {
        Node node = requireNode(path);
        node.setAttachedComment(comment == null ? null : normalizeComment(comment, node.getIndent()));
    }

    private Node requireNode(List<String> path) {
        int index = resolve(path);
        if (index < 0) {
            throw YamlEditorException.pathNotFound(path);
        }
        return nodes.get(index);
    }

    static String normalizeComment(String comment, int indent) {
        String[] lines = comment.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        List<String> normalized = new ArrayList<>(lines.length);
        for (String line : lines) {
            String content = line.stripLeading();
            String leading = line.substring(0, line.length() - content.length());
            if (!content.startsWith("#")) {
                content = content.isEmpty() ? "#" : "# " + content;
            }
            if (leading.isEmpty()) {
                leading = " ".repeat(indent);
            }
            normalized.add(leading + content);
        }
        return String.join("\n", normalized);
    }

    // ==================== Traversal ====================

    /**
     * Visits every node once in document order. Each node is handed to the visitor with
     * the keys of its enclosing nodes; comments and blank lines see the keys of the
     * structure they sit in. Removing a node removes everything it owns, and those
     * nodes are not visited: a visitor that removes a mapping never sees the keys below
     * it. Removals are applied once the pass is complete.
     */
    public void visit(NodeVisitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        boolean[] removed = new boolean[nodes.size()];
        int skipUntil = 0;
        for (int i = 0; i < nodes.size(); i++) {
            if (i < skipUntil) {
                continue;
            }
            Node node = nodes.get(i);
            List<String> ancestors = new ArrayList<>();
            if (node.isStructural()) {
                while (!stack.isEmpty() && !stack.peekLast().owns(node)) {
                    stack.removeLast();
                }
            }
            for (Frame frame : stack) {
                if (frame.key != null && (node.isStructural() || frame.indent < node.getIndent())) {
                    ancestors.add(frame.key);
                }
            }

            VisitResult result = visitor.visit(node, Collections.unmodifiableList(ancestors));
            if (result == VisitResult.REMOVE) {
                int end = node.isStructural() ? NodeHierarchy.spanEnd(nodes, i) : i + 1;
                for (int j = i; j < end; j++) {
                    removed[j] = true;
                }
                skipUntil = end;
                continue;
            }
            if (node.isStructural()) {
                stack.addLast(new Frame(node.getIndent(), node.getKey(), node.getType() == NodeType.MappingStart));
            }
        }

        int count = 0;
        Iterator<Node> it = nodes.iterator();
        for (int i = 0; it.hasNext(); i++) {
            it.next();
            if (removed[i]) {
                it.remove();
                count++;
            }
        }
        if (count > 0) {
            logger.debug("Visit removed {} node(s)", count);
        }
    }

    private static final class Frame {
        private final int indent;
        private final String key;
        private final boolean mapping;

        private Frame(int indent, String key, boolean mapping) {
            this.indent = indent;
            this.key = key;
            this.mapping = mapping;
        }

        // same test as NodeHierarchy.parentIndex
        private boolean owns(Node node) {
            return node.getIndent() > indent
                    || (node.getIndent() == indent && mapping && node.getType() == NodeType.SequenceItem);
        }
    }
}
