package org.yamlkeeper.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One line-level element of a YAML document: a key/value pair, a mapping header,
 * a sequence item, a block scalar, a comment or a blank line.
 * <p>
 * Nodes produced by the lexer keep their original source text in {@link #getRawLine()},
 * which lets the dumper reproduce untouched lines byte for byte. Nodes built from
 * native values (new keys, mirror nodes) carry nested {@link #getChildren() children}
 * instead and have no raw line.
 */
@JsonPropertyOrder({"type", "key", "value", "indent", "children", "attachedComment", "rawLine"})
public class Node {

    private NodeType type;
    private String key;
    private Object value;
    private int indent;
    private final List<Node> children = new ArrayList<>();
    private String attachedComment;
    private String rawLine;

    private boolean pristine;
    private Object pristineValue;

    public Node(NodeType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Node(NodeType type, String key, Object value, int indent) {
        this(type);
        this.key = key;
        this.value = value;
        setIndent(indent);
    }

    public static Node keyValue(String key, Object value, int indent) {
        return new Node(NodeType.KeyValue, key, value, indent);
    }

    public static Node mappingStart(String key, int indent) {
        return new Node(NodeType.MappingStart, key, null, indent);
    }

    public static Node sequenceItem(Object value, int indent) {
        return new Node(NodeType.SequenceItem, null, value, indent);
    }

    public static Node comment(String rawLine, int indent) {
        Node node = new Node(NodeType.Comment, null, null, indent);
        node.rawLine = rawLine;
        return node;
    }

    public static Node blankLine(String rawLine) {
        Node node = new Node(NodeType.BlankLine);
        node.rawLine = rawLine;
        return node;
    }

    public NodeType getType() {
        return type;
    }

    public void setType(NodeType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public int getIndent() {
        return indent;
    }

    public void setIndent(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        this.indent = indent;
    }

    public List<Node> getChildren() {
        return children;
    }

    public void addChild(Node child) {
        children.add(Objects.requireNonNull(child, "child must not be null"));
    }

    public String getAttachedComment() {
        return attachedComment;
    }

    public void setAttachedComment(String attachedComment) {
        this.attachedComment = attachedComment;
    }

    public String getRawLine() {
        return rawLine;
    }

    public void setRawLine(String rawLine) {
        this.rawLine = rawLine;
    }

    @JsonIgnore
    public boolean isStructural() {
        return type.isStructural();
    }

    /**
     * Records the current value as the one that matches {@link #getRawLine()}.
     */
    public void markPristine() {
        this.pristine = true;
        this.pristineValue = value;
    }

    /**
     * True while the node still holds the value it had when {@link #markPristine()} was called.
     */
    @JsonIgnore
    public boolean isPristine() {
        return pristine && Objects.equals(value, pristineValue);
    }

    /**
     * Shallow copy: children are shared, the pristine snapshot is not carried over.
     */
    public Node copy() {
        Node copy = new Node(type, key, value, indent);
        copy.children.addAll(children);
        copy.attachedComment = attachedComment;
        copy.rawLine = rawLine;
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Node(").append(type.name());
        if (key != null) {
            sb.append(", key: '").append(key).append('\'');
        }
        if (value != null) {
            sb.append(", value: ");
            if (value instanceof String) {
                sb.append('\'').append(value).append('\'');
            } else {
                sb.append(value);
            }
        }
        if (indent > 0) {
            sb.append(", indent: ").append(indent);
        }
        if (!children.isEmpty()) {
            sb.append(", children: ").append(children.size());
        }
        if (attachedComment != null) {
            sb.append(", comment: '").append(attachedComment).append('\'');
        }
        return sb.append(')').toString();
    }
}
