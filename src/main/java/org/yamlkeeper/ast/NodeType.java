package org.yamlkeeper.ast;

/**
 * Kinds of lines a YAML document is made of.
 */
public enum NodeType {

    KeyValue,
    MappingStart,
    SequenceItem,
    Comment,
    BlankLine,
    LiteralBlock,
    FoldedBlock;

    /**
     * Structural nodes take part in the indentation hierarchy; comments and blank lines do not.
     */
    public boolean isStructural() {
        return this != Comment && this != BlankLine;
    }

    public boolean isBlock() {
        return this == LiteralBlock || this == FoldedBlock;
    }
}
