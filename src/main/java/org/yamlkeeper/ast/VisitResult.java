package org.yamlkeeper.ast;

/**
 * Decision returned by a {@link NodeVisitor} for each node.
 */
public enum VisitResult {
    KEEP,
    /** Removes the node together with everything it owns. */
    REMOVE
}
