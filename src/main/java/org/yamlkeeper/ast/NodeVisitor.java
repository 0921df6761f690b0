package org.yamlkeeper.ast;

import java.util.List;

/**
 * Callback for {@link YamlTree#visit(NodeVisitor)}.
 * <p>
 * The visitor may change the fields of the node it receives (value, comment, key);
 * structural changes to the tree go through the tree's own operations or through
 * {@link VisitResult#REMOVE}.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * @param node         the node being visited
     * @param ancestorKeys keys of the enclosing nodes, outermost first
     */
    VisitResult visit(Node node, List<String> ancestorKeys);
}
