package org.yamlkeeper.parser;

import org.yamlkeeper.ast.Node;
import org.yamlkeeper.ast.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches runs of comment lines to the structural node directly below them.
 * A run separated from the next node by a blank line stays floating.
 */
public final class CommentAttacher {

    private CommentAttacher() {
    }

    public static List<Node> attach(List<Node> tokens) {
        List<Node> result = new ArrayList<>(tokens.size());
        List<Node> pending = new ArrayList<>();
        boolean blankSeen = false;

        for (Node token : tokens) {
            if (token.getType() == NodeType.Comment) {
                pending.add(token);
                blankSeen = false;
            } else if (token.getType() == NodeType.BlankLine) {
                result.addAll(pending);
                pending.clear();
                blankSeen = true;
                result.add(token);
            } else {
                if (!pending.isEmpty()) {
                    if (blankSeen) {
                        result.addAll(pending);
                    } else {
                        List<String> lines = new ArrayList<>(pending.size());
                        pending.forEach(c -> lines.add(c.getRawLine()));
                        token.setAttachedComment(String.join("\n", lines));
                    }
                    pending.clear();
                }
                blankSeen = false;
                result.add(token);
            }
        }
        result.addAll(pending);
        return result;
    }
}
