package org.yamlkeeper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamlkeeper.ast.MirrorBuilder;
import org.yamlkeeper.ast.Node;
import org.yamlkeeper.ast.YamlTree;
import org.yamlkeeper.value.YamlValues;

import java.util.Collections;
import java.util.List;

/**
 * Text to tree: tokenize, attach comments, build the mirror from the parsed
 * document value and align the two.
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private Parser() {
    }

    /**
     * Parsed document together with the line terminator it used.
     */
    public record Result(YamlTree tree, String lineTerminator) {
    }

    public static Result parse(String content) {
        String eol = Lexer.detectLineTerminator(content);
        List<Node> tokens = CommentAttacher.attach(Lexer.tokenize(content));

        List<Node> mirror;
        try {
            mirror = MirrorBuilder.build(YamlValues.parseDocument(content), 0);
        } catch (JsonProcessingException e) {
            logger.warn("Document is not valid YAML, keeping raw token values: {}", e.getOriginalMessage());
            mirror = Collections.emptyList();
        }
        logger.debug("Tokenized {} node(s), mirror has {} top-level node(s)", tokens.size(), mirror.size());

        return new Result(new YamlTree(Aligner.align(tokens, mirror)), eol);
    }
}
