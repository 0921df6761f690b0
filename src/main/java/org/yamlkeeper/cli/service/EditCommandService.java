package org.yamlkeeper.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yamlkeeper.YamlEditor;
import org.yamlkeeper.YamlEditorException;
import org.yamlkeeper.cli.config.EditorProperties;
import org.yamlkeeper.value.YamlValues;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs one editing command against a file.
 * <p>
 * Commands:
 * <pre>
 *   get     FILE PATH
 *   set     FILE PATH VALUE
 *   add     FILE PARENT_PATH KEY VALUE [COMMENT]
 *   delete  FILE PATH
 *   comment FILE PATH [TEXT]
 *   dump    FILE
 *   inspect FILE
 * </pre>
 * Paths are dot separated, an empty string is the document root. Values are read as
 * YAML, so {@code 8080} is a number and {@code "[a, b]"} a list.
 */
@Service
public class EditCommandService {

    private static final Logger logger = LoggerFactory.getLogger(EditCommandService.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final EditorProperties editorProperties;
    private final ObjectMapper mapper;

    public EditCommandService(EditorProperties editorProperties) {
        this.editorProperties = editorProperties;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Executes the command in {@code args}. Spring style {@code --name=value} options are ignored.
     *
     * @return process exit code
     */
    public int execute(String[] args, PrintStream out, PrintStream err) {
        List<String> words = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                words.add(arg);
            }
        }
        if (words.size() < 2) {
            err.println("Usage: <get|set|add|delete|comment|dump|inspect> FILE [ARGS...]");
            return EXIT_USAGE;
        }
        String command = words.get(0);
        Path file = Paths.get(words.get(1));
        List<String> rest = words.subList(2, words.size());

        logger.info("Executing '{}' on {}", command, file);
        try {
            return switch (command) {
                case "get" -> get(file, rest, out, err);
                case "set" -> set(file, rest, err);
                case "add" -> add(file, rest, err);
                case "delete" -> delete(file, rest, err);
                case "comment" -> comment(file, rest, out, err);
                case "dump" -> dump(file, out);
                case "inspect" -> inspect(file, out);
                default -> {
                    err.println("Unknown command: " + command);
                    yield EXIT_USAGE;
                }
            };
        } catch (YamlEditorException e) {
            logger.error("Command '{}' failed: {}", command, e.getMessage());
            err.println(e.getKind() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (JsonProcessingException e) {
            logger.error("Cannot render output of '{}'", command, e);
            err.println("Cannot render output: " + e.getOriginalMessage());
            return EXIT_FAILURE;
        }
    }

    private int get(Path file, List<String> rest, PrintStream out, PrintStream err) throws JsonProcessingException {
        if (rest.size() != 1) {
            return usage(err, "get FILE PATH");
        }
        Object value = open(file).getValue(parsePath(rest.get(0)));
        out.println(editorProperties.isPrintJson() ? mapper.writeValueAsString(value) : String.valueOf(value));
        return EXIT_OK;
    }

    private int set(Path file, List<String> rest, PrintStream err) {
        if (rest.size() != 2) {
            return usage(err, "set FILE PATH VALUE");
        }
        YamlEditor editor = open(file);
        editor.setValue(parsePath(rest.get(0)), parseValue(rest.get(1)));
        editor.save(file, editorProperties.toDumpOptions());
        return EXIT_OK;
    }

    private int add(Path file, List<String> rest, PrintStream err) {
        if (rest.size() < 3 || rest.size() > 4) {
            return usage(err, "add FILE PARENT_PATH KEY VALUE [COMMENT]");
        }
        YamlEditor editor = open(file);
        String comment = rest.size() == 4 ? rest.get(3) : null;
        editor.addKey(parsePath(rest.get(0)), rest.get(1), parseValue(rest.get(2)), comment);
        editor.save(file, editorProperties.toDumpOptions());
        return EXIT_OK;
    }

    private int delete(Path file, List<String> rest, PrintStream err) {
        if (rest.size() != 1) {
            return usage(err, "delete FILE PATH");
        }
        YamlEditor editor = open(file);
        editor.deleteKey(parsePath(rest.get(0)));
        editor.save(file, editorProperties.toDumpOptions());
        return EXIT_OK;
    }

    private int comment(Path file, List<String> rest, PrintStream out, PrintStream err) {
        if (rest.isEmpty() || rest.size() > 2) {
            return usage(err, "comment FILE PATH [TEXT]");
        }
        YamlEditor editor = open(file);
        List<String> path = parsePath(rest.get(0));
        if (rest.size() == 1) {
            String comment = editor.getComment(path);
            if (comment != null) {
                out.println(comment);
            }
            return EXIT_OK;
        }
        editor.setComment(path, rest.get(1).isEmpty() ? null : rest.get(1));
        editor.save(file, editorProperties.toDumpOptions());
        return EXIT_OK;
    }

    private int dump(Path file, PrintStream out) {
        out.print(open(file).dump(editorProperties.toDumpOptions()));
        return EXIT_OK;
    }

    private int inspect(Path file, PrintStream out) throws JsonProcessingException {
        out.println(mapper.writeValueAsString(open(file).getTree().getNodes()));
        return EXIT_OK;
    }

    private YamlEditor open(Path file) {
        return new YamlEditor().load(file, editorProperties.resolveCharset());
    }

    private static int usage(PrintStream err, String synopsis) {
        err.println("Usage: " + synopsis);
        return EXIT_USAGE;
    }

    static List<String> parsePath(String path) {
        if (path == null || path.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(path.split("\\.", -1));
    }

    /**
     * Reads a command line value as YAML; text that is not valid YAML is taken as a plain string.
     */
    static Object parseValue(String text) {
        if (text.isEmpty()) {
            return "";
        }
        try {
            return YamlValues.parseDocument(text);
        } catch (JsonProcessingException e) {
            logger.debug("Value '{}' is not YAML, using it as a string", text);
            return text;
        }
    }
}
