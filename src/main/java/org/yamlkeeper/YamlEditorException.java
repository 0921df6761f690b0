package org.yamlkeeper;

import java.util.List;

/**
 * Failure of a tree or editor operation. Each failure carries exactly one {@link Kind}.
 */
public class YamlEditorException extends RuntimeException {

    public enum Kind {
        PATH_NOT_FOUND,
        EMPTY_PATH,
        PARENT_NOT_FOUND,
        SOURCE_UNREADABLE,
        SOURCE_UNWRITABLE
    }

    private final Kind kind;

    public YamlEditorException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public YamlEditorException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static YamlEditorException pathNotFound(List<String> path) {
        return new YamlEditorException(Kind.PATH_NOT_FOUND, "Path not found: " + String.join(".", path));
    }

    public static YamlEditorException emptyPath(String operation) {
        return new YamlEditorException(Kind.EMPTY_PATH, operation + " requires a non-empty path");
    }

    public static YamlEditorException parentNotFound(List<String> parentPath) {
        return new YamlEditorException(Kind.PARENT_NOT_FOUND, "Parent not found: " + String.join(".", parentPath));
    }
}
