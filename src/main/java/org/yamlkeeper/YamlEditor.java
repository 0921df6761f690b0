package org.yamlkeeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamlkeeper.ast.NodeVisitor;
import org.yamlkeeper.ast.YamlTree;
import org.yamlkeeper.dumper.Dumper;
import org.yamlkeeper.parser.Parser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Format-preserving YAML editor.
 * <p>
 * Loads a document into a lossless {@link YamlTree}, exposes path based reads and
 * writes of values and comments, and writes the document back with every untouched
 * line exactly as it was.
 * <p>
 * Features:
 * • Values, comments and whole subtrees addressed by key path
 * • Untouched lines reproduced byte for byte, inline comments kept on changed lines
 * • LF, CRLF and CR documents, UTF-8 byte order mark kept on save
 * • Literal and folded block scalars with optional empty line collapsing
 * <p>
 * Instances are not thread-safe.
 */
public class YamlEditor {

    private static final Logger logger = LoggerFactory.getLogger(YamlEditor.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private YamlTree tree = YamlTree.empty();
    private String lineTerminator = "\n";
    private Charset charset = StandardCharsets.UTF_8;
    private boolean bom;

    // ==================== Sources ====================

    public YamlEditor load(Path file) {
        return load(file, StandardCharsets.UTF_8);
    }

    /**
     * Reads and parses {@code file}. The charset and a leading UTF-8 byte order mark are
     * remembered and reused by {@link #save(Path)}.
     *
     * @throws YamlEditorException {@code SOURCE_UNREADABLE}
     */
    public YamlEditor load(Path file, Charset charset) {
        Objects.requireNonNull(file, "file must not be null");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new YamlEditorException(YamlEditorException.Kind.SOURCE_UNREADABLE,
                    "Cannot read " + file + ": " + e.getMessage(), e);
        }
        int offset = 0;
        if (StandardCharsets.UTF_8.equals(charset) && startsWithBom(bytes)) {
            offset = UTF8_BOM.length;
        }
        this.charset = charset;
        parse(new String(bytes, offset, bytes.length - offset, charset));
        this.bom = this.bom || offset > 0;
        logger.info("Loaded {} ({} nodes, {} bytes, charset {}{})", file, tree.getNodes().size(),
                bytes.length, charset.name(), bom ? ", BOM" : "");
        return this;
    }

    /**
     * Parses {@code content}, replacing the current document.
     */
    public YamlEditor parse(String content) {
        Objects.requireNonNull(content, "content must not be null");
        bom = false;
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            bom = true;
            content = content.substring(1);
        }
        Parser.Result result = Parser.parse(content);
        this.tree = result.tree();
        this.lineTerminator = result.lineTerminator();
        return this;
    }

    private static boolean startsWithBom(byte[] bytes) {
        return bytes.length >= UTF8_BOM.length
                && Arrays.equals(Arrays.copyOf(bytes, UTF8_BOM.length), UTF8_BOM);
    }

    // ==================== Values ====================

    public Object getValue(List<String> path) {
        return tree.getValue(path);
    }

    public Object getValue(String... path) {
        return getValue(List.of(path));
    }

    public void setValue(List<String> path, Object value) {
        tree.setValue(path, value);
    }

    public void setValue(Object value, String... path) {
        setValue(List.of(path), value);
    }

    public boolean has(List<String> path) {
        return tree.has(path);
    }

    public boolean has(String... path) {
        return has(List.of(path));
    }

    public void addKey(List<String> parentPath, String key, Object value) {
        tree.addKey(parentPath, key, value, null);
    }

    public void addKey(List<String> parentPath, String key, Object value, String comment) {
        tree.addKey(parentPath, key, value, comment);
    }

    public void addKey(String key, Object value, String... parentPath) {
        addKey(List.of(parentPath), key, value);
    }

    public void deleteKey(List<String> path) {
        tree.deleteKey(path);
    }

    public void deleteKey(String... path) {
        deleteKey(List.of(path));
    }

    // ==================== Comments ====================

    public String getComment(List<String> path) {
        return tree.getComment(path);
    }

    public String getComment(String... path) {
        return getComment(List.of(path));
    }

    public void setComment(List<String> path, String comment) {
        tree.setComment(path, comment);
    }

    public void setComment(String comment, String... path) {
        setComment(List.of(path), comment);
    }

    public void visit(NodeVisitor visitor) {
        tree.visit(visitor);
    }

    // ==================== Output ====================

    public String dump() {
        return dump(DumpOptions.defaults());
    }

    public String dump(DumpOptions options) {
        return Dumper.dump(tree.getNodes(), options, lineTerminator);
    }

    public void save(Path file) {
        save(file, DumpOptions.defaults());
    }

    /**
     * Writes the document to {@code file} in the charset it was loaded with,
     * restoring a byte order mark if the source had one.
     *
     * @throws YamlEditorException {@code SOURCE_UNWRITABLE}
     */
    public void save(Path file, DumpOptions options) {
        Objects.requireNonNull(file, "file must not be null");
        byte[] body = dump(options).getBytes(charset);
        byte[] out = body;
        if (bom) {
            out = new byte[UTF8_BOM.length + body.length];
            System.arraycopy(UTF8_BOM, 0, out, 0, UTF8_BOM.length);
            System.arraycopy(body, 0, out, UTF8_BOM.length, body.length);
        }
        try {
            Files.write(file, out);
        } catch (IOException e) {
            throw new YamlEditorException(YamlEditorException.Kind.SOURCE_UNWRITABLE,
                    "Cannot write " + file + ": " + e.getMessage(), e);
        }
        logger.info("Saved {} ({} bytes)", file, out.length);
    }

    public YamlTree getTree() {
        return tree;
    }

    public String getLineTerminator() {
        return lineTerminator;
    }

    public boolean hasByteOrderMark() {
        return bom;
    }
}
