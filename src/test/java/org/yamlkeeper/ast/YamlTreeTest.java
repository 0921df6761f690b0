package org.yamlkeeper.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.yamlkeeper.DumpOptions;
import org.yamlkeeper.YamlEditorException;
import org.yamlkeeper.dumper.Dumper;
import org.yamlkeeper.parser.Parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlTreeTest {

    private static YamlTree parse(String text) {
        return Parser.parse(text).tree();
    }

    private static String dump(YamlTree tree) {
        return Dumper.dump(tree.getNodes(), DumpOptions.defaults(), "\n");
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        private final YamlTree tree = parse(""
                + "usage: root\n"
                + "commands:\n"
                + "  build:\n"
                + "    usage: nested\n"
                + "    port: 8080\n"
                + "services:\n"
                + "  - name: web\n"
                + "    port: 80\n"
                + "  - name: api\n"
                + "tags:\n"
                + "  - a\n"
                + "  - b\n");

        @Test
        @DisplayName("Each segment only matches direct children")
        void directChildrenOnly() {
            assertEquals("root", tree.getValue(List.of("usage")));
            assertEquals("nested", tree.getValue(List.of("commands", "build", "usage")));
            assertFalse(tree.has(List.of("commands", "usage")));
            YamlEditorException e = assertThrows(YamlEditorException.class,
                    () -> tree.getValue(List.of("commands", "usage")));
            assertEquals(YamlEditorException.Kind.PATH_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("Mapping headers are assembled from their children")
        void assembledValues() {
            Map<String, Object> build = new LinkedHashMap<>();
            build.put("usage", "nested");
            build.put("port", 8080);

            assertEquals(Map.of("build", build), tree.getValue(List.of("commands")));
            assertEquals(List.of("a", "b"), tree.getValue(List.of("tags")));
        }

        @Test
        @DisplayName("Numeric segments select sequence items")
        void numericSegments() {
            assertEquals("b", tree.getValue(List.of("tags", "1")));
            assertEquals(80, tree.getValue(List.of("services", "0", "port")));
            assertEquals("web", tree.getValue(List.of("services", "0", "name")));
            assertEquals(Map.of("name", "api"), tree.getValue(List.of("services", "1")));
            assertTrue(tree.has(List.of("services", "1", "name")));
            assertFalse(tree.has(List.of("services", "2")));
        }

        @Test
        void findNode() {
            assertEquals(NodeType.MappingStart, tree.findNode(List.of("commands", "build")).getType());
            assertEquals(NodeType.SequenceItem, tree.findNode(List.of("services", "1")).getType());
            assertNull(tree.findNode(List.of("commands", "deploy")));
        }

        @Test
        @DisplayName("Items written at their key's indent belong to the key")
        void itemsAtKeyIndent() {
            YamlTree flat = parse("key:\n- a\n- 1\nother: x\n");

            assertEquals(List.of("a", 1), flat.getValue(List.of("key")));
            assertEquals(1, flat.getValue(List.of("key", "1")));
            assertEquals(List.of("key", "other"), new ArrayList<>(((Map<?, ?>) flat.getValue(List.of())).keySet()));

            flat.setValue(List.of("key", "0"), "b");
            assertEquals("key:\n- b\n- 1\nother: x\n", dump(flat));
            flat.deleteKey(List.of("key"));
            assertEquals("other: x\n", dump(flat));
        }

        @Test
        void emptyPathReturnsDocument() {
            Object doc = tree.getValue(List.of());
            assertInstanceOf(Map.class, doc);
            assertEquals(List.of("usage", "commands", "services", "tags"), new ArrayList<>(((Map<?, ?>) doc).keySet()));
        }
    }

    @Nested
    @DisplayName("Set")
    class SetValue {

        @Test
        @DisplayName("Scalars are written in place")
        void inPlace() {
            YamlTree tree = parse("a:\n  b: 1\n");
            tree.setValue(List.of("a", "b"), 2);

            assertEquals(2, tree.getValue(List.of("a", "b")));
            assertEquals("a:\n  b: 2\n", dump(tree));
        }

        @Test
        @DisplayName("Replacing a mapping with a scalar rebuilds its span")
        void mappingToScalar() {
            YamlTree tree = parse("# about a\na:\n  b: 1\nc: 2\n");
            tree.setValue(List.of("a"), "x");

            assertEquals("# about a\na: x\nc: 2\n", dump(tree));
        }

        @Test
        @DisplayName("Replacing a scalar with a list builds nested items")
        void scalarToList() {
            YamlTree tree = parse("a: 1\n");
            tree.setValue(List.of("a"), List.of("x", "y"));

            assertEquals("a:\n  - x\n  - y\n", dump(tree));
            assertEquals(List.of("x", "y"), tree.getValue(List.of("a")));
        }

        @Test
        @DisplayName("Missing paths are created under their parent")
        void createsMissingKey() {
            YamlTree tree = parse("a:\n  b: 1\nz: 0\n");
            tree.setValue(List.of("a", "c"), 2);

            assertEquals("a:\n  b: 1\n  c: 2\nz: 0\n", dump(tree));
        }

        @Test
        @DisplayName("Keys inside a flow mapping are updated in the mapping")
        void insideFlowMapping() {
            YamlTree tree = parse("a: {b: 1, c: 3}  # limits\nz: 0\n");
            assertTrue(tree.has(List.of("a", "b")));

            tree.setValue(List.of("a", "b"), 2);
            assertEquals("a: {b: 2, c: 3}  # limits\nz: 0\n", dump(tree));

            tree.setValue(List.of("a", "d"), "x");
            assertEquals("a: {b: 2, c: 3, d: x}  # limits\nz: 0\n", dump(tree));

            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put("b", 2);
            expected.put("c", 3);
            expected.put("d", "x");
            assertEquals(expected, tree.getValue(List.of("a")));
        }

        @Test
        @DisplayName("Items inside a flow sequence are replaced in the sequence")
        void insideFlowSequence() {
            YamlTree tree = parse("tags: [a, b]\n");
            tree.setValue(List.of("tags", "1"), "z");

            assertEquals("tags: [a, z]\n", dump(tree));
            assertEquals(List.of("a", "z"), tree.getValue(List.of("tags")));
        }

        @Test
        @DisplayName("A key on a sequence item line is rewritten on that line")
        void keyOnItemLine() {
            YamlTree tree = parse("services:\n  - name: web  # front\n    port: 80\n  - name: db\n");

            tree.setValue(List.of("services", "0", "name"), "api");
            tree.setValue(List.of("services", "1", "name"), "cache");

            assertEquals("services:\n  - name: api  # front\n    port: 80\n  - name: cache\n", dump(tree));
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("name", "api");
            first.put("port", 80);
            assertEquals(first, tree.getValue(List.of("services", "0")));
        }

        @Test
        @DisplayName("A new key below an item with nested lines gets its own line")
        void newKeyBelowItem() {
            YamlTree tree = parse("services:\n  - name: web\n    port: 80\n");
            tree.setValue(List.of("services", "0", "tls"), true);

            assertEquals("services:\n  - name: web\n    port: 80\n    tls: true\n", dump(tree));
        }

        @Test
        void errors() {
            YamlTree tree = parse("a: 1\n");

            assertEquals(YamlEditorException.Kind.EMPTY_PATH,
                    assertThrows(YamlEditorException.class, () -> tree.setValue(List.of(), 1)).getKind());
            assertEquals(YamlEditorException.Kind.PARENT_NOT_FOUND,
                    assertThrows(YamlEditorException.class, () -> tree.setValue(List.of("x", "y"), 1)).getKind());
            assertThrows(IllegalArgumentException.class, () -> tree.setValue(List.of("a"), new Object()));
        }
    }

    @Nested
    @DisplayName("Add")
    class AddKey {

        @Test
        @DisplayName("Root keys go before the final line terminator")
        void appendAtRoot() {
            YamlTree tree = parse("a: 1\n");
            tree.addKey(List.of(), "b", true, "new flag");

            assertEquals("a: 1\n# new flag\nb: true\n", dump(tree));
        }

        @Test
        @DisplayName("Nested keys go after the parent's last child")
        void appendUnderParent() {
            YamlTree tree = parse("db:\n  host: x\n\n# other\nweb: 1\n");
            Map<String, Object> pool = new LinkedHashMap<>();
            pool.put("min", 1);
            pool.put("max", 5);
            tree.addKey(List.of("db"), "pool", pool, null);

            assertEquals("db:\n  host: x\n  pool:\n    min: 1\n    max: 5\n\n# other\nweb: 1\n", dump(tree));
            assertEquals(5, tree.getValue(List.of("db", "pool", "max")));
        }

        @Test
        @DisplayName("Adding below a scalar turns it into a mapping")
        void scalarParentBecomesMapping() {
            YamlTree tree = parse("a: 1\n");
            tree.addKey(List.of("a"), "b", 2, null);

            assertEquals("a:\n  b: 2\n", dump(tree));
        }

        @Test
        @DisplayName("Adding below a flow mapping extends the mapping")
        void flowMappingParent() {
            YamlTree tree = parse("a: {b: 1}\n");
            tree.addKey(List.of("a"), "c", 2, null);

            assertEquals("a: {b: 1, c: 2}\n", dump(tree));
            assertThrows(IllegalArgumentException.class,
                    () -> parse("t: [1]\n").addKey(List.of("t"), "c", 2, null));
        }

        @Test
        void missingParent() {
            YamlTree tree = parse("a: 1\n");
            YamlEditorException e = assertThrows(YamlEditorException.class,
                    () -> tree.addKey(List.of("nope"), "b", 2, null));
            assertEquals(YamlEditorException.Kind.PARENT_NOT_FOUND, e.getKind());
        }
    }

    @Nested
    @DisplayName("Delete")
    class DeleteKey {

        private static final String DOC = "a:\n  b: 1\n  # about c\n  c:\n    d: 2\n\ne: 3\n";

        @Test
        @DisplayName("Deleting a mapping removes all of its descendants")
        void deletesSubtree() {
            YamlTree tree = parse(DOC);
            tree.deleteKey(List.of("a"));

            assertEquals("\ne: 3\n", dump(tree));
        }

        @Test
        @DisplayName("The attached comment goes with the node")
        void deletesNestedWithComment() {
            YamlTree tree = parse(DOC);
            tree.deleteKey(List.of("a", "c"));

            assertEquals("a:\n  b: 1\n\ne: 3\n", dump(tree));
            assertFalse(tree.has(List.of("a", "c", "d")));
        }

        @Test
        void errors() {
            YamlTree tree = parse(DOC);
            assertEquals(YamlEditorException.Kind.EMPTY_PATH,
                    assertThrows(YamlEditorException.class, () -> tree.deleteKey(List.of())).getKind());
            assertEquals(YamlEditorException.Kind.PATH_NOT_FOUND,
                    assertThrows(YamlEditorException.class, () -> tree.deleteKey(List.of("a", "x"))).getKind());
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        void readAndReplace() {
            YamlTree tree = parse("a:\n  # old\n  b: 1\n");

            assertEquals("  # old", tree.getComment(List.of("a", "b")));
            assertNull(tree.getComment(List.of("a")));

            tree.setComment(List.of("a", "b"), "first\n# second");
            assertEquals("a:\n  # first\n  # second\n  b: 1\n", dump(tree));

            tree.setComment(List.of("a", "b"), null);
            assertEquals("a:\n  b: 1\n", dump(tree));
        }

        @Test
        void missingPath() {
            YamlTree tree = parse("a: 1\n");
            assertEquals(YamlEditorException.Kind.PATH_NOT_FOUND,
                    assertThrows(YamlEditorException.class, () -> tree.getComment(List.of("b"))).getKind());
            assertEquals(YamlEditorException.Kind.PATH_NOT_FOUND,
                    assertThrows(YamlEditorException.class, () -> tree.setComment(List.of("b"), "x")).getKind());
        }

        @Test
        void normalization() {
            assertEquals("  # hello\n  # there\n    # kept", YamlTree.normalizeComment("hello\n# there\n    # kept", 2));
            assertEquals("#", YamlTree.normalizeComment("", 0));
        }
    }

    @Nested
    @DisplayName("Visit")
    class Visit {

        private static final String DOC = "a:\n  b: 1\n\n  c: 2\nd: 3\n";

        @Test
        @DisplayName("Visitors see ancestor keys; blank lines do not reset them")
        void ancestorKeys() {
            YamlTree tree = parse(DOC);
            List<String> seen = new ArrayList<>();
            tree.visit((node, ancestors) -> {
                if (node.isStructural()) {
                    seen.add(String.join(".", ancestors) + "/" + node.getKey());
                }
                return VisitResult.KEEP;
            });

            assertEquals(List.of("/a", "a/b", "a/c", "/d"), seen);
        }

        @Test
        @DisplayName("Items at their key's indent see the key as an ancestor")
        void itemsAtKeyIndent() {
            YamlTree tree = parse("key:\n- a\n- b\nother: 1\n");
            List<String> seen = new ArrayList<>();
            tree.visit((node, ancestors) -> {
                seen.add(String.join(".", ancestors) + "/" + (node.getKey() != null ? node.getKey() : node.getValue()));
                return VisitResult.KEEP;
            });

            assertEquals(List.of("/key", "key/a", "key/b", "/other"), seen);
        }

        @Test
        @DisplayName("Removing a node removes and skips its descendants")
        void removeSubtree() {
            YamlTree tree = parse(DOC);
            List<String> visited = new ArrayList<>();
            tree.visit((node, ancestors) -> {
                if (node.getKey() != null) {
                    visited.add(node.getKey());
                }
                return "a".equals(node.getKey()) ? VisitResult.REMOVE : VisitResult.KEEP;
            });

            assertEquals(List.of("a", "d"), visited);
            assertEquals("d: 3\n", dump(tree));
        }

        @Test
        @DisplayName("In-place changes made by the visitor are rendered")
        void mutateInPlace() {
            YamlTree tree = parse(DOC);
            tree.visit((node, ancestors) -> {
                if (node.getValue() instanceof Integer i) {
                    node.setValue(i * 10);
                }
                return VisitResult.KEEP;
            });

            assertEquals("a:\n  b: 10\n\n  c: 20\nd: 30\n", dump(tree));
        }
    }
}
