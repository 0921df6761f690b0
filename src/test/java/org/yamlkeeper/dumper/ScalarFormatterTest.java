package org.yamlkeeper.dumper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.yamlkeeper.DumpOptions.QuotingStyle.MINIMAL;
import static org.yamlkeeper.DumpOptions.QuotingStyle.STRICT;

class ScalarFormatterTest {

    @Test
    @DisplayName("Non-string scalars")
    void scalars() {
        assertEquals("true", ScalarFormatter.format(true, STRICT));
        assertEquals("null", ScalarFormatter.format(null, STRICT));
        assertEquals("42", ScalarFormatter.format(42, STRICT));
        assertEquals("2.5", ScalarFormatter.format(2.5, STRICT));
        assertEquals("0.10", ScalarFormatter.format(new BigDecimal("0.10"), STRICT));
        assertEquals(".nan", ScalarFormatter.format(Double.NaN, STRICT));
        assertEquals("-.inf", ScalarFormatter.format(Double.NEGATIVE_INFINITY, MINIMAL));
    }

    @Nested
    @DisplayName("Strict quoting")
    class Strict {

        @Test
        void plainAndNumericStringsStayBare() {
            assertEquals("hello", ScalarFormatter.format("hello", STRICT));
            assertEquals("1.5", ScalarFormatter.format("1.5", STRICT));
        }

        @Test
        void specialCharactersAreSingleQuoted() {
            assertEquals("'hello world'", ScalarFormatter.format("hello world", STRICT));
            assertEquals("'a:b'", ScalarFormatter.format("a:b", STRICT));
            assertEquals("'it''s-here'", ScalarFormatter.format("it's-here", STRICT));
            assertEquals("'*ref'", ScalarFormatter.format("*ref", STRICT));
            assertEquals("''", ScalarFormatter.format("", STRICT));
        }

        @Test
        void controlCharactersAreDoubleQuoted() {
            assertEquals("\"a\\nb\\t\\\"c\\\"\"", ScalarFormatter.format("a\nb\t\"c\"", STRICT));
        }

        @ParameterizedTest
        @ValueSource(strings = {"true", "False", "null", "~", "yes", "No", "on", "off", "y", "n"})
        @DisplayName("Strings that read as booleans or null are single-quoted")
        void reservedWordsAreSingleQuoted(String word) {
            assertEquals("'" + word + "'", ScalarFormatter.format(word, STRICT));
        }
    }

    @Nested
    @DisplayName("Minimal quoting")
    class Minimal {

        @ParameterizedTest
        @ValueSource(strings = {"yes", "No", "null", "~", "123", "-1.5e3", "@home", "[x", "{y", "'q", " lead", "trail ",
                "a: b", "a #b", "- item", "key:"})
        void quotedWhenAmbiguous(String value) {
            assertTrue(ScalarFormatter.requiresQuotingMinimal(value), value);
            assertEquals('\'', ScalarFormatter.format(value, MINIMAL).charAt(0), value);
        }

        @ParameterizedTest
        @ValueSource(strings = {"hello world", "Updated build description with new functionality.", "a-b", "a:b", "x#y"})
        void bareOtherwise(String value) {
            assertFalse(ScalarFormatter.requiresQuotingMinimal(value), value);
            assertEquals(value, ScalarFormatter.format(value, MINIMAL));
        }

        @Test
        void emptyStringIsQuoted() {
            assertEquals("''", ScalarFormatter.format("", MINIMAL));
        }
    }

    @Test
    @DisplayName("Composites are rendered in flow style")
    void flowCollections() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "web");
        map.put("ports", List.of(80, 443));

        assertEquals("{name: web, ports: [80, 443]}", ScalarFormatter.format(map, STRICT));
        assertEquals("[a, 'b, c']", ScalarFormatter.format(List.of("a", "b, c"), MINIMAL));
        assertEquals("[]", ScalarFormatter.format(List.of(), STRICT));
    }
}
