package org.yamlkeeper.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Native value handling backed by Jackson's YAML data format.
 * <p>
 * This is the single place where document text is turned into authoritative values.
 * The parser, the aligner and the dumper all compare values through it, so a raw
 * fragment and a parsed value are judged by the same rules.
 * <p>
 * Supported native values form a closed set: {@code null}, {@link String},
 * {@link Boolean}, {@link Number}, {@link List} and {@link Map}.
 */
public final class YamlValues {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private YamlValues() {
    }

    /**
     * Parses a whole document. Returns {@code null} for empty or comment-only content.
     *
     * @throws JsonProcessingException if the text is not valid YAML
     */
    public static Object parseDocument(String content) throws JsonProcessingException {
        if (content == null || content.isBlank()) {
            return null;
        }
        JsonNode tree = YAML_MAPPER.readTree(content);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return null;
        }
        return YAML_MAPPER.treeToValue(tree, Object.class);
    }

    /**
     * Parses the value part of a {@code key: value} line by parsing the whole entry,
     * the same way the document parser would see it.
     *
     * @throws JsonProcessingException if the entry is not valid YAML
     */
    public static Object parseEntryValue(String key, String rawValue) throws JsonProcessingException {
        Object parsed = parseDocument(key + ": " + (rawValue == null ? "" : rawValue));
        if (parsed instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (key.equals(String.valueOf(entry.getKey()))) {
                    return entry.getValue();
                }
            }
            if (map.size() == 1) {
                return map.values().iterator().next();
            }
        }
        return parsed;
    }

    /**
     * Parses the value part of a {@code - value} sequence line.
     *
     * @throws JsonProcessingException if the item is not valid YAML
     */
    public static Object parseSequenceValue(String rawValue) throws JsonProcessingException {
        Object parsed = parseDocument("- " + (rawValue == null ? "" : rawValue));
        if (parsed instanceof List<?> list && list.size() == 1) {
            return list.get(0);
        }
        return parsed;
    }

    /**
     * Best-effort parse used where a value must always be produced: falls back to the
     * raw text with surrounding quotes removed.
     */
    public static Object parseEntryValueOrRaw(String key, String rawValue) {
        try {
            return parseEntryValue(key, rawValue);
        } catch (JsonProcessingException e) {
            return unquote(rawValue);
        }
    }

    public static Object parseSequenceValueOrRaw(String rawValue) {
        try {
            return parseSequenceValue(rawValue);
        } catch (JsonProcessingException e) {
            return unquote(rawValue);
        }
    }

    static String unquote(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && (trimmed.charAt(start) == '"' || trimmed.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (trimmed.charAt(end - 1) == '"' || trimmed.charAt(end - 1) == '\'')) {
            end--;
        }
        return trimmed.substring(start, end);
    }

    /**
     * Semantic equality of two native values: numbers compare by numeric value,
     * maps compare by string form of their keys, lists element by element.
     */
    public static boolean semanticallyEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return numbersEqual(na, nb);
        }
        if (isList(a) && isList(b)) {
            List<?> la = asList(a);
            List<?> lb = asList(b);
            if (la.size() != lb.size()) {
                return false;
            }
            for (int i = 0; i < la.size(); i++) {
                if (!semanticallyEqual(la.get(i), lb.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            Iterator<? extends Map.Entry<?, ?>> ia = ma.entrySet().iterator();
            Iterator<? extends Map.Entry<?, ?>> ib = mb.entrySet().iterator();
            while (ia.hasNext()) {
                Map.Entry<?, ?> ea = ia.next();
                Map.Entry<?, ?> eb = ib.next();
                if (!String.valueOf(ea.getKey()).equals(String.valueOf(eb.getKey()))
                        || !semanticallyEqual(ea.getValue(), eb.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    private static boolean numbersEqual(Number a, Number b) {
        try {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        } catch (NumberFormatException e) {
            // NaN and infinities
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
    }

    /**
     * Maps and lists are composites; everything else is a scalar.
     */
    public static boolean isComposite(Object value) {
        return value instanceof Map || value instanceof List;
    }

    /**
     * A value is list-like when it is a {@link List}, or a non-empty {@link Map} whose keys
     * are exactly the integers {@code 0..n-1} in order.
     */
    public static boolean isList(Object value) {
        if (value instanceof List) {
            return true;
        }
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) {
            return false;
        }
        int expected = 0;
        for (Object key : map.keySet()) {
            if (!String.valueOf(expected).equals(String.valueOf(key))) {
                return false;
            }
            expected++;
        }
        return true;
    }

    /**
     * Elements of a list-like value, see {@link #isList(Object)}.
     */
    public static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Map<?, ?> map && isList(map)) {
            return new ArrayList<>(map.values());
        }
        throw new IllegalArgumentException("Not a list value: " + value);
    }

    /**
     * Rejects values outside the supported set, recursing into composites.
     *
     * @throws IllegalArgumentException for unsupported types
     */
    public static void requireSupported(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return;
        }
        if (value instanceof Number) {
            if (value instanceof Integer || value instanceof Long || value instanceof Double
                    || value instanceof Float || value instanceof Short || value instanceof Byte
                    || value instanceof BigInteger || value instanceof BigDecimal) {
                return;
            }
        } else if (value instanceof List<?> list) {
            list.forEach(YamlValues::requireSupported);
            return;
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() == null) {
                    throw new IllegalArgumentException("Map keys must not be null");
                }
                requireSupported(entry.getValue());
            }
            return;
        }
        throw new IllegalArgumentException("Unsupported YAML value type: " + value.getClass().getName());
    }
}
