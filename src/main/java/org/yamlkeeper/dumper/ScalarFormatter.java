package org.yamlkeeper.dumper;

import org.yamlkeeper.DumpOptions.QuotingStyle;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Formats native values as YAML text for lines whose original text can't be reused.
 * Scalars are rendered plain where possible, composites in flow style.
 */
public final class ScalarFormatter {

    private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern STRICT_SPECIAL = Pattern.compile("[:#\\-]|\\s");
    private static final Pattern LEADING_INDICATOR = Pattern.compile("^[!&*:?#|>@`%,\\[\\]{}'\"]");
    private static final Pattern MINIMAL_INDICATOR = Pattern.compile("^[!&*:?#|>@`\\[\\]{}'\"%]");
    private static final Set<String> RESERVED = Set.of(
            "null", "~", "true", "false", "y", "n", "yes", "no", "on", "off");

    private ScalarFormatter() {
    }

    public static String format(Object value, QuotingStyle style) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Number n) {
            return formatNumber(n);
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(formatFlowItem(list.get(i), style));
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                sb.append(formatFlowItem(String.valueOf(entry.getKey()), style))
                        .append(": ")
                        .append(formatFlowItem(entry.getValue(), style));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append('}').toString();
        }
        return formatString(value.toString(), style);
    }

    private static String formatFlowItem(Object value, QuotingStyle style) {
        if (value instanceof String s && !s.isEmpty() && s.matches(".*[,\\[\\]{}].*")) {
            return needsDoubleQuotes(s) ? doubleQuote(s) : singleQuote(s);
        }
        return format(value, style);
    }

    private static String formatNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d)) {
                return ".nan";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? ".inf" : "-.inf";
            }
        }
        if (n instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        return n.toString();
    }

    static String formatString(String s, QuotingStyle style) {
        if (s.isEmpty()) {
            return "''";
        }
        if (needsDoubleQuotes(s)) {
            return doubleQuote(s);
        }
        if (style == QuotingStyle.MINIMAL) {
            return requiresQuotingMinimal(s) ? singleQuote(s) : s;
        }
        if (RESERVED.contains(s.toLowerCase(Locale.ROOT))) {
            return singleQuote(s);
        }
        if (NUMBER.matcher(s).matches()) {
            return s;
        }
        if (STRICT_SPECIAL.matcher(s).find() || LEADING_INDICATOR.matcher(s).find()) {
            return singleQuote(s);
        }
        return s;
    }

    /**
     * True when an unquoted string would read back as another type, or break the line.
     */
    static boolean requiresQuotingMinimal(String s) {
        if (RESERVED.contains(s.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (NUMBER.matcher(s).matches()) {
            return true;
        }
        if (MINIMAL_INDICATOR.matcher(s).find()) {
            return true;
        }
        if (Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1))) {
            return true;
        }
        if (s.startsWith("- ") || s.equals("-")) {
            return true;
        }
        return s.contains(": ") || s.endsWith(":") || s.contains(" #");
    }

    private static boolean needsDoubleQuotes(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                return true;
            }
        }
        return false;
    }

    private static String singleQuote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }

    private static String doubleQuote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
