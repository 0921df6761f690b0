package org.yamlkeeper;

/**
 * Rendering options for {@link YamlEditor#dump(DumpOptions)} and {@link YamlEditor#save}.
 */
public class DumpOptions {

    /**
     * How changed string values are quoted.
     */
    public enum QuotingStyle {
        /** Quote any string containing {@code :}, {@code #}, {@code -} or whitespace. */
        STRICT,
        /** Quote only strings that would otherwise read back as something else. */
        MINIMAL
    }

    private boolean collapseLiteralBlockEmptyLines;
    private QuotingStyle quotingStyle = QuotingStyle.STRICT;

    public static DumpOptions defaults() {
        return new DumpOptions();
    }

    public boolean isCollapseLiteralBlockEmptyLines() {
        return collapseLiteralBlockEmptyLines;
    }

    public DumpOptions setCollapseLiteralBlockEmptyLines(boolean collapseLiteralBlockEmptyLines) {
        this.collapseLiteralBlockEmptyLines = collapseLiteralBlockEmptyLines;
        return this;
    }

    public QuotingStyle getQuotingStyle() {
        return quotingStyle;
    }

    public DumpOptions setQuotingStyle(QuotingStyle quotingStyle) {
        this.quotingStyle = quotingStyle == null ? QuotingStyle.STRICT : quotingStyle;
        return this;
    }

    @Override
    public String toString() {
        return "DumpOptions{collapseLiteralBlockEmptyLines=" + collapseLiteralBlockEmptyLines
                + ", quotingStyle=" + quotingStyle + '}';
    }
}
