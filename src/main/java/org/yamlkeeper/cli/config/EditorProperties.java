package org.yamlkeeper.cli.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import org.yamlkeeper.DumpOptions;

import java.nio.charset.Charset;

/**
 * Configuration properties for the command line editor
 */
@Component
@Validated
@ConfigurationProperties(prefix = "editor")
public class EditorProperties {

    private boolean collapseLiteralBlockEmptyLines = false;

    @NotNull
    private DumpOptions.QuotingStyle quotingStyle = DumpOptions.QuotingStyle.STRICT;

    @NotBlank
    private String charset = "UTF-8";

    private boolean printJson = true;  // values printed by "get" as JSON, otherwise as plain text

    @AssertTrue(message = "editor.charset must name a charset supported by this JVM")
    public boolean isCharsetSupported() {
        return charset == null || charset.isBlank() || Charset.isSupported(charset);
    }

    public DumpOptions toDumpOptions() {
        return DumpOptions.defaults()
                .setCollapseLiteralBlockEmptyLines(collapseLiteralBlockEmptyLines)
                .setQuotingStyle(quotingStyle);
    }

    public Charset resolveCharset() {
        return Charset.forName(charset);
    }

    // Getters and Setters
    public boolean isCollapseLiteralBlockEmptyLines() { return collapseLiteralBlockEmptyLines; }
    public void setCollapseLiteralBlockEmptyLines(boolean collapseLiteralBlockEmptyLines) { this.collapseLiteralBlockEmptyLines = collapseLiteralBlockEmptyLines; }
    public DumpOptions.QuotingStyle getQuotingStyle() { return quotingStyle; }
    public void setQuotingStyle(DumpOptions.QuotingStyle quotingStyle) { this.quotingStyle = quotingStyle; }
    public String getCharset() { return charset; }
    public void setCharset(String charset) { this.charset = charset; }
    public boolean isPrintJson() { return printJson; }
    public void setPrintJson(boolean printJson) { this.printJson = printJson; }
}
