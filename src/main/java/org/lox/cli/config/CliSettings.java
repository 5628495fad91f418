package org.lox.cli.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code lox.cli} and {@code lox.diagnostics} configuration sections.
 *
 * @param prompt The REPL prompt.
 * @param printTokens Whether recognized tokens are listed on standard output.
 * @param showTrivia Whether whitespace and comment tokens are included in the listing.
 * @param appendEof Whether the listing ends with an {@code EOF} token.
 * @param color Whether diagnostics use ANSI styling.
 * @param contextLines Source lines shown before and after a diagnostic.
 */
public record CliSettings(
        String prompt,
        boolean printTokens,
        boolean showTrivia,
        boolean appendEof,
        boolean color,
        int contextLines
) {

    public static CliSettings fromConfig(final Config config) {
        final Config cli = config.getConfig("lox.cli");
        final Config diagnostics = config.getConfig("lox.diagnostics");
        return new CliSettings(
                cli.getString("prompt"),
                cli.getBoolean("print-tokens"),
                cli.getBoolean("show-trivia"),
                cli.getBoolean("append-eof"),
                diagnostics.getBoolean("color"),
                diagnostics.getInt("context-lines"));
    }

    /**
     * Applies command line overrides; a {@code null} argument keeps the configured value.
     */
    public CliSettings withOverrides(final Boolean printTokens, final Boolean showTrivia, final Boolean appendEof) {
        return new CliSettings(
                prompt,
                printTokens != null ? printTokens : this.printTokens,
                showTrivia != null ? showTrivia : this.showTrivia,
                appendEof != null ? appendEof : this.appendEof,
                color,
                contextLines);
    }
}
