package org.lox.compiler.diagnostics;

import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders diagnostics for humans: a header with file, line and column, followed by the
 * surrounding source lines and a row of carets under the offending bytes.
 * <pre>
 * Error at demo.lox:2:9: Invalid number '9.9.9'
 *     1 | var a = 1;
 *     2 | var b = 9.9.9;
 *                 ^^^^^
 *     3 | print a;
 * </pre>
 * Styling is optional and uses ANSI sequences produced by JLine.
 */
public class DiagnosticRenderer {

    private static final String GUTTER_FORMAT = " %4d | ";
    private static final int GUTTER_WIDTH = 8;

    private static final AttributedStyle ERROR_STYLE = AttributedStyle.BOLD.foreground(AttributedStyle.RED);
    private static final AttributedStyle GUTTER_STYLE = AttributedStyle.DEFAULT.faint();
    private static final AttributedStyle CARET_STYLE = AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW);

    private final int linesBefore;
    private final int linesAfter;
    private final boolean color;

    /**
     * @param contextLines How many lines to show before and after the offending lines.
     * @param color Whether to emit ANSI styling.
     */
    public DiagnosticRenderer(int contextLines, boolean color) {
        this(contextLines, contextLines, color);
    }

    public DiagnosticRenderer(int linesBefore, int linesAfter, boolean color) {
        if (linesBefore < 0 || linesAfter < 0) {
            throw new IllegalArgumentException("Context line counts must not be negative");
        }
        this.linesBefore = linesBefore;
        this.linesAfter = linesAfter;
        this.color = color;
    }

    /**
     * One source line shown around a diagnostic.
     *
     * @param line The 1-based line number.
     * @param text The line text without its terminator.
     * @param highlight The columns to underline, or {@code null} if the line is context only.
     */
    public record ContextLine(int line, String text, Highlight highlight) {
        public boolean hasHighlight() {
            return highlight != null;
        }
    }

    /**
     * A 0-based, half-open column range within a {@link ContextLine}.
     */
    public record Highlight(int start, int end) {
        public int length() {
            return end - start;
        }
    }

    /**
     * Computes the lines to show for the given byte range.
     *
     * @param sourceMap The source the range refers to.
     * @param start The first offending byte.
     * @param end One past the last offending byte.
     * @return The context lines in order.
     */
    public List<ContextLine> context(SourceMap sourceMap, int start, int end) {
        int startLine = sourceMap.startOf(start, end).line();
        int endLine = sourceMap.endOf(start, end).line();
        int first = Math.max(1, startLine - linesBefore);
        int last = Math.min(sourceMap.lineCount(), endLine + linesAfter);

        List<ContextLine> lines = new ArrayList<>();
        for (int line = first; line <= last; line++) {
            Highlight highlight = null;
            if (line >= startLine && line <= endLine) {
                int lineStart = sourceMap.lineStart(line);
                int from = Math.max(start, lineStart);
                int to = Math.min(end, sourceMap.lineEnd(line));
                if (to > from) {
                    highlight = new Highlight(from - lineStart, to - lineStart);
                }
            }
            lines.add(new ContextLine(line, sourceMap.lineText(line), highlight));
        }
        return lines;
    }

    /**
     * Renders one diagnostic against the source it was reported for.
     *
     * @param diagnostic The diagnostic.
     * @param sourceMap The source the diagnostic's range refers to.
     * @return The rendered text, terminated by a newline.
     */
    public String render(Diagnostic diagnostic, SourceMap sourceMap) {
        AttributedStringBuilder sb = new AttributedStringBuilder();
        sb.styled(ERROR_STYLE, "Error")
                .append(String.format(" at %s:%d:%d: %s%n",
                        diagnostic.fileName(), diagnostic.lineNumber(), diagnostic.columnNumber(), diagnostic.message()));

        for (ContextLine line : context(sourceMap, diagnostic.start(), diagnostic.end())) {
            sb.styled(GUTTER_STYLE, String.format(GUTTER_FORMAT, line.line()));
            sb.append(line.text()).append(System.lineSeparator());
            if (line.hasHighlight()) {
                sb.append(" ".repeat(GUTTER_WIDTH + line.highlight().start()));
                sb.styled(CARET_STYLE, "^".repeat(line.highlight().length()));
                sb.append(System.lineSeparator());
            }
        }
        return color ? sb.toAnsi() : sb.toString();
    }

    /**
     * Renders every diagnostic collected by the engine.
     *
     * @param diagnostics The engine holding the diagnostics and their source.
     * @return The rendered diagnostics, one block each.
     */
    public String renderAll(DiagnosticsEngine diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            sb.append(render(diagnostic, diagnostics.getSourceMap()));
        }
        return sb.toString();
    }
}
