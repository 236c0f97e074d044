package com.raditha.rlint.cli;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.syntax.LineIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prints every diagnostic with the source lines it covers underlined, followed
 * by the same summary as {@link ConciseReporter}.
 * <pre>
 * warning: seq [*]
 *  --&gt; R/a.R:3:6
 *   |
 * 3 | x &lt;- 1:length(y)
 *   |      ^^^^^^^^^^^ `1:length(...)` is likely to be wrong in the empty edge case.
 *   |
 *   = help: Use `seq_along(...)` instead.
 * </pre>
 * Sources are read again from disk. A file that can no longer be read falls
 * back to the concise line for its diagnostics.
 */
public class FullReporter extends ConciseReporter {

    private static final Logger logger = LoggerFactory.getLogger(FullReporter.class);

    static final int MAX_SNIPPET_LINES = 5;

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final Map<Path, Optional<String>> sources = new HashMap<>();

    public FullReporter(boolean showDiagnostics, boolean statistics, boolean unsafeFixesAllowed) {
        super(showDiagnostics, statistics, unsafeFixesAllowed);
    }

    @Override
    protected void printDiagnostic(Diagnostic diagnostic, PrintStream out) {
        Optional<String> source = diagnostic.file() == null ? Optional.empty() : source(diagnostic.file());
        if (source.isEmpty()) {
            super.printDiagnostic(diagnostic, out);
            return;
        }
        out.print(render(diagnostic, source.get()));
        out.println();
    }

    @Override
    protected void beforeSummary(PrintStream out) {
        // each snippet already ends with a blank line
    }

    private Optional<String> source(Path file) {
        return sources.computeIfAbsent(file, path -> {
            try {
                String text = Files.readString(path, StandardCharsets.UTF_8);
                return Optional.of(text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text);
            } catch (IOException e) {
                logger.warn("Could not read source file {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * Render one diagnostic against the text it was computed on.
     */
    static String render(Diagnostic diagnostic, String source) {
        LineIndex index = new LineIndex(source);
        int start = Math.min(diagnostic.range().start(), source.length());
        int end = Math.max(start, Math.min(diagnostic.range().end(), source.length()));
        int firstLine = index.lineOf(start);
        int lastLine = end > start ? index.lineOf(end - 1) : firstLine;
        int shownLast = Math.min(lastLine, firstLine + MAX_SNIPPET_LINES - 1);
        int width = String.valueOf(shownLast).length();
        String gutter = " ".repeat(width) + " |";
        LineIndex.Position position = index.position(start);

        StringBuilder text = new StringBuilder();
        text.append("warning: ").append(diagnostic.rule().id());
        if (diagnostic.isFixable()) {
            text.append(" [*]");
        }
        text.append('\n');
        text.append(" ".repeat(width)).append("--> ").append(diagnostic.file())
                .append(':').append(position.line()).append(':').append(position.column()).append('\n');
        text.append(gutter).append('\n');

        for (int line = firstLine; line <= shownLast; line++) {
            int lineStart = lineStart(source, line);
            String content = lineText(source, lineStart);
            text.append(String.format("%" + width + "d | ", line)).append(content).append('\n');

            int from = Math.max(start, lineStart) - lineStart;
            int to = Math.min(end, lineStart + content.length()) - lineStart;
            text.append(gutter).append(' ').append(" ".repeat(from)).append("^".repeat(Math.max(1, to - from)));
            if (line == shownLast) {
                text.append(' ').append(diagnostic.message());
            }
            text.append('\n');
        }
        if (shownLast < lastLine) {
            text.append(" ".repeat(width)).append(" ...\n");
        }
        if (diagnostic.suggestion() != null) {
            text.append(gutter).append('\n');
            text.append(" ".repeat(width)).append(" = help: ").append(diagnostic.suggestion()).append('\n');
        }
        return text.toString();
    }

    private static int lineStart(String source, int line) {
        int offset = -1;
        for (int seen = 1; seen < line; seen++) {
            offset = source.indexOf('\n', offset + 1);
        }
        return offset + 1;
    }

    private static String lineText(String source, int lineStart) {
        int newline = source.indexOf('\n', lineStart);
        String content = newline < 0 ? source.substring(lineStart) : source.substring(lineStart, newline);
        return content.endsWith("\r") ? content.substring(0, content.length() - 1) : content;
    }
}
