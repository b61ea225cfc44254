package org.gamevibe.compiler.backend.codegen;

import java.util.regex.Pattern;

/**
 * Accumulates generated lines with two-space indentation and tracks the current line number
 * for source mapping.
 */
final class CodeWriter {

    private static final String INDENT = "  ";
    private static final Pattern LINE_TERMINATORS = Pattern.compile("[\\r\\n\\u2028\\u2029]");

    private final StringBuilder out = new StringBuilder();
    private int completedLines = 0;
    private int depth = 0;

    /**
     * Appends one line at the current indentation. An empty text produces an empty line.
     */
    CodeWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(depth)).append(text);
        }
        out.append('\n');
        completedLines++;
        return this;
    }

    /**
     * Appends a {@code //} comment. Line terminators in the text are replaced by spaces so the
     * comment cannot end early.
     */
    CodeWriter comment(String text) {
        return line("// " + LINE_TERMINATORS.matcher(text).replaceAll(" "));
    }

    CodeWriter blank() {
        return line("");
    }

    /**
     * Appends a line and indents the following lines.
     */
    CodeWriter open(String text) {
        line(text);
        depth++;
        return this;
    }

    /**
     * Dedents and appends a closing line.
     */
    CodeWriter close(String text) {
        if (depth > 0) depth--;
        return line(text);
    }

    /**
     * Appends a line one level out, such as {@code } else {}, and keeps the block indented.
     */
    CodeWriter middle(String text) {
        close(text);
        depth++;
        return this;
    }

    /**
     * @return The 1-based number of the line that the next call to {@link #line} writes.
     */
    int nextLine() {
        return completedLines + 1;
    }

    String text() {
        return out.toString();
    }
}
