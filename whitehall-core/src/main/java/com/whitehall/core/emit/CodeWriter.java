package com.whitehall.core.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented text builder with an indentation level.
 *
 * <p>Multi-line text passed to {@link #line(String)} has each of its lines shifted to the current
 * indentation, so nested printer output keeps its relative layout.
 */
public final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private int level;

    public CodeWriter line(String text) {
        for (String line : text.split("\n", -1)) {
            if (line.isBlank()) {
                out.append("\n");
            } else {
                out.append(ExpressionPrinter.INDENT.repeat(level)).append(line).append("\n");
            }
        }
        return this;
    }

    public CodeWriter blank() {
        out.append("\n");
        return this;
    }

    public CodeWriter indent() {
        level++;
        return this;
    }

    public CodeWriter outdent() {
        if (level == 0) {
            throw new IllegalStateException("Indentation level is already zero");
        }
        level--;
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    /**
     * Removes the common indentation of verbatim code and trims blank leading and trailing lines.
     *
     * <p>Text that starts on the line of its opening brace ({@code { doWork() }}) has no leading
     * indentation on its first line; that line is excluded from the common indentation.
     *
     * @param code verbatim code
     * @return dedented code, or an empty string for blank input
     */
    public static String dedent(String code) {
        List<String> lines = new ArrayList<>(List.of(code.split("\n", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.isEmpty()) {
            return "";
        }
        int firstBreak = code.indexOf('\n');
        boolean firstInline = firstBreak < 0 || !code.substring(0, firstBreak).isBlank();
        int common = Integer.MAX_VALUE;
        for (int i = firstInline ? 1 : 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isBlank()) {
                common = Math.min(common, leadingWhitespace(line));
            }
        }
        if (common == Integer.MAX_VALUE) {
            common = 0;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i > 0) {
                sb.append("\n");
            }
            if (line.isBlank()) {
                continue;
            }
            if (i == 0 && firstInline) {
                sb.append(line.strip());
            } else {
                sb.append(line.substring(Math.min(common, leadingWhitespace(line))).stripTrailing());
            }
        }
        return sb.toString();
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
