package com.memlayout.generator.codegen.output;

import java.util.List;

/**
 * Formats emitted lines into final text, right-aligning every trailing
 * annotation to one column past the longest annotated code text in the buffer.
 */
public final class CommentAligner {

    private static final String COMMENT_PREFIX = "// ";

    private CommentAligner() {
        // Utility class
    }

    public static String align(List<EmittedLine> lines) {
        int column = 0;
        for (EmittedLine line : lines) {
            if (line.hasAnnotation()) {
                column = Math.max(column, line.code().length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (EmittedLine line : lines) {
            sb.append(line.code());
            if (line.hasAnnotation()) {
                sb.append(" ".repeat(column - line.code().length() + 1))
                        .append(COMMENT_PREFIX)
                        .append(line.annotation());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
