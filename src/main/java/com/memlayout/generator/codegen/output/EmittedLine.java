package com.memlayout.generator.codegen.output;

/**
 * One line of generated source, optionally carrying a trailing annotation
 * (the offset comment) that the {@link CommentAligner} places in a shared column.
 *
 * @param code       the source text, including indentation
 * @param annotation comment text without the {@code //} prefix, or null
 */
public record EmittedLine(String code, String annotation) {

    public static EmittedLine of(String code) {
        return new EmittedLine(code, null);
    }

    public static EmittedLine annotated(String code, String annotation) {
        return new EmittedLine(code, annotation);
    }

    public static EmittedLine blank() {
        return new EmittedLine("", null);
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }
}
