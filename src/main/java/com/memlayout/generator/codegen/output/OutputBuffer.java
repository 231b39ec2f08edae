package com.memlayout.generator.codegen.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates emitted lines for one render.
 */
public class OutputBuffer {

    private final List<EmittedLine> lines = new ArrayList<>();

    public void add(EmittedLine line) {
        lines.add(line);
    }

    public void line(String code) {
        lines.add(EmittedLine.of(code));
    }

    public void annotated(String code, String annotation) {
        lines.add(EmittedLine.annotated(code, annotation));
    }

    public void blank() {
        lines.add(EmittedLine.blank());
    }

    public List<EmittedLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
