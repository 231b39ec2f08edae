package com.memlayout.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Problems found while rendering a layout: overlapping members, dangling
 * pointer references and similar. Rendering never fails on them; callers
 * decide whether and how to report.
 */
@Getter
public class ToolDiagnostics {

    private final List<String> warnings = new ArrayList<>();

    /**
     * Adds a {@link String#format}-style warning.
     */
    public void warn(String format, Object... args) {
        warnings.add(args.length == 0 ? format : String.format(format, args));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
