package com.memlayout.generator.cli.model;

import java.nio.file.Path;

import com.memlayout.generator.model.TypeAliases;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path projectFile;
    /** Explicit root id, or null. */
    Long rootId;
    /** Root type/node name, or null. */
    String rootName;
    TypeAliases aliasOverrides;
    /** Output file, or null for standard output. */
    Path output;

    public boolean isRenderAll() {
        return rootId == null && rootName == null;
    }
}
