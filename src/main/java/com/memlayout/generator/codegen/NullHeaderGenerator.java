package com.memlayout.generator.codegen;

import com.memlayout.generator.codegen.model.core.context.ToolDiagnostics;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

/**
 * Generator used when output is disabled; always yields empty text.
 */
public class NullHeaderGenerator implements HeaderGenerator {

    @Override
    public GeneratorResult generateRoot(NodeTree tree, long rootId, TypeAliases aliases, ToolDiagnostics diagnostics) {
        return GeneratorResult.empty();
    }

    @Override
    public GeneratorResult generateAll(NodeTree tree, TypeAliases aliases, ToolDiagnostics diagnostics) {
        return GeneratorResult.empty();
    }
}
