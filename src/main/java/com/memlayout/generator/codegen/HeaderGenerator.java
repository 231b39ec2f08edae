package com.memlayout.generator.codegen;

import com.memlayout.generator.codegen.model.core.context.ToolDiagnostics;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

/**
 * Turns a layout tree into header source text.
 *
 * Implementations are pure: the same tree, root and alias table always yield
 * the same text, and the inputs are never modified.
 */
public interface HeaderGenerator {

    /**
     * Renders the struct {@code rootId} and the types it depends on. Yields
     * empty text when the id is unknown or does not name a struct.
     */
    GeneratorResult generateRoot(NodeTree tree, long rootId, TypeAliases aliases, ToolDiagnostics diagnostics);

    /**
     * Renders every top-level struct, in offset order.
     */
    GeneratorResult generateAll(NodeTree tree, TypeAliases aliases, ToolDiagnostics diagnostics);

    default String renderRoot(NodeTree tree, long rootId, TypeAliases aliases) {
        return generateRoot(tree, rootId, aliases, new ToolDiagnostics()).getText();
    }

    default String renderRoot(NodeTree tree, long rootId) {
        return renderRoot(tree, rootId, TypeAliases.empty());
    }

    default String renderAll(NodeTree tree, TypeAliases aliases) {
        return generateAll(tree, aliases, new ToolDiagnostics()).getText();
    }

    default String renderAll(NodeTree tree) {
        return renderAll(tree, TypeAliases.empty());
    }
}
