package com.memlayout.generator.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.codegen.layout.StructEmitter;
import com.memlayout.generator.codegen.model.core.context.GenerationContext;
import com.memlayout.generator.codegen.model.core.context.ToolDiagnostics;
import com.memlayout.generator.codegen.output.CommentAligner;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

/**
 * Emits C++ struct definitions whose compiled layout matches the model,
 * each followed by a {@code static_assert} on its size.
 */
public class CppHeaderGenerator implements HeaderGenerator {
    private static final Logger log = LoggerFactory.getLogger(CppHeaderGenerator.class);

    static final String HEADER_GUARD = "#pragma once";

    private final StructEmitter structEmitter;

    public CppHeaderGenerator() {
        this(new StructEmitter());
    }

    public CppHeaderGenerator(StructEmitter structEmitter) {
        this.structEmitter = structEmitter;
    }

    @Override
    public GeneratorResult generateRoot(NodeTree tree, long rootId, TypeAliases aliases, ToolDiagnostics diagnostics) {
        Node root = tree.findById(rootId).orElse(null);
        if (root == null || root.getKind() != NodeKind.STRUCT) {
            log.debug("Root {} is absent or not a struct; nothing to render", rootId);
            return GeneratorResult.empty();
        }

        GenerationContext ctx = new GenerationContext(tree, aliases, diagnostics);
        writeHeaderGuard(ctx);
        structEmitter.emit(ctx, rootId);
        return finish(ctx);
    }

    @Override
    public GeneratorResult generateAll(NodeTree tree, TypeAliases aliases, ToolDiagnostics diagnostics) {
        GenerationContext ctx = new GenerationContext(tree, aliases, diagnostics);
        writeHeaderGuard(ctx);

        List<Node> roots = new ArrayList<>();
        for (int ri : ctx.getChildIndex().childrenOf(0)) {
            roots.add(tree.get(ri));
        }
        roots.sort(Comparator.comparingInt(Node::getOffset));

        for (Node root : roots) {
            if (root.getKind() == NodeKind.STRUCT) {
                structEmitter.emit(ctx, root.getId());
            }
        }
        return finish(ctx);
    }

    private static void writeHeaderGuard(GenerationContext ctx) {
        ctx.getOutput().line(HEADER_GUARD);
        ctx.getOutput().blank();
    }

    private static GeneratorResult finish(GenerationContext ctx) {
        String text = CommentAligner.align(ctx.getOutput().getLines());
        return GeneratorResult.builder()
                .text(text)
                .stats(ctx.snapshotStats())
                .build();
    }
}
