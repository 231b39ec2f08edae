package com.memlayout.generator.codegen.layout;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.codegen.model.core.context.GenerationContext;
import com.memlayout.generator.codegen.output.OutputBuffer;
import com.memlayout.generator.codegen.util.NamingUtil;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;

/**
 * Emits struct definitions in dependency order.
 *
 * Nested struct types (direct children and array elements) are defined before
 * the struct that contains them by value; pointer targets that are not yet
 * defined get a forward declaration. Definitions are deduplicated by type
 * name, and a visiting set keyed by node id breaks reference cycles.
 */
public class StructEmitter {
    private static final Logger log = LoggerFactory.getLogger(StructEmitter.class);

    private final PaddingReconciler reconciler;

    public StructEmitter(PaddingReconciler reconciler) {
        this.reconciler = reconciler;
    }

    public StructEmitter() {
        this(new PaddingReconciler(new FieldEmitter()));
    }

    /**
     * Emits the type of the struct or array node {@code id} and everything it
     * depends on. Calling it again for an emitted id is a no-op.
     */
    public void emit(GenerationContext ctx, long id) {
        if (ctx.getEmittedIds().contains(id)) {
            return;
        }
        if (!ctx.getVisiting().add(id)) {
            log.debug("Cycle guard hit for node {}", id);
            return;
        }
        try {
            emitVisiting(ctx, id);
        } finally {
            ctx.getVisiting().remove(id);
        }
    }

    private void emitVisiting(GenerationContext ctx, long id) {
        Optional<Node> found = ctx.getTree().findById(id);
        if (found.isEmpty()) {
            return;
        }
        Node node = found.get();

        if (node.getKind() == NodeKind.ARRAY) {
            // arrays are inlined into their parent; only their element types are emitted
            emitStructChildren(ctx, id);
            return;
        }
        if (node.getKind() != NodeKind.STRUCT) {
            return;
        }

        String typeName = ctx.structName(node);
        if (ctx.getEmittedTypeNames().contains(typeName)) {
            skipDuplicate(ctx, node, typeName);
            return;
        }

        emitDependencies(ctx, node);

        // a nested struct may have claimed the same type name meanwhile
        if (ctx.getEmittedTypeNames().contains(typeName)) {
            skipDuplicate(ctx, node, typeName);
            return;
        }

        ctx.getEmittedIds().add(id);
        ctx.getEmittedTypeNames().add(typeName);
        long span = ctx.structSpan(id);
        log.debug("Emitting struct {} (id={}, size={})", typeName, id, NamingUtil.hex(span));

        OutputBuffer out = ctx.getOutput();
        out.line(node.resolvedClassKeyword() + " " + typeName + " {");
        reconciler.emitBody(ctx, id);
        out.line("};");
        out.line(String.format("static_assert(sizeof(%s) == %s, \"Size mismatch for %s\");",
                typeName, NamingUtil.hex(span), typeName));
        out.blank();
    }

    private void emitDependencies(GenerationContext ctx, Node node) {
        for (int ci : ctx.getChildIndex().childrenOf(node.getId())) {
            Node child = ctx.getTree().get(ci);
            switch (child.getKind()) {
                case STRUCT -> emit(ctx, child.getId());
                case ARRAY -> emitStructChildren(ctx, child.getId());
                case POINTER64 -> forwardDeclare(ctx, child);
                default -> {
                    // scalars need no prior declaration
                }
            }
        }
    }

    private void emitStructChildren(GenerationContext ctx, long arrayId) {
        for (int ci : ctx.getChildIndex().childrenOf(arrayId)) {
            Node element = ctx.getTree().get(ci);
            if (element.getKind() == NodeKind.STRUCT) {
                emit(ctx, element.getId());
            }
        }
    }

    private void forwardDeclare(GenerationContext ctx, Node pointer) {
        long refId = pointer.getRefId();
        if (refId == 0 || ctx.getEmittedIds().contains(refId) || ctx.getForwardDeclared().contains(refId)) {
            return;
        }
        Optional<Node> target = ctx.getTree().findById(refId).filter(t -> t.getKind() == NodeKind.STRUCT);
        if (target.isEmpty()) {
            return;
        }
        String targetName = ctx.structName(target.get());
        if (ctx.getEmittedTypeNames().contains(targetName)) {
            return;
        }
        log.debug("Forward declaring {} for pointer '{}'", targetName, pointer.getName());
        ctx.getOutput().line(target.get().resolvedClassKeyword() + " " + targetName + ";");
        ctx.getForwardDeclared().add(refId);
    }

    private static void skipDuplicate(GenerationContext ctx, Node node, String typeName) {
        log.debug("Type {} already emitted; skipping node {}", typeName, node.getId());
        ctx.getEmittedIds().add(node.getId());
        ctx.recordDedupSkip();
    }
}
