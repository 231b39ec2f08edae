package com.memlayout.generator.codegen.layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.codegen.model.core.context.GenerationContext;
import com.memlayout.generator.codegen.util.NamingUtil;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.NodeTree;

/**
 * Emits the body of one struct: its children in offset order, synthesized
 * padding for every gap, a warning comment for every overlap and a single
 * padding array for each run of untyped hex fields.
 *
 * The body always covers exactly {@code [0, structSpan)}: the cursor only
 * advances over declared bytes, and an overlapping child is reported instead
 * of emitted. An array advances it by its declared element count only, so
 * bytes its element child reaches beyond that are padded.
 */
public class PaddingReconciler {
    private static final Logger log = LoggerFactory.getLogger(PaddingReconciler.class);

    private final FieldEmitter fieldEmitter;

    public PaddingReconciler(FieldEmitter fieldEmitter) {
        this.fieldEmitter = fieldEmitter;
    }

    public void emitBody(GenerationContext ctx, long structId) {
        long structSize = ctx.structSpan(structId);
        List<Node> children = sortedChildren(ctx, structId);

        long cursor = 0;
        int i = 0;
        while (i < children.size()) {
            Node child = children.get(i);
            long offset = child.getOffset();

            if (offset < cursor) {
                emitOverlap(ctx, child, cursor);
                i++;
                continue;
            }
            if (offset > cursor) {
                emitPadding(ctx, cursor, offset - cursor);
            }

            if (child.getKind().isHex()) {
                long runEnd = NodeTree.saturatedAdd(offset, ctx.byteSize(child));
                int j = i + 1;
                while (j < children.size() && children.get(j).getKind().isHex()
                        && children.get(j).getOffset() >= runEnd) {
                    Node next = children.get(j);
                    runEnd = NodeTree.saturatedAdd(next.getOffset(), ctx.byteSize(next));
                    j++;
                }
                if (j - i >= 2) {
                    log.debug("Collapsing {} hex fields at {} into one padding array", j - i, NamingUtil.hex(offset));
                    emitPadding(ctx, offset, runEnd - offset);
                    cursor = runEnd;
                    i = j;
                    continue;
                }
            }

            ctx.getOutput().add(fieldEmitter.emit(ctx, child));
            cursor = NodeTree.saturatedAdd(offset, ctx.declaredSize(child));
            i++;
        }

        if (cursor < structSize) {
            emitPadding(ctx, cursor, structSize - cursor);
        }
    }

    private static List<Node> sortedChildren(GenerationContext ctx, long structId) {
        List<Node> children = new ArrayList<>();
        for (int ci : ctx.getChildIndex().childrenOf(structId)) {
            children.add(ctx.getTree().get(ci));
        }
        // stable: equal offsets keep insertion order
        children.sort(Comparator.comparingInt(Node::getOffset));
        return children;
    }

    private static void emitPadding(GenerationContext ctx, long offset, long size) {
        String type = ctx.getTypeMapper().resolve(NodeKind.PADDING);
        ctx.getOutput().annotated(
                "    " + type + " " + ctx.nextPaddingName() + "[" + NamingUtil.hex(size) + "];",
                NamingUtil.hex(offset));
    }

    private static void emitOverlap(GenerationContext ctx, Node child, long cursor) {
        String message = String.format("overlap at offset %s (previous field ends at %s)",
                NamingUtil.hex(child.getOffset()), NamingUtil.hex(cursor));
        ctx.getOutput().line("    // WARNING: " + message + ", '" + child.getName() + "' omitted");
        ctx.recordOverlap("Struct member '" + child.getName() + "': " + message);
    }
}
