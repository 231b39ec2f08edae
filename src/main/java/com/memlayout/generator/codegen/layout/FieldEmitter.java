package com.memlayout.generator.codegen.layout;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.codegen.mapper.CTypeMapper;
import com.memlayout.generator.codegen.model.core.context.GenerationContext;
import com.memlayout.generator.codegen.output.EmittedLine;
import com.memlayout.generator.codegen.util.NamingUtil;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;

/**
 * Renders the declaration line of one child inside a struct body.
 */
public class FieldEmitter {
    private static final Logger log = LoggerFactory.getLogger(FieldEmitter.class);

    private static final String INDENT = "    ";

    /**
     * Declaration of {@code node} annotated with its offset.
     */
    public EmittedLine emit(GenerationContext ctx, Node node) {
        CTypeMapper types = ctx.getTypeMapper();
        String name = fieldName(node);
        String offset = NamingUtil.hex(node.getOffset());

        return switch (node.getKind()) {
            case VEC2 -> declare(types.resolve(NodeKind.FLOAT), name + "[2]", offset);
            case VEC3 -> declare(types.resolve(NodeKind.FLOAT), name + "[3]", offset);
            case VEC4 -> declare(types.resolve(NodeKind.FLOAT), name + "[4]", offset);
            case MAT4X4 -> declare(types.resolve(NodeKind.FLOAT), name + "[4][4]", offset);
            case UTF8, UTF16 -> declare(types.resolve(node.getKind()), name + "[" + Math.max(0, node.getStrLen()) + "]", offset);
            case PADDING -> declare(types.resolve(NodeKind.PADDING), name + "[" + Math.max(1, node.getArrayLen()) + "]", offset);
            case POINTER32 -> {
                Optional<String> target = pointerTarget(ctx, node);
                String annotation = target.map(t -> offset + " -> " + t + "*").orElse(offset);
                yield declare(types.resolve(NodeKind.POINTER32), name, annotation);
            }
            case POINTER64 -> pointerTarget(ctx, node)
                    .map(t -> declare(t + "*", name, offset))
                    .orElseGet(() -> declare("void*", name, offset));
            case STRUCT -> declare(ctx.structName(node), name, offset);
            case ARRAY -> emitArray(ctx, node, offset);
            case HEX8, HEX16, HEX32, HEX64,
                 INT8, INT16, INT32, INT64,
                 UINT8, UINT16, UINT32, UINT64,
                 FLOAT, DOUBLE, BOOL -> declare(types.resolve(node.getKind()), name, offset);
        };
    }

    private EmittedLine emitArray(GenerationContext ctx, Node array, String offset) {
        String name = fieldName(array);
        String count = "[" + Math.max(0, array.getArrayLen()) + "]";

        Optional<Node> element = structElement(ctx, array);
        if (element.isPresent()) {
            return declare(ctx.structName(element.get()), name + count, offset);
        }

        CTypeMapper types = ctx.getTypeMapper();
        NodeKind elementKind = array.getElementKind();
        return switch (elementKind) {
            case VEC2 -> declare(types.resolve(NodeKind.FLOAT), name + count + "[2]", offset);
            case VEC3 -> declare(types.resolve(NodeKind.FLOAT), name + count + "[3]", offset);
            case VEC4 -> declare(types.resolve(NodeKind.FLOAT), name + count + "[4]", offset);
            case MAT4X4 -> declare(types.resolve(NodeKind.FLOAT), name + count + "[4][4]", offset);
            case POINTER64 -> declare("void*", name + count, offset);
            case STRUCT, ARRAY -> {
                log.debug("Array {} has no struct element; emitting it as a comment", name);
                yield EmittedLine.annotated(INDENT + "// array " + name + count + " has no element type", offset);
            }
            case HEX8, HEX16, HEX32, HEX64,
                 INT8, INT16, INT32, INT64,
                 UINT8, UINT16, UINT32, UINT64,
                 FLOAT, DOUBLE, BOOL, POINTER32,
                 UTF8, UTF16, PADDING -> declare(types.resolve(elementKind), name + count, offset);
        };
    }

    /**
     * First struct-kind child of an array node, which describes its element type.
     */
    static Optional<Node> structElement(GenerationContext ctx, Node array) {
        for (int ci : ctx.getChildIndex().childrenOf(array.getId())) {
            Node child = ctx.getTree().get(ci);
            if (child.getKind() == NodeKind.STRUCT) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Type name of the struct a pointer references, empty for no or dangling references.
     */
    static Optional<String> pointerTarget(GenerationContext ctx, Node pointer) {
        if (pointer.getRefId() == 0) {
            return Optional.empty();
        }
        Optional<Node> target = ctx.getTree().findById(pointer.getRefId())
                .filter(t -> t.getKind() == NodeKind.STRUCT);
        if (target.isEmpty()) {
            ctx.getDiagnostics().warn("Pointer '%s' references unknown struct id %d; emitted as opaque",
                    pointer.getName(), pointer.getRefId());
        }
        return target.map(ctx::structName);
    }

    private static String fieldName(Node node) {
        return NamingUtil.sanitizeIdentifier(node.hasName()
                ? node.getName()
                : NamingUtil.offsetFieldName(node.getOffset()));
    }

    private static EmittedLine declare(String type, String declarator, String annotation) {
        return EmittedLine.annotated(INDENT + type + " " + declarator + ";", annotation);
    }
}
