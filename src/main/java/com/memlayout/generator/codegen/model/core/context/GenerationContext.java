package com.memlayout.generator.codegen.model.core.context;

import java.util.HashSet;
import java.util.Set;

import com.memlayout.generator.codegen.mapper.CTypeMapper;
import com.memlayout.generator.codegen.output.OutputBuffer;
import com.memlayout.generator.codegen.util.NamingUtil;
import com.memlayout.generator.model.ChildIndex;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

import lombok.Getter;
import lombok.NonNull;

/**
 * State of a single render. Created fresh for every render call and
 * discarded once the text is returned; nothing is shared between renders.
 */
@Getter
public final class GenerationContext {

    @NonNull
    private final NodeTree tree;

    @NonNull
    private final ChildIndex childIndex;

    @NonNull
    private final CTypeMapper typeMapper;

    @NonNull
    private final ToolDiagnostics diagnostics;

    private final OutputBuffer output = new OutputBuffer();

    /** Struct type names already defined. */
    private final Set<String> emittedTypeNames = new HashSet<>();

    /** Struct node ids already handled. */
    private final Set<Long> emittedIds = new HashSet<>();

    /** Struct node ids on the current emission path. */
    private final Set<Long> visiting = new HashSet<>();

    /** Struct node ids that received a forward declaration. */
    private final Set<Long> forwardDeclared = new HashSet<>();

    private int paddingCounter;
    private int overlapCount;
    private int dedupSkipCount;

    public GenerationContext(@NonNull NodeTree tree, @NonNull TypeAliases aliases,
                             @NonNull ToolDiagnostics diagnostics) {
        this.tree = tree;
        this.childIndex = ChildIndex.build(tree);
        this.typeMapper = new CTypeMapper(aliases);
        this.diagnostics = diagnostics;
    }

    /**
     * Next unique padding field name for this render.
     */
    public String nextPaddingName() {
        return NamingUtil.paddingName(paddingCounter++);
    }

    /**
     * Canonical type name of a struct or array node: explicit type name, else
     * node name, else an id-derived anonymous name.
     */
    public String structName(Node node) {
        if (node.getStructTypeName() != null && !node.getStructTypeName().isEmpty()) {
            return NamingUtil.sanitizeIdentifier(node.getStructTypeName());
        }
        if (node.hasName()) {
            return NamingUtil.sanitizeIdentifier(node.getName());
        }
        return NamingUtil.anonymousTypeName(node.getId());
    }

    public long structSpan(long id) {
        return tree.structSpan(id, childIndex);
    }

    public long byteSize(Node node) {
        return tree.byteSize(node, childIndex);
    }

    /**
     * Bytes the emitted declaration of {@code node} occupies. Equal to
     * {@link #byteSize} except for arrays, which declare only
     * {@code arrayLen} elements.
     */
    public long declaredSize(Node node) {
        return node.getKind() == NodeKind.ARRAY
                ? tree.declaredArraySize(node, childIndex)
                : byteSize(node);
    }

    public void recordOverlap(String message) {
        overlapCount++;
        diagnostics.warn(message);
    }

    public void recordDedupSkip() {
        dedupSkipCount++;
    }

    public GenerationStats snapshotStats() {
        return GenerationStats.builder()
                .structCount(emittedTypeNames.size())
                .forwardDeclarationCount(forwardDeclared.size())
                .paddingCount(paddingCounter)
                .overlapCount(overlapCount)
                .dedupSkipCount(dedupSkipCount)
                .build();
    }
}
