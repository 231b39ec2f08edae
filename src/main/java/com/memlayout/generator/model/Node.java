package com.memlayout.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One typed memory region of the layout model.
 *
 * Nodes reference their parent and pointer targets by id only; the owning
 * {@link NodeTree} resolves ids. Offsets are relative to the immediate parent.
 */
@Value
@Builder(toBuilder = true)
public class Node {

    public static final int DEFAULT_STRING_LENGTH = 64;

    long id;

    @NonNull
    @Builder.Default
    NodeKind kind = NodeKind.HEX8;

    @Builder.Default
    String name = "";

    /**
     * 0 marks a top-level node.
     */
    long parentId;

    int offset;

    /**
     * Element kind of an {@link NodeKind#ARRAY} node.
     */
    @Builder.Default
    NodeKind elementKind = NodeKind.UINT8;

    /**
     * Element count for arrays, byte count for {@link NodeKind#PADDING}.
     */
    int arrayLen;

    /**
     * Declared character count of {@link NodeKind#UTF8}/{@link NodeKind#UTF16} text.
     */
    @Builder.Default
    int strLen = DEFAULT_STRING_LENGTH;

    /**
     * Pointer kinds: id of the struct node the pointer targets, 0 for none.
     */
    long refId;

    /**
     * Struct/array nodes: explicit type name, may be empty.
     */
    @Builder.Default
    String structTypeName = "";

    /**
     * Struct nodes: "struct", "class" or "enum"; empty means "struct".
     */
    @Builder.Default
    String classKeyword = "";

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    /**
     * Keyword used to declare this node's type. "enum" is cosmetic in the
     * model and declares a struct.
     */
    public String resolvedClassKeyword() {
        if ("class".equals(classKeyword)) {
            return "class";
        }
        return "struct";
    }
}
