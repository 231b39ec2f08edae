package com.memlayout.generator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of memory region kinds a node can describe.
 *
 * Each kind carries the name used in project files, its fixed byte size
 * (0 for containers, whose size is derived from their children) and a
 * category used by the generator.
 */
public enum NodeKind {

    HEX8("Hex8", 1, Category.HEX),
    HEX16("Hex16", 2, Category.HEX),
    HEX32("Hex32", 4, Category.HEX),
    HEX64("Hex64", 8, Category.HEX),

    INT8("Int8", 1, Category.SCALAR),
    INT16("Int16", 2, Category.SCALAR),
    INT32("Int32", 4, Category.SCALAR),
    INT64("Int64", 8, Category.SCALAR),
    UINT8("UInt8", 1, Category.SCALAR),
    UINT16("UInt16", 2, Category.SCALAR),
    UINT32("UInt32", 4, Category.SCALAR),
    UINT64("UInt64", 8, Category.SCALAR),

    FLOAT("Float", 4, Category.SCALAR),
    DOUBLE("Double", 8, Category.SCALAR),
    BOOL("Bool", 1, Category.SCALAR),

    /**
     * 32-bit pointer, emitted as an integer so narrower targets can be modeled
     * on a 64-bit host.
     */
    POINTER32("Pointer32", 4, Category.POINTER),

    /**
     * Native pointer, emitted as a typed pointer when it references a struct.
     */
    POINTER64("Pointer64", 8, Category.POINTER),

    VEC2("Vec2", 8, Category.VECTOR),
    VEC3("Vec3", 12, Category.VECTOR),
    VEC4("Vec4", 16, Category.VECTOR),
    MAT4X4("Mat4x4", 64, Category.VECTOR),

    /**
     * Fixed-length 8-bit text; size is the node's declared length.
     */
    UTF8("UTF8", 1, Category.STRING),

    /**
     * Fixed-length 16-bit text; size is twice the node's declared length.
     */
    UTF16("UTF16", 2, Category.STRING),

    /**
     * Explicit byte array; size is the node's element count (at least 1).
     */
    PADDING("Padding", 1, Category.PADDING),

    STRUCT("Struct", 0, Category.CONTAINER),
    ARRAY("Array", 0, Category.CONTAINER);

    /**
     * Coarse grouping of kinds.
     */
    public enum Category {
        HEX, SCALAR, POINTER, VECTOR, STRING, PADDING, CONTAINER
    }

    private final String displayName;
    private final int size;
    private final Category category;

    NodeKind(String displayName, int size, Category category) {
        this.displayName = displayName;
        this.size = size;
        this.category = category;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Fixed byte size of one value of this kind. Strings report their unit size.
     */
    public int getSize() {
        return size;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isHex() {
        return category == Category.HEX;
    }

    public boolean isContainer() {
        return category == Category.CONTAINER;
    }

    /**
     * Looks up a kind by its project-file name, case-insensitively.
     */
    public static Optional<NodeKind> fromDisplayName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(k -> k.displayName.equalsIgnoreCase(normalized) || k.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    /**
     * Lenient lookup used when loading project files: unknown names fall back to {@link #HEX8}.
     */
    public static NodeKind fromDisplayNameOrHex(String name) {
        return fromDisplayName(name).orElse(HEX8);
    }
}
