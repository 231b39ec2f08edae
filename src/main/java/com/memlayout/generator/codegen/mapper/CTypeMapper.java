package com.memlayout.generator.codegen.mapper;

import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.TypeAliases;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Maps a primitive {@link NodeKind} to the type name emitted in the header,
 * consulting the alias table before the built-in names.
 */
@RequiredArgsConstructor
public class CTypeMapper {

    @NonNull
    private final TypeAliases aliases;

    public static CTypeMapper withDefaults() {
        return new CTypeMapper(TypeAliases.empty());
    }

    /**
     * Type name for {@code kind}: the non-empty alias if one is configured,
     * the built-in name otherwise.
     */
    public String resolve(NodeKind kind) {
        return aliases.lookup(kind).orElseGet(() -> defaultTypeName(kind));
    }

    /**
     * Built-in type name. Vectors and matrices report their element type;
     * containers have no scalar type and report the byte type.
     */
    public static String defaultTypeName(NodeKind kind) {
        return switch (kind) {
            case HEX8, UINT8, PADDING -> "uint8_t";
            case HEX16, UINT16 -> "uint16_t";
            case HEX32, UINT32, POINTER32 -> "uint32_t";
            case HEX64, UINT64, POINTER64 -> "uint64_t";
            case INT8 -> "int8_t";
            case INT16 -> "int16_t";
            case INT32 -> "int32_t";
            case INT64 -> "int64_t";
            case FLOAT, VEC2, VEC3, VEC4, MAT4X4 -> "float";
            case DOUBLE -> "double";
            case BOOL -> "bool";
            case UTF8 -> "char";
            case UTF16 -> "wchar_t";
            case STRUCT, ARRAY -> "uint8_t";
        };
    }
}
