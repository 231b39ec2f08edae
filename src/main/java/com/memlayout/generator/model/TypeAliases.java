package com.memlayout.generator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Caller-supplied overrides of the emitted type name per primitive kind.
 * Blank overrides are ignored.
 */
@EqualsAndHashCode
@ToString
public final class TypeAliases {

    private static final TypeAliases EMPTY = new TypeAliases(new EnumMap<>(NodeKind.class));

    private final Map<NodeKind, String> aliases;

    private TypeAliases(EnumMap<NodeKind, String> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static TypeAliases empty() {
        return EMPTY;
    }

    public static TypeAliases of(Map<NodeKind, String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return EMPTY;
        }
        EnumMap<NodeKind, String> copy = new EnumMap<>(NodeKind.class);
        aliases.forEach((kind, alias) -> {
            if (kind != null && alias != null && !alias.isBlank()) {
                copy.put(kind, alias.trim());
            }
        });
        return new TypeAliases(copy);
    }

    public Optional<String> lookup(NodeKind kind) {
        return Optional.ofNullable(aliases.get(kind));
    }

    /**
     * Returns a table with {@code overrides} layered over this one.
     */
    public TypeAliases withOverrides(TypeAliases overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        EnumMap<NodeKind, String> merged = new EnumMap<>(NodeKind.class);
        merged.putAll(aliases);
        merged.putAll(overrides.aliases);
        return new TypeAliases(merged);
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }

    public Map<NodeKind, String> asMap() {
        return aliases;
    }
}
