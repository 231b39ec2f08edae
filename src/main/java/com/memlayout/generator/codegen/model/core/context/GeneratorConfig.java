package com.memlayout.generator.codegen.model.core.context;

import com.memlayout.generator.model.TypeAliases;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for header generation.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * When false, generation is disabled and every render yields empty text.
     */
    @Builder.Default
    private boolean enabled = true;

    /**
     * Per-kind type name overrides.
     */
    @Builder.Default
    private TypeAliases typeAliases = TypeAliases.empty();

    /**
     * Whether exported files start with the generated-by banner.
     */
    @Builder.Default
    private boolean includeBanner = true;
}
