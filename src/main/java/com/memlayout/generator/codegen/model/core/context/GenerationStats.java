package com.memlayout.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a render.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int structCount;
    int forwardDeclarationCount;
    int paddingCount;
    int overlapCount;
    int dedupSkipCount;

    public static GenerationStats empty() {
        return GenerationStats.builder().build();
    }
}
