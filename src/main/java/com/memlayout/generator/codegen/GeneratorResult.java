package com.memlayout.generator.codegen;

import com.memlayout.generator.codegen.model.core.context.GenerationStats;

import lombok.Builder;
import lombok.Value;

/**
 * Text produced by one render plus its statistics.
 */
@Value
@Builder
public class GeneratorResult {

    @Builder.Default
    String text = "";

    @Builder.Default
    GenerationStats stats = GenerationStats.empty();

    public static GeneratorResult empty() {
        return GeneratorResult.builder().build();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
