package com.memlayout.generator.codegen;

import com.memlayout.generator.codegen.model.core.context.GeneratorConfig;

import lombok.experimental.UtilityClass;

/**
 * Picks the generator implementation for a configuration.
 */
@UtilityClass
public class HeaderGenerators {

    public HeaderGenerator forConfig(GeneratorConfig config) {
        return config.isEnabled() ? new CppHeaderGenerator() : new NullHeaderGenerator();
    }
}
