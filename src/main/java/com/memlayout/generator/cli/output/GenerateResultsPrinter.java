package com.memlayout.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.cli.model.GenerateOptions;
import com.memlayout.generator.cli.model.ValidatedGenerateOptions;
import com.memlayout.generator.codegen.GeneratorResult;
import com.memlayout.generator.codegen.model.core.context.GenerationStats;
import com.memlayout.generator.codegen.model.core.context.ToolDiagnostics;
import com.memlayout.generator.model.TypeAliases;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v, TypeAliases effectiveAliases) {
        log.info("=================================================");
        log.info("Layout Header Generator");
        log.info("=================================================");
        log.info("Project File: {}", v.getProjectFile().toAbsolutePath());
        if (v.getRootId() != null) {
            log.info("Root: id {}", v.getRootId());
        } else if (v.getRootName() != null) {
            log.info("Root: {}", v.getRootName());
        } else {
            log.info("Root: all top-level structs");
        }
        log.info("Type Aliases: {}", effectiveAliases.isEmpty() ? "None" : effectiveAliases.asMap());
        log.info("Output: {}", v.getOutput() != null ? v.getOutput() : "standard output");
        if (o.isDisabled()) {
            log.info("Generation disabled: output will be empty");
        }
        log.info("=================================================");
    }

    public void printDiagnostics(ToolDiagnostics diagnostics) {
        diagnostics.getWarnings().forEach(w -> log.warn("{}", w));
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        GenerationStats stats = result.getStats();
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Structs Emitted: {}", stats.getStructCount());
        log.info("Forward Declarations: {}", stats.getForwardDeclarationCount());
        log.info("Padding Fields: {}", stats.getPaddingCount());
        log.info("Overlaps Reported: {}", stats.getOverlapCount());
        log.info("Duplicate Types Skipped: {}", stats.getDedupSkipCount());
        if (v.getOutput() != null) {
            log.info("Output Path: {}", v.getOutput());
        }
        log.info("=================================================");
    }
}
