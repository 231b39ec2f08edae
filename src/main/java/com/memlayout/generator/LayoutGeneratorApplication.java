package com.memlayout.generator;

import com.memlayout.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the layout header generator.
 * This CLI tool turns a reverse-engineered memory layout model into C++
 * struct definitions whose compiled layout matches the model.
 */
public class LayoutGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
