package com.memlayout.generator.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Every problem found in the command-line options, reported together so a
 * single run shows all of them.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() == 1
                ? errors.get(0)
                : "Invalid options:" + System.lineSeparator() + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }
}
