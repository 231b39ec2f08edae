package com.memlayout.generator.parser;

/**
 * Raised when a project file is missing, unreadable or not valid JSON.
 */
public class ProjectFileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ProjectFileException(String message) {
        super(message);
    }

    public ProjectFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
