package com.raditha.rlint.workflow;

import java.nio.file.Path;

/**
 * A failure that stops one file from being linted: it could not be read,
 * parsed, checked or written.
 */
public class LintException extends Exception {

    private final transient Path file;

    public LintException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public LintException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
