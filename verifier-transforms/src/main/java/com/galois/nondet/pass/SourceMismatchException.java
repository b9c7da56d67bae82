package com.galois.nondet.pass;

/**
 * Thrown when the source file ends before a line that a debug location
 * refers to, so the file cannot be the one the module was compiled from.
 */
public class SourceMismatchException extends IllegalStateException {
    private final String path;

    SourceMismatchException(String path, String message) {
        super(message);
        this.path = path;
    }

    /** The source file that was read. */
    public String getPath() {
        return path;
    }
}
