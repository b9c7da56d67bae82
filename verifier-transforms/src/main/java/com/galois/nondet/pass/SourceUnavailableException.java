package com.galois.nondet.pass;

/**
 * Thrown when source lines are needed to name symbolic objects but the
 * original source file is not configured or cannot be read.
 */
public class SourceUnavailableException extends InstrumentationException {
    private final String path;

    SourceUnavailableException(String path, String message) {
        super(message);
        this.path = path;
    }

    SourceUnavailableException(String path, Throwable cause) {
        super("Couldn't open file: " + path, cause);
        this.path = path;
    }

    /** The configured source path, or <code>null</code> if none was set. */
    public String getPath() {
        return path;
    }
}
