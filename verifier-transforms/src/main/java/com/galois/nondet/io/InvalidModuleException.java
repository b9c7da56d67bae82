package com.galois.nondet.io;

import java.io.IOException;

/**
 * Thrown when a serialized module cannot be turned back into IR.
 */
public class InvalidModuleException extends IOException {
    private static final long serialVersionUID = 1L;

    public InvalidModuleException(String message) {
        super(message);
    }

    public InvalidModuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
