package com.galois.nondet.pass;

/**
 * InstrumentationException is thrown when a pass cannot complete its
 * rewrite of a module.  The run is aborted; no retry is meaningful.
 */
public class InstrumentationException extends RuntimeException {
    public InstrumentationException(String message) {
        super(message);
    }

    public InstrumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
