package com.galois.nondet.pass;

import java.io.PrintStream;

/**
 * Settings for {@link ReplaceVerifierFuns}.
 */
public class PassOptions {
    /** Command line option naming the original source file. */
    public static final String SOURCE_OPTION = "replace-verifier-funs-source";

    /** Registration function emitted when no other is configured. */
    public static final String DEFAULT_ENTRY_POINT = "klee_make_nondet";

    private String sourcePath;
    private String entryPointName = DEFAULT_ENTRY_POINT;
    private PrintStream statusStream;

    public PassOptions() {
    }

    /**
     * Set the original source file used to recover variable names.  It is
     * only read if some call site has a debug location.
     */
    public void setSourcePath( String path ) {
        this.sourcePath = path;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    /**
     * Set the name of the function that registers a symbolic object.  It
     * is declared as <code>void (i8*, size_t, i8*, i32)</code> when the
     * module does not already contain it.
     */
    public void setEntryPointName( String name ) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Entry point name must not be empty.");
        }
        this.entryPointName = name;
    }

    public String getEntryPointName() {
        return entryPointName;
    }

    /**
     * Set the stream to write status messages to.  Null indicates no logging.
     * @param s The stream.
     */
    public void setStatusStream( PrintStream s ) {
        this.statusStream = s;
    }

    public PrintStream getStatusStream() {
        return statusStream;
    }
}
