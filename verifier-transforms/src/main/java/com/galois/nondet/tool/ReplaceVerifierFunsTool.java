package com.galois.nondet.tool;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.nondet.io.ModuleReader;
import com.galois.nondet.io.ModuleWriter;
import com.galois.nondet.ir.Module;
import com.galois.nondet.pass.InstrumentationException;
import com.galois.nondet.pass.PassOptions;
import com.galois.nondet.pass.ReplaceVerifierFuns;
import com.galois.nondet.pass.SourceMismatchException;

/**
 * Command line driver: reads a serialized module, runs
 * {@link ReplaceVerifierFuns} over it and writes the result.
 */
public class ReplaceVerifierFunsTool {
    private static final String SOURCE_FLAG = "-" + PassOptions.SOURCE_OPTION + "=";
    private static final String ENTRY_FLAG = "-entry-point=";

    static final String USAGE =
        "usage: replace-verifier-funs <in.pb> <out.pb> ["
        + SOURCE_FLAG + "<file>] [" + ENTRY_FLAG + "<name>] [-v]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the tool.
     *
     * @param args command line arguments
     * @param out stream for the summary
     * @param err stream for errors and, with <code>-v</code>, status messages
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        PassOptions options = new PassOptions();
        List<String> files = new ArrayList<String>();
        for (String a : args) {
            if (a.startsWith(SOURCE_FLAG)) {
                options.setSourcePath(a.substring(SOURCE_FLAG.length()));
            } else if (a.startsWith(ENTRY_FLAG)) {
                String name = a.substring(ENTRY_FLAG.length());
                if (name.isEmpty()) {
                    err.println("The entry point name must not be empty.");
                    return 2;
                }
                options.setEntryPointName(name);
            } else if (a.equals("-v")) {
                options.setStatusStream(err);
            } else if (a.startsWith("-")) {
                err.println("Unknown option " + a);
                err.println(USAGE);
                return 2;
            } else {
                files.add(a);
            }
        }
        if (files.size() != 2) {
            err.println(USAGE);
            return 2;
        }

        Module m;
        try (InputStream s = new BufferedInputStream(new FileInputStream(files.get(0)))) {
            m = ModuleReader.readModule(s);
        } catch (IOException e) {
            err.println("Error reading " + files.get(0) + ":");
            err.println(e.getLocalizedMessage());
            return 1;
        }

        ReplaceVerifierFuns pass = new ReplaceVerifierFuns(options);
        boolean changed;
        try {
            changed = pass.runOnModule(m);
        } catch (InstrumentationException e) {
            err.println(e.getLocalizedMessage());
            return 1;
        } catch (SourceMismatchException e) {
            err.println("Source file does not match the module:");
            err.println(e.getLocalizedMessage());
            return 1;
        }

        try (OutputStream s = new BufferedOutputStream(new FileOutputStream(files.get(1)))) {
            ModuleWriter.writeModule(m, s);
        } catch (IOException e) {
            err.println("Error writing " + files.get(1) + ":");
            err.println(e.getLocalizedMessage());
            return 1;
        }

        out.format("%s: %d nondet calls, %d allocations%s%n",
                   m.getName(), pass.getProducerCount(), pass.getAllocationCount(),
                   changed ? "" : " (unchanged)");
        return 0;
    }
}
