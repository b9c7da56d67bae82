package com.galois.nondet.pass;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads the lines of the original source file that call sites refer to.
 */
public final class SourceLineIndexer {

    /**
     * Return the text of every line in <code>requiredLines</code>.
     *
     * <p>
     * The file is not touched when no lines are required.  Lines are
     * numbered from 1.
     *
     * @param path the source file
     * @param requiredLines one-based line numbers
     * @return an unmodifiable map from line number to text
     * @throws SourceUnavailableException if lines are required and the path
     *   is unset or cannot be read
     * @throws SourceMismatchException if the file ends before some required
     *   line, meaning the debug locations do not belong to this file
     */
    public Map<Integer, String> index(String path, Set<Integer> requiredLines) {
        if (requiredLines.isEmpty()) {
            return Collections.emptyMap();
        }
        if (path == null || path.isEmpty()) {
            throw new SourceUnavailableException(path,
                "Source lines are needed but no file was given with -" + PassOptions.SOURCE_OPTION);
        }

        Map<Integer, String> lines = new HashMap<Integer, String>();
        try (BufferedReader r = open(path)) {
            int n = 1;
            String line;
            while (lines.size() < requiredLines.size() && (line = r.readLine()) != null) {
                if (requiredLines.contains(n)) {
                    lines.put(n, line);
                }
                ++n;
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(path, e);
        }

        if (!lines.keySet().equals(requiredLines)) {
            String msg = String.format("%s has no lines %s referenced by debug locations",
                                       path, missing(requiredLines, lines));
            throw new SourceMismatchException(path, msg);
        }
        return Collections.unmodifiableMap(lines);
    }

    private static BufferedReader open(String path) throws IOException {
        Path p;
        try {
            p = Paths.get(path);
        } catch (InvalidPathException e) {
            throw new IOException(e.getMessage(), e);
        }
        return new BufferedReader(new InputStreamReader(Files.newInputStream(p), StandardCharsets.UTF_8));
    }

    private static String missing(Set<Integer> required, Map<Integer, String> found) {
        StringBuilder b = new StringBuilder();
        for (Integer n : required) {
            if (!found.containsKey(n)) {
                if (b.length() > 0) b.append(", ");
                b.append(n);
            }
        }
        return b.toString();
    }
}
