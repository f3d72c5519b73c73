package org.pragmatica.ddmm.run;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Compile-and-run service for transformed source.
 *
 * <p>Implementations compile {@code transformedSource} under {@code sourceName}, so that positioned errors name
 * the original file, and run it to completion. Since transformation preserves lines, reported line numbers
 * refer to the original source unchanged.
 */
@FunctionalInterface
public interface Interpreter {

    /**
     * @param transformedSource source after keyword substitution
     * @param sourceName        name reported in errors and tracebacks
     * @param argv              argument vector seen by the program; the first element is its own name,
     *                          e.g. {@code -c} for inline code
     * @param modulePath        directories searched for imported modules, highest priority first
     * @return exit status of the program; non-zero on compile or runtime failure
     */
    int execute(String transformedSource, String sourceName, List<String> argv, List<Path> modulePath)
    throws IOException;
}
