package org.pragmatica.ddmm.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source text with the name it is reported under.
 */
record SourceInput(String text, String name, Path directory) {
    static final String STDIN = "-";
    static final String STDIN_NAME = "<stdin>";

    static SourceInput inline(String code, String displayName, Path workingDirectory) {
        return new SourceInput(code, displayName, workingDirectory);
    }

    /**
     * Read a file, or standard input for {@value #STDIN}.
     *
     * @throws MissingSourceException when the file does not exist
     */
    static SourceInput read(String argument, InputStream stdin, Path workingDirectory) throws IOException {
        if (STDIN.equals(argument)) {
            return new SourceInput(new String(stdin.readAllBytes(), StandardCharsets.UTF_8), STDIN_NAME, workingDirectory);
        }
        var path = workingDirectory.resolve(argument);
        if (!Files.isRegularFile(path)) {
            throw new MissingSourceException(argument);
        }
        var parent = path.toAbsolutePath()
                         .getParent();
        return new SourceInput(Files.readString(path, StandardCharsets.UTF_8),
                               argument,
                               parent == null
                               ? workingDirectory
                               : parent);
    }

    /**
     * Named source file does not exist.
     */
    static final class MissingSourceException extends IOException {
        MissingSourceException(String argument) {
            super("can't open file '" + argument + "': No such file or directory");
        }
    }
}
