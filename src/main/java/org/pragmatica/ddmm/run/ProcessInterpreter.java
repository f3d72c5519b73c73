package org.pragmatica.ddmm.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs transformed source in an external interpreter process with inherited standard streams.
 *
 * <p>The source is handed over through a temporary file and compiled by a bootstrap under the original source
 * name. The program sees {@code sys.argv} as the argument vector it is given; {@code __file__} is set only for
 * sources read from a file.
 */
public final class ProcessInterpreter implements Interpreter {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessInterpreter.class);

    static final String BOOTSTRAP = String.join("; ",
                                                "import sys",
                                                "path, name = sys.argv[1], sys.argv[2]",
                                                "sys.argv = sys.argv[3:]",
                                                "code = compile(open(path, encoding='utf-8').read(), name, 'exec')",
                                                "g = {'__name__': '__main__'}",
                                                "g.update({} if name.startswith('<') else {'__file__': name})",
                                                "exec(code, g)");

    private final List<String> command;

    /**
     * @param command interpreter executable and its leading options, e.g. {@code ["python3"]}
     */
    public ProcessInterpreter(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Interpreter command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public int execute(String transformedSource, String sourceName, List<String> argv, List<Path> modulePath)
    throws IOException {
        var script = Files.createTempFile("ddmm-", ".py");
        try{
            Files.writeString(script, transformedSource, StandardCharsets.UTF_8);
            var builder = new ProcessBuilder(commandLine(script, sourceName, argv)).inheritIO();
            if (!modulePath.isEmpty()) {
                builder.environment()
                       .put("PYTHONPATH", searchPath(modulePath, builder.environment()
                                                                        .get("PYTHONPATH")));
            }
            LOG.debug("Running {} as {}", sourceName, builder.command());
            return waitFor(builder.start());
        } finally{
            Files.deleteIfExists(script);
        }
    }

    List<String> commandLine(Path script, String sourceName, List<String> argv) {
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("Argument vector must contain the program name");
        }
        var line = new ArrayList<>(command);
        line.add("-c");
        line.add(BOOTSTRAP);
        line.add(script.toString());
        line.add(sourceName);
        line.addAll(argv);
        return line;
    }

    static String searchPath(List<Path> modulePath, String inherited) {
        var joined = modulePath.stream()
                               .map(path -> path.toAbsolutePath()
                                                .toString())
                               .collect(Collectors.joining(File.pathSeparator));
        return inherited == null || inherited.isBlank()
               ? joined
               : joined + File.pathSeparator + inherited;
    }

    private static int waitFor(Process process) throws IOException {
        try{
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread()
                  .interrupt();
            throw new IOException("Interrupted while waiting for interpreter", e);
        }
    }
}
