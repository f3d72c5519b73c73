package org.pragmatica.ddmm.cli;

import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Reads one source from a file, standard input or {@code -c}, rewrites it and prints the result.
 */
abstract class RewriteCommand implements Callable<Integer> {
    @Option(names = "-c", paramLabel = "CODE", description = "Program passed in as a string")
    String code;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "Source file, or '-' for standard input")
    String source;

    @ParentCommand
    DdmmCommand root;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var input = readInput();
        var rewritten = rewrite(input.text());
        var out = spec.commandLine()
                      .getOut();
        out.print(rewritten);
        if (!rewritten.isEmpty() && !rewritten.endsWith("\n")) {
            out.println();
        }
        out.flush();
        return 0;
    }

    protected abstract String rewrite(String text);

    private SourceInput readInput() throws Exception {
        if (code != null && source != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Give either -c CODE or FILE, not both");
        }
        if (code != null) {
            return SourceInput.inline(code, root.config()
                                                .displayName(), root.workingDirectory());
        }
        if (source == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Expected FILE, '-' or -c CODE");
        }
        return SourceInput.read(source, root.stdin(), root.workingDirectory());
    }
}
