package org.pragmatica.ddmm.cli;

import org.pragmatica.ddmm.Ddmm;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check",
    mixinStandardHelpOptions = true,
    description = "Validate keyword bracket matching. Exits with 1 if any file has problems.")
class CheckCommand implements Callable<Integer> {
    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Source files, or '-' for standard input")
    List<String> sources;

    @ParentCommand
    DdmmCommand root;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var out = spec.commandLine()
                      .getOut();
        var err = spec.commandLine()
                      .getErr();
        int exitCode = 0;
        for (var source : sources) {
            var input = SourceInput.read(source, root.stdin(), root.workingDirectory());
            var diagnostics = Ddmm.checkBracketMatching(input.text(), input.name());
            if (diagnostics.isEmpty()) {
                out.println(input.name() + ": All brackets match!");
                continue;
            }
            for (var diagnostic : diagnostics) {
                err.println(diagnostic.format(input.text()));
            }
            exitCode = 1;
        }
        out.flush();
        err.flush();
        return exitCode;
    }
}
