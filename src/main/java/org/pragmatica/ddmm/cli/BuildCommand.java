package org.pragmatica.ddmm.cli;

import org.pragmatica.ddmm.build.TranspileCache;
import org.pragmatica.ddmm.build.TreeTranspiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "build",
    mixinStandardHelpOptions = true,
    description = "Transpile every source file under a directory, skipping files that are up to date.")
class BuildCommand implements Callable<Integer> {
    @Parameters(index = "0", paramLabel = "DIR", description = "Source directory")
    Path sourceDirectory;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR", description = "Output directory (default: DIR/<cache-directory>)")
    Path outputDirectory;

    @Option(names = "--check", description = "Validate bracket matching first; files with problems are not written")
    boolean check;

    @ParentCommand
    DdmmCommand root;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var config = root.config();
        var sources = root.workingDirectory()
                          .resolve(sourceDirectory);
        if (!Files.isDirectory(sources)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Not a directory: " + sourceDirectory);
        }
        var output = outputDirectory == null
                     ? sources.resolve(config.cacheDirectory())
                     : root.workingDirectory()
                           .resolve(outputDirectory);
        var report = new TreeTranspiler(new TranspileCache(output, config), config, check).build(sources);

        var err = spec.commandLine()
                      .getErr();
        report.rejected()
              .forEach((file, diagnostics) -> diagnostics.forEach(diagnostic -> err.println(diagnostic.format())));
        report.failed()
              .forEach(file -> err.println("ddmm: could not transpile " + file));
        var out = spec.commandLine()
                      .getOut();
        if (!report.removed()
                   .isEmpty()) {
            out.printf("Removed %d stale cached file(s)%n",
                       report.removed()
                             .size());
        }
        out.printf("Built %d file(s), %d up to date, %d rejected, %d failed%n",
                   report.written()
                         .size(),
                   report.upToDate()
                         .size(),
                   report.rejected()
                         .size(),
                   report.failed()
                         .size());
        return report.isSuccess()
               ? 0
               : 1;
    }
}
