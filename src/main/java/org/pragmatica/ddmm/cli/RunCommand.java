package org.pragmatica.ddmm.cli;

import org.pragmatica.ddmm.Ddmm;
import org.pragmatica.ddmm.build.ModuleResolver;
import org.pragmatica.ddmm.build.TranspileCache;
import org.pragmatica.ddmm.build.TreeTranspiler;
import org.pragmatica.ddmm.config.DdmmConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Transforms a program and executes it with the configured interpreter.
 *
 * <p>Source directories of file and module programs are transpiled into their cache directories first, and
 * both the cache and the source directory are put on the module path, so the program can import other
 * keyword-bracket modules as well as plain ones. Only the directory itself and the packages below it are
 * transpiled.
 *
 * <p>The program's own name in its argument vector is {@code -c} for inline code, {@code -} for standard input,
 * the module name for {@code -m} and the file path otherwise.
 */
@Command(name = "run",
    mixinStandardHelpOptions = true,
    description = "Run a program given as FILE, '-' (standard input), -c CODE or -m MODULE.")
class RunCommand implements Callable<Integer> {
    @Option(names = "-c", paramLabel = "CODE", description = "Program passed in as a string")
    String code;

    @Option(names = "-m", paramLabel = "MODULE", description = "Run a module found on the module search path")
    String module;

    @Option(names = "--path", paramLabel = "DIR", description = "Additional module search directory for -m (repeatable)")
    List<Path> searchPath = new ArrayList<>();

    @Parameters(arity = "0..*", paramLabel = "ARG", description = "FILE followed by program arguments, or only arguments with -c/-m")
    List<String> positional = new ArrayList<>();

    @ParentCommand
    DdmmCommand root;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (code != null && module != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Give either -c CODE or -m MODULE, not both");
        }
        var config = root.config();
        var workingDirectory = root.workingDirectory();
        SourceInput input;
        String programName;
        List<String> arguments;
        List<Path> sourceRoots;

        if (code != null) {
            input = SourceInput.inline(code, config.displayName(), workingDirectory);
            programName = "-c";
            arguments = positional;
            sourceRoots = List.of();
        }else if (module != null) {
            sourceRoots = moduleSearchPath();
            var file = new ModuleResolver(sourceRoots, config.sourceExtension()).resolve(module)
                                                                                  .orElseThrow(() -> new IOException("No module named '"
                                                                                                                     + module
                                                                                                                     + "'"));
            input = SourceInput.read(file.toString(), root.stdin(), workingDirectory);
            programName = module;
            arguments = positional;
        }else {
            if (positional.isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Expected FILE, '-', -c CODE or -m MODULE");
            }
            input = SourceInput.read(positional.get(0), root.stdin(), workingDirectory);
            programName = positional.get(0);
            arguments = positional.subList(1, positional.size());
            sourceRoots = SourceInput.STDIN.equals(positional.get(0))
                          ? List.of()
                          : List.of(input.directory());
        }

        var modulePath = prepareModulePath(sourceRoots, config);
        var argv = new ArrayList<String>();
        argv.add(programName);
        argv.addAll(arguments);
        return root.interpreter()
                   .execute(Ddmm.transform(input.text()), input.name(), List.copyOf(argv), modulePath);
    }

    private List<Path> moduleSearchPath() {
        var entries = new ArrayList<Path>();
        entries.add(root.workingDirectory());
        for (var entry : searchPath) {
            entries.add(root.workingDirectory()
                            .resolve(entry));
        }
        return entries;
    }

    private List<Path> prepareModulePath(List<Path> sourceRoots, DdmmConfig config) throws IOException {
        var modulePath = new ArrayList<Path>();
        for (var sourceRoot : sourceRoots) {
            var cacheRoot = sourceRoot.resolve(config.cacheDirectory());
            var report = new TreeTranspiler(new TranspileCache(cacheRoot, config),
                                            config,
                                            false,
                                            TreeTranspiler.Scope.PACKAGES).build(sourceRoot);
            if (!report.isSuccess()) {
                var err = spec.commandLine()
                              .getErr();
                report.failed()
                      .forEach(file -> err.println("ddmm: could not transpile " + file));
                err.flush();
            }
            modulePath.add(cacheRoot);
            modulePath.add(sourceRoot);
        }
        return modulePath;
    }
}
