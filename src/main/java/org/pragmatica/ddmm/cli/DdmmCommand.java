package org.pragmatica.ddmm.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pragmatica.ddmm.config.DdmmConfig;
import org.pragmatica.ddmm.run.Interpreter;
import org.pragmatica.ddmm.run.ProcessInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "ddmm",
    mixinStandardHelpOptions = true,
    version = "ddmm 1.0.0",
    description = {
        "Rewrites keyword-bracket source to plain brackets and back, checks bracket matching and runs programs.",
        "",
        "  drake / maye  ->  ( )   parentheses",
        "  Drake / Maye  ->  { }   curly braces",
        "  DRAKE / MAYE  ->  [ ]   square brackets"
    },
    subcommands = {
        ShowCommand.class,
        ConvertCommand.class,
        CheckCommand.class,
        BuildCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class DdmmCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(DdmmCommand.class);
    private static final String CONFIG_FILE_NAME = "ddmm.conf";

    @Option(names = "--config", description = "Configuration file (default: ./" + CONFIG_FILE_NAME + " if present)")
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    private boolean verbose;

    @Spec
    CommandLine.Model.CommandSpec spec;

    private final Function<DdmmConfig, Interpreter> interpreters;
    private final InputStream stdin;
    private final Path workingDirectory;
    private DdmmConfig config;

    public DdmmCommand() {
        this(config -> new ProcessInterpreter(config.interpreterCommand()),
             System.in,
             Path.of("")
                 .toAbsolutePath());
    }

    public DdmmCommand(Function<DdmmConfig, Interpreter> interpreters, InputStream stdin, Path workingDirectory) {
        this.interpreters = interpreters;
        this.stdin = stdin;
        this.workingDirectory = workingDirectory;
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new DdmmCommand()).execute(args));
    }

    /**
     * Command line with the tool's parsing and error conventions applied.
     * Everything after the first positional parameter is passed through, so program arguments may start with '-'.
     */
    public static CommandLine commandLine(DdmmCommand command) {
        var commandLine = new CommandLine(command);
        commandLine.setStopAtPositional(true);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            LOG.debug("Command failed", e);
            cmd.getErr()
               .println("ddmm: " + (e.getMessage() == null
                                    ? e.toString()
                                    : e.getMessage()));
            return e instanceof SourceInput.MissingSourceException
                   ? 2
                   : 1;
        });
        return commandLine;
    }

    DdmmConfig config() {
        if (config == null) {
            var loaded = loadConfig();
            LoggingConfigurator.configure(loaded, verbose);
            config = DdmmConfig.from(loaded);
        }
        return config;
    }

    Interpreter interpreter() {
        return interpreters.apply(config());
    }

    InputStream stdin() {
        return stdin;
    }

    Path workingDirectory() {
        return workingDirectory;
    }

    // System properties > environment > config file > classpath defaults
    private Config loadConfig() {
        var file = configFile;
        if (file != null && !file.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + file);
        }
        if (file == null) {
            var local = workingDirectory.resolve(CONFIG_FILE_NAME)
                                        .toFile();
            file = local.isFile()
                   ? local
                   : null;
        }
        try{
            var config = ConfigFactory.systemProperties()
                                      .withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                LOG.debug("Using configuration file {}", file.getAbsolutePath());
                config = config.withFallback(ConfigFactory.parseFile(file));
            }
            return config.withFallback(ConfigFactory.load())
                         .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e, null, null);
        }
    }
}
