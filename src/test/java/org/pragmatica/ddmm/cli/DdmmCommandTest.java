package org.pragmatica.ddmm.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.ddmm.run.Interpreter;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DdmmCommandTest {
    @TempDir
    Path workingDirectory;

    private final RecordingInterpreter interpreter = new RecordingInterpreter();
    private StringWriter out;
    private StringWriter err;
    private String stdin = "";

    @BeforeEach
    void resetOutput() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        var command = DdmmCommand.commandLine(new DdmmCommand(config -> interpreter,
                                                              new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                                                              workingDirectory));
        command.setOut(new PrintWriter(out, true));
        command.setErr(new PrintWriter(err, true));
        return command.execute(args);
    }

    private Path write(String name, String text) throws IOException {
        var file = workingDirectory.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, text);
    }

    @Test
    void noSubcommand_printsUsage() {
        assertEquals(0, execute());
        assertThat(out.toString()).contains("Usage: ddmm")
                                  .contains("show");
    }

    @Test
    void version() {
        assertEquals(0, execute("--version"));
        assertThat(out.toString()).contains("ddmm 1.0.0");
    }

    @Nested
    class Show {
        @Test
        void inlineCode() {
            assertEquals(0, execute("show", "-c", "print drake 'hi' maye"));
            assertEquals("print ( 'hi' )\n", out.toString());
        }

        @Test
        void aliasAndFile() throws IOException {
            write("app.ddmm", "x = DRAKE 1 MAYE\n");

            assertEquals(0, execute("to-python", "app.ddmm"));
            assertEquals("x = [ 1 ]\n", out.toString());
        }

        @Test
        void standardInput() {
            stdin = "Drake Maye";

            assertEquals(0, execute("show", "-"));
            assertEquals("{ }\n", out.toString());
        }

        @Test
        void missingFile_exitCode2() {
            assertEquals(2, execute("show", "missing.ddmm"));
            assertThat(err.toString()).contains("ddmm: can't open file 'missing.ddmm': No such file or directory");
        }

        @Test
        void noInput_usageError() {
            assertEquals(CommandLine.ExitCode.USAGE, execute("show"));
            assertThat(err.toString()).contains("Expected FILE");
        }
    }

    @Test
    void convert_inlineCode() {
        assertEquals(0, execute("convert", "-c", "f(x)"));
        assertEquals("f drake x maye\n", out.toString());
    }

    @Nested
    class Check {
        @Test
        void balancedFile() throws IOException {
            write("good.ddmm", "f drake maye\n");

            assertEquals(0, execute("check", "good.ddmm"));
            assertEquals("good.ddmm: All brackets match!\n", out.toString());
        }

        @Test
        void unbalancedFile_reportsWithExcerpt() throws IOException {
            write("good.ddmm", "f drake maye\n");
            write("bad.ddmm", "x = 1\nprint drake x\n");

            assertEquals(1, execute("check", "good.ddmm", "bad.ddmm"));
            assertThat(out.toString()).contains("good.ddmm: All brackets match!");
            assertThat(err.toString()).contains("Unclosed 'drake' (paren)")
                                      .contains("File \"bad.ddmm\", line 2")
                                      .contains("    print drake x");
        }
    }

    @Nested
    class Build {
        @Test
        void buildsIntoCacheDirectory() throws IOException {
            write("src/a.ddmm", "drake maye\n");
            write("src/pkg/b.ddmm", "DRAKE MAYE\n");

            assertEquals(0, execute("build", "src"));
            assertEquals("Built 2 file(s), 0 up to date, 0 rejected, 0 failed\n", out.toString());
            assertEquals("[ ]\n", Files.readString(workingDirectory.resolve("src/__ddmmcache__/pkg/b.py")));
        }

        @Test
        void checkOption_rejectsAndFails() throws IOException {
            write("src/a.ddmm", "drake\n");

            assertEquals(1, execute("build", "--check", "-o", "out", "src"));
            assertThat(out.toString()).contains("0 file(s), 0 up to date, 1 rejected");
            assertThat(err.toString()).contains("Unclosed 'drake' (paren)");
            assertFalse(Files.exists(workingDirectory.resolve("out/a.py")));
        }
    }

    @Nested
    class Run {
        @Test
        void file_passesTransformedSourceArgumentsAndModulePath() throws IOException {
            write("prog.ddmm", "print drake 1 maye\n");
            write("helper.ddmm", "x = DRAKE MAYE\n");
            interpreter.exitCode = 3;

            assertEquals(3, execute("run", "prog.ddmm", "-v", "b"));
            assertEquals("print ( 1 )\n", interpreter.source);
            assertEquals("prog.ddmm", interpreter.name);
            assertEquals(List.of("prog.ddmm", "-v", "b"), interpreter.argv);
            assertEquals(List.of(workingDirectory.resolve("__ddmmcache__"), workingDirectory), interpreter.modulePath);
            assertTrue(Files.isRegularFile(workingDirectory.resolve("__ddmmcache__/helper.py")));
        }

        @Test
        void inlineCode_usesDisplayName() {
            assertEquals(0, execute("run", "-c", "print drake 1 maye", "x"));
            assertEquals("print ( 1 )", interpreter.source);
            assertEquals("<string>", interpreter.name);
            assertEquals(List.of("-c", "x"), interpreter.argv);
            assertThat(interpreter.modulePath).isEmpty();
        }

        @Test
        void module_resolvedFromWorkingDirectory() throws IOException {
            write("pkg/__init__.ddmm", "");
            write("pkg/mod.ddmm", "f drake maye\n");

            assertEquals(0, execute("run", "-m", "pkg.mod"));
            assertEquals("f ( )\n", interpreter.source);
            assertThat(interpreter.name).endsWith("mod.ddmm");
            assertEquals(List.of("pkg.mod"), interpreter.argv);
        }

        @Test
        void standardInput_programNameIsDash() {
            stdin = "f drake maye";

            assertEquals(0, execute("run", "-", "a"));
            assertEquals("<stdin>", interpreter.name);
            assertEquals(List.of("-", "a"), interpreter.argv);
            assertThat(interpreter.modulePath).isEmpty();
        }

        @Test
        void file_onlyPackagesBelowScriptDirectoryAreTranspiled() throws IOException {
            write("prog.ddmm", "import pkg.mod\n");
            write("pkg/__init__.ddmm", "");
            write("pkg/mod.ddmm", "x = drake maye\n");
            write("scratch/notes.ddmm", "y = drake maye\n");

            assertEquals(0, execute("run", "prog.ddmm"));
            assertTrue(Files.isRegularFile(workingDirectory.resolve("__ddmmcache__/pkg/mod.py")));
            assertFalse(Files.exists(workingDirectory.resolve("__ddmmcache__/scratch")));
        }

        @Test
        void deletedModule_cachedCopyRemovedBeforeRun() throws IOException {
            write("prog.ddmm", "import helper\n");
            var helper = write("helper.ddmm", "x = DRAKE MAYE\n");
            execute("run", "prog.ddmm");
            Files.delete(helper);
            write("helper.py", "x = []\n");

            assertEquals(0, execute("run", "prog.ddmm"));
            assertFalse(Files.exists(workingDirectory.resolve("__ddmmcache__/helper.py")));
            assertTrue(Files.isRegularFile(workingDirectory.resolve("__ddmmcache__/prog.py")));
        }

        @Test
        void unknownModule_fails() {
            assertEquals(1, execute("run", "-m", "nothing"));
            assertThat(err.toString()).contains("No module named 'nothing'");
            assertNull(interpreter.source);
        }
    }

    private static final class RecordingInterpreter implements Interpreter {
        int exitCode;
        String source;
        String name;
        List<String> argv;
        List<Path> modulePath;

        @Override
        public int execute(String transformedSource, String sourceName, List<String> argv, List<Path> modulePath) {
            this.source = transformedSource;
            this.name = sourceName;
            this.argv = argv;
            this.modulePath = modulePath;
            return exitCode;
        }
    }
}
