package org.lox.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lox.cli.CommandLineInterface;
import org.lox.cli.config.LoggingConfigurator;
import org.lox.junit.extensions.logging.AllowLog;
import org.lox.junit.extensions.logging.LogLevel;
import org.lox.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs {@code lox scan} end to end against files in a temporary directory.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ScanCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void cleanFilePrintsSignificantTokens() throws IOException {
        Path file = write("ok.lox", "if (a != b) print \"x\";");

        int exitCode = cmd.execute("scan", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly(
                "IF            [0, 2) 'if'",
                "LEFT_PAREN    [3, 4) '('",
                "IDENTIFIER    [4, 5) 'a'",
                "BANG_EQUAL    [6, 8) '!='",
                "IDENTIFIER    [9, 10) 'b'",
                "RIGHT_PAREN   [10, 11) ')'",
                "PRINT         [12, 17) 'print'",
                "STRING        [18, 21) '\"x\"'",
                "SEMICOLON     [21, 22) ';'");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void scanErrorsAreRenderedAndFailTheRun() throws IOException {
        Path file = write("bad.lox", "var a = 1;\nvar b = 9.9.9;\nvar c = @;");

        int exitCode = cmd.execute("scan", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SCAN_ERRORS);
        assertThat(err.toString())
                .contains("Error: Failed to compile with 2 error(s):")
                .contains("bad.lox:2:9: Invalid number '9.9.9'")
                .contains("bad.lox:3:9: Unknown token '@'")
                .contains("                ^^^^^");
        // Tokens recognized around the errors are still listed.
        assertThat(out.toString()).contains("IDENTIFIER    [15, 16) 'b'");
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*ScanRunner", messagePattern = "Failed to read .*")
    void unreadableFileHasItsOwnExitCode() {
        int exitCode = cmd.execute("scan", dir.resolve("missing.lox").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Failed to read").contains("missing.lox");
    }

    @Test
    void tokenListingCanBeSwitchedOff() throws IOException {
        Path file = write("quiet.lox", "x = 1;");

        int exitCode = cmd.execute("scan", "--no-tokens", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void triviaAndEofAreListedOnRequest() throws IOException {
        Path file = write("trivia.lox", "x // note\n");

        int exitCode = cmd.execute("scan", "--trivia", "--eof", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly(
                "IDENTIFIER    [0, 1) 'x'",
                "WHITESPACE    [1, 2) ' '",
                "COMMENT_LINE  [2, 9) '// note'",
                "WHITESPACE    [9, 10) '\\n'",
                "EOF           [10, 10) ''");
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
