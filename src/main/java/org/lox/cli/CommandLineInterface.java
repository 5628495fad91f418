package org.lox.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.lox.cli.commands.ReplCommand;
import org.lox.cli.commands.ScanCommand;
import org.lox.cli.config.CliSettings;
import org.lox.cli.config.ConfigLoader;
import org.lox.cli.config.LoggingConfigurator;
import org.lox.compiler.Compiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "lox",
    mixinStandardHelpOptions = true,
    version = "lox 1.0",
    description = "Scans Lox source into tokens. Without arguments an interactive session is started.",
    subcommands = {
        ScanCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCAN_ERRORS = 1;
    public static final int EXIT_IO_ERROR = 3;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: lox.conf)"
    )
    private File configFile;

    @Parameters(
        arity = "0..1",
        paramLabel = "FILE",
        description = "Source file to scan. Same as 'lox scan FILE'."
    )
    private File file;

    @Spec
    private CommandSpec spec;

    private CliSettings settings;

    @Override
    public Integer call() throws IOException {
        if (file != null) {
            return newRunner(getSettings()).runFile(file.toPath(), spec.commandLine().getOut(), spec.commandLine().getErr());
        }
        return startRepl();
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Runs an interactive session on the system terminal.
     * @return The exit code.
     * @throws IOException if the terminal cannot be opened.
     */
    public int startRepl() throws IOException {
        final CliSettings replSettings = getSettings();
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            return new ReplSession(newRunner(replSettings), replSettings.prompt()).run(terminal);
        }
    }

    public ScanRunner newRunner(final CliSettings runSettings) {
        return new ScanRunner(new Compiler(), runSettings);
    }

    public CliSettings getSettings() {
        if (settings == null) {
            initialize();
        }
        return settings;
    }

    private void initialize() {
        final Config config;
        try {
            config = ConfigLoader.load(configFile);
            settings = CliSettings.fromConfig(config);
        } catch (FileNotFoundException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Failed to load or parse configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
    }
}
