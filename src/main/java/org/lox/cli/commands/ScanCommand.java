package org.lox.cli.commands;

import org.lox.cli.CommandLineInterface;
import org.lox.cli.config.CliSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "scan",
    mixinStandardHelpOptions = true,
    description = "Scans a source file, prints its tokens and reports every scan error."
)
public class ScanCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to scan.")
    private File file;

    @Option(names = "--tokens", negatable = true, description = "List the recognized tokens (default: from configuration).")
    private Boolean printTokens;

    @Option(names = "--trivia", description = "Include whitespace and comment tokens in the listing.")
    private Boolean showTrivia;

    @Option(names = "--eof", description = "End the listing with an EOF token.")
    private Boolean appendEof;

    @Override
    public Integer call() {
        final CliSettings settings = parent.getSettings().withOverrides(printTokens, showTrivia, appendEof);
        return parent.newRunner(settings).runFile(file.toPath(), spec.commandLine().getOut(), spec.commandLine().getErr());
    }
}
