package org.lox.cli.commands;

import org.lox.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts an interactive session that scans each entered line."
)
public class ReplCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws IOException {
        return parent.startRepl();
    }
}
