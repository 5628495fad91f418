package org.lox.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Interactive loop: every entered line is scanned on its own and its tokens or errors printed.
 * Scan errors never end the session; {@code exit}, {@code quit} or end of input do.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);
    static final String SOURCE_NAME = "<repl>";

    private final ScanRunner runner;
    private final String prompt;

    public ReplSession(ScanRunner runner, String prompt) {
        this.runner = runner;
        this.prompt = prompt;
    }

    /**
     * Runs the loop until the user leaves.
     * @param terminal The terminal to read from and write to.
     * @return The exit code, always {@link CommandLineInterface#EXIT_OK}.
     */
    public int run(Terminal terminal) {
        LineReader lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .build();
        PrintWriter out = terminal.writer();
        int lines = 0;

        while (true) {
            try {
                String line = lineReader.readLine(prompt);
                lines++;
                if (!handle(line, out, out)) {
                    break;
                }
            } catch (UserInterruptException e) {
                // Ctrl-C drops the current line only.
                LOG.debug("Interrupted, discarding partial input");
            } catch (EndOfFileException e) {
                break;
            }
        }
        out.flush();
        LOG.debug("REPL session ended after {} line(s)", lines);
        return CommandLineInterface.EXIT_OK;
    }

    /**
     * Handles one entered line.
     * @return {@code false} if the session should end.
     */
    boolean handle(String line, PrintWriter out, PrintWriter err) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if ("exit".equalsIgnoreCase(trimmed) || "quit".equalsIgnoreCase(trimmed)) {
            return false;
        }
        if (!trimmed.isEmpty()) {
            runner.runLine(line, SOURCE_NAME, out, err);
        }
        return true;
    }
}
