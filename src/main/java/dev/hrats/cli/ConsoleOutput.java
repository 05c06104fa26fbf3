package dev.hrats.cli;

import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Command output for the user. Diagnostics go to the log instead.
 */
@Component
public class ConsoleOutput {

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleOutput() {
        this(System.out, System.err);
    }

    public ConsoleOutput(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void line(String text) {
        out.println(text);
    }

    public void line(String format, Object... args) {
        out.println(String.format(format, args));
    }

    public void error(String format, Object... args) {
        err.println(String.format(format, args));
    }
}
