package com.gazapps.mcpevals;

import java.io.IOException;
import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.commands.CommandProcessor;
import com.gazapps.mcpevals.commands.CommandResult;
import com.gazapps.mcpevals.config.Config;
import com.gazapps.mcpevals.exceptions.ErrorMessageHandler;
import com.github.lalyos.jfiglet.FigletFont;

public class App implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private final CommandProcessor commandProcessor;
    private final PrintStream out;
    private final PrintStream err;

    public App(Config config, PrintStream out, PrintStream err) {
        this.commandProcessor = new CommandProcessor(config, out);
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        try {
            CommandResult result = commandProcessor.processCommand(args);
            (result.isSuccess() ? out : err).println(result.getMessage());
            return result.getExitCode();
        } catch (Exception e) {
            logger.error("Unexpected error: {}", e.getMessage(), e);
            err.println(ErrorMessageHandler.getUserFriendlyMessage(e));
            return CommandResult.EXIT_FAILURE;
        }
    }

    @Override
    public void close() {
        out.flush();
        err.flush();
    }

    public static void main(String[] args) {
        starting();

        int exitCode;
        try (var app = new App(new Config(), System.out, System.err)) {
            exitCode = app.run(args);
        }
        System.exit(exitCode);
    }

    // Banner goes to stderr so reports printed on stdout stay clean
    private static void starting() {
        try {
            System.err.println(FigletFont.convertOneLine("MCP Evals"));
        } catch (IOException e) {
            System.err.println("MCP Evals");
        }
    }
}
