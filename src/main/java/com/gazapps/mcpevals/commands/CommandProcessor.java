package com.gazapps.mcpevals.commands;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.config.Config;
import com.gazapps.mcpevals.config.ConfigurationValidator;
import com.gazapps.mcpevals.config.EvaluationConfigLoader;
import com.gazapps.mcpevals.config.EvaluationOptions;
import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.evaluation.EvaluationOrchestrator;
import com.gazapps.mcpevals.evaluation.LlmEvaluationScorer;
import com.gazapps.mcpevals.exceptions.ConfigException;
import com.gazapps.mcpevals.exceptions.ErrorMessageHandler;
import com.gazapps.mcpevals.llm.LanguageModel;
import com.gazapps.mcpevals.llm.LlmBuilder;
import com.gazapps.mcpevals.llm.LlmException;
import com.gazapps.mcpevals.mcp.ConnectionCache;
import com.gazapps.mcpevals.mcp.McpConnectionFactory;
import com.gazapps.mcpevals.mcp.SdkConnectionFactory;
import com.gazapps.mcpevals.mcp.process.ServerProcessManager;
import com.gazapps.mcpevals.mcp.transport.ServerTypeDetector;
import com.gazapps.mcpevals.mcp.transport.TransportCreationService;
import com.gazapps.mcpevals.mcp.transport.TransportResolver;
import com.gazapps.mcpevals.metrics.LoggingMetricsCollector;
import com.gazapps.mcpevals.metrics.MetricsCollector;
import com.gazapps.mcpevals.metrics.NoOpMetricsCollector;
import com.gazapps.mcpevals.model.EvaluationConfiguration;
import com.gazapps.mcpevals.model.EvaluationSummary;
import com.gazapps.mcpevals.planning.PatternToolMatcher;
import com.gazapps.mcpevals.planning.ToolExecutionPlanner;
import com.gazapps.mcpevals.report.ReportFormat;
import com.gazapps.mcpevals.report.ReportWriter;

/**
 * Parses the command line and runs {@code evaluate}, {@code validate} or {@code help}.
 */
public class CommandProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    static final String HELP = """
        Usage: mcp-evals <command> [options]

        Commands:
          evaluate <config>   Run every evaluation in a YAML or JSON suite
              -o, --output <file>        Write results to a file instead of the console
              -f, --format <format>      json, summary, detailed or clean (default: clean)
              -v, --verbose              Log tool selection and server details
              -p, --parallel <n>         Evaluations run at once (default: processor count)
                  --api-key <key>        Language model API key (overrides environment)
                  --endpoint <url>       Language model endpoint (Azure OpenAI)
                  --enable-metrics       Log evaluation and connection metrics
          validate <config>   Check a suite without running it
              -v, --verbose              Show the loaded configuration
              -c, --check-connectivity   Also connect to the server and list its tools
          help                Show this message""";

    private final Config config;
    private final PrintStream out;
    private final EvaluationConfigLoader loader = new EvaluationConfigLoader();
    private final ConfigurationValidator validator = new ConfigurationValidator();

    public CommandProcessor(Config config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public CommandResult processCommand(String[] args) {
        if (args == null || args.length == 0) {
            return CommandResult.error("❌ Command required\n\n" + HELP);
        }

        String command = args[0].trim().toLowerCase(Locale.ROOT);
        try {
            return switch (command) {
                case "evaluate", "eval", "run" -> handleEvaluateCommand(args);
                case "validate" -> handleValidateCommand(args);
                case "help", "-h", "--help" -> CommandResult.success(HELP);
                default -> CommandResult.error("❌ Unknown command: " + args[0] + "\n\n" + HELP);
            };
        } catch (IllegalArgumentException e) {
            return CommandResult.error("❌ " + e.getMessage() + "\n\n" + HELP);
        }
    }

    private CommandResult handleEvaluateCommand(String[] args) {
        EvaluationOptions options = parseEvaluateOptions(args);
        configureLogging(options.isVerbose());

        EvaluationConfiguration suite;
        try {
            suite = loadAndValidate(options.getConfigPath());
        } catch (ConfigException e) {
            return CommandResult.error(ErrorMessageHandler.getUserFriendlyMessage(e));
        }

        LanguageModel languageModel;
        try {
            languageModel = createLanguageModel(suite, options);
        } catch (LlmException e) {
            logger.error("Language model setup failed: {}", e.getMessage());
            return CommandResult.error(ErrorMessageHandler.getUserFriendlyMessage(e));
        }

        MetricsCollector metrics = options.isMetricsEnabled() ? new LoggingMetricsCollector() : new NoOpMetricsCollector();
        TransportResolver resolver = new TransportResolver();
        ConnectionCache cache = new ConnectionCache(createConnectionFactory(resolver), resolver, metrics);
        ToolExecutionPlanner planner = new ToolExecutionPlanner(languageModel, new PatternToolMatcher(), options.isVerbose());
        LlmEvaluationScorer scorer = new LlmEvaluationScorer(languageModel, suite.model);
        int parallelism = options.getParallelism(config.getDefaultParallelism());

        out.printf("🧪 Running %d evaluation(s) from %s with %s/%s%n",
                suite.evals.size(), options.getConfigPath(), languageModel.getProvider().getConfigName(),
                languageModel.getModelName());

        CancellationToken cancellation = new CancellationToken();
        Thread shutdownHook = shutdownHook(cancellation, cache);
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        long start = System.nanoTime();
        EvaluationSummary summary;
        try (EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(cache, planner, scorer, metrics)) {
            summary = orchestrator.evaluateAll(suite.evals, suite.server, parallelism, cancellation);
        } finally {
            removeShutdownHook(shutdownHook);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        try {
            new ReportWriter(out).write(summary, elapsed, options.getFormat(), options.getOutputPath(),
                    options.getConfigPath());
        } catch (IOException e) {
            logger.error("Failed to write report: {}", e.getMessage());
            return CommandResult.error(ErrorMessageHandler.getUserFriendlyMessage(e));
        }

        if (metrics instanceof LoggingMetricsCollector logging) {
            logging.logSummary();
        }

        if (summary.allSucceeded()) {
            return CommandResult.success(String.format("✅ All %d evaluation(s) completed successfully", summary.getTotal()));
        }
        return CommandResult.error(String.format("⚠️ %d of %d evaluation(s) failed", summary.getFailureCount(), summary.getTotal()));
    }

    private CommandResult handleValidateCommand(String[] args) {
        Path configPath = null;
        boolean verbose = false;
        boolean checkConnectivity = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "-v", "--verbose" -> verbose = true;
                case "-c", "--check-connectivity" -> checkConnectivity = true;
                default -> configPath = positional(configPath, args[i]);
            }
        }
        if (configPath == null) {
            throw new IllegalArgumentException("Configuration file is required");
        }
        configureLogging(verbose);

        EvaluationConfiguration suite;
        try {
            suite = loadAndValidate(configPath);
        } catch (ConfigException e) {
            return CommandResult.error(ErrorMessageHandler.getUserFriendlyMessage(e));
        }

        if (verbose) {
            out.println("📋 Suite: " + (suite.name != null ? suite.name : configPath.getFileName()));
            out.println("🤖 Model: " + suite.model);
            out.println("🔧 Server: " + suite.server);
            suite.evals.forEach(eval -> out.println("  - " + eval.name + ": " + eval.description));
        }

        if (checkConnectivity) {
            TransportResolver resolver = new TransportResolver();
            try (ConnectionCache cache = new ConnectionCache(createConnectionFactory(resolver), resolver, new NoOpMetricsCollector())) {
                if (!cache.testConnection(suite.server, new CancellationToken())) {
                    return CommandResult.error("❌ Configuration is valid but the MCP server could not be reached");
                }
            }
            out.println("🔌 MCP server reachable");
        }

        return CommandResult.success(String.format("✅ Configuration is valid (%d evaluation(s))", suite.evals.size()));
    }

    private EvaluationConfiguration loadAndValidate(Path configPath) throws ConfigException {
        EvaluationConfiguration suite = loader.load(configPath);
        List<String> errors = validator.validate(suite);
        if (!errors.isEmpty()) {
            throw new ConfigException(configPath.toString(),
                    "Configuration is invalid:\n  - " + String.join("\n  - ", errors), null);
        }
        return suite;
    }

    EvaluationOptions parseEvaluateOptions(String[] args) {
        Path configPath = null;
        Path output = null;
        ReportFormat format = ReportFormat.fromName(config.getDefaultFormat());
        boolean verbose = false;
        boolean metrics = false;
        int parallelism = 0;
        String apiKey = null;
        String endpoint = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> output = Path.of(requireValue(args, ++i, arg));
                case "-f", "--format" -> format = ReportFormat.fromName(requireValue(args, ++i, arg));
                case "-v", "--verbose" -> verbose = true;
                case "-p", "--parallel" -> parallelism = parsePositive(requireValue(args, ++i, arg), arg);
                case "--api-key" -> apiKey = requireValue(args, ++i, arg);
                case "--endpoint" -> endpoint = requireValue(args, ++i, arg);
                case "--enable-metrics" -> metrics = true;
                default -> configPath = positional(configPath, arg);
            }
        }
        if (configPath == null) {
            throw new IllegalArgumentException("Configuration file is required");
        }

        return EvaluationOptions.builder(configPath)
            .outputPath(output)
            .format(format)
            .verbose(verbose)
            .parallelism(parallelism)
            .apiKey(apiKey)
            .endpoint(endpoint)
            .metricsEnabled(metrics)
            .build();
    }

    protected void configureLogging(boolean verbose) {
        config.setupProgrammaticLogging(verbose);
    }

    protected LanguageModel createLanguageModel(EvaluationConfiguration suite, EvaluationOptions options) {
        return LlmBuilder.from(suite.model)
            .apiKey(options.getApiKey())
            .endpoint(options.getEndpoint())
            .config(config)
            .build();
    }

    protected McpConnectionFactory createConnectionFactory(TransportResolver resolver) {
        TransportCreationService transportCreation =
            new TransportCreationService(new ServerTypeDetector(), new ServerProcessManager());
        return new SdkConnectionFactory(resolver, transportCreation);
    }

    private static Path positional(Path current, String arg) {
        if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
        }
        if (current != null) {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
        }
        return Path.of(arg);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static int parsePositive(String value, String option) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException("Option " + option + " must be a positive number");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + option + " must be a number: " + value);
        }
    }

    /**
     * Ctrl+C hook: stops the run, then waits for every server it started to be shut down.
     */
    static Thread shutdownHook(CancellationToken cancellation, ConnectionCache cache) {
        return new Thread(() -> {
            cancellation.cancel();
            cache.closeAll();
        }, "evaluation-shutdown");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("Shutdown in progress, hook left in place");
        }
    }
}
