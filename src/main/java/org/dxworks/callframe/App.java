package org.dxworks.callframe;

import ch.qos.logback.classic.Level;
import org.dxworks.callframe.pipeline.CallGraphOrchestrator;
import org.dxworks.callframe.pipeline.CallGraphPipeline;
import org.dxworks.callframe.pipeline.FileOutcome;
import org.dxworks.callframe.pipeline.SourceFileCollector;
import org.dxworks.callframe.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        if (options.isVerbose()) {
            enableDebugLogging();
        }

        if (!Files.exists(options.getInput())) {
            log.error("Input path does not exist: {}", options.getInput());
            System.exit(1);
            return;
        }

        run(options, CallframeConfig.load());
    }

    /**
     * Processes every source file under the input and logs a summary.
     * Per-file failures are part of the returned outcomes, never thrown.
     */
    public static List<FileOutcome> run(CommandLineOptions options, CallframeConfig config) throws IOException {
        OutputFormat format = options.getFormat().orElse(config.getOutputFormat());

        log.info("Input: {}", options.getInput().toAbsolutePath());
        List<Path> files = SourceFileCollector.collect(options.getInput());
        log.info("Found {} source files", files.size());

        Instant startTime = Instant.now();
        CallGraphPipeline pipeline = new CallGraphPipeline(format.createRenderer(), config.getMethodAttribution(),
                config.getMaxFileLines());
        List<FileOutcome> outcomes = new CallGraphOrchestrator(pipeline).run(files);

        long succeeded = outcomes.stream().filter(FileOutcome::isSuccess).count();
        long failed = outcomes.size() - succeeded;
        log.info("=".repeat(60));
        log.info("Call graphs complete in {} s", Duration.between(startTime, Instant.now()).getSeconds());
        log.info("Successfully processed: {} files", succeeded);
        if (failed > 0) {
            log.warn("Failed: {} files", failed);
        }
        log.info("=".repeat(60));
        return outcomes;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar callframe.jar -i <input> [-v] [-f dot|json]");
        System.err.println("  -i, --input <path>:   Java source file, or directory searched recursively for .java files");
        System.err.println("  -v, --verbose:        Log every traversal step");
        System.err.println("  -f, --format <name>:  Output format, dot (default) or json");
        System.err.println("Each source file gets a sibling output file, e.g. Foo.java -> Foo.dot");
    }
}
