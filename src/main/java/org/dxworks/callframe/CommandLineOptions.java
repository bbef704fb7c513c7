package org.dxworks.callframe;

import org.dxworks.callframe.render.OutputFormat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * {@code -i|--input <path> [-v|--verbose] [-f|--format dot|json]}
 */
public final class CommandLineOptions {

    private final Path input;
    private final boolean verbose;
    private final OutputFormat format;

    private CommandLineOptions(Path input, boolean verbose, OutputFormat format) {
        this.input = input;
        this.verbose = verbose;
        this.format = format;
    }

    /**
     * @throws IllegalArgumentException for unknown options, missing values or a missing input
     */
    public static CommandLineOptions parse(String[] args) {
        Path input = null;
        boolean verbose = false;
        OutputFormat format = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-i":
                case "--input":
                    input = Paths.get(requireValue(args, ++i, arg));
                    break;
                case "-v":
                case "--verbose":
                    verbose = true;
                    break;
                case "-f":
                case "--format":
                    String name = requireValue(args, ++i, arg);
                    format = OutputFormat.fromName(name)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + name));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("Missing required option -i/--input");
        }
        return new CommandLineOptions(input, verbose, format);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    public Path getInput() {
        return input;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * @return the format given on the command line, empty to use the configured one
     */
    public Optional<OutputFormat> getFormat() {
        return Optional.ofNullable(format);
    }
}
