package org.dxworks.callframe.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The graph was rendered but could not be written, or the output file is missing afterwards.
 */
public class OutputWriteException extends IOException {

    private final Path output;

    public OutputWriteException(Path output, String message) {
        super(message);
        this.output = output;
    }

    public OutputWriteException(Path output, Throwable cause) {
        super("Failed to write " + output + ": " + cause.getMessage(), cause);
        this.output = output;
    }

    public Path getOutput() {
        return output;
    }
}
