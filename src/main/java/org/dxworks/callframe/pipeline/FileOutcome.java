package org.dxworks.callframe.pipeline;

import java.nio.file.Path;

/**
 * Result of one file's pipeline inside a batch.
 */
public final class FileOutcome {
    private final Path source;
    private final Path output;
    private final String progress;
    private final Throwable error;

    private FileOutcome(Path source, Path output, String progress, Throwable error) {
        this.source = source;
        this.output = output;
        this.progress = progress;
        this.error = error;
    }

    public static FileOutcome success(Path source, Path output, String progress) {
        return new FileOutcome(source, output, progress, null);
    }

    public static FileOutcome failure(Path source, String progress, Throwable error) {
        return new FileOutcome(source, null, progress, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Path getSource() {
        return source;
    }

    /**
     * @return the written file, or {@code null} for a failed outcome
     */
    public Path getOutput() {
        return output;
    }

    /**
     * Position in the batch, e.g. {@code "3/10"}.
     */
    public String getProgress() {
        return progress;
    }

    public Throwable getError() {
        return error;
    }
}
