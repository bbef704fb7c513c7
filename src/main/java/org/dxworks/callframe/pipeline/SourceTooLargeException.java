package org.dxworks.callframe.pipeline;

import java.nio.file.Path;

/**
 * The source file has more lines than the configured limit and was not parsed.
 * Fatal for that file only.
 */
public class SourceTooLargeException extends RuntimeException {

    private final Path source;
    private final long lineCount;
    private final int maxFileLines;

    public SourceTooLargeException(Path source, long lineCount, int maxFileLines) {
        super(source + " has " + lineCount + " lines, more than the limit of " + maxFileLines);
        this.source = source;
        this.lineCount = lineCount;
        this.maxFileLines = maxFileLines;
    }

    public Path getSource() {
        return source;
    }

    public long getLineCount() {
        return lineCount;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }
}
