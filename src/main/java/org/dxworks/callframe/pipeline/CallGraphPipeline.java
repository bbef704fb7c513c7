package org.dxworks.callframe.pipeline;

import org.dxworks.callframe.analyzer.CallGraphCollector;
import org.dxworks.callframe.analyzer.JavaParserFactory;
import org.dxworks.callframe.analyzer.MethodAttribution;
import org.dxworks.callframe.model.FileModel;
import org.dxworks.callframe.render.GraphRenderer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parse, collect, render and write for a single source file.
 * <p>
 * Every call builds its own collector, so one pipeline can serve many files concurrently.
 * The output is rendered completely in memory before anything is written: a file whose
 * extraction fails leaves no output behind.
 */
public class CallGraphPipeline {

    private static final String SOURCE_EXTENSION = ".java";

    private final GraphRenderer renderer;
    private final MethodAttribution attribution;
    private final int maxFileLines;

    public CallGraphPipeline(GraphRenderer renderer, MethodAttribution attribution) {
        this(renderer, attribution, Integer.MAX_VALUE);
    }

    public CallGraphPipeline(GraphRenderer renderer, MethodAttribution attribution, int maxFileLines) {
        this.renderer = renderer;
        this.attribution = attribution;
        this.maxFileLines = maxFileLines;
    }

    /**
     * @throws SourceTooLargeException when the file has more than {@code maxFileLines} lines;
     *                                 it is rejected before parsing
     */
    public ExtractionResult extract(Path sourceFile) throws IOException {
        String sourceCode = Files.readString(sourceFile, StandardCharsets.UTF_8);
        long lineCount = sourceCode.lines().count();
        if (lineCount > maxFileLines) {
            throw new SourceTooLargeException(sourceFile, lineCount, maxFileLines);
        }
        return extract(sourceFile.toString(), sourceCode);
    }

    public ExtractionResult extract(String filePath, String sourceCode) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        CallGraphCollector collector = new CallGraphCollector(attribution);
        JavaParserFactory.walk(sourceCode, collector);

        FileModel model = collector.getFileModel();
        model.filePath = filePath;
        return new ExtractionResult(model, collector.getDiagnostics());
    }

    /**
     * Extracts and renders {@code sourceFile} into a sibling file named after it.
     *
     * @return the written output file
     */
    public Path process(Path sourceFile) throws IOException {
        ExtractionResult result = extract(sourceFile);
        String rendered = renderer.render(result.getModel());

        Path output = outputPathFor(sourceFile);
        try {
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException(output, e);
        }
        if (!Files.isRegularFile(output)) {
            throw new OutputWriteException(output, "Output file " + output + " does not exist after writing");
        }
        return output;
    }

    public Path outputPathFor(Path sourceFile) {
        String fileName = sourceFile.getFileName().toString();
        String baseName = fileName.endsWith(SOURCE_EXTENSION)
                ? fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length())
                : fileName;
        return sourceFile.resolveSibling(baseName + renderer.getFormat().getExtension());
    }

    public GraphRenderer getRenderer() {
        return renderer;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }
}
