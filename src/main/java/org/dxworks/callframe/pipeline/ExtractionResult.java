package org.dxworks.callframe.pipeline;

import org.dxworks.callframe.analyzer.Diagnostic;
import org.dxworks.callframe.model.FileModel;

import java.util.List;

public final class ExtractionResult {
    private final FileModel model;
    private final List<Diagnostic> diagnostics;

    public ExtractionResult(FileModel model, List<Diagnostic> diagnostics) {
        this.model = model;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public FileModel getModel() {
        return model;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
