package org.dxworks.callframe.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.callframe.model.FileModel;

import java.io.UncheckedIOException;

/**
 * Renders the complete model (package, imports, classes with fields, methods and statements) as JSON.
 */
public class JsonModelRenderer implements GraphRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String render(FileModel model) {
        try {
            return MAPPER.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize model of " + model.filePath, e);
        }
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }
}
