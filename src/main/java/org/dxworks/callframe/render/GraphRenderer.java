package org.dxworks.callframe.render;

import org.dxworks.callframe.model.FileModel;

/**
 * Turns a finished {@link FileModel} into text. Implementations only read the model,
 * so rendering the same model twice yields identical output.
 */
public interface GraphRenderer {

    String render(FileModel model);

    OutputFormat getFormat();
}
