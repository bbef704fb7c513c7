package org.dxworks.callframe.analyzer;

/**
 * A syntax node did not have one of the shapes the extraction knows how to read,
 * or a re-derived declaration disagrees with the scope being tracked.
 * Fatal for the file being processed.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }
}
