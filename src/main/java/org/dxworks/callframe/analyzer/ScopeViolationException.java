package org.dxworks.callframe.analyzer;

/**
 * The enter/exit notifications left the scope tracker in an impossible state:
 * an exit without a matching enter, or a declaration that needs an enclosing
 * class where none is open. Fatal for the file being processed.
 */
public class ScopeViolationException extends RuntimeException {

    public ScopeViolationException(String message) {
        super(message);
    }
}
