package org.dxworks.callframe.analyzer;

/**
 * How calls are attributed once a class is declared inside a method body.
 */
public enum MethodAttribution {
    /**
     * One current-method pointer for the whole file. A local class leaves the outer
     * method as current until one of its own methods is entered; after that, the
     * outer method's remaining calls land on the class-level statements.
     */
    GLOBAL,
    /**
     * Entering a class suspends the current method and exiting the class resumes it,
     * so calls after a local class stay on the outer method.
     */
    NESTED
}
