package org.dxworks.callframe.syntax;

/**
 * The grammar productions the call graph extraction reacts to.
 */
public enum ProductionKind {
    PACKAGE_DECLARATION("packageDeclaration"),
    IMPORT_DECLARATION("importDeclaration"),
    CLASS_DECLARATION("classDeclaration"),
    ENUM_DECLARATION("enumDeclaration"),
    FIELD_DECLARATION("fieldDeclaration"),
    METHOD_DECLARATION("methodDeclaration"),
    METHOD_CALL("methodCall");

    private final String ruleName;

    ProductionKind(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
