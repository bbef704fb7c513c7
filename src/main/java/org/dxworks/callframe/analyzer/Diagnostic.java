package org.dxworks.callframe.analyzer;

/**
 * A recoverable condition met while building the model. The declaration it refers
 * to was dropped or replaced, but extraction continued.
 */
public final class Diagnostic {

    public enum Kind {
        /** A method with an already recorded name; the first declaration is kept. */
        OVERLOAD_COLLISION,
        /** A class with an already recorded name; the last declaration is kept. */
        CLASS_REDECLARED
    }

    private final Kind kind;
    private final String className;
    private final String memberName;
    private final int line;

    public Diagnostic(Kind kind, String className, String memberName, int line) {
        this.kind = kind;
        this.className = className;
        this.memberName = memberName;
        this.line = line;
    }

    public Kind getKind() {
        return kind;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Method name for {@link Kind#OVERLOAD_COLLISION}, class name again for
     * {@link Kind#CLASS_REDECLARED}.
     */
    public String getMemberName() {
        return memberName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return kind + " " + className + (memberName.equals(className) ? "" : "." + memberName) + " at line " + line;
    }
}
