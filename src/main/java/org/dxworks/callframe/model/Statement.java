package org.dxworks.callframe.model;

/**
 * One recorded call expression. {@code value} is the callee text exactly as written
 * (a method name, {@code this} or {@code super}), not a resolved symbol.
 */
public class Statement {
    public String value;
    public int line;
    public int column;

    public Statement() {
    }

    public Statement(String value, int line, int column) {
        this.value = value;
        this.line = line;
        this.column = column;
    }
}
