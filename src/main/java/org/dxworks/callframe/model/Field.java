package org.dxworks.callframe.model;

public class Field {
    public String type;
    public String define;  // Declarator text as the parser sees it, e.g. "count=0"

    public Field() {
    }

    public Field(String type, String define) {
        this.type = type;
        this.define = define;
    }
}
