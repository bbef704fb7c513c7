package org.dxworks.callframe.model;

public class Parameter {
    public String type;
    public String name;

    public Parameter() {
    }

    public Parameter(String type, String name) {
        this.type = type;
        this.name = name;
    }
}
