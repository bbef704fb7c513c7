package org.dxworks.callframe.analyzer;

import java.util.List;

/**
 * Name, superclass and interfaces read off a class or enum declaration node.
 */
public final class ClassHeader {
    private final String name;
    private final String extendsType;
    private final List<String> implementsTypes;

    public ClassHeader(String name, String extendsType, List<String> implementsTypes) {
        this.name = name;
        this.extendsType = extendsType;
        this.implementsTypes = List.copyOf(implementsTypes);
    }

    public String getName() {
        return name;
    }

    public String getExtendsType() {
        return extendsType;
    }

    public List<String> getImplementsTypes() {
        return implementsTypes;
    }
}
