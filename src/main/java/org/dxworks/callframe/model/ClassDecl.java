package org.dxworks.callframe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClassDecl {
    public String name;
    public String extendsType = "";
    public List<String> implementsTypes = new ArrayList<>();
    public List<Field> fields = new ArrayList<>();
    public Map<String, Method> methods = new LinkedHashMap<>();
    public List<Statement> statements = new ArrayList<>();  // Calls made in the class body outside any method

    public ClassDecl() {
    }

    public ClassDecl(String name, String extendsType, List<String> implementsTypes) {
        this.name = name;
        this.extendsType = extendsType;
        this.implementsTypes.addAll(implementsTypes);
    }
}
