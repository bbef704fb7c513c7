package org.dxworks.callframe.model;

import java.util.ArrayList;
import java.util.List;

public class Method {
    public String name;
    public String returnType;
    public int startLine;
    public int endLine;
    public int depth;  // Depth of the declaration node in the syntax tree
    public List<Parameter> parameters = new ArrayList<>();
    public List<Statement> statements = new ArrayList<>();
}
