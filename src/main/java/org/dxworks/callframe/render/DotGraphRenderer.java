package org.dxworks.callframe.render;

import org.dxworks.callframe.model.ClassDecl;
import org.dxworks.callframe.model.FileModel;
import org.dxworks.callframe.model.Method;
import org.dxworks.callframe.model.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a Graphviz digraph: one node per class and method, a containment edge from each
 * class to its methods and one call edge per recorded statement. Repeated calls produce
 * repeated edges, so edge multiplicity is the call count.
 */
public class DotGraphRenderer implements GraphRenderer {

    static final String GRAPH_NAME = "callGraph";

    @Override
    public String render(FileModel model) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph " + quote(GRAPH_NAME) + " {");
        for (ClassDecl classDecl : model.classes.values()) {
            lines.add(quote(classDecl.name));
            for (Statement statement : classDecl.statements) {
                lines.add(edge(classDecl.name, statement.value));
            }
            for (Method method : classDecl.methods.values()) {
                lines.add(quote(method.name));
                lines.add(edge(classDecl.name, method.name));
                for (Statement statement : method.statements) {
                    lines.add(edge(method.name, statement.value));
                }
            }
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.DOT;
    }

    private static String edge(String from, String to) {
        return quote(from) + " -> " + quote(to) + ";";
    }

    private static String quote(String id) {
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
