package org.dxworks.callframe.analyzer;

import org.dxworks.callframe.model.ClassDecl;
import org.dxworks.callframe.model.FileModel;
import org.dxworks.callframe.model.Method;
import org.dxworks.callframe.model.Statement;
import org.dxworks.callframe.syntax.ProductionKind;
import org.dxworks.callframe.syntax.StubSyntaxNode;
import org.dxworks.callframe.syntax.SyntaxNode;
import org.dxworks.callframe.syntax.TraversalListener;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.callframe.syntax.StubSyntaxNode.leaf;
import static org.dxworks.callframe.syntax.StubSyntaxNode.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallGraphCollectorTest {

    private static CallGraphCollector collect(String source) {
        return collect(source, MethodAttribution.GLOBAL);
    }

    private static CallGraphCollector collect(String source, MethodAttribution attribution) {
        CallGraphCollector collector = new CallGraphCollector(attribution);
        JavaParserFactory.walk(source, collector);
        return collector;
    }

    private static List<String> values(List<Statement> statements) {
        return statements.stream().map(s -> s.value).collect(Collectors.toList());
    }

    @Test
    void packageClassMethodAndCallsInSourceOrder() {
        String source = String.join("\n",
                "package com.example;",
                "",
                "public class Greeter {",
                "    public void greet() {",
                "        foo();",
                "        bar();",
                "    }",
                "}");

        FileModel model = collect(source).getFileModel();

        assertEquals("com.example", model.packageName);
        assertEquals(List.of("Greeter"), List.copyOf(model.classes.keySet()));
        ClassDecl greeter = model.classes.get("Greeter");
        assertEquals(List.of("greet"), List.copyOf(greeter.methods.keySet()));
        assertTrue(greeter.statements.isEmpty());

        Method greet = greeter.methods.get("greet");
        assertEquals("void", greet.returnType);
        assertEquals(4, greet.startLine);
        assertEquals(7, greet.endLine);
        assertEquals(7, greet.depth);
        assertTrue(greet.parameters.isEmpty());
        assertEquals(List.of("foo", "bar"), values(greet.statements));
        assertEquals(5, greet.statements.get(0).line);
        assertEquals(8, greet.statements.get(0).column);
        assertEquals(6, greet.statements.get(1).line);
    }

    @Test
    void importsKeepOrderAndDuplicates() {
        String source = String.join("\n",
                "import java.util.List;",
                "import static java.util.Objects.requireNonNull;",
                "import java.util.*;",
                "import java.util.List;",
                "class Empty {}");

        FileModel model = collect(source).getFileModel();

        assertEquals("", model.packageName);
        assertEquals(List.of("java.util.List", "java.util.Objects.requireNonNull", "java.util", "java.util.List"),
                model.imports);
    }

    @Test
    void headerExtendsImplementsAndParameters() {
        String source = String.join("\n",
                "class Child extends Base implements Runnable, Comparable<Child> {",
                "    public int add(int a, List<String> names) { return a; }",
                "}",
                "class Task implements Runnable {}",
                "class Special extends Base {}");

        FileModel model = collect(source).getFileModel();

        ClassDecl child = model.classes.get("Child");
        assertEquals("Base", child.extendsType);
        assertEquals(List.of("Runnable", "Comparable<Child>"), child.implementsTypes);
        Method add = child.methods.get("add");
        assertEquals("int", add.returnType);
        assertEquals(2, add.parameters.size());
        assertEquals("int", add.parameters.get(0).type);
        assertEquals("a", add.parameters.get(0).name);
        assertEquals("List<String>", add.parameters.get(1).type);
        assertEquals("names", add.parameters.get(1).name);

        assertEquals(List.of("Runnable"), model.classes.get("Task").implementsTypes);
        assertEquals("", model.classes.get("Task").extendsType);
        assertEquals("Base", model.classes.get("Special").extendsType);
    }

    @Test
    void fieldsRecordTypeAndDeclarator() {
        String source = String.join("\n",
                "class Counter {",
                "    private int count = 0;",
                "    String label;",
                "}");

        ClassDecl counter = collect(source).getFileModel().classes.get("Counter");

        assertEquals(2, counter.fields.size());
        assertEquals("int", counter.fields.get(0).type);
        assertEquals("count=0", counter.fields.get(0).define);
        assertEquals("String", counter.fields.get(1).type);
        assertEquals("label", counter.fields.get(1).define);
    }

    @Test
    void overloadKeepsFirstMethodAndSignalsCollision() {
        String source = String.join("\n",
                "class Overloads {",
                "    void m(int a) { first(); }",
                "    void m(String s, int t) { second(); }",
                "}");

        CallGraphCollector collector = collect(source);
        ClassDecl overloads = collector.getFileModel().classes.get("Overloads");

        assertEquals(List.of("m"), List.copyOf(overloads.methods.keySet()));
        Method m = overloads.methods.get("m");
        assertEquals(1, m.parameters.size());
        assertEquals("int", m.parameters.get(0).type);
        assertEquals(List.of("first"), values(m.statements));
        assertEquals(List.of("second"), values(overloads.statements));

        assertEquals(1, collector.getDiagnostics().size());
        Diagnostic diagnostic = collector.getDiagnostics().get(0);
        assertEquals(Diagnostic.Kind.OVERLOAD_COLLISION, diagnostic.getKind());
        assertEquals("Overloads", diagnostic.getClassName());
        assertEquals("m", diagnostic.getMemberName());
        assertEquals(3, diagnostic.getLine());
    }

    @Test
    void callsOutsideMethodsGoToClassStatements() {
        String source = String.join("\n",
                "class Init {",
                "    static { setup(); }",
                "    { prepare(); }",
                "    private final Helper helper = create();",
                "    Init() { construct(); }",
                "}");

        ClassDecl init = collect(source).getFileModel().classes.get("Init");

        assertTrue(init.methods.isEmpty());
        assertEquals(List.of("setup", "prepare", "create", "construct"), values(init.statements));
    }

    @Test
    void chainedCallsAreRecordedInSourceOrder() {
        String source = String.join("\n",
                "class Chain {",
                "    void run() { db.query().debug().print(output()); }",
                "}");

        Method run = collect(source).getFileModel().classes.get("Chain").methods.get("run");

        assertEquals(List.of("query", "debug", "print", "output"), values(run.statements));
    }

    @Test
    void nestedClassesAreRecordedAndScopeUnwinds() {
        String source = String.join("\n",
                "class Outer {",
                "    class Inner {",
                "        void work() { innerCall(); }",
                "    }",
                "    void after() { outerCall(); }",
                "}");

        CallGraphCollector collector = collect(source);
        FileModel model = collector.getFileModel();

        assertEquals(List.of("Outer", "Inner"), List.copyOf(model.classes.keySet()));
        assertEquals(List.of("innerCall"), values(model.classes.get("Inner").methods.get("work").statements));
        assertEquals(List.of("outerCall"), values(model.classes.get("Outer").methods.get("after").statements));
        assertEquals(0, collector.getScope().getDepth());
    }

    @Test
    void enumIsTrackedLikeAClass() {
        String source = String.join("\n",
                "enum Operation {",
                "    PLUS {",
                "        int base = 1;",
                "        int apply() { return calc(); }",
                "    }",
                "}");

        ClassDecl operation = collect(source).getFileModel().classes.get("Operation");

        assertEquals(1, operation.fields.size());
        assertEquals("base=1", operation.fields.get(0).define);
        assertEquals(List.of("calc"), values(operation.methods.get("apply").statements));
    }

    @Test
    void enumWithBodyDeclarationsIsStructuralError() {
        String source = String.join("\n",
                "enum Status {",
                "    ACTIVE;",
                "    boolean isActive() { return true; }",
                "}");

        assertThrows(StructuralException.class, () -> collect(source));
    }

    @Test
    void genericClassIsStructuralError() {
        assertThrows(StructuralException.class, () -> collect("class Box<T> { T value; }"));
    }

    @Test
    void anonymousClassMembersBelongToEnclosingClass() {
        String source = String.join("\n",
                "class Outer {",
                "    void run() {",
                "        Runnable r = new Runnable() {",
                "            int counter = 0;",
                "            public void execute() { tick(); }",
                "        };",
                "        after();",
                "    }",
                "}");

        ClassDecl outer = collect(source).getFileModel().classes.get("Outer");

        assertEquals(1, outer.fields.size());
        assertEquals("counter=0", outer.fields.get(0).define);
        assertEquals(List.of("run", "execute"), List.copyOf(outer.methods.keySet()));
        assertEquals(List.of("tick"), values(outer.methods.get("execute").statements));
        // execute() cleared the method pointer, so the rest of run() lands on the class
        assertEquals(List.of("after"), values(outer.statements));
        assertTrue(outer.methods.get("run").statements.isEmpty());
    }

    private static final String LOCAL_CLASS_SOURCE = String.join("\n",
            "class Host {",
            "    void outer() {",
            "        before();",
            "        class Local {",
            "            void inner() { innerCall(); }",
            "        }",
            "        after();",
            "    }",
            "}");

    @Test
    void globalAttributionLosesOuterMethodAfterLocalClass() {
        FileModel model = collect(LOCAL_CLASS_SOURCE, MethodAttribution.GLOBAL).getFileModel();

        ClassDecl host = model.classes.get("Host");
        assertEquals(List.of("before"), values(host.methods.get("outer").statements));
        assertEquals(List.of("after"), values(host.statements));
        assertEquals(List.of("innerCall"), values(model.classes.get("Local").methods.get("inner").statements));
    }

    @Test
    void nestedAttributionKeepsOuterMethodAfterLocalClass() {
        FileModel model = collect(LOCAL_CLASS_SOURCE, MethodAttribution.NESTED).getFileModel();

        ClassDecl host = model.classes.get("Host");
        assertEquals(List.of("before", "after"), values(host.methods.get("outer").statements));
        assertTrue(host.statements.isEmpty());
        assertEquals(List.of("innerCall"), values(model.classes.get("Local").methods.get("inner").statements));
    }

    @Test
    void redeclaredClassReplacesEarlierOne() {
        String source = String.join("\n",
                "class A { class Node { void a() {} } }",
                "class B { class Node { void b() {} } }");

        CallGraphCollector collector = collect(source);
        FileModel model = collector.getFileModel();

        assertEquals(List.of("A", "Node", "B"), List.copyOf(model.classes.keySet()));
        assertEquals(List.of("b"), List.copyOf(model.classes.get("Node").methods.keySet()));
        assertEquals(1, collector.getDiagnostics().size());
        assertEquals(Diagnostic.Kind.CLASS_REDECLARED, collector.getDiagnostics().get(0).getKind());
        assertEquals(2, collector.getDiagnostics().get(0).getLine());
    }

    @Test
    void scopeDepthNeverGoesNegative() {
        String source = String.join("\n",
                "class Level1 {",
                "    class Level2 {",
                "        class Level3 { void deep() { call(); } }",
                "        void mid() { call(); }",
                "    }",
                "    enum Mode { ON, OFF }",
                "    void top() { call(); }",
                "}",
                "class Sibling { void other() { call(); } }");

        CallGraphCollector collector = new CallGraphCollector();
        int[] maxDepth = {0};
        TraversalListener checking = new TraversalListener() {
            @Override
            public void enter(ProductionKind kind, SyntaxNode node) {
                collector.enter(kind, node);
                assertTrue(collector.getScope().getDepth() >= 0);
                maxDepth[0] = Math.max(maxDepth[0], collector.getScope().getDepth());
            }

            @Override
            public void exit(ProductionKind kind, SyntaxNode node) {
                collector.exit(kind, node);
                assertTrue(collector.getScope().getDepth() >= 0);
            }
        };

        JavaParserFactory.walk(source, checking);

        assertEquals(3, maxDepth[0]);
        assertEquals(0, collector.getScope().getDepth());
        assertEquals(5, collector.getFileModel().classes.size());
    }

    @Test
    void fieldWhoseClassDisagreesWithScopeIsStructuralError() {
        StubSyntaxNode field = node("fieldDeclaration", leaf("int"), leaf("x=1"), leaf(";"));
        node("classDeclaration", leaf("class"), leaf("Other"),
                node("classBody", leaf("{"),
                        node("classBodyDeclaration", node("memberDeclaration", field)),
                        leaf("}")));
        StubSyntaxNode tracked = node("classDeclaration", leaf("class"), leaf("Tracked"),
                node("classBody", leaf("{"), leaf("}")));

        CallGraphCollector collector = new CallGraphCollector();
        collector.enter(ProductionKind.CLASS_DECLARATION, tracked);

        StructuralException e = assertThrows(StructuralException.class,
                () -> collector.enter(ProductionKind.FIELD_DECLARATION, field));
        assertTrue(e.getMessage().contains("Other"));
        assertTrue(e.getMessage().contains("Tracked"));
    }

    @Test
    void callOutsideAnyClassIsScopeViolation() {
        StubSyntaxNode call = node("methodCall", leaf("run"), node("arguments", leaf("("), leaf(")")));

        assertThrows(ScopeViolationException.class,
                () -> new CallGraphCollector().enter(ProductionKind.METHOD_CALL, call));
    }
}
