package org.dxworks.callframe.analyzer;

import org.dxworks.callframe.model.ClassDecl;
import org.dxworks.callframe.model.Field;
import org.dxworks.callframe.model.FileModel;
import org.dxworks.callframe.model.Method;
import org.dxworks.callframe.model.Statement;
import org.dxworks.callframe.syntax.ProductionKind;
import org.dxworks.callframe.syntax.SyntaxNode;
import org.dxworks.callframe.syntax.TraversalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds a {@link FileModel} from the enter/exit notifications of one file's syntax tree.
 * <p>
 * The notifications carry no semantic labels beyond the production kind, so declarations
 * are read off their children with {@link StructuralDecoder} and attributed to whatever
 * class and method the {@link ScopeTracker} reports as open. Two naming conflicts are
 * resolved by policy and reported as {@link Diagnostic}s: a redeclared class replaces the
 * earlier one, and a second method with a known name is skipped.
 */
public class CallGraphCollector implements TraversalListener {

    private static final Logger log = LoggerFactory.getLogger(CallGraphCollector.class);

    // fieldDeclaration -> memberDeclaration -> classBodyDeclaration -> classBody -> declaration
    private static final int FIELD_TO_CLASS_LEVELS = 4;

    private final FileModel model = new FileModel();
    private final ScopeTracker scope;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public CallGraphCollector() {
        this(MethodAttribution.GLOBAL);
    }

    public CallGraphCollector(MethodAttribution attribution) {
        this.scope = new ScopeTracker(attribution);
    }

    @Override
    public void enter(ProductionKind kind, SyntaxNode node) {
        stage("enter " + kind + ": " + node.getStartLine());
        switch (kind) {
            case PACKAGE_DECLARATION:
                model.packageName = qualifiedName(node);
                break;
            case IMPORT_DECLARATION:
                model.imports.add(qualifiedName(node));
                break;
            case CLASS_DECLARATION:
            case ENUM_DECLARATION:
                enterClass(node);
                break;
            case FIELD_DECLARATION:
                enterField(node);
                break;
            case METHOD_DECLARATION:
                enterMethod(node);
                break;
            case METHOD_CALL:
                enterMethodCall(node);
                break;
            default:
                break;
        }
    }

    @Override
    public void exit(ProductionKind kind, SyntaxNode node) {
        stage("exit " + kind + ": " + node.getStartLine());
        switch (kind) {
            case CLASS_DECLARATION:
            case ENUM_DECLARATION:
                scope.exitClass();
                break;
            case METHOD_DECLARATION:
                scope.exitMethod();
                break;
            default:
                break;
        }
    }

    private void enterClass(SyntaxNode node) {
        ClassHeader header = StructuralDecoder.decodeClassHeader(node, scope);
        ClassDecl decl = new ClassDecl(header.getName(), header.getExtendsType(), header.getImplementsTypes());

        if (model.classes.containsKey(decl.name)) {
            signal(new Diagnostic(Diagnostic.Kind.CLASS_REDECLARED, decl.name, decl.name, node.getStartLine()));
            log.warn("{} is declared again at line {}, the later declaration replaces the earlier one.",
                    decl.name, node.getStartLine());
        }
        model.classes.put(decl.name, decl);
        scope.enterClass(decl);
    }

    private void enterField(SyntaxNode node) {
        SyntaxNode declaration = node.getAncestor(FIELD_TO_CLASS_LEVELS);
        if (declaration == null) {
            throw new StructuralException("Field at line " + node.getStartLine() + " has no enclosing declaration");
        }
        String className = StructuralDecoder.decodeClassHeader(declaration, scope).getName();
        ClassDecl current = scope.currentClass();
        if (!className.equals(current.name)) {
            throw new StructuralException("Class name " + className + " is not equal " + current.name
                    + " for field at line " + node.getStartLine());
        }
        current.fields.add(new Field(node.getChild(0).getText(), node.getChild(1).getText()));
    }

    private void enterMethod(SyntaxNode node) {
        String methodName = node.getChild(1).getText();
        ClassDecl current = scope.currentClass();

        if (current.methods.containsKey(methodName)) {
            signal(new Diagnostic(Diagnostic.Kind.OVERLOAD_COLLISION, current.name, methodName, node.getStartLine()));
            log.warn("{}.{} at line {} is an overload, only the first declaration is kept.",
                    current.name, methodName, node.getStartLine());
            return;
        }

        Method method = new Method();
        method.name = methodName;
        method.returnType = node.getChild(0).getText();
        method.startLine = node.getStartLine();
        method.endLine = node.getStopLine();
        method.depth = node.getDepth();
        method.parameters.addAll(StructuralDecoder.decodeParameterList(node.getChild(2)));

        current.methods.put(methodName, method);
        scope.enterMethod(method);
    }

    private void enterMethodCall(SyntaxNode node) {
        Statement statement = new Statement(node.getChild(0).getText(), node.getStartLine(), node.getStartColumn());
        Method method = scope.currentMethod();
        // No open method: initializer block, constructor or field initializer
        if (method == null) {
            scope.currentClass().statements.add(statement);
        } else {
            method.statements.add(statement);
        }
    }

    private static String qualifiedName(SyntaxNode node) {
        SyntaxNode name = node.findChild("qualifiedName");
        if (name == null) {
            throw new StructuralException("No qualified name in " + node.getKind() + " at line " + node.getStartLine());
        }
        return name.getText();
    }

    private void signal(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    private void stage(String stage) {
        if (log.isDebugEnabled()) {
            log.debug("depth={} - {}", scope.getDepth(), stage);
        }
    }

    public FileModel getFileModel() {
        return model;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public ScopeTracker getScope() {
        return scope;
    }
}
