package org.dxworks.callframe.analyzer;

import org.dxworks.callframe.analyzer.generated.JavaParser;
import org.dxworks.callframe.analyzer.generated.JavaParserBaseListener;
import org.dxworks.callframe.syntax.ProductionKind;
import org.dxworks.callframe.syntax.TraversalListener;

/**
 * ANTLR listener that forwards the productions of interest to a {@link TraversalListener}
 * as {@link AntlrSyntaxNode}s. Enum declarations are reported as their own kind;
 * the collector treats them like classes.
 */
public class JavaTreeBridge extends JavaParserBaseListener {

    private final TraversalListener listener;

    public JavaTreeBridge(TraversalListener listener) {
        this.listener = listener;
    }

    @Override
    public void enterPackageDeclaration(JavaParser.PackageDeclarationContext ctx) {
        listener.enter(ProductionKind.PACKAGE_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitPackageDeclaration(JavaParser.PackageDeclarationContext ctx) {
        listener.exit(ProductionKind.PACKAGE_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterImportDeclaration(JavaParser.ImportDeclarationContext ctx) {
        listener.enter(ProductionKind.IMPORT_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitImportDeclaration(JavaParser.ImportDeclarationContext ctx) {
        listener.exit(ProductionKind.IMPORT_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterClassDeclaration(JavaParser.ClassDeclarationContext ctx) {
        listener.enter(ProductionKind.CLASS_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitClassDeclaration(JavaParser.ClassDeclarationContext ctx) {
        listener.exit(ProductionKind.CLASS_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterEnumDeclaration(JavaParser.EnumDeclarationContext ctx) {
        listener.enter(ProductionKind.ENUM_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitEnumDeclaration(JavaParser.EnumDeclarationContext ctx) {
        listener.exit(ProductionKind.ENUM_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterFieldDeclaration(JavaParser.FieldDeclarationContext ctx) {
        listener.enter(ProductionKind.FIELD_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitFieldDeclaration(JavaParser.FieldDeclarationContext ctx) {
        listener.exit(ProductionKind.FIELD_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterMethodDeclaration(JavaParser.MethodDeclarationContext ctx) {
        listener.enter(ProductionKind.METHOD_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitMethodDeclaration(JavaParser.MethodDeclarationContext ctx) {
        listener.exit(ProductionKind.METHOD_DECLARATION, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void enterMethodCall(JavaParser.MethodCallContext ctx) {
        listener.enter(ProductionKind.METHOD_CALL, AntlrSyntaxNode.of(ctx));
    }

    @Override
    public void exitMethodCall(JavaParser.MethodCallContext ctx) {
        listener.exit(ProductionKind.METHOD_CALL, AntlrSyntaxNode.of(ctx));
    }
}
