package org.dxworks.callframe.analyzer;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.callframe.analyzer.generated.JavaLexer;
import org.dxworks.callframe.analyzer.generated.JavaParser;
import org.dxworks.callframe.syntax.SyntaxNode;

/**
 * {@link SyntaxNode} view over a node of the ANTLR parse tree produced by {@link JavaParser}.
 * Wrappers are created on demand and hold no state of their own.
 */
public final class AntlrSyntaxNode implements SyntaxNode {

    private final ParseTree tree;

    private AntlrSyntaxNode(ParseTree tree) {
        this.tree = tree;
    }

    public static AntlrSyntaxNode of(ParseTree tree) {
        return tree == null ? null : new AntlrSyntaxNode(tree);
    }

    @Override
    public String getKind() {
        if (tree instanceof ParserRuleContext) {
            return JavaParser.ruleNames[((ParserRuleContext) tree).getRuleIndex()];
        }
        if (tree instanceof TerminalNode) {
            return JavaLexer.VOCABULARY.getSymbolicName(((TerminalNode) tree).getSymbol().getType());
        }
        return tree.getClass().getSimpleName();
    }

    @Override
    public String getText() {
        return tree.getText();
    }

    @Override
    public int getChildCount() {
        return tree.getChildCount();
    }

    @Override
    public SyntaxNode getChild(int index) {
        return of(tree.getChild(index));
    }

    @Override
    public SyntaxNode getParent() {
        return of(tree.getParent());
    }

    @Override
    public int getStartLine() {
        Token start = startToken();
        return start == null ? 0 : start.getLine();
    }

    @Override
    public int getStartColumn() {
        Token start = startToken();
        return start == null ? 0 : start.getCharPositionInLine();
    }

    @Override
    public int getStopLine() {
        if (tree instanceof ParserRuleContext) {
            Token stop = ((ParserRuleContext) tree).getStop();
            if (stop != null) {
                return stop.getLine();
            }
        }
        return getStartLine();
    }

    @Override
    public int getDepth() {
        if (tree instanceof ParserRuleContext) {
            return ((ParserRuleContext) tree).depth();
        }
        ParseTree parent = tree.getParent();
        return parent == null ? 1 : of(parent).getDepth() + 1;
    }

    private Token startToken() {
        if (tree instanceof ParserRuleContext) {
            return ((ParserRuleContext) tree).getStart();
        }
        if (tree instanceof TerminalNode) {
            return ((TerminalNode) tree).getSymbol();
        }
        return null;
    }

    @Override
    public String toString() {
        return getKind() + "[" + getText() + "]";
    }
}
