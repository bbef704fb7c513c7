package org.dxworks.callframe.analyzer;

import org.dxworks.callframe.model.ClassDecl;
import org.dxworks.callframe.model.Parameter;
import org.dxworks.callframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads typed declarations out of syntax nodes purely by child position.
 * <p>
 * The positions mirror the productions of {@code JavaParser.g4}:
 * <pre>
 * classDeclaration  : CLASS identifier typeParameters? (EXTENDS typeType)? (IMPLEMENTS typeList)? (PERMITS typeList)? classBody
 * enumDeclaration   : ENUM identifier (IMPLEMENTS typeList)? '{' enumConstants? ','? enumBodyDeclarations? '}'
 * classCreatorRest  : arguments classBody?
 * enumConstant      : annotation* identifier arguments? classBody?
 * formalParameters  : '(' formalParameterList? ')'
 * </pre>
 * A grammar change that moves any of these children has to be reflected here.
 */
public final class StructuralDecoder {

    private static final String IMPLEMENTS = "implements";
    private static final String EXTENDS = "extends";

    private StructuralDecoder() {
        // utility class
    }

    /**
     * Decodes a class header by its number of children:
     * <ul>
     *   <li>7: {@code class Name extends Base implements List body}</li>
     *   <li>5: {@code class Name implements List body} or {@code class Name extends Base body}</li>
     *   <li>3: {@code class Name body}</li>
     *   <li>2: a bare class body (anonymous class, enum constant body), named after the
     *       class open at the current depth of {@code scope}</li>
     * </ul>
     *
     * @throws StructuralException      for any other shape
     * @throws ScopeViolationException  for a bare class body with no class open
     */
    public static ClassHeader decodeClassHeader(SyntaxNode node, ScopeTracker scope) {
        int childCount = node.getChildCount();
        String name = "";
        String extendsType = "";
        List<String> implementsTypes = List.of();

        switch (childCount) {
            case 7:
                name = node.getChild(1).getText();
                extendsType = firstChildText(node.getChild(3));
                implementsTypes = decodeImplementsList(node.getChild(5));
                break;
            case 5:
                name = node.getChild(1).getText();
                String keyword = node.getChild(2).getText();
                if (IMPLEMENTS.equals(keyword)) {
                    implementsTypes = decodeImplementsList(node.getChild(3));
                } else if (EXTENDS.equals(keyword)) {
                    extendsType = firstChildText(node.getChild(3));
                }
                break;
            case 3:
                name = node.getChild(1).getText();
                break;
            case 2:
                ClassDecl enclosing = scope.classAtCurrentDepth();
                if (enclosing == null) {
                    throw new ScopeViolationException("Class body at line " + node.getStartLine()
                            + " has no enclosing class at depth " + scope.getDepth());
                }
                name = enclosing.name;
                break;
            default:
                break;
        }

        if (name == null || name.isEmpty()) {
            throw new StructuralException("Class name is not found in " + node.getKind()
                    + " with " + childCount + " children at line " + node.getStartLine());
        }
        return new ClassHeader(name, extendsType, implementsTypes);
    }

    /**
     * A single child is the only interface; otherwise interfaces sit at even
     * indices with separators in between.
     */
    public static List<String> decodeImplementsList(SyntaxNode node) {
        List<String> result = new ArrayList<>();
        int childCount = node.getChildCount();
        if (childCount == 1) {
            result.add(node.getChild(0).getText());
        } else if (childCount > 1) {
            for (int i = 0; i < childCount; i += 2) {
                result.add(node.getChild(i).getText());
            }
        }
        return result;
    }

    /**
     * Decodes {@code '(' formalParameterList ')'}. Each parameter contributes its first
     * child as type and its second child as name. Anything but three children, such
     * as the empty {@code ()}, yields no parameters.
     */
    public static List<Parameter> decodeParameterList(SyntaxNode node) {
        List<Parameter> result = new ArrayList<>();
        if (node.getChildCount() != 3) {
            return result;
        }

        SyntaxNode list = node.getChild(1);
        int paramCount = list.getChildCount();
        if (paramCount == 1) {
            result.add(toParameter(list.getChild(0)));
        } else if (paramCount > 1) {
            for (int i = 0; i < paramCount; i += 2) {
                result.add(toParameter(list.getChild(i)));
            }
        }
        return result;
    }

    private static Parameter toParameter(SyntaxNode param) {
        return new Parameter(param.getChild(0).getText(), param.getChild(1).getText());
    }

    private static String firstChildText(SyntaxNode node) {
        if (node.getChildCount() == 0) {
            return node.getText();
        }
        return node.getChild(0).getText();
    }
}
