package org.dxworks.callframe.analyzer;

import org.dxworks.callframe.model.ClassDecl;
import org.dxworks.callframe.model.Method;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks which class and method are open at the current point of a depth-first walk.
 * One instance per file; never shared between threads.
 */
public class ScopeTracker {

    private final MethodAttribution attribution;
    private final Map<Integer, ClassDecl> classesByDepth = new HashMap<>();
    private final Deque<Optional<Method>> suspendedMethods = new ArrayDeque<>();
    private int depth;
    private Method currentMethod;

    public ScopeTracker() {
        this(MethodAttribution.GLOBAL);
    }

    public ScopeTracker(MethodAttribution attribution) {
        this.attribution = attribution;
    }

    public void enterClass(ClassDecl decl) {
        depth++;
        classesByDepth.put(depth, decl);
        if (attribution == MethodAttribution.NESTED) {
            suspendedMethods.push(Optional.ofNullable(currentMethod));
            currentMethod = null;
        }
    }

    public void exitClass() {
        if (depth <= 0 || !classesByDepth.containsKey(depth)) {
            throw new ScopeViolationException("Class exit without a matching enter at depth " + depth);
        }
        classesByDepth.remove(depth);
        depth--;
        if (attribution == MethodAttribution.NESTED) {
            currentMethod = suspendedMethods.pop().orElse(null);
        }
    }

    public void enterMethod(Method method) {
        currentMethod = method;
    }

    public void exitMethod() {
        currentMethod = null;
    }

    /**
     * @throws ScopeViolationException when no class is open
     */
    public ClassDecl currentClass() {
        ClassDecl decl = classesByDepth.get(depth);
        if (decl == null) {
            throw new ScopeViolationException("No class is open at depth " + depth);
        }
        return decl;
    }

    /**
     * Same as {@link #currentClass()} but returns {@code null} instead of failing.
     */
    public ClassDecl classAtCurrentDepth() {
        return classesByDepth.get(depth);
    }

    /**
     * @return the open method, or {@code null} outside any method body
     */
    public Method currentMethod() {
        return currentMethod;
    }

    public int getDepth() {
        return depth;
    }

    public MethodAttribution getAttribution() {
        return attribution;
    }
}
