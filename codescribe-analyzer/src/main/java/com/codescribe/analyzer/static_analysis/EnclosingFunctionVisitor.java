package com.codescribe.analyzer.static_analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Syntax-tree visitor that maps each method and constructor to the calls made in its body.
 *
 * The enclosing function is tracked as a cursor that is set on entering a method or constructor and
 * restored on leaving it. By default calls inside local and anonymous classes are attributed to the
 * innermost declaration; with {@code typeMembersOnly} the cursor only moves for members of named types,
 * so those calls go to the enclosing member instead. Calls inside lambdas go to the method that
 * contains the lambda. Calls outside any
 * function body (field initializers, initializer blocks) are ignored, as are explicit
 * {@code this(..)} and {@code super(..)} constructor calls.
 */
public class EnclosingFunctionVisitor extends VoidVisitorAdapter<Void> {

    private final UnaryOperator<String> qualifier;
    private final boolean typeMembersOnly;
    private final Map<String, Set<Callee>> calls = new LinkedHashMap<>();
    private String currentFunction;

    public EnclosingFunctionVisitor() {
        this(UnaryOperator.identity());
    }

    /**
     * @param qualifier maps a bare function name to the key it is recorded under
     */
    public EnclosingFunctionVisitor(UnaryOperator<String> qualifier) {
        this(qualifier, false);
    }

    /**
     * @param qualifier maps a bare function name to the key it is recorded under
     * @param typeMembersOnly only methods and constructors that pass {@link #isTypeMember} become functions
     */
    public EnclosingFunctionVisitor(UnaryOperator<String> qualifier, boolean typeMembersOnly) {
        this.qualifier = qualifier;
        this.typeMembersOnly = typeMembersOnly;
    }

    /**
     * True when the declaration belongs to a top-level or nested named type, false inside anonymous
     * classes, local classes and enum constant bodies.
     */
    public static boolean isTypeMember(CallableDeclaration<?> declaration) {
        Node parent = declaration.getParentNode().orElse(null);
        while (parent instanceof TypeDeclaration) {
            parent = parent.getParentNode().orElse(null);
            if (parent instanceof CompilationUnit) return true;
        }
        return false;
    }

    /** Function key to the distinct callees seen in its body, in first-seen order. Includes functions without calls. */
    public Map<String, Set<Callee>> getCalls() {
        return calls;
    }

    @Override
    public void visit(MethodDeclaration node, Void arg) {
        if (typeMembersOnly && !isTypeMember(node)) {
            super.visit(node, arg);
            return;
        }
        String previous = enter(node.getNameAsString());
        try {
            super.visit(node, arg);
        } finally {
            currentFunction = previous;
        }
    }

    @Override
    public void visit(ConstructorDeclaration node, Void arg) {
        if (typeMembersOnly && !isTypeMember(node)) {
            super.visit(node, arg);
            return;
        }
        String previous = enter(node.getNameAsString());
        try {
            super.visit(node, arg);
        } finally {
            currentFunction = previous;
        }
    }

    @Override
    public void visit(MethodCallExpr node, Void arg) {
        if (currentFunction != null) {
            String text = node.getScope()
                .map(scope -> collapse(scope.toString()) + "." + node.getNameAsString())
                .orElse(node.getNameAsString());
            record(new Callee(text, node.getNameAsString()));
        }
        super.visit(node, arg);
    }

    @Override
    public void visit(ObjectCreationExpr node, Void arg) {
        if (currentFunction != null) {
            record(new Callee(node.getType().getNameWithScope(), node.getType().getNameAsString()));
        }
        super.visit(node, arg);
    }

    private String enter(String name) {
        String previous = currentFunction;
        currentFunction = qualifier.apply(name);
        calls.computeIfAbsent(currentFunction, k -> new LinkedHashSet<>());
        return previous;
    }

    private void record(Callee callee) {
        calls.get(currentFunction).add(callee);
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").strip();
    }
}
