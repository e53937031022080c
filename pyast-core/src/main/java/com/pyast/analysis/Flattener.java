package com.pyast.analysis;

import com.pyast.ast.AbstractAstVisitor;
import com.pyast.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Linearizes trees into the pre-order sequence a full visit would produce.
 *
 * <p>With {@code expandScopes == false}, nodes that open a new lexical scope (function and class
 * definitions, lambdas, comprehensions, generator expressions, modules) appear in the result but
 * nothing inside them does. A root that is itself such a node is therefore returned alone.</p>
 */
public final class Flattener {

    private Flattener() {
        // Utility class
    }

    public static List<Node> flatten(List<? extends Node> roots, boolean expandScopes) {
        FlattenVisitor visitor = new FlattenVisitor(expandScopes);
        for (Node root : roots) {
            root.accept(visitor);
        }
        return Collections.unmodifiableList(visitor.output);
    }

    public static List<Node> flatten(Node root, boolean expandScopes) {
        return flatten(List.of(root), expandScopes);
    }

    private static final class FlattenVisitor extends AbstractAstVisitor {

        private final List<Node> output = new ArrayList<>();
        private final boolean expandScopes;

        FlattenVisitor(boolean expandScopes) {
            this.expandScopes = expandScopes;
        }

        @Override
        protected boolean visitNode(Node node) {
            output.add(node);
            return expandScopes || !node.kind().isScopeBoundary();
        }
    }
}
