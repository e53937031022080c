package com.pyast.ast;

import com.pyast.InternalConsistencyError;
import com.pyast.ops.OperatorCategory;
import com.pyast.ops.OperatorKind;

import java.util.List;

/**
 * Construction-time shape checks shared by the node records.
 */
final class NodeChecks {

    private NodeChecks() {
    }

    static <T> T required(T child, NodeKind kind, String field) {
        if (child == null) {
            throw new InternalConsistencyError(kind + " is missing required child '" + field + "'");
        }
        return child;
    }

    /**
     * Checks the list and its elements for nulls and returns an unmodifiable copy.
     */
    static <T> List<T> requiredList(List<T> children, NodeKind kind, String field) {
        if (children == null) {
            throw new InternalConsistencyError(kind + " is missing required list '" + field + "'");
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == null) {
                throw new InternalConsistencyError(kind + " has a null element at " + field + "[" + i + "]");
            }
        }
        return List.copyOf(children);
    }

    static <T> List<T> nonEmptyList(List<T> children, NodeKind kind, String field) {
        List<T> copy = requiredList(children, kind, field);
        if (copy.isEmpty()) {
            throw new InternalConsistencyError(kind + " requires at least one element in '" + field + "'");
        }
        return copy;
    }

    // e.g. raise's third argument is only meaningful after the second
    static void requireOrdered(Object earlier, Object later, NodeKind kind, String earlierField, String laterField) {
        if (later != null && earlier == null) {
            throw new InternalConsistencyError(kind + " has '" + laterField + "' without '" + earlierField + "'");
        }
    }

    static void sameSize(List<?> a, List<?> b, NodeKind kind, String aField, String bField) {
        if (a.size() != b.size()) {
            throw new InternalConsistencyError(kind + " has " + a.size() + " " + aField
                + " but " + b.size() + " " + bField);
        }
    }

    static OperatorKind operator(OperatorKind op, NodeKind kind, OperatorCategory category) {
        required(op, kind, "op");
        if (op.category() != category) {
            throw new InternalConsistencyError(kind + " cannot carry " + op.category() + " operator " + op);
        }
        return op;
    }
}
