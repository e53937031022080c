package com.pyast.ops;

import com.pyast.InternalConsistencyError;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves operator tags to the names the object model dispatches on.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * Operators.methodName(OperatorKind.ADD);   // "__add__"
 * Operators.inplaceName(OperatorKind.ADD);  // "__iadd__"
 * Operators.reverseName(OperatorKind.ADD);  // "__radd__"
 * Operators.reverseName(OperatorKind.LT);   // "__gt__"
 * }</pre>
 *
 * <p>Symbols and method names come from exhaustive switch expressions. The in-place and
 * reverse names are derived from them once, while this class initializes, and the resulting
 * maps are never written again. Every reverse name except a comparison's is the method name
 * with {@code r} after the leading underscores, so {@code in} maps to {@code __rcontains__}.</p>
 */
public final class Operators {

    private static final Map<OperatorKind, String> INPLACE_NAMES;
    private static final Map<OperatorKind, String> REVERSE_NAMES;

    static {
        Map<OperatorKind, String> inplace = new EnumMap<>(OperatorKind.class);
        Map<OperatorKind, String> reverse = new EnumMap<>(OperatorKind.class);
        for (OperatorKind op : OperatorKind.values()) {
            switch (op.category()) {
                case BINARY -> {
                    inplace.put(op, insertAfterDunder(methodName(op), 'i'));
                    reverse.put(op, insertAfterDunder(methodName(op), 'r'));
                }
                case COMPARISON -> reverse.put(op, methodName(reverseComparison(op)));
                case CONTAINMENT, BOOLEAN, UNARY -> reverse.put(op, insertAfterDunder(methodName(op), 'r'));
                case IDENTITY -> {
                    // identity tests have no swapped-operand fallback
                }
            }
        }
        INPLACE_NAMES = Collections.unmodifiableMap(inplace);
        REVERSE_NAMES = Collections.unmodifiableMap(reverse);
    }

    private Operators() {
        // Utility class
    }

    /**
     * The token shown for this operator in diagnostics.
     */
    public static String symbol(OperatorKind op) {
        return switch (op) {
            case ADD, UADD -> "+";
            case SUB, USUB -> "-";
            case MULT -> "*";
            case DIV, TRUE_DIV -> "/";
            case FLOOR_DIV -> "//";
            case MOD -> "%";
            case POW -> "**";
            case DIV_MOD -> "divmod()";
            case LSHIFT -> "<<";
            case RSHIFT -> ">>";
            case BIT_AND -> "&";
            case BIT_OR -> "|";
            case BIT_XOR -> "^";
            case EQ -> "==";
            case NOT_EQ -> "!=";
            case LT -> "<";
            case LT_E -> "<=";
            case GT -> ">";
            case GT_E -> ">=";
            case IS -> "is";
            case IS_NOT -> "is not";
            case IN -> "in";
            case NOT_IN -> "not in";
            case AND -> "and";
            case OR -> "or";
            case INVERT -> "~";
            case NOT -> "not";
        };
    }

    /**
     * The token of the augmented-assignment form, e.g. {@code +=}.
     */
    public static String inplaceSymbol(OperatorKind op) {
        requireCategory(op, OperatorCategory.BINARY, "in-place symbol");
        return symbol(op) + '=';
    }

    /**
     * The special method the object model looks up to execute this operator.
     * Containment tests dispatch on {@code __contains__}; truth tests on {@code __nonzero__}.
     */
    public static String methodName(OperatorKind op) {
        return switch (op) {
            case ADD -> "__add__";
            case SUB -> "__sub__";
            case MULT -> "__mul__";
            case DIV -> "__div__";
            case TRUE_DIV -> "__truediv__";
            case FLOOR_DIV -> "__floordiv__";
            case MOD -> "__mod__";
            case POW -> "__pow__";
            case DIV_MOD -> "__divmod__";
            case LSHIFT -> "__lshift__";
            case RSHIFT -> "__rshift__";
            case BIT_AND -> "__and__";
            case BIT_OR -> "__or__";
            case BIT_XOR -> "__xor__";
            case EQ -> "__eq__";
            case NOT_EQ -> "__ne__";
            case LT -> "__lt__";
            case LT_E -> "__le__";
            case GT -> "__gt__";
            case GT_E -> "__ge__";
            case IS -> "__is__";
            case IS_NOT -> "__isnot__";
            case IN, NOT_IN -> "__contains__";
            case AND, OR, NOT -> "__nonzero__";
            case INVERT -> "__invert__";
            case UADD -> "__pos__";
            case USUB -> "__neg__";
        };
    }

    /**
     * The special method used by augmented assignment, e.g. {@code __iadd__}.
     *
     * @throws InternalConsistencyError if {@code op} is not an arithmetic, bitwise or shift operator
     */
    public static String inplaceName(OperatorKind op) {
        String name = INPLACE_NAMES.get(op);
        if (name == null) {
            throw new InternalConsistencyError("No in-place method for operator " + op);
        }
        return name;
    }

    /**
     * The special method tried on the right operand, with operands swapped, when the left
     * operand cannot service the call: {@code __radd__} for {@code +}, {@code __gt__} for {@code <}.
     *
     * @throws InternalConsistencyError for {@code is} and {@code is not}
     */
    public static String reverseName(OperatorKind op) {
        String name = REVERSE_NAMES.get(op);
        if (name == null) {
            throw new InternalConsistencyError("No reverse-operand method for operator " + op);
        }
        return name;
    }

    /**
     * The comparison that holds with operands swapped: {@code a < b} iff {@code b > a}.
     *
     * @throws InternalConsistencyError if {@code op} is not an equality or ordering comparison
     */
    public static OperatorKind reverseComparison(OperatorKind op) {
        return switch (op) {
            case EQ -> OperatorKind.EQ;
            case NOT_EQ -> OperatorKind.NOT_EQ;
            case LT -> OperatorKind.GT;
            case GT -> OperatorKind.LT;
            case LT_E -> OperatorKind.GT_E;
            case GT_E -> OperatorKind.LT_E;
            default -> throw new InternalConsistencyError("Operator " + op + " has no swapped comparison");
        };
    }

    private static void requireCategory(OperatorKind op, OperatorCategory category, String what) {
        if (op.category() != category) {
            throw new InternalConsistencyError("No " + what + " for " + op.category() + " operator " + op);
        }
    }

    // "__add__" -> "__iadd__"
    private static String insertAfterDunder(String methodName, char marker) {
        return "__" + marker + methodName.substring(2);
    }
}
