package com.pyast.ast;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class NodeKindTest {

    @Test
    void testScopeBoundaries() {
        Set<NodeKind> boundaries = Arrays.stream(NodeKind.values())
            .filter(NodeKind::isScopeBoundary)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(NodeKind.class)));

        assertEquals(EnumSet.of(
            NodeKind.FUNCTION_DEF, NodeKind.CLASS_DEF, NodeKind.LAMBDA,
            NodeKind.LIST_COMP, NodeKind.SET_COMP, NodeKind.DICT_COMP, NodeKind.GENERATOR_EXP,
            NodeKind.PROGRAM), boundaries);
    }

    @Test
    void testFamilies() {
        long statements = Arrays.stream(NodeKind.values())
            .filter(kind -> kind.family() == NodeKind.Family.STATEMENT)
            .count();
        long roots = Arrays.stream(NodeKind.values())
            .filter(kind -> kind.family() == NodeKind.Family.ROOT)
            .count();

        assertEquals(24, statements);
        assertEquals(3, roots);
        assertEquals(NodeKind.Family.AUXILIARY, NodeKind.EXCEPT_HANDLER.family());
        assertEquals(NodeKind.Family.EXPRESSION, NodeKind.LANG_PRIMITIVE.family());
    }
}
