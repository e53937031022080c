package com.pyast.ast;

import com.pyast.InternalConsistencyError;
import com.pyast.ops.OperatorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shape checks performed when a node is built.
 */
public class NodeConstructionTest {

    private final InternedStringPool pool = new InternedStringPool();

    private Name load(String id) {
        return new Name(pool.get(id), ExprContext.LOAD);
    }

    @Test
    void testMissingRequiredChildIsRejected() {
        InternalConsistencyError error = assertThrows(InternalConsistencyError.class,
            () -> new BinOp(null, OperatorKind.ADD, Num.ofInt(1)));
        assertTrue(error.getMessage().contains("BIN_OP"), error.getMessage());
        assertTrue(error.getMessage().contains("left"), error.getMessage());

        assertThrows(InternalConsistencyError.class, () -> new ExprStmt(null));
        assertThrows(InternalConsistencyError.class, () -> new Name(null, ExprContext.LOAD));
        assertThrows(InternalConsistencyError.class,
            () -> new Invoke(0, 0, new Pass(0, 0), null, new BlockRef(1)));
    }

    @Test
    void testNullListElementIsRejected() {
        List<Expr> targets = Arrays.asList(load("x"), null);
        assertThrows(InternalConsistencyError.class, () -> new Assign(targets, load("v")));
    }

    @Test
    void testOptionalChildrenMayBeAbsent() {
        assertNull(new Return(0, 0, null).value());
        assertNull(new Yield(0, 0, null).value());
        assertNull(new Assert(0, 0, load("x"), null).msg());
        assertNull(new With(0, 0, load("cm"), null, List.of(new Pass(0, 0))).optionalVars());
        assertNull(new ExceptHandler(0, 0, null, null, List.of(new Pass(0, 0))).type());
        assertTrue(new For(0, 0, load("i"), load("xs"), List.of(new Pass(0, 0)), List.of()).orelse().isEmpty());
    }

    @Test
    @DisplayName("raise accepts 0..3 arguments but never a later one without the earlier")
    void testRaiseArgumentOrdering() {
        assertDoesNotThrow(() -> new Raise(0, 0, null, null, null));
        assertDoesNotThrow(() -> new Raise(0, 0, load("E"), null, null));
        assertDoesNotThrow(() -> new Raise(0, 0, load("E"), load("v"), load("tb")));
        assertThrows(InternalConsistencyError.class, () -> new Raise(0, 0, null, load("v"), null));
        assertThrows(InternalConsistencyError.class, () -> new Raise(0, 0, load("E"), null, load("tb")));
    }

    @Test
    void testExecLocalsRequireGlobals() {
        assertDoesNotThrow(() -> new Exec(0, 0, new Str("code"), load("g"), null));
        assertThrows(InternalConsistencyError.class, () -> new Exec(0, 0, new Str("code"), null, load("l")));
    }

    @Test
    void testExceptHandlerNameRequiresType() {
        Name name = new Name(pool.get("e"), ExprContext.STORE);
        assertThrows(InternalConsistencyError.class,
            () -> new ExceptHandler(0, 0, null, name, List.of(new Pass(0, 0))));
    }

    @Test
    void testDictKeysAndValuesMustPair() {
        assertThrows(InternalConsistencyError.class,
            () -> new DictLiteral(List.of(Num.ofInt(1), Num.ofInt(2)), List.of(Num.ofInt(3))));
    }

    @Test
    void testCompareShape() {
        assertThrows(InternalConsistencyError.class,
            () -> new Compare(load("x"), List.of(), List.of()));
        assertThrows(InternalConsistencyError.class,
            () -> new Compare(load("x"), List.of(OperatorKind.LT), List.of(load("y"), load("z"))));
        assertDoesNotThrow(
            () -> new Compare(load("x"), List.of(OperatorKind.IS_NOT, OperatorKind.IN), List.of(load("y"), load("z"))));
    }

    @Test
    void testOperatorCategoryIsChecked() {
        assertThrows(InternalConsistencyError.class, () -> new BinOp(load("a"), OperatorKind.EQ, load("b")));
        assertThrows(InternalConsistencyError.class,
            () -> new Compare(load("a"), List.of(OperatorKind.ADD), List.of(load("b"))));
        assertThrows(InternalConsistencyError.class,
            () -> new BoolOp(0, 0, OperatorKind.BIT_AND, List.of(load("a"), load("b"))));
        assertThrows(InternalConsistencyError.class, () -> new UnaryOp(0, 0, OperatorKind.SUB, load("a")));
        assertThrows(InternalConsistencyError.class,
            () -> new AugAssign(0, 0, new Name(pool.get("a"), ExprContext.STORE), OperatorKind.LT, load("b")));
    }

    @Test
    void testArgumentsDefaultsCannotOutnumberArgs() {
        assertThrows(InternalConsistencyError.class,
            () -> new Arguments(0, 0, List.of(), List.of(Num.ofInt(1)), null, null));
    }

    @Test
    void testNegativeValuesAreRejected() {
        assertThrows(InternalConsistencyError.class, () -> new BlockRef(-1));
        assertThrows(InternalConsistencyError.class,
            () -> new ImportFrom(0, 0, pool.get("os"), List.of(new Alias(pool.get("path"), null)), -1));
    }

    @Test
    void testLongLiteralNeedsDigits() {
        assertThrows(InternalConsistencyError.class, () -> Num.ofLong(0, 0, null));
        assertEquals("123", Num.ofLong(0, 0, "123").nLong());
    }

    @Test
    void testListChildrenAreDefensiveCopies() {
        List<Stmt> body = new ArrayList<>();
        body.add(new Pass(0, 0));
        Suite suite = new Suite(0, 0, body);

        body.add(new Break(0, 0));

        assertEquals(1, suite.body().size());
        assertThrows(UnsupportedOperationException.class, () -> suite.body().add(new Continue(0, 0)));
    }

    @Test
    void testKindIsFixedByRecordType() {
        assertEquals(NodeKind.PASS, new Pass(0, 0).kind());
        assertEquals(NodeKind.EXPR, new ExprStmt(load("x")).kind());
        assertEquals(NodeKind.LIST, new ListLiteral(List.of(), ExprContext.LOAD).kind());
        assertEquals(NodeKind.PROGRAM, new Program(List.of(), pool).kind());
        assertEquals(NodeKind.Family.STATEMENT, new Pass(0, 0).kind().family());
        assertEquals(NodeKind.Family.EXPRESSION, load("x").kind().family());
    }

    @Test
    void testPositionsAreKept() {
        Name name = new Name(12, 4, pool.get("x"), ExprContext.LOAD);
        assertEquals(12, name.lineno());
        assertEquals(4, name.colOffset());
    }
}
