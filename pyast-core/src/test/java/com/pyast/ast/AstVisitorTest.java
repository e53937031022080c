package com.pyast.ast;

import com.pyast.ops.OperatorKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstVisitorTest {

    private final InternedStringPool pool = new InternedStringPool();

    private Name load(String id) {
        return new Name(pool.get(id), ExprContext.LOAD);
    }

    private Name store(String id) {
        return new Name(pool.get(id), ExprContext.STORE);
    }

    /**
     * Records every node in visit order. Equal records are distinct nodes here, so lookups
     * compare by identity.
     */
    private static class RecordingVisitor extends AbstractAstVisitor {
        final List<Node> visited = new ArrayList<>();

        @Override
        protected boolean visitNode(Node node) {
            visited.add(node);
            return true;
        }

        int indexOf(Node node) {
            for (int i = 0; i < visited.size(); i++) {
                if (visited.get(i) == node) {
                    return i;
                }
            }
            return -1;
        }
    }

    private static List<Node> visitAll(Node root) {
        RecordingVisitor visitor = new RecordingVisitor();
        root.accept(visitor);
        return visitor.visited;
    }

    @Test
    void testAssignVisitsValueBeforeTargets() {
        Name t1 = store("x");
        Attribute t2 = new Attribute(load("x"), pool.get("a"), ExprContext.STORE);
        Name v = load("v");
        Assign assign = new Assign(List.of(t1, t2), v);

        RecordingVisitor visitor = new RecordingVisitor();
        assign.accept(visitor);

        assertSame(assign, visitor.visited.get(0));
        assertTrue(visitor.indexOf(v) < visitor.indexOf(t1));
        assertTrue(visitor.indexOf(t1) < visitor.indexOf(t2));
        assertEquals(5, visitor.visited.size());
    }

    @Test
    void testBinOpVisitsLeftThenRight() {
        Num left = Num.ofInt(1);
        Num right = Num.ofInt(2);
        BinOp binOp = new BinOp(left, OperatorKind.ADD, right);

        List<Node> visited = visitAll(binOp);

        assertEquals(3, visited.size());
        assertSame(binOp, visited.get(0));
        assertSame(left, visited.get(1));
        assertSame(right, visited.get(2));
    }

    @Test
    void testCallVisitsCalleeArgsKeywordsStarargsKwargs() {
        Name func = load("f");
        Name arg = load("a");
        Name keywordValue = load("v");
        Keyword keyword = new Keyword(pool.get("k"), keywordValue);
        Name starargs = load("args");
        Name kwargs = load("kw");
        Call call = new Call(0, 0, func, List.of(arg), List.of(keyword), starargs, kwargs);

        List<Node> visited = visitAll(call);

        assertEquals(7, visited.size());
        assertSame(call, visited.get(0));
        assertSame(func, visited.get(1));
        assertSame(arg, visited.get(2));
        assertSame(keyword, visited.get(3));
        assertSame(keywordValue, visited.get(4));
        assertSame(starargs, visited.get(5));
        assertSame(kwargs, visited.get(6));
    }

    @Test
    void testIfVisitsTestBodyOrelse() {
        Name test = load("a");
        Pass body = new Pass(0, 0);
        Break orelse = new Break(0, 0);
        If ifStmt = new If(test, List.of(body), List.of(orelse));

        List<Node> visited = visitAll(ifStmt);

        assertEquals(List.of(ifStmt, test, body, orelse), visited);
    }

    @Test
    void testDictInterleavesKeysAndValues() {
        Num k1 = Num.ofInt(1);
        Num v1 = Num.ofInt(10);
        Num k2 = Num.ofInt(2);
        Num v2 = Num.ofInt(20);
        DictLiteral dict = new DictLiteral(List.of(k1, k2), List.of(v1, v2));

        List<Node> visited = visitAll(dict);

        assertEquals(5, visited.size());
        assertSame(k1, visited.get(1));
        assertSame(v1, visited.get(2));
        assertSame(k2, visited.get(3));
        assertSame(v2, visited.get(4));
    }

    @Test
    void testComprehensionClausesBeforeElement() {
        Name elt = load("y");
        Name target = store("x");
        Name iter = load("xs");
        Name condition = load("c");
        Comprehension generator = new Comprehension(0, 0, target, iter, List.of(condition));
        ListComp listComp = new ListComp(0, 0, elt, List.of(generator));

        List<Node> visited = visitAll(listComp);

        assertEquals(6, visited.size());
        assertSame(listComp, visited.get(0));
        assertSame(generator, visited.get(1));
        assertSame(target, visited.get(2));
        assertSame(iter, visited.get(3));
        assertSame(condition, visited.get(4));
        assertSame(elt, visited.get(5));
    }

    @Test
    void testFalseFromHandlerPrunesSubtree() {
        int[] counts = new int[2];
        AbstractAstVisitor visitor = new AbstractAstVisitor() {
            @Override
            protected boolean visitNode(Node node) {
                counts[0]++;
                return true;
            }

            @Override
            public boolean visitFunctionDef(FunctionDef functionDef) {
                counts[1]++;
                return false;
            }
        };
        FunctionDef functionDef = new FunctionDef(0, 0, pool.get("f"), Arguments.empty(0, 0), List.of(),
            List.of(new Return(0, 0, new BinOp(load("a"), OperatorKind.ADD, load("b")))));
        Program program = new Program(List.of(functionDef, new Pass(0, 0)), pool);

        program.accept(visitor);

        assertEquals(1, counts[1]);
        // Program and Pass only; nothing below the function
        assertEquals(2, counts[0]);
    }

    @Test
    void testFalseAtRootVisitsNothingElse() {
        int[] count = new int[1];
        AbstractAstVisitor visitor = new AbstractAstVisitor() {
            @Override
            protected boolean visitNode(Node node) {
                count[0]++;
                return false;
            }
        };

        new Compare(load("x"), List.of(OperatorKind.LT, OperatorKind.LT), List.of(load("y"), load("z")))
            .accept(visitor);

        assertEquals(1, count[0]);
    }

    @Test
    void testLeafResultHasNoEffect() {
        AbstractAstVisitor pruning = new AbstractAstVisitor() {
            @Override
            public boolean visitName(Name name) {
                return false;
            }
        };
        RecordingVisitor recording = new RecordingVisitor();
        Global global = new Global(0, 0, List.of(pool.get("a")));

        load("a").accept(pruning);
        global.accept(recording);

        assertEquals(List.of(global), recording.visited);
    }

    @Test
    void testInvokeVisitsWrappedStatementOnly() {
        ExprStmt call = new ExprStmt(new Call(load("f"), List.of()));
        Invoke invoke = new Invoke(0, 0, call, new BlockRef(1), new BlockRef(2));

        List<Node> visited = visitAll(invoke);

        assertEquals(4, visited.size());
        assertSame(invoke, visited.get(0));
        assertSame(call, visited.get(1));
    }

    @Test
    void testArgumentsVisitDefaultsFirst() {
        Num defaultValue = Num.ofInt(1);
        Name a = new Name(pool.get("a"), ExprContext.PARAM);
        Name b = new Name(pool.get("b"), ExprContext.PARAM);
        Arguments arguments = new Arguments(0, 0, List.of(a, b), List.of(defaultValue), null, null);

        List<Node> visited = visitAll(arguments);

        assertEquals(4, visited.size());
        assertSame(defaultValue, visited.get(1));
        assertSame(a, visited.get(2));
        assertSame(b, visited.get(3));
    }

    @Test
    void testDefaultVisitorWalksWholeTree() {
        // x = [i for i in range(3)]
        Comprehension generator = new Comprehension(0, 0, store("i"),
            new Call(load("range"), List.of(Num.ofInt(3))), List.of());
        Assign assign = new Assign(List.of(store("x")), new ListComp(0, 0, load("i"), List.of(generator)));
        Program program = new Program(List.of(assign), pool);

        List<Node> visited = visitAll(program);

        // Program, Assign, ListComp, Comprehension, i, Call, range, 3, i, x
        assertEquals(10, visited.size());
        assertSame(program, visited.get(0));
        assertEquals(NodeKind.NAME, visited.get(visited.size() - 1).kind());
    }
}
