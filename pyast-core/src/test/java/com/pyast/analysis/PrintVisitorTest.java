package com.pyast.analysis;

import com.pyast.ast.Alias;
import com.pyast.ast.Arguments;
import com.pyast.ast.Assign;
import com.pyast.ast.AugAssign;
import com.pyast.ast.BinOp;
import com.pyast.ast.BlockRef;
import com.pyast.ast.BoolOp;
import com.pyast.ast.Call;
import com.pyast.ast.ClassDef;
import com.pyast.ast.ClsAttribute;
import com.pyast.ast.Compare;
import com.pyast.ast.Comprehension;
import com.pyast.ast.DictLiteral;
import com.pyast.ast.ExceptHandler;
import com.pyast.ast.Exec;
import com.pyast.ast.ExprContext;
import com.pyast.ast.ExprStmt;
import com.pyast.ast.Expression;
import com.pyast.ast.FunctionDef;
import com.pyast.ast.GeneratorExp;
import com.pyast.ast.Global;
import com.pyast.ast.If;
import com.pyast.ast.ImportFrom;
import com.pyast.ast.Index;
import com.pyast.ast.InternedStringPool;
import com.pyast.ast.Invoke;
import com.pyast.ast.Keyword;
import com.pyast.ast.LangPrimitive;
import com.pyast.ast.Name;
import com.pyast.ast.Num;
import com.pyast.ast.Pass;
import com.pyast.ast.Print;
import com.pyast.ast.Program;
import com.pyast.ast.Return;
import com.pyast.ast.SetLiteral;
import com.pyast.ast.Slice;
import com.pyast.ast.Str;
import com.pyast.ast.Subscript;
import com.pyast.ast.TryExcept;
import com.pyast.ast.TryFinally;
import com.pyast.ast.TupleLiteral;
import com.pyast.ast.UnaryOp;
import com.pyast.ast.While;
import com.pyast.ops.OperatorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrintVisitorTest {

    private final InternedStringPool pool = new InternedStringPool();

    private Name load(String id) {
        return new Name(pool.get(id), ExprContext.LOAD);
    }

    private Name store(String id) {
        return new Name(pool.get(id), ExprContext.STORE);
    }

    private Name param(String id) {
        return new Name(pool.get(id), ExprContext.PARAM);
    }

    private static Pass pass() {
        return new Pass(0, 0);
    }

    @Test
    void testBinaryOperator() {
        assertEquals("1+2", PrintVisitor.render(new BinOp(Num.ofInt(1), OperatorKind.ADD, Num.ofInt(2))));
        assertEquals("a//b", PrintVisitor.render(new BinOp(load("a"), OperatorKind.FLOOR_DIV, load("b"))));
    }

    @Test
    void testOneElementTuple() {
        assertEquals("(5,)", PrintVisitor.render(new TupleLiteral(List.of(Num.ofInt(5)), ExprContext.LOAD)));
        assertEquals("(1, 2)",
            PrintVisitor.render(new TupleLiteral(List.of(Num.ofInt(1), Num.ofInt(2)), ExprContext.LOAD)));
    }

    @Test
    void testEmptySetIsMarked() {
        assertEquals("SET{}", PrintVisitor.render(new SetLiteral(List.of())));
        assertEquals("{1, 2}", PrintVisitor.render(new SetLiteral(List.of(Num.ofInt(1), Num.ofInt(2)))));
        assertEquals("{}", PrintVisitor.render(new DictLiteral(List.of(), List.of())));
    }

    @Test
    void testChainedComparison() {
        Compare compare = new Compare(load("x"), List.of(OperatorKind.LT, OperatorKind.LT),
            List.of(load("y"), load("z")));
        assertEquals("x < y < z", PrintVisitor.render(compare));

        Compare identity = new Compare(load("a"), List.of(OperatorKind.IS_NOT), List.of(load("b")));
        assertEquals("a is not b", PrintVisitor.render(identity));
    }

    @Test
    void testElifCollapse() {
        If inner = new If(load("b"), List.of(pass()), List.of());
        If outer = new If(load("a"), List.of(pass()), List.of(inner));

        assertEquals("if a:\n    pass\nelif b:\n    pass", PrintVisitor.render(outer));
    }

    @Test
    void testElseBlock() {
        If ifStmt = new If(load("a"), List.of(pass()), List.of(pass(), pass()));

        assertEquals("if a:\n    pass\nelse:\n    pass\n    pass", PrintVisitor.render(ifStmt));
    }

    @Test
    void testNestedIndentation() {
        If ifStmt = new If(load("a"), List.of(pass()), List.of(pass()));
        FunctionDef functionDef = new FunctionDef(0, 0, pool.get("g"), Arguments.empty(0, 0), List.of(),
            List.of(ifStmt));

        assertEquals("def g():\n    if a:\n        pass\n    else:\n        pass", PrintVisitor.render(functionDef));
    }

    @Test
    void testLiterals() {
        assertEquals("\"hi\"", PrintVisitor.render(new Str("hi")));
        assertEquals("<unicode value>", PrintVisitor.render(new Str(0, 0, Str.StrType.UNICODE, "hi")));
        assertEquals("42", PrintVisitor.render(Num.ofInt(42)));
        assertEquals("10L", PrintVisitor.render(Num.ofLong(0, 0, "10")));
        assertEquals("1.5", PrintVisitor.render(Num.ofFloat(0, 0, 1.5)));
        assertEquals("2.0j", PrintVisitor.render(Num.ofComplex(0, 0, 2.0)));
        assertEquals("{1:2, 3:4}", PrintVisitor.render(
            new DictLiteral(List.of(Num.ofInt(1), Num.ofInt(3)), List.of(Num.ofInt(2), Num.ofInt(4)))));
    }

    @Test
    void testFloatSpellings() {
        assertEquals("1e+20", PrintVisitor.render(Num.ofFloat(0, 0, 1e20)));
        assertEquals("-1e+20", PrintVisitor.render(Num.ofFloat(0, 0, -1e20)));
        assertEquals("2.5e-07", PrintVisitor.render(Num.ofFloat(0, 0, 2.5e-7)));
        assertEquals("inf", PrintVisitor.render(Num.ofFloat(0, 0, Double.POSITIVE_INFINITY)));
        assertEquals("-inf", PrintVisitor.render(Num.ofFloat(0, 0, Double.NEGATIVE_INFINITY)));
        assertEquals("nan", PrintVisitor.render(Num.ofFloat(0, 0, Double.NaN)));
        assertEquals("infj", PrintVisitor.render(Num.ofComplex(0, 0, Double.POSITIVE_INFINITY)));
        assertEquals("1e+20j", PrintVisitor.render(Num.ofComplex(0, 0, 1e20)));
    }

    @Test
    void testUnaryAndBooleanOperators() {
        assertEquals("not (x)", PrintVisitor.render(new UnaryOp(0, 0, OperatorKind.NOT, load("x"))));
        assertEquals("-(x)", PrintVisitor.render(new UnaryOp(0, 0, OperatorKind.USUB, load("x"))));
        assertEquals("~(x)", PrintVisitor.render(new UnaryOp(0, 0, OperatorKind.INVERT, load("x"))));
        assertEquals("a or b or c",
            PrintVisitor.render(new BoolOp(0, 0, OperatorKind.OR, List.of(load("a"), load("b"), load("c")))));
    }

    @Test
    void testCall() {
        Call call = new Call(0, 0, load("f"), List.of(load("a")),
            List.of(new Keyword(pool.get("k"), Num.ofInt(1))), load("args"), load("kw"));

        assertEquals("f(a, k=1, *args, **kw)", PrintVisitor.render(call));
        assertEquals("g()", PrintVisitor.render(new Call(load("g"), List.of())));
    }

    @Test
    void testSubscripts() {
        assertEquals("x[0]", PrintVisitor.render(
            new Subscript(0, 0, load("x"), new Index(0, 0, Num.ofInt(0)), ExprContext.LOAD)));
        assertEquals("x[<slice>(1:2)]", PrintVisitor.render(
            new Subscript(0, 0, load("x"), new Slice(0, 0, Num.ofInt(1), Num.ofInt(2), null), ExprContext.LOAD)));
        assertEquals("x[<slice>(::2)]", PrintVisitor.render(
            new Subscript(0, 0, load("x"), new Slice(0, 0, null, null, Num.ofInt(2)), ExprContext.LOAD)));
    }

    @Test
    void testAssignments() {
        assertEquals("a = b = 1",
            PrintVisitor.render(new Assign(List.of(store("a"), store("b")), Num.ofInt(1))));
        assertEquals("x+=1",
            PrintVisitor.render(new AugAssign(0, 0, store("x"), OperatorKind.ADD, Num.ofInt(1))));
    }

    @Test
    void testFunctionDefinition() {
        Arguments arguments = new Arguments(0, 0, List.of(param("a"), param("b")), List.of(Num.ofInt(1)),
            param("rest"), null);
        FunctionDef functionDef = new FunctionDef(0, 0, pool.get("f"), arguments, List.of(load("deco")),
            List.of(new Return(0, 0, load("a"))));

        assertEquals("@deco\ndef f(a, b=1, *rest):\n    return a", PrintVisitor.render(functionDef));
    }

    @Test
    void testClassDefinition() {
        ClassDef classDef = new ClassDef(0, 0, pool.get("C"), List.of(load("object")), List.of(),
            List.of(pass()));

        assertEquals("class C(object):\n    pass", PrintVisitor.render(classDef));
    }

    @Test
    void testTryExceptFinally() {
        ExceptHandler handler = new ExceptHandler(0, 0, load("E"), store("e"), List.of(pass()));
        TryExcept tryExcept = new TryExcept(0, 0, List.of(pass()), List.of(handler), List.of());
        TryFinally tryFinally = new TryFinally(0, 0, List.of(tryExcept), List.of(pass()));

        assertEquals("try:\n    pass\nexcept E as e:\n    pass\nfinally:\n    pass",
            PrintVisitor.render(tryFinally));
    }

    @Test
    void testWhileElse() {
        While loop = new While(0, 0, load("a"), List.of(pass()), List.of(pass()));

        assertEquals("while a:\n    pass\nelse:\n    pass", PrintVisitor.render(loop));
    }

    @Test
    void testLegacyStatements() {
        assertEquals("print 1, 2,",
            PrintVisitor.render(new Print(0, 0, null, List.of(Num.ofInt(1), Num.ofInt(2)), false)));
        assertEquals("print >>f, 1",
            PrintVisitor.render(new Print(0, 0, load("f"), List.of(Num.ofInt(1)), true)));
        assertEquals("exec \"code\" in g",
            PrintVisitor.render(new Exec(0, 0, new Str("code"), load("g"), null)));
        assertEquals("global a, b",
            PrintVisitor.render(new Global(0, 0, List.of(pool.get("a"), pool.get("b")))));
        assertEquals("from .os.path import join as j", PrintVisitor.render(new ImportFrom(0, 0,
            pool.get("os.path"), List.of(new Alias(pool.get("join"), pool.get("j"))), 1)));
    }

    @Test
    void testInternalNodes() {
        Invoke invoke = new Invoke(0, 0, new ExprStmt(new Call(load("f"), List.of())),
            new BlockRef(3), new BlockRef(4));
        assertEquals("invoke 3 4: f()", PrintVisitor.render(invoke));

        assertEquals(":GET_ITER(xs)", PrintVisitor.render(
            new LangPrimitive(0, 0, LangPrimitive.Opcode.GET_ITER, List.of(load("xs")))));
        assertEquals("self:attr", PrintVisitor.render(new ClsAttribute(0, 0, load("self"), pool.get("attr"))));
    }

    @Test
    void testGeneratorExpression() {
        GeneratorExp generatorExp = new GeneratorExp(0, 0, load("x"),
            List.of(new Comprehension(0, 0, store("x"), load("xs"), List.of(load("c")))));

        assertEquals("(x for x in xs if c)", PrintVisitor.render(generatorExp));
    }

    @Test
    void testRoots() {
        Program program = new Program(List.of(new Assign(List.of(store("x")), Num.ofInt(1)), pass()), pool);
        assertEquals("x = 1\npass\n", PrintVisitor.render(program));

        assertEquals("x\n", PrintVisitor.render(new Expression(0, 0, load("x"), pool)));
    }

    @Test
    void testVisitorAccumulates() {
        PrintVisitor printVisitor = new PrintVisitor();
        load("a").accept(printVisitor);
        load("b").accept(printVisitor);

        assertEquals("ab", printVisitor.getResult());
    }
}
