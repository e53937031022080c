package com.pyast.analysis;

import com.pyast.ast.Alias;
import com.pyast.ast.Arguments;
import com.pyast.ast.Assert;
import com.pyast.ast.Assign;
import com.pyast.ast.AstVisitor;
import com.pyast.ast.Attribute;
import com.pyast.ast.AugAssign;
import com.pyast.ast.AugBinOp;
import com.pyast.ast.BinOp;
import com.pyast.ast.BoolOp;
import com.pyast.ast.Break;
import com.pyast.ast.Call;
import com.pyast.ast.ClassDef;
import com.pyast.ast.ClsAttribute;
import com.pyast.ast.Compare;
import com.pyast.ast.Comprehension;
import com.pyast.ast.Continue;
import com.pyast.ast.Delete;
import com.pyast.ast.DictComp;
import com.pyast.ast.DictLiteral;
import com.pyast.ast.Ellipsis;
import com.pyast.ast.ExceptHandler;
import com.pyast.ast.Exec;
import com.pyast.ast.Expr;
import com.pyast.ast.ExprStmt;
import com.pyast.ast.Expression;
import com.pyast.ast.ExtSlice;
import com.pyast.ast.For;
import com.pyast.ast.FunctionDef;
import com.pyast.ast.GeneratorExp;
import com.pyast.ast.Global;
import com.pyast.ast.If;
import com.pyast.ast.IfExp;
import com.pyast.ast.Import;
import com.pyast.ast.ImportFrom;
import com.pyast.ast.Index;
import com.pyast.ast.InternedString;
import com.pyast.ast.Invoke;
import com.pyast.ast.Keyword;
import com.pyast.ast.Lambda;
import com.pyast.ast.LangPrimitive;
import com.pyast.ast.ListComp;
import com.pyast.ast.ListLiteral;
import com.pyast.ast.Name;
import com.pyast.ast.Node;
import com.pyast.ast.Num;
import com.pyast.ast.Pass;
import com.pyast.ast.Print;
import com.pyast.ast.Program;
import com.pyast.ast.Raise;
import com.pyast.ast.Repr;
import com.pyast.ast.Return;
import com.pyast.ast.SetComp;
import com.pyast.ast.SetLiteral;
import com.pyast.ast.Slice;
import com.pyast.ast.Stmt;
import com.pyast.ast.Str;
import com.pyast.ast.Subscript;
import com.pyast.ast.Suite;
import com.pyast.ast.TryExcept;
import com.pyast.ast.TryFinally;
import com.pyast.ast.TupleLiteral;
import com.pyast.ast.UnaryOp;
import com.pyast.ast.While;
import com.pyast.ast.With;
import com.pyast.ast.Yield;
import com.pyast.ops.OperatorKind;
import com.pyast.ops.Operators;

import java.util.List;

/**
 * Renders a tree as pseudo-source for debugging. The output is meant for people and is not
 * guaranteed to parse.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * PrintVisitor printVisitor = new PrintVisitor();
 * node.accept(printVisitor);
 * return printVisitor.getResult();
 * }</pre>
 *
 * <p>Every handler renders its children itself and returns {@code false}, so the dispatcher never
 * descends on its own. An instance accumulates output and must not be shared between threads.</p>
 */
public class PrintVisitor implements AstVisitor {

    private static final int INDENT_STEP = 4;

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    public static String render(Node node) {
        PrintVisitor printVisitor = new PrintVisitor();
        node.accept(printVisitor);
        return printVisitor.getResult();
    }

    public String getResult() {
        return sb.toString();
    }

    private void appendIndent() {
        sb.append(" ".repeat(indent));
    }

    // One statement per line, one step deeper than the header that owns the block.
    private void appendBlock(List<? extends Node> body) {
        indent += INDENT_STEP;
        for (Node stmt : body) {
            sb.append('\n');
            appendIndent();
            stmt.accept(this);
        }
        indent -= INDENT_STEP;
    }

    private void appendCommaSeparated(List<? extends Node> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            nodes.get(i).accept(this);
        }
    }

    private void appendGenerators(List<Comprehension> generators) {
        for (Comprehension generator : generators) {
            sb.append(' ');
            generator.accept(this);
        }
    }

    private void appendDecorators(List<Expr> decorators) {
        for (Expr decorator : decorators) {
            sb.append('@');
            decorator.accept(this);
            sb.append('\n');
            appendIndent();
        }
    }

    // expressions

    @Override
    public boolean visitNum(Num num) {
        switch (num.numType()) {
            case INT -> sb.append(num.nInt());
            case LONG -> sb.append(num.nLong()).append('L');
            case FLOAT -> sb.append(formatFloat(num.nFloat()));
            case COMPLEX -> sb.append(formatFloat(num.nFloat())).append('j');
        }
        return false;
    }

    // 1.0E20 -> 1e+20, 2.5E-7 -> 2.5e-07; non-finite values as inf, -inf and nan
    static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        String text = Double.toString(value);
        int e = text.indexOf('E');
        if (e < 0) {
            return text;
        }
        String mantissa = text.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        String exponent = text.substring(e + 1);
        char sign = '+';
        if (exponent.startsWith("-")) {
            sign = '-';
            exponent = exponent.substring(1);
        }
        if (exponent.length() < 2) {
            exponent = "0" + exponent;
        }
        return mantissa + 'e' + sign + exponent;
    }

    @Override
    public boolean visitStr(Str str) {
        switch (str.strType()) {
            case STR -> sb.append('"').append(str.strData()).append('"');
            case UNICODE -> sb.append("<unicode value>");
        }
        return false;
    }

    @Override
    public boolean visitEllipsis(Ellipsis ellipsis) {
        sb.append("...");
        return false;
    }

    @Override
    public boolean visitName(Name name) {
        sb.append(name.id());
        return false;
    }

    @Override
    public boolean visitBinOp(BinOp binOp) {
        binOp.left().accept(this);
        sb.append(Operators.symbol(binOp.op()));
        binOp.right().accept(this);
        return false;
    }

    @Override
    public boolean visitAugBinOp(AugBinOp augBinOp) {
        augBinOp.left().accept(this);
        sb.append(Operators.inplaceSymbol(augBinOp.op()));
        augBinOp.right().accept(this);
        return false;
    }

    @Override
    public boolean visitBoolOp(BoolOp boolOp) {
        String separator = " " + Operators.symbol(boolOp.op()) + " ";
        for (int i = 0; i < boolOp.values().size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            boolOp.values().get(i).accept(this);
        }
        return false;
    }

    @Override
    public boolean visitUnaryOp(UnaryOp unaryOp) {
        sb.append(Operators.symbol(unaryOp.op()));
        if (unaryOp.op() == OperatorKind.NOT) {
            sb.append(' ');
        }
        sb.append('(');
        unaryOp.operand().accept(this);
        sb.append(')');
        return false;
    }

    @Override
    public boolean visitCompare(Compare compare) {
        compare.left().accept(this);
        for (int i = 0; i < compare.ops().size(); i++) {
            sb.append(' ').append(Operators.symbol(compare.ops().get(i))).append(' ');
            compare.comparators().get(i).accept(this);
        }
        return false;
    }

    @Override
    public boolean visitCall(Call call) {
        call.func().accept(this);
        sb.append('(');
        boolean first = true;
        for (Expr arg : call.args()) {
            first = appendSeparator(first);
            arg.accept(this);
        }
        for (Keyword keyword : call.keywords()) {
            first = appendSeparator(first);
            keyword.accept(this);
        }
        if (call.starargs() != null) {
            first = appendSeparator(first);
            sb.append('*');
            call.starargs().accept(this);
        }
        if (call.kwargs() != null) {
            appendSeparator(first);
            sb.append("**");
            call.kwargs().accept(this);
        }
        sb.append(')');
        return false;
    }

    private boolean appendSeparator(boolean first) {
        if (!first) {
            sb.append(", ");
        }
        return false;
    }

    @Override
    public boolean visitAttribute(Attribute attribute) {
        attribute.value().accept(this);
        sb.append('.').append(attribute.attr());
        return false;
    }

    @Override
    public boolean visitClsAttribute(ClsAttribute clsAttribute) {
        clsAttribute.value().accept(this);
        sb.append(':').append(clsAttribute.attr());
        return false;
    }

    @Override
    public boolean visitSubscript(Subscript subscript) {
        subscript.value().accept(this);
        sb.append('[');
        subscript.slice().accept(this);
        sb.append(']');
        return false;
    }

    @Override
    public boolean visitIndex(Index index) {
        index.value().accept(this);
        return false;
    }

    @Override
    public boolean visitSlice(Slice slice) {
        sb.append("<slice>(");
        if (slice.lower() != null) {
            slice.lower().accept(this);
        }
        if (slice.upper() != null || slice.step() != null) {
            sb.append(':');
        }
        if (slice.upper() != null) {
            slice.upper().accept(this);
        }
        if (slice.step() != null) {
            sb.append(':');
            slice.step().accept(this);
        }
        sb.append(')');
        return false;
    }

    @Override
    public boolean visitExtSlice(ExtSlice extSlice) {
        appendCommaSeparated(extSlice.dims());
        return false;
    }

    @Override
    public boolean visitListLiteral(ListLiteral listLiteral) {
        sb.append('[');
        appendCommaSeparated(listLiteral.elts());
        sb.append(']');
        return false;
    }

    @Override
    public boolean visitTupleLiteral(TupleLiteral tupleLiteral) {
        sb.append('(');
        appendCommaSeparated(tupleLiteral.elts());
        if (tupleLiteral.elts().size() == 1) {
            sb.append(',');
        }
        sb.append(')');
        return false;
    }

    @Override
    public boolean visitSetLiteral(SetLiteral setLiteral) {
        // "{}" would read as an empty dict
        if (setLiteral.elts().isEmpty()) {
            sb.append("SET");
        }
        sb.append('{');
        appendCommaSeparated(setLiteral.elts());
        sb.append('}');
        return false;
    }

    @Override
    public boolean visitDictLiteral(DictLiteral dictLiteral) {
        sb.append('{');
        for (int i = 0; i < dictLiteral.keys().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            dictLiteral.keys().get(i).accept(this);
            sb.append(':');
            dictLiteral.values().get(i).accept(this);
        }
        sb.append('}');
        return false;
    }

    @Override
    public boolean visitListComp(ListComp listComp) {
        sb.append('[');
        listComp.elt().accept(this);
        appendGenerators(listComp.generators());
        sb.append(']');
        return false;
    }

    @Override
    public boolean visitSetComp(SetComp setComp) {
        sb.append('{');
        setComp.elt().accept(this);
        appendGenerators(setComp.generators());
        sb.append('}');
        return false;
    }

    @Override
    public boolean visitDictComp(DictComp dictComp) {
        sb.append('{');
        dictComp.key().accept(this);
        sb.append(':');
        dictComp.value().accept(this);
        appendGenerators(dictComp.generators());
        sb.append('}');
        return false;
    }

    @Override
    public boolean visitGeneratorExp(GeneratorExp generatorExp) {
        sb.append('(');
        generatorExp.elt().accept(this);
        appendGenerators(generatorExp.generators());
        sb.append(')');
        return false;
    }

    @Override
    public boolean visitLambda(Lambda lambda) {
        sb.append("lambda ");
        lambda.args().accept(this);
        sb.append(": ");
        lambda.body().accept(this);
        return false;
    }

    @Override
    public boolean visitIfExp(IfExp ifExp) {
        ifExp.body().accept(this);
        sb.append(" if ");
        ifExp.test().accept(this);
        sb.append(" else ");
        ifExp.orelse().accept(this);
        return false;
    }

    @Override
    public boolean visitYield(Yield yieldExpr) {
        sb.append("yield");
        if (yieldExpr.value() != null) {
            sb.append(' ');
            yieldExpr.value().accept(this);
        }
        return false;
    }

    @Override
    public boolean visitRepr(Repr repr) {
        sb.append('`');
        repr.value().accept(this);
        sb.append('`');
        return false;
    }

    @Override
    public boolean visitLangPrimitive(LangPrimitive langPrimitive) {
        sb.append(':').append(langPrimitive.opcode().name()).append('(');
        appendCommaSeparated(langPrimitive.args());
        sb.append(')');
        return false;
    }

    // statements

    @Override
    public boolean visitAssign(Assign assign) {
        for (Expr target : assign.targets()) {
            target.accept(this);
            sb.append(" = ");
        }
        assign.value().accept(this);
        return false;
    }

    @Override
    public boolean visitAugAssign(AugAssign augAssign) {
        augAssign.target().accept(this);
        sb.append(Operators.inplaceSymbol(augAssign.op()));
        augAssign.value().accept(this);
        return false;
    }

    @Override
    public boolean visitExprStmt(ExprStmt exprStmt) {
        exprStmt.value().accept(this);
        return false;
    }

    @Override
    public boolean visitIf(If ifStmt) {
        sb.append("if ");
        ifStmt.test().accept(this);
        sb.append(':');
        appendBlock(ifStmt.body());

        List<Stmt> orelse = ifStmt.orelse();
        if (orelse.size() == 1 && orelse.get(0) instanceof If elif) {
            sb.append('\n');
            appendIndent();
            sb.append("el");
            elif.accept(this);
        } else if (!orelse.isEmpty()) {
            sb.append('\n');
            appendIndent();
            sb.append("else:");
            appendBlock(orelse);
        }
        return false;
    }

    @Override
    public boolean visitFor(For forStmt) {
        sb.append("for ");
        forStmt.target().accept(this);
        sb.append(" in ");
        forStmt.iter().accept(this);
        sb.append(':');
        appendBlock(forStmt.body());
        appendElse(forStmt.orelse());
        return false;
    }

    @Override
    public boolean visitWhile(While whileStmt) {
        sb.append("while ");
        whileStmt.test().accept(this);
        sb.append(':');
        appendBlock(whileStmt.body());
        appendElse(whileStmt.orelse());
        return false;
    }

    private void appendElse(List<Stmt> orelse) {
        if (orelse.isEmpty()) {
            return;
        }
        sb.append('\n');
        appendIndent();
        sb.append("else:");
        appendBlock(orelse);
    }

    @Override
    public boolean visitWith(With with) {
        sb.append("with ");
        with.contextExpr().accept(this);
        if (with.optionalVars() != null) {
            sb.append(" as ");
            with.optionalVars().accept(this);
        }
        sb.append(':');
        appendBlock(with.body());
        return false;
    }

    @Override
    public boolean visitTryExcept(TryExcept tryExcept) {
        sb.append("try:");
        appendBlock(tryExcept.body());
        for (ExceptHandler handler : tryExcept.handlers()) {
            sb.append('\n');
            appendIndent();
            handler.accept(this);
        }
        appendElse(tryExcept.orelse());
        return false;
    }

    @Override
    public boolean visitTryFinally(TryFinally tryFinally) {
        // try/except/finally is stored as a TryFinally wrapping a lone TryExcept
        if (tryFinally.body().size() == 1 && tryFinally.body().get(0) instanceof TryExcept tryExcept) {
            tryExcept.accept(this);
        } else {
            sb.append("try:");
            appendBlock(tryFinally.body());
        }
        sb.append('\n');
        appendIndent();
        sb.append("finally:");
        appendBlock(tryFinally.finalbody());
        return false;
    }

    @Override
    public boolean visitRaise(Raise raise) {
        sb.append("raise");
        if (raise.arg0() != null) {
            sb.append(' ');
            raise.arg0().accept(this);
        }
        if (raise.arg1() != null) {
            sb.append(", ");
            raise.arg1().accept(this);
        }
        if (raise.arg2() != null) {
            sb.append(", ");
            raise.arg2().accept(this);
        }
        return false;
    }

    @Override
    public boolean visitReturn(Return returnStmt) {
        sb.append("return");
        if (returnStmt.value() != null) {
            sb.append(' ');
            returnStmt.value().accept(this);
        }
        return false;
    }

    @Override
    public boolean visitPass(Pass pass) {
        sb.append("pass");
        return false;
    }

    @Override
    public boolean visitBreak(Break breakStmt) {
        sb.append("break");
        return false;
    }

    @Override
    public boolean visitContinue(Continue continueStmt) {
        sb.append("continue");
        return false;
    }

    @Override
    public boolean visitGlobal(Global global) {
        sb.append("global ");
        for (int i = 0; i < global.names().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(global.names().get(i));
        }
        return false;
    }

    @Override
    public boolean visitImport(Import importStmt) {
        sb.append("import ");
        appendCommaSeparated(importStmt.names());
        return false;
    }

    @Override
    public boolean visitImportFrom(ImportFrom importFrom) {
        sb.append("from ")
            .append(".".repeat(importFrom.level()))
            .append(importFrom.module())
            .append(" import ");
        appendCommaSeparated(importFrom.names());
        return false;
    }

    @Override
    public boolean visitPrint(Print print) {
        sb.append("print");
        boolean first = true;
        if (print.dest() != null) {
            sb.append(" >>");
            print.dest().accept(this);
            first = false;
        }
        for (Expr value : print.values()) {
            sb.append(first ? " " : ", ");
            value.accept(this);
            first = false;
        }
        if (!print.nl()) {
            sb.append(',');
        }
        return false;
    }

    @Override
    public boolean visitExec(Exec exec) {
        sb.append("exec ");
        exec.body().accept(this);
        if (exec.globals() != null) {
            sb.append(" in ");
            exec.globals().accept(this);
            if (exec.locals() != null) {
                sb.append(", ");
                exec.locals().accept(this);
            }
        }
        return false;
    }

    @Override
    public boolean visitDelete(Delete delete) {
        sb.append("del ");
        appendCommaSeparated(delete.targets());
        return false;
    }

    @Override
    public boolean visitAssert(Assert assertStmt) {
        sb.append("assert ");
        assertStmt.test().accept(this);
        if (assertStmt.msg() != null) {
            sb.append(", ");
            assertStmt.msg().accept(this);
        }
        return false;
    }

    @Override
    public boolean visitFunctionDef(FunctionDef functionDef) {
        appendDecorators(functionDef.decoratorList());
        InternedString name = functionDef.name();
        sb.append("def ").append(name == null ? "<lambda>" : name.s()).append('(');
        functionDef.args().accept(this);
        sb.append("):");
        appendBlock(functionDef.body());
        return false;
    }

    @Override
    public boolean visitClassDef(ClassDef classDef) {
        appendDecorators(classDef.decoratorList());
        sb.append("class ").append(classDef.name());
        if (!classDef.bases().isEmpty()) {
            sb.append('(');
            appendCommaSeparated(classDef.bases());
            sb.append(')');
        }
        sb.append(':');
        appendBlock(classDef.body());
        return false;
    }

    @Override
    public boolean visitInvoke(Invoke invoke) {
        sb.append("invoke ")
            .append(invoke.normalDest().index())
            .append(' ')
            .append(invoke.excDest().index())
            .append(": ");
        invoke.stmt().accept(this);
        return false;
    }

    // auxiliary records

    @Override
    public boolean visitAlias(Alias alias) {
        sb.append(alias.name());
        if (alias.asname() != null) {
            sb.append(" as ").append(alias.asname());
        }
        return false;
    }

    @Override
    public boolean visitArguments(Arguments arguments) {
        List<Expr> args = arguments.args();
        List<Expr> defaults = arguments.defaults();
        int firstDefault = args.size() - defaults.size();
        boolean first = true;
        for (int i = 0; i < args.size(); i++) {
            first = appendSeparator(first);
            args.get(i).accept(this);
            if (i >= firstDefault) {
                sb.append('=');
                defaults.get(i - firstDefault).accept(this);
            }
        }
        if (arguments.vararg() != null) {
            first = appendSeparator(first);
            sb.append('*');
            arguments.vararg().accept(this);
        }
        if (arguments.kwarg() != null) {
            appendSeparator(first);
            sb.append("**");
            arguments.kwarg().accept(this);
        }
        return false;
    }

    @Override
    public boolean visitKeyword(Keyword keyword) {
        sb.append(keyword.arg()).append('=');
        keyword.value().accept(this);
        return false;
    }

    @Override
    public boolean visitComprehension(Comprehension comprehension) {
        sb.append("for ");
        comprehension.target().accept(this);
        sb.append(" in ");
        comprehension.iter().accept(this);
        for (Expr condition : comprehension.ifs()) {
            sb.append(" if ");
            condition.accept(this);
        }
        return false;
    }

    @Override
    public boolean visitExceptHandler(ExceptHandler exceptHandler) {
        sb.append("except");
        if (exceptHandler.type() != null) {
            sb.append(' ');
            exceptHandler.type().accept(this);
        }
        if (exceptHandler.name() != null) {
            sb.append(" as ");
            exceptHandler.name().accept(this);
        }
        sb.append(':');
        appendBlock(exceptHandler.body());
        return false;
    }

    // roots

    @Override
    public boolean visitProgram(Program program) {
        for (Stmt stmt : program.body()) {
            stmt.accept(this);
            sb.append('\n');
        }
        return false;
    }

    @Override
    public boolean visitExpression(Expression expression) {
        expression.body().accept(this);
        sb.append('\n');
        return false;
    }

    @Override
    public boolean visitSuite(Suite suite) {
        for (Stmt stmt : suite.body()) {
            appendIndent();
            stmt.accept(this);
            sb.append('\n');
        }
        return false;
    }
}
