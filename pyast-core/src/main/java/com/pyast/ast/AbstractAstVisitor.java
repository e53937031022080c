package com.pyast.ast;

/**
 * {@link AstVisitor} whose handlers all forward to {@link #visitNode(Node)}, which descends into
 * every child by default. Subclasses override the kinds they care about.
 */
public abstract class AbstractAstVisitor implements AstVisitor {

    /**
     * Fallback for every kind not overridden.
     *
     * @return whether to visit the children of {@code node}
     */
    protected boolean visitNode(Node node) {
        return true;
    }

    @Override
    public boolean visitNum(Num num) {
        return visitNode(num);
    }

    @Override
    public boolean visitStr(Str str) {
        return visitNode(str);
    }

    @Override
    public boolean visitEllipsis(Ellipsis ellipsis) {
        return visitNode(ellipsis);
    }

    @Override
    public boolean visitName(Name name) {
        return visitNode(name);
    }

    @Override
    public boolean visitBinOp(BinOp binOp) {
        return visitNode(binOp);
    }

    @Override
    public boolean visitAugBinOp(AugBinOp augBinOp) {
        return visitNode(augBinOp);
    }

    @Override
    public boolean visitBoolOp(BoolOp boolOp) {
        return visitNode(boolOp);
    }

    @Override
    public boolean visitUnaryOp(UnaryOp unaryOp) {
        return visitNode(unaryOp);
    }

    @Override
    public boolean visitCompare(Compare compare) {
        return visitNode(compare);
    }

    @Override
    public boolean visitCall(Call call) {
        return visitNode(call);
    }

    @Override
    public boolean visitAttribute(Attribute attribute) {
        return visitNode(attribute);
    }

    @Override
    public boolean visitClsAttribute(ClsAttribute clsAttribute) {
        return visitNode(clsAttribute);
    }

    @Override
    public boolean visitSubscript(Subscript subscript) {
        return visitNode(subscript);
    }

    @Override
    public boolean visitIndex(Index index) {
        return visitNode(index);
    }

    @Override
    public boolean visitSlice(Slice slice) {
        return visitNode(slice);
    }

    @Override
    public boolean visitExtSlice(ExtSlice extSlice) {
        return visitNode(extSlice);
    }

    @Override
    public boolean visitListLiteral(ListLiteral listLiteral) {
        return visitNode(listLiteral);
    }

    @Override
    public boolean visitTupleLiteral(TupleLiteral tupleLiteral) {
        return visitNode(tupleLiteral);
    }

    @Override
    public boolean visitSetLiteral(SetLiteral setLiteral) {
        return visitNode(setLiteral);
    }

    @Override
    public boolean visitDictLiteral(DictLiteral dictLiteral) {
        return visitNode(dictLiteral);
    }

    @Override
    public boolean visitListComp(ListComp listComp) {
        return visitNode(listComp);
    }

    @Override
    public boolean visitSetComp(SetComp setComp) {
        return visitNode(setComp);
    }

    @Override
    public boolean visitDictComp(DictComp dictComp) {
        return visitNode(dictComp);
    }

    @Override
    public boolean visitGeneratorExp(GeneratorExp generatorExp) {
        return visitNode(generatorExp);
    }

    @Override
    public boolean visitLambda(Lambda lambda) {
        return visitNode(lambda);
    }

    @Override
    public boolean visitIfExp(IfExp ifExp) {
        return visitNode(ifExp);
    }

    @Override
    public boolean visitYield(Yield yieldExpr) {
        return visitNode(yieldExpr);
    }

    @Override
    public boolean visitRepr(Repr repr) {
        return visitNode(repr);
    }

    @Override
    public boolean visitLangPrimitive(LangPrimitive langPrimitive) {
        return visitNode(langPrimitive);
    }

    @Override
    public boolean visitAssign(Assign assign) {
        return visitNode(assign);
    }

    @Override
    public boolean visitAugAssign(AugAssign augAssign) {
        return visitNode(augAssign);
    }

    @Override
    public boolean visitExprStmt(ExprStmt exprStmt) {
        return visitNode(exprStmt);
    }

    @Override
    public boolean visitIf(If ifStmt) {
        return visitNode(ifStmt);
    }

    @Override
    public boolean visitFor(For forStmt) {
        return visitNode(forStmt);
    }

    @Override
    public boolean visitWhile(While whileStmt) {
        return visitNode(whileStmt);
    }

    @Override
    public boolean visitWith(With with) {
        return visitNode(with);
    }

    @Override
    public boolean visitTryExcept(TryExcept tryExcept) {
        return visitNode(tryExcept);
    }

    @Override
    public boolean visitTryFinally(TryFinally tryFinally) {
        return visitNode(tryFinally);
    }

    @Override
    public boolean visitRaise(Raise raise) {
        return visitNode(raise);
    }

    @Override
    public boolean visitReturn(Return returnStmt) {
        return visitNode(returnStmt);
    }

    @Override
    public boolean visitPass(Pass pass) {
        return visitNode(pass);
    }

    @Override
    public boolean visitBreak(Break breakStmt) {
        return visitNode(breakStmt);
    }

    @Override
    public boolean visitContinue(Continue continueStmt) {
        return visitNode(continueStmt);
    }

    @Override
    public boolean visitGlobal(Global global) {
        return visitNode(global);
    }

    @Override
    public boolean visitImport(Import importStmt) {
        return visitNode(importStmt);
    }

    @Override
    public boolean visitImportFrom(ImportFrom importFrom) {
        return visitNode(importFrom);
    }

    @Override
    public boolean visitPrint(Print print) {
        return visitNode(print);
    }

    @Override
    public boolean visitExec(Exec exec) {
        return visitNode(exec);
    }

    @Override
    public boolean visitDelete(Delete delete) {
        return visitNode(delete);
    }

    @Override
    public boolean visitAssert(Assert assertStmt) {
        return visitNode(assertStmt);
    }

    @Override
    public boolean visitFunctionDef(FunctionDef functionDef) {
        return visitNode(functionDef);
    }

    @Override
    public boolean visitClassDef(ClassDef classDef) {
        return visitNode(classDef);
    }

    @Override
    public boolean visitInvoke(Invoke invoke) {
        return visitNode(invoke);
    }

    @Override
    public boolean visitAlias(Alias alias) {
        return visitNode(alias);
    }

    @Override
    public boolean visitArguments(Arguments arguments) {
        return visitNode(arguments);
    }

    @Override
    public boolean visitKeyword(Keyword keyword) {
        return visitNode(keyword);
    }

    @Override
    public boolean visitComprehension(Comprehension comprehension) {
        return visitNode(comprehension);
    }

    @Override
    public boolean visitExceptHandler(ExceptHandler exceptHandler) {
        return visitNode(exceptHandler);
    }

    @Override
    public boolean visitProgram(Program program) {
        return visitNode(program);
    }

    @Override
    public boolean visitExpression(Expression expression) {
        return visitNode(expression);
    }

    @Override
    public boolean visitSuite(Suite suite) {
        return visitNode(suite);
    }
}
