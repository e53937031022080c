package com.pyast.ast;

/**
 * Handler per node kind. {@link Node#accept(AstVisitor)} calls the handler and visits the node's
 * children only when it returns {@code true}; returning {@code false} prunes the subtree.
 *
 * @see AbstractAstVisitor
 * @see StmtVisitor
 */
public interface AstVisitor {

    // expressions
    boolean visitNum(Num num);
    boolean visitStr(Str str);
    boolean visitEllipsis(Ellipsis ellipsis);
    boolean visitName(Name name);
    boolean visitBinOp(BinOp binOp);
    boolean visitAugBinOp(AugBinOp augBinOp);
    boolean visitBoolOp(BoolOp boolOp);
    boolean visitUnaryOp(UnaryOp unaryOp);
    boolean visitCompare(Compare compare);
    boolean visitCall(Call call);
    boolean visitAttribute(Attribute attribute);
    boolean visitClsAttribute(ClsAttribute clsAttribute);
    boolean visitSubscript(Subscript subscript);
    boolean visitIndex(Index index);
    boolean visitSlice(Slice slice);
    boolean visitExtSlice(ExtSlice extSlice);
    boolean visitListLiteral(ListLiteral listLiteral);
    boolean visitTupleLiteral(TupleLiteral tupleLiteral);
    boolean visitSetLiteral(SetLiteral setLiteral);
    boolean visitDictLiteral(DictLiteral dictLiteral);
    boolean visitListComp(ListComp listComp);
    boolean visitSetComp(SetComp setComp);
    boolean visitDictComp(DictComp dictComp);
    boolean visitGeneratorExp(GeneratorExp generatorExp);
    boolean visitLambda(Lambda lambda);
    boolean visitIfExp(IfExp ifExp);
    boolean visitYield(Yield yieldExpr);
    boolean visitRepr(Repr repr);
    boolean visitLangPrimitive(LangPrimitive langPrimitive);

    // statements
    boolean visitAssign(Assign assign);
    boolean visitAugAssign(AugAssign augAssign);
    boolean visitExprStmt(ExprStmt exprStmt);
    boolean visitIf(If ifStmt);
    boolean visitFor(For forStmt);
    boolean visitWhile(While whileStmt);
    boolean visitWith(With with);
    boolean visitTryExcept(TryExcept tryExcept);
    boolean visitTryFinally(TryFinally tryFinally);
    boolean visitRaise(Raise raise);
    boolean visitReturn(Return returnStmt);
    boolean visitPass(Pass pass);
    boolean visitBreak(Break breakStmt);
    boolean visitContinue(Continue continueStmt);
    boolean visitGlobal(Global global);
    boolean visitImport(Import importStmt);
    boolean visitImportFrom(ImportFrom importFrom);
    boolean visitPrint(Print print);
    boolean visitExec(Exec exec);
    boolean visitDelete(Delete delete);
    boolean visitAssert(Assert assertStmt);
    boolean visitFunctionDef(FunctionDef functionDef);
    boolean visitClassDef(ClassDef classDef);
    boolean visitInvoke(Invoke invoke);

    // auxiliary records
    boolean visitAlias(Alias alias);
    boolean visitArguments(Arguments arguments);
    boolean visitKeyword(Keyword keyword);
    boolean visitComprehension(Comprehension comprehension);
    boolean visitExceptHandler(ExceptHandler exceptHandler);

    // roots
    boolean visitProgram(Program program);
    boolean visitExpression(Expression expression);
    boolean visitSuite(Suite suite);
}
