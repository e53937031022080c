package com.pyast.ast;

/**
 * Handler per statement kind. {@link Stmt#acceptStmt(StmtVisitor)} calls exactly one handler and
 * never descends; the handler decides what to do with nested statements.
 */
public interface StmtVisitor {

    void visitAssign(Assign assign);

    void visitAugAssign(AugAssign augAssign);

    void visitExprStmt(ExprStmt exprStmt);

    void visitIf(If ifStmt);

    void visitFor(For forStmt);

    void visitWhile(While whileStmt);

    void visitWith(With with);

    void visitTryExcept(TryExcept tryExcept);

    void visitTryFinally(TryFinally tryFinally);

    void visitRaise(Raise raise);

    void visitReturn(Return returnStmt);

    void visitPass(Pass pass);

    void visitBreak(Break breakStmt);

    void visitContinue(Continue continueStmt);

    void visitGlobal(Global global);

    void visitImport(Import importStmt);

    void visitImportFrom(ImportFrom importFrom);

    void visitPrint(Print print);

    void visitExec(Exec exec);

    void visitDelete(Delete delete);

    void visitAssert(Assert assertStmt);

    void visitFunctionDef(FunctionDef functionDef);

    void visitClassDef(ClassDef classDef);

    void visitInvoke(Invoke invoke);
}
