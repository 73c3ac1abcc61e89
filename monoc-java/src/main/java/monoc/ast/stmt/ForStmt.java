package monoc.ast.stmt;

import monoc.ast.expr.Expr;

/** {@code for (x in iterable) { ... }} */
public record ForStmt(
        String varName,
        Expr iterable,
        BlockStmt body
) implements Stmt {}
