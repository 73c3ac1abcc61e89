package monoc.ast.stmt;

import monoc.ast.expr.Expr;

public record AssignStmt(
        Expr target,
        Expr value
) implements Stmt {}
