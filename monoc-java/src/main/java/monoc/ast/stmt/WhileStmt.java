package monoc.ast.stmt;

import monoc.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        BlockStmt body
) implements Stmt {}
