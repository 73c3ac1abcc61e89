package monoc.ast.stmt;

import monoc.ast.expr.Expr;

/** {@code with (name = value) { ... }}: scoped resource bound to {@code name}. */
public record WithStmt(
        String varName,
        Expr value,
        BlockStmt body
) implements Stmt {}
