package monoc.ast.stmt;

import monoc.ast.expr.Expr;

public record ExprStmt(Expr expr) implements Stmt {}
