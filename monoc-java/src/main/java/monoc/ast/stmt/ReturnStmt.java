package monoc.ast.stmt;

import monoc.ast.expr.Expr;

public record ReturnStmt(Expr value) implements Stmt {}   // value == null for bare return
