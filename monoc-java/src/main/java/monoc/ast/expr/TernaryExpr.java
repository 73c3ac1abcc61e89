package monoc.ast.expr;

public record TernaryExpr(
        Expr condition,
        Expr thenExpr,
        Expr elseExpr
) implements Expr {}
