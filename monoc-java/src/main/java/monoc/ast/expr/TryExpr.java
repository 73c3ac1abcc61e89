package monoc.ast.expr;

/** {@code try expr}: unwraps a result or propagates its error. */
public record TryExpr(Expr expr) implements Expr {}
