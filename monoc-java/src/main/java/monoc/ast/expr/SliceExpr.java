package monoc.ast.expr;

/** {@code target[start:end]}, either bound may be null. */
public record SliceExpr(
        Expr target,
        Expr start,
        Expr end
) implements Expr {}
