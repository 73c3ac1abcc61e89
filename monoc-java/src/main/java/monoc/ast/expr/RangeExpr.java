package monoc.ast.expr;

/** {@code from...to}, used as a for-loop iterable. */
public record RangeExpr(
        Expr from,
        Expr to
) implements Expr {}
