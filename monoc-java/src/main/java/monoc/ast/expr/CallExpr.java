package monoc.ast.expr;

import java.util.List;

/**
 * {@code callee[compileTimeArgs](args)}. Plain calls have an empty
 * {@code compileTimeArgs} list.
 */
public record CallExpr(
        Expr callee,
        List<Expr> compileTimeArgs,
        List<Expr> args
) implements Expr {

    public CallExpr {
        compileTimeArgs = List.copyOf(compileTimeArgs);
        args = List.copyOf(args);
    }

    public CallExpr(Expr callee, List<Expr> args) {
        this(callee, List.of(), args);
    }
}
