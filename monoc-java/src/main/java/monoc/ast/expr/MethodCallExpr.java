package monoc.ast.expr;

import java.util.List;

public record MethodCallExpr(
        Expr receiver,
        String method,
        List<Expr> args
) implements Expr {

    public MethodCallExpr {
        args = List.copyOf(args);
    }
}
