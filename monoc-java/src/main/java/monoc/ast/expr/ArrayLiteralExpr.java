package monoc.ast.expr;

import java.util.List;

public record ArrayLiteralExpr(List<Expr> elements) implements Expr {

    public ArrayLiteralExpr {
        elements = List.copyOf(elements);
    }
}
