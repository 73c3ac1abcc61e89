package monoc.ast.expr;

import java.util.List;

public record StructLiteralExpr(
        String typeName,
        List<FieldInit> fields
) implements Expr {

    public StructLiteralExpr {
        fields = List.copyOf(fields);
    }

    public record FieldInit(String name, Expr value) {}
}
