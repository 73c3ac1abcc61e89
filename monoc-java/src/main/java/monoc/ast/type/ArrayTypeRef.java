package monoc.ast.type;

import monoc.ast.expr.Expr;

public record ArrayTypeRef(
        TypeRef element,
        Expr size           // null for T[]
) implements TypeRef {}
