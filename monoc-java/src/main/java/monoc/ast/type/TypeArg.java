package monoc.ast.type;

import monoc.ast.expr.Expr;

public sealed interface TypeArg {

    record OfType(TypeRef type) implements TypeArg {}

    record OfValue(Expr value) implements TypeArg {}
}
