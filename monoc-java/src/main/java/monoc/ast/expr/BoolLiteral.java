package monoc.ast.expr;

public record BoolLiteral(boolean value) implements Literal {}
