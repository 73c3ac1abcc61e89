package monoc.ast.expr;

public record FloatLiteral(double value) implements Literal {}
