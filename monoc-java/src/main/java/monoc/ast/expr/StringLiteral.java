package monoc.ast.expr;

public record StringLiteral(String value) implements Literal {}
