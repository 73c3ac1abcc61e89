package monoc.ast.expr;

public record IntLiteral(long value) implements Literal {}
