package monoc.ast.expr;

public record NoneLiteral() implements Literal {}
