package monoc.ast.expr;

public record CharLiteral(char value) implements Literal {}
