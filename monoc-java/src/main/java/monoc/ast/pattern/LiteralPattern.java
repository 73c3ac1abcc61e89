package monoc.ast.pattern;

import monoc.ast.expr.Literal;

public record LiteralPattern(Literal literal) implements Pattern {}
