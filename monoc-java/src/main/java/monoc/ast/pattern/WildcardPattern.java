package monoc.ast.pattern;

public record WildcardPattern() implements Pattern {}
