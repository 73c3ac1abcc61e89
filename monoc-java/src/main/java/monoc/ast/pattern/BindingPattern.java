package monoc.ast.pattern;

public record BindingPattern(String name) implements Pattern {}
