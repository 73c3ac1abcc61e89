package monoc.ast.pattern;

public sealed interface Pattern permits LiteralPattern, BindingPattern, WildcardPattern {}
