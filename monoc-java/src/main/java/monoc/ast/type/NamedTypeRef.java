package monoc.ast.type;

public record NamedTypeRef(String name) implements TypeRef {}
