package monoc.ast.type;

public record PrimitiveTypeRef(String name) implements TypeRef {}
