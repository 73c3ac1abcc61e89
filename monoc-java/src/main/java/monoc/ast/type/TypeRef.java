package monoc.ast.type;

public sealed interface TypeRef
        permits PrimitiveTypeRef, NamedTypeRef, ArrayTypeRef, GenericTypeRef {}
