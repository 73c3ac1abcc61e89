package monoc.ast.decl;

import monoc.ast.type.TypeRef;

public record FieldDecl(
        String name,
        TypeRef type
) {}
