package monoc.ast.decl;

import java.util.List;

public record StructDecl(
        String name,
        List<FieldDecl> fields
) implements Decl {}
