package monoc.ast;

import monoc.ast.decl.Decl;
import monoc.ast.decl.FunctionDecl;

import java.util.List;

public record Program(List<Decl> items) {

    public List<FunctionDecl> functions() {
        return items.stream()
                .filter(FunctionDecl.class::isInstance)
                .map(FunctionDecl.class::cast)
                .toList();
    }

    /** First function with the given name, or null. */
    public FunctionDecl function(String name) {
        for (Decl d : items) {
            if (d instanceof FunctionDecl f && f.name().equals(name)) return f;
        }
        return null;
    }
}
