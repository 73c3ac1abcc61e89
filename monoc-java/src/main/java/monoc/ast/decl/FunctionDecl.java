package monoc.ast.decl;

import monoc.ast.stmt.BlockStmt;
import monoc.ast.type.TypeRef;

import java.util.List;

public record FunctionDecl(
        String name,
        List<CompileTimeParam> compileTimeParams,
        List<Param> params,
        TypeRef returnType,     // null when omitted
        BlockStmt body
) implements Decl {

    public FunctionDecl {
        compileTimeParams = List.copyOf(compileTimeParams);
        params = List.copyOf(params);
    }

    public record Param(String name, TypeRef type) {}

    /** {@code N: int} or {@code Flag: bool} between the brackets of a generic function. */
    public record CompileTimeParam(String name, Kind kind) {
        public enum Kind { INT, BOOL }
    }
}
