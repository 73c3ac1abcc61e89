package monoc.ast.stmt;

import monoc.ast.expr.Expr;
import monoc.ast.type.TypeRef;

public record VarDeclStmt(
        String name,
        boolean mutable,
        TypeRef type,           // may be null
        Expr initializer        // may be null
) implements Stmt {}
