package monoc.ast.stmt;

import monoc.ast.expr.Expr;
import java.util.List;

public record IfStmt(
        List<Branch> branches,   // if + else if ...
        BlockStmt elseBlock      // may be null
) implements Stmt {

    public IfStmt {
        if (branches.isEmpty()) throw new IllegalArgumentException("if statement needs at least one branch");
        branches = List.copyOf(branches);
    }

    public record Branch(Expr condition, BlockStmt body) {}
}
