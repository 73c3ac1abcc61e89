package monoc.ast.stmt;

import monoc.ast.expr.Expr;
import monoc.ast.pattern.Pattern;

import java.util.List;

public record MatchStmt(
        Expr scrutinee,
        List<Arm> arms
) implements Stmt {

    public MatchStmt {
        arms = List.copyOf(arms);
    }

    public record Arm(Pattern pattern, Expr guard, BlockStmt body) {}   // guard may be null
}
