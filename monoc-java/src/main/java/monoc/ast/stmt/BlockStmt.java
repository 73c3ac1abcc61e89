package monoc.ast.stmt;

import java.util.List;

public record BlockStmt(List<Stmt> statements) implements Stmt {

    public BlockStmt {
        statements = List.copyOf(statements);
    }
}
