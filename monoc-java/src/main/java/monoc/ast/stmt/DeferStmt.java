package monoc.ast.stmt;

/** Block run when the enclosing scope exits. */
public record DeferStmt(BlockStmt body) implements Stmt {}
