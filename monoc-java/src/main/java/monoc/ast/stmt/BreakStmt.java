package monoc.ast.stmt;

public record BreakStmt() implements Stmt {}
