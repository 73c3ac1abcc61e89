package monoc.ast.stmt;

public record ContinueStmt() implements Stmt {}
