package monoc.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, VarDeclStmt, AssignStmt, ReturnStmt,
        IfStmt, WhileStmt, ForStmt, ExprStmt,
        DeferStmt, MatchStmt, WithStmt,
        BreakStmt, ContinueStmt {}
