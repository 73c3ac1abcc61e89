package monoc.ast.decl;

public sealed interface Decl permits FunctionDecl, StructDecl {}
