package monoc.ast.expr;

public sealed interface Literal extends Expr
        permits IntLiteral, FloatLiteral, StringLiteral, CharLiteral,
        BoolLiteral, NoneLiteral {}
