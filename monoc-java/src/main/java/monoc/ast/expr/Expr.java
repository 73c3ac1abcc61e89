package monoc.ast.expr;

public sealed interface Expr
        permits Literal, VarExpr, BinaryExpr, UnaryExpr,
        CallExpr, MethodCallExpr, FieldAccessExpr,
        ArrayAccessExpr, SliceExpr, ArrayLiteralExpr, StructLiteralExpr,
        TernaryExpr, TryExpr, RangeExpr {}
