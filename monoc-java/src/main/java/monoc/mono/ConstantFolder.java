package monoc.mono;

import monoc.ast.expr.BinaryExpr;
import monoc.ast.expr.BoolLiteral;
import monoc.ast.expr.Expr;
import monoc.ast.expr.IntLiteral;

/**
 * Folds a binary operation whose operands are both literals.
 * Integer arithmetic wraps at 64 bits; {@code /} and {@code %} truncate toward
 * zero like the generated code does.
 */
public final class ConstantFolder {
    private ConstantFolder() {}

    /** Folded literal, or {@code b} itself when it cannot be folded. */
    public static Expr tryConstFold(BinaryExpr b) {
        if (b.left() instanceof IntLiteral l && b.right() instanceof IntLiteral r) {
            long x = l.value();
            long y = r.value();
            return switch (b.op()) {
                case ADD -> new IntLiteral(x + y);
                case SUB -> new IntLiteral(x - y);
                case MUL -> new IntLiteral(x * y);
                case DIV -> y == 0 ? b : new IntLiteral(x / y);
                case MOD -> y == 0 ? b : new IntLiteral(x % y);
                default -> b;
            };
        }

        if (b.left() instanceof BoolLiteral l && b.right() instanceof BoolLiteral r) {
            return switch (b.op()) {
                case AND -> new BoolLiteral(l.value() && r.value());
                case OR -> new BoolLiteral(l.value() || r.value());
                default -> b;
            };
        }

        return b;
    }
}
