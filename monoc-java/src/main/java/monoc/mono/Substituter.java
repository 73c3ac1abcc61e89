package monoc.mono;

import monoc.ast.expr.BinaryExpr;
import monoc.ast.expr.Expr;
import monoc.ast.expr.VarExpr;
import monoc.ast.type.NamedTypeRef;
import monoc.ast.type.TypeArg;

import java.util.Map;

/**
 * Replaces references to compile-time parameters with literals and folds the
 * binary operations that become constant as a result.
 * <p>
 * Matching is by name only. Unary operations are never folded, even when
 * their operand turns into a literal.
 */
public final class Substituter extends TreeTransformer {

    private final Map<String, CompileTimeValue> substitutions;

    public Substituter(Map<String, CompileTimeValue> substitutions) {
        this.substitutions = Map.copyOf(substitutions);
    }

    @Override
    public Expr transformExpr(Expr e) {
        if (e instanceof VarExpr v) {
            CompileTimeValue value = substitutions.get(v.name());
            return value == null ? v : value.toLiteral();
        }

        Expr out = super.transformExpr(e);
        if (out instanceof BinaryExpr b) return ConstantFolder.tryConstFold(b);
        return out;
    }

    /**
     * In {@code Matrix<Rows, int>} the parser cannot tell {@code Rows} from a
     * type name; a slot naming a compile-time parameter becomes a value slot.
     */
    @Override
    public TypeArg transformTypeArg(TypeArg arg) {
        if (arg instanceof TypeArg.OfType ot && ot.type() instanceof NamedTypeRef n) {
            CompileTimeValue value = substitutions.get(n.name());
            if (value != null) return new TypeArg.OfValue(value.toLiteral());
        }
        return super.transformTypeArg(arg);
    }
}
