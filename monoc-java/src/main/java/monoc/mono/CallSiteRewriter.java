package monoc.mono;

import monoc.ast.decl.FunctionDecl;
import monoc.ast.expr.CallExpr;
import monoc.ast.expr.Expr;
import monoc.ast.expr.VarExpr;

import java.util.List;

/**
 * Points calls of generic functions at their specializations:
 * {@code double[2](5)} becomes {@code double_2(5)}.
 * <p>
 * Only calls through a plain name are handled; {@code obj.f[1]()} and other
 * computed callees are left alone. Specializations must already exist in the
 * context.
 */
public final class CallSiteRewriter extends TreeTransformer {

    private final SpecializationContext context;

    public CallSiteRewriter(SpecializationContext context) {
        this.context = context;
    }

    /** Name of the called function, or null when the callee is not a plain name. */
    public static String calleeName(CallExpr call) {
        return call.callee() instanceof VarExpr v ? v.name() : null;
    }

    public static boolean shouldRewrite(CallExpr call, SpecializationContext context) {
        if (call.compileTimeArgs().isEmpty()) return false;
        String name = calleeName(call);
        return name != null && context.isRegistered(name);
    }

    public FunctionDecl rewrite(FunctionDecl decl) {
        return transformFunction(decl);
    }

    @Override
    public Expr transformExpr(Expr e) {
        Expr out = super.transformExpr(e);
        if (!(e instanceof CallExpr original) || !shouldRewrite(original, context)) return out;

        String name = calleeName(original);
        List<CompileTimeValue> args = Monomorphizer.extractCompileTimeArgs(original);
        FunctionDecl specialized = context.findSpecialization(name, args)
                .orElseThrow(() -> new IllegalStateException(
                        "No specialization of '" + name + "' for " + args + " to rewrite the call to"));

        CallExpr rebuilt = (CallExpr) out;
        return new CallExpr(new VarExpr(specialized.name()), List.of(), rebuilt.args());
    }
}
