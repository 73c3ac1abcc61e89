package monoc.mono;

import monoc.ast.Program;
import monoc.ast.decl.Decl;
import monoc.ast.expr.CallExpr;
import monoc.ast.expr.Expr;
import monoc.ast.stmt.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every call expression under a node, in pre-order and source order: a
 * call comes before the calls inside its callee and arguments.
 */
public final class CallCollector {
    private CallCollector() {}

    public static List<CallExpr> collect(Program program) {
        Walker w = new Walker();
        for (Decl d : program.items()) w.transformDecl(d);
        return w.calls;
    }

    public static List<CallExpr> collect(Decl decl) {
        Walker w = new Walker();
        w.transformDecl(decl);
        return w.calls;
    }

    public static List<CallExpr> collect(Stmt stmt) {
        Walker w = new Walker();
        w.transformStmt(stmt);
        return w.calls;
    }

    public static List<CallExpr> collect(Expr expr) {
        Walker w = new Walker();
        w.transformExpr(expr);
        return w.calls;
    }

    // read-only use of the transformer: nothing is replaced, so every node comes back as-is
    private static final class Walker extends TreeTransformer {
        final List<CallExpr> calls = new ArrayList<>();

        @Override
        public Expr transformExpr(Expr e) {
            if (e instanceof CallExpr c) calls.add(c);
            return super.transformExpr(e);
        }
    }
}
