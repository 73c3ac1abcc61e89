package monoc.mono;

import monoc.ast.decl.Decl;
import monoc.ast.decl.FieldDecl;
import monoc.ast.decl.FunctionDecl;
import monoc.ast.decl.StructDecl;
import monoc.ast.expr.*;
import monoc.ast.pattern.Pattern;
import monoc.ast.stmt.*;
import monoc.ast.type.ArrayTypeRef;
import monoc.ast.type.GenericTypeRef;
import monoc.ast.type.NamedTypeRef;
import monoc.ast.type.PrimitiveTypeRef;
import monoc.ast.type.TypeArg;
import monoc.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Bottom-up rebuild of the program tree. Every node kind of the sealed
 * hierarchies is visited; children are visited in source order.
 * <p>
 * A node whose children all come back as the same instances is itself
 * returned unchanged, so a pass that touches nothing returns the input tree.
 * Subclasses override the {@code transform*} hooks and call {@code super} for
 * the default recursion.
 */
public abstract class TreeTransformer {

    // ---------- declarations ----------

    public Decl transformDecl(Decl d) {
        if (d instanceof FunctionDecl f) return transformFunction(f);
        if (d instanceof StructDecl s) return transformStruct(s);
        throw new IllegalStateException("Unknown declaration kind: " + d.getClass().getName());
    }

    public FunctionDecl transformFunction(FunctionDecl f) {
        List<FunctionDecl.Param> params = transformAll(f.params(), this::transformParam);
        TypeRef ret = transformTypeOpt(f.returnType());
        BlockStmt body = transformBlock(f.body());
        if (params == f.params() && ret == f.returnType() && body == f.body()) return f;
        return new FunctionDecl(f.name(), f.compileTimeParams(), params, ret, body);
    }

    public FunctionDecl.Param transformParam(FunctionDecl.Param p) {
        TypeRef t = transformType(p.type());
        return t == p.type() ? p : new FunctionDecl.Param(p.name(), t);
    }

    public StructDecl transformStruct(StructDecl s) {
        List<FieldDecl> fields = transformAll(s.fields(), f -> {
            TypeRef t = transformType(f.type());
            return t == f.type() ? f : new FieldDecl(f.name(), t);
        });
        return fields == s.fields() ? s : new StructDecl(s.name(), fields);
    }

    // ---------- statements ----------

    public BlockStmt transformBlock(BlockStmt b) {
        List<Stmt> stmts = transformAll(b.statements(), this::transformStmt);
        return stmts == b.statements() ? b : new BlockStmt(stmts);
    }

    public Stmt transformStmt(Stmt s) {
        if (s instanceof BlockStmt b) return transformBlock(b);

        if (s instanceof VarDeclStmt v) {
            TypeRef t = transformTypeOpt(v.type());
            Expr init = transformExprOpt(v.initializer());
            if (t == v.type() && init == v.initializer()) return v;
            return new VarDeclStmt(v.name(), v.mutable(), t, init);
        }

        if (s instanceof AssignStmt a) {
            Expr target = transformExpr(a.target());
            Expr value = transformExpr(a.value());
            if (target == a.target() && value == a.value()) return a;
            return new AssignStmt(target, value);
        }

        if (s instanceof ReturnStmt r) {
            Expr value = transformExprOpt(r.value());
            return value == r.value() ? r : new ReturnStmt(value);
        }

        if (s instanceof IfStmt i) {
            List<IfStmt.Branch> branches = transformAll(i.branches(), br -> {
                Expr cond = transformExpr(br.condition());
                BlockStmt body = transformBlock(br.body());
                if (cond == br.condition() && body == br.body()) return br;
                return new IfStmt.Branch(cond, body);
            });
            BlockStmt elseBlock = i.elseBlock() == null ? null : transformBlock(i.elseBlock());
            if (branches == i.branches() && elseBlock == i.elseBlock()) return i;
            return new IfStmt(branches, elseBlock);
        }

        if (s instanceof WhileStmt w) {
            Expr cond = transformExpr(w.condition());
            BlockStmt body = transformBlock(w.body());
            if (cond == w.condition() && body == w.body()) return w;
            return new WhileStmt(cond, body);
        }

        if (s instanceof ForStmt f) {
            // loop variable is a binding, not a reference
            Expr iterable = transformExpr(f.iterable());
            BlockStmt body = transformBlock(f.body());
            if (iterable == f.iterable() && body == f.body()) return f;
            return new ForStmt(f.varName(), iterable, body);
        }

        if (s instanceof ExprStmt e) {
            Expr expr = transformExpr(e.expr());
            return expr == e.expr() ? e : new ExprStmt(expr);
        }

        if (s instanceof DeferStmt d) {
            BlockStmt body = transformBlock(d.body());
            return body == d.body() ? d : new DeferStmt(body);
        }

        if (s instanceof MatchStmt m) {
            Expr scrutinee = transformExpr(m.scrutinee());
            List<MatchStmt.Arm> arms = transformAll(m.arms(), arm -> {
                Pattern pattern = transformPattern(arm.pattern());
                Expr guard = transformExprOpt(arm.guard());
                BlockStmt body = transformBlock(arm.body());
                if (pattern == arm.pattern() && guard == arm.guard() && body == arm.body()) return arm;
                return new MatchStmt.Arm(pattern, guard, body);
            });
            if (scrutinee == m.scrutinee() && arms == m.arms()) return m;
            return new MatchStmt(scrutinee, arms);
        }

        if (s instanceof WithStmt w) {
            Expr value = transformExpr(w.value());
            BlockStmt body = transformBlock(w.body());
            if (value == w.value() && body == w.body()) return w;
            return new WithStmt(w.varName(), value, body);
        }

        if (s instanceof BreakStmt || s instanceof ContinueStmt) return s;

        throw new IllegalStateException("Unknown statement kind: " + s.getClass().getName());
    }

    /** Patterns hold only literals and binding names. */
    public Pattern transformPattern(Pattern p) {
        return p;
    }

    // ---------- expressions ----------

    public Expr transformExpr(Expr e) {
        if (e instanceof Literal || e instanceof VarExpr) return e;

        if (e instanceof BinaryExpr b) {
            Expr l = transformExpr(b.left());
            Expr r = transformExpr(b.right());
            if (l == b.left() && r == b.right()) return b;
            return new BinaryExpr(l, b.op(), r);
        }

        if (e instanceof UnaryExpr u) {
            Expr operand = transformExpr(u.expr());
            return operand == u.expr() ? u : new UnaryExpr(u.op(), operand);
        }

        if (e instanceof CallExpr c) {
            Expr callee = transformExpr(c.callee());
            List<Expr> ctArgs = transformAll(c.compileTimeArgs(), this::transformExpr);
            List<Expr> args = transformAll(c.args(), this::transformExpr);
            if (callee == c.callee() && ctArgs == c.compileTimeArgs() && args == c.args()) return c;
            return new CallExpr(callee, ctArgs, args);
        }

        if (e instanceof MethodCallExpr m) {
            Expr receiver = transformExpr(m.receiver());
            List<Expr> args = transformAll(m.args(), this::transformExpr);
            if (receiver == m.receiver() && args == m.args()) return m;
            return new MethodCallExpr(receiver, m.method(), args);
        }

        if (e instanceof FieldAccessExpr f) {
            Expr target = transformExpr(f.target());
            return target == f.target() ? f : new FieldAccessExpr(target, f.field());
        }

        if (e instanceof ArrayAccessExpr a) {
            Expr array = transformExpr(a.array());
            Expr index = transformExpr(a.index());
            if (array == a.array() && index == a.index()) return a;
            return new ArrayAccessExpr(array, index);
        }

        if (e instanceof SliceExpr s) {
            Expr target = transformExpr(s.target());
            Expr start = transformExprOpt(s.start());
            Expr end = transformExprOpt(s.end());
            if (target == s.target() && start == s.start() && end == s.end()) return s;
            return new SliceExpr(target, start, end);
        }

        if (e instanceof ArrayLiteralExpr a) {
            List<Expr> elements = transformAll(a.elements(), this::transformExpr);
            return elements == a.elements() ? a : new ArrayLiteralExpr(elements);
        }

        if (e instanceof StructLiteralExpr s) {
            List<StructLiteralExpr.FieldInit> fields = transformAll(s.fields(), fi -> {
                Expr value = transformExpr(fi.value());
                return value == fi.value() ? fi : new StructLiteralExpr.FieldInit(fi.name(), value);
            });
            return fields == s.fields() ? s : new StructLiteralExpr(s.typeName(), fields);
        }

        if (e instanceof TernaryExpr t) {
            Expr cond = transformExpr(t.condition());
            Expr thenE = transformExpr(t.thenExpr());
            Expr elseE = transformExpr(t.elseExpr());
            if (cond == t.condition() && thenE == t.thenExpr() && elseE == t.elseExpr()) return t;
            return new TernaryExpr(cond, thenE, elseE);
        }

        if (e instanceof TryExpr t) {
            Expr inner = transformExpr(t.expr());
            return inner == t.expr() ? t : new TryExpr(inner);
        }

        if (e instanceof RangeExpr r) {
            Expr from = transformExpr(r.from());
            Expr to = transformExpr(r.to());
            if (from == r.from() && to == r.to()) return r;
            return new RangeExpr(from, to);
        }

        throw new IllegalStateException("Unknown expression kind: " + e.getClass().getName());
    }

    // ---------- types ----------

    public TypeRef transformType(TypeRef t) {
        if (t instanceof PrimitiveTypeRef || t instanceof NamedTypeRef) return t;

        if (t instanceof ArrayTypeRef a) {
            TypeRef element = transformTypeOpt(a.element());
            Expr size = transformExprOpt(a.size());
            if (element == a.element() && size == a.size()) return a;
            return new ArrayTypeRef(element, size);
        }

        if (t instanceof GenericTypeRef g) {
            List<TypeArg> args = transformAll(g.args(), this::transformTypeArg);
            return args == g.args() ? g : new GenericTypeRef(g.name(), args);
        }

        throw new IllegalStateException("Unknown type kind: " + t.getClass().getName());
    }

    public TypeArg transformTypeArg(TypeArg arg) {
        if (arg instanceof TypeArg.OfType ot) {
            TypeRef t = transformType(ot.type());
            return t == ot.type() ? ot : new TypeArg.OfType(t);
        }
        TypeArg.OfValue ov = (TypeArg.OfValue) arg;
        Expr value = transformExpr(ov.value());
        return value == ov.value() ? ov : new TypeArg.OfValue(value);
    }

    // ---------- helpers ----------

    protected final Expr transformExprOpt(Expr e) {
        return e == null ? null : transformExpr(e);
    }

    protected final TypeRef transformTypeOpt(TypeRef t) {
        return t == null ? null : transformType(t);
    }

    /** Applies {@code fn} to each item; returns {@code items} itself when nothing changed. */
    protected static <T> List<T> transformAll(List<T> items, UnaryOperator<T> fn) {
        List<T> out = null;
        for (int i = 0; i < items.size(); i++) {
            T before = items.get(i);
            T after = fn.apply(before);
            if (out == null && after != before) {
                out = new ArrayList<>(items.subList(0, i));
            }
            if (out != null) out.add(after);
        }
        return out == null ? items : out;
    }
}
