package monoc.mono;

import monoc.ast.expr.*;
import monoc.ast.pattern.BindingPattern;
import monoc.ast.stmt.BlockStmt;
import monoc.ast.stmt.ExprStmt;
import monoc.ast.stmt.MatchStmt;
import monoc.ast.stmt.VarDeclStmt;
import monoc.ast.type.GenericTypeRef;
import monoc.ast.type.TypeArg;
import monoc.lexer.Lexer;
import monoc.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SubstituterTest {

    private static final Map<String, CompileTimeValue> SUBS = Map.of(
            "N", new CompileTimeValue.IntValue(3),
            "D", new CompileTimeValue.BoolValue(true)
    );

    private static BlockStmt body(String stmts) {
        var tokens = new Lexer("fnc f() { " + stmts + " }").tokenize();
        return new Parser(tokens).parseProgram().functions().get(0).body();
    }

    private static BlockStmt subst(String stmts) {
        return new Substituter(SUBS).transformBlock(body(stmts));
    }

    private static Expr substExpr(String expr) {
        return ((ExprStmt) subst(expr + ";").statements().get(0)).expr();
    }

    @Test
    void replaces_references_in_every_statement_kind() {
        assertEquals(body("""
                let a: int[3] = 3;
                x[3] = 3;
                if (T) { r(3); } else if (3 > y) { r(1); } else { r(3); }
                while (i < 3) { i = i + 3; break; }
                for (k in 0...3) { continue; }
                defer { close(3); }
                { nested(3); }
                return 3;
                """), subst("""
                let a: int[N] = N;
                x[N] = N;
                if (D) { r(N); } else if (N > y) { r(1); } else { r(N); }
                while (i < N) { i = i + N; break; }
                for (k in 0...N) { continue; }
                defer { close(N); }
                { nested(N); }
                return N;
                """));
    }

    @Test
    void recurses_into_match_arms_and_with_bodies() {
        assertEquals(body("""
                match (v + 3) {
                  case 0 { r(3); }
                  case k if k > 3 { r(T); }
                  case _ { }
                }
                with (h = open(3)) { use(h, 3); }
                """), subst("""
                match (v + N) {
                  case 0 { r(N); }
                  case k if k > N { r(D); }
                  case _ { }
                }
                with (h = open(N)) { use(h, N); }
                """));
    }

    @Test
    void binding_pattern_named_like_a_parameter_is_kept() {
        var m = (MatchStmt) subst("match (v) { case N { } }").statements().get(0);
        assertEquals(new BindingPattern("N"), m.arms().get(0).pattern());
    }

    @Test
    void replaces_references_in_every_expression_kind() {
        assertEquals(new MethodCallExpr(new VarExpr("o"), "m", List.of(new IntLiteral(3))), substExpr("o.m(N)"));
        assertEquals(new SliceExpr(new VarExpr("a"), new IntLiteral(3), new IntLiteral(4)), substExpr("a[N:N + 1]"));
        assertEquals(new ArrayLiteralExpr(List.of(new IntLiteral(3), new BoolLiteral(true))), substExpr("[N, D]"));
        assertEquals(new StructLiteralExpr("P", List.of(new StructLiteralExpr.FieldInit("x", new IntLiteral(3)))),
                substExpr("new P { x: N }"));
        assertEquals(new TernaryExpr(new BoolLiteral(true), new IntLiteral(3), new IntLiteral(0)), substExpr("D ? N : 0"));
        assertEquals(new TryExpr(new CallExpr(new VarExpr("g"), List.of(new IntLiteral(3)))), substExpr("try g(N)"));
        assertEquals(new FieldAccessExpr(new ArrayAccessExpr(new VarExpr("a"), new IntLiteral(3)), "len"),
                substExpr("a[N].len"));
    }

    @Test
    void replaces_compile_time_args_of_nested_calls() {
        assertEquals(new CallExpr(new VarExpr("g"), List.of(new IntLiteral(4), new BoolLiteral(true)),
                List.of(new IntLiteral(3))), substExpr("g[N + 1, D](N)"));
    }

    @Test
    void folds_nested_arithmetic_bottom_up() {
        assertEquals(new IntLiteral(8), substExpr("(N + 1) * 2"));
        assertEquals(new IntLiteral(1), substExpr("N / 2"));
        assertEquals(new BoolLiteral(false), substExpr("D && F"));
    }

    @Test
    void partially_constant_expression_is_not_folded() {
        assertEquals(new BinaryExpr(new IntLiteral(3), BinaryExpr.Operator.ADD, new VarExpr("x")), substExpr("N + x"));
        assertEquals(new BinaryExpr(new BoolLiteral(true), BinaryExpr.Operator.OR, new VarExpr("x")), substExpr("D || x"));
    }

    @Test
    void unary_is_not_folded() {
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NEG, new IntLiteral(3)), substExpr("-N"));
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NOT, new BoolLiteral(true)), substExpr("!D"));
    }

    @Test
    void division_by_substituted_zero_stays_binary() {
        var zero = new Substituter(Map.of("Z", new CompileTimeValue.IntValue(0)));
        var e = zero.transformExpr(new BinaryExpr(new IntLiteral(5), BinaryExpr.Operator.DIV, new VarExpr("Z")));
        assertEquals(new BinaryExpr(new IntLiteral(5), BinaryExpr.Operator.DIV, new IntLiteral(0)), e);
    }

    @Test
    void other_identifiers_are_left_alone() {
        assertEquals(new VarExpr("M"), substExpr("M"));
    }

    @Test
    void untouched_tree_is_returned_as_same_instance() {
        var b = body("""
                let a: int[4] = x + 1;
                if (y) { r(a.len, [1, 2]); }
                match (a) { case 1 { } }
                with (h = open()) { }
                """);
        assertSame(b, new Substituter(SUBS).transformBlock(b));
    }

    @Test
    void generic_type_arg_naming_a_parameter_becomes_value() {
        var v = (VarDeclStmt) subst("let m: Matrix<N, int, (N * 2), D> = z;").statements().get(0);
        var g = (GenericTypeRef) v.type();
        assertEquals(new TypeArg.OfValue(new IntLiteral(3)), g.args().get(0));
        assertTrue(g.args().get(1) instanceof TypeArg.OfType);
        assertEquals(new TypeArg.OfValue(new IntLiteral(6)), g.args().get(2));
        assertEquals(new TypeArg.OfValue(new BoolLiteral(true)), g.args().get(3));
    }
}
