package monoc.mono;

import monoc.ast.Program;
import monoc.ast.decl.Decl;
import monoc.ast.decl.FunctionDecl;
import monoc.ast.expr.CallExpr;
import monoc.ast.expr.Expr;
import monoc.ast.expr.FieldAccessExpr;
import monoc.ast.expr.Literal;
import monoc.ast.expr.VarExpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Whole-program monomorphization: every function with compile-time
 * parameters is replaced by the specializations its call sites need.
 * <p>
 * Output order is the non-generic declarations as written, then the
 * specializations in the order they were first created. Generic originals
 * never appear in the output, even when nothing calls them.
 * <p>
 * An instance handles one program.
 */
public final class Monomorphizer {

    private static final Logger LOGGER = Logger.getLogger(Monomorphizer.class.getName());

    public static final int DEFAULT_MAX_SPECIALIZATIONS = 10_000;

    private final SpecializationContext context = new SpecializationContext();
    private final int maxSpecializations;
    private boolean used;

    public Monomorphizer() {
        this(DEFAULT_MAX_SPECIALIZATIONS);
    }

    /** @param maxSpecializations ceiling that stops unbounded compile-time recursion */
    public Monomorphizer(int maxSpecializations) {
        if (maxSpecializations < 1) {
            throw new IllegalArgumentException("maxSpecializations must be positive: " + maxSpecializations);
        }
        this.maxSpecializations = maxSpecializations;
    }

    public SpecializationContext context() {
        return context;
    }

    public Program monomorphizeProgram(Program program) {
        if (used) throw new IllegalStateException("Monomorphizer already ran; create a new one per program");
        used = true;

        // 1) generics
        List<FunctionDecl> work = new ArrayList<>();
        for (FunctionDecl f : program.functions()) {
            if (context.needsSpecialization(f)) {
                context.registerOriginalFunction(f);
            } else {
                context.reserveName(f.name());
                work.add(f);
            }
        }

        // 2) specialize for every call site; new specializations are scanned in turn,
        //    since substitution may have turned g[N] into g[10]
        Deque<FunctionDecl> queue = new ArrayDeque<>(work);
        while (!queue.isEmpty()) {
            FunctionDecl f = queue.poll();
            for (CallExpr call : CallCollector.collect(f)) {
                FunctionDecl created = specializeCall(call);
                if (created != null) queue.add(created);
            }
        }

        // 3) rewrite call sites and assemble
        CallSiteRewriter rewriter = new CallSiteRewriter(context);
        List<Decl> items = new ArrayList<>();
        for (Decl d : program.items()) {
            if (d instanceof FunctionDecl f) {
                if (!context.needsSpecialization(f)) items.add(rewriter.rewrite(f));
            } else {
                items.add(d);
            }
        }
        for (SpecializationKey key : context.specializationKeys()) {
            FunctionDecl specialized = context.findSpecialization(key.functionName(), key.args()).orElseThrow();
            FunctionDecl rewritten = rewriter.rewrite(specialized);
            if (rewritten != specialized) context.replaceSpecialization(key, rewritten);
            items.add(rewritten);
        }

        LOGGER.log(Level.FINE, "Monomorphized {0} generic function(s) into {1} specialization(s)",
                new Object[]{countGenerics(program), context.specializationCount()});
        return new Program(items);
    }

    // newly created specialization, or null
    private FunctionDecl specializeCall(CallExpr call) {
        String name = CallSiteRewriter.calleeName(call);
        if (!CallSiteRewriter.shouldRewrite(call, context)) {
            if (name != null && call.compileTimeArgs().isEmpty() && context.isRegistered(name)) {
                LOGGER.log(Level.WARNING, "Call to generic function ''{0}'' has no compile-time arguments; left as is",
                        name);
            }
            return null;
        }

        List<CompileTimeValue> args = extractCompileTimeArgs(call);
        if (context.findSpecialization(name, args).isPresent()) return null;
        if (context.specializationCount() >= maxSpecializations) {
            throw new MonomorphizationException("More than " + maxSpecializations
                    + " specializations needed while specializing '" + name + "' for " + args
                    + "; unbounded compile-time recursion?");
        }
        return context.specializeFunction(context.originalFunction(name), args);
    }

    private long countGenerics(Program program) {
        return program.functions().stream().filter(context::needsSpecialization).count();
    }

    /**
     * Values of the compile-time arguments of {@code call}. Each argument has to
     * be a literal already; nothing is evaluated here.
     */
    public static List<CompileTimeValue> extractCompileTimeArgs(CallExpr call) {
        List<CompileTimeValue> values = new ArrayList<>(call.compileTimeArgs().size());
        for (int i = 0; i < call.compileTimeArgs().size(); i++) {
            Expr arg = call.compileTimeArgs().get(i);
            if (!(arg instanceof Literal literal)) {
                throw new MonomorphizationException("Compile-time argument " + i + " in call to '"
                        + describe(call.callee()) + "' must be a literal, got "
                        + arg.getClass().getSimpleName());
            }
            values.add(CompileTimeValue.of(literal));
        }
        return List.copyOf(values);
    }

    private static String describe(Expr callee) {
        if (callee instanceof VarExpr v) return v.name();
        if (callee instanceof FieldAccessExpr f) return describe(f.target()) + "." + f.field();
        return callee.getClass().getSimpleName();
    }
}
