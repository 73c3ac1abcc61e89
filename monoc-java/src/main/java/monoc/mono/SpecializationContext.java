package monoc.mono;

import monoc.ast.decl.FunctionDecl;
import monoc.ast.stmt.BlockStmt;
import monoc.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of generic functions and cache of their specializations for one
 * compilation. Not thread-safe; create one per run.
 */
public final class SpecializationContext {

    private static final Logger LOGGER = Logger.getLogger(SpecializationContext.class.getName());

    private final Map<String, FunctionDecl> originals = new LinkedHashMap<>();
    // insertion order == creation order
    private final Map<SpecializationKey, FunctionDecl> specializations = new LinkedHashMap<>();
    // emitted name -> what owns it, for error messages
    private final Map<String, String> nameOwners = new HashMap<>();

    /** First registration of a name wins; later ones are ignored. */
    public void registerOriginalFunction(FunctionDecl decl) {
        originals.putIfAbsent(decl.name(), decl);
    }

    public boolean isRegistered(String name) {
        return originals.containsKey(name);
    }

    /** Registered generic function, or null. */
    public FunctionDecl originalFunction(String name) {
        return originals.get(name);
    }

    public boolean needsSpecialization(FunctionDecl decl) {
        return !decl.compileTimeParams().isEmpty();
    }

    /** Keeps specializations from taking the name of a function that is emitted as written. */
    public void reserveName(String name) {
        nameOwners.putIfAbsent(name, "function '" + name + "'");
    }

    /**
     * {@code process} with {@code (256, true)} becomes {@code process_256_true};
     * negative integers are spelled {@code neg10}. No arguments, no change.
     */
    public String getSpecializedFunctionName(String name, List<CompileTimeValue> args) {
        if (args.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name);
        for (CompileTimeValue arg : args) {
            sb.append('_').append(arg.nameSegment());
        }
        return sb.toString();
    }

    /**
     * Specialization of {@code decl} for {@code args}. Repeated requests for the
     * same name and argument values return the same instance; after a
     * {@link Monomorphizer} run that is the instance in the output program.
     *
     * @throws MonomorphizationException on an argument count mismatch, or when
     *         the specialized name is already taken by another function
     */
    public FunctionDecl specializeFunction(FunctionDecl decl, List<CompileTimeValue> args) {
        SpecializationKey key = new SpecializationKey(decl.name(), args);
        FunctionDecl cached = specializations.get(key);
        if (cached != null) return cached;

        List<FunctionDecl.CompileTimeParam> ctParams = decl.compileTimeParams();
        if (ctParams.size() != args.size()) {
            throw new MonomorphizationException("Function '" + decl.name() + "' expects "
                    + ctParams.size() + " compile-time argument(s), got " + args.size());
        }

        String name = getSpecializedFunctionName(decl.name(), args);
        String owner = nameOwners.get(name);
        if (owner != null) {
            throw new MonomorphizationException("Specialization " + describe(key) + " would be named '"
                    + name + "', which is already taken by " + owner);
        }

        Map<String, CompileTimeValue> substitutions = new LinkedHashMap<>();
        for (int i = 0; i < ctParams.size(); i++) {
            substitutions.put(ctParams.get(i).name(), args.get(i));
        }
        Substituter substituter = new Substituter(substitutions);

        List<FunctionDecl.Param> params = new ArrayList<>(decl.params().size());
        for (FunctionDecl.Param p : decl.params()) {
            params.add(substituter.transformParam(p));
        }
        TypeRef ret = decl.returnType() == null ? null : substituter.transformType(decl.returnType());
        BlockStmt body = substituter.transformBlock(decl.body());

        FunctionDecl specialized = new FunctionDecl(name, List.of(), params, ret, body);
        specializations.put(key, specialized);
        nameOwners.put(name, "specialization " + describe(key));
        LOGGER.log(Level.FINE, "Specialized {0} as {1}", new Object[]{decl.name(), name});
        return specialized;
    }

    public Optional<FunctionDecl> findSpecialization(String name, List<CompileTimeValue> args) {
        return Optional.ofNullable(specializations.get(new SpecializationKey(name, args)));
    }

    /** In the order they were first created. */
    public List<FunctionDecl> specializations() {
        return List.copyOf(specializations.values());
    }

    public List<SpecializationKey> specializationKeys() {
        return List.copyOf(specializations.keySet());
    }

    public int specializationCount() {
        return specializations.size();
    }

    // swaps in the call-rewritten form so the cache hands out the emitted instance
    void replaceSpecialization(SpecializationKey key, FunctionDecl rewritten) {
        if (!specializations.containsKey(key)) {
            throw new IllegalStateException("No specialization cached for " + key);
        }
        specializations.put(key, rewritten);
    }

    private static String describe(SpecializationKey key) {
        StringJoiner sj = new StringJoiner(", ", key.functionName() + "[", "]");
        for (CompileTimeValue v : key.args()) {
            if (v instanceof CompileTimeValue.IntValue i) sj.add(Long.toString(i.value()));
            else if (v instanceof CompileTimeValue.BoolValue b) sj.add(Boolean.toString(b.value()));
            else sj.add(((CompileTimeValue.OtherValue) v).literal().toString());
        }
        return sj.toString();
    }
}
