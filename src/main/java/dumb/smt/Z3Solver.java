package dumb.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import dumb.smt.SmtException.SolverFailure;
import dumb.smt.util.Log;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Solver} backed by the Z3 Java API.
 * <p>
 * Supports the Bool/Real fragment: boolean connectives, (chained) equality and
 * comparisons, {@code distinct}, {@code ite}, linear and non-linear arithmetic,
 * and {@code let} in the flattened form produced by the {@link Elaborator}.
 */
public class Z3Solver implements Solver {

    private final Context ctx;
    private final com.microsoft.z3.Solver solver;
    private final Map<String, com.microsoft.z3.Expr<?>> constants = new HashMap<>();

    public Z3Solver() {
        this.ctx = new Context();
        this.solver = ctx.mkSolver();
    }

    /** SMT-LIB quoted symbols name the same constant as their unquoted text. */
    static String symbol(String name) {
        return name.length() >= 2 && name.startsWith("|") && name.endsWith("|")
                ? name.substring(1, name.length() - 1)
                : name;
    }

    @Override
    public void declareVariable(String name, Sort sort) {
        com.microsoft.z3.Expr<?> z3 = switch (sort) {
            case BOOL -> ctx.mkBoolConst(symbol(name));
            case REAL -> ctx.mkRealConst(symbol(name));
        };
        constants.put(name, z3);
    }

    /**
     * Accepts any constraint that translates to a Bool term. The elaborated sort
     * is not consulted: operators such as {@code distinct} are boolean even though
     * they are sorted by their last argument.
     */
    @Override
    public void addAssertion(Expr constraint) {
        try {
            var z3 = translate(constraint, Map.of());
            if (!(z3 instanceof BoolExpr b))
                throw new SolverFailure("Assertion is not boolean: " + constraint);
            solver.add(b);
        } catch (Z3Exception e) {
            throw new SolverFailure("Z3 rejected " + constraint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Result check(Options options) {
        try {
            if (options.timeoutMillis() > 0) {
                var params = ctx.mkParams();
                params.add("timeout", options.timeoutMillis());
                solver.setParameters(params);
            }
            var status = solver.check();
            if (status == Status.SATISFIABLE) {
                return new Result(Verdict.SATISFIABLE, options.produceModels() ? Optional.of(model()) : Optional.empty());
            } else if (status == Status.UNSATISFIABLE) {
                return Result.of(Verdict.UNSATISFIABLE);
            } else {
                Log.debug("Z3 returned unknown: {}", solver.getReasonUnknown());
                return Result.of(Verdict.UNKNOWN);
            }
        } catch (Z3Exception e) {
            throw new SolverFailure("Z3 check failed: " + e.getMessage(), e);
        }
    }

    private Map<String, String> model() {
        var model = solver.getModel();
        var values = new LinkedHashMap<String, String>();
        for (var decl : model.getConstDecls())
            values.put(decl.getName().toString(), String.valueOf(model.getConstInterp(decl)));
        return values;
    }

    @Override
    public void close() {
        ctx.close();
    }

    private com.microsoft.z3.Expr<?> translate(Expr e, Map<String, com.microsoft.z3.Expr<?>> scope) {
        return switch (e.kind()) {
            case LITERAL -> ctx.mkReal(e.name());
            case VARIABLE -> variable(e, scope);
            case BINDING -> throw new SolverFailure("Binding outside of let: " + e);
            case APPLY -> e.isLet() ? let(e, scope) : apply(e, scope);
        };
    }

    private com.microsoft.z3.Expr<?> variable(Expr e, Map<String, com.microsoft.z3.Expr<?>> scope) {
        var local = scope.get(e.name());
        if (local != null) return local;
        var declared = constants.get(e.name());
        if (declared == null)
            throw new SolverFailure("Variable was never declared to the solver: " + e.name());
        return declared;
    }

    private com.microsoft.z3.Expr<?> let(Expr e, Map<String, com.microsoft.z3.Expr<?>> scope) {
        var args = e.args();
        var inner = new HashMap<>(scope);
        for (var binding : args.subList(0, args.size() - 1)) {
            if (binding.kind() != Expr.Kind.BINDING)
                throw new SolverFailure("Malformed let: " + e);
            inner.put(binding.name(), translate(binding.args().get(0), scope));
        }
        return translate(args.get(args.size() - 1), inner);
    }

    private com.microsoft.z3.Expr<?> apply(Expr e, Map<String, com.microsoft.z3.Expr<?>> scope) {
        var args = e.args();
        var z = new ArrayList<com.microsoft.z3.Expr<?>>(args.size());
        for (var arg : args)
            z.add(translate(arg, scope));

        return switch (e.name()) {
            case "and" -> ctx.mkAnd(bools(z, e));
            case "or" -> ctx.mkOr(bools(z, e));
            case "not" -> ctx.mkNot(bool(unary(z, e), e));
            case "=>" -> implies(bools(z, e), e);
            case "xor" -> {
                var b = bools(z, e);
                var acc = b[0];
                for (var i = 1; i < b.length; i++) acc = ctx.mkXor(acc, b[i]);
                yield acc;
            }
            case "=" -> chain(z, e, (l, r) -> eq(l, r, e));
            case "distinct" -> ctx.mkDistinct(z.toArray(new com.microsoft.z3.Expr<?>[0]));
            case "<" -> chain(z, e, (l, r) -> ctx.mkLt(real(l, e), real(r, e)));
            case ">" -> chain(z, e, (l, r) -> ctx.mkGt(real(l, e), real(r, e)));
            case "<=" -> chain(z, e, (l, r) -> ctx.mkLe(real(l, e), real(r, e)));
            case ">=" -> chain(z, e, (l, r) -> ctx.mkGe(real(l, e), real(r, e)));
            case "+" -> fold(z, e, ctx::mkAdd);
            case "*" -> fold(z, e, ctx::mkMul);
            case "-" -> z.size() == 1 ? ctx.mkUnaryMinus(real(z.get(0), e)) : fold(z, e, ctx::mkSub);
            case "/" -> fold(z, e, ctx::mkDiv);
            case "ite" -> {
                if (z.size() != 3)
                    throw new SolverFailure("ite expects three arguments: " + e);
                var then = same(z.get(1), z.get(2), e);
                yield ctx.mkITE(bool(z.get(0), e), then, same(z.get(2), z.get(1), e));
            }
            default -> throw new SolverFailure("Unsupported operator '" + e.name() + "' in " + e);
        };
    }

    private BoolExpr implies(BoolExpr[] b, Expr e) {
        if (b.length < 2)
            throw new SolverFailure("=> expects at least two arguments: " + e);
        // right associative
        var acc = b[b.length - 1];
        for (var i = b.length - 2; i >= 0; i--) acc = ctx.mkImplies(b[i], acc);
        return acc;
    }

    /** {@code (op a b c)} as {@code (and (op a b) (op b c))}. */
    private BoolExpr chain(List<com.microsoft.z3.Expr<?>> z, Expr e, Pairwise op) {
        if (z.size() < 2)
            throw new SolverFailure("'" + e.name() + "' expects at least two arguments: " + e);
        if (z.size() == 2) return op.apply(z.get(0), z.get(1));
        var parts = new BoolExpr[z.size() - 1];
        for (var i = 0; i + 1 < z.size(); i++) parts[i] = op.apply(z.get(i), z.get(i + 1));
        return ctx.mkAnd(parts);
    }

    /** Left fold of a binary arithmetic operator: {@code (- a b c)} is {@code (- (- a b) c)}. */
    private ArithExpr<RealSort> fold(List<com.microsoft.z3.Expr<?>> z, Expr e, Arithmetic op) {
        if (z.size() < 2)
            throw new SolverFailure("'" + e.name() + "' expects at least two arguments: " + e);
        var acc = op.apply(real(z.get(0), e), real(z.get(1), e));
        for (var i = 2; i < z.size(); i++) acc = op.apply(acc, real(z.get(i), e));
        return acc;
    }

    private BoolExpr eq(com.microsoft.z3.Expr<?> l, com.microsoft.z3.Expr<?> r, Expr e) {
        return ctx.mkEq(same(l, r, e), same(r, l, e));
    }

    /** {@code z} viewed at the sort it shares with {@code other}. */
    @SuppressWarnings("unchecked")
    private static com.microsoft.z3.Expr<com.microsoft.z3.Sort> same(com.microsoft.z3.Expr<?> z, com.microsoft.z3.Expr<?> other, Expr source) {
        if (!z.getSort().equals(other.getSort()))
            throw new SolverFailure("Operands of different sorts in " + source + ": " + z + ", " + other);
        return (com.microsoft.z3.Expr<com.microsoft.z3.Sort>) z;
    }

    private static com.microsoft.z3.Expr<?> unary(List<com.microsoft.z3.Expr<?>> z, Expr e) {
        if (z.size() != 1)
            throw new SolverFailure("'" + e.name() + "' expects one argument: " + e);
        return z.get(0);
    }

    private static BoolExpr[] bools(List<com.microsoft.z3.Expr<?>> z, Expr e) {
        var b = new BoolExpr[z.size()];
        for (var i = 0; i < b.length; i++) b[i] = bool(z.get(i), e);
        return b;
    }

    private static BoolExpr bool(com.microsoft.z3.Expr<?> z, Expr source) {
        if (z instanceof BoolExpr b) return b;
        throw new SolverFailure("Expected a Bool operand in " + source + ", got " + z);
    }

    @SuppressWarnings("unchecked")
    private static ArithExpr<RealSort> real(com.microsoft.z3.Expr<?> z, Expr source) {
        if (z instanceof ArithExpr<?> a && a.getSort() instanceof RealSort) return (ArithExpr<RealSort>) a;
        throw new SolverFailure("Expected a Real operand in " + source + ", got " + z);
    }

    @FunctionalInterface
    private interface Pairwise {
        BoolExpr apply(com.microsoft.z3.Expr<?> l, com.microsoft.z3.Expr<?> r);
    }

    @FunctionalInterface
    private interface Arithmetic {
        ArithExpr<RealSort> apply(ArithExpr<RealSort> l, ArithExpr<RealSort> r);
    }
}
