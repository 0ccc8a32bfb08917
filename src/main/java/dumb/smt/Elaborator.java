package dumb.smt;

import dumb.smt.SmtException.MalformedExpression;
import dumb.smt.util.Log;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Set;

/**
 * Turns parsed {@link Term}s into sorted {@link Expr}s, resolving variables
 * against a {@link Sorts} environment. Never modifies the environment it is given.
 */
public class Elaborator {

    /** Operators whose application is always {@link Sort#BOOL}. */
    public static final Set<String> BOOL_OPERATORS = Set.of("and", "or", "not", "=", "<", ">", "<=", ">=", "=>");

    private final boolean rationalLiterals;

    public Elaborator() {
        this(false);
    }

    /**
     * @param rationalLiterals accept decimal fractions such as {@code 2.5};
     *                         otherwise only integers, optionally written with a
     *                         trailing {@code .0}, are valid numerals
     */
    public Elaborator(boolean rationalLiterals) {
        this.rationalLiterals = rationalLiterals;
    }

    public Expr elaborate(Term term, Sorts sorts) {
        return term.match(
                atom -> atom(atom, sorts),
                list -> list(list, sorts));
    }

    private Expr atom(Term.Atom atom, Sorts sorts) {
        if (atom.isEmpty())
            throw new MalformedExpression("Empty token");
        var c = atom.charAt(0);
        if (Character.isDigit(c) || c == '.')
            return Expr.literal(numeral(atom.text()));
        var name = atom.text();
        var sort = sorts.lookup(name).orElseThrow(() -> new MalformedExpression("Undeclared variable", atom));
        return Expr.variable(name, sort);
    }

    private Expr list(Term.Lst list, Sorts sorts) {
        if (list.isEmpty())
            throw new MalformedExpression("Empty expression", list);
        var op = list.op().orElseThrow(() -> new MalformedExpression("Operator must be a symbol", list));
        return op.is(Expr.LET) ? let(list, sorts) : application(op.text(), list, sorts);
    }

    /**
     * {@code (let ((x1 t1) (x2 t2)) T)} becomes {@code let(x1(t1), x2(t2), T)}.
     * Every ti is elaborated in the enclosing scope, so bindings of one let do
     * not see each other.
     */
    private Expr let(Term.Lst let, Sorts sorts) {
        if (let.size() != 3)
            throw new MalformedExpression("let expects a binding list and a body", let);
        var bindingList = let.get(1).match(
                a -> {
                    throw new MalformedExpression("let bindings must be a list", let);
                },
                l -> l);

        var args = new ArrayList<Expr>(bindingList.size() + 1);
        var bound = new LinkedHashMap<String, Sort>();
        for (var binding : bindingList.terms) {
            var pair = binding.match(
                    a -> {
                        throw new MalformedExpression("let binding must be a (name value) pair", binding);
                    },
                    l -> l);
            if (pair.size() != 2)
                throw new MalformedExpression("let binding must be a (name value) pair", pair);
            var name = pair.get(0).match(
                    Term.Atom::text,
                    l -> {
                        throw new MalformedExpression("let binding name must be a symbol", pair);
                    });
            var value = elaborate(pair.get(1), sorts);
            Log.debug("Binding {} to {}", name, value);
            bound.put(name, value.sort());
            args.add(Expr.binding(name, value));
        }

        var body = elaborate(let.get(2), sorts.extend(bound));
        args.add(body);
        return Expr.apply(Expr.LET, args, body.sort());
    }

    private Expr application(String op, Term.Lst list, Sorts sorts) {
        if (list.size() < 2)
            throw new MalformedExpression("Operator '" + op + "' applied to no arguments", list);
        var args = new ArrayList<Expr>(list.size() - 1);
        for (var i = 1; i < list.size(); i++)
            args.add(elaborate(list.get(i), sorts));
        var sort = BOOL_OPERATORS.contains(op) ? Sort.BOOL : args.get(args.size() - 1).sort();
        return Expr.apply(op, args, sort);
    }

    /**
     * Canonical decimal text of a numeric token. Trailing {@code .0} groups are
     * stripped first, so {@code 5.0} and {@code 5} denote the same literal.
     */
    String numeral(String token) {
        var s = token;
        while (s.length() >= 3 && s.endsWith(".0"))
            s = s.substring(0, s.length() - 2);
        try {
            if (rationalLiterals) {
                var value = new BigDecimal(s).stripTrailingZeros();
                return value.scale() <= 0 ? value.toBigIntegerExact().toString() : value.toPlainString();
            }
            return new BigInteger(s).toString();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedExpression("Unsupported numeral '" + token + "'"
                    + (rationalLiterals ? "" : " (only integer values are supported)"));
        }
    }
}
