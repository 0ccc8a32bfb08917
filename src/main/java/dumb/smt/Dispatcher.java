package dumb.smt;

import dumb.smt.SmtException.MalformedExpression;
import dumb.smt.SmtException.UnknownCommand;
import dumb.smt.util.Json;
import dumb.smt.util.Log;

import java.io.PrintStream;

import static java.util.Objects.requireNonNull;

/**
 * Executes top-level commands against a {@link Solver}. Owns the global sort
 * environment for the lifetime of one run.
 */
public class Dispatcher {

    private final Sorts globals = Sorts.global();
    private final Solver solver;
    private final Elaborator elaborator;
    private final Solver.Options checkOptions;
    private final PrintStream out;
    private State state = State.RUNNING;

    public Dispatcher(Solver solver, PrintStream out) {
        this(solver, new Elaborator(), Solver.Options.DEFAULT, out);
    }

    public Dispatcher(Solver solver, Elaborator elaborator, Solver.Options checkOptions, PrintStream out) {
        this.solver = requireNonNull(solver);
        this.elaborator = requireNonNull(elaborator);
        this.checkOptions = requireNonNull(checkOptions);
        this.out = requireNonNull(out);
    }

    public State state() {
        return state;
    }

    public Sorts globals() {
        return globals;
    }

    public State dispatch(Term form) {
        if (state == State.TERMINATED)
            throw new IllegalStateException("Dispatcher already terminated");

        var items = form.match(
                a -> {
                    throw new MalformedExpression("Expected a command list", a);
                },
                l -> l);
        var command = items.op().orElseThrow(() -> new MalformedExpression("Expected a command name", items)).text();

        switch (command) {
            case "set-info", "set-logic" -> {
            }
            case "define-fun" -> Log.warning("Ignoring 'define-fun'");
            case "declare-fun" -> declareFun(items);
            case "assert" -> assertion(items);
            case "check-sat" -> checkSat();
            case "exit" -> state = State.TERMINATED;
            default -> throw new UnknownCommand(command);
        }
        return state;
    }

    /** {@code (declare-fun name () Real|Bool)} */
    private void declareFun(Term.Lst items) {
        if (items.size() != 4)
            throw new MalformedExpression("declare-fun expects a name, an empty argument list and a sort", items);
        var name = items.get(1).match(
                Term.Atom::text,
                l -> {
                    throw new MalformedExpression("declare-fun name must be a symbol", items);
                });
        var empty = items.get(2).match(a -> false, Term.Lst::isEmpty);
        if (!empty)
            throw new MalformedExpression("Only nullary functions can be declared", items);
        var sortName = items.get(3).match(
                Term.Atom::text,
                l -> {
                    throw new MalformedExpression("declare-fun sort must be a symbol", items);
                });
        var sort = Sort.of(sortName).orElseThrow(() -> new MalformedExpression("Unsupported sort '" + sortName + "'", items));

        globals.declare(name, sort);
        solver.declareVariable(name, sort);
    }

    private void assertion(Term.Lst items) {
        if (items.size() != 2)
            throw new MalformedExpression("assert expects exactly one expression", items);
        var constraint = elaborator.elaborate(items.get(1), globals);
        if (Log.debugging())
            Log.debug("assert {}", Json.str(constraint));
        solver.addAssertion(constraint);
    }

    private void checkSat() {
        var result = solver.check(checkOptions);
        result.model().ifPresent(model -> Log.debug("model {}", model));
        out.println(result.verdict().answer);
        out.flush();
    }

    public enum State {
        RUNNING, TERMINATED
    }
}
