package dumb.smt;

import java.util.Map;
import java.util.Optional;

/**
 * Constraint solver consumed by the {@link Dispatcher}. Constraints only
 * accumulate; there is no retraction.
 */
public interface Solver extends AutoCloseable {

    void declareVariable(String name, Sort sort);

    void addAssertion(Expr constraint);

    Result check(Options options);

    @Override
    void close();

    enum Verdict {
        SATISFIABLE("sat"),
        UNSATISFIABLE("unsat"),
        UNKNOWN("unknown");

        /** What {@code check-sat} prints. */
        public final String answer;

        Verdict(String answer) {
            this.answer = answer;
        }
    }

    /** @param model variable name to value text, only for satisfiable results when requested */
    record Result(Verdict verdict, Optional<Map<String, String>> model) {
        public static Result of(Verdict verdict) {
            return new Result(verdict, Optional.empty());
        }
    }

    /** @param timeoutMillis zero or negative for no limit */
    record Options(int timeoutMillis, boolean produceModels) {
        public static final Options DEFAULT = new Options(0, false);
    }
}
