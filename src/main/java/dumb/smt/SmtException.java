package dumb.smt;

/**
 * Fatal errors of the front end. None of them is recovered from: the driver
 * stops at the first one.
 */
public class SmtException extends RuntimeException {

    public SmtException(String message) {
        super(message);
    }

    public SmtException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Wrong arity, wrong node shape, undeclared variable or unsupported literal. */
    public static class MalformedExpression extends SmtException {
        public MalformedExpression(String message, Term term) {
            super(message + ": " + term);
        }

        public MalformedExpression(String message) {
            super(message);
        }
    }

    public static class UnknownCommand extends SmtException {
        public final String command;

        public UnknownCommand(String command) {
            super("Unknown instruction: " + command);
            this.command = command;
        }
    }

    public static class UsageError extends SmtException {
        public UsageError(String message) {
            super(message);
        }

        public UsageError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The solver backend could not translate or decide a constraint. */
    public static class SolverFailure extends SmtException {
        public SolverFailure(String message) {
            super(message);
        }

        public SolverFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
