package dumb.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.smt.SmtException.UsageError;
import dumb.smt.util.Json;
import dumb.smt.util.Log;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

import static dumb.smt.util.Log.error;

/**
 * Command line driver: reads an SMT-LIB script, runs it against Z3 and prints
 * one {@code sat}/{@code unsat}/{@code unknown} line per {@code check-sat}.
 */
public class Smt {

    /** System property naming an optional JSON {@link Configuration} file. */
    public static final String CONFIG_PROPERTY = "smt.config";

    public static final boolean DEFAULT_STRICT_LISTS = false;
    public static final boolean DEFAULT_RATIONAL_LITERALS = false;
    public static final int DEFAULT_TIMEOUT_MILLIS = 0;
    public static final boolean DEFAULT_PRODUCE_MODELS = false;

    private final Configuration config;
    private final Dispatcher dispatcher;

    public Smt(Configuration config, Solver solver, PrintStream out) {
        this.config = config;
        this.dispatcher = new Dispatcher(solver,
                new Elaborator(config.rationalLiterals()),
                new Solver.Options(config.timeoutMillis(), config.produceModels()),
                out);
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, Z3Solver::new));
    }

    /** @return the process exit status */
    static int execute(String[] args, PrintStream out, Supplier<Solver> solvers) {
        if (args.length != 1) {
            printUsage();
            return 1;
        }
        try {
            var config = Configuration.load(System.getProperty(CONFIG_PROPERTY));
            var input = read(Path.of(args[0]));
            try (var solver = solvers.get()) {
                new Smt(config, solver, out).run(input);
            }
            return 0;
        } catch (SmtException | SmtParser.ParseException e) {
            error(e.getMessage());
            return 1;
        }
    }

    private static void printUsage() {
        System.err.printf("Usage: java %s <smtlib2 file>%n", Smt.class.getName());
        System.err.println("Options are read from the JSON file given by -D" + CONFIG_PROPERTY + "=<file>");
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UsageError("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses and executes every top-level form of {@code script} until the
     * input is exhausted or {@code (exit)} is reached.
     */
    public Dispatcher.State run(String script) throws SmtParser.ParseException {
        var input = SmtParser.removeComments(script);
        var pos = 0;
        while (dispatcher.state() == Dispatcher.State.RUNNING) {
            var parser = new SmtParser(input, pos, config.strictLists());
            if (!parser.hasMore()) break;
            var form = parser.parseExpression();
            var next = parser.position();
            Log.debug("got : {}", input.substring(pos, next));
            Log.debug(" -> {}", form);
            pos = next;
            dispatcher.dispatch(form);
        }
        return dispatcher.state();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("strictLists") boolean strictLists,
            @JsonProperty("rationalLiterals") boolean rationalLiterals,
            @JsonProperty("timeoutMillis") int timeoutMillis,
            @JsonProperty("produceModels") boolean produceModels
    ) {
        public static final Configuration DEFAULT = new Configuration(
                DEFAULT_STRICT_LISTS, DEFAULT_RATIONAL_LITERALS, DEFAULT_TIMEOUT_MILLIS, DEFAULT_PRODUCE_MODELS);

        @JsonCreator
        public static Configuration of(
                @JsonProperty("strictLists") @Nullable Boolean strictLists,
                @JsonProperty("rationalLiterals") @Nullable Boolean rationalLiterals,
                @JsonProperty("timeoutMillis") @Nullable Integer timeoutMillis,
                @JsonProperty("produceModels") @Nullable Boolean produceModels
        ) {
            return new Configuration(
                    strictLists != null ? strictLists : DEFAULT_STRICT_LISTS,
                    rationalLiterals != null ? rationalLiterals : DEFAULT_RATIONAL_LITERALS,
                    timeoutMillis != null ? timeoutMillis : DEFAULT_TIMEOUT_MILLIS,
                    produceModels != null ? produceModels : DEFAULT_PRODUCE_MODELS
            );
        }

        public static Configuration parse(String json) {
            try {
                var config = Json.obj(json, Configuration.class);
                if (config == null)
                    throw new UsageError("Invalid configuration: expected a JSON object, got '" + json.strip() + "'");
                return config;
            } catch (JsonProcessingException e) {
                throw new UsageError("Invalid configuration: " + e.getOriginalMessage(), e);
            }
        }

        /** Defaults when {@code file} is null, otherwise the JSON content of {@code file}. */
        public static Configuration load(@Nullable String file) {
            if (file == null) return DEFAULT;
            var config = parse(read(Path.of(file)));
            Log.debug("Configuration {}", Json.str(config));
            return config;
        }
    }
}
