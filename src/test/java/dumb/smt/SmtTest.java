package dumb.smt;

import dumb.smt.SmtException.MalformedExpression;
import dumb.smt.SmtException.UnknownCommand;
import dumb.smt.SmtException.UsageError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmtTest extends AbstractTest {

    private static final String SCRIPT = """
            ; simple linear problem
            (set-info :status sat)
            (set-logic QF_LRA)
            (declare-fun x () Real)
            (assert (> x 0)) ; positive
            (check-sat)
            """;

    private RecordingSolver solver;
    private ByteArrayOutputStream bytes;

    @BeforeEach
    void setUp() {
        solver = new RecordingSolver();
        bytes = new ByteArrayOutputStream();
    }

    private Smt smt(Smt.Configuration config) {
        return new Smt(config, solver, new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    private List<String> lines() {
        return bytes.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void runsAScript() throws SmtParser.ParseException {
        var state = smt(Smt.Configuration.DEFAULT).run(SCRIPT);
        assertEquals(Dispatcher.State.RUNNING, state);
        assertEquals(List.of("x"), List.copyOf(solver.variables.keySet()));
        assertEquals(1, solver.assertions.size());
        assertEquals(List.of("sat"), lines());
    }

    @Test
    void exitStopsProcessing() throws SmtParser.ParseException {
        var state = smt(Smt.Configuration.DEFAULT).run("(check-sat)\n(exit)\n(check-sat)\n(push 1)\n");
        assertEquals(Dispatcher.State.TERMINATED, state);
        assertEquals(List.of("sat"), lines());
        assertEquals(1, solver.checks.size());
    }

    @Test
    void unknownCommandStopsTheRun() {
        var smt = smt(Smt.Configuration.DEFAULT);
        assertThrows(UnknownCommand.class, () -> smt.run("(declare-fun x () Real)\n(push 1)\n(assert (> x 0))\n(check-sat)"));
        assertEquals(List.of("declare x"), solver.calls);
        assertEquals(List.of(), lines());
    }

    @Test
    void commentedOutFormsAreSkipped() throws SmtParser.ParseException {
        smt(Smt.Configuration.DEFAULT).run("; (push 1)\n(check-sat);(exit)\n(check-sat)");
        assertEquals(List.of("sat", "sat"), lines());
    }

    @Test
    void emptyInput() throws SmtParser.ParseException {
        assertEquals(Dispatcher.State.RUNNING, smt(Smt.Configuration.DEFAULT).run(" \n\t\r\n"));
        assertTrue(solver.calls.isEmpty());
    }

    @Test
    void unterminatedFinalFormIsAccepted() throws SmtParser.ParseException {
        smt(Smt.Configuration.DEFAULT).run("(declare-fun x () Real)\n(assert (> x 0)");
        assertEquals(1, solver.assertions.size());
    }

    @Test
    void unterminatedFinalFormRejectedWhenStrict() {
        var strict = Smt.Configuration.of(true, null, null, null);
        assertThrows(SmtParser.ParseException.class, () -> smt(strict).run("(declare-fun x () Real)\n(assert (> x 0)"));
        assertEquals(List.of("declare x"), solver.calls);
    }

    @Test
    void rationalLiteralsOption() throws SmtParser.ParseException {
        var script = "(declare-fun x () Real)(assert (> x 2.5))";
        assertThrows(MalformedExpression.class, () -> smt(Smt.Configuration.DEFAULT).run(script));

        setUp();
        smt(Smt.Configuration.of(null, true, null, null)).run(script);
        assertEquals("(> x 2.5)", solver.assertions.get(0).toString());
    }

    @Test
    void checkOptionsComeFromTheConfiguration() throws SmtParser.ParseException {
        smt(new Smt.Configuration(false, false, 250, true)).run("(check-sat)");
        assertEquals(List.of(new Solver.Options(250, true)), solver.checks);
    }

    @Test
    void configurationDefaults() {
        var config = Smt.Configuration.parse("{}");
        assertEquals(Smt.Configuration.DEFAULT, config);
        assertEquals(Smt.Configuration.DEFAULT, Smt.Configuration.load(null));
    }

    @Test
    void configurationFromJson() {
        var config = Smt.Configuration.parse("{\"strictLists\": true, \"timeoutMillis\": 1000, \"unknown\": 1}");
        assertTrue(config.strictLists());
        assertFalse(config.rationalLiterals());
        assertEquals(1000, config.timeoutMillis());
        assertFalse(config.produceModels());
    }

    @Test
    void invalidConfiguration() {
        assertThrows(UsageError.class, () -> Smt.Configuration.parse("{\"timeoutMillis\": \"soon\""));
    }

    @Test
    void nullConfigurationIsAUsageError(@TempDir Path dir) throws IOException {
        var e = assertThrows(UsageError.class, () -> Smt.Configuration.parse("null"));
        assertTrue(e.getMessage().startsWith("Invalid configuration"), e.getMessage());

        var file = dir.resolve("null.json");
        Files.writeString(file, "null\n");
        assertThrows(UsageError.class, () -> Smt.Configuration.load(file.toString()));
    }

    @Test
    void configurationFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("smt.json");
        Files.writeString(file, "{\"rationalLiterals\": true}");
        assertTrue(Smt.Configuration.load(file.toString()).rationalLiterals());
    }

    @Test
    void wrongArgumentCountIsAUsageError() {
        var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        assertEquals(1, Smt.execute(new String[0], out, () -> solver));
        assertEquals(1, Smt.execute(new String[]{"a.smt2", "b.smt2"}, out, () -> solver));
        assertTrue(solver.calls.isEmpty());
        assertFalse(solver.closed);
    }

    @Test
    void executeFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("input.smt2");
        Files.writeString(file, SCRIPT + "(exit)\n(check-sat)\n");
        var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        assertEquals(0, Smt.execute(new String[]{file.toString()}, out, () -> solver));
        assertEquals(List.of("sat"), lines());
        assertTrue(solver.closed);
    }

    @Test
    void fatalErrorExitsNonZero(@TempDir Path dir) throws IOException {
        var file = dir.resolve("input.smt2");
        Files.writeString(file, "(check-sat)\n(push 1)\n(check-sat)\n");
        var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        assertEquals(1, Smt.execute(new String[]{file.toString()}, out, () -> solver));
        assertEquals(List.of("sat"), lines());
        assertEquals(1, solver.checks.size());
        assertTrue(solver.closed);
    }

    @Test
    void missingFile(@TempDir Path dir) {
        var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        assertEquals(1, Smt.execute(new String[]{dir.resolve("absent.smt2").toString()}, out, () -> solver));
        assertTrue(solver.calls.isEmpty());
    }
}
