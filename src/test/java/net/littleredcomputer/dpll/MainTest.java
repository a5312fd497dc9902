package net.littleredcomputer.dpll;

import com.google.common.base.Splitter;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class MainTest {
    private static final Splitter lineSplitter = Splitter.on('\n').trimResults().omitEmptyStrings();

    private static class Run {
        final int status;
        final List<String> lines;

        Run(String input, String... args) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            PrintStream out = new PrintStream(bytes, true);
            status = Main.run(args, new StringReader(input), out);
            lines = lineSplitter.splitToList(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
        }
    }

    /** Parse the v line of a run and check it against the formula. */
    private static boolean satisfies(String input, String vLine) {
        CNFFormula f = CNFFormula.parseFrom(input);
        List<String> tokens = Splitter.on(' ').splitToList(vLine);
        assertThat(tokens.get(0), is("v"));
        assertThat(tokens.get(tokens.size() - 1), is("0"));
        assertThat(tokens.size(), is(f.nVariables() + 2));
        boolean[] p = new boolean[f.nVariables()];
        for (int i = 1; i <= f.nVariables(); ++i) {
            int l = Integer.parseInt(tokens.get(i));
            assertThat(Math.abs(l), is(i));
            p[i - 1] = l > 0;
        }
        return f.evaluate(p);
    }

    @Test
    public void satisfiable() {
        String input = "p cnf 3 2\n1 2 0\n-2 3 0\n";
        Run r = new Run(input);
        assertThat(r.status, is(Main.OK));
        assertThat(r.lines.get(0), is("s SATISFIABLE"));
        assertThat(satisfies(input, r.lines.get(1)), is(true));
        assertThat(r.lines.get(1), is("v 1 2 3 0"));
    }

    @Test
    public void unsatisfiable() {
        Run r = new Run("p cnf 1 2\n1 0\n-1 0\n");
        assertThat(r.status, is(Main.OK));
        assertThat(r.lines, contains("s UNSATISFIABLE"));
    }

    @Test
    public void tautologyOnly() {
        Run r = new Run("p cnf 2 1\n1 -1 0\n");
        assertThat(r.lines, contains("s SATISFIABLE", "v 1 2 0"));
    }

    @Test
    public void noVariablesIsAnError() {
        Run r = new Run("p cnf 0 0\n");
        assertThat(r.status, is(Main.ERROR));
        assertThat(r.lines, contains("s ERROR"));
    }

    @Test
    public void zeroDeclaredButReferenced() {
        Run r = new Run("p cnf 0 1\n1 0\n");
        assertThat(r.status, is(Main.OK));
        assertThat(r.lines, contains("s SATISFIABLE", "v 1 0"));
    }

    @Test
    public void unitClauseIsPropagated() {
        Run r = new Run("p cnf 2 1\n1 0\n");
        assertThat(r.lines.get(0), is("s SATISFIABLE"));
        assertThat(r.lines.get(1), startsWith("v 1 "));
    }

    @Test
    public void malformedInputIsAnError() {
        Run r = new Run("p cnf 2 1\n1 two 0\n");
        assertThat(r.status, is(Main.ERROR));
        assertThat(r.lines, contains("s ERROR"));
    }

    @Test
    public void hugeVariableNumberIsAnError() {
        Run r = new Run("p cnf 1 1\n2147483647 0\n");
        assertThat(r.status, is(Main.ERROR));
        assertThat(r.lines, contains("s ERROR"));
    }

    @Test
    public void missingFileIsAnError() {
        Run r = new Run("", "-problem", "/nonexistent/problem.cnf");
        assertThat(r.lines, contains("s ERROR"));
    }

    @Test
    public void unknownAlgorithmIsAnError() {
        Run r = new Run("p cnf 1 1\n1 0\n", "-algorithm", "cdcl");
        assertThat(r.status, is(Main.ERROR));
        assertThat(r.lines, contains("s ERROR"));
    }

    @Test
    public void unknownOptionIsAnError() {
        assertThat(new Run("p cnf 1 1\n1 0\n", "-frobnicate").lines, contains("s ERROR"));
    }

    @Test
    public void algorithmsAndPropagationModesAgree() {
        String input = "p cnf 5 6\n1 -5 4 0\n-1 5 3 4 0\n-3 -4 0\n2 3 0\n-2 -1 0\n5 -2 0\n";
        List<String> expected = new Run(input).lines;
        assertThat(new Run(input, "-algorithm", "stack").lines, is(expected));
        assertThat(satisfies(input, new Run(input, "-propagation", "fixpoint").lines.get(1)), is(true));
        assertThat(satisfies(input, new Run(input, "-algorithm", "stack", "-propagation", "fixpoint").lines.get(1)), is(true));
    }

    @Test
    public void generatedProblems() {
        // W(3,3) = 9
        assertThat(new Run("", "-problem", "waerden(3,3,8)").lines.get(0), is("s SATISFIABLE"));
        assertThat(new Run("", "-problem", "waerden(3,3,9)").lines, contains("s UNSATISFIABLE"));
        assertThat(new Run("", "-problem", "random(10,20,1)").status, is(Main.OK));
    }

    @Test
    public void printOutcome() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true);
        Main.printOutcome(Optional.of(new boolean[]{false, true, false}), out);
        assertThat(lineSplitter.splitToList(new String(bytes.toByteArray(), StandardCharsets.UTF_8)),
                contains("s SATISFIABLE", "v -1 2 -3 0"));
    }
}
