package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a DIMACS CNF instance, decides it, and prints the verdict in the usual competition form:
 * {@code s SATISFIABLE} followed by a {@code v} line, {@code s UNSATISFIABLE}, or {@code s ERROR}.
 */
public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Splitter commaSplitter = Splitter.on(',').trimResults();
    private static final Pattern randomRe = Pattern.compile("random\\((\\d+,\\d+,-?\\d+)\\)");
    private static final Pattern waerdenRe = Pattern.compile("waerden\\((\\d+,\\d+,\\d+)\\)");

    static final int OK = 0;
    static final int ERROR = 1;

    private static Options options() {
        return new Options()
                .addOption("problem", true, "file holding the DIMACS problem, - for standard input, random(n,m,seed) or waerden(j,k,n)")
                .addOption("algorithm", true, "search driver: recursive (default) or stack")
                .addOption("propagation", true, "simplification per search node: single (default) or fixpoint")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static int[] arguments(String group) {
        return commaSplitter.splitToList(group).stream().mapToInt(Integer::parseInt).toArray();
    }

    private static CNFFormula formula(CommandLine cmd, Reader stdin) throws IOException {
        String p = cmd.getOptionValue("problem", "-");
        Matcher rm = randomRe.matcher(p);
        if (rm.matches()) {
            int[] a = arguments(rm.group(1));
            return CNFFormula.randomInstance(a[0], a[1], a[2]);
        }
        Matcher wm = waerdenRe.matcher(p);
        if (wm.matches()) {
            int[] a = arguments(wm.group(1));
            return CNFFormula.waerden(a[0], a[1], a[2]);
        }
        if (p.equals("-")) return CNFFormula.parseFrom(stdin);
        try (Reader r = Files.newBufferedReader(Paths.get(p), StandardCharsets.UTF_8)) {
            return CNFFormula.parseFrom(r);
        }
    }

    private static BiFunction<CNFFormula, Propagation, AbstractSATSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "recursive");
        switch (a) {
            case "recursive": return DPLLSolver::new;
            case "stack": return StackDPLLSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static Propagation propagation(CommandLine cmd) {
        String p = cmd.getOptionValue("propagation", "single");
        switch (p) {
            case "single": return Propagation.SINGLE_PASS;
            case "fixpoint": return Propagation.FIXED_POINT;
            default: throw new IllegalArgumentException("Unknown propagation: " + p);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    /** Print the verdict lines for an outcome of {@link AbstractSATSolver#solve()}. */
    static void printOutcome(Optional<boolean[]> outcome, PrintStream out) {
        if (outcome.isPresent()) {
            boolean[] bs = outcome.get();
            List<Integer> literals = new ArrayList<>(bs.length + 1);
            for (int i = 0; i < bs.length; ++i) literals.add(bs[i] ? i + 1 : -i - 1);
            literals.add(0);
            out.println("s SATISFIABLE");
            out.println("v " + spaceJoiner.join(literals));
        } else {
            out.println("s UNSATISFIABLE");
        }
    }

    /**
     * Run the solver as the command line would.
     *
     * @return the process exit status
     */
    static int run(String[] args, Reader stdin, PrintStream out) {
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            BiFunction<CNFFormula, Propagation, AbstractSATSolver> factory = solver(cmd);
            Propagation propagation = propagation(cmd);
            CNFFormula f = formula(cmd, stdin);
            log.info("%d variables, %d clauses (%d tautologies dropped)", f.nVariables(), f.nClauses(), f.droppedTautologies());
            AbstractSATSolver s = factory.apply(f, propagation);
            s.setLogInterval(logInterval(cmd));
            Optional<boolean[]> outcome = s.solve();
            log.info("%s: %d nodes, %d propagated, %s", s.name(), s.nodeCount(), s.propagationCount(), s.stopwatch());
            if (outcome.isPresent() && !f.evaluate(outcome.get())) {
                throw new IllegalStateException("solver returned an assignment that does not satisfy the formula");
            }
            printOutcome(outcome, out);
            return OK;
        } catch (DegenerateInstanceException e) {
            log.error("%s", e.getMessage());
        } catch (ParseException | IOException | RuntimeException e) {
            log.error("%s", e.toString());
        } catch (StackOverflowError e) {
            log.error("search too deep for the thread stack; try -algorithm stack");
        } catch (OutOfMemoryError e) {
            log.error("out of memory: %s", e.getMessage());
        }
        out.println("s ERROR");
        return ERROR;
    }

    public static void main(String[] args) {
        int status = run(args, new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
        System.out.flush();
        System.exit(status);
    }
}
