package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

import static net.littleredcomputer.dpll.ClauseScanner.findPureLiterals;
import static net.littleredcomputer.dpll.ClauseScanner.findUnitLiterals;
import static net.littleredcomputer.dpll.ClauseScanner.hasConflict;

/**
 * Base for the backtracking solvers: holds the formula, counts search nodes and periodically
 * logs progress, and performs the simplification each search node does before branching.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    protected final CNFFormula formula;
    protected final Propagation propagation;
    long nodeCount = 0;
    long propagationCount = 0;
    private long lastNodeCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, CNFFormula formula, Propagation propagation) {
        this.name = name;
        this.formula = formula;
        this.propagation = propagation;
    }

    public String name() { return name; }

    /** @return search nodes visited by the latest solve */
    public long nodeCount() { return nodeCount; }

    /** @return variables fixed by unit propagation or purity in the latest solve */
    public long propagationCount() { return propagationCount; }

    public Stopwatch stopwatch() { return stopwatch; }

    /** Begin a run. Counters and the stopwatch describe the most recent call to {@link #solve()} only. */
    void start() {
        nodeCount = 0;
        propagationCount = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastNodeCount = 0;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    private static String abbreviate(String state) {
        if (state.length() <= 100) return state;
        return state.substring(0, initialStateSegment) + "..." + state.substring(state.length() - finalStateSegment);
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d nodes %s %.0f/sec %s", name, nodeCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
    }

    void maybeReportProgress(PartialAssignment a) {
        maybeReportProgress(() -> abbreviate(a.toString()));
    }

    /** Count a search node, reporting progress now and then. */
    void visit(PartialAssignment a) {
        ++nodeCount;
        if (nodeCount % logCheckSteps == 0) maybeReportProgress(a);
    }

    /**
     * Apply unit propagation and then pure literal elimination, recording each assignment in undo.
     * Under {@link Propagation#FIXED_POINT} both are repeated until nothing changes.
     *
     * @return false if a propagated unit produced a conflict; undo has then been rolled back
     */
    boolean simplify(PartialAssignment a, UndoLog undo) {
        boolean changed;
        do {
            changed = false;
            for (int l : findUnitLiterals(formula, a)) {
                if (a.isAssigned(Math.abs(l))) continue;
                undo.assign(a, l);
                ++propagationCount;
                changed = true;
                if (hasConflict(formula, a)) {
                    undo.rollback(a);
                    return false;
                }
            }
            // A pure literal occurs with one polarity in every open clause, so it cannot falsify any.
            for (int l : findPureLiterals(formula, a)) {
                if (a.isAssigned(Math.abs(l))) continue;
                undo.assign(a, l);
                ++propagationCount;
                changed = true;
            }
        } while (propagation == Propagation.FIXED_POINT && changed);
        return true;
    }

    /**
     * @return the first unassigned variable at or after cursor, or nVariables + 1 if there is none
     */
    int nextUnassigned(PartialAssignment a, int cursor) {
        int v = cursor;
        while (v <= formula.nVariables() && a.isAssigned(v)) ++v;
        return v;
    }

    /**
     * Decide the formula.
     *
     * @return a satisfying assignment (element v-1 is the value of variable v), or empty if there is none
     */
    public Optional<boolean[]> solve() {
        start();
        PartialAssignment a = new PartialAssignment(formula.nVariables());
        try {
            return search(a) ? Optional.of(a.toSolution()) : Optional.empty();
        } finally {
            stop();
            log.debug("%s: %d nodes, %d propagated, %s", name, nodeCount, propagationCount, stopwatch);
        }
    }

    boolean search(PartialAssignment a) {
        return search(a, 1);
    }

    /**
     * Search for an extension of a that satisfies the formula, branching only on variables numbered
     * cursor or higher. On success a holds the solution; on failure a is left exactly as it was.
     */
    abstract boolean search(PartialAssignment a, int cursor);

    void checkSize(PartialAssignment a) {
        if (a.nVariables() != formula.nVariables()) {
            throw new IllegalArgumentException("assignment covers " + a.nVariables() + " variables, formula has " + formula.nVariables());
        }
    }
}
