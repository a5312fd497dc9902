package net.littleredcomputer.dpll;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the clauses of a formula against a partial assignment. None of these methods
 * changes the assignment.
 */
public final class ClauseScanner {
    private ClauseScanner() {}

    /**
     * @return true iff some clause has every literal false
     */
    public static boolean hasConflict(CNFFormula formula, PartialAssignment a) {
        CLAUSE:
        for (List<Integer> clause : formula.clauses()) {
            for (int literal : clause) {
                // A true literal satisfies the clause; an unassigned one leaves it open.
                if (a.valueOf(literal) >= 0) continue CLAUSE;
            }
            return true;
        }
        return false;
    }

    /**
     * Find the literals forced by unit clauses: clauses with no true literal and exactly one
     * unassigned literal. The result follows clause order and may repeat a literal or contain
     * both a literal and its complement.
     */
    public static List<Integer> findUnitLiterals(CNFFormula formula, PartialAssignment a) {
        List<Integer> units = new ArrayList<>();
        CLAUSE:
        for (List<Integer> clause : formula.clauses()) {
            int unassigned = 0;
            for (int literal : clause) {
                int v = a.valueOf(literal);
                if (v > 0) continue CLAUSE;
                if (v == 0) {
                    if (unassigned != 0) continue CLAUSE;
                    unassigned = literal;
                }
            }
            if (unassigned != 0) units.add(unassigned);
        }
        return units;
    }

    /**
     * Find the pure literals: for each unassigned variable occurring (unassigned) in some clause
     * that is not yet satisfied, the literal of that variable if all such occurrences share one
     * polarity. Variables with no such occurrence are not reported. The result is in increasing
     * variable order.
     */
    public static List<Integer> findPureLiterals(CNFFormula formula, PartialAssignment a) {
        final int n = formula.nVariables();
        boolean[] positive = new boolean[n + 1];
        boolean[] negative = new boolean[n + 1];
        CLAUSE:
        for (List<Integer> clause : formula.clauses()) {
            for (int literal : clause) {
                if (a.valueOf(literal) > 0) continue CLAUSE;
            }
            for (int literal : clause) {
                if (a.valueOf(literal) != 0) continue;
                if (literal > 0) positive[literal] = true;
                else negative[-literal] = true;
            }
        }
        List<Integer> pure = new ArrayList<>();
        for (int v = 1; v <= n; ++v) {
            if (a.isAssigned(v) || positive[v] == negative[v]) continue;
            pure.add(positive[v] ? v : -v);
        }
        return pure;
    }
}
