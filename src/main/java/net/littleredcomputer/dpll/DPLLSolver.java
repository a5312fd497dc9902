package net.littleredcomputer.dpll;

import static net.littleredcomputer.dpll.ClauseScanner.hasConflict;

/**
 * Recursive backtracking search with unit propagation and pure literal elimination. Variables are
 * branched on in increasing order, true before false. Every node shares one assignment; a node
 * that fails restores it from its undo log before returning.
 */
public class DPLLSolver extends AbstractSATSolver {

    public DPLLSolver(CNFFormula formula) {
        this(formula, Propagation.SINGLE_PASS);
    }

    public DPLLSolver(CNFFormula formula, Propagation propagation) {
        super("recursive", formula, propagation);
    }

    @Override
    boolean search(PartialAssignment a, int cursor) {
        checkSize(a);
        return node(a, cursor);
    }

    private boolean node(PartialAssignment a, int cursor) {
        visit(a);
        if (hasConflict(formula, a)) return false;
        UndoLog undo = new UndoLog();
        if (!simplify(a, undo)) return false;
        final int v = nextUnassigned(a, cursor);
        if (v > formula.nVariables()) {
            if (!hasConflict(formula, a)) return true;
            undo.rollback(a);
            return false;
        }
        a.set(v, 1);
        if (node(a, v + 1)) return true;
        a.set(v, -1);
        if (node(a, v + 1)) return true;
        a.set(v, 0);
        undo.rollback(a);
        return false;
    }
}
