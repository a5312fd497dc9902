package net.littleredcomputer.dpll;

import java.util.ArrayDeque;
import java.util.Deque;

import static net.littleredcomputer.dpll.ClauseScanner.hasConflict;

/**
 * The same search as {@link DPLLSolver}, driven by an explicit stack of frames instead of the
 * call stack, so depth is limited by heap rather than thread stack size. For a given formula and
 * propagation mode both solvers visit the same nodes and report the same assignment.
 */
public class StackDPLLSolver extends AbstractSATSolver {

    private enum Step { ENTER, TRIED_TRUE, TRIED_FALSE }

    private static final class Frame {
        final int cursor;
        final UndoLog undo = new UndoLog();
        Step step = Step.ENTER;
        int variable;

        Frame(int cursor) {
            this.cursor = cursor;
        }
    }

    public StackDPLLSolver(CNFFormula formula) {
        this(formula, Propagation.SINGLE_PASS);
    }

    public StackDPLLSolver(CNFFormula formula, Propagation propagation) {
        super("stack", formula, propagation);
    }

    @Override
    boolean search(PartialAssignment a, int cursor) {
        checkSize(a);
        final int n = formula.nVariables();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(cursor));
        // Outcome of the most recently finished frame.
        boolean result = false;
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            switch (f.step) {
                case ENTER:
                    visit(a);
                    if (hasConflict(formula, a) || !simplify(a, f.undo)) {
                        result = false;
                        stack.pop();
                        continue;
                    }
                    f.variable = nextUnassigned(a, f.cursor);
                    if (f.variable > n) {
                        result = !hasConflict(formula, a);
                        if (!result) f.undo.rollback(a);
                        stack.pop();
                        continue;
                    }
                    a.set(f.variable, 1);
                    f.step = Step.TRIED_TRUE;
                    stack.push(new Frame(f.variable + 1));
                    continue;
                case TRIED_TRUE:
                    if (result) {
                        stack.pop();
                        continue;
                    }
                    a.set(f.variable, -1);
                    f.step = Step.TRIED_FALSE;
                    stack.push(new Frame(f.variable + 1));
                    continue;
                case TRIED_FALSE:
                    if (!result) {
                        a.set(f.variable, 0);
                        f.undo.rollback(a);
                    }
                    stack.pop();
                    continue;
                default:
                    throw new IllegalStateException("unknown step " + f.step);
            }
        }
        return result;
    }
}
