package net.littleredcomputer.dpll;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

/**
 * The assignments made by one search node, kept as (variable, previous value) pairs so the node
 * can put the assignment back exactly as it found it.
 */
final class UndoLog {
    // A pair of stacks rather than a stack of pairs, to avoid boxing.
    private final TIntStack variables = new TIntArrayStack();
    private final TIntStack previous = new TIntArrayStack();  // value of the variable above before assign

    /** Make the literal true in a, remembering the variable's prior value. */
    void assign(PartialAssignment a, int literal) {
        int variable = Math.abs(literal);
        variables.push(variable);
        previous.push(a.get(variable));
        a.makeTrue(literal);
    }

    /** Restore every recorded variable, most recent first, and forget them. */
    void rollback(PartialAssignment a) {
        while (variables.size() > 0) {
            a.set(variables.pop(), previous.pop());
        }
    }

    int size() {
        return variables.size();
    }
}
