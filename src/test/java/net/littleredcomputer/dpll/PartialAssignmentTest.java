package net.littleredcomputer.dpll;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PartialAssignmentTest {

    @Test
    public void literalValues() {
        PartialAssignment a = new PartialAssignment(3);
        a.makeTrue(-2);
        a.makeTrue(3);
        assertThat(a.valueOf(1), is(0));
        assertThat(a.valueOf(-1), is(0));
        assertThat(a.valueOf(2), is(-1));
        assertThat(a.valueOf(-2), is(1));
        assertThat(a.valueOf(3), is(1));
        assertThat(a.toString(), is(".-+"));
    }

    @Test(expected = IllegalStateException.class)
    public void partialAssignmentIsNotASolution() {
        new PartialAssignment(2).toSolution();
    }

    @Test(expected = DegenerateInstanceException.class)
    public void needsAVariable() {
        new PartialAssignment(0);
    }

    @Test
    public void undoLogRestoresInReverse() {
        PartialAssignment a = new PartialAssignment(20);
        a.set(4, -1);
        int[] before = a.snapshot();
        UndoLog undo = new UndoLog();
        for (int v = 1; v <= 20; ++v) undo.assign(a, v % 3 == 0 ? -v : v);
        assertThat(undo.size(), is(20));
        assertThat(a.get(4), is(1));
        undo.rollback(a);
        assertThat(a.snapshot(), is(before));
        assertThat(undo.size(), is(0));
    }
}
