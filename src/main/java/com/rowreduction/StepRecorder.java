package com.rowreduction;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only step log for one solve.  Every call snapshots the matrix, so
 * later mutation of the working copy never reaches a recorded step.
 */
final class StepRecorder {
    private final Matrix work;
    private final List<Step> steps = new ArrayList<>();

    StepRecorder(Matrix work) {
        this.work = work;
        steps.add(Step.initial(work.copy()));
    }

    void swap(int pivotRow, int otherRow, int col) {
        steps.add(Step.swap(pivotRow, otherRow, col, work.copy()));
    }

    void scale(int row, int col, Rational factor) {
        steps.add(Step.scale(row, col, factor, work.copy()));
    }

    void replace(int target, int source, int col, Rational factor) {
        steps.add(Step.replace(target, source, col, factor, work.copy()));
    }

    int size() { return steps.size(); }

    List<Step> steps() { return List.copyOf(steps); }
}
