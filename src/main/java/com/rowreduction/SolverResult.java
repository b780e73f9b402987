package com.rowreduction;

import java.util.List;
import java.util.Optional;

/** Everything one solve produces. Immutable; matrices are handed out as copies. */
public final class SolverResult {
    private final Matrix rref;
    private final List<Step> steps;
    private final SolutionType solutionType;
    private final List<String> solution;          // null when inconsistent
    private final List<Integer> freeVariables;
    private final List<Integer> pivotColumns;
    private final int rank;

    SolverResult(Matrix rref, List<Step> steps, SolutionType solutionType, List<String> solution,
                 List<Integer> freeVariables, List<Integer> pivotColumns, int rank) {
        this.rref = rref.copy();
        this.steps = List.copyOf(steps);
        this.solutionType = solutionType;
        this.solution = solution == null ? null : List.copyOf(solution);
        this.freeVariables = List.copyOf(freeVariables);
        this.pivotColumns = List.copyOf(pivotColumns);
        this.rank = rank;
    }

    public Matrix rref() { return rref.copy(); }
    public List<List<String>> rrefDisplay() { return rref.toDisplayRows(); }
    public List<Step> steps() { return steps; }
    public SolutionType solutionType() { return solutionType; }
    public Optional<List<String>> solution() { return Optional.ofNullable(solution); }
    public List<Integer> freeVariables() { return freeVariables; }
    /** Columns that received a pivot, augmented column included. */
    public List<Integer> pivotColumns() { return pivotColumns; }
    public int rank() { return rank; }
    public int numVariables() { return rref.cols() - 1; }

    public boolean isConsistent() { return solutionType != SolutionType.INCONSISTENT; }

    /** Applies every recorded step, in order, to a copy of {@code original}. */
    public Matrix replay(Matrix original) {
        Matrix m = original.copy();
        for (Step s : steps) s.applyTo(m);
        return m;
    }
}
