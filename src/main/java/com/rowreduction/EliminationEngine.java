package com.rowreduction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gauss-Jordan elimination over exact rationals.
 *
 * <p>Columns are processed left to right, the augmented column included.
 * The pivot of a column is the first non-zero entry at or below the
 * current pivot row; it is swapped up, scaled to one, and cleared from
 * every other row.  Each of those operations is recorded as a
 * {@link Step}.  Instances hold only immutable options and can be shared
 * between threads; every call works on its own copy of the input.
 */
public final class EliminationEngine {
    private static final Logger log = LoggerFactory.getLogger(EliminationEngine.class);

    private final SolverOptions options;

    public EliminationEngine() { this(SolverOptions.defaults()); }

    public EliminationEngine(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Same as {@link #solve(List)}. */
    public SolverResult solveRREF(List<? extends List<?>> cells) { return solve(cells); }

    /**
     * Solves a raw cell matrix.  Cells may be {@link Rational}s, {@link Number}s
     * or text; text that does not parse reads as zero.
     *
     * @throws InvalidMatrixException if the input is not a rectangular
     *         matrix with at least one row and two columns
     */
    public SolverResult solve(List<? extends List<?>> cells) {
        if (cells == null || cells.isEmpty()) throw new InvalidMatrixException("Matrix needs at least one row");
        List<?> first = cells.get(0);
        if (first == null) throw new InvalidMatrixException("Row 0 is null");
        int m = cells.size(), n = first.size();
        checkShape(m, n);
        for (int i = 0; i < m; i++) {
            List<?> row = cells.get(i);
            if (row == null || row.size() != n) {
                throw new InvalidMatrixException("Row " + i + " has " + (row == null ? 0 : row.size())
                        + " cells, expected " + n);
            }
        }
        Matrix work = new Matrix(m, n);
        for (int i = 0; i < m; i++) {
            List<?> row = cells.get(i);
            for (int j = 0; j < n; j++) work.set(i, j, Rational.parseCell(row.get(j)));
        }
        return run(work);
    }

    public SolverResult solve(Object[][] cells) {
        if (cells == null) throw new InvalidMatrixException("Matrix needs at least one row");
        List<List<Object>> rows = new ArrayList<>(cells.length);
        for (Object[] r : cells) rows.add(r == null ? null : Arrays.asList(r));
        return solve(rows);
    }

    public SolverResult solve(Matrix input) {
        if (input == null) throw new InvalidMatrixException("Matrix needs at least one row");
        checkShape(input.rows(), input.cols());
        return run(input.copy());
    }

    private void checkShape(int m, int n) {
        if (m < 1) throw new InvalidMatrixException("Matrix needs at least one row");
        if (n < 2) throw new InvalidMatrixException("Matrix needs a coefficient column and a constants column, got " + n + " column(s)");
        if (options.maxSize > 0 && (m > options.maxSize || n > options.maxSize)) {
            throw new InvalidMatrixException("Matrix " + m + "x" + n + " exceeds size cap " + options.maxSize);
        }
    }

    /** Reduces {@code work} in place; it must be private to this call. */
    private SolverResult run(Matrix work) {
        final int rows = work.rows(), cols = work.cols();
        StepRecorder rec = new StepRecorder(work);
        List<Integer> pivotColumns = new ArrayList<>();

        int pivotRow = 0;
        for (int col = 0; col < cols && pivotRow < rows; col++) {
            int found = -1;
            for (int i = pivotRow; i < rows; i++) {
                if (!work.get(i, col).isZero()) { found = i; break; }
            }
            if (found < 0) continue;   // no pivot: free column

            if (found != pivotRow) {
                work.swapRows(pivotRow, found);
                rec.swap(pivotRow, found, col);
            }

            Rational pivot = work.get(pivotRow, col);
            if (!pivot.isOne()) {
                Rational k = pivot.inverse();
                work.scaleRow(pivotRow, k);
                rec.scale(pivotRow, col, k);
            }

            for (int i = 0; i < rows; i++) {
                if (i == pivotRow) continue;
                Rational entry = work.get(i, col);
                if (entry.isZero()) continue;
                Rational k = entry.negate();
                work.addMultipleOfRow(i, pivotRow, k);
                rec.replace(i, pivotRow, col, k);
            }

            pivotColumns.add(col);
            pivotRow++;
        }

        SolutionClassifier.Classification c = SolutionClassifier.classify(work, pivotColumns);
        log.debug("Reduced {}x{} system in {} steps: {} rank={} free={}",
                rows, cols, rec.size(), c.type, c.rank, c.freeVariables);
        return new SolverResult(work, rec.steps(), c.type, c.solution, c.freeVariables, pivotColumns, c.rank);
    }
}
