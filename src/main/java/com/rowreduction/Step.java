package com.rowreduction;

import java.util.List;
import java.util.Objects;

/**
 * One elementary row operation together with the matrix as it stood right
 * after the operation.  Steps carry their operands as data; rendering them
 * as text is left to {@link StepFormatter}.
 *
 * <p>Operand conventions:
 * <ul>
 *   <li>{@code SWAP}: rows {@code targetRow} and {@code sourceRow} exchanged.</li>
 *   <li>{@code SCALE}: {@code targetRow} multiplied by {@code scalar}.</li>
 *   <li>{@code REPLACE}: {@code targetRow += scalar × sourceRow}.</li>
 * </ul>
 */
public final class Step {
    public enum Kind { INITIAL, SWAP, SCALE, REPLACE }

    private final Kind kind;
    private final int targetRow;      // -1 for INITIAL
    private final int sourceRow;      // -1 unless SWAP/REPLACE
    private final int column;         // pivot column being cleared, -1 for INITIAL
    private final Rational scalar;    // null unless SCALE/REPLACE
    private final Matrix snapshot;

    private Step(Kind kind, int targetRow, int sourceRow, int column, Rational scalar, Matrix snapshot) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.targetRow = targetRow;
        this.sourceRow = sourceRow;
        this.column = column;
        this.scalar = scalar;
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    static Step initial(Matrix snapshot) {
        return new Step(Kind.INITIAL, -1, -1, -1, null, snapshot);
    }

    static Step swap(int a, int b, int col, Matrix snapshot) {
        return new Step(Kind.SWAP, a, b, col, null, snapshot);
    }

    static Step scale(int row, int col, Rational k, Matrix snapshot) {
        return new Step(Kind.SCALE, row, -1, col, Objects.requireNonNull(k, "scalar"), snapshot);
    }

    static Step replace(int target, int source, int col, Rational k, Matrix snapshot) {
        return new Step(Kind.REPLACE, target, source, col, Objects.requireNonNull(k, "scalar"), snapshot);
    }

    public Kind kind() { return kind; }
    public int targetRow() { return targetRow; }
    public int sourceRow() { return sourceRow; }
    public int column() { return column; }
    public Rational scalar() { return scalar; }

    /** Copy of the matrix after this step. */
    public Matrix snapshot() { return snapshot.copy(); }

    public Rational cell(int r, int c) { return snapshot.get(r, c); }

    public List<List<String>> displaySnapshot() { return snapshot.toDisplayRows(); }

    /** Rows a viewer should emphasise for this step. */
    public List<Integer> highlightRows() {
        switch (kind) {
            case SWAP:
            case REPLACE: return List.of(targetRow, sourceRow);
            case SCALE:   return List.of(targetRow);
            default:      return List.of();
        }
    }

    /** Re-applies this operation to {@code m} in place. INITIAL is a no-op. */
    public void applyTo(Matrix m) {
        switch (kind) {
            case SWAP:    m.swapRows(targetRow, sourceRow); break;
            case SCALE:   m.scaleRow(targetRow, scalar); break;
            case REPLACE: m.addMultipleOfRow(targetRow, sourceRow, scalar); break;
            default: break;
        }
    }

    @Override public String toString() {
        return kind + "[target=" + targetRow + ", source=" + sourceRow
                + ", col=" + column + ", scalar=" + scalar + "]";
    }
}
