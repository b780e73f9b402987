package com.rowreduction;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dense matrix of {@link Rational} values.  Rows and columns are indexed
 * from zero.  Besides plain access it carries the three elementary row
 * operations used by the elimination engine.
 */
public class Matrix {
    private final int rows;
    private final int cols;
    private final Rational[][] data;

    public int rows() { return rows; }
    public int cols() { return cols; }

    /**
     * Constructs a {@code rows × cols} matrix with all entries set to
     * zero.
     */
    public Matrix(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative dimensions");
        }
        this.rows = rows;
        this.cols = cols;
        this.data = new Rational[rows][cols];
        for (Rational[] row : data) Arrays.fill(row, Rational.ZERO);
    }

    /** Copies a rectangular array of values; the array is not retained. */
    public static Matrix of(Rational[][] values) {
        int m = values.length;
        int n = m == 0 ? 0 : values[0].length;
        Matrix mat = new Matrix(m, n);
        for (int i = 0; i < m; i++) {
            if (values[i].length != n) throw new IllegalArgumentException("Ragged row " + i);
            for (int j = 0; j < n; j++) mat.set(i, j, values[i][j]);
        }
        return mat;
    }

    /** Convenience for tests and presets: integer entries. */
    public static Matrix of(long[][] values) {
        Rational[][] r = new Rational[values.length][];
        for (int i = 0; i < values.length; i++) {
            r[i] = new Rational[values[i].length];
            for (int j = 0; j < values[i].length; j++) r[i][j] = Rational.of(values[i][j]);
        }
        return of(r);
    }

    /** Returns the entry at row {@code r}, column {@code c}. */
    public Rational get(int r, int c) {
        return data[r][c];
    }

    /** Sets the entry at row {@code r}, column {@code c}. */
    public void set(int r, int c, Rational value) {
        if (value == null) throw new IllegalArgumentException("null entry at " + r + "," + c);
        data[r][c] = value;
    }

    /** Independent copy; entries are immutable so a shallow row copy suffices. */
    public Matrix copy() {
        Matrix m = new Matrix(rows, cols);
        for (int i = 0; i < rows; i++) System.arraycopy(data[i], 0, m.data[i], 0, cols);
        return m;
    }

    // ---- elementary row operations ----

    /** Type I: exchange rows {@code a} and {@code b}. */
    public void swapRows(int a, int b) {
        Rational[] tmp = data[a];
        data[a] = data[b];
        data[b] = tmp;
    }

    /** Type II: multiply row {@code r} by a non-zero scalar. */
    public void scaleRow(int r, Rational k) {
        if (k.isZero()) throw new IllegalArgumentException("Row scale by zero");
        for (int j = 0; j < cols; j++) data[r][j] = data[r][j].multiply(k);
    }

    /** Type III: row {@code target} += {@code k} × row {@code source}. */
    public void addMultipleOfRow(int target, int source, Rational k) {
        if (target == source) throw new IllegalArgumentException("Row replacement needs two rows");
        for (int j = 0; j < cols; j++) {
            data[target][j] = data[target][j].add(k.multiply(data[source][j]));
        }
    }

    public boolean isZeroRow(int r, int fromCol, int toCol) {
        for (int j = fromCol; j < toCol; j++) if (!data[r][j].isZero()) return false;
        return true;
    }

    /** Display strings per cell, row by row. */
    public List<List<String>> toDisplayRows() {
        List<List<String>> out = new ArrayList<>(rows);
        for (Rational[] row : data) {
            List<String> r = new ArrayList<>(cols);
            for (Rational x : row) r.add(x.toDisplayString());
            out.add(Collections.unmodifiableList(r));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Writes this matrix to a writer, one row per line, cells separated by
     * a single space.
     */
    public void write(Writer out) throws IOException {
        for (int i = 0; i < rows; i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(data[i][j].toDisplayString());
            }
            out.write(sb.toString());
            out.write(System.lineSeparator());
        }
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        return rows == o.rows && cols == o.cols && Arrays.deepEquals(data, o.data);
    }

    @Override public int hashCode() { return Arrays.deepHashCode(data); }

    @Override public String toString() { return toDisplayRows().toString(); }
}
