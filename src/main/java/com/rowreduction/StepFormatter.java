package com.rowreduction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders steps in elementary-matrix notation, e.g.
 * {@code [Type III] E₂₁(3) : R2 + (3) × R1}.  The ASCII form swaps
 * subscripts for comma-separated indices and symbols for plain text.
 */
public final class StepFormatter {
    private static final char[] SUBSCRIPTS = {'₀', '₁', '₂', '₃', '₄', '₅', '₆', '₇', '₈', '₉'};

    private final boolean ascii;

    public StepFormatter(boolean ascii) { this.ascii = ascii; }

    public String describe(Step s) {
        int t = s.targetRow() + 1, src = s.sourceRow() + 1;
        switch (s.kind()) {
            case INITIAL:
                return "Initial augmented matrix";
            case SWAP:
                return "[Type I] E" + indices(t, src) + " : Swap R" + t + (ascii ? " <-> R" : " ↔ R") + src;
            case SCALE: {
                String k = s.scalar().toDisplayString();
                return "[Type II] E" + sub(t) + "(" + k + ") : Multiply R" + t + " by " + k;
            }
            case REPLACE: {
                String k = s.scalar().toDisplayString();
                return "[Type III] E" + indices(t, src) + "(" + k + ") : R" + t + " + (" + k + ")"
                        + (ascii ? " * R" : " × R") + src;
            }
            default:
                throw new IllegalStateException("Unknown step kind " + s.kind());
        }
    }

    /** One-line verdict shown after the last step. */
    public String summary(SolverResult r) {
        switch (r.solutionType()) {
            case INCONSISTENT:
                return (ascii ? "!" : "⚠") + " System is INCONSISTENT (0 = non-zero detected)";
            case INFINITE:
                String free = r.freeVariables().stream()
                        .map(j -> "x" + sub(j + 1))
                        .collect(Collectors.joining(", "));
                return (ascii ? "inf" : "∞") + " Infinite solutions (Free variables: " + free + ")";
            default:
                return (ascii ? "ok" : "✓") + " Unique solution found";
        }
    }

    /** Right-aligned columns with a bar in front of the augmented column. */
    public static String formatMatrix(List<List<String>> rows) {
        if (rows.isEmpty()) return "";
        int cols = rows.get(0).size();
        int[] width = new int[cols];
        for (List<String> row : rows)
            for (int j = 0; j < cols; j++) width[j] = Math.max(width[j], row.get(j).length());

        StringBuilder sb = new StringBuilder();
        for (List<String> row : rows) {
            sb.append('[');
            for (int j = 0; j < cols; j++) {
                sb.append(j == cols - 1 ? " | " : " ");
                pad(sb, row.get(j), width[j]);
            }
            sb.append(" ]").append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static void pad(StringBuilder sb, String s, int w) {
        for (int i = s.length(); i < w; i++) sb.append(' ');
        sb.append(s);
    }

    private String indices(int a, int b) {
        return ascii ? a + "," + b : sub(a) + sub(b);
    }

    private String sub(int k) {
        if (ascii) return Integer.toString(k);
        String digits = Integer.toString(k);
        StringBuilder sb = new StringBuilder(digits.length());
        for (char c : digits.toCharArray()) sb.append(SUBSCRIPTS[c - '0']);
        return sb.toString();
    }
}
