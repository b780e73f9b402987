package com.rowreduction;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a finished RREF matrix as a linear system whose last column holds
 * the constants.  Every well-formed matrix falls into exactly one
 * {@link SolutionType}; this class never throws on valid input.
 */
final class SolutionClassifier {

    static final class Classification {
        final SolutionType type;
        final int rank;
        final List<Integer> freeVariables;
        final List<String> solution;      // null when inconsistent

        Classification(SolutionType type, int rank, List<Integer> freeVariables, List<String> solution) {
            this.type = type;
            this.rank = rank;
            this.freeVariables = freeVariables;
            this.solution = solution;
        }
    }

    private SolutionClassifier() {}

    static Classification classify(Matrix m, List<Integer> pivotColumns) {
        int rows = m.rows(), cols = m.cols();
        int numVariables = cols - 1;

        int rank = 0;
        for (int c : pivotColumns) if (c < numVariables) rank++;

        List<Integer> free = new ArrayList<>();
        for (int j = 0; j < numVariables; j++) if (!pivotColumns.contains(j)) free.add(j);

        // 0 = non-zero
        for (int i = 0; i < rows; i++) {
            if (m.isZeroRow(i, 0, numVariables) && !m.get(i, numVariables).isZero()) {
                return new Classification(SolutionType.INCONSISTENT, rank, free, null);
            }
        }

        List<String> solution = new ArrayList<>(numVariables);
        if (rank < numVariables) {
            for (int j = 0; j < numVariables; j++) {
                int p = free.indexOf(j);
                if (p >= 0) {
                    solution.add(variable(j) + " = " + parameter(p) + " (free)");
                    continue;
                }
                int row = pivotColumns.indexOf(j);
                if (row < 0 || row >= rows) continue;
                solution.add(variable(j) + " = " + parametricExpression(m, row, free));
            }
            return new Classification(SolutionType.INFINITE, rank, free, solution);
        }

        // rank == numVariables: pivot row of variable j is row j
        for (int j = 0; j < numVariables && j < rows; j++) {
            solution.add(variable(j) + " = " + m.get(j, numVariables).toDisplayString());
        }
        return new Classification(SolutionType.UNIQUE, rank, free, solution);
    }

    /** Constant term followed by each free column moved to the right-hand side. */
    private static String parametricExpression(Matrix m, int row, List<Integer> free) {
        StringBuilder sb = new StringBuilder(m.get(row, m.cols() - 1).toDisplayString());
        for (int p = 0; p < free.size(); p++) {
            Rational coef = m.get(row, free.get(p));
            if (coef.isZero()) continue;
            Rational moved = coef.negate();
            String mag = moved.abs().toDisplayString();
            sb.append(moved.signum() >= 0 ? " + " : " - ");
            if (!mag.equals("1")) sb.append(mag);
            sb.append(parameter(p));
        }
        return sb.toString();
    }

    static String variable(int col) { return "x" + (col + 1); }

    static String parameter(int index) { return "t" + (index + 1); }
}
