package com.rowreduction;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

/** Worked systems: unique, infinite, inconsistent and exact-fraction inputs. */
public class EliminationEngineTest {

    private final EliminationEngine engine = new EliminationEngine();

    private static List<Step.Kind> kinds(SolverResult r) {
        Step.Kind[] k = new Step.Kind[r.steps().size()];
        for (int i = 0; i < k.length; i++) k[i] = r.steps().get(i).kind();
        return Arrays.asList(k);
    }

    @Test
    public void testUniqueSolution() {
        Object[][] in = { { 2, 1, -1, 8 }, { -3, -1, 2, -11 }, { -2, 1, 2, -3 } };
        SolverResult r = engine.solve(in);

        assertEquals(SolutionType.UNIQUE, r.solutionType());
        assertEquals(List.of("x1 = 2", "x2 = 3", "x3 = -1"), r.solution().orElseThrow());
        assertEquals(3, r.rank());
        assertEquals(List.of(), r.freeVariables());
        assertEquals(List.of(0, 1, 2), r.pivotColumns());
        assertEquals(Matrix.of(new long[][] { { 1, 0, 0, 2 }, { 0, 1, 0, 3 }, { 0, 0, 1, -1 } }), r.rref());
    }

    @Test
    public void testUniqueSolutionStepLog() {
        Object[][] in = { { 2, 1, -1, 8 }, { -3, -1, 2, -11 }, { -2, 1, 2, -3 } };
        SolverResult r = engine.solve(in);

        assertEquals(List.of(Step.Kind.INITIAL,
                Step.Kind.SCALE, Step.Kind.REPLACE, Step.Kind.REPLACE,
                Step.Kind.SCALE, Step.Kind.REPLACE, Step.Kind.REPLACE,
                Step.Kind.SCALE, Step.Kind.REPLACE, Step.Kind.REPLACE), kinds(r));

        Step scale = r.steps().get(1);
        assertEquals(0, scale.targetRow());
        assertEquals(0, scale.column());
        assertEquals(Rational.of(1, 2), scale.scalar());
        assertEquals(List.of(0), scale.highlightRows());

        Step replace = r.steps().get(2);
        assertEquals(1, replace.targetRow());
        assertEquals(0, replace.sourceRow());
        assertEquals(Rational.of(3), replace.scalar());
        assertEquals(List.of("0", "1/2", "1/2", "1"), replace.displaySnapshot().get(1));
        assertEquals(List.of(1, 0), replace.highlightRows());
    }

    @Test
    public void testInfiniteSolutions() {
        Object[][] in = { { 1, 2, 1, 0, 5 }, { 2, 4, 0, 1, 8 }, { 3, 6, 1, 1, 13 } };
        SolverResult r = engine.solve(in);

        assertEquals(SolutionType.INFINITE, r.solutionType());
        assertEquals(2, r.rank());
        assertEquals(List.of(1, 3), r.freeVariables());
        assertEquals(List.of(0, 2), r.pivotColumns());
        assertEquals(List.of(
                "x1 = 4 - 2t1 - 1/2t2",
                "x2 = t1 (free)",
                "x3 = 1 + 1/2t2",
                "x4 = t2 (free)"), r.solution().orElseThrow());
        assertEquals(List.of(
                List.of("1", "2", "0", "1/2", "4"),
                List.of("0", "0", "1", "-1/2", "1"),
                List.of("0", "0", "0", "0", "0")), r.rrefDisplay());
        assertEquals(r.numVariables(), r.rank() + r.freeVariables().size());
    }

    @Test
    public void testInconsistentSystem() {
        Object[][] in = { { 1, 1, 1, 6 }, { 1, 1, 1, 8 }, { 0, 0, 1, 3 } };
        SolverResult r = engine.solve(in);

        assertEquals(SolutionType.INCONSISTENT, r.solutionType());
        assertTrue(r.solution().isEmpty());
        assertFalse(r.isConsistent());
        assertEquals(2, r.rank());
        assertEquals(List.of(0, 2, 3), r.pivotColumns());

        Matrix rref = r.rref();
        boolean contradiction = false;
        for (int i = 0; i < rref.rows(); i++)
            if (rref.isZeroRow(i, 0, 3) && !rref.get(i, 3).isZero()) contradiction = true;
        assertTrue(contradiction, "some row reads 0 = non-zero");

        assertEquals(List.of(Step.Kind.INITIAL, Step.Kind.REPLACE, Step.Kind.SWAP, Step.Kind.REPLACE,
                Step.Kind.SCALE, Step.Kind.REPLACE, Step.Kind.REPLACE), kinds(r));
        Step swap = r.steps().get(2);
        assertEquals(1, swap.targetRow());
        assertEquals(2, swap.sourceRow());
        assertEquals(2, swap.column());
        assertNull(swap.scalar());
    }

    @Test
    public void testFractionCellsStayExact() {
        Object[][] in = { { "1/3", "1", "2" }, { "1", "-1", "0" } };
        SolverResult r = engine.solve(in);

        assertEquals(Rational.of(1, 3), r.steps().get(0).cell(0, 0));
        Step scale = r.steps().get(1);
        assertEquals(Step.Kind.SCALE, scale.kind());
        assertEquals(Rational.of(3), scale.scalar());
        assertEquals(Rational.ONE, scale.cell(0, 0));
        assertEquals(SolutionType.UNIQUE, r.solutionType());
        assertEquals(List.of("x1 = 3/2", "x2 = 3/2"), r.solution().orElseThrow());
    }

    @Test
    public void testDecimalCells() {
        SolverResult r = engine.solve(new Object[][] { { "0.1", "0.2", "0.3" } });
        assertEquals(List.of(List.of("1", "2", "3")), r.rrefDisplay());
        assertEquals(Rational.of(10), r.steps().get(1).scalar());
        assertEquals(List.of("x1 = 3 - 2t1", "x2 = t1 (free)"), r.solution().orElseThrow());
    }

    @Test
    public void testLenientCells() {
        Object[][] in = { { "", "2", "x" }, { "-", "abc", "4" } };
        SolverResult r = engine.solve(in);
        assertEquals(Rational.ZERO, r.steps().get(0).cell(0, 0));
        assertEquals(Rational.ZERO, r.steps().get(0).cell(0, 2));
        assertEquals(Rational.ZERO, r.steps().get(0).cell(1, 1));
        // 0x1 + 2x2 = 0 ; 0 = 4
        assertEquals(SolutionType.INCONSISTENT, r.solutionType());
    }

    @Test
    public void testSingleRowNoPivotColumns() {
        SolverResult zero = engine.solve(new Object[][] { { 0, 0 } });
        assertEquals(SolutionType.INFINITE, zero.solutionType());
        assertEquals(0, zero.rank());
        assertEquals(List.of(0), zero.freeVariables());
        assertEquals(List.of("x1 = t1 (free)"), zero.solution().orElseThrow());
        assertEquals(1, zero.steps().size());

        SolverResult bad = engine.solve(new Object[][] { { 0, 5 } });
        assertEquals(SolutionType.INCONSISTENT, bad.solutionType());
        assertEquals(List.of(List.of("0", "1")), bad.rrefDisplay());
        assertEquals(List.of(1), bad.pivotColumns());
        assertEquals(0, bad.rank());

        SolverResult one = engine.solve(new Object[][] { { 3, 6 } });
        assertEquals(List.of("x1 = 2"), one.solution().orElseThrow());
    }

    @Test
    public void testMoreEquationsThanVariables() {
        SolverResult r = engine.solve(new Object[][] { { 1, 2 }, { 2, 4 }, { 3, 6 } });
        assertEquals(SolutionType.UNIQUE, r.solutionType());
        assertEquals(List.of("x1 = 2"), r.solution().orElseThrow());
        assertEquals(List.of(List.of("1", "2"), List.of("0", "0"), List.of("0", "0")), r.rrefDisplay());
    }

    @Test
    public void testListInputAndAlias() {
        List<List<String>> in = List.of(List.of("1", "1", "3"), List.of("1", "-1", "1"));
        SolverResult r = engine.solveRREF(in);
        assertEquals(List.of("x1 = 2", "x2 = 1"), r.solution().orElseThrow());
    }

    @Test
    public void testCallerInputNotMutated() {
        Matrix in = Matrix.of(new long[][] { { 0, 2, 4 }, { 3, 0, 3 } });
        Matrix before = in.copy();
        SolverResult r = engine.solve(in);
        assertEquals(before, in);
        assertEquals(before, r.steps().get(0).snapshot());
        assertEquals(Step.Kind.SWAP, r.steps().get(1).kind());
    }

    @Test
    public void testSnapshotsAreIndependent() {
        SolverResult r = engine.solve(new Object[][] { { 2, 4 }, { 1, 1 } });
        Matrix s = r.steps().get(0).snapshot();
        s.set(0, 0, Rational.of(100));
        assertEquals(Rational.of(2), r.steps().get(0).cell(0, 0));

        Matrix rref = r.rref();
        rref.set(0, 0, Rational.of(100));
        assertEquals(Rational.ONE, r.rref().get(0, 0));
        assertNotEquals(r.steps().get(0).displaySnapshot(), r.rrefDisplay());
    }

    @Test
    public void testValidation() {
        assertThrows(InvalidMatrixException.class, () -> engine.solve(new Object[0][]));
        assertThrows(InvalidMatrixException.class, () -> engine.solve((Object[][]) null));
        assertThrows(InvalidMatrixException.class, () -> engine.solve(new Object[][] { { 1 } }));
        assertThrows(InvalidMatrixException.class, () -> engine.solve(new Object[][] { { 1, 2 }, { 1 } }));
        assertThrows(InvalidMatrixException.class, () -> engine.solve(new Object[][] { { 1, 2 }, null }));
        assertThrows(InvalidMatrixException.class, () -> engine.solve(List.of()));
        assertThrows(IllegalArgumentException.class, () -> engine.solve(new Matrix(2, 1)));
    }

    @Test
    public void testSizeCap() {
        EliminationEngine capped = new EliminationEngine(new SolverOptions.Builder().maxSize(3).build());
        assertNotNull(capped.solve(new Object[][] { { 1, 2, 3 }, { 4, 5, 6 } }));
        InvalidMatrixException e = assertThrows(InvalidMatrixException.class,
                () -> capped.solve(new Object[][] { { 1, 2, 3, 4 } }));
        assertTrue(e.getMessage().contains("size cap"));
    }
}
