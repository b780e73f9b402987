package com.rowreduction;

/** Operation counts for one solve, printed as the CLI's totals line. */
public final class SolveStats {
    public int steps;
    public int swaps;
    public int scales;
    public int replacements;
    public int rank;

    public static SolveStats of(SolverResult r) {
        SolveStats st = new SolveStats();
        st.steps = r.steps().size();
        st.rank = r.rank();
        for (Step s : r.steps()) {
            switch (s.kind()) {
                case SWAP: st.swaps++; break;
                case SCALE: st.scales++; break;
                case REPLACE: st.replacements++; break;
                default: break;
            }
        }
        return st;
    }

    @Override
    public String toString() {
        return "*Totals: steps=" + steps +
                " swaps=" + swaps +
                " scales=" + scales +
                " replacements=" + replacements +
                " rank=" + rank;
    }
}
