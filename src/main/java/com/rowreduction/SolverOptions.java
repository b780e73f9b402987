package com.rowreduction;

public final class SolverOptions {
    public enum Verbosity { QUIET, NORMAL, VERBOSE }

    public final boolean showSteps;         // print every step with its snapshot
    public final boolean ascii;             // plain ASCII notation instead of subscripts
    public final int maxSize;               // cap on rows and columns (0 = no cap)
    public final Verbosity verbosity;

    private SolverOptions(Builder b) {
        this.showSteps = b.showSteps;
        this.ascii = b.ascii;
        this.maxSize = b.maxSize;
        this.verbosity = b.verbosity;
    }

    public static SolverOptions defaults() { return new Builder().build(); }

    public static final class Builder {
        private boolean showSteps = true, ascii;
        private int maxSize = 0;
        private Verbosity verbosity = Verbosity.NORMAL;

        public Builder showSteps(boolean v){ this.showSteps=v; return this; }
        public Builder ascii(boolean v){ this.ascii=v; return this; }
        public Builder maxSize(int v){
            if (v < 0) throw new IllegalArgumentException("maxsize must be >= 0: " + v);
            this.maxSize=v; return this;
        }
        public Builder verbosity(Verbosity v){ this.verbosity=v; return this; }
        public SolverOptions build(){ return new SolverOptions(this); }
    }
}
