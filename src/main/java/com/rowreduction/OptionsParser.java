package com.rowreduction;

public final class OptionsParser {

    public static final class Parsed {
        public final SolverOptions options;
        public final String inputPath;
        private Parsed(SolverOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        SolverOptions.Builder b = new SolverOptions.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-steps": b.showSteps(true); break;        // default
                case "-nosteps": b.showSteps(false); break;
                case "-ascii": b.ascii(true); break;
                case "-v": b.verbosity(SolverOptions.Verbosity.VERBOSE); break;
                case "-q": b.verbosity(SolverOptions.Verbosity.QUIET); break;
                case "-maxsize": b.maxSize(Integer.parseInt(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}
