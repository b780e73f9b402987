package com.rowreduction;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static void usage(PrintStream err) {
        err.println(
                "Usage: rref-java [options] <input-file>\n" +
                        "Options:\n" +
                        "  -steps        print every row operation with its matrix [default]\n" +
                        "  -nosteps      print only the reduced matrix and the solution\n" +
                        "  -ascii        plain ASCII notation (E1,2 instead of E₁₂)\n" +
                        "  -maxsize N    reject systems with more than N rows or columns\n" +
                        "  -v            debug logging\n" +
                        "  -q            log errors only\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        SolverOptions options = parsed.options;
        String filename = parsed.inputPath;
        configureLogging(options.verbosity);

        long t0 = System.nanoTime();
        try {
            AugmentedSystem system = AugmentedSystem.readFromFile(filename);
            SolverResult result = new EliminationEngine(options).solve(system.getCells());
            StepFormatter fmt = new StepFormatter(options.ascii);

            // name line: the file's own name line, else the base filename
            String base = system.getName();
            if (base == null) {
                base = Paths.get(filename).getFileName().toString();
                int dot = base.lastIndexOf('.');
                if (dot > 0) base = base.substring(0, dot);
            }
            out.println(base);

            if (options.showSteps) {
                for (Step s : result.steps()) {
                    out.println(fmt.describe(s));
                    out.print(StepFormatter.formatMatrix(s.displaySnapshot()));
                }
            } else {
                PrintWriter pw = new PrintWriter(out);
                result.rref().write(pw);
                pw.flush();
            }
            out.println(fmt.summary(result));
            for (String line : result.solution().orElse(List.of())) out.println(line);

            out.println(SolveStats.of(result));
            double secs = (System.nanoTime() - t0) / 1_000_000_000.0;
            out.printf("*Time=%.3fs%n", secs);
            return 0;
        } catch (FileNotFoundException e) {
            err.println("File not found: " + filename);
            return 1;
        } catch (IOException e) {
            log.error("Failed to read {}", filename, e);
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (InvalidMatrixException e) {
            err.println("Invalid matrix: " + e.getMessage());
            return 1;
        }
    }

    private static void configureLogging(SolverOptions.Verbosity verbosity) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        switch (verbosity) {
            case QUIET: root.setLevel(Level.ERROR); break;
            case VERBOSE: root.setLevel(Level.DEBUG); break;
            default: root.setLevel(Level.INFO); break;
        }
    }
}
