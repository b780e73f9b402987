package com.rowreduction;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * An augmented system read from a small lrs-like text format:
 * <pre>
 * name                  (optional)
 * begin
 * m n                   (or "***** n" to read rows until end)
 * a11 a12 ... b1
 * ...
 * end
 * </pre>
 * Cells stay raw text; the engine applies its lenient parsing.
 */
public class AugmentedSystem {
    private final String name;
    private final int rowCount;
    private final int colCount;
    private final List<List<String>> cells;

    AugmentedSystem(String name, List<List<String>> cells) {
        this.name = name;
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
        this.rowCount = cells.size();
        this.colCount = cells.isEmpty() ? 0 : cells.get(0).size();
    }

    public String getName() { return name; }
    public int getRowCount() { return rowCount; }
    public int getColCount() { return colCount; }
    public List<List<String>> getCells() { return cells; }

    public static AugmentedSystem readFromFile(String filename) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(filename))) {
            return read(br);
        }
    }

    public static AugmentedSystem read(Reader in) throws IOException {
        BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;
        String name = null;
        boolean sawBegin = false;

        // ---- header: optional name and comments, then 'begin' ----
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || isComment(line)) continue;
            if (line.toLowerCase(Locale.ROOT).equals("begin")) { sawBegin = true; break; }
            if (name == null) name = line;
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        String[] header = nextContentLine(br).split("\\s+");
        if (header.length < 2)
            throw new IOException("Expected 'm n' or '***** n', got: " + String.join(" ", header));
        final boolean starHeader = header[0].equals("*****");
        final int n = parseCount(header[1], "Column count");
        final int m = starHeader ? -1 : parseCount(header[0], "Row count");

        List<List<String>> rows = new ArrayList<>();
        while (true) {
            line = nextContentLine(br);
            if (line.equalsIgnoreCase("end")) break;
            if (!starHeader && rows.size() == m)
                throw new IOException("Expected 'end' after " + m + " rows, got: " + line);
            String[] tokens = line.split("\\s+");
            if (tokens.length != n)
                throw new IOException("Expected " + n + " columns on row " + (rows.size() + 1) + ", got " + tokens.length);
            rows.add(Collections.unmodifiableList(Arrays.asList(tokens)));
        }
        if (!starHeader && rows.size() != m)
            throw new IOException("Expected " + m + " rows, got " + rows.size());

        return new AugmentedSystem(name, rows);
    }

    /** Writes the system back out with a starred header. */
    public void write(PrintWriter out) {
        if (name != null) out.println(name);
        out.println("begin");
        out.printf("***** %d%n", colCount);
        for (List<String> row : cells) out.println(String.join(" ", row));
        out.println("end");
    }

    private static String nextContentLine(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty() || isComment(line));
        return line;
    }

    // "*****" is a header token, not a comment
    private static boolean isComment(String line) {
        return line.startsWith("#") || (line.startsWith("*") && !line.startsWith("*****"));
    }

    private static int parseCount(String token, String what) throws IOException {
        if (!token.matches("\\d+"))
            throw new IOException(what + " must be numeric, got: " + token);
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IOException(what + " out of range, got: " + token, e);
        }
    }
}
