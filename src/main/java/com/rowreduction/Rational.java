package com.rowreduction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Immutable arbitrary-precision rational with normalized sign and gcd reduction. */
public final class Rational implements Numeric<Rational> {
    private static final Logger log = LoggerFactory.getLogger(Rational.class);

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE  = new Rational(BigInteger.ONE,  BigInteger.ONE);

    private static final Pattern DECIMAL  = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern FRACTION = Pattern.compile("([-+]?\\d+)\\s*/\\s*([-+]?\\d+)");

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Rational(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    public Rational(BigInteger integer) { this(integer, BigInteger.ONE); }

    /** Factories */
    public static Rational of(long k) { return new Rational(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Rational of(long num, long den) { return new Rational(BigInteger.valueOf(num), BigInteger.valueOf(den)); }
    public static Rational of(BigInteger k) { return new Rational(k); }

    /** Exact value of a decimal; 0.1 is 1/10. */
    public static Rational of(BigDecimal x) {
        if (x.scale() <= 0) return new Rational(x.toBigIntegerExact());
        return new Rational(x.unscaledValue(), BigInteger.TEN.pow(x.scale()));
    }

    /**
     * Lenient cell parser. Accepts "", "-", integers, decimals and "p/d";
     * anything else (including a zero denominator) reads as zero.
     */
    public static Rational parse(String s) {
        if (s == null) return ZERO;
        String t = s.trim();
        if (t.isEmpty() || t.equals("-") || t.equals("+")) return ZERO;
        if (DECIMAL.matcher(t).matches()) return of(new BigDecimal(t));
        Matcher m = FRACTION.matcher(t);
        if (m.matches()) {
            BigInteger b = new BigInteger(m.group(2));
            if (b.signum() != 0) return new Rational(new BigInteger(m.group(1)), b);
        }
        log.debug("Unparseable cell '{}' read as 0", s);
        return ZERO;
    }

    /**
     * Numbers convert exactly.  Floats and doubles go through their shortest
     * decimal form, so 0.1f is 1/10; other number types through their text.
     */
    public static Rational parse(Number x) {
        if (x == null) return ZERO;
        if (x instanceof BigInteger) return of((BigInteger) x);
        if (x instanceof BigDecimal) return of((BigDecimal) x);
        if (x instanceof Long || x instanceof Integer || x instanceof Short || x instanceof Byte)
            return of(x.longValue());
        if (x instanceof Double || x instanceof Float) {
            double v = x.doubleValue();
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                log.debug("Non-finite cell {} read as 0", x);
                return ZERO;
            }
            return of(new BigDecimal(x.toString()));
        }
        return parse(x.toString());
    }

    /** Dispatches on cell type: Rational, Number, or anything else through its text form. */
    public static Rational parseCell(Object cell) {
        if (cell instanceof Rational) return (Rational) cell;
        if (cell instanceof Number) return parse((Number) cell);
        return parse(cell == null ? null : cell.toString());
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    // ---- Numeric ----

    @Override public Rational add(Rational o) {
        // (n/d) + (x/y) over lcm(d, y)
        BigInteger g = d.gcd(o.d);
        BigInteger left = d.divide(g);
        BigInteger right = o.d.divide(g);
        return new Rational(n.multiply(right).add(o.n.multiply(left)), left.multiply(o.d));
    }

    @Override public Rational subtract(Rational o) {
        return add(o.negate());
    }

    @Override public Rational multiply(Rational o) {
        if (n.signum() == 0 || o.n.signum() == 0) return ZERO;
        BigInteger g1 = n.gcd(o.d);
        BigInteger g2 = d.gcd(o.n);
        return new Rational(n.divide(g1).multiply(o.n.divide(g2)),
                d.divide(g2).multiply(o.d.divide(g1)));
    }

    @Override public Rational divide(Rational o) {
        if (o.n.signum() == 0) throw new ArithmeticException("Divide by zero rational");
        return multiply(o.inverse());
    }

    @Override public Rational inverse() {
        if (n.signum() == 0) throw new ArithmeticException("Zero has no inverse");
        return new Rational(d, n);
    }

    @Override public Rational negate() { return n.signum() == 0 ? ZERO : new Rational(n.negate(), d); }
    @Override public Rational abs()    { return n.signum() < 0 ? negate() : this; }
    @Override public int signum()      { return n.signum(); }
    @Override public boolean isZero()  { return n.signum() == 0; }
    @Override public boolean isOne()   { return n.equals(BigInteger.ONE) && d.equals(BigInteger.ONE); }

    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    // ---- Comparable ----
    @Override public int compareTo(Rational o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rational)) return false;
        Rational o = (Rational) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Integers print as integers, everything else as n/d with the sign on n. */
    public String toDisplayString() {
        return isInteger() ? n.toString() : n + "/" + d;
    }

    @Override public String toString() { return toDisplayString(); }
}
