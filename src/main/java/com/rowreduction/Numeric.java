package com.rowreduction;

/** Minimal exact-number abstraction for the elimination code. */
public interface Numeric<T extends Numeric<T>> extends Comparable<T> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T divide(T o);
    T negate();
    T abs();
    T inverse();
    int signum();
    boolean isZero();
    boolean isOne();
}
