package com.rowreduction;

/** How many solutions the reduced system admits. */
public enum SolutionType { UNIQUE, INFINITE, INCONSISTENT }
