package com.rowreduction;

/** Input matrix has the wrong shape: ragged, empty, too narrow, or over the size cap. */
public class InvalidMatrixException extends IllegalArgumentException {
    public InvalidMatrixException(String message) {
        super(message);
    }
}
