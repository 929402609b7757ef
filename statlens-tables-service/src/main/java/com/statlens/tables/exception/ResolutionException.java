package com.statlens.tables.exception;

/**
 * A dataflow, table, hierarchy or codelist that cannot be found.
 */
public class ResolutionException extends IllegalArgumentException {

    public ResolutionException(String message) {
        super(message);
    }
}
