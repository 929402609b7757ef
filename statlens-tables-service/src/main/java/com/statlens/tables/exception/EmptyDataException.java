package com.statlens.tables.exception;

public class EmptyDataException extends RuntimeException {

    private final String url;

    public EmptyDataException(String message, String url) {
        super(message);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
