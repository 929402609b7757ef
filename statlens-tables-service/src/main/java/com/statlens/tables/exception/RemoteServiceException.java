package com.statlens.tables.exception;

public class RemoteServiceException extends RuntimeException {

    private final String url;
    private final int statusCode;

    public RemoteServiceException(String message, String url, int statusCode) {
        super(message + " -> " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public RemoteServiceException(String message, String url, Throwable cause) {
        super(message + " -> " + url, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
