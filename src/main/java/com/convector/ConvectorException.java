package com.convector;

public class ConvectorException extends RuntimeException {
    public ConvectorException(String message) {
        super(message);
    }

    public ConvectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
