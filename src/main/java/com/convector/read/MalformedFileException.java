package com.convector.read;

import com.convector.ConvectorException;

public class MalformedFileException extends ConvectorException {
    public MalformedFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
