package com.convector.read;

import com.convector.ConvectorException;

public class UnsupportedFormatException extends ConvectorException {
    public UnsupportedFormatException(String message) {
        super(message);
    }
}
