package com.convector.extract;

import com.convector.ConvectorException;

public class SchemaMismatchException extends ConvectorException {
    public SchemaMismatchException(String message) {
        super(message);
    }
}
