package com.convector.pipeline;

import java.io.IOException;

public class TransientIOException extends IOException {
    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
