package com.convector.write;

public enum WriterState {
    OPEN,
    WRITING,
    LIMIT_REACHED,
    EXHAUSTED,
    CLOSED
}
