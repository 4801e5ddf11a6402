package com.convector.read;

public record ReadResult(RawRecord record, String skipReason) {

    public static ReadResult ok(RawRecord record) {
        return new ReadResult(record, null);
    }

    public static ReadResult skipped(String reason) {
        return new ReadResult(null, reason);
    }

    public boolean isOk() {
        return record != null;
    }
}
