package com.convector.write;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.Profile;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Writes mapped records as JSON lines while enforcing the profile's line and
 * byte budgets. A line that would exceed the byte budget is never written, not
 * even partially.
 *
 * <p>State moves {@code OPEN -> WRITING -> LIMIT_REACHED | EXHAUSTED -> CLOSED}.
 */
public class BoundedRecordWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(BoundedRecordWriter.class);
    public static final String SOURCE_FIELD = "source";

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final Path outputPath;
    private final String source;
    private final Integer lineLimit;
    private final Long byteLimit;
    private final FlushPolicy flushPolicy;
    private final BufferedWriter writer;
    private final List<String> buffer = new ArrayList<>();

    private WriterState state = WriterState.OPEN;
    private long linesWritten;
    private long bytesWritten;

    BoundedRecordWriter(
            Path outputPath,
            String source,
            Integer lineLimit,
            Long byteLimit,
            boolean append,
            FlushPolicy flushPolicy) throws IOException {
        this.outputPath = outputPath;
        this.source = source;
        this.lineLimit = lineLimit;
        this.byteLimit = byteLimit;
        this.flushPolicy = flushPolicy;
        this.writer = Files.newBufferedWriter(
                outputPath,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING);
    }

    public static BoundedRecordWriter open(Path outputPath, String source, Profile profile, FlushPolicy flushPolicy)
            throws IOException {
        return new BoundedRecordWriter(outputPath, source, profile.lines(), profile.bytes(), profile.append(), flushPolicy);
    }

    public boolean isAccepting() {
        return state == WriterState.OPEN || state == WriterState.WRITING;
    }

    /**
     * Serializes and buffers one record with the {@code source} field attached.
     *
     * @return false once a budget is reached; the record was not written
     */
    public boolean write(Map<String, Object> record) throws IOException {
        if (!isAccepting()) {
            return false;
        }
        if (lineLimit != null && linesWritten >= lineLimit) {
            limitReached("lines");
            return false;
        }
        Map<String, Object> withSource = new LinkedHashMap<>(record);
        withSource.put(SOURCE_FIELD, source);
        String line = objectMapper.writeValueAsString(withSource);
        long lineBytes = line.getBytes(StandardCharsets.UTF_8).length + 1L;
        if (byteLimit != null && bytesWritten + lineBytes > byteLimit) {
            limitReached("bytes");
            return false;
        }

        buffer.add(line);
        linesWritten++;
        bytesWritten += lineBytes;
        state = WriterState.WRITING;
        if (flushPolicy.shouldFlush(buffer.size())) {
            flush();
        }
        if (lineLimit != null && linesWritten >= lineLimit) {
            limitReached("lines");
        }
        return true;
    }

    public void markExhausted() {
        if (isAccepting()) {
            state = WriterState.EXHAUSTED;
        }
    }

    public void flush() throws IOException {
        if (buffer.isEmpty()) {
            return;
        }
        for (String line : buffer) {
            writer.write(line);
            writer.write('\n');
        }
        writer.flush();
        log.debug("write.flush path={} lines={}", outputPath, buffer.size());
        buffer.clear();
    }

    public WriterState state() {
        return state;
    }

    public WriteResult result() {
        return new WriteResult(outputPath, linesWritten, bytesWritten);
    }

    @Override
    public void close() throws IOException {
        if (state == WriterState.CLOSED) {
            return;
        }
        try {
            if (flushPolicy.flushOnClose()) {
                flush();
            }
        } finally {
            writer.close();
            state = WriterState.CLOSED;
        }
    }

    private void limitReached(String budget) {
        if (state != WriterState.LIMIT_REACHED) {
            log.info("write.limit.reached path={} budget={} lines={} bytes={}", outputPath, budget, linesWritten, bytesWritten);
        }
        state = WriterState.LIMIT_REACHED;
    }
}
