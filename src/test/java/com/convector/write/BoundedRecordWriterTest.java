package com.convector.write;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedRecordWriterTest {

    @TempDir
    Path tempDir;

    private static Map<String, Object> row(int i) {
        return Map.of("input", "q" + i);
    }

    @Test
    void shouldStopAfterLineBudgetAndTagSource() throws Exception {
        Path output = tempDir.resolve("out.jsonl");

        try (BoundedRecordWriter writer = new BoundedRecordWriter(output, "in.jsonl", 2, null, false, FlushPolicy.DEFAULT)) {
            assertTrue(writer.write(row(1)));
            assertTrue(writer.write(row(2)));
            assertEquals(WriterState.LIMIT_REACHED, writer.state());
            assertFalse(writer.write(row(3)));
            assertEquals(2, writer.result().linesWritten());
        }

        List<String> lines = Files.readAllLines(output);
        assertEquals(List.of("{\"input\":\"q1\",\"source\":\"in.jsonl\"}", "{\"input\":\"q2\",\"source\":\"in.jsonl\"}"), lines);
    }

    @Test
    void shouldNeverWritePartialLineOverByteBudget() throws Exception {
        Path output = tempDir.resolve("out.jsonl");
        long lineBytes = "{\"input\":\"q1\",\"source\":\"s\"}".getBytes(StandardCharsets.UTF_8).length + 1L;

        try (BoundedRecordWriter writer = new BoundedRecordWriter(output, "s", null, lineBytes * 2 + 5, false, FlushPolicy.DEFAULT)) {
            assertTrue(writer.write(row(1)));
            assertTrue(writer.write(row(2)));
            assertFalse(writer.write(row(3)));
            assertEquals(WriterState.LIMIT_REACHED, writer.state());
        }

        assertEquals(lineBytes * 2, Files.size(output));
    }

    @Test
    void shouldFlushWhenThresholdIsReached() throws Exception {
        Path output = tempDir.resolve("out.jsonl");

        try (BoundedRecordWriter writer = new BoundedRecordWriter(output, "s", null, null, false, new FlushPolicy(2, true))) {
            writer.write(row(1));
            assertEquals(0, Files.size(output));
            writer.write(row(2));
            assertEquals(2, Files.readAllLines(output).size());
            writer.write(row(3));
        }

        assertEquals(3, Files.readAllLines(output).size());
    }

    @Test
    void shouldTruncateOrAppendExistingOutput() throws Exception {
        Path output = tempDir.resolve("out.jsonl");
        Files.writeString(output, "{\"old\":true}\n");

        try (BoundedRecordWriter writer = new BoundedRecordWriter(output, "s", null, null, true, FlushPolicy.DEFAULT)) {
            writer.write(row(1));
        }
        assertEquals(2, Files.readAllLines(output).size());

        try (BoundedRecordWriter writer = new BoundedRecordWriter(output, "s", null, null, false, FlushPolicy.DEFAULT)) {
            writer.write(row(1));
        }
        assertEquals(1, Files.readAllLines(output).size());
    }

    @Test
    void shouldReportExhaustedAndClosedStates() throws Exception {
        BoundedRecordWriter writer = new BoundedRecordWriter(tempDir.resolve("out.jsonl"), "s", 5, null, false, FlushPolicy.DEFAULT);
        assertEquals(WriterState.OPEN, writer.state());

        writer.write(row(1));
        writer.markExhausted();
        assertEquals(WriterState.EXHAUSTED, writer.state());

        writer.close();
        assertEquals(WriterState.CLOSED, writer.state());
        assertFalse(writer.write(row(2)));
    }
}
