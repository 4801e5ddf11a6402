package com.convector.read;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decodes one JSON value per line. Lines that fail to parse are reported as
 * skipped results and the sequence continues.
 */
public class JsonLinesRecordReader extends AbstractRecordReader {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordReader.class);

    private final String source;
    private final BufferedReader reader;
    private long lineNumber;

    public JsonLinesRecordReader(String source, InputStream inputStream) {
        this.source = source;
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    @Override
    protected ReadResult computeNext() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = JsonValues.MAPPER.readTree(line);
            } catch (JsonProcessingException e) {
                log.warn("read.line.malformed source={} line={} reason={}", source, lineNumber, e.getOriginalMessage());
                return ReadResult.skipped("line " + lineNumber + ": " + e.getOriginalMessage());
            }
            return ReadResult.ok(JsonValues.toRawRecord(nextPosition(), node));
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
