package com.convector.read;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a whole-file JSON document: each element of a top-level array, or a
 * single top-level object once.
 */
public class JsonRecordReader extends AbstractRecordReader {
    private final Path path;
    private final JsonParser parser;
    private boolean started;
    private boolean array;

    public JsonRecordReader(Path path) throws IOException {
        this.path = path;
        this.parser = JsonValues.MAPPER.getFactory().createParser(Files.newInputStream(path));
    }

    @Override
    protected ReadResult computeNext() throws IOException {
        try {
            if (!started) {
                started = true;
                JsonToken first = parser.nextToken();
                if (first == null) {
                    return null;
                }
                if (first == JsonToken.START_ARRAY) {
                    array = true;
                } else {
                    JsonNode single = parser.readValueAsTree();
                    return ReadResult.ok(JsonValues.toRawRecord(nextPosition(), single));
                }
            }
            if (!array) {
                return null;
            }
            JsonToken token = parser.nextToken();
            if (token == null || token == JsonToken.END_ARRAY) {
                array = false;
                return null;
            }
            JsonNode element = parser.readValueAsTree();
            return ReadResult.ok(JsonValues.toRawRecord(nextPosition(), element));
        } catch (JsonProcessingException e) {
            throw new MalformedFileException("Invalid JSON document " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
