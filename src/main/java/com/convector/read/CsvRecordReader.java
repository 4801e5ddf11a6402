package com.convector.read;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Yields one field map per CSV row, keyed by the header row.
 */
public class CsvRecordReader extends AbstractRecordReader {
    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private final Path path;
    private final CSVParser parser;
    private final Iterator<CSVRecord> rows;

    public CsvRecordReader(Path path) throws IOException {
        this.path = path;
        this.parser = CSV_FORMAT.parse(Files.newBufferedReader(path, StandardCharsets.UTF_8));
        this.rows = parser.iterator();
    }

    @Override
    protected ReadResult computeNext() {
        CSVRecord row;
        try {
            if (!rows.hasNext()) {
                return null;
            }
            row = rows.next();
        } catch (UncheckedIOException e) {
            throw new MalformedFileException("Invalid CSV file " + path + ": " + e.getCause().getMessage(), e);
        }
        if (!row.isConsistent()) {
            return ReadResult.skipped("row " + row.getRecordNumber() + ": expected " + parser.getHeaderNames().size()
                    + " columns but found " + row.size());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String header : parser.getHeaderNames()) {
            fields.put(header, row.get(header));
        }
        return ReadResult.ok(RawRecord.ofFields(nextPosition(), fields));
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
