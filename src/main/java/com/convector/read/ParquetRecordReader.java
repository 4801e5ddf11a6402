package com.convector.read;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.ParquetDecodingException;

/**
 * Yields one field map per Parquet row, converting Avro values to plain Java
 * scalars, lists and maps.
 */
public class ParquetRecordReader extends AbstractRecordReader {
    private final Path path;
    private final ParquetReader<GenericRecord> reader;

    public ParquetRecordReader(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        this.path = path;
        Configuration conf = new Configuration();
        try {
            this.reader = AvroParquetReader.<GenericRecord>builder(
                            HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(path.toUri()), conf))
                    .withConf(conf)
                    .build();
        } catch (RuntimeException e) {
            throw new MalformedFileException("Invalid Parquet file " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected ReadResult computeNext() throws IOException {
        GenericRecord row;
        try {
            row = reader.read();
        } catch (ParquetDecodingException e) {
            throw new MalformedFileException("Invalid Parquet file " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new MalformedFileException("Invalid Parquet file " + path + ": " + e.getMessage(), e);
        }
        if (row == null) {
            return null;
        }
        return ReadResult.ok(RawRecord.ofFields(nextPosition(), toMap(row)));
    }

    static Map<String, Object> toMap(GenericRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
            fields.put(field.name(), toJavaValue(record.get(field.pos())));
        }
        return fields;
    }

    static Object toJavaValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof GenericRecord nested) {
            return toMap(nested);
        }
        if (value instanceof Collection<?> items) {
            List<Object> converted = new ArrayList<>(items.size());
            for (Object item : items) {
                converted.add(toJavaValue(item));
            }
            return converted;
        }
        if (value instanceof Map<?, ?> entries) {
            Map<String, Object> converted = new LinkedHashMap<>();
            entries.forEach((key, item) -> converted.put(String.valueOf(key), toJavaValue(item)));
            return converted;
        }
        if (value instanceof ByteBuffer buffer) {
            ByteBuffer copy = buffer.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof GenericFixed fixed) {
            return Base64.getEncoder().encodeToString(fixed.bytes());
        }
        return value.toString();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
