package com.convector.read;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

import com.github.luben.zstd.ZstdInputStream;

/**
 * Selects a {@link RecordReader} by file extension.
 */
public final class RecordReaders {
    private static final List<RecordFormat> FORMATS = defaultFormats();

    private RecordReaders() {
    }

    public static RecordReader open(Path path) throws IOException {
        return formatFor(path)
                .orElseThrow(() -> new UnsupportedFormatException("Unsupported file type: " + path.getFileName()))
                .open(path);
    }

    public static boolean isSupported(Path path) {
        return formatFor(path).isPresent();
    }

    public static Optional<RecordFormat> formatFor(Path path) {
        if (path.getFileName() == null) {
            return Optional.empty();
        }
        return FORMATS.stream().filter(format -> format.supports(path)).findFirst();
    }

    private static List<RecordFormat> defaultFormats() {
        List<RecordFormat> all = new ArrayList<>();
        all.add(new ExtensionRecordFormat("jsonl", List.of(".jsonl"),
                path -> new JsonLinesRecordReader(path.toString(), Files.newInputStream(path))));
        all.add(new ExtensionRecordFormat("json", List.of(".json"), JsonRecordReader::new));
        all.add(new ExtensionRecordFormat("csv", List.of(".csv"), CsvRecordReader::new));
        all.add(new ExtensionRecordFormat("parquet", List.of(".parquet"), ParquetRecordReader::new));
        all.add(new ExtensionRecordFormat("zst", List.of(".zst"),
                path -> new JsonLinesRecordReader(path.toString(), zstd(path))));
        all.add(new ExtensionRecordFormat("gzip", List.of(".gz"),
                path -> new JsonLinesRecordReader(path.toString(), gzip(path))));
        all.add(new ExtensionRecordFormat("txt", List.of(".txt"), TextRecordReader::new));
        return List.copyOf(all);
    }

    private static InputStream zstd(Path path) throws IOException {
        InputStream raw = Files.newInputStream(path);
        try {
            return new ZstdInputStream(raw);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    private static InputStream gzip(Path path) throws IOException {
        InputStream raw = Files.newInputStream(path);
        try {
            return new GZIPInputStream(raw);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }
}
