package com.convector.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.convector.config.Profile;
import com.convector.config.ProfileSettings;
import com.convector.filter.FilteredRecord;
import com.convector.schema.DefaultOutputSchema;
import com.convector.schema.OutputSchema;
import com.convector.schema.OutputSchemaRegistry;
import com.convector.write.FlushPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryProcessorTest {
    private static final RetryPolicy NO_DELAY = new RetryPolicy(3, Duration.ZERO);

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private ProfileSettings settings;

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectory(tempDir.resolve("in"));
        outputDir = tempDir.resolve("out");
        settings = new ProfileSettings();
        settings.setInput("prompt");
        settings.setOutput("reply");
        settings.setOutputDir(outputDir.toString());
    }

    private Path write(String name, String content) throws IOException {
        Path file = inputDir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    void shouldSkipFailingFileAndProcessTheRest() throws Exception {
        write("a.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        write("b.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n{\"prompt\":\"p2\",\"reply\":\"r2\"}\n");
        write("nested/c.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        Path bad = write("bad.jsonl", "{\"prompt\":\"p\"}\n");

        DirectorySummary summary = new DirectoryProcessor(new FileTransformer(), NO_DELAY, 2)
                .process(inputDir, settings.toProfile());

        assertEquals(3, summary.processedFiles());
        assertEquals(1, summary.skippedFiles());
        assertEquals(4, summary.linesWritten());
        assertEquals(bad, summary.skipped().get(0).path());
        assertTrue(summary.skipped().get(0).reason().contains("missing"));
        assertTrue(Files.exists(outputDir.resolve("c_tr.jsonl")));
    }

    @Test
    void shouldSkipUnsupportedFilesWithoutRetrying() throws Exception {
        write("notes.md", "# not data");
        AtomicInteger calls = new AtomicInteger();
        FileTransformer counting = new FileTransformer() {
            @Override
            public TransformReport transform(Path inputFile, Profile profile) throws IOException {
                calls.incrementAndGet();
                return super.transform(inputFile, profile);
            }
        };

        DirectorySummary summary = new DirectoryProcessor(counting, NO_DELAY, 1).process(inputDir, settings.toProfile());

        assertEquals(0, summary.processedFiles());
        assertEquals(1, summary.skippedFiles());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRetryTransientFailure() throws Exception {
        write("a.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        AtomicInteger calls = new AtomicInteger();
        FileTransformer flaky = new FileTransformer() {
            @Override
            public TransformReport transform(Path inputFile, Profile profile) throws IOException {
                if (calls.incrementAndGet() == 1) {
                    throw new TransientIOException("storage unavailable");
                }
                return super.transform(inputFile, profile);
            }
        };

        DirectorySummary summary = new DirectoryProcessor(flaky, NO_DELAY, 1).process(inputDir, settings.toProfile());

        assertEquals(2, calls.get());
        assertEquals(1, summary.processedFiles());
        assertEquals(0, summary.skippedFiles());
    }

    @Test
    void shouldGiveUpAfterMaximumRetryAttempts() throws Exception {
        write("a.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        AtomicInteger calls = new AtomicInteger();
        FileTransformer broken = new FileTransformer() {
            @Override
            public TransformReport transform(Path inputFile, Profile profile) throws IOException {
                calls.incrementAndGet();
                throw new TransientIOException("storage unavailable");
            }
        };

        DirectorySummary summary = new DirectoryProcessor(broken, NO_DELAY, 1).process(inputDir, settings.toProfile());

        assertEquals(3, calls.get());
        assertEquals(1, summary.skippedFiles());
        assertTrue(summary.skipped().get(0).reason().startsWith("Reached maximum retry attempts (3)"));
    }

    @Test
    void shouldAppendEveryFileToSharedOutputFile() throws Exception {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("merged.jsonl"), "{\"stale\":true}\n");
        write("a.jsonl", "{\"prompt\":\"p1\",\"reply\":\"r1\"}\n");
        write("b.jsonl", "{\"prompt\":\"p2\",\"reply\":\"r2\"}\n{\"prompt\":\"p3\",\"reply\":\"r3\"}\n");
        settings.setOutputFile("merged.jsonl");

        DirectorySummary summary = new DirectoryProcessor(new FileTransformer(), NO_DELAY, 4)
                .process(inputDir, settings.toProfile());

        assertEquals(2, summary.processedFiles());
        assertEquals(3, Files.readAllLines(outputDir.resolve("merged.jsonl")).size());
    }

    @Test
    void shouldTruncateSharedOutputFileWhenFirstFileIsSkipped() throws Exception {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("merged.jsonl"), "{\"stale\":true}\n");
        write("a.md", "# not data");
        write("b.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        settings.setOutputFile("merged.jsonl");

        DirectorySummary summary = new DirectoryProcessor(new FileTransformer(), NO_DELAY, 1)
                .process(inputDir, settings.toProfile());

        List<String> lines = Files.readAllLines(outputDir.resolve("merged.jsonl"));
        assertEquals(1, summary.skippedFiles());
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"source\":\"b.jsonl\""));
    }

    @Test
    void shouldKeepExistingLinesOfSharedOutputFileWhenAppending() throws Exception {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("merged.jsonl"), "{\"kept\":true}\n");
        write("a.md", "# not data");
        write("b.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        settings.setOutputFile("merged.jsonl");
        settings.setAppend(true);

        new DirectoryProcessor(new FileTransformer(), NO_DELAY, 1).process(inputDir, settings.toProfile());

        assertEquals(2, Files.readAllLines(outputDir.resolve("merged.jsonl")).size());
    }

    @Test
    void shouldNotDuplicateLinesFlushedBeforeRetriedFailure() throws Exception {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("data_tr.jsonl"), "{\"earlier\":true}\n");
        write("data.jsonl", IntStream.range(0, 5)
                .mapToObj(i -> "{\"prompt\":\"p" + i + "\",\"reply\":\"r" + i + "\"}")
                .collect(Collectors.joining("\n")));
        settings.setAppend(true);
        AtomicInteger applied = new AtomicInteger();
        OutputSchema failingOnce = new OutputSchema() {
            @Override
            public String name() {
                return DefaultOutputSchema.NAME;
            }

            @Override
            public Map<String, Object> apply(FilteredRecord record) {
                if (applied.incrementAndGet() == 4) {
                    throw new UncheckedIOException(new TransientIOException("disk hiccup"));
                }
                return record.record().toMap();
            }
        };
        FileTransformer transformer = new FileTransformer(
                new OutputSchemaRegistry().register(failingOnce), new FlushPolicy(1, true));

        DirectorySummary summary = new DirectoryProcessor(transformer, NO_DELAY, 1).process(inputDir, settings.toProfile());

        List<String> lines = Files.readAllLines(outputDir.resolve("data_tr.jsonl"));
        assertEquals(1, summary.processedFiles());
        assertEquals(6, lines.size());
        assertEquals("{\"earlier\":true}", lines.get(0));
        assertEquals(6, lines.stream().distinct().count());
    }

    @Test
    void shouldPropagateInterruptedWorker() throws Exception {
        write("a.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        write("b.jsonl", "{\"prompt\":\"p\",\"reply\":\"r\"}\n");
        DirectoryProcessor interrupted = new DirectoryProcessor(new FileTransformer(), NO_DELAY, 2) {
            @Override
            void processWithRetries(Path file, Profile profile, SummaryCollector collector) throws InterruptedException {
                throw new InterruptedException("stopped");
            }
        };

        assertThrows(InterruptedException.class, () -> interrupted.process(inputDir, settings.toProfile()));
        assertTrue(Thread.interrupted());
    }

    @Test
    void shouldRejectNonDirectoryInput() throws Exception {
        Path file = write("a.jsonl", "{}");

        assertThrows(NotDirectoryException.class,
                () -> new DirectoryProcessor(new FileTransformer(), NO_DELAY, 1).process(file, settings.toProfile()));
    }
}
