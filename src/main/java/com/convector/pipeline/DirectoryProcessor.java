package com.convector.pipeline;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.ConvectorException;
import com.convector.config.Profile;
import com.convector.write.OutputPathResolver;

/**
 * Runs the single-file pipeline over every regular file below a directory.
 * Transient I/O failures are retried; schema, format and other fatal per-file
 * errors skip the file without stopping the walk.
 */
public class DirectoryProcessor {
    private static final Logger log = LoggerFactory.getLogger(DirectoryProcessor.class);

    private final FileTransformer transformer;
    private final RetryPolicy retryPolicy;
    private final int workers;

    public DirectoryProcessor(FileTransformer transformer, RetryPolicy retryPolicy, int workers) {
        this.transformer = transformer;
        this.retryPolicy = retryPolicy;
        this.workers = Math.max(1, workers);
    }

    public DirectorySummary process(Path directory, Profile profile) throws IOException, InterruptedException {
        transformer.validate(profile);
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(path -> !path.equals(directory))
                    .filter(path -> {
                        if (Files.isRegularFile(path)) {
                            return true;
                        }
                        log.debug("directory.entry.ignored path={} reason=not-a-file", path);
                        return false;
                    })
                    .sorted()
                    .toList();
        }
        log.info("directory.started path={} files={} workers={}", directory, files.size(), workers);

        SummaryCollector collector = new SummaryCollector();
        if (profile.hasOutputFile() || workers == 1) {
            runSequentially(files, profile, collector);
        } else {
            runInParallel(files, profile, collector);
        }
        DirectorySummary summary = collector.summary();
        log.info("directory.completed path={} processed={} skipped={} lines={}",
                directory,
                summary.processedFiles(),
                summary.skippedFiles(),
                summary.linesWritten());
        return summary;
    }

    private void runSequentially(List<Path> files, Profile profile, SummaryCollector collector)
            throws IOException, InterruptedException {
        Profile effective = profile;
        if (profile.hasOutputFile() && !files.isEmpty()) {
            // every file appends to the shared output; it is truncated once up front unless appending
            Path shared = OutputPathResolver.resolve(files.get(0), profile);
            if (!profile.append()) {
                Files.write(shared, new byte[0]);
                log.debug("directory.output.truncated path={}", shared);
            }
            effective = profile.withAppend(true);
        }
        for (Path file : files) {
            processWithRetries(file, effective, collector);
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("directory processing interrupted");
            }
        }
    }

    private void runInParallel(List<Path> files, Profile profile, SummaryCollector collector) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    processWithRetries(file, profile, collector);
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        throw interrupted;
                    }
                    throw new IllegalStateException("directory worker failed", e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    void processWithRetries(Path file, Profile profile, SummaryCollector collector) throws InterruptedException {
        OutputMark mark = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                if (mark == null) {
                    mark = OutputMark.of(file, profile);
                } else {
                    mark.restore();
                }
                TransformReport report = transformer.transform(file, profile);
                collector.processed(file, report);
                return;
            } catch (ConvectorException e) {
                collector.skipped(file, e.getMessage());
                return;
            } catch (NoSuchFileException e) {
                collector.skipped(file, "File not found: " + e.getMessage());
                return;
            } catch (IOException e) {
                if (attempt == retryPolicy.maxAttempts()) {
                    collector.skipped(file, "Reached maximum retry attempts (" + attempt + ") for: " + e.getMessage());
                    return;
                }
                log.warn("directory.retry path={} attempt={} maxAttempts={} delayMs={} reason={}",
                        file,
                        attempt,
                        retryPolicy.maxAttempts(),
                        retryPolicy.delay().toMillis(),
                        e.getMessage());
                Thread.sleep(retryPolicy.delay().toMillis());
            } catch (RuntimeException e) {
                collector.skipped(file, e.getClass().getSimpleName() + ": " + e.getMessage());
                return;
            }
        }
    }

    /**
     * Size of an appended output before the first attempt. A retry cuts the
     * file back to it so lines flushed by a failed attempt are not repeated.
     */
    record OutputMark(Path output, long size) {
        private static final long NONE = -1;

        static OutputMark of(Path file, Profile profile) throws IOException {
            if (!profile.append()) {
                return new OutputMark(null, NONE);
            }
            Path output = OutputPathResolver.resolve(file, profile);
            return new OutputMark(output, Files.exists(output) ? Files.size(output) : 0L);
        }

        void restore() throws IOException {
            if (size == NONE || !Files.exists(output)) {
                return;
            }
            try (FileChannel channel = FileChannel.open(output, StandardOpenOption.WRITE)) {
                channel.truncate(size);
            }
            log.debug("directory.output.restored path={} size={}", output, size);
        }
    }

    static final class SummaryCollector {
        private int processed;
        private long linesWritten;
        private final List<SkippedFile> skipped = new ArrayList<>();

        synchronized void processed(Path file, TransformReport report) {
            processed++;
            linesWritten += report.linesWritten();
            log.info("directory.file.processed path={} lines={}", file, report.linesWritten());
        }

        synchronized void skipped(Path file, String reason) {
            skipped.add(new SkippedFile(file, reason));
            log.warn("directory.file.skipped path={} reason={}", file, reason);
        }

        synchronized DirectorySummary summary() {
            return new DirectorySummary(processed, skipped.size(), linesWritten, skipped);
        }
    }
}
