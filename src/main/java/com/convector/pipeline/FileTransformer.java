package com.convector.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.Profile;
import com.convector.config.ProfileValidator;
import com.convector.extract.NormalizedRecord;
import com.convector.extract.RecordExtractor;
import com.convector.extract.RecordExtractors;
import com.convector.filter.FilteredRecord;
import com.convector.filter.LabelFilter;
import com.convector.read.RawRecord;
import com.convector.read.ReadResult;
import com.convector.read.RecordReader;
import com.convector.read.RecordReaders;
import com.convector.read.UnsupportedFormatException;
import com.convector.sample.RecordSampler;
import com.convector.sample.RecordSamplers;
import com.convector.sample.RecordSource;
import com.convector.schema.OutputSchema;
import com.convector.schema.OutputSchemaRegistry;
import com.convector.write.BoundedRecordWriter;
import com.convector.write.FlushPolicy;
import com.convector.write.OutputPathResolver;
import com.convector.write.WriteResult;

/**
 * Single-file pipeline: read, extract, filter, map and write one input file as
 * a single pull-based sequence.
 */
public class FileTransformer {
    private static final Logger log = LoggerFactory.getLogger(FileTransformer.class);

    private final OutputSchemaRegistry schemaRegistry;
    private final ProfileValidator validator;
    private final FlushPolicy flushPolicy;

    public FileTransformer() {
        this(new OutputSchemaRegistry(), FlushPolicy.DEFAULT);
    }

    public FileTransformer(OutputSchemaRegistry schemaRegistry, FlushPolicy flushPolicy) {
        this.schemaRegistry = schemaRegistry;
        this.validator = new ProfileValidator(schemaRegistry.names());
        this.flushPolicy = flushPolicy;
    }

    public void validate(Profile profile) {
        validator.validate(profile);
    }

    public TransformReport transform(Path inputFile, Profile profile) throws IOException {
        validate(profile);
        if (!RecordReaders.isSupported(inputFile)) {
            throw new UnsupportedFormatException("Unsupported file type: " + inputFile.getFileName());
        }
        if (!Files.isRegularFile(inputFile)) {
            throw new NoSuchFileException(inputFile.toString());
        }

        RecordExtractor extractor = RecordExtractors.forProfile(profile);
        LabelFilter labelFilter = new LabelFilter(profile.filters());
        OutputSchema schema = schemaRegistry.resolve(profile.outputSchema());
        RecordSource source = () -> RecordReaders.open(inputFile);

        try {
            Set<Long> selection = null;
            Optional<RecordSampler> sampler = RecordSamplers.forProfile(profile);
            if (sampler.isPresent()) {
                selection = sampler.get().select(source, profile, random(profile));
            }
            return run(inputFile, profile, source, selection, extractor, labelFilter, schema);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private TransformReport run(
            Path inputFile,
            Profile profile,
            RecordSource source,
            Set<Long> selection,
            RecordExtractor extractor,
            LabelFilter labelFilter,
            OutputSchema schema) throws IOException {
        Path outputPath = OutputPathResolver.resolve(inputFile, profile);
        log.info("transform.file.started input={} output={} extractor={} schema={}",
                inputFile,
                outputPath,
                extractor.getClass().getSimpleName(),
                schema.name());

        long recordsRead = 0;
        long malformed = 0;
        long unmapped = 0;
        long filteredOut = 0;
        WriteResult written;
        try (RecordReader reader = source.open();
                BoundedRecordWriter writer = BoundedRecordWriter.open(
                        outputPath,
                        inputFile.getFileName().toString(),
                        profile,
                        flushPolicy)) {
            records:
            while (writer.isAccepting() && reader.hasNext()) {
                ReadResult result = reader.next();
                if (!result.isOk()) {
                    malformed++;
                    continue;
                }
                RawRecord raw = result.record();
                if (selection != null && !selection.contains(raw.position())) {
                    continue;
                }
                recordsRead++;
                List<NormalizedRecord> normalized = extractor.extract(raw, profile);
                if (normalized.isEmpty()) {
                    unmapped++;
                    log.debug("transform.record.unmapped input={} position={}", inputFile, raw.position());
                    continue;
                }
                for (NormalizedRecord record : normalized) {
                    Optional<FilteredRecord> filtered = labelFilter.apply(record);
                    if (filtered.isEmpty()) {
                        filteredOut++;
                        continue;
                    }
                    if (!writer.write(schema.apply(filtered.get()))) {
                        break records;
                    }
                }
            }
            writer.markExhausted();
            written = writer.result();
        }

        log.info("transform.file.completed input={} output={} lines={} bytes={} read={} malformed={} unmapped={} filtered={}",
                inputFile,
                written.outputPath(),
                written.linesWritten(),
                written.bytesWritten(),
                recordsRead,
                malformed,
                unmapped,
                filteredOut);
        return new TransformReport(
                inputFile,
                written.outputPath(),
                written.linesWritten(),
                written.bytesWritten(),
                recordsRead,
                malformed,
                unmapped,
                filteredOut);
    }

    private static Random random(Profile profile) {
        return profile.randomSeed() == null ? new Random() : new Random(profile.randomSeed());
    }
}
