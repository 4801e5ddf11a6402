package com.convector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.ConfigurationException;
import com.convector.config.ConvectorConfig;
import com.convector.config.Profile;
import com.convector.config.ProfileSettings;
import com.convector.pipeline.DirectoryProcessor;
import com.convector.pipeline.DirectorySummary;
import com.convector.pipeline.FileTransformer;
import com.convector.pipeline.RetryPolicy;
import com.convector.pipeline.SkippedFile;
import com.convector.pipeline.TransformReport;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "convector",
        mixinStandardHelpOptions = true,
        version = "convector 0.1.0",
        description = "Transforms conversational data files into normalized JSONL training records.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CONFIG = "src/main/resources/convector.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    @Parameters(index = "0", description = "Input file or directory")
    Path inputPath;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = DEFAULT_CONFIG)
    String configPath;

    @Option(names = "--profile", description = "Profile name from the config file")
    String profileName;

    @Option(names = "--conversation", description = "Treat records as conversations")
    Boolean conversation;

    @Option(names = "--input", description = "Key for user inputs")
    String inputKey;

    @Option(names = "--output", description = "Key for bot outputs")
    String outputKey;

    @Option(names = "--instruction", description = "Key for instructions or system messages")
    String instructionKey;

    @Option(names = "--add", split = ",", description = "Comma-separated raw fields to keep in the output")
    List<String> additionalFields;

    @Option(names = "--lines", description = "Maximum number of lines to write")
    Integer lines;

    @Option(names = "--bytes", description = "Maximum number of bytes to write")
    Long bytes;

    @Option(names = "--output-file", description = "Output file name, relative to the output directory")
    String outputFile;

    @Option(names = "--output-dir", description = "Directory for output files")
    String outputDir;

    @Option(names = "--append", description = "Append to an existing output file instead of overwriting it")
    Boolean append;

    @Option(names = "--random", description = "Randomly sample records within the lines or bytes budget")
    Boolean random;

    @Option(names = "--seed", description = "Seed for random sampling")
    Long seed;

    @Option(names = "--schema", description = "Output schema: default, chat_completion")
    String outputSchema;

    @Option(names = "--filter", description = "Label filter expression, repeatable (e.g. user_id>50, metadata.temp<=>1,3)")
    List<String> filters;

    @Option(names = "--workers", description = "Parallel workers for directory input")
    Integer workers;

    @Option(names = { "-v", "--verbose" }, description = "Enable debug logging")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            Configurator.setLevel("com.convector", Level.DEBUG);
        }

        ConvectorConfig config = ConvectorConfig.load(Path.of(configPath));
        FileTransformer transformer = new FileTransformer();
        Profile profile;
        try {
            ProfileSettings settings = config.activeProfile(profileName);
            applyOverrides(settings);
            profile = settings.toProfile();
            transformer.validate(profile);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        }
        log.info("Using config file: {} profile={}", configPath, profileName == null ? config.getDefaultProfile() : profileName);

        if (Files.isRegularFile(inputPath)) {
            return transformFile(transformer, profile);
        }
        if (Files.isDirectory(inputPath)) {
            return transformDirectory(transformer, profile, config.getDirectory());
        }
        log.error("Input path does not exist or is not a file or directory: {}", inputPath.toAbsolutePath().normalize());
        return EXIT_CONFIGURATION;
    }

    private int transformFile(FileTransformer transformer, Profile profile) {
        try {
            TransformReport report = transformer.transform(inputPath, profile);
            log.info("Delivered to file://{} ({} lines, {} bytes)",
                    report.outputPath().toAbsolutePath().normalize(),
                    report.linesWritten(),
                    report.bytesWritten());
            return EXIT_OK;
        } catch (ConvectorException | IOException e) {
            log.error("Failed to transform {}: {}", inputPath, e.getMessage());
            return EXIT_FILE_FAILED;
        }
    }

    private int transformDirectory(FileTransformer transformer, Profile profile, ConvectorConfig.DirectoryConfig directoryConfig)
            throws IOException, InterruptedException {
        RetryPolicy retryPolicy = new RetryPolicy(
                Math.max(1, directoryConfig.getRetryAttempts()),
                Duration.ofMillis(Math.max(0, directoryConfig.getRetryDelayMs())));
        int workerCount = workers == null ? directoryConfig.getWorkers() : workers;
        DirectoryProcessor processor = new DirectoryProcessor(transformer, retryPolicy, workerCount);
        DirectorySummary summary = processor.process(inputPath, profile);

        log.info("Processing completed. Total files processed: {}", summary.processedFiles());
        if (summary.skippedFiles() == 0) {
            log.info("No files were skipped.");
        } else {
            log.info("Files skipped: {}. See details below.", summary.skippedFiles());
            for (SkippedFile skipped : summary.skipped()) {
                log.info("Skipped file: {} - Reason: {}", skipped.path(), skipped.reason());
            }
        }
        return EXIT_OK;
    }

    void applyOverrides(ProfileSettings settings) {
        if (conversation != null) {
            settings.setConversational(conversation);
        }
        if (inputKey != null) {
            settings.setInput(inputKey);
        }
        if (outputKey != null) {
            settings.setOutput(outputKey);
        }
        if (instructionKey != null) {
            settings.setInstruction(instructionKey);
        }
        if (additionalFields != null) {
            settings.setAdditionalFields(additionalFields);
        }
        if (lines != null) {
            settings.setLines(lines);
        }
        if (bytes != null) {
            settings.setBytes(bytes);
        }
        if (outputFile != null) {
            settings.setOutputFile(outputFile);
        }
        if (outputDir != null) {
            settings.setOutputDir(outputDir);
        }
        if (append != null) {
            settings.setAppend(append);
        }
        if (random != null) {
            settings.setRandom(random);
        }
        if (seed != null) {
            settings.setSeed(seed);
        }
        if (outputSchema != null) {
            settings.setOutputSchema(outputSchema);
        }
        if (filters != null) {
            settings.setFilters(filters);
        }
    }
}
