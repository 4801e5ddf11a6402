package com.convector.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.convector.filter.FilterExpressionParser;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileSettings {
    private boolean conversational;
    private String input;
    private String output;
    private String instruction;
    private List<String> additionalFields = new ArrayList<>();
    private List<String> filters = new ArrayList<>();
    private Integer lines;
    private Long bytes;
    private boolean append;
    private boolean random;
    private Long seed;
    private String outputSchema = Profile.DEFAULT_SCHEMA;
    private String outputDir = Path.of(System.getProperty("user.home"), "convector", "silo").toString();
    private String outputFile;

    public Profile toProfile() {
        return new Profile(
                conversational,
                input,
                output,
                instruction,
                additionalFields,
                FilterExpressionParser.parseAll(filters),
                lines,
                bytes,
                append,
                random,
                seed,
                outputSchema,
                outputDir == null ? null : Path.of(outputDir),
                outputFile);
    }

    public boolean isConversational() {
        return conversational;
    }

    public void setConversational(boolean conversational) {
        this.conversational = conversational;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getInstruction() {
        return instruction;
    }

    public void setInstruction(String instruction) {
        this.instruction = instruction;
    }

    public List<String> getAdditionalFields() {
        return additionalFields;
    }

    public void setAdditionalFields(List<String> additionalFields) {
        this.additionalFields = additionalFields == null ? new ArrayList<>() : additionalFields;
    }

    public List<String> getFilters() {
        return filters;
    }

    public void setFilters(List<String> filters) {
        this.filters = filters == null ? new ArrayList<>() : filters;
    }

    public Integer getLines() {
        return lines;
    }

    public void setLines(Integer lines) {
        this.lines = lines;
    }

    public Long getBytes() {
        return bytes;
    }

    public void setBytes(Long bytes) {
        this.bytes = bytes;
    }

    public boolean isAppend() {
        return append;
    }

    public void setAppend(boolean append) {
        this.append = append;
    }

    public boolean isRandom() {
        return random;
    }

    public void setRandom(boolean random) {
        this.random = random;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public String getOutputSchema() {
        return outputSchema;
    }

    public void setOutputSchema(String outputSchema) {
        this.outputSchema = outputSchema;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }
}
