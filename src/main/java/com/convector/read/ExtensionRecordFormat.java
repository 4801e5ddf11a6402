package com.convector.read;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class ExtensionRecordFormat implements RecordFormat {
    private final String name;
    private final List<String> extensions;
    private final Opener opener;

    public ExtensionRecordFormat(String name, List<String> extensions, Opener opener) {
        this.name = name;
        this.extensions = extensions;
        this.opener = opener;
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public RecordReader open(Path path) throws IOException {
        return opener.open(path);
    }

    public String name() {
        return name;
    }

    @FunctionalInterface
    public interface Opener {
        RecordReader open(Path path) throws IOException;
    }

    @Override
    public String toString() {
        return "ExtensionRecordFormat{" +
                "name=" + name +
                ", extensions=" + extensions +
                '}';
    }
}
