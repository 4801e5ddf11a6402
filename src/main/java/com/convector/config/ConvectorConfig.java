package com.convector.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConvectorConfig {
    private String defaultProfile = "default";
    private Map<String, ProfileSettings> profiles = new HashMap<>();
    private DirectoryConfig directory = new DirectoryConfig();

    public static ConvectorConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new ConvectorConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ConvectorConfig loaded = mapper.readValue(config.toFile(), ConvectorConfig.class);
        return loaded == null ? new ConvectorConfig() : loaded;
    }

    /**
     * Returns the settings of the named profile, or of the default profile when
     * {@code name} is null. Unknown names start from an empty profile.
     */
    public ProfileSettings activeProfile(String name) {
        String resolved = name == null || name.isBlank() ? defaultProfile : name;
        return profiles.computeIfAbsent(resolved, ignored -> new ProfileSettings());
    }

    public String getDefaultProfile() {
        return defaultProfile;
    }

    public void setDefaultProfile(String defaultProfile) {
        this.defaultProfile = defaultProfile == null ? "default" : defaultProfile;
    }

    public Map<String, ProfileSettings> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, ProfileSettings> profiles) {
        this.profiles = profiles == null ? new HashMap<>() : profiles;
    }

    public DirectoryConfig getDirectory() {
        return directory;
    }

    public void setDirectory(DirectoryConfig directory) {
        this.directory = directory == null ? new DirectoryConfig() : directory;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DirectoryConfig {
        private int workers = 1;
        private int retryAttempts = 3;
        private long retryDelayMs = 5000;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }
    }
}
