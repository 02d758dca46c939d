package com.luanvv.listings.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.luanvv.listings.model.PropertyType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

@Log4j2
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String CONFIG_ENV = "LISTINGS_CONFIG";
    public static final String DATASET_PATH_ENV = "DATASET_PATH";
    public static final String DEFAULT_RESOURCE = "listings-config.yaml";

    private boolean headless = true;
    private int parallelism = 1;
    private String baseUrl;
    private List<Target> targets = new ArrayList<>();
    private RateLimit rateLimit = new RateLimit();
    private Retries retries = new Retries();
    private Retries runRetries = Retries.of(10, 20000);
    private Fetch fetch = new Fetch();
    private Currency currency = new Currency();
    private DatasetConfig dataset = new DatasetConfig();
    private Output output = new Output();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target {
        private String id;
        private PropertyType propertyType;
        private String url;
        private String urlEnv; // env var whose value replaces url
    }

    @Data
    public static class RateLimit {
        private double permitsPerSecond = 1.0;
        private int burst = 2;
    }

    @Data
    public static class Retries {
        private int maxAttempts = 20;
        private long backoffMs = 10000;
        private double multiplier = 1.0;
        private long maxBackoffMs = 10000;

        public static Retries of(int maxAttempts, long backoffMs) {
            Retries r = new Retries();
            r.setMaxAttempts(maxAttempts);
            r.setBackoffMs(backoffMs);
            r.setMaxBackoffMs(backoffMs);
            return r;
        }
    }

    @Data
    public static class Fetch {
        private long timeoutMs = 30000;
    }

    @Data
    public static class Currency {
        private String toggleSelector = ".header-cur";
        private String localCode = "IDR";
        private int localOptionIndex = 0;
        private String usdCode = "USD";
        // the menu lists USD once more before the first switch of a session
        private int usdFirstOptionIndex = 2;
        private int usdOptionIndex = 1;
    }

    @Data
    public static class DatasetConfig {
        private String path = "data/listings.csv";
        private String archiveDir;
    }

    @Data
    public static class Output {
        private String dir = "data";
        private boolean report = true;
    }

    public static Config load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static Config load(String configPath) throws IOException {
        return load(Path.of(configPath));
    }

    public static Config load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, Config.class);
    }

    public static Config loadDefault() throws IOException {
        String[] defaultPaths = {
            "listings-config.yaml",
            "listings-config.yml",
            "config/listings-config.yaml",
            "config/listings-config.yml"
        };

        for (String defaultPath : defaultPaths) {
            Path path = Path.of(defaultPath);
            if (Files.exists(path)) {
                log.info("Using default config file: {}", path);
                return load(path);
            }
        }

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                log.info("Using bundled config resource: {}", DEFAULT_RESOURCE);
                return load(in);
            }
        }

        throw new IOException("No default config file found in any of these locations: " +
                            String.join(", ", defaultPaths) + " or classpath:" + DEFAULT_RESOURCE);
    }

    /**
     * Resolves the config from an explicit path, then {@value #CONFIG_ENV}, then the defaults,
     * applies environment overrides and validates the result.
     */
    public static Config resolve(String explicitPath, Map<String, String> env) throws IOException {
        Config config;
        if (explicitPath != null && !explicitPath.isBlank()) {
            config = load(explicitPath);
        } else if (env.get(CONFIG_ENV) != null && !env.get(CONFIG_ENV).isBlank()) {
            config = load(env.get(CONFIG_ENV));
        } else {
            config = loadDefault();
        }
        config.applyEnvironment(env);
        config.validate();
        return config;
    }

    public void applyEnvironment(Map<String, String> env) {
        for (Target target : targets) {
            if (target.getUrlEnv() == null) continue;
            String value = env.get(target.getUrlEnv());
            if (value != null && !value.isBlank()) {
                log.info("Target '{}' url taken from {}", target.getId(), target.getUrlEnv());
                target.setUrl(value.trim());
            }
        }
        String datasetPath = env.get(DATASET_PATH_ENV);
        if (datasetPath != null && !datasetPath.isBlank()) {
            dataset.setPath(datasetPath.trim());
        }
    }

    public void validate() {
        if (targets == null || targets.isEmpty()) {
            throw new ConfigException("No crawl targets configured");
        }
        for (Target target : targets) {
            if (target.getUrl() == null || target.getUrl().isBlank()) {
                throw new ConfigException("Target '" + target.getId() + "' has no url"
                    + (target.getUrlEnv() != null ? " (set " + target.getUrlEnv() + ")" : ""));
            }
            if (target.getPropertyType() == null) {
                target.setPropertyType(PropertyType.fromUrl(target.getUrl()));
            }
            if (target.getId() == null || target.getId().isBlank()) {
                target.setId(target.getPropertyType().label());
            }
            boolean relative = !target.getUrl().contains("://");
            if (relative && (baseUrl == null || baseUrl.isBlank())) {
                throw new ConfigException("Target '" + target.getId() + "' url is relative but baseUrl is not set");
            }
        }
        if (retries == null || retries.getMaxAttempts() < 1) {
            throw new ConfigException("retries.maxAttempts must be at least 1");
        }
        if (runRetries == null || runRetries.getMaxAttempts() < 1) {
            throw new ConfigException("runRetries.maxAttempts must be at least 1");
        }
        if (dataset == null || dataset.getPath() == null || dataset.getPath().isBlank()) {
            throw new ConfigException("dataset.path is required");
        }
        if (parallelism < 1) {
            parallelism = 1;
        }
    }

    public String targetUrl(Target target) {
        return UrlUtils.toAbsolute(baseUrl, target.getUrl()).toString();
    }
}
