package org.yafin.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads and validates the run configuration from a YAML or JSON file, or from an already parsed map.
 */
public final class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        Logger rootLogger = Logger.getLogger("");
        for (Handler h : rootLogger.getHandlers()) {
            if (h instanceof ConsoleHandler) {
                rootLogger.removeHandler(h);
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    /**
     * Reads {@code .yaml}/{@code .yml} or {@code .json} files and validates the result.
     */
    public static AppConfig load(Path configPath) throws ConfigException {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigException("Config file not found at " + configPath);
        }
        ObjectMapper mapper = mapperFor(configPath);
        AppConfig appConfig;
        try {
            appConfig = mapper.readValue(configPath.toFile(), AppConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Error loading config file " + configPath + ": " + e.getMessage(), e);
        }
        if (appConfig == null) {
            throw new ConfigException("Config file " + configPath + " is empty");
        }
        APP_LOGGER.log(Level.CONFIG, "Loaded configuration from {0}", configPath);
        return validate(appConfig);
    }

    /**
     * Binds an already parsed key-value mapping and validates it.
     */
    public static AppConfig fromMap(Map<String, ?> values) throws ConfigException {
        try {
            return validate(newMapper(new ObjectMapper()).convertValue(values, AppConfig.class));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Checks the folders, output format, percentile range and degenerate policy.
     */
    public static AppConfig validate(AppConfig config) throws ConfigException {
        if (config.inputFolder() == null || !Files.isDirectory(config.inputFolder())) {
            throw new ConfigException("Input folder not found at " + config.inputFolder());
        }
        if (config.outputFolder() == null) {
            throw new ConfigException("Output folder is not configured");
        }
        try {
            config.format();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        try {
            config.policy();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        checkPercentile("downsample_percentile_low", config.downsamplePercentileLow());
        checkPercentile("downsample_percentile_high", config.downsamplePercentileHigh());
        if (config.downsamplePercentileLow() >= config.downsamplePercentileHigh()) {
            APP_LOGGER.log(Level.WARNING, "downsample_percentile_low ({0}) is not below downsample_percentile_high ({1}); "
                            + "every wide-integer image will take the degenerate path",
                    new Object[]{config.downsamplePercentileLow(), config.downsamplePercentileHigh()});
        }
        return config;
    }

    private static void checkPercentile(String key, double value) throws ConfigException {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new ConfigException(key + " must be within [0, 100] but was " + value);
        }
    }

    private static ObjectMapper mapperFor(Path configPath) throws ConfigException {
        String name = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return newMapper(new ObjectMapper(new YAMLFactory()));
        }
        if (name.endsWith(".json")) {
            return newMapper(new ObjectMapper());
        }
        throw new ConfigException("Unsupported config file extension: " + configPath.getFileName());
    }

    private static ObjectMapper newMapper(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
