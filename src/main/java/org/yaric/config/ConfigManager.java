package org.yaric.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.yaric.catalog.BuiltInIndexCatalog;
import org.yaric.catalog.IndexCatalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (var existing : rootLogger.getHandlers()) {
            if (existing instanceof ConsoleHandler) rootLogger.removeHandler(existing);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static AppConfig getConfig() {
        return getConfig(DEFAULT_CONFIG_PATH);
    }

    public static AppConfig getConfig(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath.toAbsolutePath());
        }
        ObjectMapper yamlObjectMapper = new ObjectMapper(new YAMLFactory());
        yamlObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            AppConfig appConfig = yamlObjectMapper.readValue(configPath.toFile(), AppConfig.class);
            if (appConfig == null) {
                throw new ConfigurationException("Configuration file is empty: " + configPath);
            }
            APP_LOGGER.info("Loaded configuration from " + configPath.toAbsolutePath());
            return appConfig;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static BatchRequest toBatchRequest(AppConfig appConfig) {
        return BatchRequest.of(appConfig.inputFiles(), appConfig.selectedIndices(), appConfig.bandMapping(),
                appConfig.outputDir(), appConfig.maxMemoryUsageMb(), appConfig.maxActiveTasks());
    }

    public static IndexCatalog toIndexCatalog(AppConfig appConfig) {
        return new BuiltInIndexCatalog(appConfig.customIndices());
    }
}
