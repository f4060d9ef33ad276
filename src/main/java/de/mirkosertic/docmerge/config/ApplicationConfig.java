package de.mirkosertic.docmerge.config;

import de.mirkosertic.docmerge.cleaning.CleaningConfig;
import de.mirkosertic.docmerge.cleaning.FillStrategy;
import de.mirkosertic.docmerge.cleaning.KeepPolicy;
import de.mirkosertic.docmerge.cleaning.OutlierMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the document merger.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.docmerge/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_OUTPUT_PATH = "DOCMERGE_OUTPUT_PATH";
    private static final String ENV_AUTO_CLEAN = "DOCMERGE_AUTO_CLEAN";
    private static final String PROP_OUTPUT_PATH = "docmerge.output.path";
    private static final String PROP_AUTO_CLEAN = "docmerge.auto.clean";
    private static final String CONFIG_DIR = ".docmerge";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String DEFAULT_OUTPUT_PATH = "data/output/merged_result.xlsx";

    // Merge settings
    private String outputPath = DEFAULT_OUTPUT_PATH;
    private boolean autoClean = false;

    private final CleaningConfig cleaningConfig = new CleaningConfig();

    private boolean fileLoggingEnabled = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: outputPath={}, autoClean={}", config.outputPath, config.autoClean);

        return config;
    }

    /**
     * Configuration from a single YAML document on top of the built-in defaults.
     */
    public static ApplicationConfig fromYaml(final InputStream is) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(is);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to docmerge section
        final Map<String, Object> docmergeConfig = (Map<String, Object>) config.get("docmerge");
        if (docmergeConfig == null) {
            return;
        }

        final Map<String, Object> mergeConfig = (Map<String, Object>) docmergeConfig.get("merge");
        if (mergeConfig != null) {
            final Object path = mergeConfig.get("output-path");
            if (path != null) {
                this.outputPath = resolveVariables(path.toString());
            }
            if (mergeConfig.containsKey("auto-clean")) {
                this.autoClean = (Boolean) mergeConfig.get("auto-clean");
            }
        }

        final Map<String, Object> cleaningSection = (Map<String, Object>) docmergeConfig.get("cleaning");
        if (cleaningSection != null) {
            applyCleaningConfig(cleaningSection);
        }

        final Map<String, Object> loggingConfig = (Map<String, Object>) docmergeConfig.get("logging");
        if (loggingConfig != null && loggingConfig.containsKey("file-enabled")) {
            this.fileLoggingEnabled = (Boolean) loggingConfig.get("file-enabled");
        }
    }

    @SuppressWarnings("unchecked")
    private void applyCleaningConfig(final Map<String, Object> section) {
        if (section.containsKey("remove-duplicates")) {
            cleaningConfig.setRemoveDuplicates((Boolean) section.get("remove-duplicates"));
        }
        if (section.containsKey("duplicate-subset")) {
            final Object subset = section.get("duplicate-subset");
            cleaningConfig.setDuplicateSubset(subset instanceof List ? new ArrayList<>((List<String>) subset) : null);
        }
        if (section.containsKey("keep-duplicate")) {
            cleaningConfig.setKeepDuplicate(KeepPolicy.parse(section.get("keep-duplicate").toString()));
        }
        if (section.containsKey("handle-nulls")) {
            cleaningConfig.setHandleNulls((Boolean) section.get("handle-nulls"));
        }
        if (section.containsKey("null-threshold")) {
            cleaningConfig.setNullThreshold(((Number) section.get("null-threshold")).doubleValue());
        }
        if (section.containsKey("fill-strategy")) {
            cleaningConfig.setFillStrategy(FillStrategy.parse(section.get("fill-strategy").toString()));
        }
        if (section.containsKey("infer-types")) {
            cleaningConfig.setInferTypes((Boolean) section.get("infer-types"));
        }
        if (section.containsKey("parse-dates")) {
            cleaningConfig.setParseDates((Boolean) section.get("parse-dates"));
        }
        if (section.containsKey("normalize-names")) {
            cleaningConfig.setNormalizeNames((Boolean) section.get("normalize-names"));
        }
        if (section.containsKey("detect-outliers")) {
            cleaningConfig.setDetectOutliers((Boolean) section.get("detect-outliers"));
        }
        if (section.containsKey("outlier-method")) {
            cleaningConfig.setOutlierMethod(OutlierMethod.parse(section.get("outlier-method").toString()));
        }
        if (section.containsKey("z-score-threshold")) {
            cleaningConfig.setZScoreThreshold(((Number) section.get("z-score-threshold")).doubleValue());
        }
    }

    private void applyEnvironmentOverrides() {
        final String envOutputPath = System.getenv(ENV_OUTPUT_PATH);
        if (envOutputPath != null && !envOutputPath.trim().isEmpty()) {
            this.outputPath = envOutputPath.trim();
            logger.info("Output path from environment: {}", this.outputPath);
        }

        final String envAutoClean = System.getenv(ENV_AUTO_CLEAN);
        if (envAutoClean != null && !envAutoClean.trim().isEmpty()) {
            this.autoClean = Boolean.parseBoolean(envAutoClean.trim());
        }

        final String propOutputPath = System.getProperty(PROP_OUTPUT_PATH);
        if (propOutputPath != null && !propOutputPath.isEmpty()) {
            this.outputPath = propOutputPath;
        }
        final String propAutoClean = System.getProperty(PROP_AUTO_CLEAN);
        if (propAutoClean != null && !propAutoClean.isEmpty()) {
            this.autoClean = Boolean.parseBoolean(propAutoClean);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getOutputPath() {
        return outputPath;
    }

    public boolean isAutoClean() {
        return autoClean;
    }

    /**
     * Copy of the configured cleaning settings.
     */
    public CleaningConfig getCleaningConfig() {
        return new CleaningConfig(cleaningConfig);
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }
}
