package fr.lapetina.airouter.infrastructure.config;

import fr.lapetina.airouter.provider.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@link RouterConfig} from YAML.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - {@code ${NAME}} and {@code ${NAME:default}} placeholders resolved from the environment
 * - Structural validation before anything is wired
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

    private final Path configPath;
    private final UnaryOperator<String> environment;

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    /**
     * @param environment variable lookup, returns null for unset names
     */
    public ConfigLoader(String configPath, UnaryOperator<String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public RouterConfig load() {
        RouterConfig config = parse(readSource());
        validate(config);
        log.info("Configuration loaded: providers={}, models={}, pricedModels={}",
                config.getProviders().size(), config.getModels().size(), config.getPricing().size());
        return config;
    }

    /**
     * Loads configuration from an input stream.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        try {
            RouterConfig config = parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
            validate(config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
    }

    private String readSource() {
        // Try file system first
        if (Files.exists(configPath)) {
            try {
                log.info("Loading configuration from file: {}", configPath);
                return Files.readString(configPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RouterConfig parse(String source) {
        Yaml yaml = new Yaml(new Constructor(RouterConfig.class, new LoaderOptions()));
        try {
            RouterConfig config = yaml.load(resolvePlaceholders(source));
            return config != null ? config : new RouterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration YAML: " + e.getMessage(), e);
        }
    }

    /**
     * Replaces environment placeholders; an unset variable without default is an error.
     */
    String resolvePlaceholders(String source) {
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = environment.apply(name);
            if (value == null) {
                value = matcher.group(2);
            }
            if (value == null) {
                throw new ConfigurationException("Environment variable not set and no default given: " + name);
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private void validate(RouterConfig config) {
        Set<String> providerIds = new HashSet<>();
        for (RouterConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider without id");
            }
            if (provider.getId().contains("/")) {
                throw new ConfigurationException("Provider id must not contain '/': " + provider.getId());
            }
            if (!providerIds.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            if (ProviderType.fromName(provider.getType()).isEmpty()) {
                throw new ConfigurationException(
                        "Unknown provider type '" + provider.getType() + "' for provider: " + provider.getId());
            }
            if (provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
                throw new ConfigurationException("Provider without baseUrl: " + provider.getId());
            }
            if (provider.getMaxConcurrentRequests() < 1) {
                throw new ConfigurationException("maxConcurrentRequests must be at least 1: " + provider.getId());
            }
        }

        Set<String> modelNames = new HashSet<>();
        for (RouterConfig.ModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                throw new ConfigurationException("Model alias without name");
            }
            if (!modelNames.add(model.getName())) {
                throw new ConfigurationException("Duplicate model alias: " + model.getName());
            }
            if (model.getCandidates() == null || model.getCandidates().isEmpty()) {
                throw new ConfigurationException("Model alias without candidates: " + model.getName());
            }
            for (String candidate : model.getCandidates()) {
                int slash = candidate.indexOf('/');
                if (slash <= 0 || slash == candidate.length() - 1) {
                    throw new ConfigurationException(
                            "Candidate must be 'provider/model': " + candidate + " in " + model.getName());
                }
                if (!providerIds.contains(candidate.substring(0, slash))) {
                    throw new ConfigurationException(
                            "Candidate references unknown provider: " + candidate + " in " + model.getName());
                }
            }
        }

        if (config.getHealthCheck().getUnhealthyThreshold() < 1) {
            throw new ConfigurationException("healthCheck.unhealthyThreshold must be at least 1");
        }
        if (config.getRouting().getAttemptTimeoutMs() <= 0) {
            throw new ConfigurationException("routing.attemptTimeoutMs must be positive");
        }
        if (Integer.bitCount(config.getEvents().getRingBufferSize()) != 1) {
            throw new ConfigurationException("events.ringBufferSize must be a power of 2");
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
