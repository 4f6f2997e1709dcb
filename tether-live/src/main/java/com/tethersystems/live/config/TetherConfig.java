package com.tethersystems.live.config;

import com.tethersystems.live.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for live connections. Built with fluent setters or loaded from {@code tether.properties}.
 *
 * <pre>
 * tether.environment=prod
 * tether.browser-response-timeout-ms=5000
 * tether.disconnect-timeout-ms=5000
 * tether.state-timeout-ms=5000
 * tether.template-directory=/etc/app/tether
 * tether.token-secret=...
 * tether.token-max-age-seconds=86400
 * </pre>
 */
public class TetherConfig {
    private static final Logger logger = LoggerFactory.getLogger(TetherConfig.class);

    public static final String RESOURCE_NAME = "tether.properties";
    private static final String PREFIX = "tether.";

    public static final Duration DEFAULT_BROWSER_RESPONSE_TIMEOUT = Duration.ofMillis(5000);
    public static final Duration DEFAULT_DISCONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STATE_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Controls how much failure detail reaches the page.
     */
    public enum Environment {
        /** Full failure text is shown on the page. */
        DEV,
        /** The page gets a generic notice; details go to the log only. */
        PROD;

        public String templateSuffix() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Environment parse(String value) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            if (normalized.equals("DEVELOPMENT")) {
                return DEV;
            }
            if (normalized.equals("PRODUCTION")) {
                return PROD;
            }
            try {
                return valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown environment: " + value, e);
            }
        }
    }

    private Environment environment = Environment.DEV;
    private Duration browserResponseTimeout = DEFAULT_BROWSER_RESPONSE_TIMEOUT;
    private Duration disconnectTimeout = DEFAULT_DISCONNECT_TIMEOUT;
    private Duration stateTimeout = DEFAULT_STATE_TIMEOUT;
    private Path templateDirectory;
    private String tokenSecret;
    private Duration tokenMaxAge;

    /**
     * Loads {@code tether.properties} from the classpath, falling back to defaults when absent.
     *
     * @return the configuration
     * @throws ConfigurationException if the resource exists but holds invalid values
     */
    public static TetherConfig load() {
        Properties properties = new Properties();
        try (InputStream in = TetherConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
                return new TetherConfig();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    public static TetherConfig fromProperties(Properties properties) {
        TetherConfig config = new TetherConfig();
        String environment = property(properties, "environment");
        if (environment != null) {
            config.setEnvironment(Environment.parse(environment));
        }
        Long browserTimeout = longProperty(properties, "browser-response-timeout-ms");
        if (browserTimeout != null) {
            config.setBrowserResponseTimeout(Duration.ofMillis(browserTimeout));
        }
        Long disconnectTimeout = longProperty(properties, "disconnect-timeout-ms");
        if (disconnectTimeout != null) {
            config.setDisconnectTimeout(Duration.ofMillis(disconnectTimeout));
        }
        Long stateTimeout = longProperty(properties, "state-timeout-ms");
        if (stateTimeout != null) {
            config.setStateTimeout(Duration.ofMillis(stateTimeout));
        }
        String templateDirectory = property(properties, "template-directory");
        if (templateDirectory != null) {
            config.setTemplateDirectory(Paths.get(templateDirectory));
        }
        config.setTokenSecret(property(properties, "token-secret"));
        Long maxAge = longProperty(properties, "token-max-age-seconds");
        if (maxAge != null) {
            config.setTokenMaxAge(Duration.ofSeconds(maxAge));
        }
        return config;
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Long longProperty(Properties properties, String key) {
        String value = property(properties, key);
        if (value == null) {
            return null;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new ConfigurationException(PREFIX + key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    public Environment getEnvironment() {
        return environment;
    }

    public TetherConfig setEnvironment(Environment environment) {
        this.environment = environment;
        return this;
    }

    /**
     * Default wait for a reply to a push-and-wait call.
     *
     * @return the timeout
     */
    public Duration getBrowserResponseTimeout() {
        return browserResponseTimeout;
    }

    public TetherConfig setBrowserResponseTimeout(Duration browserResponseTimeout) {
        this.browserResponseTimeout = browserResponseTimeout;
        return this;
    }

    /**
     * How long a stopping connection waits for its on-disconnect callback.
     *
     * @return the timeout
     */
    public Duration getDisconnectTimeout() {
        return disconnectTimeout;
    }

    public TetherConfig setDisconnectTimeout(Duration disconnectTimeout) {
        this.disconnectTimeout = disconnectTimeout;
        return this;
    }

    /**
     * How long a {@code ConnectionRef} getter waits for the actor.
     *
     * @return the timeout
     */
    public Duration getStateTimeout() {
        return stateTimeout;
    }

    public TetherConfig setStateTimeout(Duration stateTimeout) {
        this.stateTimeout = stateTimeout;
        return this;
    }

    public Path getTemplateDirectory() {
        return templateDirectory;
    }

    public TetherConfig setTemplateDirectory(Path templateDirectory) {
        this.templateDirectory = templateDirectory;
        return this;
    }

    public String getTokenSecret() {
        return tokenSecret;
    }

    public TetherConfig setTokenSecret(String tokenSecret) {
        this.tokenSecret = tokenSecret;
        return this;
    }

    public Duration getTokenMaxAge() {
        return tokenMaxAge;
    }

    public TetherConfig setTokenMaxAge(Duration tokenMaxAge) {
        this.tokenMaxAge = tokenMaxAge;
        return this;
    }
}
