package com.tethersystems.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tethersystems.live.bridge.RequestResponseBridge;
import com.tethersystems.live.capability.CoreCommands;
import com.tethersystems.live.config.TetherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs handler and task failures and shows them on the page.
 * <p>
 * The page script comes from {@code handler_error.<env>.js}: first from the configured template
 * directory, then from {@code tether/templates/} on the classpath. {@code {{message}}} in the
 * template is replaced by the failure text as a JavaScript string literal.
 */
public class FailureReporter {

    private static final Logger logger = LoggerFactory.getLogger(FailureReporter.class);

    static final String TEMPLATE_RESOURCE_DIR = "tether/templates/";
    static final String MESSAGE_PLACEHOLDER = "{{message}}";
    private static final String HEADER = "Handler failed with the following exception:\n";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TetherConfig config;
    private final RequestResponseBridge bridge;
    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public FailureReporter(TetherConfig config, RequestResponseBridge bridge) {
        this.config = config;
        this.bridge = bridge;
    }

    /**
     * Reports a failure. Never throws.
     *
     * @param socket The page to notify, or null to log only
     * @param fault  The failure
     */
    public void report(LiveSocket socket, Throwable fault) {
        String text = describe(fault);
        logger.error("{}{}", HEADER, text);
        if (socket == null) {
            return;
        }
        try {
            String js = render(text);
            bridge.push(socket, CoreCommands.EXECJS, Map.of("js", js));
        } catch (RuntimeException e) {
            logger.warn("Could not show failure on {}", socket.id(), e);
        }
    }

    public void report(LiveSocket socket, String message) {
        report(socket, new TetherException(message));
    }

    String render(String text) {
        String template = templates.computeIfAbsent(config.getEnvironment().templateSuffix(), this::loadTemplate);
        return template.replace(MESSAGE_PLACEHOLDER, encodeJs(HEADER + text));
    }

    /**
     * Encodes a value as a JavaScript string literal.
     *
     * @param value The text
     * @return a quoted, escaped literal
     */
    static String encodeJs(String value) {
        try {
            // JSON allows raw U+2028/U+2029, JavaScript string literals before ES2019 do not
            return MAPPER.writeValueAsString(value)
                    .replace("\u2028", "\\u2028")
                    .replace("\u2029", "\\u2029");
        } catch (JsonProcessingException e) {
            throw new TetherException("Cannot encode message as JavaScript", e);
        }
    }

    private static String describe(Throwable fault) {
        StringWriter out = new StringWriter();
        fault.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private String loadTemplate(String suffix) {
        String fileName = "handler_error." + suffix + ".js";
        Path directory = config.getTemplateDirectory();
        if (directory != null) {
            Path file = directory.resolve(fileName);
            if (Files.isRegularFile(file)) {
                try {
                    return Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    logger.warn("Cannot read template {}, using the built-in one", file, e);
                }
            }
        }
        try (InputStream in = FailureReporter.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE_DIR + fileName)) {
            if (in == null) {
                throw new ConfigurationException("Missing template " + TEMPLATE_RESOURCE_DIR + fileName);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read template " + TEMPLATE_RESOURCE_DIR + fileName, e);
        }
    }
}
