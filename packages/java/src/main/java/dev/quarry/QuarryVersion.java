package dev.quarry;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library version: the jar manifest's {@code Implementation-Version}, else {@code version.properties}.
 */
final class QuarryVersion {
    private static final Logger LOG = LoggerFactory.getLogger(QuarryVersion.class);
    private static final String UNKNOWN = "0.0.0-unknown";
    private static final String VERSION = load();

    private QuarryVersion() {
    }

    static String get() {
        return VERSION;
    }

    private static String load() {
        String fromManifest = QuarryVersion.class.getPackage().getImplementationVersion();
        if (fromManifest != null && !fromManifest.isBlank()) {
            return fromManifest;
        }
        try (InputStream in = QuarryVersion.class.getResourceAsStream("version.properties")) {
            if (in == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("version", UNKNOWN).trim();
            return version.isEmpty() || version.startsWith("${") ? UNKNOWN : version;
        } catch (IOException e) {
            LOG.debug("Failed to read version.properties: {}", e.getMessage());
            return UNKNOWN;
        }
    }
}
