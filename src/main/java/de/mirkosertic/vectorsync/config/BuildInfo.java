package de.mirkosertic.vectorsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the running engine, read from the Maven-filtered {@code build-info.properties}.
 * <p>
 * The version is stamped into the persisted watcher state and sent as HTTP user agent
 * to the inference servers. Unfiltered values (running from an IDE) count as "dev".
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final class Holder {
        private static final BuildInfo CURRENT = load();
    }

    public static BuildInfo current() {
        return Holder.CURRENT;
    }

    static BuildInfo load() {
        try (InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("{} not found, running as {}", BUILD_INFO_FILE, DEV_VERSION);
                return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
            }
            final Properties properties = new Properties();
            properties.load(input);
            return from(properties);
        } catch (final IOException e) {
            logger.warn("Cannot read {}, running as {}", BUILD_INFO_FILE, DEV_VERSION, e);
            return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
        }
    }

    static BuildInfo from(final Properties properties) {
        return new BuildInfo(
                filtered(properties.getProperty("build.version"), DEV_VERSION),
                filtered(properties.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP));
    }

    private static String filtered(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value.trim();
    }

    public boolean isDevBuild() {
        return DEV_VERSION.equals(version);
    }

    public String userAgent() {
        return "vector-sync/" + version;
    }
}
