package in.matchbot.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Environment variable utilities.
 * Environment first, then system property (handy for tests and -D overrides).
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("{}={} is not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Comma-separated list of numeric ids, e.g. "438466803, 1001".
     * Entries that do not parse are skipped.
     */
    public static Set<Long> getLongSet(String key) {
        String value = get(key, null);
        if (value == null) return Set.of();
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> parseId(key, s))
            .flatMap(Optional::stream)
            .collect(Collectors.toUnmodifiableSet());
    }

    private static Optional<Long> parseId(String key, String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("{}: skipping invalid id '{}'", key, value);
            return Optional.empty();
        }
    }

    private Env() {}
}
