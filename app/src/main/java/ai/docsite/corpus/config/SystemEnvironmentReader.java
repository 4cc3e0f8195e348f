package ai.docsite.corpus.config;

import java.util.Optional;

/**
 * Reads environment variables, falling back to a JVM system property of the same name
 * (e.g. {@code -DQUALITY_MIN_RATIO=0.2}).
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value != null) {
            return Optional.of(value);
        }
        return Optional.ofNullable(System.getProperty(key));
    }
}
