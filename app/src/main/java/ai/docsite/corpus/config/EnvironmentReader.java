package ai.docsite.corpus.config;

import java.util.Optional;

/**
 * Source of externally supplied settings, keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value, or empty when the key is unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
