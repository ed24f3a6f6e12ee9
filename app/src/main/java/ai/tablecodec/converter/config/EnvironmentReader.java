package ai.tablecodec.converter.config;

import java.util.Optional;

/**
 * Source of configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Returns the trimmed value of {@code key}, treating blank values as absent.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
