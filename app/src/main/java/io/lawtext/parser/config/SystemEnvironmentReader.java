package io.lawtext.parser.config;

import java.util.Optional;

/**
 * Reads process environment variables.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
