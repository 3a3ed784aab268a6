package io.lawtext.parser.config;

import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.SourceFormat;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputFile,
        SourceFormat format,
        ActIdentity identity,
        OutputMode outputMode,
        boolean prettyPrint,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(identity, "identity");
        outputMode = outputMode == null ? OutputMode.JSON : outputMode;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
