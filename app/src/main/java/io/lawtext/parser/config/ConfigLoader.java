package io.lawtext.parser.config;

import io.lawtext.parser.cli.CliArguments;
import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ActStatus;
import io.lawtext.parser.model.SourceFormat;
import io.lawtext.parser.output.ActIdentityJsonReader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_FORMAT = "LAWTEXT_FORMAT";
    static final String ENV_OUTPUT = "LAWTEXT_OUTPUT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;
    private final ActIdentityJsonReader identityReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new ActIdentityJsonReader());
    }

    public ConfigLoader(EnvironmentReader environmentReader, ActIdentityJsonReader identityReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.identityReader = Objects.requireNonNull(identityReader, "identityReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path inputFile = arguments.inputFile();
        if (inputFile == null) {
            throw new IllegalArgumentException("input file must be provided");
        }
        SourceFormat format = resolveFormat(arguments, inputFile);
        ActIdentity identity = resolveIdentity(arguments, inputFile);
        OutputMode outputMode = resolveOutputMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        return new Config(inputFile, format, identity, outputMode, arguments.pretty(), logFormat);
    }

    private SourceFormat resolveFormat(CliArguments arguments, Path inputFile) {
        if (arguments.format() != null) {
            return arguments.format();
        }
        return environmentReader.getNonBlank(ENV_FORMAT)
                .map(value -> wrap(ENV_FORMAT, () -> SourceFormat.from(value)))
                .orElseGet(() -> inferFormat(inputFile));
    }

    static SourceFormat inferFormat(Path inputFile) {
        String name = fileName(inputFile).toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm") ? SourceFormat.HTML : SourceFormat.TEXT;
    }

    private ActIdentity resolveIdentity(CliArguments arguments, Path inputFile) {
        boolean inlineFields = isNotBlank(arguments.actId()) || isNotBlank(arguments.title())
                || isNotBlank(arguments.titleEn()) || isNotBlank(arguments.shortName())
                || arguments.year() != null || arguments.status() != null || isNotBlank(arguments.url());
        if (arguments.identityFile() != null) {
            if (inlineFields) {
                throw new IllegalArgumentException("--identity cannot be combined with --act-id, --title or other identity options");
            }
            return identityReader.read(arguments.identityFile());
        }
        if (arguments.year() != null && arguments.year() < 0) {
            throw new IllegalArgumentException("--year must be zero or greater");
        }
        String id = Optional.ofNullable(arguments.actId())
                .filter(ConfigLoader::isNotBlank)
                .orElseGet(() -> idFromFileName(inputFile));
        if (id.isBlank()) {
            throw new IllegalArgumentException("--act-id must be provided when the input file name has no stem");
        }
        return new ActIdentity(id,
                arguments.title(),
                arguments.titleEn(),
                arguments.shortName(),
                arguments.year() == null ? 0 : arguments.year(),
                arguments.status() == null ? ActStatus.IN_FORCE : arguments.status(),
                Optional.empty(),
                Optional.empty(),
                arguments.url());
    }

    private OutputMode resolveOutputMode(CliArguments arguments) {
        if (arguments.outputMode() != null) {
            return arguments.outputMode();
        }
        return environmentReader.getNonBlank(ENV_OUTPUT)
                .map(value -> wrap(ENV_OUTPUT, () -> OutputMode.from(value)))
                .orElse(OutputMode.JSON);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(value -> wrap(ENV_LOG_FORMAT, () -> LogFormat.from(value)))
                .orElse(LogFormat.TEXT);
    }

    static String idFromFileName(Path inputFile) {
        String name = fileName(inputFile);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }

    private static <T> T wrap(String envKey, Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(envKey + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
