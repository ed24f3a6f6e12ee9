package ai.tablecodec.converter.config;

import ai.tablecodec.converter.otsl.OtslSyntax;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link ConverterConfig} from environment variables, falling back to defaults for unset values.
 */
public class ConfigLoader {

    static final String ENV_PARSE_MODE = "TABLE_PARSE_MODE";
    static final String ENV_DEFAULT_GEOMETRY = "OTSL_DEFAULT_GEOMETRY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_INCLUDE_LOCATION = "OTSL_INCLUDE_LOCATION";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public ConverterConfig load() {
        ParseMode parseMode = environmentReader.getNonBlank(ENV_PARSE_MODE)
                .map(ConfigLoader::parseMode)
                .orElse(ParseMode.STRICT);
        List<Integer> geometry = environmentReader.getNonBlank(ENV_DEFAULT_GEOMETRY)
                .map(ConfigLoader::parseGeometry)
                .orElse(OtslSyntax.DEFAULT_GEOMETRY);
        LogFormat logFormat = environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(ConfigLoader::logFormat)
                .orElse(LogFormat.TEXT);
        boolean includeLocation = environmentReader.getNonBlank(ENV_INCLUDE_LOCATION)
                .map(ConfigLoader::parseFlag)
                .orElse(true);
        return new ConverterConfig(parseMode, geometry, logFormat, includeLocation);
    }

    private static ParseMode parseMode(String raw) {
        try {
            return ParseMode.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_PARSE_MODE + " must be 'strict' or 'lenient' but was '" + raw + "'", ex);
        }
    }

    private static LogFormat logFormat(String raw) {
        try {
            return LogFormat.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_LOG_FORMAT + " must be 'text' or 'json' but was '" + raw + "'", ex);
        }
    }

    private static boolean parseFlag(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException(ENV_INCLUDE_LOCATION + " must be 'true' or 'false' but was '" + raw + "'");
    }

    private static List<Integer> parseGeometry(String raw) {
        List<String> parts = Arrays.stream(raw.split(","))
                .map(String::trim)
                .collect(Collectors.toList());
        if (parts.size() != 4) {
            throw new IllegalArgumentException(ENV_DEFAULT_GEOMETRY + " must contain four comma-separated integers but was '" + raw + "'");
        }
        return parts.stream()
                .map(ConfigLoader::parseNonNegativeInteger)
                .collect(Collectors.toList());
    }

    private static int parseNonNegativeInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(ENV_DEFAULT_GEOMETRY + " values must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_DEFAULT_GEOMETRY + " values must be integers but got '" + raw + "'", ex);
        }
    }
}
