package ai.tablecodec.converter.config;

import ai.tablecodec.converter.otsl.OtslSyntax;
import java.util.List;
import java.util.Objects;

/**
 * Settings shared by every conversion a {@code TableConverter} performs.
 *
 * @param parseMode       mode used by the operations that take no explicit strict flag
 * @param defaultGeometry four non-negative location values written when a table carries none
 * @param logFormat       console log format applied at startup
 * @param includeLocation whether encoded OTSL carries {@code <loc_N>} tokens
 */
public record ConverterConfig(ParseMode parseMode, List<Integer> defaultGeometry, LogFormat logFormat,
                              boolean includeLocation) {

    public ConverterConfig {
        Objects.requireNonNull(parseMode, "parseMode");
        Objects.requireNonNull(logFormat, "logFormat");
        defaultGeometry = List.copyOf(Objects.requireNonNull(defaultGeometry, "defaultGeometry"));
        if (defaultGeometry.size() != 4) {
            throw new IllegalArgumentException("defaultGeometry must have exactly four values: " + defaultGeometry);
        }
        if (defaultGeometry.stream().anyMatch(value -> value < 0)) {
            throw new IllegalArgumentException("defaultGeometry values must be non-negative: " + defaultGeometry);
        }
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig(ParseMode.STRICT, OtslSyntax.DEFAULT_GEOMETRY, LogFormat.TEXT, true);
    }

    public boolean strict() {
        return parseMode.isStrict();
    }

    public ConverterConfig withParseMode(ParseMode mode) {
        return new ConverterConfig(mode, defaultGeometry, logFormat, includeLocation);
    }

    public ConverterConfig withIncludeLocation(boolean value) {
        return new ConverterConfig(parseMode, defaultGeometry, logFormat, value);
    }
}
