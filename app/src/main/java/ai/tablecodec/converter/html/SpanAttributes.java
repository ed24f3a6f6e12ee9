package ai.tablecodec.converter.html;

import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code rowspan}/{@code colspan} values. Backslashes and quotes left over from escaped markup such as
 * {@code colspan=\"2\"} are stripped; anything that is not a positive integer reads as 1. Values above
 * {@value #MAX_SPAN} are capped, as browsers do for {@code colspan}.
 */
public final class SpanAttributes {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpanAttributes.class);

    public static final int MAX_SPAN = 1000;

    private static final Pattern NOISE = Pattern.compile("[\\\\\"']");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,6}");

    private SpanAttributes() {
    }

    public static int parse(String raw) {
        if (raw == null) {
            return 1;
        }
        String cleaned = NOISE.matcher(raw).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            return 1;
        }
        if (!DIGITS.matcher(cleaned).matches()) {
            LOGGER.debug("Span attribute '{}' is not a number; using 1", raw);
            return 1;
        }
        int value = Integer.parseInt(cleaned);
        if (value > MAX_SPAN) {
            LOGGER.debug("Span attribute {} exceeds {}; capping", value, MAX_SPAN);
            return MAX_SPAN;
        }
        return value < 1 ? 1 : value;
    }
}
