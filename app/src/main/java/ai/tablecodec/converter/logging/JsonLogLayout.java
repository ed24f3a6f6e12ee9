package ai.tablecodec.converter.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One-line JSON layout. The conversion direction and parse mode found in the MDC become top-level fields;
 * other MDC entries are nested under {@code mdc}.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    public static final String MDC_CONVERSION = "conversion";
    public static final String MDC_PARSE_MODE = "parseMode";

    private static final Set<String> LIFTED_KEYS = Set.of(MDC_CONVERSION, MDC_PARSE_MODE);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap() == null ? Map.of() : event.getMDCPropertyMap();
        Map<String, String> nested = new LinkedHashMap<>();
        mdc.forEach((key, value) -> {
            if (!LIFTED_KEYS.contains(key)) {
                nested.put(key, value);
            }
        });

        StringBuilder json = new StringBuilder(256).append('{');
        field(json, "timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        field(json.append(','), "level", String.valueOf(event.getLevel()));
        field(json.append(','), "logger", event.getLoggerName());
        field(json.append(','), "thread", event.getThreadName());
        for (String key : new String[] {MDC_CONVERSION, MDC_PARSE_MODE}) {
            if (mdc.containsKey(key)) {
                field(json.append(','), key, mdc.get(key));
            }
        }
        field(json.append(','), "message", event.getFormattedMessage());
        if (!nested.isEmpty()) {
            json.append(",\"mdc\":{");
            boolean first = true;
            for (Map.Entry<String, String> entry : nested.entrySet()) {
                if (!first) {
                    json.append(',');
                }
                field(json, entry.getKey(), entry.getValue());
                first = false;
            }
            json.append('}');
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            field(json.append(','), "exception", ThrowableProxyUtil.asString(throwable));
        }
        return json.append('}').append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static void field(StringBuilder json, String name, String value) {
        appendQuoted(json, name);
        json.append(':');
        if (value == null) {
            json.append("null");
        } else {
            appendQuoted(json, value);
        }
    }

    private static void appendQuoted(StringBuilder json, String value) {
        json.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> json.append("\\\"");
                case '\\' -> json.append("\\\\");
                case '\n' -> json.append("\\n");
                case '\r' -> json.append("\\r");
                case '\t' -> json.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        json.append(String.format("\\u%04x", (int) ch));
                    } else {
                        json.append(ch);
                    }
                }
            }
        }
        json.append('"');
    }
}
