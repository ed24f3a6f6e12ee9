package ai.tablecodec.converter.html;

import java.util.regex.Pattern;

/**
 * A {@code td} or {@code th} element as read by a tree parser. Span attributes are kept raw.
 */
public record CellMarkup(boolean headerElement, String text, String rowspan, String colspan, String scope) {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    public CellMarkup {
        text = normalizeText(text);
        rowspan = rowspan == null ? "" : rowspan;
        colspan = colspan == null ? "" : colspan;
        scope = scope == null ? "" : scope;
    }

    /**
     * Collapses runs of whitespace to a single space and trims the result.
     */
    static String normalizeText(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw).replaceAll(" ").trim();
    }
}
