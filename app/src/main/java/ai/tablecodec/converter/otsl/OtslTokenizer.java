package ai.tablecodec.converter.otsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the inside of an {@code <otsl>} wrapper into preamble metadata and rows of cell tokens.
 *
 * <p>Preamble tokens may appear in any order before the first cell token. Text following a cell tag is
 * trimmed and attached to it; text following a continuation tag is dropped. Any {@code <...>} sequence that
 * is not a known tag is plain text. Segments between row breaks that hold no cell token are not rows.</p>
 */
public class OtslTokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(OtslTokenizer.class);

    private static final Pattern CAPTION = Pattern.compile("\\A\\s*<caption>(.*?)</caption>", Pattern.DOTALL);
    private static final Pattern FLAG = Pattern.compile("\\A\\s*<(has_thead|has_tbody|has_tfoot)>");
    private static final Pattern FOOTER_ROWS = Pattern.compile("\\A\\s*<tfoot_rows>([^<]*)</tfoot_rows>");
    private static final Pattern LOCATION = Pattern.compile("\\A\\s*<loc_(\\d{1,9})>");
    private static final Pattern CELL_TAG = Pattern.compile("<(ched|rhed|fcel|ecel|lcel|ucel|xcel|nl)>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public OtslDocument tokenize(String body) {
        PreambleBuilder preamble = new PreambleBuilder();
        String remaining = body;
        while (true) {
            Matcher matcher;
            if ((matcher = CAPTION.matcher(remaining)).find()) {
                String caption = WHITESPACE.matcher(matcher.group(1)).replaceAll(" ").trim();
                preamble.caption = caption.isEmpty() ? Optional.empty() : Optional.of(caption);
            } else if ((matcher = FLAG.matcher(remaining)).find()) {
                switch (matcher.group(1)) {
                    case "has_thead" -> preamble.hasHeader = true;
                    case "has_tbody" -> preamble.hasBody = true;
                    default -> preamble.hasFooter = true;
                }
            } else if ((matcher = FOOTER_ROWS.matcher(remaining)).find()) {
                preamble.footerRows.addAll(parseFooterRows(matcher.group(1)));
            } else if ((matcher = LOCATION.matcher(remaining)).find()) {
                preamble.geometry.add(Integer.parseInt(matcher.group(1)));
            } else {
                break;
            }
            remaining = remaining.substring(matcher.end());
        }
        return new OtslDocument(preamble.caption, preamble.hasHeader, preamble.hasBody, preamble.hasFooter,
                preamble.footerRows, preamble.geometry, tokenizeRows(remaining));
    }

    private List<List<OtslToken>> tokenizeRows(String cells) {
        List<List<OtslToken>> rows = new ArrayList<>();
        List<OtslToken> current = new ArrayList<>();
        Matcher matcher = CELL_TAG.matcher(cells);
        OtslTag pendingTag = null;
        int textStart = 0;
        while (matcher.find()) {
            String text = cells.substring(textStart, matcher.start()).trim();
            if (pendingTag != null) {
                current.add(tokenWithText(pendingTag, text));
            } else if (!text.isEmpty()) {
                LOGGER.debug("Ignoring text outside any cell: '{}'", text);
            }
            pendingTag = null;
            textStart = matcher.end();

            String name = matcher.group(1);
            if ("nl".equals(name)) {
                closeRow(rows, current);
                current = new ArrayList<>();
            } else {
                pendingTag = OtslTag.fromName(name).orElseThrow();
            }
        }
        String trailing = cells.substring(textStart).trim();
        if (pendingTag != null) {
            current.add(tokenWithText(pendingTag, trailing));
        } else if (!trailing.isEmpty()) {
            LOGGER.debug("Ignoring trailing text outside any cell: '{}'", trailing);
        }
        closeRow(rows, current);
        return rows;
    }

    private static OtslToken tokenWithText(OtslTag tag, String text) {
        if (tag.isContinuation()) {
            if (!text.isEmpty()) {
                LOGGER.debug("Dropping text '{}' after continuation tag {}", text, tag.markup());
            }
            return OtslToken.of(tag);
        }
        return new OtslToken(tag, text);
    }

    private static void closeRow(List<List<OtslToken>> rows, List<OtslToken> current) {
        if (!current.isEmpty()) {
            rows.add(current);
        }
    }

    private static List<Integer> parseFooterRows(String raw) {
        List<Integer> indices = new ArrayList<>();
        for (String part : raw.split(",")) {
            String value = part.trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                indices.add(Integer.parseInt(value));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring non-numeric footer row index '{}'", value);
            }
        }
        return indices;
    }

    private static final class PreambleBuilder {
        private Optional<String> caption = Optional.empty();
        private boolean hasHeader;
        private boolean hasBody;
        private boolean hasFooter;
        private final List<Integer> footerRows = new ArrayList<>();
        private final List<Integer> geometry = new ArrayList<>();
    }
}
