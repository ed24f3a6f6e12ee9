package ai.tablecodec.converter.repair;

import ai.tablecodec.converter.otsl.OtslSyntax;
import ai.tablecodec.converter.repair.TruncationReport.ContentType;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects and closes inputs that were cut off mid-stream, such as model output that hit a token limit.
 */
public class TruncationDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TruncationDetector.class);

    private static final Pattern TABLE_OPEN = Pattern.compile("<table(?=[\\s>/]|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_CLOSE = Pattern.compile("</table\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROW_OPEN = Pattern.compile("<tr(?=[\\s>/]|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROW_CLOSE = Pattern.compile("</tr\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL_OPEN = Pattern.compile("<t[dh](?=[\\s>/]|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL_CLOSE = Pattern.compile("</t[dh]\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DANGLING_TAG = Pattern.compile("<[^<>]*$");
    private static final Pattern PARTIAL_OTSL_TAG = Pattern.compile("<[a-z_/]*$", Pattern.CASE_INSENSITIVE);

    public TruncationReport detect(String content) {
        String trimmed = content == null ? "" : content.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith(OtslSyntax.OPEN)) {
            if (!isOtslTruncated(trimmed)) {
                return TruncationReport.complete(ContentType.OTSL, "Complete OTSL");
            }
            return lower.contains(OtslSyntax.CLOSE)
                    ? TruncationReport.truncated(ContentType.OTSL, "Incomplete tag syntax")
                    : TruncationReport.truncated(ContentType.OTSL, "Missing closing </otsl> tag");
        }
        if (!TABLE_OPEN.matcher(lower).find()) {
            return TruncationReport.complete(ContentType.UNKNOWN, "Not HTML or OTSL");
        }
        if (count(TABLE_OPEN, lower) > count(TABLE_CLOSE, lower)) {
            return TruncationReport.truncated(ContentType.HTML, "Missing closing </table> tag");
        }
        if (count(ROW_OPEN, lower) > count(ROW_CLOSE, lower)) {
            return TruncationReport.truncated(ContentType.HTML, "Unclosed <tr> tags");
        }
        if (count(CELL_OPEN, lower) > count(CELL_CLOSE, lower)) {
            return TruncationReport.truncated(ContentType.HTML, "Unclosed <td>/<th> tags");
        }
        if (DANGLING_TAG.matcher(lower).find()) {
            return TruncationReport.truncated(ContentType.HTML, "Incomplete tag syntax");
        }
        return TruncationReport.complete(ContentType.HTML, "Complete HTML");
    }

    public boolean isOtslTruncated(String otsl) {
        String trimmed = otsl.strip();
        if (trimmed.startsWith(OtslSyntax.OPEN) && !trimmed.endsWith(OtslSyntax.CLOSE)) {
            return true;
        }
        return PARTIAL_OTSL_TAG.matcher(trimmed).find();
    }

    /**
     * Restores the stream wrapper around a possibly cut-off tag stream. A partial tag at the end stays in
     * place and ends up as text of the last cell.
     */
    public String closeOtsl(String otsl) {
        String result = otsl.strip();
        boolean changed = false;
        if (!result.startsWith(OtslSyntax.OPEN)) {
            result = OtslSyntax.OPEN + result;
            changed = true;
        }
        if (!result.endsWith(OtslSyntax.CLOSE)) {
            if (!result.endsWith(OtslSyntax.NEW_ROW)) {
                result += OtslSyntax.NEW_ROW;
            }
            result += OtslSyntax.CLOSE;
            changed = true;
        }
        if (changed) {
            LOGGER.info("Auto-closed truncated OTSL input ({} chars)", otsl.length());
        }
        return result;
    }

    /**
     * Drops a dangling partial tag and balances table elements so the tree parsers see a complete table.
     */
    public String closeHtml(String html) {
        String result = html.strip();
        Matcher dangling = DANGLING_TAG.matcher(result);
        if (dangling.find()) {
            LOGGER.debug("Dropping dangling tag fragment '{}'", dangling.group());
            result = result.substring(0, dangling.start());
        }
        if (!TABLE_OPEN.matcher(result).find()) {
            result = "<table>" + result;
        }
        int missing = count(TABLE_OPEN, result) - count(TABLE_CLOSE, result);
        if (missing > 0) {
            result += "</table>".repeat(missing);
            LOGGER.info("Auto-closed truncated HTML input with {} missing </table> tag(s)", missing);
        }
        return result;
    }

    /**
     * Closes whichever kind of input {@link #detect(String)} recognizes; other input is returned unchanged.
     */
    public String autoClose(String content) {
        TruncationReport report = detect(content);
        if (!report.truncated()) {
            return content;
        }
        return switch (report.contentType()) {
            case OTSL -> closeOtsl(content);
            case HTML -> closeHtml(content);
            case UNKNOWN -> content;
        };
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
