package ai.tablecodec.converter.api;

import ai.tablecodec.converter.config.ConfigLoader;
import ai.tablecodec.converter.config.ConverterConfig;
import ai.tablecodec.converter.config.EnvironmentReader;
import ai.tablecodec.converter.config.ParseMode;
import ai.tablecodec.converter.error.TableConversionException;
import ai.tablecodec.converter.html.HtmlDecoder;
import ai.tablecodec.converter.html.HtmlEncoder;
import ai.tablecodec.converter.logging.JsonLogLayout;
import ai.tablecodec.converter.logging.LoggingConfigurator;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.otsl.OtslDecoder;
import ai.tablecodec.converter.otsl.OtslEncoder;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for converting tables between HTML, OTSL and {@link TableStructure}.
 *
 * <p>Every operation is available with an explicit strict flag and without one, in which case the configured
 * {@link ParseMode} applies. Instances hold no per-call state and may be shared between threads.</p>
 */
public class TableConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableConverter.class);

    private final ConverterConfig config;
    private final StructureValidator validator;
    private final HtmlDecoder htmlDecoder;
    private final HtmlEncoder htmlEncoder;
    private final OtslDecoder otslDecoder;
    private final OtslEncoder otslEncoder;

    public TableConverter() {
        this(ConverterConfig.defaults());
    }

    public TableConverter(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = new StructureValidator();
        this.htmlDecoder = new HtmlDecoder();
        this.htmlEncoder = new HtmlEncoder(validator);
        this.otslDecoder = new OtslDecoder();
        this.otslEncoder = new OtslEncoder(validator, config.defaultGeometry(), config.includeLocation());
    }

    /**
     * Builds a converter from {@code TABLE_PARSE_MODE}, {@code OTSL_DEFAULT_GEOMETRY} and {@code LOG_FORMAT},
     * applying the log format to the active logback context.
     */
    public static TableConverter fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    static TableConverter fromEnvironment(EnvironmentReader environmentReader) {
        ConverterConfig config = new ConfigLoader(environmentReader).load();
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Table converter configured: parseMode={}, defaultGeometry={}, includeLocation={}, logFormat={}",
                config.parseMode(), config.defaultGeometry(), config.includeLocation(), config.logFormat());
        return new TableConverter(config);
    }

    public ConverterConfig config() {
        return config;
    }

    public TableStructure treeToIr(String html) {
        return treeToIr(html, config.strict());
    }

    public TableStructure treeToIr(String html, boolean strict) {
        return inContext("html->ir", strict, () -> htmlDecoder.decode(html, strict));
    }

    public String irToTree(TableStructure table) {
        return irToTree(table, config.strict());
    }

    public String irToTree(TableStructure table, boolean strict) {
        return inContext("ir->html", strict, () -> htmlEncoder.encode(table, strict));
    }

    public TableStructure streamToIr(String otsl) {
        return streamToIr(otsl, config.strict());
    }

    public TableStructure streamToIr(String otsl, boolean strict) {
        return inContext("otsl->ir", strict, () -> otslDecoder.decode(otsl, strict));
    }

    public String irToStream(TableStructure table) {
        return irToStream(table, config.strict());
    }

    public String irToStream(TableStructure table, boolean strict) {
        return inContext("ir->otsl", strict, () -> otslEncoder.encode(table, strict));
    }

    public List<Violation> validate(TableStructure table) {
        return validator.validate(table);
    }

    public String htmlToOtsl(String html) {
        return htmlToOtsl(html, config.strict());
    }

    public String htmlToOtsl(String html, boolean strict) {
        return irToStream(treeToIr(html, strict), strict);
    }

    public String otslToHtml(String otsl) {
        return otslToHtml(otsl, config.strict());
    }

    public String otslToHtml(String otsl, boolean strict) {
        return irToTree(streamToIr(otsl, strict), strict);
    }

    public RoundTrip roundTripHtml(String html) {
        return roundTripHtml(html, config.strict());
    }

    /**
     * Converts HTML to OTSL and the OTSL back to HTML. The summary describes the table decoded from {@code html}.
     */
    public RoundTrip roundTripHtml(String html, boolean strict) {
        TableStructure table = treeToIr(html, strict);
        String otsl = irToStream(table, strict);
        return new RoundTrip(otsl, otslToHtml(otsl, strict), RoundTrip.summarize(table));
    }

    public RoundTrip roundTripOtsl(String otsl) {
        return roundTripOtsl(otsl, config.strict());
    }

    /**
     * Converts OTSL to HTML and the HTML back to OTSL. The summary describes the table decoded from {@code otsl}.
     */
    public RoundTrip roundTripOtsl(String otsl, boolean strict) {
        TableStructure table = streamToIr(otsl, strict);
        String html = irToTree(table, strict);
        return new RoundTrip(html, htmlToOtsl(html, strict), RoundTrip.summarize(table));
    }

    /**
     * Decodes both renderings with the configured mode and compares dimensions, cell positions, spans, header
     * types and content. Missing input and conversion failures are reported as a mismatch rather than thrown.
     */
    public ConversionCheck validateConversion(String html, String otsl) {
        if (html == null || otsl == null) {
            return ConversionCheck.mismatch("Validation error: " + (html == null ? "HTML" : "OTSL") + " input is null");
        }
        TableStructure fromHtml;
        TableStructure fromOtsl;
        try {
            fromHtml = treeToIr(html);
            fromOtsl = streamToIr(otsl);
        } catch (TableConversionException | IllegalStateException ex) {
            LOGGER.debug("Conversion check failed to decode input", ex);
            return ConversionCheck.mismatch("Validation error: " + ex.getMessage());
        }
        if (fromHtml.numRows() != fromOtsl.numRows()) {
            return ConversionCheck.mismatch("Row count mismatch: HTML=" + fromHtml.numRows() + ", OTSL=" + fromOtsl.numRows());
        }
        if (fromHtml.numCols() != fromOtsl.numCols()) {
            return ConversionCheck.mismatch("Column count mismatch: HTML=" + fromHtml.numCols() + ", OTSL=" + fromOtsl.numCols());
        }
        if (fromHtml.cells().size() != fromOtsl.cells().size()) {
            return ConversionCheck.mismatch("Cell count mismatch: HTML=" + fromHtml.cells().size()
                    + ", OTSL=" + fromOtsl.cells().size());
        }
        for (int index = 0; index < fromHtml.cells().size(); index++) {
            Cell left = fromHtml.cells().get(index);
            Cell right = fromOtsl.cells().get(index);
            String at = " at (" + left.rowIdx() + ", " + left.colIdx() + ")";
            if (left.rowIdx() != right.rowIdx() || left.colIdx() != right.colIdx()) {
                return ConversionCheck.mismatch("Cell position mismatch" + at);
            }
            if (left.rowspan() != right.rowspan() || left.colspan() != right.colspan()) {
                return ConversionCheck.mismatch("Cell span mismatch" + at);
            }
            if (left.headerType() != right.headerType()) {
                return ConversionCheck.mismatch("Header type mismatch" + at + ": " + left.headerType() + " != " + right.headerType());
            }
            if (!left.content().strip().equals(right.content().strip())) {
                return ConversionCheck.mismatch("Content mismatch" + at + ": '" + left.content().strip()
                        + "' != '" + right.content().strip() + "'");
            }
        }
        return ConversionCheck.match();
    }

    private static <T> T inContext(String conversion, boolean strict, Supplier<T> action) {
        MDC.put(JsonLogLayout.MDC_CONVERSION, conversion);
        MDC.put(JsonLogLayout.MDC_PARSE_MODE, ParseMode.of(strict).name().toLowerCase(Locale.ROOT));
        try {
            return action.get();
        } finally {
            MDC.remove(JsonLogLayout.MDC_CONVERSION);
            MDC.remove(JsonLogLayout.MDC_PARSE_MODE);
        }
    }
}
