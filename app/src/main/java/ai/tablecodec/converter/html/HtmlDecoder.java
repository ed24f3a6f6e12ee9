package ai.tablecodec.converter.html;

import ai.tablecodec.converter.error.StructuralException;
import ai.tablecodec.converter.error.TableViolationException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.HeaderType;
import ai.tablecodec.converter.model.OccupancyGrid;
import ai.tablecodec.converter.model.Span;
import ai.tablecodec.converter.model.TableDraft;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.repair.LenientRepairPolicy;
import ai.tablecodec.converter.repair.TruncationDetector;
import ai.tablecodec.converter.repair.TruncationReport;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the first table of an HTML fragment into a {@link TableStructure}.
 *
 * <p>Each cell element is placed at the first uncovered column of its row. The column count is the furthest
 * column any placed cell reaches. Rows keep the order header, body, footer regardless of source order.</p>
 *
 * <p>Lenient decoding closes truncated input first. Strict decoding rejects it with the reason reported by
 * {@link TruncationDetector#detect(String)}.</p>
 */
public class HtmlDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlDecoder.class);

    private final TableTreeReader reader;
    private final StructureValidator validator;
    private final LenientRepairPolicy repairPolicy;
    private final TruncationDetector truncationDetector;

    public HtmlDecoder() {
        this(new TableTreeReader(), new StructureValidator(), new LenientRepairPolicy(), new TruncationDetector());
    }

    public HtmlDecoder(TableTreeReader reader,
                       StructureValidator validator,
                       LenientRepairPolicy repairPolicy,
                       TruncationDetector truncationDetector) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.repairPolicy = Objects.requireNonNull(repairPolicy, "repairPolicy");
        this.truncationDetector = Objects.requireNonNull(truncationDetector, "truncationDetector");
    }

    public TableStructure decode(String html, boolean strict) {
        Objects.requireNonNull(html, "html");
        if (strict) {
            rejectTruncated(html);
        }
        String input = strict ? html : truncationDetector.closeHtml(html);
        ParseOutcome outcome = reader.read(input);
        Optional<String> caption = outcome.markup().flatMap(TableMarkup::caption);
        if (!outcome.isParsed()) {
            return emptyOrFail(outcome.reason(), caption, strict);
        }
        TableMarkup markup = outcome.markup().orElseThrow();
        List<RowMarkup> rows = markup.rows();
        int numRows = rows.size();

        OccupancyGrid grid = new OccupancyGrid(numRows, widthBound(rows));
        TableDraft draft = new TableDraft(numRows, grid.cols());
        Set<Integer> emptyRows = new HashSet<>();
        List<Integer> footerRows = new ArrayList<>();
        int numCols = 0;

        for (int row = 0; row < numRows; row++) {
            RowMarkup rowMarkup = rows.get(row);
            if (rowMarkup.section() == TableSection.FOOTER) {
                footerRows.add(row);
            }
            if (rowMarkup.cells().isEmpty()) {
                emptyRows.add(row);
                continue;
            }
            boolean allHeaders = rowMarkup.allHeaderElements();
            int col = 0;
            for (CellMarkup cellMarkup : rowMarkup.cells()) {
                while (grid.isCovered(row, col)) {
                    col++;
                }
                Span span = new Span(SpanAttributes.parse(cellMarkup.rowspan()), SpanAttributes.parse(cellMarkup.colspan()));
                if (!strict) {
                    span = repairPolicy.fitToFreeRegion(grid, row, col, span);
                }
                HeaderType headerType = HeaderClassifier.classify(cellMarkup.headerElement(), rowMarkup.section(),
                        col, allHeaders, cellMarkup.scope());
                Cell cell = new Cell(row, col, span.rowspan(), span.colspan(), cellMarkup.text(), headerType);
                grid.mark(draft.addCell(cell), cell);
                col += span.colspan();
                numCols = Math.max(numCols, col);
            }
        }

        if (numCols == 0) {
            return emptyOrFail("Table has no cells", markup.caption(), strict);
        }
        draft.resize(numRows, numCols);
        draft.caption(markup.caption());
        draft.sections(markup.explicitHeader(), markup.explicitBody(), markup.explicitFooter());
        draft.footerRowIndices(footerRows);

        if (!strict) {
            repairPolicy.removeRows(draft, emptyRows);
            if (draft.numRows() == 0) {
                return TableStructure.emptyTable(markup.caption(), List.of());
            }
            return repairPolicy.finish(draft);
        }
        TableStructure table = draft.toTable();
        List<Violation> violations = validator.validate(table);
        if (!violations.isEmpty()) {
            throw TableViolationException.forViolations(violations);
        }
        return table;
    }

    /**
     * Strict mode never closes cut-off markup, so a truncated table is a structural error even though the
     * fallback parser would accept it. Complete tables that are merely not well-formed still reach the parsers.
     */
    private void rejectTruncated(String html) {
        TruncationReport report = truncationDetector.detect(html);
        if (report.truncated() && report.contentType() == TruncationReport.ContentType.HTML) {
            throw new StructuralException(report.reason());
        }
    }

    private TableStructure emptyOrFail(String reason, Optional<String> caption, boolean strict) {
        if (strict) {
            throw new StructuralException(reason);
        }
        LOGGER.debug("{}; returning a single empty cell", reason);
        return TableStructure.emptyTable(caption, List.of());
    }

    /**
     * Upper bound on the columns any placement can reach: per row, the row's own colspans plus the colspans
     * of earlier cells whose rowspan reaches into it.
     */
    private static int widthBound(List<RowMarkup> rows) {
        int numRows = rows.size();
        int[] bound = new int[numRows];
        for (int row = 0; row < numRows; row++) {
            for (CellMarkup cell : rows.get(row).cells()) {
                int colspan = SpanAttributes.parse(cell.colspan());
                bound[row] += colspan;
                int lastRow = Math.min(numRows, row + SpanAttributes.parse(cell.rowspan()));
                for (int below = row + 1; below < lastRow; below++) {
                    bound[below] += colspan;
                }
            }
        }
        int max = 0;
        for (int value : bound) {
            max = Math.max(max, value);
        }
        return max;
    }
}
