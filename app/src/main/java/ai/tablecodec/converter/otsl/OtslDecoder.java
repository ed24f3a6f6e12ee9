package ai.tablecodec.converter.otsl;

import ai.tablecodec.converter.error.StructuralException;
import ai.tablecodec.converter.error.TableViolationException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.OccupancyGrid;
import ai.tablecodec.converter.model.TableDraft;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.repair.LenientRepairPolicy;
import ai.tablecodec.converter.repair.TruncationDetector;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an OTSL tag stream into a {@link TableStructure}.
 *
 * <p>Spans are resolved with a row cursor and a column cursor. An origin token starts a cell whose colspan
 * is one plus the number of {@code lcel} tokens directly after it and whose rowspan grows while the rows
 * below carry {@code ucel}/{@code xcel} at the same column. Continuation tokens never create cells.</p>
 */
public class OtslDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OtslDecoder.class);

    private final OtslTokenizer tokenizer;
    private final StructureValidator validator;
    private final LenientRepairPolicy repairPolicy;
    private final TruncationDetector truncationDetector;

    public OtslDecoder() {
        this(new OtslTokenizer(), new StructureValidator(), new LenientRepairPolicy(), new TruncationDetector());
    }

    public OtslDecoder(OtslTokenizer tokenizer,
                       StructureValidator validator,
                       LenientRepairPolicy repairPolicy,
                       TruncationDetector truncationDetector) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.repairPolicy = Objects.requireNonNull(repairPolicy, "repairPolicy");
        this.truncationDetector = Objects.requireNonNull(truncationDetector, "truncationDetector");
    }

    public TableStructure decode(String otsl, boolean strict) {
        Objects.requireNonNull(otsl, "otsl");
        String input = strict ? otsl.strip() : truncationDetector.closeOtsl(otsl);
        if (!input.startsWith(OtslSyntax.OPEN)) {
            throw new StructuralException("OTSL string must start with " + OtslSyntax.OPEN);
        }
        if (!input.endsWith(OtslSyntax.CLOSE)) {
            throw new StructuralException("OTSL string must end with " + OtslSyntax.CLOSE);
        }
        String body = input.substring(OtslSyntax.OPEN.length(), input.length() - OtslSyntax.CLOSE.length());
        OtslDocument document = tokenizer.tokenize(body);
        List<List<OtslToken>> rows = document.rows();

        if (rows.isEmpty()) {
            if (strict) {
                throw new StructuralException("OTSL stream contains no rows");
            }
            LOGGER.debug("OTSL stream has no rows; returning a single empty cell");
            return TableStructure.emptyTable(document.caption(), document.geometry());
        }

        int numCols;
        if (strict) {
            numCols = rows.get(0).size();
            for (int index = 1; index < rows.size(); index++) {
                int size = rows.get(index).size();
                if (size > numCols) {
                    throw new StructuralException("Row " + index + " has " + size
                            + " tokens but the first row has " + numCols);
                }
            }
        } else {
            numCols = document.widestRow();
            rows = repairPolicy.normalizeRowLengths(rows, numCols, () -> OtslToken.of(OtslTag.EMPTY));
        }

        TableDraft draft = resolveCells(rows, numCols, strict);
        draft.caption(document.caption());
        draft.sections(document.hasHeader(), document.hasBody(), document.hasFooter());
        int numRows = rows.size();
        draft.footerRowIndices(document.footerRows().stream()
                .filter(row -> row >= 0 && row < numRows)
                .collect(Collectors.toList()));
        draft.geometry(document.geometry());

        if (!strict) {
            return repairPolicy.finish(draft);
        }
        TableStructure table = draft.toTable();
        List<Violation> violations = validator.validate(table);
        if (!violations.isEmpty()) {
            throw TableViolationException.forViolations(violations);
        }
        return table;
    }

    private TableDraft resolveCells(List<List<OtslToken>> rows, int numCols, boolean strict) {
        int numRows = rows.size();
        TableDraft draft = new TableDraft(numRows, numCols);
        OccupancyGrid grid = new OccupancyGrid(numRows, numCols);

        for (int row = 0; row < numRows; row++) {
            List<OtslToken> tokens = rows.get(row);
            int columnCursor = 0;
            int tokenCursor = 0;
            while (columnCursor < numCols && tokenCursor < tokens.size()) {
                OtslToken token = tokens.get(tokenCursor);
                if (token.isContinuation()) {
                    if (!grid.isCovered(row, columnCursor)) {
                        LOGGER.debug("Ignoring orphan {} at ({}, {})", token.tag().markup(), row, columnCursor);
                    }
                    columnCursor++;
                    tokenCursor++;
                    continue;
                }

                int colspan = 1 + countLeftContinuations(tokens, tokenCursor + 1);
                int rowspan = 1 + countRowsBelow(rows, row, columnCursor, colspan, strict);
                Cell cell = new Cell(row, columnCursor, rowspan, colspan, token.text(), token.tag().headerType());
                if (grid.isCovered(row, columnCursor)) {
                    LOGGER.debug("Origin {} at covered position ({}, {})", token.tag().markup(), row, columnCursor);
                }
                grid.mark(draft.addCell(cell), cell);

                columnCursor += colspan;
                tokenCursor += colspan;
            }
        }
        return draft;
    }

    private static int countLeftContinuations(List<OtslToken> tokens, int from) {
        int count = 0;
        for (int index = from; index < tokens.size() && tokens.get(index).tag() == OtslTag.LEFT; index++) {
            count++;
        }
        return count;
    }

    private static int countRowsBelow(List<List<OtslToken>> rows, int row, int col, int colspan, boolean strict) {
        int count = 0;
        for (int next = row + 1; next < rows.size(); next++) {
            if (!continuesDown(rows.get(next), col, colspan, strict)) {
                break;
            }
            count++;
        }
        return count;
    }

    private static boolean continuesDown(List<OtslToken> tokens, int col, int colspan, boolean strict) {
        if (col >= tokens.size() || !tokens.get(col).tag().continuesDown()) {
            return false;
        }
        if (strict) {
            return true;
        }
        for (int offset = 1; offset < colspan; offset++) {
            int index = col + offset;
            if (index >= tokens.size() || !tokens.get(index).isContinuation()) {
                return false;
            }
        }
        return true;
    }
}
