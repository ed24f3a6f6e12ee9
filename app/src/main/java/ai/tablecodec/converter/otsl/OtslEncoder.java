package ai.tablecodec.converter.otsl;

import ai.tablecodec.converter.error.TableViolationException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.OccupancyGrid;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link TableStructure} as an OTSL tag stream.
 *
 * <p>Positions are emitted row-major from the occupancy grid. In lenient mode uncovered positions become
 * {@code ecel}, spans are cut at the grid edge and the first cell claiming a position keeps it.</p>
 */
public class OtslEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OtslEncoder.class);

    private final StructureValidator validator;
    private final List<Integer> defaultGeometry;
    private final boolean includeLocation;

    public OtslEncoder() {
        this(new StructureValidator(), OtslSyntax.DEFAULT_GEOMETRY);
    }

    public OtslEncoder(StructureValidator validator, List<Integer> defaultGeometry) {
        this(validator, defaultGeometry, true);
    }

    /**
     * @param includeLocation whether {@code <loc_N>} tokens are written; when {@code false} both stored and
     *                        default geometry are left out
     */
    public OtslEncoder(StructureValidator validator, List<Integer> defaultGeometry, boolean includeLocation) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.defaultGeometry = List.copyOf(Objects.requireNonNull(defaultGeometry, "defaultGeometry"));
        this.includeLocation = includeLocation;
    }

    public String encode(TableStructure table, boolean strict) {
        Objects.requireNonNull(table, "table");
        if (strict) {
            List<Violation> violations = validator.validate(table);
            if (!violations.isEmpty()) {
                throw TableViolationException.forViolations(violations);
            }
        }

        StringBuilder builder = new StringBuilder(64 + table.cells().size() * 16);
        builder.append(OtslSyntax.OPEN);
        appendPreamble(builder, table);

        List<Cell> cells = table.cells();
        OccupancyGrid grid = OccupancyGrid.of(table);
        int gaps = 0;
        for (int row = 0; row < table.numRows(); row++) {
            for (int col = 0; col < table.numCols(); col++) {
                int owner = grid.ownerAt(row, col);
                if (owner == OccupancyGrid.UNCOVERED) {
                    builder.append(OtslTag.EMPTY.markup());
                    gaps++;
                    continue;
                }
                Cell cell = cells.get(owner);
                if (cell.isOriginAt(row, col)) {
                    OtslTag tag = OtslTag.originFor(cell.headerType(), cell.content());
                    builder.append(tag.markup());
                    if (tag != OtslTag.EMPTY) {
                        builder.append(cell.content());
                    }
                } else if (cell.rowIdx() < row && cell.colIdx() < col) {
                    builder.append(OtslTag.CROSS.markup());
                } else if (cell.rowIdx() < row) {
                    builder.append(OtslTag.UP.markup());
                } else {
                    builder.append(OtslTag.LEFT.markup());
                }
            }
            builder.append(OtslSyntax.NEW_ROW);
        }
        builder.append(OtslSyntax.CLOSE);
        if (gaps > 0) {
            LOGGER.debug("Emitted {} empty cell(s) for uncovered positions", gaps);
        }
        return builder.toString();
    }

    private void appendPreamble(StringBuilder builder, TableStructure table) {
        table.caption().ifPresent(caption -> builder.append(OtslSyntax.CAPTION_OPEN)
                .append(caption)
                .append(OtslSyntax.CAPTION_CLOSE));
        if (table.hadHeaderSection()) {
            builder.append(OtslSyntax.HAS_HEADER);
        }
        if (table.hadBodySection()) {
            builder.append(OtslSyntax.HAS_BODY);
        }
        if (table.hadFooterSection()) {
            builder.append(OtslSyntax.HAS_FOOTER);
            List<Integer> footerRows = table.footerRowIndices().stream()
                    .filter(row -> row < table.numRows())
                    .collect(Collectors.toList());
            if (!footerRows.isEmpty()) {
                builder.append(OtslSyntax.FOOTER_ROWS_OPEN)
                        .append(footerRows.stream().map(String::valueOf).collect(Collectors.joining(",")))
                        .append(OtslSyntax.FOOTER_ROWS_CLOSE);
            }
        }
        if (!includeLocation) {
            return;
        }
        List<Integer> geometry = table.geometry().isEmpty() ? defaultGeometry : table.geometry();
        geometry.forEach(value -> builder.append(OtslSyntax.location(value)));
    }
}
