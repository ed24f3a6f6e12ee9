package ai.tablecodec.converter.html;

import ai.tablecodec.converter.error.TableViolationException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.HeaderType;
import ai.tablecodec.converter.model.OccupancyGrid;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.validate.StructureValidator;
import ai.tablecodec.converter.validate.Violation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link TableStructure} as a compact HTML table.
 *
 * <p>A {@code thead} holds the leading rows made entirely of column headers; footer rows go to
 * {@code tfoot}; the remaining rows sit in {@code tbody} only when the source had one. Header cells carry
 * a {@code scope} attribute only where {@link HeaderClassifier} would otherwise read them differently.</p>
 *
 * <p>A row covered entirely by rowspans from rows above has no cell of its own and is written as an empty
 * {@code <tr></tr>}. Strict decoding reads it back unchanged; lenient decoding drops empty rows and shortens
 * the rowspans, so exact round trips of such tables require strict mode.</p>
 */
public class HtmlEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlEncoder.class);

    private final StructureValidator validator;

    public HtmlEncoder() {
        this(new StructureValidator());
    }

    public HtmlEncoder(StructureValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public String encode(TableStructure table, boolean strict) {
        Objects.requireNonNull(table, "table");
        if (strict) {
            List<Violation> violations = validator.validate(table);
            if (!violations.isEmpty()) {
                throw TableViolationException.forViolations(violations);
            }
        }

        Document document = new Document("");
        document.outputSettings()
                .prettyPrint(false)
                .escapeMode(Entities.EscapeMode.xhtml);
        Element tableElement = document.appendElement("table");
        table.caption().ifPresent(caption -> tableElement.appendElement("caption").text(caption));

        OccupancyGrid grid = OccupancyGrid.of(table);
        RowLayout layout = RowLayout.of(table, grid);

        if (table.hadHeaderSection()) {
            Element head = tableElement.appendElement("thead");
            layout.headerRows.forEach(row -> appendRow(head, table, grid, row, TableSection.HEADER));
        }
        Element bodyParent = table.hadBodySection() ? tableElement.appendElement("tbody") : tableElement;
        layout.bodyRows.forEach(row -> appendRow(bodyParent, table, grid, row, TableSection.BODY));
        if (table.hadFooterSection()) {
            Element foot = tableElement.appendElement("tfoot");
            layout.footerRows.forEach(row -> appendRow(foot, table, grid, row, TableSection.FOOTER));
        }
        return tableElement.outerHtml();
    }

    private void appendRow(Element parent, TableStructure table, OccupancyGrid grid, int row, TableSection section) {
        List<PlacedCell> placed = new ArrayList<>();
        for (int col = 0; col < table.numCols(); col++) {
            int owner = grid.ownerAt(row, col);
            if (owner == OccupancyGrid.UNCOVERED) {
                LOGGER.debug("Emitting empty cell for uncovered position ({}, {})", row, col);
                placed.add(new PlacedCell(Cell.empty(row, col), 1, 1));
                continue;
            }
            Cell cell = table.cells().get(owner);
            if (cell.isOriginAt(row, col)) {
                placed.add(new PlacedCell(cell, visibleRowspan(grid, owner, row, col), visibleColspan(grid, owner, row, col)));
            }
        }

        boolean allHeaders = placed.stream().allMatch(item -> item.cell.isHeader());
        Element rowElement = parent.appendElement("tr");
        for (PlacedCell item : placed) {
            Cell cell = item.cell;
            Element cellElement = rowElement.appendElement(cell.isHeader() ? "th" : "td");
            if (cell.isHeader()) {
                HeaderType inferred = HeaderClassifier.classify(true, section, cell.colIdx(), allHeaders, null);
                if (inferred != cell.headerType()) {
                    cellElement.attr("scope", HeaderClassifier.scopeFor(cell.headerType()));
                }
            }
            if (item.rowspan > 1) {
                cellElement.attr("rowspan", String.valueOf(item.rowspan));
            }
            if (item.colspan > 1) {
                cellElement.attr("colspan", String.valueOf(item.colspan));
            }
            cellElement.text(cell.content());
        }
    }

    private static int visibleRowspan(OccupancyGrid grid, int owner, int row, int col) {
        int span = 1;
        while (grid.ownerAt(row + span, col) == owner) {
            span++;
        }
        return span;
    }

    private static int visibleColspan(OccupancyGrid grid, int owner, int row, int col) {
        int span = 1;
        while (grid.ownerAt(row, col + span) == owner) {
            span++;
        }
        return span;
    }

    private record PlacedCell(Cell cell, int rowspan, int colspan) {
    }

    private static final class RowLayout {
        private final List<Integer> headerRows = new ArrayList<>();
        private final List<Integer> bodyRows = new ArrayList<>();
        private final List<Integer> footerRows = new ArrayList<>();

        static RowLayout of(TableStructure table, OccupancyGrid grid) {
            RowLayout layout = new RowLayout();
            Set<Integer> footer = new HashSet<>();
            if (table.hadFooterSection()) {
                table.footerRowIndices().stream()
                        .filter(row -> row >= 0 && row < table.numRows())
                        .forEach(footer::add);
            }
            boolean leading = table.hadHeaderSection();
            for (int row = 0; row < table.numRows(); row++) {
                if (footer.contains(row)) {
                    layout.footerRows.add(row);
                    continue;
                }
                if (leading && isColumnHeaderRow(table, grid, row)) {
                    layout.headerRows.add(row);
                    continue;
                }
                leading = false;
                layout.bodyRows.add(row);
            }
            return layout;
        }

        private static boolean isColumnHeaderRow(TableStructure table, OccupancyGrid grid, int row) {
            if (table.numCols() == 0) {
                return false;
            }
            for (int col = 0; col < table.numCols(); col++) {
                int owner = grid.ownerAt(row, col);
                if (owner == OccupancyGrid.UNCOVERED || table.cells().get(owner).headerType() != HeaderType.COLUMN) {
                    return false;
                }
            }
            return true;
        }
    }
}
