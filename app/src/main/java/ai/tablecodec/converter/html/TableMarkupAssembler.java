package ai.tablecodec.converter.html;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects rows from a parsed table element in document order and emits them in canonical section order.
 */
final class TableMarkupAssembler {

    private final List<RowMarkup> headerRows = new ArrayList<>();
    private final List<RowMarkup> bodyRows = new ArrayList<>();
    private final List<RowMarkup> footerRows = new ArrayList<>();
    private Optional<String> caption = Optional.empty();
    private boolean explicitHeader;
    private boolean explicitBody;
    private boolean explicitFooter;

    void caption(String text) {
        if (caption.isEmpty()) {
            caption = Optional.of(text);
        }
    }

    void section(TableSection section) {
        switch (section) {
            case HEADER -> explicitHeader = true;
            case BODY -> explicitBody = true;
            case FOOTER -> explicitFooter = true;
            case NONE -> {
            }
        }
    }

    void row(TableSection section, List<CellMarkup> cells) {
        RowMarkup row = new RowMarkup(section, cells);
        switch (section) {
            case HEADER -> headerRows.add(row);
            case FOOTER -> footerRows.add(row);
            default -> bodyRows.add(row);
        }
    }

    TableMarkup build() {
        List<RowMarkup> rows = new ArrayList<>(headerRows.size() + bodyRows.size() + footerRows.size());
        rows.addAll(headerRows);
        rows.addAll(bodyRows);
        rows.addAll(footerRows);
        return new TableMarkup(caption, rows, explicitHeader, explicitBody, explicitFooter);
    }

    static TableSection sectionFor(String elementName) {
        return switch (elementName) {
            case "thead" -> TableSection.HEADER;
            case "tbody" -> TableSection.BODY;
            case "tfoot" -> TableSection.FOOTER;
            default -> TableSection.NONE;
        };
    }
}
