package ai.tablecodec.converter.html;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parser-neutral view of one table element: rows in header, body, footer order plus the wrappers seen.
 */
public record TableMarkup(Optional<String> caption,
                          List<RowMarkup> rows,
                          boolean explicitHeader,
                          boolean explicitBody,
                          boolean explicitFooter) {

    public TableMarkup {
        caption = Objects.requireNonNull(caption, "caption")
                .map(CellMarkup::normalizeText)
                .filter(value -> !value.isEmpty());
        rows = List.copyOf(rows);
    }

    public boolean hasRows() {
        return !rows.isEmpty();
    }
}
