package ai.tablecodec.converter.html;

import java.util.List;
import java.util.Objects;

/**
 * A {@code tr} element with its direct cell children.
 */
public record RowMarkup(TableSection section, List<CellMarkup> cells) {

    public RowMarkup {
        Objects.requireNonNull(section, "section");
        cells = List.copyOf(cells);
    }

    public boolean allHeaderElements() {
        return !cells.isEmpty() && cells.stream().allMatch(CellMarkup::headerElement);
    }
}
