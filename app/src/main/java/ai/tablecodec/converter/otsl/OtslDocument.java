package ai.tablecodec.converter.otsl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tokenized tag stream: preamble metadata plus rows of cell tokens.
 */
public record OtslDocument(Optional<String> caption,
                           boolean hasHeader,
                           boolean hasBody,
                           boolean hasFooter,
                           List<Integer> footerRows,
                           List<Integer> geometry,
                           List<List<OtslToken>> rows) {

    public OtslDocument {
        caption = Objects.requireNonNull(caption, "caption");
        footerRows = List.copyOf(footerRows);
        geometry = List.copyOf(geometry);
        rows = rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public int widestRow() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }
}
