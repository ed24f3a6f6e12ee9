package ai.tablecodec.converter.model;

/**
 * Row and column extent of a cell.
 */
public record Span(int rowspan, int colspan) {

    public Span {
        if (rowspan < 1 || colspan < 1) {
            throw new IllegalArgumentException("spans must be at least 1: " + rowspan + "x" + colspan);
        }
    }
}
