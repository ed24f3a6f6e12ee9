package ai.tablecodec.converter.model;

import java.util.Objects;

/**
 * A logical table cell anchored at its top-left grid position. Content is stripped of surrounding whitespace.
 */
public record Cell(int rowIdx, int colIdx, int rowspan, int colspan, String content, HeaderType headerType) {

    public Cell {
        if (rowIdx < 0 || colIdx < 0) {
            throw new IllegalArgumentException("cell origin must be non-negative: (" + rowIdx + ", " + colIdx + ")");
        }
        if (rowspan < 1 || colspan < 1) {
            throw new IllegalArgumentException("cell spans must be at least 1: rowspan=" + rowspan + ", colspan=" + colspan);
        }
        content = content == null ? "" : content.strip();
        Objects.requireNonNull(headerType, "headerType");
    }

    public static Cell of(int rowIdx, int colIdx, String content) {
        return new Cell(rowIdx, colIdx, 1, 1, content, HeaderType.NONE);
    }

    public static Cell empty(int rowIdx, int colIdx) {
        return new Cell(rowIdx, colIdx, 1, 1, "", HeaderType.NONE);
    }

    public boolean covers(int row, int col) {
        return row >= rowIdx && row < rowEnd() && col >= colIdx && col < colEnd();
    }

    public boolean isOriginAt(int row, int col) {
        return rowIdx == row && colIdx == col;
    }

    /** Exclusive end row of the covered rectangle. */
    public int rowEnd() {
        return rowIdx + rowspan;
    }

    /** Exclusive end column of the covered rectangle. */
    public int colEnd() {
        return colIdx + colspan;
    }

    public boolean isHeader() {
        return headerType.isHeader();
    }

    public Cell withSpans(int newRowspan, int newColspan) {
        return new Cell(rowIdx, colIdx, newRowspan, newColspan, content, headerType);
    }
}
