package ai.tablecodec.converter.model;

/**
 * Header classification of a cell.
 */
public enum HeaderType {
    NONE,
    COLUMN,
    ROW;

    public boolean isHeader() {
        return this != NONE;
    }
}
