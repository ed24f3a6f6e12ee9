package ai.tablecodec.converter.html;

/**
 * Section wrapper a row was read from. {@code NONE} marks rows placed directly under the table element.
 */
public enum TableSection {
    HEADER,
    BODY,
    FOOTER,
    NONE
}
