package ai.tablecodec.converter.otsl;

import java.util.List;

/**
 * Literal markup of the OTSL tag stream.
 */
public final class OtslSyntax {

    public static final String OPEN = "<otsl>";
    public static final String CLOSE = "</otsl>";
    public static final String NEW_ROW = "<nl>";
    public static final String CAPTION_OPEN = "<caption>";
    public static final String CAPTION_CLOSE = "</caption>";
    public static final String HAS_HEADER = "<has_thead>";
    public static final String HAS_BODY = "<has_tbody>";
    public static final String HAS_FOOTER = "<has_tfoot>";
    public static final String FOOTER_ROWS_OPEN = "<tfoot_rows>";
    public static final String FOOTER_ROWS_CLOSE = "</tfoot_rows>";

    public static final List<Integer> DEFAULT_GEOMETRY = List.of(0, 0, 500, 500);

    private OtslSyntax() {
    }

    public static String location(int value) {
        return "<loc_" + value + ">";
    }
}
