package ai.tablecodec.converter.html;

import ai.tablecodec.converter.model.HeaderType;
import java.util.Locale;

/**
 * Infers the header type of a tree cell from its element, section, position and {@code scope}.
 *
 * <ol>
 *   <li>a {@code th} with {@code scope="col|colgroup"} is a column header, {@code "row|rowgroup"} a row header</li>
 *   <li>any cell inside {@code thead} is a column header</li>
 *   <li>a {@code th} in a row made only of {@code th} elements is a column header</li>
 *   <li>a {@code th} in the first column is a row header, any other {@code th} a column header</li>
 *   <li>a {@code td} outside {@code thead} is not a header</li>
 * </ol>
 */
public final class HeaderClassifier {

    private HeaderClassifier() {
    }

    public static HeaderType classify(boolean headerElement, TableSection section, int column,
                                      boolean rowAllHeaders, String scope) {
        if (headerElement) {
            HeaderType scoped = fromScope(scope);
            if (scoped != HeaderType.NONE) {
                return scoped;
            }
        }
        if (section == TableSection.HEADER) {
            return HeaderType.COLUMN;
        }
        if (!headerElement) {
            return HeaderType.NONE;
        }
        if (rowAllHeaders) {
            return HeaderType.COLUMN;
        }
        return column == 0 ? HeaderType.ROW : HeaderType.COLUMN;
    }

    static HeaderType fromScope(String scope) {
        if (scope == null) {
            return HeaderType.NONE;
        }
        return switch (scope.trim().toLowerCase(Locale.ROOT)) {
            case "col", "colgroup" -> HeaderType.COLUMN;
            case "row", "rowgroup" -> HeaderType.ROW;
            default -> HeaderType.NONE;
        };
    }

    static String scopeFor(HeaderType type) {
        return switch (type) {
            case COLUMN -> "col";
            case ROW -> "row";
            case NONE -> "";
        };
    }
}
