package ai.tablecodec.converter.html;

/**
 * One strategy for reading the first table element out of tree markup. Implementations never throw for
 * malformed input; they report it through the outcome.
 */
public interface TableTreeParser {

    String name();

    ParseOutcome parse(String html);
}
