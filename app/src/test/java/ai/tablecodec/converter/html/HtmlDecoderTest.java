package ai.tablecodec.converter.html;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.tablecodec.converter.error.OccupancyGapException;
import ai.tablecodec.converter.error.SpanOverflowException;
import ai.tablecodec.converter.error.StructuralException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.HeaderType;
import ai.tablecodec.converter.model.TableStructure;
import ai.tablecodec.converter.validate.StructureValidator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class HtmlDecoderTest {

    private final HtmlDecoder decoder = new HtmlDecoder();
    private final StructureValidator validator = new StructureValidator();

    @Test
    void decodesSectionedTable() {
        TableStructure table = decoder.decode("<table><thead><tr><th>Name</th><th>Age</th></tr></thead>"
                + "<tbody><tr><td>Bob</td><td>30</td></tr></tbody></table>", true);

        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.numCols()).isEqualTo(2);
        assertThat(table.hadHeaderSection()).isTrue();
        assertThat(table.hadBodySection()).isTrue();
        assertThat(table.hadFooterSection()).isFalse();
        assertThat(table.cells())
                .extracting(Cell::rowIdx, Cell::colIdx, Cell::content, Cell::headerType)
                .containsExactly(
                        tuple(0, 0, "Name", HeaderType.COLUMN),
                        tuple(0, 1, "Age", HeaderType.COLUMN),
                        tuple(1, 0, "Bob", HeaderType.NONE),
                        tuple(1, 1, "30", HeaderType.NONE));
    }

    @Test
    void placesCellsAroundEarlierSpans() {
        TableStructure table = decoder.decode("<table>"
                + "<tr><td rowspan=\"2\" colspan=\"2\">X</td><td>a</td></tr>"
                + "<tr><td>b</td></tr>"
                + "<tr><td>c</td><td>d</td><td>e</td></tr></table>", true);

        assertThat(table.numCols()).isEqualTo(3);
        assertThat(table.cells().get(0)).isEqualTo(new Cell(0, 0, 2, 2, "X", HeaderType.NONE));
        assertThat(table.originAt(1, 2)).map(Cell::content).contains("b");
        assertThat(table.hadBodySection()).isFalse();
    }

    @Test
    void classifiesHeaderCellsByPositionAndScope() {
        TableStructure table = decoder.decode("<table>"
                + "<tr><th>Region</th><th>Sales</th></tr>"
                + "<tr><th>North</th><td>10</td></tr>"
                + "<tr><td>x</td><th>mid</th></tr>"
                + "<tr><th scope=\"col\">Forced</th><td>1</td></tr></table>", true);

        assertThat(table.cells())
                .extracting(Cell::content, Cell::headerType)
                .containsExactly(
                        tuple("Region", HeaderType.COLUMN),
                        tuple("Sales", HeaderType.COLUMN),
                        tuple("North", HeaderType.ROW),
                        tuple("10", HeaderType.NONE),
                        tuple("x", HeaderType.NONE),
                        tuple("mid", HeaderType.COLUMN),
                        tuple("Forced", HeaderType.COLUMN),
                        tuple("1", HeaderType.NONE));
    }

    @Test
    void ordersRowsHeaderBodyFooterAndRecordsFooterIndices() {
        TableStructure table = decoder.decode("<table><caption>  Annual\n  totals </caption>"
                + "<tfoot><tr><td>Sum</td></tr></tfoot>"
                + "<tbody><tr><td>1</td></tr></tbody>"
                + "<thead><tr><td>Head</td></tr></thead></table>", true);

        assertThat(table.caption()).contains("Annual totals");
        assertThat(table.cells()).extracting(Cell::content).containsExactly("Head", "1", "Sum");
        assertThat(table.footerRowIndices()).containsExactly(2);
        assertThat(table.originAt(0, 0)).map(Cell::headerType).contains(HeaderType.COLUMN);
    }

    @Test
    void collapsesWhitespaceInCellText() {
        TableStructure table = decoder.decode("<table><tr><td>  multi\n\t line <b>bold</b>  </td></tr></table>", true);

        assertThat(table.cells().get(0).content()).isEqualTo("multi line bold");
    }

    @Test
    void readsEscapedQuoteSpanAttributes() throws IOException {
        TableStructure table = decoder.decode(fixture("escaped_quotes.html"), true);

        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.numCols()).isEqualTo(2);
        assertThat(table.cells().get(0)).isEqualTo(new Cell(0, 0, 1, 2, "Wide", HeaderType.COLUMN));
    }

    @Test
    void fallsBackForMalformedCaption() throws IOException {
        TableStructure table = decoder.decode(fixture("malformed_caption.html"), true);

        assertThat(table.caption()).contains("Table Caption");
        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.hadBodySection()).isFalse();
    }

    @Test
    void strictRejectsTableMissingItsClosingTag() {
        Throwable thrown = catchThrowable(() -> decoder.decode("<table><tr><td>A</td><td>B</td></tr>", true));

        assertThat(thrown).isInstanceOf(StructuralException.class).hasMessage("Missing closing </table> tag");
        assertThat(decoder.decode("<table><tr><td>A</td><td>B</td></tr>", false).cells())
                .extracting(Cell::content)
                .containsExactly("A", "B");
    }

    @Test
    void strictRejectsInputCutOffInsideACell() throws IOException {
        assertThat(catchThrowable(() -> decoder.decode("<table><tr><td>A</td><td>B", true)))
                .isInstanceOf(StructuralException.class)
                .hasMessage("Missing closing </table> tag");
        assertThat(catchThrowable(() -> decoder.decode(fixture("truncated_midcell.html"), true)))
                .isInstanceOf(StructuralException.class);
        assertThat(catchThrowable(() -> decoder.decode("<table><tr><td>A</td></tr><tr><td>B</table>", true)))
                .isInstanceOf(StructuralException.class)
                .hasMessage("Unclosed <tr> tags");
    }

    @Test
    void strictStillFallsBackForClosedTableWithUnbalancedInlineMarkup() {
        TableStructure table = decoder.decode("<table><tr><td><b>bold</td><td>x<br></td></tr></table>", true);

        assertThat(table.cells()).extracting(Cell::content).containsExactly("bold", "x");
    }

    @Test
    void lenientClampsRowspanOnLastRow() {
        String html = "<table><tr><td>1</td></tr><tr><td>2</td></tr><tr><td>3</td></tr><tr><td>4</td></tr>"
                + "<tr><td rowspan=\"2\">5</td></tr></table>";

        TableStructure table = decoder.decode(html, false);

        assertThat(table.numRows()).isEqualTo(5);
        assertThat(table.originAt(4, 0)).map(Cell::rowspan).contains(1);
        assertThat(validator.validate(table)).isEmpty();
        assertThat(catchThrowable(() -> decoder.decode(html, true))).isInstanceOf(SpanOverflowException.class);
    }

    @Test
    void lenientRemovesEmptyRowAndShrinksRowspan() {
        String html = "<table><tr><td rowspan=\"2\">A</td><td>B</td></tr><tr></tr>"
                + "<tr><td>C</td><td>D</td></tr></table>";

        TableStructure table = decoder.decode(html, false);

        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.cells())
                .extracting(Cell::rowIdx, Cell::colIdx, Cell::rowspan, Cell::content)
                .containsExactly(tuple(0, 0, 1, "A"), tuple(0, 1, 1, "B"), tuple(1, 0, 1, "C"), tuple(1, 1, 1, "D"));
        assertThat(catchThrowable(() -> decoder.decode(html, true))).isInstanceOf(OccupancyGapException.class);
    }

    @Test
    void lenientRecoversTruncatedTable() throws IOException {
        TableStructure table = decoder.decode(fixture("truncated_midcell.html"), false);

        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.numCols()).isEqualTo(2);
        assertThat(table.originAt(1, 0)).map(Cell::content).contains("C");
        assertThat(table.originAt(1, 1)).contains(Cell.empty(1, 1));
        assertThat(validator.validate(table)).isEmpty();
    }

    @Test
    void lenientShrinksColspanThatRunsIntoEarlierRowspan() {
        TableStructure table = decoder.decode("<table><tr><td>a</td><td rowspan=\"2\">b</td><td>c</td></tr>"
                + "<tr><td colspan=\"2\">wide</td><td>z</td></tr></table>", false);

        assertThat(table.originAt(1, 0)).map(Cell::colspan).contains(1);
        assertThat(table.originAt(1, 2)).map(Cell::content).contains("z");
        assertThat(validator.validate(table)).isEmpty();
    }

    @Test
    void reportsMissingTable() {
        assertThat(catchThrowable(() -> decoder.decode("<p>no table here</p>", true)))
                .isInstanceOf(StructuralException.class)
                .hasMessage("No table element found");

        TableStructure lenient = decoder.decode("<p>no table here</p>", false);

        assertThat(lenient.cells()).containsExactly(Cell.empty(0, 0));
    }

    @Test
    void reportsTableWithoutRows() {
        assertThat(catchThrowable(() -> decoder.decode("<table></table>", true)))
                .isInstanceOf(StructuralException.class)
                .hasMessage("Table has no rows");
        assertThat(decoder.decode("<table><caption>c</caption></table>", false).caption()).contains("c");
    }

    private static String fixture(String name) throws IOException {
        try (InputStream stream = HtmlDecoderTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(stream).as("fixture %s", name).isNotNull();
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
