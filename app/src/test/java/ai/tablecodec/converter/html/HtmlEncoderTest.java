package ai.tablecodec.converter.html;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.tablecodec.converter.error.OccupancyGapException;
import ai.tablecodec.converter.model.Cell;
import ai.tablecodec.converter.model.HeaderType;
import ai.tablecodec.converter.model.TableStructure;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HtmlEncoderTest {

    private final HtmlEncoder encoder = new HtmlEncoder();

    @Test
    void encodesBareRowsWithoutSectionFlags() {
        TableStructure table = TableStructure.of(1, 2, List.of(Cell.of(0, 0, "A"), Cell.of(0, 1, "B")));

        assertThat(encoder.encode(table, true)).isEqualTo("<table><tr><td>A</td><td>B</td></tr></table>");
    }

    @Test
    void wrapsLeadingColumnHeaderRowsInThead() {
        TableStructure table = new TableStructure(2, 2, List.of(
                new Cell(0, 0, 1, 1, "Name", HeaderType.COLUMN),
                new Cell(0, 1, 1, 1, "Age", HeaderType.COLUMN),
                Cell.of(1, 0, "Bob"),
                Cell.of(1, 1, "30")),
                Optional.of("People"), true, true, false, List.of(), List.of());

        assertThat(encoder.encode(table, true)).isEqualTo("<table><caption>People</caption>"
                + "<thead><tr><th>Name</th><th>Age</th></tr></thead>"
                + "<tbody><tr><td>Bob</td><td>30</td></tr></tbody></table>");
    }

    @Test
    void writesSpanAttributesOnlyWhenGreaterThanOne() {
        TableStructure table = TableStructure.of(2, 3, List.of(
                new Cell(0, 0, 2, 2, "X", HeaderType.NONE),
                Cell.of(0, 2, "a"),
                Cell.of(1, 2, "b")));

        assertThat(encoder.encode(table, true)).isEqualTo(
                "<table><tr><td rowspan=\"2\" colspan=\"2\">X</td><td>a</td></tr><tr><td>b</td></tr></table>");
    }

    @Test
    void addsScopeWhenPositionWouldImplyAnotherHeaderType() {
        TableStructure table = TableStructure.of(2, 2, List.of(
                new Cell(0, 0, 1, 1, "Col", HeaderType.COLUMN),
                Cell.of(0, 1, "v"),
                new Cell(1, 0, 1, 1, "Row", HeaderType.ROW),
                new Cell(1, 1, 1, 1, "Row too", HeaderType.ROW)));

        assertThat(encoder.encode(table, true)).isEqualTo("<table>"
                + "<tr><th scope=\"col\">Col</th><td>v</td></tr>"
                + "<tr><th scope=\"row\">Row</th><th scope=\"row\">Row too</th></tr></table>");
    }

    @Test
    void placesFooterRowsInTfoot() {
        TableStructure table = new TableStructure(2, 1, List.of(Cell.of(0, 0, "1"), Cell.of(1, 0, "Sum")),
                Optional.empty(), false, false, true, List.of(1), List.of());

        assertThat(encoder.encode(table, true)).isEqualTo(
                "<table><tr><td>1</td></tr><tfoot><tr><td>Sum</td></tr></tfoot></table>");
    }

    @Test
    void writesEmptyRowUnderFullRowspanThatOnlyStrictDecodingKeeps() {
        TableStructure table = TableStructure.of(2, 1, List.of(new Cell(0, 0, 2, 1, "A", HeaderType.NONE)));

        String html = encoder.encode(table, true);
        HtmlDecoder decoder = new HtmlDecoder();

        assertThat(html).isEqualTo("<table><tr><td rowspan=\"2\">A</td></tr><tr></tr></table>");
        assertThat(decoder.decode(html, true)).isEqualTo(table);
        assertThat(decoder.decode(html, false).numRows()).isEqualTo(1);
    }

    @Test
    void escapesMarkupInContent() {
        TableStructure table = TableStructure.of(1, 1, List.of(Cell.of(0, 0, "a < b & \"c\"")));

        assertThat(encoder.encode(table, true)).isEqualTo("<table><tr><td>a &lt; b &amp; \"c\"</td></tr></table>");
    }

    @Test
    void strictRefusesGapsButLenientFillsThem() {
        TableStructure table = TableStructure.of(1, 2, List.of(Cell.of(0, 0, "A")));

        assertThat(catchThrowable(() -> encoder.encode(table, true))).isInstanceOf(OccupancyGapException.class);
        assertThat(encoder.encode(table, false)).isEqualTo("<table><tr><td>A</td><td></td></tr></table>");
    }
}
