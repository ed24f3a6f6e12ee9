package ai.tablecodec.converter.html;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TableTreeReaderTest {

    private static final TableMarkup ONE_ROW = new TableMarkup(Optional.empty(),
            List.of(new RowMarkup(TableSection.NONE, List.of(new CellMarkup(false, "A", "", "", "")))),
            false, false, false);

    @Test
    void returnsPrimaryResultWithoutTryingFallback() {
        RecordingParser primary = new RecordingParser("primary", ParseOutcome.parsed(ONE_ROW));
        RecordingParser fallback = new RecordingParser("fallback", ParseOutcome.parsed(ONE_ROW));

        ParseOutcome outcome = new TableTreeReader(List.of(primary, fallback)).read("<table/>");

        assertThat(outcome.isParsed()).isTrue();
        assertThat(primary.inputs).containsExactly("<table/>");
        assertThat(fallback.inputs).isEmpty();
    }

    @Test
    void triesFallbackWhenPrimaryFails() {
        RecordingParser primary = new RecordingParser("primary", ParseOutcome.failed("broken"));
        RecordingParser fallback = new RecordingParser("fallback", ParseOutcome.parsed(ONE_ROW));

        ParseOutcome outcome = new TableTreeReader(List.of(primary, fallback)).read("<table>");

        assertThat(outcome.markup()).contains(ONE_ROW);
        assertThat(fallback.inputs).containsExactly("<table>");
    }

    @Test
    void triesFallbackWhenPrimaryFindsNoRows() {
        RecordingParser primary = new RecordingParser("primary", ParseOutcome.empty("Table has no rows", null));
        RecordingParser fallback = new RecordingParser("fallback", ParseOutcome.parsed(ONE_ROW));

        assertThat(new TableTreeReader(List.of(primary, fallback)).read("x").isParsed()).isTrue();
    }

    @Test
    void reportsLastOutcomeWhenEveryStrategyComesUpEmpty() {
        RecordingParser primary = new RecordingParser("primary", ParseOutcome.failed("broken"));
        RecordingParser fallback = new RecordingParser("fallback", ParseOutcome.empty("No table element found", null));

        ParseOutcome outcome = new TableTreeReader(List.of(primary, fallback)).read("x");

        assertThat(outcome.status()).isEqualTo(ParseOutcome.Status.EMPTY);
        assertThat(outcome.reason()).isEqualTo("No table element found");
    }

    @Test
    void defaultStrategiesRecoverUnbalancedMarkup() {
        ParseOutcome outcome = new TableTreeReader().read("<table><tr><td>A<td>B</table>");

        assertThat(outcome.isParsed()).isTrue();
        assertThat(outcome.markup().orElseThrow().rows().get(0).cells())
                .extracting(CellMarkup::text)
                .containsExactly("A", "B");
    }

    private static final class RecordingParser implements TableTreeParser {
        private final String name;
        private final ParseOutcome outcome;
        private final List<String> inputs = new ArrayList<>();

        private RecordingParser(String name, ParseOutcome outcome) {
            this.name = name;
            this.outcome = outcome;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ParseOutcome parse(String html) {
            inputs.add(html);
            return outcome;
        }
    }
}
