package ai.tablecodec.converter.html;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tree parsers in order and returns the first outcome that yields rows. When none does, the outcome of
 * the last strategy is returned.
 */
public class TableTreeReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableTreeReader.class);

    private final List<TableTreeParser> strategies;

    public TableTreeReader() {
        this(List.of(new XmlTableTreeParser(), new JsoupTableTreeParser()));
    }

    public TableTreeReader(List<TableTreeParser> strategies) {
        if (Objects.requireNonNull(strategies, "strategies").isEmpty()) {
            throw new IllegalArgumentException("at least one parsing strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public ParseOutcome read(String html) {
        Objects.requireNonNull(html, "html");
        ParseOutcome outcome = null;
        for (int index = 0; index < strategies.size(); index++) {
            TableTreeParser parser = strategies.get(index);
            outcome = parser.parse(html);
            if (outcome.isParsed()) {
                if (index > 0) {
                    LOGGER.info("Table read with fallback parser '{}'", parser.name());
                }
                return outcome;
            }
            if (index < strategies.size() - 1) {
                LOGGER.info("Parser '{}' returned {} ({}); trying '{}'", parser.name(), outcome.status(),
                        outcome.reason(), strategies.get(index + 1).name());
            }
        }
        return outcome;
    }
}
