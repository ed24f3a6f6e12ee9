package ai.tablecodec.converter.html;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Fallback tree parser backed by jsoup's HTML5 tree builder, which closes unbalanced and truncated markup.
 *
 * <p>The HTML5 algorithm inserts a {@code tbody} around bare rows, so a body section only counts as
 * explicit when the source text actually contains one.</p>
 */
public class JsoupTableTreeParser implements TableTreeParser {

    private static final Pattern SOURCE_TBODY = Pattern.compile("<tbody[\\s>/]", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "jsoup";
    }

    @Override
    public ParseOutcome parse(String html) {
        Document document = Jsoup.parse(html);
        Element table = document.selectFirst("table");
        if (table == null) {
            return ParseOutcome.empty("No table element found", null);
        }
        boolean sourceHasBody = SOURCE_TBODY.matcher(html).find();

        TableMarkupAssembler assembler = new TableMarkupAssembler();
        for (Element child : table.children()) {
            String name = child.normalName();
            switch (name) {
                case "caption" -> assembler.caption(child.text());
                case "tr" -> assembler.row(TableSection.NONE, readCells(child));
                case "thead", "tbody", "tfoot" -> {
                    TableSection section = TableMarkupAssembler.sectionFor(name);
                    if (section == TableSection.BODY && !sourceHasBody) {
                        section = TableSection.NONE;
                    }
                    assembler.section(section);
                    for (Element row : child.children()) {
                        if ("tr".equals(row.normalName())) {
                            assembler.row(section, readCells(row));
                        }
                    }
                }
                default -> {
                }
            }
        }
        return ParseOutcome.of(assembler.build());
    }

    private List<CellMarkup> readCells(Element row) {
        List<CellMarkup> cells = new ArrayList<>();
        for (Element element : row.children()) {
            String name = element.normalName();
            if ("td".equals(name) || "th".equals(name)) {
                cells.add(new CellMarkup("th".equals(name), element.text(),
                        element.attr("rowspan"), element.attr("colspan"), element.attr("scope")));
            }
        }
        return cells;
    }
}
