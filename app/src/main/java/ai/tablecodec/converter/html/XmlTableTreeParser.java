package ai.tablecodec.converter.html;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Primary tree parser. Treats the markup as well-formed XML and fails fast on anything else, which leaves
 * malformed or truncated input to the fallback parser.
 */
public class XmlTableTreeParser implements TableTreeParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(XmlTableTreeParser.class);

    private static final ErrorHandler FAIL_ON_ERROR = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            LOGGER.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    @Override
    public String name() {
        return "xml";
    }

    @Override
    public ParseOutcome parse(String html) {
        Document document;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            document = builder.parse(new InputSource(new StringReader(html.strip())));
        } catch (SAXException ex) {
            return ParseOutcome.failed("Markup is not well-formed: " + ex.getMessage());
        } catch (IOException ex) {
            return ParseOutcome.failed("Unable to read markup: " + ex.getMessage());
        }

        Element table = findTable(document.getDocumentElement());
        if (table == null) {
            return ParseOutcome.empty("No table element found", null);
        }
        return ParseOutcome.of(read(table));
    }

    private TableMarkup read(Element table) {
        TableMarkupAssembler assembler = new TableMarkupAssembler();
        for (Element child : childElements(table)) {
            String name = nameOf(child);
            switch (name) {
                case "caption" -> assembler.caption(child.getTextContent());
                case "tr" -> assembler.row(TableSection.NONE, readCells(child));
                case "thead", "tbody", "tfoot" -> {
                    TableSection section = TableMarkupAssembler.sectionFor(name);
                    assembler.section(section);
                    for (Element row : childElements(child)) {
                        if ("tr".equals(nameOf(row))) {
                            assembler.row(section, readCells(row));
                        }
                    }
                }
                default -> LOGGER.debug("Skipping <{}> inside table", name);
            }
        }
        return assembler.build();
    }

    private List<CellMarkup> readCells(Element row) {
        List<CellMarkup> cells = new ArrayList<>();
        for (Element element : childElements(row)) {
            String name = nameOf(element);
            if ("td".equals(name) || "th".equals(name)) {
                cells.add(new CellMarkup("th".equals(name), element.getTextContent(),
                        attribute(element, "rowspan"), attribute(element, "colspan"), attribute(element, "scope")));
            }
        }
        return cells;
    }

    private static Element findTable(Element element) {
        if (element == null) {
            return null;
        }
        if ("table".equals(nameOf(element))) {
            return element;
        }
        for (Element child : childElements(element)) {
            Element found = findTable(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static List<Element> childElements(Element parent) {
        NodeList nodes = parent.getChildNodes();
        List<Element> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static String nameOf(Element element) {
        return element.getTagName().toLowerCase(Locale.ROOT);
    }

    private static String attribute(Element element, String name) {
        if (element.hasAttribute(name)) {
            return element.getAttribute(name);
        }
        String upper = name.toUpperCase(Locale.ROOT);
        return element.hasAttribute(upper) ? element.getAttribute(upper) : "";
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(FAIL_ON_ERROR);
            return builder;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support the required features", ex);
        }
    }
}
