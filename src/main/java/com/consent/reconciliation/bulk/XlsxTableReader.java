package com.consent.reconciliation.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Excel workbook (.xlsx) table reader.
 *
 * <p>Reads one worksheet: the sheet named by {@code preferredSheet} when the workbook
 * has it, the first sheet otherwise. The first non-blank row is the header row and
 * blank rows are skipped; row line numbers are the Excel row numbers. Shared and
 * inline strings are resolved. Numeric cells formatted as dates are rendered as
 * ISO dates ({@code 2020-06-01}), other numbers as stored, booleans as
 * {@code true}/{@code false}.</p>
 *
 * <p>The workbook is binary, so only {@link #read(InputStream, String)} and
 * {@link #read(Path)} are supported.</p>
 */
public class XlsxTableReader implements TableReader {
    private static final Logger log = LoggerFactory.getLogger(XlsxTableReader.class);

    private static final String REL_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private final String preferredSheet;

    /**
     * Creates a reader for the first sheet of a workbook.
     */
    public XlsxTableReader() {
        this(null);
    }

    /**
     * @param preferredSheet sheet to read when present (case-insensitive), may be null
     */
    public XlsxTableReader(String preferredSheet) {
        this.preferredSheet = preferredSheet;
    }

    @Override
    public RawTable read(Reader reader, String source) {
        throw new TableReadException("Cannot read " + source + " as text: xlsx workbooks are binary");
    }

    @Override
    public RawTable read(InputStream input, String source) {
        Map<String, byte[]> entries;
        try {
            entries = unzip(input);
        } catch (IOException e) {
            log.error("table.read.failed source={} error={}", source, e.getMessage());
            throw new TableReadException("IO error reading " + source + ": " + e.getMessage(), e);
        }
        if (!entries.containsKey("xl/workbook.xml")) {
            throw new TableReadException(source + " is not an xlsx workbook");
        }

        try {
            DocumentBuilder builder = newDocumentBuilder();
            String sheetEntry = selectSheet(builder, entries, source);
            if (sheetEntry == null || !entries.containsKey(sheetEntry)) {
                log.info("table.read source={} format=xlsx rows=0", source);
                return RawTable.empty(source);
            }
            List<String> sharedStrings = sharedStrings(builder, entries.get("xl/sharedStrings.xml"));
            StyleTable styles = StyleTable.parse(builder, entries.get("xl/styles.xml"));
            return readSheet(builder, entries.get(sheetEntry), sharedStrings, styles, source);
        } catch (SAXException | IOException | NumberFormatException e) {
            log.error("table.read.failed source={} error={}", source, e.getMessage());
            throw new TableReadException("Invalid xlsx in " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RawTable read(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return read(input, path.getFileName().toString());
        } catch (IOException e) {
            throw new TableReadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getFormat() {
        return "xlsx";
    }

    private static Map<String, byte[]> unzip(InputStream input) throws IOException {
        Map<String, byte[]> entries = new HashMap<>();
        ZipInputStream zip = new ZipInputStream(input);
        ZipEntry entry;
        while ((entry = zip.getNextEntry()) != null) {
            if (!entry.isDirectory()) {
                entries.put(entry.getName(), zip.readAllBytes());
            }
        }
        return entries;
    }

    /**
     * Returns the zip entry of the sheet to read, or null when the workbook has no sheet.
     */
    private String selectSheet(DocumentBuilder builder, Map<String, byte[]> entries, String source)
            throws SAXException, IOException {
        Map<String, String> targetsById = new HashMap<>();
        byte[] rels = entries.get("xl/_rels/workbook.xml.rels");
        if (rels != null) {
            NodeList relationships = parse(builder, rels).getElementsByTagNameNS("*", "Relationship");
            for (int i = 0; i < relationships.getLength(); i++) {
                Element relationship = (Element) relationships.item(i);
                targetsById.put(relationship.getAttribute("Id"), relationship.getAttribute("Target"));
            }
        }

        Map<String, String> sheets = new LinkedHashMap<>();
        NodeList sheetElements = parse(builder, entries.get("xl/workbook.xml")).getElementsByTagNameNS("*", "sheet");
        for (int i = 0; i < sheetElements.getLength(); i++) {
            Element sheet = (Element) sheetElements.item(i);
            String target = targetsById.get(sheet.getAttributeNS(REL_NS, "id"));
            if (target != null && !target.isEmpty()) {
                sheets.put(sheet.getAttribute("name"), resolveTarget(target));
            }
        }
        if (sheets.isEmpty()) {
            return null;
        }
        if (preferredSheet != null) {
            for (Map.Entry<String, String> sheet : sheets.entrySet()) {
                if (sheet.getKey().equalsIgnoreCase(preferredSheet)) {
                    log.debug("table.read.sheet source={} sheet={}", source, sheet.getKey());
                    return sheet.getValue();
                }
            }
        }
        Map.Entry<String, String> first = sheets.entrySet().iterator().next();
        log.debug("table.read.sheet source={} sheet={} preferred={}", source, first.getKey(), preferredSheet);
        return first.getValue();
    }

    static String resolveTarget(String target) {
        return target.startsWith("/") ? target.substring(1) : "xl/" + target;
    }

    private static List<String> sharedStrings(DocumentBuilder builder, byte[] xml) throws SAXException, IOException {
        List<String> strings = new ArrayList<>();
        if (xml == null) {
            return strings;
        }
        NodeList items = parse(builder, xml).getElementsByTagNameNS("*", "si");
        for (int i = 0; i < items.getLength(); i++) {
            strings.add(text((Element) items.item(i)));
        }
        return strings;
    }

    private RawTable readSheet(DocumentBuilder builder, byte[] xml, List<String> sharedStrings, StyleTable styles,
                               String source) throws SAXException, IOException {
        List<String> headers = null;
        List<RawTable.Row> rows = new ArrayList<>();
        NodeList rowElements = parse(builder, xml).getElementsByTagNameNS("*", "row");
        for (int i = 0; i < rowElements.getLength(); i++) {
            Element rowElement = (Element) rowElements.item(i);
            List<String> values = rowValues(rowElement, sharedStrings, styles);
            if (values.stream().allMatch(String::isBlank)) {
                continue;
            }
            if (headers == null) {
                headers = new ArrayList<>();
                for (String value : values) {
                    headers.add(value.trim());
                }
                continue;
            }
            String r = rowElement.getAttribute("r");
            long lineNumber = r.isEmpty() ? i + 1 : Long.parseLong(r);
            rows.add(new RawTable.Row(lineNumber, values));
        }
        if (headers == null) {
            log.info("table.read source={} format=xlsx rows=0", source);
            return RawTable.empty(source);
        }
        log.info("table.read source={} format=xlsx columns={} rows={}", source, headers.size(), rows.size());
        return new RawTable(source, headers, rows);
    }

    private static List<String> rowValues(Element row, List<String> sharedStrings, StyleTable styles) {
        List<String> values = new ArrayList<>();
        NodeList cells = row.getElementsByTagNameNS("*", "c");
        for (int j = 0; j < cells.getLength(); j++) {
            Element cell = (Element) cells.item(j);
            String ref = cell.getAttribute("r");
            int column = ref.isEmpty() ? values.size() : columnIndex(ref);
            while (values.size() < column) {
                values.add("");
            }
            values.add(cellValue(cell, sharedStrings, styles));
        }
        return values;
    }

    private static String cellValue(Element cell, List<String> sharedStrings, StyleTable styles) {
        String type = cell.getAttribute("t");
        if ("inlineStr".equals(type)) {
            Element inline = firstChild(cell, "is");
            return inline != null ? text(inline) : "";
        }
        Element v = firstChild(cell, "v");
        String raw = v != null ? v.getTextContent().trim() : "";
        if (raw.isEmpty()) {
            return "";
        }
        return switch (type) {
            case "s" -> sharedString(raw, sharedStrings);
            case "b" -> "1".equals(raw) ? "true" : "false";
            case "e" -> "";
            case "str" -> raw;
            default -> {
                String style = cell.getAttribute("s");
                yield !style.isEmpty() && styles.isDate(Integer.parseInt(style)) ? excelDate(raw) : raw;
            }
        };
    }

    private static String sharedString(String raw, List<String> sharedStrings) {
        int index = Integer.parseInt(raw);
        return index >= 0 && index < sharedStrings.size() ? sharedStrings.get(index) : "";
    }

    /**
     * Converts an Excel date serial number to an ISO date; the time of day is dropped.
     */
    static String excelDate(String serial) {
        double value = Double.parseDouble(serial);
        return EXCEL_EPOCH.plusDays((long) Math.floor(value)).toString();
    }

    /**
     * Converts a cell reference such as {@code AB12} to a zero-based column index.
     */
    static int columnIndex(String cellRef) {
        int index = 0;
        for (int i = 0; i < cellRef.length() && Character.isLetter(cellRef.charAt(i)); i++) {
            index = index * 26 + (Character.toUpperCase(cellRef.charAt(i)) - 'A' + 1);
        }
        return Math.max(0, index - 1);
    }

    /**
     * Concatenates the {@code t} runs of a string item, leaving out phonetic runs.
     */
    private static String text(Element item) {
        StringBuilder sb = new StringBuilder();
        NodeList runs = item.getElementsByTagNameNS("*", "t");
        for (int i = 0; i < runs.getLength(); i++) {
            Node run = runs.item(i);
            Node parent = run.getParentNode();
            if (parent != null && "rPh".equals(parent.getLocalName())) {
                continue;
            }
            sb.append(run.getTextContent());
        }
        return sb.toString();
    }

    private static Element firstChild(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && localName.equals(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    private static Document parse(DocumentBuilder builder, byte[] xml) throws SAXException, IOException {
        return builder.parse(new ByteArrayInputStream(xml));
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    /**
     * Number formats of the cell styles, enough to tell date cells from plain numbers.
     */
    static final class StyleTable {
        private final List<Integer> formatIds;
        private final Map<Integer, String> customFormats;

        private StyleTable(List<Integer> formatIds, Map<Integer, String> customFormats) {
            this.formatIds = formatIds;
            this.customFormats = customFormats;
        }

        static StyleTable parse(DocumentBuilder builder, byte[] xml) throws SAXException, IOException {
            List<Integer> formatIds = new ArrayList<>();
            Map<Integer, String> customFormats = new HashMap<>();
            if (xml == null) {
                return new StyleTable(formatIds, customFormats);
            }
            Document document = XlsxTableReader.parse(builder, xml);
            NodeList numFmts = document.getElementsByTagNameNS("*", "numFmt");
            for (int i = 0; i < numFmts.getLength(); i++) {
                Element numFmt = (Element) numFmts.item(i);
                customFormats.put(Integer.parseInt(numFmt.getAttribute("numFmtId")), numFmt.getAttribute("formatCode"));
            }
            NodeList cellXfs = document.getElementsByTagNameNS("*", "cellXfs");
            if (cellXfs.getLength() > 0) {
                for (Node xf = cellXfs.item(0).getFirstChild(); xf != null; xf = xf.getNextSibling()) {
                    if (xf instanceof Element element && "xf".equals(element.getLocalName())) {
                        String id = element.getAttribute("numFmtId");
                        formatIds.add(id.isEmpty() ? 0 : Integer.parseInt(id));
                    }
                }
            }
            return new StyleTable(formatIds, customFormats);
        }

        boolean isDate(int styleIndex) {
            if (styleIndex < 0 || styleIndex >= formatIds.size()) {
                return false;
            }
            int formatId = formatIds.get(styleIndex);
            String custom = customFormats.get(formatId);
            return custom != null ? isDateFormat(custom) : isBuiltInDateFormat(formatId);
        }

        static boolean isBuiltInDateFormat(int formatId) {
            return (formatId >= 14 && formatId <= 22) || (formatId >= 27 && formatId <= 36)
                    || (formatId >= 45 && formatId <= 47) || (formatId >= 50 && formatId <= 58);
        }

        /**
         * A custom format is a date format when, outside quoted literals and bracketed
         * sections, it contains a day or year token.
         */
        static boolean isDateFormat(String formatCode) {
            String stripped = formatCode.replaceAll("\"[^\"]*\"", "")
                    .replaceAll("\\[[^\\]]*\\]", "")
                    .toLowerCase(Locale.ROOT);
            return stripped.indexOf('d') >= 0 || stripped.indexOf('y') >= 0;
        }
    }
}
